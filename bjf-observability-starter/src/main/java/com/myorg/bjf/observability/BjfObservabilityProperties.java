package com.myorg.bjf.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "bjf.observability")
public class BjfObservabilityProperties {
    private boolean enabled = true;
    private boolean metricsEnabled = true;

    // low-cardinality tags only; never tag userKey or jobId
    private boolean tagOperation = true;
    private boolean tagOutcome = true;
}
