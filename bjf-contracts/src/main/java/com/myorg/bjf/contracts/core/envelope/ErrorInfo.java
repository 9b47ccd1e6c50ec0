package com.myorg.bjf.contracts.core.envelope;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned for a failed forward. {@code code} is a {@code ForwardingReason} code;
 * {@code upstreamStatus} and {@code detail} are only set when the upstream answered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorInfo {
    private String code;
    private String message;
    private Integer upstreamStatus;
    // raw upstream response body
    private String detail;
}
