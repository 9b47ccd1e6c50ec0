package com.myorg.bjf.forwarding;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@NoArgsConstructor
@AllArgsConstructor
@ConfigurationProperties(prefix = "bjf.forwarding")
public class BjfForwardingProperties {
    // base URL of the upstream API
    private String endpoint = "https://api-segment.intercom.io";
    private String userAgent = "bjf-forwarder/1.0.0";

    // BULK_JOB: track/group coalesce into bulk jobs; SINGLE_RECORD: one request per event
    private ForwardingMode mode = ForwardingMode.BULK_JOB;

    private Credentials credentials = new Credentials();

    // copy selected context fields (device, os, app...) into custom_attributes on identify
    private boolean collectContext = false;

    //auto: Redis if a RedisConnectionFactory exists, otherwise memory
    //redis: Redis is mandatory (fail startup without it)
    //memory: process-local lock + directory (single instance only)
    private String store = "auto";
    private String keyPrefix = "bjf:";
    private Redis redis = new Redis();
    //if true: store=auto without Redis fails startup
    private boolean requireRedis = false;

    private Lock lock = new Lock();
    private Job job = new Job();
    private Directory directory = new Directory();
    private Http http = new Http();
    private Executor executor = new Executor();

    @Data
    public static class Credentials {
        private String appId;
        private String apiKey;
        // takes precedence over appId/apiKey when present
        private String oauthAccessToken;
        // tenant used in lock/job keys when only an OAuth token is configured
        private String tenantId;
    }

    @Data
    public static class Redis {
        private boolean enabled = true;
        // overrides the top-level keyPrefix for Redis keys when set
        private String keyPrefix;
    }

    @Data
    public static class Lock {
        /**
         * Safety TTL of a shared lock entry. A holder that crashes or fails to unlock
         * stops blocking others after this long. Must exceed the slowest upstream call.
         */
        private Duration leaseTtl = Duration.ofSeconds(30);
        // how long a caller waits for a contended lock before LockUnavailable
        private Duration waitTimeout = Duration.ofSeconds(10);
        // poll interval while another instance holds the shared lock
        private Duration pollInterval = Duration.ofMillis(25);
    }

    @Data
    public static class Job {
        // how long the upstream keeps a bulk job open
        private Duration window = Duration.ofMinutes(15);
        // directory entries expire this much before the upstream closes the job
        private Duration safetyMargin = Duration.ofSeconds(15);
    }

    @Data
    public static class Directory {
        // in-memory store only
        private int maxEntries = 100_000;
        private Duration cleanupInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Executor {
        private int threads = 8;
    }
}
