package com.myorg.bjf.forwarding.coordinator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Expiry of a directory record for a freshly opened job: the time left until the upstream
 * closes the job, minus a safety margin. Without a reported closing time the full job window
 * minus the margin is used.
 */
public class JobTtlPolicy {

    private final Duration window;
    private final Duration safetyMargin;
    private final Clock clock;

    public JobTtlPolicy(Duration window, Duration safetyMargin, Clock clock) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("job window must be positive");
        }
        if (safetyMargin == null || safetyMargin.isNegative() || safetyMargin.compareTo(window) >= 0) {
            throw new IllegalArgumentException("safetyMargin must be >= 0 and shorter than the job window");
        }
        this.window = window;
        this.safetyMargin = safetyMargin;
        this.clock = clock;
    }

    /**
     * @param closingAt closing time reported by the upstream, may be {@code null}
     * @return the TTL to record, or empty when the job closes too soon to coalesce into
     */
    public Optional<Duration> ttlFor(Instant closingAt) {
        Duration ttl = closingAt == null
                ? defaultTtl()
                : Duration.between(clock.instant(), closingAt).minus(safetyMargin);
        if (ttl.isZero() || ttl.isNegative()) return Optional.empty();
        return Optional.of(ttl);
    }

    public Duration defaultTtl() {
        return window.minus(safetyMargin);
    }
}
