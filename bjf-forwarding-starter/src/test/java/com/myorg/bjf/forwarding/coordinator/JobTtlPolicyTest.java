package com.myorg.bjf.forwarding.coordinator;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTtlPolicyTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final JobTtlPolicy policy = new JobTtlPolicy(
            Duration.ofMinutes(15), Duration.ofSeconds(15), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void ttlIsTimeUntilClosingMinusTheMargin() {
        assertThat(policy.ttlFor(NOW.plusMillis(900_000))).contains(Duration.ofSeconds(885));
    }

    @Test
    void missingClosingTimeFallsBackToTheWindow() {
        assertThat(policy.ttlFor(null)).contains(Duration.ofSeconds(885));
        assertThat(policy.defaultTtl()).isEqualTo(Duration.ofSeconds(885));
    }

    @Test
    void closingWithinTheMarginYieldsNoTtl() {
        assertThat(policy.ttlFor(NOW.plusSeconds(15))).isEmpty();
        assertThat(policy.ttlFor(NOW.plusSeconds(3))).isEmpty();
        assertThat(policy.ttlFor(NOW.minusSeconds(60))).isEmpty();
    }

    @Test
    void rejectsAMarginThatSwallowsTheWindow() {
        Clock clock = Clock.systemUTC();
        assertThatThrownBy(() -> new JobTtlPolicy(Duration.ofSeconds(10), Duration.ofSeconds(10), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobTtlPolicy(Duration.ZERO, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobTtlPolicy(Duration.ofMinutes(1), Duration.ofSeconds(-1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
