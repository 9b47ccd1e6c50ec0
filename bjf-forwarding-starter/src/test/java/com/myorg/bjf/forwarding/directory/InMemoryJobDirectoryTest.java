package com.myorg.bjf.forwarding.directory;

import com.myorg.bjf.forwarding.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobDirectoryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final InMemoryJobDirectory directory = new InMemoryJobDirectory("bjf", 1000, Duration.ofMinutes(1), clock);

    @AfterEach
    void tearDown() {
        directory.close();
    }

    @Test
    void recordIsVisibleUntilItExpires() {
        directory.record("acme:jobs:events:u1", "J1", Duration.ofSeconds(885));

        JobRecord rec = directory.lookup("acme:jobs:events:u1").orElseThrow();
        assertThat(rec.jobId()).isEqualTo("J1");
        assertThat(rec.expiresAt()).isEqualTo(clock.instant().plusSeconds(885));

        clock.advance(Duration.ofSeconds(885));
        assertThat(directory.lookup("acme:jobs:events:u1")).isEmpty();
        assertThat(directory.size()).isZero();
    }

    @Test
    void recordOverwritesALiveEntry() {
        directory.record("acme:jobs:events:u1", "J1", Duration.ofMinutes(10));
        directory.record("acme:jobs:events:u1", "J2", Duration.ofMinutes(5));

        JobRecord rec = directory.lookup("acme:jobs:events:u1").orElseThrow();
        assertThat(rec.jobId()).isEqualTo("J2");
        assertThat(rec.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
    }

    @Test
    void dataTypesAndUsersAreSeparateEntries() {
        directory.record("acme:jobs:events:u1", "E1", Duration.ofMinutes(10));
        directory.record("acme:jobs:users:u1", "U1", Duration.ofMinutes(10));

        assertThat(directory.lookup("acme:jobs:events:u1")).map(JobRecord::jobId).contains("E1");
        assertThat(directory.lookup("acme:jobs:users:u1")).map(JobRecord::jobId).contains("U1");
        assertThat(directory.lookup("acme:jobs:events:u2")).isEmpty();
    }

    @Test
    void clearRemovesTheEntry() {
        directory.record("acme:jobs:events:u1", "J1", Duration.ofMinutes(10));
        directory.clear("acme:jobs:events:u1");
        directory.clear("acme:jobs:events:missing");

        assertThat(directory.lookup("acme:jobs:events:u1")).isEmpty();
    }

    @Test
    void nonPositiveTtlIsRejected() {
        assertThatThrownBy(() -> directory.record("k", "J1", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> directory.record("k", "J1", Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cleanupDropsOnlyExpiredEntries() {
        directory.record("a", "J1", Duration.ofSeconds(10));
        directory.record("b", "J2", Duration.ofMinutes(10));
        clock.advance(Duration.ofSeconds(11));

        directory.cleanupExpired();

        assertThat(directory.size()).isEqualTo(1);
        assertThat(directory.lookup("b")).isPresent();
    }
}
