package com.myorg.bjf.forwarding;

import com.myorg.bjf.forwarding.directory.JobRecord;
import com.myorg.bjf.forwarding.directory.RedisJobDirectory;
import com.myorg.bjf.forwarding.exception.LockUnavailableException;
import com.myorg.bjf.forwarding.lock.LockHandle;
import com.myorg.bjf.forwarding.lock.RedisKeyedLock;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lock and directory against a real Redis. Two lock instances stand in for two processes.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisStoresTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory cf;
    private static StringRedisTemplate redis;

    @BeforeAll
    static void connect() {
        cf = new LettuceConnectionFactory(REDIS.getHost(), REDIS.getMappedPort(6379));
        cf.afterPropertiesSet();
        cf.start();
        redis = new StringRedisTemplate(cf);
    }

    @AfterAll
    static void disconnect() {
        if (cf != null) cf.destroy();
    }

    @BeforeEach
    void flush() {
        redis.execute(connection -> {
            connection.serverCommands().flushAll();
            return null;
        }, true);
    }

    @Test
    void twoInstancesNeverHoldTheSameKeyTogether() throws Exception {
        RedisKeyedLock a = newLock(Duration.ofSeconds(5));
        RedisKeyedLock b = newLock(Duration.ofSeconds(5));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                RedisKeyedLock lock = i % 2 == 0 ? a : b;
                futures.add(pool.submit(() -> {
                    try (LockHandle ignored = lock.acquire("acme:u1")) {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.sleep(5);
                        inside.decrementAndGet();
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(redis.hasKey("bjf:lock:acme:u1")).isFalse();
    }

    @Test
    void lockEntryCarriesTheLeaseTtl() {
        RedisKeyedLock lock = newLock(Duration.ofSeconds(5));
        try (LockHandle ignored = lock.acquire("acme:u1")) {
            Long pttl = redis.getExpire("bjf:lock:acme:u1", TimeUnit.MILLISECONDS);
            assertThat(pttl).isBetween(1L, 30_000L);
        }
    }

    @Test
    void otherInstanceTimesOutWhileTheKeyIsHeld() {
        RedisKeyedLock a = newLock(Duration.ofSeconds(5));
        RedisKeyedLock b = newLock(Duration.ofMillis(150));

        try (LockHandle ignored = a.acquire("acme:u1")) {
            assertThatThrownBy(() -> b.acquire("acme:u1"))
                    .isInstanceOf(LockUnavailableException.class);
        }
        try (LockHandle h = b.acquire("acme:u1")) {
            assertThat(h.isReleased()).isFalse();
        }
    }

    @Test
    void lateReleaseDoesNotDeleteANewHoldersEntry() {
        RedisKeyedLock lock = newLock(Duration.ofSeconds(5));
        LockHandle h = lock.acquire("acme:u1");
        // simulate expiry and takeover by someone else
        redis.opsForValue().set("bjf:lock:acme:u1", "someone-else", Duration.ofSeconds(30));

        h.close();

        assertThat(redis.opsForValue().get("bjf:lock:acme:u1")).isEqualTo("someone-else");
    }

    @Test
    void directoryRecordsOverwritesAndExpires() throws Exception {
        RedisJobDirectory directory = new RedisJobDirectory(redis, "bjf");

        assertThat(directory.lookup("acme:jobs:events:u1")).isEmpty();

        directory.record("acme:jobs:events:u1", "J1", Duration.ofMinutes(10));
        directory.record("acme:jobs:events:u1", "J2", Duration.ofMillis(300));
        assertThat(directory.lookup("acme:jobs:events:u1")).map(JobRecord::jobId).contains("J2");
        assertThat(redis.opsForValue().get("bjf:acme:jobs:events:u1")).isEqualTo("J2");

        Thread.sleep(500);
        assertThat(directory.lookup("acme:jobs:events:u1")).isEmpty();
    }

    @Test
    void directoryClearRemovesTheKey() {
        RedisJobDirectory directory = new RedisJobDirectory(redis, "bjf:");
        directory.record("acme:jobs:users:u1", "J1", Duration.ofMinutes(10));

        directory.clear("acme:jobs:users:u1");

        assertThat(directory.lookup("acme:jobs:users:u1")).isEmpty();
    }

    private static RedisKeyedLock newLock(Duration waitTimeout) {
        return new RedisKeyedLock(redis, "bjf", Duration.ofSeconds(30), waitTimeout, Duration.ofMillis(10));
    }
}
