package com.myorg.bjf.forwarding.directory;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

// Records live in RAM (ConcurrentHashMap) for dev or single-instance apps.
// A daemon cleaner removes expired records so the map does not grow without bound.
@Slf4j
public class InMemoryJobDirectory implements JobDirectory, AutoCloseable {

    private final ConcurrentHashMap<String, JobRecord> records = new ConcurrentHashMap<>();

    private final int maxEntries;
    private final Clock clock;
    private final ScheduledExecutorService cleaner;
    private final String keyPrefix; // normalized, may be ""

    public InMemoryJobDirectory(String keyPrefix, int maxEntries, Duration cleanupInterval) {
        this(keyPrefix, maxEntries, cleanupInterval, Clock.systemUTC());
    }

    public InMemoryJobDirectory(String keyPrefix, int maxEntries, Duration cleanupInterval, Clock clock) {
        this.maxEntries = Math.max(1000, maxEntries);
        this.keyPrefix = normalizePrefix(keyPrefix);
        this.clock = clock;

        this.cleaner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bjf-job-directory-cleaner");
            t.setDaemon(true);
            return t;
        });

        long periodMs = Math.max(1_000L, cleanupInterval.toMillis());
        cleaner.scheduleAtFixedRate(this::cleanupExpiredSafe, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private String key(String jobKey) {
        return keyPrefix + jobKey;
    }

    @Override
    public Optional<JobRecord> lookup(String jobKey) {
        String k = key(jobKey);
        JobRecord r = records.get(k);
        if (r == null) return Optional.empty();

        if (r.isExpired(clock.instant())) {
            records.remove(k, r);
            return Optional.empty();
        }
        return Optional.of(r);
    }

    @Override
    public void record(String jobKey, String jobId, Duration ttl) {
        requirePositive(ttl, "ttl");
        Instant expiresAt = clock.instant().plus(ttl);
        records.put(key(jobKey), new JobRecord(jobId, expiresAt));

        if (records.size() > maxEntries) {
            cleanupExpired();
            trimToMaxEntries();
        }
    }

    @Override
    public void clear(String jobKey) {
        records.remove(key(jobKey));
    }

    int size() {
        return records.size();
    }

    private void cleanupExpiredSafe() {
        try {
            cleanupExpired();
        } catch (Exception e) {
            log.warn("Job directory cleanup failed", e);
        }
    }

    void cleanupExpired() {
        Instant now = clock.instant();
        Iterator<Map.Entry<String, JobRecord>> it = records.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
            }
        }
    }

    // dropping a record only costs a redundant job later
    private void trimToMaxEntries() {
        int over = records.size() - maxEntries;
        if (over <= 0) return;

        Iterator<String> it = records.keySet().iterator();
        int removed = 0;
        while (it.hasNext() && removed < over) {
            it.next();
            it.remove();
            removed++;
        }
    }

    @Override
    public void close() {
        cleaner.shutdownNow();
    }

    private static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
