package com.myorg.bjf.forwarding.directory;

import com.myorg.bjf.forwarding.exception.DirectoryReadException;
import com.myorg.bjf.forwarding.exception.DirectoryWriteException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * One Redis string per job key holding the job id; the key's PTTL is the record's expiry.
 */
@RequiredArgsConstructor
public class RedisJobDirectory implements JobDirectory {

    private final StringRedisTemplate redis;
    private final String keyPrefix;
    private final Clock clock;

    public RedisJobDirectory(StringRedisTemplate redis, String keyPrefix) {
        this(redis, keyPrefix, Clock.systemUTC());
    }

    private String key(String jobKey) {
        return normalizePrefix(keyPrefix) + jobKey;
    }

    @Override
    public Optional<JobRecord> lookup(String jobKey) {
        String k = key(jobKey);
        try {
            String jobId = redis.opsForValue().get(k);
            if (jobId == null || jobId.isEmpty()) return Optional.empty();

            // -2: key vanished between GET and PTTL, -1: no expiry (written by someone else)
            Long pttl = redis.getExpire(k, TimeUnit.MILLISECONDS);
            if (pttl == null || pttl == -2L || pttl == 0L) return Optional.empty();
            if (pttl < 0) {
                return Optional.of(new JobRecord(jobId, clock.instant().plus(Duration.ofDays(365))));
            }
            return Optional.of(new JobRecord(jobId, clock.instant().plusMillis(pttl)));
        } catch (DataAccessException e) {
            throw new DirectoryReadException(jobKey, e);
        }
    }

    @Override
    public void record(String jobKey, String jobId, Duration ttl) {
        requirePositive(ttl, "ttl");
        try {
            // plain SET ... PX (no NX): a fresh job must replace a stale id
            redis.opsForValue().set(key(jobKey), jobId, ttl);
        } catch (DataAccessException e) {
            throw new DirectoryWriteException(jobKey, e);
        }
    }

    @Override
    public void clear(String jobKey) {
        try {
            redis.delete(key(jobKey));
        } catch (DataAccessException e) {
            throw new DirectoryWriteException(jobKey, e);
        }
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
