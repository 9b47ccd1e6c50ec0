package com.myorg.bjf.forwarding.lock;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Shared lock entries are plain Redis strings: {@code SET key token NX PX leaseTtl} to lock,
 * compare-and-delete (Lua) to unlock, so a late release never deletes another holder's entry.
 */
public class RedisKeyedLock extends AbstractKeyedLock {

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "local v = redis.call('GET', KEYS[1]); " +
                    "if v == ARGV[1] then return redis.call('DEL', KEYS[1]) end " +
                    "return 0",
            Long.class
    );

    private final StringRedisTemplate redis;

    public RedisKeyedLock(StringRedisTemplate redis, String keyPrefix, Duration leaseTtl, Duration waitTimeout, Duration pollInterval) {
        super(keyPrefix, leaseTtl, waitTimeout, pollInterval);
        this.redis = redis;
    }

    @Override
    protected boolean tryLockShared(String sharedKey, String token, Duration ttl) {
        Boolean ok = redis.opsForValue().setIfAbsent(sharedKey, token, ttl);
        return Boolean.TRUE.equals(ok);
    }

    @Override
    protected void unlockShared(String sharedKey, String token) {
        redis.execute(RELEASE_SCRIPT, List.of(sharedKey), token);
    }
}
