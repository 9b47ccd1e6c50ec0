package com.myorg.bjf.forwarding.lock;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

// Lock entries live in this JVM only: fine for dev or a single instance, no cross-instance exclusion.
public class InMemoryKeyedLock extends AbstractKeyedLock {

    private record Lease(String token, long expireAtMs) {}

    private final ConcurrentHashMap<String, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyedLock(String keyPrefix, Duration leaseTtl, Duration waitTimeout, Duration pollInterval) {
        this(keyPrefix, leaseTtl, waitTimeout, pollInterval, Clock.systemUTC());
    }

    public InMemoryKeyedLock(String keyPrefix, Duration leaseTtl, Duration waitTimeout, Duration pollInterval, Clock clock) {
        super(keyPrefix, leaseTtl, waitTimeout, pollInterval);
        this.clock = clock;
    }

    @Override
    protected boolean tryLockShared(String sharedKey, String token, Duration ttl) {
        long now = clock.millis();
        Lease after = leases.compute(sharedKey, (k, cur) -> {
            if (cur == null || now >= cur.expireAtMs()) {
                return new Lease(token, now + ttl.toMillis());
            }
            return cur;
        });
        return token.equals(after.token());
    }

    @Override
    protected void unlockShared(String sharedKey, String token) {
        leases.computeIfPresent(sharedKey, (k, cur) -> Objects.equals(cur.token(), token) ? null : cur);
    }

    int size() {
        return leases.size();
    }
}
