package com.myorg.bjf.forwarding.lock;

import com.myorg.bjf.forwarding.exception.LockUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Two-level lock: a fair, per-key semaphore queues the callers of this process in arrival
 * order, and only the head of that queue competes for the shared entry
 * ({@link #tryLockShared}) against other processes.
 *
 * <p>The shared entry always carries {@code leaseTtl}, so a holder that dies or fails to
 * unlock blocks other processes for at most that long.
 */
@Slf4j
public abstract class AbstractKeyedLock implements KeyedLock {

    private static final class LocalQueue {
        final Semaphore permit = new Semaphore(1, true);
        int users; // guarded by ConcurrentHashMap.compute
    }

    private final ConcurrentHashMap<String, LocalQueue> queues = new ConcurrentHashMap<>();

    private final String namespace;
    protected final Duration leaseTtl;
    private final Duration waitTimeout;
    private final Duration pollInterval;

    protected AbstractKeyedLock(String keyPrefix, Duration leaseTtl, Duration waitTimeout, Duration pollInterval) {
        this.namespace = normalizePrefix(keyPrefix) + "lock:";
        this.leaseTtl = requirePositive(leaseTtl, "leaseTtl");
        this.waitTimeout = requirePositive(waitTimeout, "waitTimeout");
        this.pollInterval = requirePositive(pollInterval, "pollInterval");
    }

    /**
     * Set the shared entry for {@code sharedKey} to {@code token} with expiry {@code ttl}
     * if no live entry exists.
     *
     * @return {@code true} if this token now owns the entry
     */
    protected abstract boolean tryLockShared(String sharedKey, String token, Duration ttl);

    /** Delete the shared entry only if it still holds {@code token}. */
    protected abstract void unlockShared(String sharedKey, String token);

    @Override
    public LockHandle acquire(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("lock key must not be blank");
        }
        String sharedKey = namespace + key;
        long startNanos = System.nanoTime();
        long deadline = startNanos + waitTimeout.toNanos();

        LocalQueue queue = join(sharedKey);
        boolean localHeld = false;
        boolean acquired = false;
        try {
            localHeld = queue.permit.tryAcquire(waitTimeout.toNanos(), TimeUnit.NANOSECONDS);
            if (!localHeld) {
                throw LockUnavailableException.timeout(key, elapsedMs(startNanos));
            }

            String token = UUID.randomUUID().toString();
            while (true) {
                boolean ok;
                try {
                    ok = tryLockShared(sharedKey, token, leaseTtl);
                } catch (RuntimeException e) {
                    throw new LockUnavailableException(key, "Lock store unavailable for " + key, e);
                }
                if (ok) {
                    acquired = true;
                    log.debug("Lock acquired key={} waitedMs={}", key, elapsedMs(startNanos));
                    return new LockHandle(key, token, this);
                }

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw LockUnavailableException.timeout(key, elapsedMs(startNanos));
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(pollInterval.toNanos(), remaining));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockUnavailableException(key, "Interrupted while waiting for lock " + key, e);
        } finally {
            if (!acquired) {
                if (localHeld) queue.permit.release();
                leave(sharedKey);
            }
        }
    }

    @Override
    public void release(LockHandle handle) {
        if (handle == null || !handle.markReleased()) return;

        String sharedKey = namespace + handle.key();
        try {
            unlockShared(sharedKey, handle.token());
            log.debug("Lock released key={}", handle.key());
        } catch (RuntimeException e) {
            // best-effort: the entry expires after leaseTtl
            log.warn("Failed to release lock key={}, it will expire after {}", handle.key(), leaseTtl, e);
        } finally {
            LocalQueue queue = queues.get(sharedKey);
            if (queue != null) queue.permit.release();
            leave(sharedKey);
        }
    }

    private LocalQueue join(String sharedKey) {
        return queues.compute(sharedKey, (k, q) -> {
            LocalQueue cur = q == null ? new LocalQueue() : q;
            cur.users++;
            return cur;
        });
    }

    private void leave(String sharedKey) {
        queues.computeIfPresent(sharedKey, (k, q) -> --q.users <= 0 ? null : q);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    protected static Duration requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return d;
    }

    protected static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return "";
        String p = prefix.trim();
        return p.endsWith(":") ? p : (p + ":");
    }
}
