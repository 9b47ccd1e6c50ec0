package com.myorg.bjf.forwarding.lock;

import com.myorg.bjf.forwarding.exception.LockUnavailableException;

/**
 * Exclusive, named, non-reentrant lock backed by shared state.
 *
 * <p>Usage:
 * <pre>
 * try (LockHandle handle = lock.acquire(lockKey)) {
 *     // upstream writes for this key
 * }
 * </pre>
 */
public interface KeyedLock {

    /**
     * Block until no other holder exists for {@code key}, then grant exclusive holdership.
     * Contending callers are served first-come-first-served.
     *
     * @throws LockUnavailableException if the backing store is unreachable, or the wait timed out
     */
    LockHandle acquire(String key) throws LockUnavailableException;

    /**
     * Relinquish holdership. Idempotent and never throws; a failed release is left to the
     * lock's safety TTL.
     */
    void release(LockHandle handle);
}
