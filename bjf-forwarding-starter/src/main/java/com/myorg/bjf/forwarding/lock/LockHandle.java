package com.myorg.bjf.forwarding.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof of holdership for one key. Closing the handle releases the lock; closing it again is a no-op.
 */
public final class LockHandle implements AutoCloseable {

    private final String key;
    private final String token;
    private final KeyedLock owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockHandle(String key, String token, KeyedLock owner) {
        this.key = key;
        this.token = token;
        this.owner = owner;
    }

    public String key() {
        return key;
    }

    public String token() {
        return token;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** @return {@code true} for the first caller only. */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        owner.release(this);
    }

    @Override
    public String toString() {
        return "LockHandle{key=" + key + ", released=" + released.get() + "}";
    }
}
