package com.myorg.bjf.forwarding.exception;

import com.myorg.bjf.contracts.core.exception.ForwardingException;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;

public class LockUnavailableException extends ForwardingException {

    private final String lockKey;
    private final boolean timedOut;

    public LockUnavailableException(String lockKey, String msg, Throwable cause) {
        super(ForwardingReason.LOCK_UNAVAILABLE, msg, cause);
        this.lockKey = lockKey;
        this.timedOut = false;
    }

    private LockUnavailableException(String lockKey, String msg) {
        super(ForwardingReason.LOCK_UNAVAILABLE, msg);
        this.lockKey = lockKey;
        this.timedOut = true;
    }

    public static LockUnavailableException timeout(String lockKey, long waitedMs) {
        return new LockUnavailableException(lockKey, "Timed out after " + waitedMs + "ms waiting for lock " + lockKey);
    }

    public String getLockKey() {
        return lockKey;
    }

    /** {@code true} when the lock was held by someone else for the whole wait, {@code false} on store errors. */
    public boolean timedOut() {
        return timedOut;
    }
}
