package com.myorg.bjf.contracts.core.exception;

public class ForwardingException extends RuntimeException {

    private final ForwardingReason reason;

    public ForwardingException(ForwardingReason reason, String message) {
        this(reason, message, null);
    }

    public ForwardingException(ForwardingReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason == null ? ForwardingReason.UNKNOWN : reason;
    }

    public ForwardingReason getReason() {
        return reason;
    }
}
