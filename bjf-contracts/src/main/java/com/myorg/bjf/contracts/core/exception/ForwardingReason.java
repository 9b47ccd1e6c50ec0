package com.myorg.bjf.contracts.core.exception;

// Reason codes attached to every forwarding failure (logs, metrics tags, HTTP error bodies).
public enum ForwardingReason {
    CONFIGURATION_INVALID("CONFIGURATION_INVALID"),
    LOCK_UNAVAILABLE("LOCK_UNAVAILABLE"),
    DIRECTORY_READ_FAILURE("DIRECTORY_READ_FAILURE"),
    DIRECTORY_WRITE_FAILURE("DIRECTORY_WRITE_FAILURE"),
    UPSTREAM_APPEND_FAILURE("UPSTREAM_APPEND_FAILURE"),
    UPSTREAM_CREATE_FAILURE("UPSTREAM_CREATE_FAILURE"),
    UPSTREAM_REQUEST_FAILURE("UPSTREAM_REQUEST_FAILURE"),
    UNKNOWN("UNKNOWN");

    private final String code;

    ForwardingReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
