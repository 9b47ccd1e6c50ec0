package com.myorg.bjf.forwarding;

/**
 * Which {@link EventForwarder} implementation is built at startup.
 */
public enum ForwardingMode {
    /** track and group coalesce into upstream bulk jobs. */
    BULK_JOB,
    /** every event is written with its own request. */
    SINGLE_RECORD
}
