package com.myorg.bjf.forwarding.context;

/**
 * Identity of one forwarded event, for log correlation.
 */
public record ForwardingContext(
        String tenant,
        String userKey,
        String operation,
        String messageId
) {}
