package com.myorg.bjf.forwarding.context;

import org.slf4j.MDC;

public final class ForwardingMdc {

    private ForwardingMdc() {}

    public static void put(ForwardingContext c) {
        if (c == null) return;
        if (c.tenant() != null) MDC.put("tenant", c.tenant());
        if (c.userKey() != null) MDC.put("userKey", c.userKey());
        if (c.operation() != null) MDC.put("operation", c.operation());
        if (c.messageId() != null) MDC.put("messageId", c.messageId());
    }

    public static void clear() {
        MDC.remove("tenant");
        MDC.remove("userKey");
        MDC.remove("operation");
        MDC.remove("messageId");
    }
}
