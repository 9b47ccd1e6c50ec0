package com.myorg.bjf.forwarding;

import org.springframework.util.StringUtils;

/**
 * Lock and job keys for one tenant.
 *
 * <p>identify and track share {@code tenant:userKey} so a profile write is ordered before the
 * user's events; group writes lock {@code tenant:groups:userKey}. Job keys are
 * {@code tenant:jobs:dataType:userKey}. Stores prepend their own prefix.
 */
public class ForwardingKeys {

    static final String DEFAULT_TENANT = "default";

    private final String tenant;

    public ForwardingKeys(String tenant) {
        this.tenant = StringUtils.hasText(tenant) ? tenant.trim() : DEFAULT_TENANT;
    }

    public static ForwardingKeys of(BjfForwardingProperties.Credentials credentials) {
        return new ForwardingKeys(resolveTenant(credentials));
    }

    // appId, then the explicit tenant id (OAuth-only setups), then "default"
    public static String resolveTenant(BjfForwardingProperties.Credentials c) {
        if (c == null) return DEFAULT_TENANT;
        if (StringUtils.hasText(c.getAppId())) return c.getAppId().trim();
        if (StringUtils.hasText(c.getTenantId())) return c.getTenantId().trim();
        return DEFAULT_TENANT;
    }

    public String tenant() {
        return tenant;
    }

    public String lockKey(String userKey) {
        return tenant + ":" + userKey;
    }

    public String groupLockKey(String userKey) {
        return tenant + ":groups:" + userKey;
    }

    public String jobKey(DataType dataType, String userKey) {
        return tenant + ":jobs:" + dataType.code() + ":" + userKey;
    }
}
