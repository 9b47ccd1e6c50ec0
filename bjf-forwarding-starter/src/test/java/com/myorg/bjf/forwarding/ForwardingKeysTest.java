package com.myorg.bjf.forwarding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ForwardingKeysTest {

    @Test
    void keysFollowTheTenantLayout() {
        ForwardingKeys keys = new ForwardingKeys("tenantA");

        assertThat(keys.lockKey("user42")).isEqualTo("tenantA:user42");
        assertThat(keys.groupLockKey("user42")).isEqualTo("tenantA:groups:user42");
        assertThat(keys.jobKey(DataType.EVENTS, "user42")).isEqualTo("tenantA:jobs:events:user42");
        assertThat(keys.jobKey(DataType.USERS, "user42")).isEqualTo("tenantA:jobs:users:user42");
    }

    @Test
    void tenantPrefersAppIdThenTenantIdThenDefault() {
        BjfForwardingProperties.Credentials c = new BjfForwardingProperties.Credentials();
        assertThat(ForwardingKeys.resolveTenant(c)).isEqualTo("default");

        c.setTenantId("oauth-tenant");
        assertThat(ForwardingKeys.resolveTenant(c)).isEqualTo("oauth-tenant");

        c.setAppId("app1");
        assertThat(ForwardingKeys.resolveTenant(c)).isEqualTo("app1");
        assertThat(ForwardingKeys.of(c).tenant()).isEqualTo("app1");
        assertThat(ForwardingKeys.resolveTenant(null)).isEqualTo("default");
    }
}
