package com.myorg.bjf.forwarding;

import com.myorg.bjf.contracts.core.exception.ForwardingReason;
import com.myorg.bjf.contracts.events.IdentifyEvent;
import com.myorg.bjf.contracts.events.TrackEvent;
import com.myorg.bjf.forwarding.exception.ConfigurationInvalidException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForwardingValidatorTest {

    @Test
    void apiKeyWithoutAppIdIsInvalid() {
        BjfForwardingProperties.Credentials c = new BjfForwardingProperties.Credentials();
        c.setApiKey("secret");
        ForwardingValidator validator = new ForwardingValidator(c);

        assertThatThrownBy(validator::validateCredentials)
                .isInstanceOf(ConfigurationInvalidException.class)
                .satisfies(e -> assertThat(((ConfigurationInvalidException) e).getReason())
                        .isEqualTo(ForwardingReason.CONFIGURATION_INVALID));
    }

    @Test
    void oauthTokenAloneIsEnough() {
        BjfForwardingProperties.Credentials c = new BjfForwardingProperties.Credentials();
        c.setOauthAccessToken("tok");

        new ForwardingValidator(c).validateCredentials();
    }

    @Test
    void eventNeedsUserIdOrEmail() {
        ForwardingValidator validator = new ForwardingValidator(apiKeyCredentials());

        assertThatThrownBy(() -> validator.validate(TrackEvent.builder().event("Ping").build()))
                .isInstanceOf(ConfigurationInvalidException.class)
                .hasMessageContaining("userId or email");
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(ConfigurationInvalidException.class);
    }

    @Test
    void emailStandsInForAMissingUserId() {
        ForwardingValidator validator = new ForwardingValidator(apiKeyCredentials());

        String fromTraits = validator.validate(IdentifyEvent.builder().traits(Map.of("email", "a@b.io")).build());
        String fromProps = validator.validate(TrackEvent.builder().event("Ping").properties(Map.of("email", "c@d.io")).build());
        String fromUserId = validator.validate(TrackEvent.builder().userId("u1").properties(Map.of("email", "c@d.io")).build());

        assertThat(fromTraits).isEqualTo("a@b.io");
        assertThat(fromProps).isEqualTo("c@d.io");
        assertThat(fromUserId).isEqualTo("u1");
    }

    static BjfForwardingProperties.Credentials apiKeyCredentials() {
        BjfForwardingProperties.Credentials c = new BjfForwardingProperties.Credentials();
        c.setAppId("tenantA");
        c.setApiKey("secret");
        return c;
    }
}
