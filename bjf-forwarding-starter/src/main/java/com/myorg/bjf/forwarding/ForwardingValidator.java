package com.myorg.bjf.forwarding;

import com.myorg.bjf.contracts.events.AnalyticsEvent;
import com.myorg.bjf.forwarding.exception.ConfigurationInvalidException;
import com.myorg.bjf.forwarding.gateway.UpstreamCredentials;

/**
 * Checks run before any lock or upstream call.
 */
public class ForwardingValidator {

    private final BjfForwardingProperties.Credentials credentials;

    public ForwardingValidator(BjfForwardingProperties.Credentials credentials) {
        this.credentials = credentials;
    }

    public void validateCredentials() {
        if (UpstreamCredentials.hasOauthToken(credentials)) return;
        if (UpstreamCredentials.hasApiKey(credentials)) return;
        throw new ConfigurationInvalidException("appId and apiKey are required when no OAuth access token is configured");
    }

    /**
     * @return the event's user key (userId, else e-mail)
     * @throws ConfigurationInvalidException on bad credentials or an event without identity
     */
    public String validate(AnalyticsEvent event) {
        validateCredentials();
        if (event == null) {
            throw new ConfigurationInvalidException("event is required");
        }
        String userKey = event.userKey();
        if (userKey == null || userKey.isBlank()) {
            throw new ConfigurationInvalidException("userId or email is required");
        }
        return userKey;
    }
}
