package com.myorg.bjf.forwarding.gateway;

import com.myorg.bjf.forwarding.BjfForwardingProperties;
import lombok.experimental.UtilityClass;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

@UtilityClass
public class UpstreamCredentials {

    public static boolean hasOauthToken(BjfForwardingProperties.Credentials c) {
        return c != null && StringUtils.hasText(c.getOauthAccessToken());
    }

    public static boolean hasApiKey(BjfForwardingProperties.Credentials c) {
        return c != null && StringUtils.hasText(c.getAppId()) && StringUtils.hasText(c.getApiKey());
    }

    /** Bearer token when configured, otherwise HTTP Basic with appId:apiKey; {@code null} with neither. */
    public static String authorizationHeader(BjfForwardingProperties.Credentials c) {
        if (hasOauthToken(c)) {
            return "Bearer " + c.getOauthAccessToken().trim();
        }
        if (hasApiKey(c)) {
            String raw = c.getAppId() + ":" + c.getApiKey();
            return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
        }
        return null;
    }
}
