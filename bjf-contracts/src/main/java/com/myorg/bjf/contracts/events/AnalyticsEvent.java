package com.myorg.bjf.contracts.events;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common part of every inbound analytics call.
 *
 * <p>An event is attributed to a user through {@link #getUserId()} or, when that is absent,
 * through the e-mail carried by the event ({@link #email()}).
 */
@Data
@SuperBuilder
@NoArgsConstructor
public abstract class AnalyticsEvent {
    private String messageId;
    private String userId;
    private String anonymousId;
    private Instant timestamp;

    @lombok.Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    public abstract EventAction action();

    /** E-mail of the user this event belongs to, or {@code null}. */
    public abstract String email();

    /** Identity used for locking and job coalescing: userId, else e-mail. */
    public String userKey() {
        if (userId != null && !userId.isBlank()) return userId;
        String email = email();
        return (email == null || email.isBlank()) ? null : email;
    }

    public String ip() {
        return stringValue(context, "ip");
    }

    protected static String stringValue(Map<String, Object> map, String key) {
        if (map == null) return null;
        Object v = map.get(key);
        return v == null ? null : String.valueOf(v);
    }
}
