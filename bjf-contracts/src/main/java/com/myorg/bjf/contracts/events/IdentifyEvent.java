package com.myorg.bjf.contracts.events;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class IdentifyEvent extends AnalyticsEvent {

    @lombok.Builder.Default
    private Map<String, Object> traits = new LinkedHashMap<>();

    // null = unknown; false means the user was not active (do not bump last_request_at)
    private Boolean active;

    @Override
    public EventAction action() {
        return EventAction.IDENTIFY;
    }

    @Override
    public String email() {
        return stringValue(traits, "email");
    }
}
