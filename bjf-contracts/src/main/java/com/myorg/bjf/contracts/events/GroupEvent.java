package com.myorg.bjf.contracts.events;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Associates a user with a company ({@code groupId}); the traits describe the company.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GroupEvent extends AnalyticsEvent {
    private String groupId;

    @lombok.Builder.Default
    private Map<String, Object> traits = new LinkedHashMap<>();

    @Override
    public EventAction action() {
        return EventAction.GROUP;
    }

    @Override
    public String email() {
        return stringValue(traits, "email");
    }
}
