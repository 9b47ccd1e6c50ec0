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
public class TrackEvent extends AnalyticsEvent {
    private String event;

    @lombok.Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @Override
    public EventAction action() {
        return EventAction.TRACK;
    }

    @Override
    public String email() {
        String fromProps = stringValue(properties, "email");
        if (fromProps != null) return fromProps;
        // some producers put identified traits under context.traits
        Object traits = getContext() == null ? null : getContext().get("traits");
        if (traits instanceof Map<?, ?> m) {
            Object v = m.get("email");
            return v == null ? null : String.valueOf(v);
        }
        return null;
    }
}
