package com.myorg.bjf.forwarding.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.bjf.contracts.events.AnalyticsEvent;
import com.myorg.bjf.contracts.events.GroupEvent;
import com.myorg.bjf.contracts.events.IdentifyEvent;
import com.myorg.bjf.contracts.events.TrackEvent;
import com.myorg.bjf.forwarding.DataType;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure mapping from inbound events to upstream request bodies. No I/O; malformed input falls
 * back to defaults instead of failing.
 */
public class PayloadMapper {

    private static final Set<String> RESERVED_USER_TRAITS = Set.of(
            "email", "name", "firstName", "lastName", "created", "createdAt", "created_at",
            "company", "companies", "lastRequestAt", "last_request_at",
            "unsubscribedFromEmails", "unsubscribed_from_emails");

    private final ObjectMapper mapper;
    private final boolean collectContext;
    private final Clock clock;

    public PayloadMapper(ObjectMapper mapper, boolean collectContext, Clock clock) {
        this.mapper = mapper;
        this.collectContext = collectContext;
        this.clock = clock;
    }

    /** User upsert body ({@code POST /users}, or bulk {@code data} for users). */
    public ObjectNode user(IdentifyEvent identify) {
        Map<String, Object> traits = safe(identify.getTraits());
        ObjectNode out = mapper.createObjectNode();
        putIdentity(out, identify);

        String name = name(traits);
        if (name != null) out.put("name", name);

        Long created = Companies.firstDate(traits, "createdAt", "created_at", "created");
        if (created != null) out.put("remote_created_at", created);

        if (!Boolean.FALSE.equals(identify.getActive())) {
            Long lastRequest = Companies.firstDate(traits, "lastRequestAt", "last_request_at");
            if (lastRequest == null && identify.getTimestamp() != null) {
                lastRequest = identify.getTimestamp().getEpochSecond();
            }
            if (lastRequest != null) out.put("last_request_at", lastRequest);
        }
        if (identify.getActive() != null) out.put("update_last_request_at", identify.getActive());

        if (identify.ip() != null) out.put("last_seen_ip", identify.ip());

        Object unsubscribed = traits.containsKey("unsubscribedFromEmails")
                ? traits.get("unsubscribedFromEmails")
                : traits.get("unsubscribed_from_emails");
        if (unsubscribed instanceof Boolean b) out.put("unsubscribed_from_emails", b);

        Map<String, Object> custom = new LinkedHashMap<>(traits);
        RESERVED_USER_TRAITS.forEach(custom::remove);
        Map<String, Object> formatted = TraitFormatter.formatDates(custom);
        if (collectContext) formatted.putAll(contextAttributes(identify.getContext()));
        out.set("custom_attributes", mapper.valueToTree(formatted));

        List<Map<String, Object>> companies = Companies.fromTraits(traits);
        if (!companies.isEmpty()) out.set("companies", mapper.valueToTree(companies));
        return out;
    }

    /** User upsert attaching the group's company, for bulk user jobs. */
    public ObjectNode groupUser(GroupEvent group) {
        ObjectNode out = mapper.createObjectNode();
        putIdentity(out, group);
        ArrayNode companies = out.putArray("companies");
        companies.add(company(group));
        return out;
    }

    /** Company upsert body ({@code POST /companies}). */
    public ObjectNode company(GroupEvent group) {
        return mapper.valueToTree(Companies.fromGroup(group.getGroupId(), safe(group.getTraits())));
    }

    /** Event body ({@code POST /events}, or bulk {@code data} for events). */
    public ObjectNode event(TrackEvent track) {
        ObjectNode out = mapper.createObjectNode();
        out.put("event_name", track.getEvent() == null ? "" : track.getEvent());
        Instant at = track.getTimestamp() == null ? clock.instant() : track.getTimestamp();
        out.put("created_at", at.getEpochSecond());
        putIdentity(out, track);
        out.set("metadata", mapper.valueToTree(TraitFormatter.formatDates(safe(track.getProperties()))));
        return out;
    }

    /**
     * Single-item bulk body: {@code {"items":[{"method":"post","data_type":...,"data":...}]}}.
     * The {@code job} reference is added by the gateway on append.
     */
    public ObjectNode bulk(DataType dataType, ObjectNode data) {
        ObjectNode out = mapper.createObjectNode();
        ObjectNode item = out.putArray("items").addObject();
        item.put("method", "post");
        item.put("data_type", dataType.itemType());
        item.set("data", data);
        return out;
    }

    private void putIdentity(ObjectNode out, AnalyticsEvent event) {
        if (event.getUserId() != null && !event.getUserId().isBlank()) out.put("user_id", event.getUserId());
        String email = event.email();
        if (email != null && !email.isBlank()) out.put("email", email);
    }

    private static String name(Map<String, Object> traits) {
        Object name = traits.get("name");
        if (name != null) return String.valueOf(name);
        Object first = traits.get("firstName");
        Object last = traits.get("lastName");
        if (first == null && last == null) return null;
        return ((first == null ? "" : first) + " " + (last == null ? "" : last)).trim();
    }

    private static Map<String, Object> contextAttributes(Map<String, Object> context) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (context == null) return out;
        copyNested(context, "device", "type", out, "device_type");
        copyNested(context, "device", "manufacturer", out, "device_manufacturer");
        copyNested(context, "device", "model", out, "device_model");
        copyNested(context, "os", "name", out, "os_name");
        copyNested(context, "os", "version", out, "os_version");
        copyNested(context, "app", "name", out, "app_name");
        copyNested(context, "app", "version", out, "app_version");
        if (context.get("userAgent") != null) out.put("user_agent", String.valueOf(context.get("userAgent")));
        return out;
    }

    private static void copyNested(Map<String, Object> ctx, String section, String field,
                                   Map<String, Object> out, String target) {
        if (ctx.get(section) instanceof Map<?, ?> m && m.get(field) != null) {
            out.put(target, String.valueOf(m.get(field)));
        }
    }

    private static Map<String, Object> safe(Map<String, Object> map) {
        return map == null ? Map.of() : map;
    }
}
