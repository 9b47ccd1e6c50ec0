package com.myorg.bjf.forwarding.mapping;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the companies a user belongs to out of identify traits.
 *
 * <p>{@code traits.companies} must be a list of objects; anything else (a string, a number) is
 * treated as "no companies" so the rest of the profile still gets written.
 */
@UtilityClass
public class Companies {

    private static final Set<String> RESERVED = Set.of(
            "id", "company_id", "name", "remove", "plan", "monthly_spend", "monthlySpend",
            "created", "createdAt", "created_at");

    public static List<Map<String, Object>> fromTraits(Map<String, Object> traits) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (traits == null) return out;

        Object list = traits.get("companies");
        if (list instanceof List<?> items) {
            for (Object item : items) {
                if (item instanceof Map<?, ?> m) {
                    Map<String, Object> c = toCompany(TraitFormatter.stringKeyed(m));
                    if (c != null) out.add(c);
                }
            }
        }

        Object single = traits.get("company");
        if (single instanceof Map<?, ?> m) {
            Map<String, Object> c = toCompany(TraitFormatter.stringKeyed(m));
            if (c != null) out.add(c);
        } else if (single instanceof String name && !name.isBlank()) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("company_id", companyId(null, name));
            c.put("custom_attributes", Map.of());
            c.put("name", name);
            out.add(c);
        }
        return out;
    }

    /**
     * Upstream company object for {@code groupId} described by group traits.
     */
    public static Map<String, Object> fromGroup(String groupId, Map<String, Object> traits) {
        Map<String, Object> t = traits == null ? Map.of() : traits;
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("company_id", groupId);
        putCommon(c, t);
        return c;
    }

    // null when neither an id nor a name can identify the company
    static Map<String, Object> toCompany(Map<String, Object> raw) {
        Object id = raw.containsKey("id") ? raw.get("id") : raw.get("company_id");
        Object name = raw.get("name");
        String nameText = name == null ? null : String.valueOf(name);
        if (isBlank(id) && isBlank(nameText)) return null;

        Map<String, Object> c = new LinkedHashMap<>();
        c.put("company_id", companyId(id, nameText));
        putCommon(c, raw);
        if (Boolean.TRUE.equals(raw.get("remove")) || "true".equals(String.valueOf(raw.get("remove")))) {
            c.put("remove", true);
        }
        return c;
    }

    private static void putCommon(Map<String, Object> c, Map<String, Object> raw) {
        if (raw.get("name") != null) c.put("name", String.valueOf(raw.get("name")));

        Long created = firstDate(raw, "createdAt", "created_at", "created");
        if (created != null) c.put("remote_created_at", created);
        if (raw.get("plan") != null) c.put("plan", raw.get("plan"));

        Object spend = raw.containsKey("monthlySpend") ? raw.get("monthlySpend") : raw.get("monthly_spend");
        if (spend instanceof Number) c.put("monthly_spend", spend);

        Map<String, Object> custom = new LinkedHashMap<>(raw);
        RESERVED.forEach(custom::remove);
        custom.remove("email");
        c.put("custom_attributes", TraitFormatter.formatDates(custom));
    }

    // null when neither the id nor the name is usable
    static String companyId(Object id, String name) {
        if (!isBlank(id)) return String.valueOf(id);
        if (isBlank(name)) return null;
        return String.valueOf(stableHash(name));
    }

    private static boolean isBlank(Object v) {
        return v == null || String.valueOf(v).isBlank();
    }

    // djb2 string hash; null hashes like ""
    static long stableHash(String s) {
        long hash = 5381;
        if (s == null) return hash;
        for (int i = 0; i < s.length(); i++) {
            hash = ((hash << 5) + hash + s.charAt(i)) & 0xffffffffL;
        }
        return hash;
    }

    static Long firstDate(Map<String, Object> raw, String... keys) {
        for (String k : keys) {
            Object v = raw.get(k);
            if (v == null) continue;
            Long s = TraitFormatter.toEpochSeconds(v);
            if (s != null) return s;
            if (v instanceof Number n) return n.longValue();
        }
        return null;
    }
}
