package com.myorg.bjf.forwarding.mapping;

import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Dates in traits and properties become integer epoch seconds under a key with the
 * {@code _at} suffix, which is how the upstream recognises date attributes.
 */
@UtilityClass
public class TraitFormatter {

    private static final Pattern ISO_DATE = Pattern.compile(
            "^\\d{4}-\\d{2}-\\d{2}([T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}:?\\d{2})?)?$");

    /**
     * Copy of {@code traits} with every date value converted (nested maps included).
     * Non-date values are kept as they are.
     */
    public static Map<String, Object> formatDates(Map<String, ?> traits) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (traits == null) return out;

        traits.forEach((key, val) -> {
            if (key == null) return;
            Long seconds = toEpochSeconds(val);
            if (seconds != null) {
                out.put(dateKey(key), seconds);
            } else if (val instanceof Map<?, ?> nested) {
                out.put(key, formatDates(stringKeyed(nested)));
            } else {
                out.put(key, val);
            }
        });
        return out;
    }

    /**
     * {@code created_at} and {@code "created at"} and {@code createdAt} all become
     * {@code created_at}; any other key gets {@code _at} appended.
     */
    public static String dateKey(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (lower.endsWith("_at")) return key;
        if (lower.endsWith(" at")) return key.substring(0, key.length() - 3) + "_at";
        int n = key.length();
        if (n > 2 && key.endsWith("At") && Character.isLowerCase(key.charAt(n - 3))) {
            return key.substring(0, n - 2) + "_at";
        }
        return key + "_at";
    }

    /** @return epoch seconds if {@code val} is a date or an ISO-8601 date string, else {@code null} */
    public static Long toEpochSeconds(Object val) {
        if (val == null) return null;
        if (val instanceof Date d) return d.getTime() / 1000L;
        if (val instanceof Instant i) return i.getEpochSecond();
        if (val instanceof OffsetDateTime o) return o.toEpochSecond();
        if (val instanceof ZonedDateTime z) return z.toEpochSecond();
        if (val instanceof LocalDateTime l) return l.toEpochSecond(ZoneOffset.UTC);
        if (val instanceof LocalDate ld) return ld.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        if (val instanceof String s) return parseIso(s.trim());
        return null;
    }

    private static Long parseIso(String s) {
        if (!ISO_DATE.matcher(s).matches()) return null;
        try {
            if (s.length() == 10) {
                return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
            }
            String iso = s.replace(' ', 'T');
            // +0000 -> +00:00
            if (iso.matches(".*[+-]\\d{4}$")) {
                iso = iso.substring(0, iso.length() - 2) + ":" + iso.substring(iso.length() - 2);
            }
            if (iso.endsWith("Z") || iso.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(iso).toEpochSecond();
            }
            return LocalDateTime.parse(iso).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Map<String, Object> stringKeyed(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (k != null) out.put(String.valueOf(k), v);
        });
        return out;
    }
}
