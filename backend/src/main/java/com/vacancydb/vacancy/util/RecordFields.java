package com.vacancydb.vacancy.util;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for reading the loosely typed maps delivered by the upstream vacancy feed.
 */
public final class RecordFields {

    private RecordFields() {
    }

    public static boolean hasKeys(Map<String, ?> record, String... keys) {
        if (record == null) {
            return false;
        }
        for (String key : keys) {
            if (!record.containsKey(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the value under {@code key} when it is itself a map, otherwise an empty map.
     */
    public static Map<String, Object> nested(Map<String, ?> record, String key) {
        Map<String, Object> nested = asRecord(record == null ? null : record.get(key));
        return nested == null ? Map.of() : nested;
    }

    /**
     * Copies a map with arbitrary keys into a record keyed by strings; {@code null} for
     * anything that is not a map.
     */
    public static Map<String, Object> asRecord(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> record = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            record.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return record;
    }

    /**
     * The feed sends ids as strings; numeric strings become integers, anything else is
     * returned unchanged so the database decides whether it is acceptable. Numbers are only
     * narrowed when they fit an {@code int} exactly.
     */
    public static Object toIntegerIfNumeric(Object value) {
        if (value instanceof Integer) {
            return value;
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                return value;
            }
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            try {
                return Integer.parseInt(trimmed);
            } catch (NumberFormatException ignored) {
                return value;
            }
        }
        return value;
    }

    public static Object intOrDefault(Object value, int fallback) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            return fallback;
        }
        return toIntegerIfNumeric(value);
    }

    public static String stringOrDefault(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String text = value.toString();
        return text.isEmpty() ? fallback : text;
    }

    public static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
