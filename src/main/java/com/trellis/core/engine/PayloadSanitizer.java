package com.trellis.core.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scrubs data before it is written to a checkpoint: credentials are removed from
 * arguments and long strings in results are truncated.
 */
public final class PayloadSanitizer {

    public static final Set<String> SENSITIVE_KEYS = Set.of("password", "apiKey", "secret", "token");
    public static final int MAX_STRING_LENGTH = 1000;
    public static final String TRUNCATION_MARKER = "... [truncated]";

    private PayloadSanitizer() {}

    /**
     * Copies {@code args} without sensitive keys, at any nesting depth.
     */
    public static Map<String, Object> sanitizeArgs(Map<String, Object> args) {
        if (args == null) {
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> cleaned = (Map<String, Object>) stripSensitive(args);
        return cleaned;
    }

    /**
     * Copies {@code result}, truncating string values longer than {@link #MAX_STRING_LENGTH}.
     */
    public static Object sanitizeResult(Object result) {
        if (result instanceof String s) {
            return truncate(s);
        }
        if (result instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), sanitizeResult(v)));
            return copy;
        }
        if (result instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(sanitizeResult(v)));
            return copy;
        }
        return result;
    }

    static String truncate(String value) {
        if (value.length() <= MAX_STRING_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_STRING_LENGTH) + TRUNCATION_MARKER;
    }

    private static Object stripSensitive(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                String key = String.valueOf(k);
                if (!SENSITIVE_KEYS.contains(key)) {
                    copy.put(key, stripSensitive(v));
                }
            });
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(stripSensitive(v)));
            return copy;
        }
        return value;
    }
}
