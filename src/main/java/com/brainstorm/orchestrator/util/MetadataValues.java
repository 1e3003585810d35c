package com.brainstorm.orchestrator.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Lenient coercion of loosely typed metadata values (parsed model JSON or
 * values put by other capabilities).
 */
public final class MetadataValues {

    private MetadataValues() {
    }

    public static boolean asBoolean(Object value, boolean fallback) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return fallback;
    }

    public static double asDouble(Object value, double fallback) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    public static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        return new ArrayList<>();
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> asMapList(Object value) {
        List<Map<String, Object>> maps = new ArrayList<>();
        for (Object entry : asList(value)) {
            if (entry instanceof Map<?, ?> map) {
                maps.add((Map<String, Object>) map);
            }
        }
        return maps;
    }

    /**
     * Strings are kept, maps contribute the first present value among the
     * given keys, blanks are dropped.
     */
    public static List<String> asStringList(Object value, String... mapKeys) {
        List<String> strings = new ArrayList<>();
        for (Object entry : asList(value)) {
            String text = null;
            if (entry instanceof Map<?, ?> map) {
                for (String key : mapKeys) {
                    Object candidate = map.get(key);
                    if (candidate != null) {
                        text = candidate.toString();
                        break;
                    }
                }
            } else if (entry != null) {
                text = entry.toString();
            }
            if (text != null && !text.isBlank()) {
                strings.add(text.trim());
            }
        }
        return strings;
    }
}
