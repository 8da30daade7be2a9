package com.openforge.rxmate.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only view over the arguments a model supplied for one tool call.
 *
 * Models are loose with types: numbers arrive as strings, booleans as
 * "true"/"false", a single store id where a list was declared. The typed
 * getters coerce these, and fall back to the given default when a value
 * cannot be interpreted.
 */
public final class ToolArguments {

    private static final ToolArguments EMPTY = new ToolArguments(Map.of());

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values;
    }

    public static ToolArguments of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new ToolArguments(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ToolArguments empty() {
        return EMPTY;
    }

    /** The full mapping as supplied, optional fields included. */
    public Map<String, Object> asMap() {
        return values;
    }

    /** True if the key is present with a non-null value. */
    public boolean has(String key) {
        return values.get(key) != null;
    }

    /** Trimmed string value, or null when absent or blank. */
    public String string(String key) {
        Object value = values.get(key);
        if (value == null) return null;
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public int integer(String key, int defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number number) return number.intValue();
        if (value instanceof String text && !text.isBlank()) {
            try {
                return (int) Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /** Integer value, or null when absent or not numeric. */
    public Integer optionalInteger(String key) {
        if (!has(key)) return null;
        int sentinel = Integer.MIN_VALUE;
        int value = integer(key, sentinel);
        return value == sentinel ? null : value;
    }

    /** Tri-state boolean: null when absent or not interpretable. */
    public Boolean bool(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean flag) return flag;
        if (value instanceof Number number) return number.intValue() != 0;
        if (value instanceof String text) {
            return switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "1" -> Boolean.TRUE;
                case "false", "no", "0" -> Boolean.FALSE;
                default -> null;
            };
        }
        return null;
    }

    public boolean bool(String key, boolean defaultValue) {
        Boolean value = bool(key);
        return value == null ? defaultValue : value;
    }

    /** List of non-blank strings; a lone string becomes a one-element list. */
    public List<String> stringList(String key) {
        Object value = values.get(key);
        if (value == null) return List.of();
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !item.toString().isBlank()) result.add(item.toString().trim());
            }
        } else if (!value.toString().isBlank()) {
            result.add(value.toString().trim());
        }
        return List.copyOf(result);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
