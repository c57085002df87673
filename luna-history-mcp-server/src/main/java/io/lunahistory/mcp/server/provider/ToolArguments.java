package io.lunahistory.mcp.server.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the loosely typed argument map of a tool call.
 * Every accessor throws {@link IllegalArgumentException} for a missing required value or a value
 * of the wrong shape.
 */
public final class ToolArguments {
    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public String requiredString(String name) {
        Object raw = values.get(name);
        if (raw == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return String.valueOf(raw);
    }

    public String optionalString(String name) {
        Object raw = values.get(name);
        return raw == null ? null : String.valueOf(raw);
    }

    public long requiredLong(String name) {
        Object raw = values.get(name);
        if (raw == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return toLong(name, raw);
    }

    public Integer optionalInt(String name) {
        Object raw = values.get(name);
        if (raw == null) {
            return null;
        }
        long value = toLong(name, raw);
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }

    /**
     * Reads a keyword list. A plain string is accepted too and split on whitespace, which is how
     * older clients send a single search phrase.
     */
    public List<String> keywords(String name) {
        Object raw = values.get(name);
        if (raw == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (raw instanceof String text) {
            return text.isBlank() ? List.of() : List.of(text.trim().split("\\s+"));
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException(name + " must be a list of strings");
        }
        List<String> keywords = new ArrayList<>();
        for (Object item : list) {
            if (item != null) {
                keywords.add(String.valueOf(item));
            }
        }
        return keywords;
    }

    private long toLong(String name, Object raw) {
        if (raw instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble)) {
                throw new IllegalArgumentException(name + " must be an integer");
            }
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }
}
