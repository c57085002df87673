package io.lunahistory.mcp.server.config;

import java.util.Locale;

public enum Transport {
    STDIO,
    HTTP;

    public static Transport parse(String value) {
        if (value == null || value.isBlank()) {
            return STDIO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown transport '" + value + "', expected stdio or http", e);
        }
    }
}
