package com.syncgen.schemagen.model;

import java.util.Locale;

/**
 * Category of a column's database default expression.
 */
public enum DefaultKind {
    NONE,
    UUID_FUNCTION,
    TIMESTAMP_FUNCTION,
    FUNCTION,
    LITERAL;

    /** True when the database computes the value itself. */
    public boolean isGenerated() {
        return this == UUID_FUNCTION || this == TIMESTAMP_FUNCTION || this == FUNCTION;
    }

    public static DefaultKind categorize(String defaultValue) {
        if (defaultValue == null || defaultValue.isBlank()) return NONE;
        String value = defaultValue.toLowerCase(Locale.ROOT).trim();
        if (value.contains("gen_random_uuid") || value.contains("uuid_generate")) {
            return UUID_FUNCTION;
        }
        if (value.startsWith("now()") || value.startsWith("current_timestamp")
                || value.startsWith("current_date") || value.startsWith("localtimestamp")) {
            return TIMESTAMP_FUNCTION;
        }
        if (value.contains("(")) {
            return FUNCTION;
        }
        return LITERAL;
    }
}
