package com.syncgen.schemagen.generate;

import java.util.regex.Pattern;

/**
 * One column builder line. {@code key} is the column name, quoted when it is not a valid
 * identifier.
 */
public record ColumnDefinition(String key, String expression, String comment) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    public static ColumnDefinition of(String columnName, String expression, String comment) {
        String key = IDENTIFIER.matcher(columnName).matches() ? columnName : "'" + columnName + "'";
        String flat = comment == null || comment.isBlank() ? null : comment.strip().replaceAll("\\s+", " ");
        return new ColumnDefinition(key, expression, flat);
    }
}
