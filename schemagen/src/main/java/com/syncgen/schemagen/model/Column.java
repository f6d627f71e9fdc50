package com.syncgen.schemagen.model;

import java.util.List;
import java.util.Locale;

/**
 * A column as seen by the generators. Enum columns carry their ordered string value set;
 * non-enum columns carry an empty list.
 */
public record Column(
        String name,
        ColumnKind kind,
        String sqlType,
        boolean nullable,
        String defaultValue,
        DefaultKind defaultKind,
        String comment,
        boolean primaryKey,
        List<String> enumValues
) {
    public Column {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name is required");
        }
        kind = kind == null ? ColumnKind.UNKNOWN : kind;
        defaultKind = defaultKind == null ? DefaultKind.categorize(defaultValue) : defaultKind;
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    public static Column of(String name, ColumnKind kind, boolean nullable) {
        return new Column(name, kind, kind.name().toLowerCase(Locale.ROOT), nullable, null, DefaultKind.NONE, null, false, List.of());
    }

    public boolean isEnum() {
        return !enumValues.isEmpty();
    }

    public boolean hasDefault() {
        return defaultKind != DefaultKind.NONE;
    }

    public Column withEnumValues(List<String> values) {
        return new Column(name, kind, sqlType, nullable, defaultValue, defaultKind, comment, primaryKey, values);
    }

    public Column asPrimaryKey() {
        return new Column(name, kind, sqlType, nullable, defaultValue, defaultKind, comment, true, enumValues);
    }
}
