package com.syncgen.schemagen.model;

import java.util.List;

public record Index(
        String name,
        String table,
        List<String> columns,
        boolean unique,
        String method,
        String predicate
) {
    public Index {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public boolean isPartial() {
        return predicate != null && !predicate.isBlank();
    }
}
