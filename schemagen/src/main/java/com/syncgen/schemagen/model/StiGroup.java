package com.syncgen.schemagen.model;

import java.util.List;

/**
 * Single-table-inheritance grouping: subclasses stored in their base class's table.
 */
public record StiGroup(
        String baseClass,
        String table,
        List<String> subclasses
) {
    public StiGroup {
        subclasses = subclasses == null ? List.of() : List.copyOf(subclasses);
    }
}
