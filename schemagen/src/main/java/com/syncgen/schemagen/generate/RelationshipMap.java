package com.syncgen.schemagen.generate;

import java.util.ArrayList;
import java.util.List;

/**
 * The relationship accessors of one table. A map whose entries are all comments renders as
 * comments only and is left out of {@code createSchema}.
 */
public record RelationshipMap(String table, String humanName, List<RelationshipEntry> entries) {
    public RelationshipMap {
        entries = List.copyOf(entries);
    }

    public String variableName() {
        return table + "Relationships";
    }

    public boolean hasAccessors() {
        return entries.stream().anyMatch(e -> e.accessor() != null);
    }

    /** Destructured builder parameters, e.g. {@code one, many}. */
    public String params() {
        List<String> params = new ArrayList<>();
        if (entries.stream().anyMatch(e -> "one".equals(e.cardinality()))) params.add("one");
        if (entries.stream().anyMatch(e -> "many".equals(e.cardinality()))) params.add("many");
        return String.join(", ", params);
    }
}
