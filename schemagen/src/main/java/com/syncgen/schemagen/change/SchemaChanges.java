package com.syncgen.schemagen.change;

import java.util.List;

/**
 * Tables and relationship accessors ({@code table.accessor}) added or removed between two
 * versions of the generated schema.
 */
public record SchemaChanges(
        List<String> addedTables,
        List<String> removedTables,
        List<String> addedRelationships,
        List<String> removedRelationships,
        List<String> migrationNotes
) {
    public SchemaChanges {
        addedTables = List.copyOf(addedTables);
        removedTables = List.copyOf(removedTables);
        addedRelationships = List.copyOf(addedRelationships);
        removedRelationships = List.copyOf(removedRelationships);
        migrationNotes = List.copyOf(migrationNotes);
    }

    public static SchemaChanges none() {
        return new SchemaChanges(List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasChanges() {
        return !addedTables.isEmpty() || !removedTables.isEmpty()
                || !addedRelationships.isEmpty() || !removedRelationships.isEmpty();
    }
}
