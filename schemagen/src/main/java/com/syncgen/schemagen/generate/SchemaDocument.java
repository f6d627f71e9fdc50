package com.syncgen.schemagen.generate;

import java.util.List;

/**
 * Everything the schema template renders: imports, table definitions, relationship maps and
 * the names aggregated into {@code createSchema}.
 */
public record SchemaDocument(
        List<String> imports,
        List<TableDefinition> tables,
        List<RelationshipMap> relationshipMaps
) {
    public SchemaDocument {
        imports = List.copyOf(imports);
        tables = List.copyOf(tables);
        relationshipMaps = List.copyOf(relationshipMaps);
    }

    public List<String> tableNames() {
        return tables.stream().map(TableDefinition::name).toList();
    }

    public List<String> relationshipNames() {
        return relationshipMaps.stream()
                .filter(RelationshipMap::hasAccessors)
                .map(RelationshipMap::variableName)
                .toList();
    }

    /** All accessor keys, as {@code table.accessor}. */
    public List<String> accessorKeys() {
        return relationshipMaps.stream()
                .flatMap(map -> map.entries().stream()
                        .filter(e -> e.accessor() != null)
                        .map(e -> map.table() + "." + e.accessor()))
                .toList();
    }
}
