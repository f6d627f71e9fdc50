package com.syncgen.schemagen.introspect;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.function.Predicate;

/**
 * Raw catalog rows for one schema. Saved to JSON by the {@code introspect} command so generation
 * can run offline against it.
 */
public record IntrospectionResult(
        @JsonProperty("tables") List<TableInfo> tables,
        @JsonProperty("columns") List<ColumnInfo> columns,
        @JsonProperty("primaryKeys") List<PrimaryKeyInfo> primaryKeys,
        @JsonProperty("foreignKeys") List<ForeignKeyInfo> foreignKeys,
        @JsonProperty("indexes") List<IndexInfo> indexes,
        @JsonProperty("constraints") List<ConstraintInfo> constraints
) {
    public IntrospectionResult {
        tables = tables == null ? List.of() : List.copyOf(tables);
        columns = columns == null ? List.of() : List.copyOf(columns);
        primaryKeys = primaryKeys == null ? List.of() : List.copyOf(primaryKeys);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }

    /**
     * Copy without the rows belonging to tables matched by {@code excluded}. Foreign keys are
     * dropped with their child table.
     */
    public IntrospectionResult withoutTables(Predicate<String> excluded) {
        return new IntrospectionResult(
                tables.stream().filter(t -> !excluded.test(t.name())).toList(),
                columns.stream().filter(c -> !excluded.test(c.tableName())).toList(),
                primaryKeys.stream().filter(pk -> !excluded.test(pk.tableName())).toList(),
                foreignKeys.stream().filter(fk -> !excluded.test(fk.childTable())).toList(),
                indexes.stream().filter(i -> !excluded.test(i.tableName())).toList(),
                constraints.stream().filter(c -> !excluded.test(c.tableName())).toList());
    }
}
