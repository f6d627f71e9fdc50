package com.syncgen.schemagen.model;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public record Table(
        String name,
        List<Column> columns,
        String primaryKey,
        List<ForeignKey> foreignKeys,
        List<Index> indexes,
        List<Constraint> constraints
) {
    public Table {
        columns = columns == null ? List.of() : List.copyOf(columns);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);

        Set<String> seen = new HashSet<>();
        for (Column column : columns) {
            if (!seen.add(column.name())) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + column.name() + "' in table '" + name + "'");
            }
        }
    }

    public Optional<Column> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    public boolean hasColumn(String columnName) {
        return column(columnName).isPresent();
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    public Table withColumns(List<Column> replacement) {
        return new Table(name, replacement, primaryKey, foreignKeys, indexes, constraints);
    }
}
