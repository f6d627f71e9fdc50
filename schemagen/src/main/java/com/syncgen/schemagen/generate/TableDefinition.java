package com.syncgen.schemagen.generate;

import java.util.List;

public record TableDefinition(
        String name,
        String humanName,
        List<ColumnDefinition> columns,
        String primaryKey
) {
    public TableDefinition {
        columns = List.copyOf(columns);
    }
}
