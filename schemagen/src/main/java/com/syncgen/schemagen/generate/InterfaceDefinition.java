package com.syncgen.schemagen.generate;

import java.util.List;

public record InterfaceDefinition(String name, String table, List<FieldDefinition> fields) {
    public InterfaceDefinition {
        fields = List.copyOf(fields);
    }
}
