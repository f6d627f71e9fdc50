package com.syncgen.schemagen.model;

public record ForeignKey(
        String name,
        String column,
        String targetTable,
        String targetColumn,
        String onDelete,
        String onUpdate
) {}
