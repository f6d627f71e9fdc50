package com.syncgen.schemagen.model;

public record Constraint(
        String table,
        String name,
        Type type,
        String definition
) {
    public enum Type {
        CHECK,
        UNIQUE
    }
}
