package com.syncgen.schemagen.pattern;

public record PolymorphicPair(String name, String typeColumn, String idColumn) implements DetectedPattern {
    @Override
    public PatternKind kind() {
        return PatternKind.POLYMORPHIC;
    }

    @Override
    public String describe() {
        return name + " (" + typeColumn + ", " + idColumn + ")";
    }
}
