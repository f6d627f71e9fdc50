package com.syncgen.schemagen.pattern;

public record NormalizedField(String column, String source) implements DetectedPattern {
    @Override
    public PatternKind kind() {
        return PatternKind.NORMALIZED_FIELD;
    }

    @Override
    public String describe() {
        return column + " normalizes " + source;
    }
}
