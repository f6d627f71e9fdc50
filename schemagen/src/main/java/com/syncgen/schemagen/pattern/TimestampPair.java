package com.syncgen.schemagen.pattern;

public record TimestampPair(String flagColumn, String timestampColumn) implements DetectedPattern {
    @Override
    public PatternKind kind() {
        return PatternKind.TIMESTAMP_PAIR;
    }

    @Override
    public String describe() {
        return flagColumn + " tracks " + timestampColumn;
    }
}
