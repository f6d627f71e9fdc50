package com.syncgen.schemagen.pattern;

import java.util.List;

public record EnumField(String column, List<String> values) implements DetectedPattern {
    public EnumField {
        values = List.copyOf(values);
    }

    @Override
    public PatternKind kind() {
        return PatternKind.ENUM;
    }

    @Override
    public String describe() {
        return column + " enum [" + String.join(", ", values) + "]";
    }
}
