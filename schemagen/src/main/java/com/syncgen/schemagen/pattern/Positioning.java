package com.syncgen.schemagen.pattern;

import java.util.List;

/**
 * Ordered-list positioning. {@code scopes} are the candidate columns the order is relative to.
 */
public record Positioning(
        String column,
        List<String> scopes,
        List<String> operations
) implements DetectedPattern {
    public static final List<String> OPERATIONS = List.of("moveBefore", "moveAfter", "moveToTop", "moveToBottom");

    public Positioning {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        operations = operations == null ? OPERATIONS : List.copyOf(operations);
    }

    @Override
    public PatternKind kind() {
        return PatternKind.POSITIONING;
    }

    @Override
    public String describe() {
        return scopes.isEmpty()
                ? "positioning on " + column
                : "positioning on " + column + " scoped by " + String.join(", ", scopes);
    }
}
