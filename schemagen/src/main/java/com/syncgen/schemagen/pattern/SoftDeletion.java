package com.syncgen.schemagen.pattern;

import java.util.Locale;

public record SoftDeletion(
        String column,
        Convention convention,
        boolean discardModule
) implements DetectedPattern {

    public enum Convention {
        /** {@code discarded_at} with discard/undiscard operations. */
        DISCARD,
        /** Legacy {@code deleted_at} with soft-delete/restore operations. */
        TIMESTAMP_DELETE
    }

    @Override
    public PatternKind kind() {
        return PatternKind.SOFT_DELETION;
    }

    @Override
    public String describe() {
        return "soft deletion via " + column + " (" + convention.name().toLowerCase(Locale.ROOT) + ")";
    }
}
