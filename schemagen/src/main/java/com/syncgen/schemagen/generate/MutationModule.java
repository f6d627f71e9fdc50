package com.syncgen.schemagen.generate;

import com.syncgen.schemagen.pattern.NormalizedField;
import com.syncgen.schemagen.pattern.TimestampPair;

import java.util.List;

/**
 * View model for one table's mutation module and its custom scaffold.
 * <p>
 * {@code softDelete}, {@code positioning} and {@code status} are null when the table lacks the
 * corresponding pattern.
 */
public record MutationModule(
        String table,
        String singular,
        String className,
        String primaryKey,
        String zeroClientImport,
        String schemaImport,
        List<FieldDefinition> recordFields,
        List<FieldDefinition> createFields,
        List<FieldDefinition> updateFields,
        List<RequiredCheck> requiredChecks,
        List<String> uuidFields,
        boolean hasCreatedAt,
        boolean hasUpdatedAt,
        SoftDeleteOps softDelete,
        PositionOps positioning,
        StatusOp status,
        List<NormalizedField> normalizedFields,
        List<TimestampPair> timestampPairs,
        List<EnumTransition> enumTransitions,
        List<ScopeQuery> scopes
) {
    public MutationModule {
        recordFields = List.copyOf(recordFields);
        createFields = List.copyOf(createFields);
        updateFields = List.copyOf(updateFields);
        requiredChecks = List.copyOf(requiredChecks);
        uuidFields = List.copyOf(uuidFields);
        normalizedFields = List.copyOf(normalizedFields);
        timestampPairs = List.copyOf(timestampPairs);
        enumTransitions = List.copyOf(enumTransitions);
        scopes = List.copyOf(scopes);
    }

    public String generatedFileName() {
        return singular + ".generated.ts";
    }

    public String customFileName() {
        return singular + ".custom.ts";
    }

    public boolean hasDerivedFields() {
        return !normalizedFields.isEmpty() || !timestampPairs.isEmpty();
    }

    /** {@code string} columns are checked with {@code trim()}, everything else against null. */
    public record RequiredCheck(String field, String label, boolean text) {}

    public record SoftDeleteOps(String column, String deleteFunction, String restoreFunction) {}

    public record PositionOps(
            String column,
            String scope,
            String moveBefore,
            String moveAfter,
            String moveToTop,
            String moveToBottom
    ) {}

    public record StatusOp(String column, String function, String constant, List<String> values, String valuesLiteral) {}

    public record EnumTransition(String column, String function, List<String> values) {}

    public record ScopeQuery(String name, String column, String operator) {}
}
