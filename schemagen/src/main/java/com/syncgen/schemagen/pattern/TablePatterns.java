package com.syncgen.schemagen.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * All patterns detected on one table.
 * <p>
 * Serialized to canonical JSON for the manifest's pattern hash; derived accessors must not
 * use bean-style names or they become part of the hash.
 */
public record TablePatterns(
        String table,
        SoftDeletion softDeletion,
        Positioning positioning,
        List<NormalizedField> normalizedFields,
        List<TimestampPair> timestampPairs,
        List<EnumField> enums,
        List<PolymorphicPair> polymorphicPairs
) {
    public TablePatterns {
        normalizedFields = normalizedFields == null ? List.of() : List.copyOf(normalizedFields);
        timestampPairs = timestampPairs == null ? List.of() : List.copyOf(timestampPairs);
        enums = enums == null ? List.of() : List.copyOf(enums);
        polymorphicPairs = polymorphicPairs == null ? List.of() : List.copyOf(polymorphicPairs);
    }

    public static TablePatterns none(String table) {
        return new TablePatterns(table, null, null, List.of(), List.of(), List.of(), List.of());
    }

    public Optional<SoftDeletion> softDeletionPattern() {
        return Optional.ofNullable(softDeletion);
    }

    public Optional<Positioning> positioningPattern() {
        return Optional.ofNullable(positioning);
    }

    public Optional<EnumField> enumFor(String column) {
        return enums.stream().filter(e -> e.column().equals(column)).findFirst();
    }

    public List<DetectedPattern> all() {
        List<DetectedPattern> result = new ArrayList<>();
        if (softDeletion != null) result.add(softDeletion);
        if (positioning != null) result.add(positioning);
        result.addAll(normalizedFields);
        result.addAll(timestampPairs);
        result.addAll(enums);
        result.addAll(polymorphicPairs);
        return result;
    }

    public int count() {
        return all().size();
    }

    public long count(PatternKind kind) {
        return all().stream().filter(p -> p.kind() == kind).count();
    }
}
