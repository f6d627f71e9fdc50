package com.syncgen.schemagen.model;

import java.util.List;

/**
 * A resolved polymorphic association. {@code targets} drives generation;
 * {@code observedTypes} and {@code observedTables} are informational only.
 */
public record PolymorphicAssociation(
        String table,
        String name,
        String typeColumn,
        String idColumn,
        List<String> targets,
        DiscoverySource source,
        List<StiGroup> stiGroups,
        List<String> observedTypes,
        List<String> observedTables,
        UsageStatistics statistics
) {
    public PolymorphicAssociation {
        targets = targets == null ? List.of() : List.copyOf(targets);
        stiGroups = stiGroups == null ? List.of() : List.copyOf(stiGroups);
        observedTypes = observedTypes == null ? List.of() : List.copyOf(observedTypes);
        observedTables = observedTables == null ? List.of() : List.copyOf(observedTables);
        statistics = statistics == null ? UsageStatistics.empty() : statistics;
    }

    public boolean isResolved() {
        return !targets.isEmpty();
    }
}
