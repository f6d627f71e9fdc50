package com.syncgen.schemagen.model;

/**
 * Row-level statistics of a polymorphic association. Fields are null when unavailable.
 */
public record UsageStatistics(
        Long totalRecords,
        String firstSeen,
        String lastSeen
) {
    public static UsageStatistics empty() {
        return new UsageStatistics(null, null, null);
    }
}
