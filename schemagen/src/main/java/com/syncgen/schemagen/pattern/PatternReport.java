package com.syncgen.schemagen.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-table summary of detected patterns.
 */
public record PatternReport(@JsonProperty("tables") Map<String, TableSummary> tables) {

    public record TableSummary(
            @JsonProperty("total") int total,
            @JsonProperty("counts") Map<String, Long> counts,
            @JsonProperty("details") List<String> details
    ) {}

    public static PatternReport of(Map<String, TablePatterns> patterns) {
        Map<String, TableSummary> tables = new LinkedHashMap<>();
        patterns.forEach((table, detected) -> {
            if (detected.count() == 0) return;
            Map<String, Long> counts = new LinkedHashMap<>();
            for (PatternKind kind : PatternKind.values()) {
                long count = detected.count(kind);
                if (count > 0) counts.put(kind.configKey(), count);
            }
            List<String> details = new ArrayList<>();
            for (DetectedPattern pattern : detected.all()) {
                details.add(pattern.describe());
            }
            tables.put(table, new TableSummary(detected.count(), counts, details));
        });
        return new PatternReport(tables);
    }

    public int totalPatterns() {
        return tables.values().stream().mapToInt(TableSummary::total).sum();
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        out.append("Pattern report: ").append(totalPatterns()).append(" patterns across ")
                .append(tables.size()).append(" tables\n");
        tables.forEach((table, summary) -> {
            out.append("  ").append(table).append(" (").append(summary.total()).append(")\n");
            for (String detail : summary.details()) {
                out.append("    - ").append(detail).append('\n');
            }
        });
        return out.toString();
    }
}
