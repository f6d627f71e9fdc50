package com.syncgen.schemagen;

import com.syncgen.schemagen.change.SchemaChanges;
import com.syncgen.schemagen.generate.ValidationResult;
import com.syncgen.schemagen.pattern.PatternReport;
import com.syncgen.schemagen.polymorphic.DiscoveryDocument;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one generation run did. {@code customizations} is keyed by output path.
 */
public record GenerationReport(
        List<String> tablesGenerated,
        List<String> tablesSkipped,
        List<Path> writtenFiles,
        List<String> warnings,
        SchemaChanges changes,
        Map<Path, List<String>> customizations,
        List<Path> handEditedFiles,
        ValidationResult validation,
        PatternReport patterns,
        DiscoveryDocument discovery,
        boolean dryRun
) {
    public GenerationReport {
        tablesGenerated = List.copyOf(tablesGenerated);
        tablesSkipped = List.copyOf(tablesSkipped);
        writtenFiles = List.copyOf(writtenFiles);
        warnings = List.copyOf(warnings);
        customizations = Collections.unmodifiableMap(new LinkedHashMap<>(customizations));
        handEditedFiles = List.copyOf(handEditedFiles);
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        out.append(dryRun ? "Dry run: " : "").append("generated ").append(tablesGenerated.size())
                .append(" mutation modules, skipped ").append(tablesSkipped.size()).append('\n');
        for (Path file : writtenFiles) {
            out.append("  ").append(dryRun ? "would write " : "wrote ").append(file).append('\n');
        }
        out.append("Validation: ").append(validation.statistics()).append('\n');
        if (changes.hasChanges()) {
            out.append("Schema changes:\n");
            changes.addedTables().forEach(t -> out.append("  + table ").append(t).append('\n'));
            changes.removedTables().forEach(t -> out.append("  - table ").append(t).append('\n'));
            changes.addedRelationships().forEach(r -> out.append("  + relationship ").append(r).append('\n'));
            changes.removedRelationships().forEach(r -> out.append("  - relationship ").append(r).append('\n'));
            changes.migrationNotes().forEach(n -> out.append("  note: ").append(n).append('\n'));
        }
        customizations.forEach((path, findings) -> {
            out.append("Customizations in ").append(path).append(":\n");
            findings.forEach(f -> out.append("  ").append(f).append('\n'));
        });
        handEditedFiles.forEach(f -> out.append("Hand-edited since last run: ").append(f).append('\n'));
        if (!warnings.isEmpty()) {
            out.append("Warnings:\n");
            warnings.forEach(w -> out.append("  ").append(w).append('\n'));
        }
        return out.toString();
    }
}
