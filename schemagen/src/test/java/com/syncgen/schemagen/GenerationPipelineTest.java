package com.syncgen.schemagen;

import com.syncgen.schemagen.config.ConfigurationException;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.introspect.EnumStorageException;
import com.syncgen.schemagen.registry.EntityDescriptor;
import com.syncgen.schemagen.registry.EntityRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class GenerationPipelineTest {

    private static GeneratorConfig.Builder config(Path outputDir) {
        return GeneratorConfig.builder().outputDirectory(outputDir.toString());
    }

    private static GenerationReport run(GeneratorConfig config) throws Exception {
        return new GenerationPipeline(config, Fixtures.registry()).run(Fixtures.introspection(), null);
    }

    private static long fileCount(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.count();
        }
    }

    @Test
    void firstRunWritesEverything(@TempDir Path outputDir) throws Exception {
        GenerationReport report = run(config(outputDir).build());

        assertEquals(List.of("activity_logs", "jobs", "notes", "tasks", "users"), report.tablesGenerated());
        assertTrue(report.tablesSkipped().isEmpty());
        assertEquals(13, report.writtenFiles().size());
        assertFalse(report.changes().hasChanges());
        assertTrue(report.validation().valid());

        assertTrue(Files.exists(outputDir.resolve("generated-schema.ts")));
        assertTrue(Files.exists(outputDir.resolve("generated-types.ts")));
        assertTrue(Files.exists(outputDir.resolve("polymorphic-discovery.yml")));
        assertTrue(Files.exists(outputDir.resolve(".generation-manifest.json")));
        assertTrue(Files.exists(outputDir.resolve("mutations/task.generated.ts")));
        assertTrue(Files.exists(outputDir.resolve("mutations/task.custom.ts")));
        assertTrue(Files.exists(outputDir.resolve("mutations/activity_log.generated.ts")));

        String types = Files.readString(outputDir.resolve("generated-types.ts"));
        assertTrue(types.contains("export interface Task {"));
        assertTrue(types.contains("export type TableNames = 'activity_logs' | 'jobs' | 'notes' | 'tasks' | 'users';"));

        String discovery = Files.readString(outputDir.resolve("polymorphic-discovery.yml"));
        assertTrue(discovery.contains("activity_logs.loggable:"));
        assertTrue(report.warnings().stream().anyMatch(w -> w.startsWith("Using fallback targets for activity_logs.loggable")));
        assertTrue(report.render().contains("generated 5 mutation modules, skipped 0"));
    }

    @Test
    void secondRunIsIdempotent(@TempDir Path outputDir) throws Exception {
        GeneratorConfig config = config(outputDir).build();
        run(config);
        String schema = Files.readString(outputDir.resolve("generated-schema.ts"));
        String module = Files.readString(outputDir.resolve("mutations/task.generated.ts"));
        String manifest = Files.readString(outputDir.resolve(".generation-manifest.json"));

        GenerationReport second = run(config);

        assertTrue(second.tablesGenerated().isEmpty());
        assertEquals(List.of("activity_logs", "jobs", "notes", "tasks", "users"), second.tablesSkipped());
        assertFalse(second.changes().hasChanges());
        assertTrue(second.customizations().isEmpty());
        assertTrue(second.handEditedFiles().isEmpty());
        assertEquals(schema, Files.readString(outputDir.resolve("generated-schema.ts")));
        assertEquals(module, Files.readString(outputDir.resolve("mutations/task.generated.ts")));
        assertEquals(manifest, Files.readString(outputDir.resolve(".generation-manifest.json")));
    }

    @Test
    void forceRegeneratesButKeepsCustomFiles(@TempDir Path outputDir) throws Exception {
        run(config(outputDir).build());
        Path custom = outputDir.resolve("mutations/task.custom.ts");
        Files.writeString(custom, "export * from './task.generated';\nexport const archived = true;\n");

        GenerationReport report = run(config(outputDir).forceGeneration(true).build());

        assertEquals(5, report.tablesGenerated().size());
        assertEquals("export * from './task.generated';\nexport const archived = true;\n", Files.readString(custom));
        assertFalse(report.writtenFiles().contains(custom));
    }

    @Test
    void foreignFilesAreNotOverwritten(@TempDir Path outputDir) throws Exception {
        Path module = outputDir.resolve("mutations/task.generated.ts");
        Files.createDirectories(module.getParent());
        Files.writeString(module, "export const mine = 1;\n");

        GenerationReport report = run(config(outputDir).build());

        assertEquals("export const mine = 1;\n", Files.readString(module));
        assertTrue(report.tablesSkipped().contains("tasks"));
        assertFalse(report.tablesGenerated().contains("tasks"));
        assertTrue(report.warnings().stream().anyMatch(w -> w.contains("was not generated by this tool")));
    }

    @Test
    void handEditsAreReported(@TempDir Path outputDir) throws Exception {
        GeneratorConfig config = config(outputDir).build();
        run(config);
        Path schema = outputDir.resolve("generated-schema.ts");
        Files.writeString(schema, Files.readString(schema)
                .replace("// @generated-begin\n", "// @generated-begin\n// keep tasks first\n"));

        GenerationReport report = run(config);

        assertEquals(List.of(schema), report.handEditedFiles());
        assertEquals(List.of("Custom comment: // keep tasks first"), report.customizations().get(schema));
        assertFalse(Files.readString(schema).contains("keep tasks first"));
    }

    @Test
    void narrowedScaffoldDeclarationWinsOnNextRun(@TempDir Path outputDir) throws Exception {
        GeneratorConfig config = config(outputDir).build();
        run(config);
        Path custom = outputDir.resolve("mutations/note.custom.ts");
        String scaffold = Files.readString(custom);
        assertTrue(scaffold.contains("      allowedTypes: ['job', 'task']"));
        assertTrue(Files.readString(outputDir.resolve("mutations/activity_log.custom.ts"))
                .contains("      allowedTypes: ['job', 'task', 'user']"));

        Files.writeString(custom, scaffold.replace("allowedTypes: ['job', 'task']", "allowedTypes: ['task']"));
        GenerationReport second = run(config);

        String schema = Files.readString(outputDir.resolve("generated-schema.ts"));
        assertTrue(schema.contains("  notableTask: one({"));
        assertFalse(schema.contains("notableJob"));
        assertEquals(List.of("notes.notableJob"), second.changes().removedRelationships());
        assertTrue(Files.readString(outputDir.resolve("polymorphic-discovery.yml")).contains("source: DECLARED"));
        // untouched seed keeps resolving through the fallback table
        assertTrue(second.warnings().stream().anyMatch(w -> w.startsWith("Using fallback targets for activity_logs.loggable")));
    }

    @Test
    void dryRunWritesNothing(@TempDir Path outputDir) throws Exception {
        GenerationReport report = run(config(outputDir).dryRun(true).build());

        assertTrue(report.dryRun());
        assertEquals(13, report.writtenFiles().size());
        assertEquals(0, fileCount(outputDir));
        assertTrue(report.render().startsWith("Dry run: "));
    }

    @Test
    void mutationsCanBeDisabled(@TempDir Path outputDir) throws Exception {
        GenerationReport report = run(config(outputDir).generateMutations(false).build());

        assertTrue(report.tablesGenerated().isEmpty());
        assertEquals(3, report.writtenFiles().size());
        assertFalse(Files.exists(outputDir.resolve("mutations")));
    }

    @Test
    void removedTablesProduceMigrationNotes(@TempDir Path outputDir) throws Exception {
        run(config(outputDir).build());

        GenerationReport report = run(config(outputDir).excludeTable("users").build());

        assertEquals(List.of("users"), report.changes().removedTables());
        assertTrue(report.changes().removedRelationships().containsAll(
                List.of("activity_logs.loggableUser", "notes.user", "users.notes")));
        assertTrue(report.changes().migrationNotes()
                .contains("Table 'users' was removed; delete client code that queries it"));
        assertFalse(Files.readString(outputDir.resolve("generated-schema.ts")).contains("table('users')"));
    }

    @Test
    void integerEnumAbortsBeforeWriting(@TempDir Path outputDir) throws Exception {
        EntityDescriptor task = new EntityDescriptor("Task", null, false, List.of(),
                Map.of("status", Map.<String, Object>of("open", 0, "done", 1)), List.of());
        GenerationPipeline pipeline = new GenerationPipeline(config(outputDir).build(),
                new EntityRegistry(List.of(task)));

        assertThrows(EnumStorageException.class, () -> pipeline.run(Fixtures.introspection(), null));
        assertEquals(0, fileCount(outputDir));
    }

    @Test
    void invalidConfigurationAbortsBeforeWriting(@TempDir Path outputDir) throws Exception {
        Path file = Files.writeString(outputDir.resolve("occupied"), "x");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> run(config(file).build()));

        assertTrue(e.errors().get(0).contains("not a directory"));
        assertEquals(1, fileCount(outputDir));
    }
}
