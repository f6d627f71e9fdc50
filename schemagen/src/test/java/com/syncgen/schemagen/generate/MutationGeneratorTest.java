package com.syncgen.schemagen.generate;

import com.syncgen.schemagen.Fixtures;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.model.DiscoverySource;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.pattern.EnumField;
import com.syncgen.schemagen.pattern.TablePatterns;
import com.syncgen.schemagen.polymorphic.PolymorphicDeclaration;
import com.syncgen.schemagen.polymorphic.PolymorphicDeclarationCollector;
import com.syncgen.schemagen.types.TypeMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MutationGeneratorTest {

    private Schema schema;
    private HandlebarsEngine engine;

    @BeforeEach
    void setUp() {
        schema = Fixtures.schema();
        engine = new HandlebarsEngine();
    }

    private MutationGenerator generator(GeneratorConfig config) {
        return new MutationGenerator(engine, TypeMapper.from(config), config);
    }

    private MutationGenerator generator(Path outputDir) {
        return generator(GeneratorConfig.builder().outputDirectory(outputDir.toString()).build());
    }

    private Table table(String name) {
        return schema.table(name).orElseThrow();
    }

    @Test
    void tasksModuleModel(@TempDir Path outputDir) {
        MutationModule module = generator(outputDir).module(table("tasks"), schema.patternsFor("tasks"));

        assertEquals("task", module.singular());
        assertEquals("Task", module.className());
        assertEquals("task.generated.ts", module.generatedFileName());
        assertEquals("task.custom.ts", module.customFileName());
        assertEquals("../zero-client", module.zeroClientImport());
        assertEquals("../generated-schema", module.schemaImport());

        assertEquals(List.of("title", "status", "position", "job_id", "parent_id", "reminder_time_set", "reminder_at"),
                module.createFields().stream().map(FieldDefinition::name).toList());
        assertEquals(List.of(
                        new MutationModule.RequiredCheck("title", "Title", true),
                        new MutationModule.RequiredCheck("job_id", "Job", true)),
                module.requiredChecks());
        assertEquals(List.of("job_id", "parent_id"), module.uuidFields());

        assertEquals(new MutationModule.SoftDeleteOps("discarded_at", "discardTask", "undiscardTask"),
                module.softDelete());
        assertEquals("job_id", module.positioning().scope());
        assertEquals("moveToBottomTask", module.positioning().moveToBottom());
        assertEquals("TASK_STATUS_VALUES", module.status().constant());
        assertEquals(List.of("kept", "discarded"), module.scopes().stream().map(MutationModule.ScopeQuery::name).toList());
        assertTrue(module.hasDerivedFields());
    }

    @Test
    void rendersTasksModule(@TempDir Path outputDir) throws Exception {
        GeneratedArtifact artifact = generator(outputDir).generate(table("tasks"), schema.patternsFor("tasks"));
        String text = artifact.text();

        assertEquals(outputDir.resolve("mutations").resolve("task.generated.ts"), artifact.path());
        assertEquals(ArtifactKind.MUTATIONS, artifact.kind());
        assertTrue(MutationGenerator.isGeneratedByUs(text));
        assertTrue(text.contains("import { getZero } from '../zero-client';"));
        assertTrue(text.contains("import type { ZeroClient } from '../generated-schema';"));
        assertTrue(text.contains("export interface CreateTaskData {"));
        assertTrue(text.contains("  status?: 'open' | 'done';"));
        assertTrue(text.contains("  position?: number | null;"));
        assertTrue(text.contains("  if (!data.title?.trim()) {"));
        assertTrue(text.contains("    throw new Error('Title is required');"));
        assertTrue(text.contains("  if (data.parent_id != null && !isValidUuid(data.parent_id)) {"));
        assertTrue(text.contains("    result.reminder_time_set = data.reminder_at !== null;"));
        assertTrue(text.contains("export async function createTask(data: CreateTaskData)"));
        assertTrue(text.contains("export async function upsertTask("));
        assertTrue(text.contains("export async function discardTask(id: string)"));
        assertTrue(text.contains("export async function undiscardTask(id: string)"));
        assertTrue(text.contains("export async function moveBeforeTask(id: string, targetId: string)"));
        assertTrue(text.contains("export async function moveToTopTask(id: string)"));
        assertTrue(text.contains("query.where('job_id', 'IS', null)"));
        assertTrue(text.contains("export const TASK_STATUS_VALUES = ['open', 'done'] as const;"));
        assertTrue(text.contains("export async function updateTaskStatus(id: string, status: 'open' | 'done')"));
        assertTrue(text.contains("  kept() {"));
        assertTrue(text.contains("(zero.query.tasks as any).where('discarded_at', 'IS NOT', null)"));
        assertFalse(text.contains("normalizeValue"));
    }

    @Test
    void customNamingRenamesOperations(@TempDir Path outputDir) throws Exception {
        GeneratorConfig config = GeneratorConfig.builder()
                .outputDirectory(outputDir.toString())
                .customNaming(Map.of("softDelete", "archive", "restore", "unarchive"))
                .build();

        String text = generator(config).generate(table("jobs"), schema.patternsFor("jobs")).text();

        assertTrue(text.contains("export async function archiveJob(id: string)"));
        assertTrue(text.contains("export async function unarchiveJob(id: string)"));
        assertFalse(text.contains("softDeleteJob"));
        assertTrue(text.contains("deleted_at: now,"));
        assertTrue(text.contains("export const JOB_STATUS_VALUES = ['open', 'closed'] as const;"));
        assertTrue(text.contains("  active() {"));
        assertFalse(text.contains("moveBeforeJob"));
    }

    @Test
    void defaultSoftDeleteNames(@TempDir Path outputDir) {
        MutationModule module = generator(outputDir).module(table("jobs"), schema.patternsFor("jobs"));

        assertEquals("softDeleteJob", module.softDelete().deleteFunction());
        assertEquals("restoreJob", module.softDelete().restoreFunction());
        assertNull(module.positioning());
    }

    @Test
    void normalizedFieldsAreDerived(@TempDir Path outputDir) throws Exception {
        String text = generator(outputDir).generate(table("users"), schema.patternsFor("users")).text();

        assertTrue(text.contains("function normalizeValue(value: string | null | undefined): string | null {"));
        assertTrue(text.contains("    result.email_normalized = normalizeValue(data.email as string | null);"));
        assertTrue(text.contains("  email_normalized?: string | null;"));
        assertFalse(text.contains("STATUS_VALUES"));
        assertFalse(text.contains("discardUser"));
    }

    @Test
    void scaffoldReexportsGeneratedModule(@TempDir Path outputDir) throws Exception {
        GeneratedArtifact scaffold = generator(outputDir).scaffold(table("tasks"), schema.patternsFor("tasks"), List.of());
        String text = scaffold.text();

        assertEquals(outputDir.resolve("mutations").resolve("task.custom.ts"), scaffold.path());
        assertEquals(ArtifactKind.CUSTOM_SCAFFOLD, scaffold.kind());
        assertTrue(text.contains("export * from './task.generated';"));
        assertTrue(text.contains("// export async function transitionTaskStatus(id: string, next: 'open' | 'done'): Promise<void> {"));
        assertFalse(MutationGenerator.isGeneratedByUs(text));
        assertFalse(text.contains("declarePolymorphicRelationships"));
    }

    @Test
    void scaffoldDeclaresResolvedPolymorphicTargets(@TempDir Path outputDir) throws Exception {
        PolymorphicAssociation notable = new PolymorphicAssociation("notes", "notable", "notable_type", "notable_id",
                List.of("jobs", "activity_logs"), DiscoverySource.INFERRED, null, null, null, null);
        PolymorphicAssociation unresolved = new PolymorphicAssociation("notes", "subject", "subject_type",
                "subject_id", List.of(), DiscoverySource.UNRESOLVED, null, null, null, null);

        String text = generator(outputDir).scaffold(table("notes"), schema.patternsFor("notes"),
                List.of(notable, unresolved)).text();

        assertTrue(text.contains("import { declarePolymorphicRelationships } from '../polymorphic';"));
        assertTrue(text.contains("  tableName: 'notes',"));
        assertTrue(text.contains("      allowedTypes: ['job', 'activitylog']"));
        assertFalse(text.contains("subject:"));

        List<PolymorphicDeclaration> declarations =
                new PolymorphicDeclarationCollector().collectFromText(text, "note.custom.ts");
        assertEquals(1, declarations.size());
        assertEquals("notable_type", declarations.get(0).typeField());
        assertEquals(List.of("job", "activitylog"), declarations.get(0).allowedTypes());
    }

    @Test
    void statusValuesAreEscaped(@TempDir Path outputDir) {
        TablePatterns patterns = new TablePatterns("tasks", null, null, List.of(), List.of(),
                List.of(new EnumField("status", List.of("it's", "back\\slash"))), List.of());

        MutationModule module = generator(outputDir).module(table("tasks"), patterns);

        assertEquals("'it\\'s', 'back\\\\slash'", module.status().valuesLiteral());
    }

    @Test
    void recognizesOwnHeader() {
        assertTrue(MutationGenerator.isGeneratedByUs("// @generated-begin\n// AUTO-GENERATED SYNC MUTATIONS for tasks\n"));
        assertFalse(MutationGenerator.isGeneratedByUs("export function createTask() {}\n"));
    }
}
