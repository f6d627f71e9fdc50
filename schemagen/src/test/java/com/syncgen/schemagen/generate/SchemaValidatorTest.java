package com.syncgen.schemagen.generate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private static final String VALID = String.join("\n",
            "import {",
            "  createSchema,",
            "  table,",
            "  string,",
            "  number,",
            "  boolean,",
            "  relationships,",
            "  type Zero,",
            "} from '@rocicorp/zero';",
            "",
            "const jobs = table('jobs')",
            "  .columns({",
            "    id: string(),",
            "  })",
            "  .primaryKey('id');",
            "",
            "const tasks = table('tasks')",
            "  .columns({",
            "    id: string(),",
            "    job_id: string(),",
            "  })",
            "  .primaryKey('id');",
            "",
            "const tasksRelationships = relationships(tasks, ({ one }) => ({",
            "  job: one({",
            "    sourceField: ['job_id'],",
            "    destField: ['id'],",
            "    destSchema: jobs,",
            "  }),",
            "  // SKIPPED: notes - foreign key 'task_id' does not exist in target table 'notes'",
            "}));",
            "",
            "export const schema = createSchema({ tables: [jobs, tasks], relationships: [tasksRelationships] });",
            "",
            "export type ZeroClient = Zero<typeof schema>;",
            "");

    private final SchemaValidator validator = new SchemaValidator();

    @Test
    void acceptsWellFormedSchema() {
        ValidationResult result = validator.validate(VALID);

        assertTrue(result.valid());
        assertTrue(result.warnings().isEmpty());
        assertEquals(Integer.valueOf(2), result.statistics().get("tables"));
        assertEquals(Integer.valueOf(1), result.statistics().get("relationshipMaps"));
        assertEquals(Integer.valueOf(1), result.statistics().get("accessors"));
        assertEquals(Integer.valueOf(1), result.statistics().get("skipped"));
        assertEquals(Integer.valueOf(36), result.statistics().get("lines"));
    }

    @Test
    void missingImportsAndExportsAreErrors() {
        String broken = VALID
                .replace("  boolean,\n", "")
                .replace("export type ZeroClient = Zero<typeof schema>;", "");

        ValidationResult result = validator.validate(broken);

        assertFalse(result.valid());
        assertEquals(List.of("Missing import: boolean", "Missing ZeroClient type export"), result.errors());
    }

    @Test
    void emptyDocumentReportsEverything() {
        ValidationResult result = validator.validate("");

        assertTrue(result.errors().contains("Missing import: createSchema"));
        assertTrue(result.errors().contains("Missing schema export (export const schema)"));
        assertTrue(result.errors().contains("No table definitions found"));
        assertTrue(result.warnings().contains("No relationships defined"));
        assertEquals(Integer.valueOf(0), result.statistics().get("lines"));
    }

    @Test
    void rejectsZodInference() {
        ValidationResult result = validator.validate(VALID + "type Task = inferZodType<typeof tasks>;\n");

        assertEquals(List.of("Unsupported inferZodType usage found"), result.errors());
    }

    @Test
    void deprecatedQueryApisAreWarnings() {
        ValidationResult result = validator.validate(VALID + "// zero.query.jobs.offset(10)\n// row.value\n");

        assertTrue(result.valid());
        assertEquals(List.of("Deprecated query method .offset( found", "Deprecated .value access found"),
                result.warnings());
    }

    @Test
    void validateOrThrowCarriesTheResult() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validateOrThrow("export const schema = 1;"));

        assertTrue(e.errors().contains("Missing import: table"));
        assertFalse(e.result().valid());
        assertTrue(e.getMessage().startsWith("Generated schema failed validation:"));
    }
}
