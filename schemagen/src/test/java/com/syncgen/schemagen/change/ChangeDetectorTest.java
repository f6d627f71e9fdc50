package com.syncgen.schemagen.change;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChangeDetectorTest {

    private static String schema(String tables, String relationships) {
        return "// @generated-begin\n" + tables + "\n" + relationships + "\nexport const schema = createSchema({});\n";
    }

    private static final String JOBS = "const jobs = table('jobs')\n  .columns({ id: string() })\n  .primaryKey('id');\n";
    private static final String TASKS = "const tasks = table('tasks')\n  .columns({ id: string() })\n  .primaryKey('id');\n";
    private static final String USERS = "const users = table('users')\n  .columns({ id: string() })\n  .primaryKey('id');\n";

    private static final String TASK_RELATIONSHIPS = String.join("\n",
            "const tasksRelationships = relationships(tasks, ({ one, many }) => ({",
            "  job: one({",
            "    sourceField: ['job_id'],",
            "    destField: ['id'],",
            "    destSchema: jobs,",
            "  }),",
            "  assignee: one({",
            "    sourceField: ['assignee_id'],",
            "    destField: ['id'],",
            "    destSchema: users,",
            "  }),",
            "}));");

    private final ChangeDetector detector = new ChangeDetector();

    @Test
    void firstRunHasNoChanges() {
        SchemaChanges changes = detector.detect(null, schema(JOBS, ""));

        assertFalse(changes.hasChanges());
        assertTrue(changes.migrationNotes().isEmpty());
    }

    @Test
    void identicalOutputHasNoChanges() {
        String text = schema(JOBS + TASKS + USERS, TASK_RELATIONSHIPS);

        assertFalse(detector.detect(text, text).hasChanges());
    }

    @Test
    void detectsTableAdditionsAndRemovals() {
        SchemaChanges changes = detector.detect(schema(JOBS + USERS, ""), schema(JOBS + TASKS, ""));

        assertEquals(List.of("tasks"), changes.addedTables());
        assertEquals(List.of("users"), changes.removedTables());
        assertEquals(List.of(
                "New table 'tasks' is available to clients",
                "Table 'users' was removed; delete client code that queries it"), changes.migrationNotes());
    }

    @Test
    void detectsRelationshipChanges() {
        String before = schema(JOBS + TASKS + USERS, TASK_RELATIONSHIPS);
        String after = schema(JOBS + TASKS + USERS, TASK_RELATIONSHIPS
                .replace("assignee: one", "owner: one"));

        SchemaChanges changes = detector.detect(before, after);

        assertEquals(List.of("tasks.owner"), changes.addedRelationships());
        assertEquals(List.of("tasks.assignee"), changes.removedRelationships());
        assertEquals(List.of("Relationship 'tasks.assignee' was removed; update queries using .related('assignee')"),
                changes.migrationNotes());
    }

    @Test
    void accessorsAreScopedToTheirMap() {
        Set<String> accessors = ChangeDetector.accessors(TASK_RELATIONSHIPS + "\nconst other = { stray: one({ }) };\n");

        assertEquals(Set.of("tasks.job", "tasks.assignee"), accessors);
        assertEquals(Set.of("jobs", "tasks"), ChangeDetector.tables(JOBS + TASKS));
    }
}
