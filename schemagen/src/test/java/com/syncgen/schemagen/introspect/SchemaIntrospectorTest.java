package com.syncgen.schemagen.introspect;

import com.syncgen.schemagen.Fixtures;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.model.Column;
import com.syncgen.schemagen.model.ColumnKind;
import com.syncgen.schemagen.model.DefaultKind;
import com.syncgen.schemagen.model.Relationship;
import com.syncgen.schemagen.model.RelationshipKind;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.pattern.SoftDeletion;
import com.syncgen.schemagen.pattern.TablePatterns;
import com.syncgen.schemagen.registry.EntityDescriptor;
import com.syncgen.schemagen.registry.EntityRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaIntrospectorTest {

    private Relationship relationship(Schema schema, String table, String name) {
        return schema.relationshipsFor(table).stream()
                .filter(r -> r.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No relationship " + table + "." + name));
    }

    @Test
    void excludedTablesAreDroppedAndTheRestSorted() {
        Schema schema = Fixtures.schema();

        assertEquals(List.of("activity_logs", "jobs", "notes", "tasks", "users"), schema.tableNames());
        assertFalse(schema.hasTable("schema_migrations"));
    }

    @Test
    void configuredExclusionsApply() {
        GeneratorConfig config = GeneratorConfig.builder().excludeTable("activity_logs").build();

        assertFalse(Fixtures.schema(config).hasTable("activity_logs"));
    }

    @Test
    void columnsCarryKindsDefaultsAndComments() {
        Table tasks = Fixtures.schema().table("tasks").orElseThrow();

        assertEquals("id", tasks.primaryKey());
        assertTrue(tasks.column("id").orElseThrow().primaryKey());
        assertEquals(DefaultKind.UUID_FUNCTION, tasks.column("id").orElseThrow().defaultKind());

        Column title = tasks.column("title").orElseThrow();
        assertEquals(ColumnKind.STRING, title.kind());
        assertFalse(title.nullable());
        assertEquals("Short summary shown in lists", title.comment());

        assertEquals(ColumnKind.UUID, tasks.column("job_id").orElseThrow().kind());
        assertEquals(ColumnKind.BOOLEAN, tasks.column("reminder_time_set").orElseThrow().kind());
        assertEquals(DefaultKind.LITERAL, tasks.column("status").orElseThrow().defaultKind());
    }

    @Test
    void declaredEnumsAttachToColumns() {
        Table tasks = Fixtures.schema().table("tasks").orElseThrow();

        assertEquals(List.of("open", "done"), tasks.column("status").orElseThrow().enumValues());
        assertFalse(tasks.column("title").orElseThrow().isEnum());
    }

    @Test
    void keysIndexesAndConstraintsAreCarried() {
        Schema schema = Fixtures.schema();
        Table tasks = schema.table("tasks").orElseThrow();

        assertEquals(2, tasks.foreignKeys().size());
        assertEquals(List.of("job_id", "position"), tasks.indexes().get(0).columns());
        assertEquals(1, tasks.constraints().size());
        assertEquals(2, schema.indexes().size());
        assertEquals(2, schema.constraints().size());
    }

    @Test
    void integerBackedEnumAborts() {
        EntityDescriptor task = new EntityDescriptor("Task", null, false, List.of(),
                Map.of("status", Map.<String, Object>of("open", 0, "done", 1)), List.of());
        SchemaIntrospector introspector = new SchemaIntrospector(
                new EntityRegistry(List.of(task)), GeneratorConfig.defaults());

        EnumStorageException e = assertThrows(EnumStorageException.class,
                () -> introspector.extractSchema(Fixtures.introspection()));

        assertEquals("tasks", e.table());
        assertEquals("status", e.column());
        assertTrue(e.getMessage().contains("migration"));
    }

    @Test
    void belongsToRelationships() {
        Schema schema = Fixtures.schema();

        Relationship job = relationship(schema, "tasks", "job");
        assertEquals(RelationshipKind.BELONGS_TO, job.kind());
        assertEquals("job_id", job.foreignKey());
        assertEquals("jobs", job.target());

        Relationship parent = relationship(schema, "tasks", "parent");
        assertEquals("parent_id", parent.foreignKey());
        assertTrue(parent.isSelfReferential());
    }

    @Test
    void hasManyRelationships() {
        Schema schema = Fixtures.schema();

        Relationship tasks = relationship(schema, "jobs", "tasks");
        assertEquals(RelationshipKind.HAS_MANY, tasks.kind());
        assertEquals("job_id", tasks.foreignKey());
        assertEquals("tasks", tasks.target());

        Relationship subtasks = relationship(schema, "tasks", "subtasks");
        assertEquals("parent_id", subtasks.foreignKey());
        assertEquals("tasks", subtasks.target());

        Relationship logs = relationship(schema, "tasks", "activity_logs");
        assertEquals("task_id", logs.foreignKey());
        assertEquals("activity_logs", logs.target());
    }

    @Test
    void polymorphicInterfacesUseTheirName() {
        Schema schema = Fixtures.schema();

        Relationship notes = relationship(schema, "jobs", "notes");
        assertEquals("notable_id", notes.foreignKey());
        assertEquals("notable_type", notes.foreignType());

        Relationship notable = relationship(schema, "notes", "notable");
        assertTrue(notable.polymorphic());
        assertNull(notable.target());
        assertEquals("notable_id", notable.foreignKey());
    }

    @Test
    void throughAssociationsKeepTheirJoin() {
        Relationship contributors = relationship(Fixtures.schema(), "jobs", "contributors");

        assertTrue(contributors.isThrough());
        assertEquals("tasks", contributors.through());
        assertEquals("users", contributors.target());
    }

    @Test
    void tablesWithoutEntitiesKeepPatternsButNoRelationships() {
        SchemaIntrospector introspector = new SchemaIntrospector(EntityRegistry.empty(), GeneratorConfig.defaults());

        Schema schema = introspector.extractSchema(Fixtures.introspection());

        assertTrue(schema.relationships().isEmpty());
        assertNotNull(schema.patternsFor("tasks").softDeletion());
        assertEquals(5, introspector.warnings().size());
    }

    @Test
    void patternsAreDetectedPerTable() {
        Schema schema = Fixtures.schema();

        TablePatterns tasks = schema.patternsFor("tasks");
        assertEquals(SoftDeletion.Convention.DISCARD, tasks.softDeletion().convention());
        assertTrue(tasks.softDeletion().discardModule());
        assertEquals(List.of("job_id", "parent_id"), tasks.positioning().scopes());
        assertEquals(1, tasks.timestampPairs().size());

        assertEquals(SoftDeletion.Convention.TIMESTAMP_DELETE, schema.patternsFor("jobs").softDeletion().convention());
        assertEquals(1, schema.patternsFor("users").normalizedFields().size());
        assertEquals(1, schema.patternsFor("notes").polymorphicPairs().size());
    }

    @Test
    void excludedPatternsAreSkipped() {
        GeneratorConfig config = GeneratorConfig.builder()
                .excludePatterns(Map.of("tasks", List.of("positioning")))
                .build();

        assertNull(Fixtures.schema(config).patternsFor("tasks").positioning());
    }
}
