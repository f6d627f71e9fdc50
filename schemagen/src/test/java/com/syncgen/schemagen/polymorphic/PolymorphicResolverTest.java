package com.syncgen.schemagen.polymorphic;

import com.syncgen.schemagen.Fixtures;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.introspect.SchemaIntrospector;
import com.syncgen.schemagen.model.DiscoverySource;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.StiGroup;
import com.syncgen.schemagen.model.UsageStatistics;
import com.syncgen.schemagen.registry.AssociationDescriptor;
import com.syncgen.schemagen.registry.EntityDescriptor;
import com.syncgen.schemagen.registry.EntityRegistry;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PolymorphicResolverTest {

    private final EntityRegistry registry = Fixtures.registry();
    private final Schema schema = Fixtures.schema();

    private static ObservedDataSource observing(String... types) {
        return new ObservedDataSource() {
            @Override
            public List<String> distinctTypes(String table, String typeColumn) {
                return List.of(types);
            }

            @Override
            public UsageStatistics statistics(String table, String typeColumn, String timestampColumn) {
                return new UsageStatistics(3L, "2024-01-01 09:00:00", "2024-03-01 17:30:00");
            }
        };
    }

    private static PolymorphicDeclarations declaring(String table, String association, String... types) {
        PolymorphicDeclarations declarations = new PolymorphicDeclarations();
        declarations.add(new PolymorphicDeclaration(table, association, PolymorphicDeclaration.Side.BELONGS_TO,
                association + "_type", association + "_id", List.of(types), "model.ts"));
        return declarations;
    }

    private static PolymorphicAssociation find(List<PolymorphicAssociation> associations, String table, String name) {
        return associations.stream()
                .filter(a -> a.table().equals(table) && a.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No association " + table + "." + name));
    }

    @Test
    void reverseDeclarationsInferTargets() {
        PolymorphicResolver resolver = new PolymorphicResolver(registry, PolymorphicDeclarations.none(), null,
                GeneratorConfig.defaults());

        PolymorphicAssociation notable = find(resolver.resolve(schema), "notes", "notable");

        assertEquals(List.of("jobs", "tasks"), notable.targets());
        assertEquals(DiscoverySource.INFERRED, notable.source());
        assertEquals("notable_type", notable.typeColumn());
        assertEquals("notable_id", notable.idColumn());
        assertNull(notable.statistics().totalRecords());
    }

    @Test
    void compactLowercaseTypeNamesMapToTables() {
        PolymorphicResolver resolver = new PolymorphicResolver(registry,
                declaring("notes", "notable", "activitylog", "task", "user"), null, GeneratorConfig.defaults());

        PolymorphicAssociation notable = find(resolver.resolve(schema), "notes", "notable");

        assertEquals(List.of("activity_logs", "tasks", "users"), notable.targets());
        assertEquals(DiscoverySource.DECLARED, notable.source());
        assertEquals("activity_logs", resolver.tableFor("activity_log", schema));
        assertEquals("widgets", resolver.tableFor("Widget", schema));
    }

    @Test
    void uneditedSeededDeclarationsFallThroughToInference() {
        PolymorphicDeclarations collected = declaring("notes", "notable", "job", "task");
        PolymorphicDeclarations narrowed = declaring("notes", "notable", "task");
        Map<String, List<String>> seeded = Map.of("notes.notable", List.of("job", "task"));

        PolymorphicAssociation unedited = find(new PolymorphicResolver(registry, collected.withoutUnedited(seeded),
                null, GeneratorConfig.defaults()).resolve(schema), "notes", "notable");
        PolymorphicAssociation edited = find(new PolymorphicResolver(registry, narrowed.withoutUnedited(seeded),
                null, GeneratorConfig.defaults()).resolve(schema), "notes", "notable");

        assertEquals(DiscoverySource.INFERRED, unedited.source());
        assertEquals(List.of("jobs", "tasks"), unedited.targets());
        assertEquals(DiscoverySource.DECLARED, edited.source());
        assertEquals(List.of("tasks"), edited.targets());
    }

    @Test
    void fallbackTargetsAreFilteredToKnownTables() {
        PolymorphicResolver resolver = new PolymorphicResolver(registry, PolymorphicDeclarations.none(), null,
                GeneratorConfig.defaults());

        PolymorphicAssociation loggable = find(resolver.resolve(schema), "activity_logs", "loggable");

        assertEquals(List.of("jobs", "tasks", "users"), loggable.targets());
        assertEquals(DiscoverySource.FALLBACK, loggable.source());
        assertTrue(resolver.warnings().stream().anyMatch(w -> w.contains("fallback targets for activity_logs.loggable")));
    }

    @Test
    void declarationsWinAndObservedTypesNeverBecomeTargets() {
        PolymorphicResolver resolver = new PolymorphicResolver(registry, declaring("notes", "notable", "Job", "Task"),
                observing("Job", "User"), GeneratorConfig.defaults());

        PolymorphicAssociation notable = find(resolver.resolve(schema), "notes", "notable");

        assertEquals(DiscoverySource.DECLARED, notable.source());
        assertEquals(List.of("jobs", "tasks"), notable.targets());
        assertEquals(List.of("Job", "User"), notable.observedTypes());
        assertEquals(List.of("jobs", "users"), notable.observedTables());
        assertEquals(Long.valueOf(3), notable.statistics().totalRecords());
    }

    @Test
    void narrowerDeclarationOverridesInference() {
        PolymorphicResolver resolver = new PolymorphicResolver(registry, declaring("notes", "notable", "Task"),
                null, GeneratorConfig.defaults());

        assertEquals(List.of("tasks"), find(resolver.resolve(schema), "notes", "notable").targets());
    }

    @Test
    void stiSubclassesGroupUnderTheirBaseTable() {
        PolymorphicResolver resolver = new PolymorphicResolver(registry,
                declaring("notes", "notable", "Task::Recurring", "Task::OneOff"), null, GeneratorConfig.defaults());

        PolymorphicAssociation notable = find(resolver.resolve(schema), "notes", "notable");

        assertEquals(List.of("tasks"), notable.targets());
        assertEquals(List.of(new StiGroup("Task", "tasks", List.of("Task::Recurring", "Task::OneOff"))),
                notable.stiGroups());
    }

    @Test
    void withoutAnySourceTheAssociationIsUnresolved() {
        GeneratorConfig config = GeneratorConfig.builder().polymorphicFallbacks(Map.of()).build();
        PolymorphicResolver resolver = new PolymorphicResolver(registry, PolymorphicDeclarations.none(), null, config);

        PolymorphicAssociation loggable = find(resolver.resolve(schema), "activity_logs", "loggable");

        assertFalse(loggable.isResolved());
        assertEquals(DiscoverySource.UNRESOLVED, loggable.source());
    }

    @Test
    void observedOnlyAssociationStaysWithoutTargets() {
        GeneratorConfig config = GeneratorConfig.builder().polymorphicFallbacks(Map.of()).build();
        PolymorphicResolver resolver = new PolymorphicResolver(registry, PolymorphicDeclarations.none(),
                observing("Job"), config);

        PolymorphicAssociation loggable = find(resolver.resolve(schema), "activity_logs", "loggable");

        assertEquals(DiscoverySource.OBSERVED, loggable.source());
        assertTrue(loggable.targets().isEmpty());
        assertEquals(List.of("jobs"), loggable.observedTables());
    }

    @Test
    void failingObservationIsAWarning() {
        ObservedDataSource failing = new ObservedDataSource() {
            @Override
            public List<String> distinctTypes(String table, String typeColumn) throws SQLException {
                throw new SQLException("permission denied");
            }

            @Override
            public UsageStatistics statistics(String table, String typeColumn, String timestampColumn)
                    throws SQLException {
                throw new SQLException("permission denied");
            }
        };
        PolymorphicResolver resolver = new PolymorphicResolver(registry, PolymorphicDeclarations.none(), failing,
                GeneratorConfig.defaults());

        PolymorphicAssociation notable = find(resolver.resolve(schema), "notes", "notable");

        assertEquals(List.of("jobs", "tasks"), notable.targets());
        assertTrue(notable.observedTypes().isEmpty());
        assertTrue(resolver.warnings().stream().anyMatch(w -> w.contains("permission denied")));
    }

    @Test
    void registryAssociationWithMissingColumnsIsReported() {
        EntityDescriptor user = new EntityDescriptor("User", null, false, List.of(), Map.of(),
                List.of(AssociationDescriptor.polymorphicBelongsTo("owner")));
        EntityRegistry ownerRegistry = new EntityRegistry(List.of(user));
        Schema ownerSchema = new SchemaIntrospector(ownerRegistry, GeneratorConfig.defaults())
                .extractSchema(Fixtures.introspection());
        PolymorphicResolver resolver = new PolymorphicResolver(ownerRegistry, PolymorphicDeclarations.none(), null,
                GeneratorConfig.defaults());

        List<PolymorphicAssociation> associations = resolver.resolve(ownerSchema);

        assertTrue(associations.stream().noneMatch(a -> a.name().equals("owner")));
        assertTrue(resolver.warnings().stream().anyMatch(w -> w.contains("users.owner is missing column owner_type")));
    }
}
