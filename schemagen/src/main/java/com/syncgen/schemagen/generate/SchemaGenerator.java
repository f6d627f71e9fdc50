package com.syncgen.schemagen.generate;

import com.syncgen.schemagen.model.Column;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.Relationship;
import com.syncgen.schemagen.model.RelationshipKind;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.naming.Inflector;
import com.syncgen.schemagen.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the sync schema document: one {@code table()} per table, one {@code relationships()}
 * map per table with accessors, and the aggregate {@code createSchema}.
 * <p>
 * Relationships that cannot be expressed (missing target table, foreign key absent on the
 * target, has-many-through) become comments in the map instead of accessors.
 */
public class SchemaGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SchemaGenerator.class);

    static final List<String> REQUIRED_IMPORTS = List.of("createSchema", "table", "string", "number", "boolean");

    private final HandlebarsEngine engine;
    private final TypeMapper typeMapper;
    private final List<String> warnings = new ArrayList<>();

    public SchemaGenerator(HandlebarsEngine engine, TypeMapper typeMapper) {
        this.engine = engine;
        this.typeMapper = typeMapper;
    }

    public GeneratedArtifact generate(Schema schema, List<PolymorphicAssociation> polymorphic, Path path)
            throws IOException {
        SchemaDocument document = document(schema, polymorphic);
        logger.info("  Generating {} ({} tables, {} relationship maps)", path.getFileName(),
                document.tables().size(), document.relationshipNames().size());
        return new GeneratedArtifact(path, ArtifactKind.SCHEMA, render(document));
    }

    public String render(SchemaDocument document) throws IOException {
        Map<String, Object> context = new HashMap<>();
        context.put("document", document);
        return engine.render("schema", context);
    }

    public SchemaDocument document(Schema schema, List<PolymorphicAssociation> polymorphic) {
        List<TableDefinition> tables = new ArrayList<>();
        Set<String> expressions = new LinkedHashSet<>();
        for (Table table : schema.tables()) {
            List<ColumnDefinition> columns = new ArrayList<>();
            for (Column column : table.columns()) {
                String expression = typeMapper.map(table.name(), column);
                expressions.add(expression);
                columns.add(ColumnDefinition.of(column.name(), expression, column.comment()));
            }
            String primaryKey = table.primaryKey() != null ? table.primaryKey() : "id";
            tables.add(new TableDefinition(table.name(), Inflector.humanize(table.name()), columns, primaryKey));
        }

        List<RelationshipMap> maps = new ArrayList<>();
        for (Table table : schema.tables()) {
            List<RelationshipEntry> entries = relationshipEntries(schema, table, polymorphic);
            if (!entries.isEmpty()) {
                maps.add(new RelationshipMap(table.name(), Inflector.humanize(table.name()), entries));
            }
        }

        return new SchemaDocument(imports(expressions, maps), tables, maps);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    private List<String> imports(Set<String> expressions, List<RelationshipMap> maps) {
        List<String> imports = new ArrayList<>(REQUIRED_IMPORTS);
        if (expressions.stream().anyMatch(e -> e.startsWith("json("))) imports.add("json");
        if (expressions.stream().anyMatch(e -> e.startsWith("enumeration<"))) imports.add("enumeration");
        if (maps.stream().anyMatch(RelationshipMap::hasAccessors)) imports.add("relationships");
        imports.add("type Zero");
        return imports;
    }

    private List<RelationshipEntry> relationshipEntries(Schema schema, Table table,
                                                        List<PolymorphicAssociation> polymorphic) {
        List<RelationshipEntry> entries = new ArrayList<>();
        Set<String> accessors = new LinkedHashSet<>();
        Set<String> polymorphicNames = new LinkedHashSet<>();

        for (Relationship rel : schema.relationshipsFor(table.name())) {
            List<RelationshipEntry> produced;
            if (rel.kind() == RelationshipKind.BELONGS_TO && rel.polymorphic()) {
                polymorphicNames.add(rel.name());
                produced = polymorphicBelongsTo(schema, association(polymorphic, table, rel.name()), rel.name());
            } else if (rel.kind() == RelationshipKind.BELONGS_TO) {
                produced = belongsTo(schema, table, rel);
            } else if (rel.isThrough()) {
                produced = List.of(RelationshipEntry.note(rel.name() + ": has-many through " + rel.through()
                        + "; use " + Inflector.camelCase(rel.through()) + ".related('"
                        + Inflector.singularize(rel.name()) + "')"));
            } else {
                produced = hasManyOrOne(schema, table, rel);
            }

            add(table, entries, accessors, produced);
        }

        // Column pairs resolved without a registry association
        for (PolymorphicAssociation association : polymorphic) {
            if (!association.table().equals(table.name()) || !polymorphicNames.add(association.name())) continue;
            add(table, entries, accessors, polymorphicBelongsTo(schema, Optional.of(association), association.name()));
        }
        return entries;
    }

    private static void add(Table table, List<RelationshipEntry> entries, Set<String> accessors,
                            List<RelationshipEntry> produced) {
        for (RelationshipEntry entry : produced) {
            if (entry.accessor() == null) {
                entries.add(entry);
            } else if (accessors.add(entry.accessor())) {
                entries.add(entry);
            } else {
                logger.debug("Duplicate accessor {}.{} ignored", table.name(), entry.accessor());
            }
        }
    }

    private static Optional<PolymorphicAssociation> association(List<PolymorphicAssociation> polymorphic,
                                                                Table table, String name) {
        return polymorphic.stream()
                .filter(a -> a.table().equals(table.name()) && a.name().equals(name))
                .findFirst();
    }

    private List<RelationshipEntry> belongsTo(Schema schema, Table table, Relationship rel) {
        Optional<Table> target = schema.table(rel.target());
        if (target.isEmpty()) {
            return List.of(RelationshipEntry.note(rel.name() + ": target table '" + rel.target()
                    + "' is not part of the generated schema"));
        }
        if (!table.hasColumn(rel.foreignKey())) {
            warn("Skipping " + table.name() + "." + rel.name() + ": column '" + rel.foreignKey() + "' does not exist");
            return List.of(RelationshipEntry.note("SKIPPED: " + rel.name() + " - foreign key '"
                    + rel.foreignKey() + "' does not exist in table '" + table.name() + "'"));
        }

        List<RelationshipEntry> produced = new ArrayList<>();
        produced.add(RelationshipEntry.toOne(Inflector.camelCase(rel.name()), rel.foreignKey(),
                primaryKey(target.get()), target.get().name()));
        if (rel.isSelfReferential() && rel.name().equals("parent")) {
            produced.add(RelationshipEntry.toMany("children", primaryKey(table), rel.foreignKey(), table.name()));
        }
        return produced;
    }

    private List<RelationshipEntry> polymorphicBelongsTo(Schema schema, Optional<PolymorphicAssociation> association,
                                                         String name) {
        if (association.isEmpty() || !association.get().isResolved()) {
            return List.of(RelationshipEntry.note(name + ": polymorphic association has no resolved targets"));
        }

        List<RelationshipEntry> produced = new ArrayList<>();
        for (String target : association.get().targets()) {
            String accessor = Inflector.camelCase(name) + Inflector.classify(target);
            String destField = schema.table(target).map(SchemaGenerator::primaryKey).orElse("id");
            produced.add(RelationshipEntry.toOne(accessor, association.get().idColumn(), destField, target));
        }
        return produced;
    }

    private List<RelationshipEntry> hasManyOrOne(Schema schema, Table table, Relationship rel) {
        Optional<Table> target = schema.table(rel.target());
        if (target.isEmpty()) {
            return List.of(RelationshipEntry.note(rel.name() + ": target table '" + rel.target()
                    + "' is not part of the generated schema"));
        }
        if (!target.get().hasColumn(rel.foreignKey())) {
            warn("Skipping " + table.name() + "." + rel.name() + ": foreign key '" + rel.foreignKey()
                    + "' does not exist in " + target.get().name());
            return List.of(RelationshipEntry.note("SKIPPED: " + rel.name() + " - foreign key '"
                    + rel.foreignKey() + "' does not exist in target table '" + target.get().name() + "'"));
        }

        String accessor = Inflector.camelCase(rel.name());
        if (rel.kind() == RelationshipKind.HAS_ONE) {
            return List.of(RelationshipEntry.toOne(accessor, primaryKey(table), rel.foreignKey(), target.get().name()));
        }
        return List.of(RelationshipEntry.toMany(accessor, primaryKey(table), rel.foreignKey(), target.get().name()));
    }

    private static String primaryKey(Table table) {
        return table.primaryKey() != null ? table.primaryKey() : "id";
    }

    private void warn(String message) {
        logger.warn(message);
        warnings.add(message);
    }
}
