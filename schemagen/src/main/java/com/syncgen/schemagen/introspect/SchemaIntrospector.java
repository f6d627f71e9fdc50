package com.syncgen.schemagen.introspect;

import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.model.Column;
import com.syncgen.schemagen.model.ColumnKind;
import com.syncgen.schemagen.model.Constraint;
import com.syncgen.schemagen.model.DefaultKind;
import com.syncgen.schemagen.model.ForeignKey;
import com.syncgen.schemagen.model.Index;
import com.syncgen.schemagen.model.Relationship;
import com.syncgen.schemagen.model.RelationshipKind;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.naming.Inflector;
import com.syncgen.schemagen.pattern.PatternDetector;
import com.syncgen.schemagen.pattern.TablePatterns;
import com.syncgen.schemagen.registry.AssociationDescriptor;
import com.syncgen.schemagen.registry.EntityDescriptor;
import com.syncgen.schemagen.registry.EntityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the {@link Schema} model from raw catalog rows and the entity registry.
 * <p>
 * Enum declarations are cross-referenced here: an enum stored as integers aborts with
 * {@link EnumStorageException}. Tables without a registered entity keep their columns and
 * patterns but contribute no relationships.
 */
public class SchemaIntrospector {
    private static final Logger logger = LoggerFactory.getLogger(SchemaIntrospector.class);

    private final EntityRegistry registry;
    private final GeneratorConfig config;
    private final PatternDetector patternDetector;
    private final List<String> warnings = new ArrayList<>();

    public SchemaIntrospector(EntityRegistry registry, GeneratorConfig config) {
        this(registry, config, new PatternDetector());
    }

    public SchemaIntrospector(EntityRegistry registry, GeneratorConfig config, PatternDetector patternDetector) {
        this.registry = registry;
        this.config = config;
        this.patternDetector = patternDetector;
    }

    public Schema extractSchema(IntrospectionResult raw) {
        List<String> tableNames = raw.tables().stream()
                .map(TableInfo::name)
                .filter(name -> !config.excludesTable(name))
                .sorted()
                .toList();
        logger.info("Extracting {} tables ({} excluded)", tableNames.size(), raw.tables().size() - tableNames.size());

        List<Table> tables = new ArrayList<>();
        for (String name : tableNames) {
            tables.add(buildTable(name, raw));
        }

        List<Relationship> relationships = new ArrayList<>();
        Map<String, TablePatterns> patterns = new LinkedHashMap<>();
        for (Table table : tables) {
            Optional<EntityDescriptor> entity = registry.forTable(table.name());
            if (entity.isPresent()) {
                relationships.addAll(extractRelationships(table, entity.get()));
            } else {
                warn("No entity registered for table '" + table.name() + "'; skipping relationship extraction");
            }
            patterns.put(table.name(), patternDetector.detect(
                    table, entity.orElse(null), config.excludedPatterns(table.name())));
        }

        return new Schema(tables, relationships, patterns);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    private Table buildTable(String name, IntrospectionResult raw) {
        Set<String> pkColumns = raw.primaryKeys().stream()
                .filter(pk -> pk.tableName().equals(name))
                .sorted(Comparator.comparingInt(PrimaryKeyInfo::ordinalPosition))
                .map(PrimaryKeyInfo::columnName)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Map<String, List<String>> enumValues = enumValues(name);

        List<Column> columns = new ArrayList<>();
        raw.columns().stream()
                .filter(c -> c.tableName().equals(name))
                .sorted(Comparator.comparingInt(ColumnInfo::ordinalPosition))
                .forEach(info -> columns.add(new Column(
                        info.columnName(),
                        ColumnKind.fromPostgres(info.dataType(), info.udtName()),
                        info.udtName() != null ? info.udtName() : info.dataType(),
                        info.nullable(),
                        info.columnDefault(),
                        DefaultKind.categorize(info.columnDefault()),
                        info.comment(),
                        pkColumns.contains(info.columnName()),
                        enumValues.getOrDefault(info.columnName(), List.of())
                )));

        for (String enumColumn : enumValues.keySet()) {
            if (columns.stream().noneMatch(c -> c.name().equals(enumColumn))) {
                warn("Enum '" + enumColumn + "' declared for " + name + " has no matching column");
            }
        }

        String primaryKey = primaryKey(name, pkColumns, columns);
        if (primaryKey != null) {
            columns.replaceAll(c -> c.name().equals(primaryKey) ? c.asPrimaryKey() : c);
        }

        List<ForeignKey> foreignKeys = raw.foreignKeys().stream()
                .filter(fk -> fk.childTable().equals(name))
                .map(fk -> new ForeignKey(fk.constraintName(), fk.childColumn(), fk.parentTable(),
                        fk.parentColumn(), fk.deleteRule(), fk.updateRule()))
                .toList();

        List<Index> indexes = raw.indexes().stream()
                .filter(ix -> ix.tableName().equals(name))
                .map(ix -> new Index(ix.indexName(), name, ix.columns(), ix.unique(), ix.method(), ix.predicate()))
                .toList();

        List<Constraint> constraints = new ArrayList<>();
        for (ConstraintInfo info : raw.constraints()) {
            if (!info.tableName().equals(name)) continue;
            try {
                Constraint.Type type = Constraint.Type.valueOf(info.constraintType().toUpperCase(Locale.ROOT));
                constraints.add(new Constraint(name, info.constraintName(), type, info.definition()));
            } catch (IllegalArgumentException e) {
                logger.debug("Ignoring {} constraint {} on {}", info.constraintType(), info.constraintName(), name);
            }
        }

        return new Table(name, columns, primaryKey, foreignKeys, indexes, constraints);
    }

    private String primaryKey(String table, Set<String> pkColumns, List<Column> columns) {
        if (pkColumns.size() == 1) {
            return pkColumns.iterator().next();
        }
        if (pkColumns.size() > 1) {
            String first = pkColumns.iterator().next();
            warn("Table '" + table + "' has a composite primary key; using '" + first + "'");
            return first;
        }
        if (columns.stream().anyMatch(c -> c.name().equals("id"))) {
            warn("Table '" + table + "' has no primary key constraint; assuming 'id'");
            return "id";
        }
        warn("Table '" + table + "' has no primary key");
        return null;
    }

    /**
     * Declared enum values per column for a table's entity. Integer-backed values are fatal.
     */
    private Map<String, List<String>> enumValues(String table) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        Optional<EntityDescriptor> entity = registry.forTable(table);
        if (entity.isEmpty()) return result;

        for (Map.Entry<String, Map<String, Object>> declared : entity.get().enums().entrySet()) {
            String column = declared.getKey();
            List<String> values = new ArrayList<>();
            for (Object value : declared.getValue().values()) {
                if (value instanceof Number) {
                    throw new EnumStorageException(entity.get().name(), table, column);
                }
                values.add(String.valueOf(value));
            }
            if (!values.isEmpty()) {
                result.put(column, values);
            }
        }
        return result;
    }

    List<Relationship> extractRelationships(Table table, EntityDescriptor entity) {
        List<Relationship> result = new ArrayList<>();
        for (AssociationDescriptor association : entity.associations()) {
            if (association.kind() == null || association.name() == null) {
                warn("Skipping malformed association on " + entity.name());
                continue;
            }
            switch (association.kind()) {
                case BELONGS_TO -> result.add(belongsTo(table, association));
                case HAS_MANY -> result.add(hasMany(table, entity, association, RelationshipKind.HAS_MANY));
                case HAS_ONE -> result.add(hasMany(table, entity, association, RelationshipKind.HAS_ONE));
            }
        }
        return result;
    }

    private Relationship belongsTo(Table table, AssociationDescriptor association) {
        String foreignKey = association.foreignKey() != null ? association.foreignKey() : association.name() + "_id";
        if (association.polymorphic()) {
            String foreignType = association.foreignType() != null
                    ? association.foreignType()
                    : association.name() + "_type";
            return new Relationship(table.name(), RelationshipKind.BELONGS_TO, association.name(),
                    foreignKey, foreignType, null, null, true);
        }
        return new Relationship(table.name(), RelationshipKind.BELONGS_TO, association.name(),
                foreignKey, null, targetTable(association, false), null, false);
    }

    private Relationship hasMany(Table table, EntityDescriptor owner, AssociationDescriptor association,
                                 RelationshipKind kind) {
        String foreignKey;
        String foreignType = null;
        if (association.foreignKey() != null) {
            foreignKey = association.foreignKey();
        } else if (association.as() != null) {
            foreignKey = association.as() + "_id";
        } else {
            foreignKey = Inflector.underscore(simpleName(owner.name())) + "_id";
        }
        if (association.as() != null) {
            foreignType = association.as() + "_type";
        }
        return new Relationship(table.name(), kind, association.name(), foreignKey, foreignType,
                targetTable(association, kind == RelationshipKind.HAS_ONE), association.through(), false);
    }

    private String targetTable(AssociationDescriptor association, boolean singular) {
        if (association.className() != null) {
            return registry.byName(association.className())
                    .map(EntityDescriptor::table)
                    .orElseGet(() -> Inflector.tableize(simpleName(association.className())));
        }
        String className = Inflector.pascalCase(Inflector.singularize(association.name()));
        return registry.byName(className)
                .map(EntityDescriptor::table)
                .orElseGet(() -> singular
                        ? Inflector.pluralize(association.name())
                        : Inflector.pluralize(Inflector.singularize(association.name())));
    }

    private static String simpleName(String className) {
        int separator = className.lastIndexOf("::");
        return separator >= 0 ? className.substring(separator + 2) : className;
    }

    private void warn(String message) {
        logger.warn(message);
        warnings.add(message);
    }
}
