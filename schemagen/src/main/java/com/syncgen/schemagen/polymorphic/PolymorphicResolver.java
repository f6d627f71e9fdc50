package com.syncgen.schemagen.polymorphic;

import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.model.DiscoverySource;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.Relationship;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.StiGroup;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.model.UsageStatistics;
import com.syncgen.schemagen.naming.Inflector;
import com.syncgen.schemagen.pattern.PolymorphicPair;
import com.syncgen.schemagen.registry.EntityDescriptor;
import com.syncgen.schemagen.registry.EntityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves the target tables of each polymorphic association.
 * <p>
 * Targets come from the first non-empty source among explicit declarations, reverse
 * declarations in the entity registry, and the configured fallback table. Observed type values
 * are collected for the discovery document only and never become targets.
 */
public class PolymorphicResolver {
    private static final Logger logger = LoggerFactory.getLogger(PolymorphicResolver.class);

    private final EntityRegistry registry;
    private final PolymorphicDeclarations declarations;
    private final ObservedDataSource observed;
    private final Map<String, List<String>> fallbacks;
    private final String stiSeparator;
    private final List<String> warnings = new ArrayList<>();

    /**
     * @param observed live data access; null when resolving offline
     */
    public PolymorphicResolver(EntityRegistry registry, PolymorphicDeclarations declarations,
                               ObservedDataSource observed, GeneratorConfig config) {
        this.registry = registry;
        this.declarations = declarations;
        this.observed = observed;
        this.fallbacks = config.polymorphicFallbacks();
        this.stiSeparator = config.stiSeparator();
    }

    public List<PolymorphicAssociation> resolve(Schema schema) {
        List<PolymorphicAssociation> result = new ArrayList<>();
        for (Table table : schema.tables()) {
            for (PolymorphicPair pair : candidatePairs(schema, table)) {
                result.add(resolve(schema, table, pair));
            }
        }
        logger.info("Resolved {} polymorphic associations", result.size());
        return result;
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    /**
     * Column pairs detected by naming convention plus polymorphic belongs-to associations from
     * the registry whose columns exist on the table.
     */
    private List<PolymorphicPair> candidatePairs(Schema schema, Table table) {
        Map<String, PolymorphicPair> pairs = new TreeMap<>();
        for (PolymorphicPair pair : schema.patternsFor(table.name()).polymorphicPairs()) {
            pairs.put(pair.name(), pair);
        }
        for (Relationship rel : schema.relationshipsFor(table.name())) {
            if (!rel.polymorphic() || pairs.containsKey(rel.name())) continue;
            if (table.hasColumn(rel.foreignType()) && table.hasColumn(rel.foreignKey())) {
                pairs.put(rel.name(), new PolymorphicPair(rel.name(), rel.foreignType(), rel.foreignKey()));
            } else {
                warn("Polymorphic association " + table.name() + "." + rel.name() + " is missing column "
                        + (table.hasColumn(rel.foreignType()) ? rel.foreignKey() : rel.foreignType()));
            }
        }
        return new ArrayList<>(pairs.values());
    }

    private PolymorphicAssociation resolve(Schema schema, Table table, PolymorphicPair pair) {
        Map<String, StiGroup> stiGroups = new LinkedHashMap<>();

        List<String> declaredTypes = declarations.allowedTypes(table.name(), pair.name());
        List<String> targets = toTables(declaredTypes, schema, stiGroups);
        DiscoverySource source = DiscoverySource.DECLARED;

        if (targets.isEmpty()) {
            targets = inferTargets(schema, pair.name());
            source = DiscoverySource.INFERRED;
        }
        if (targets.isEmpty()) {
            targets = fallbacks.getOrDefault(pair.name(), List.of()).stream()
                    .filter(schema::hasTable)
                    .toList();
            source = DiscoverySource.FALLBACK;
            if (!targets.isEmpty()) {
                warn("Using fallback targets for " + table.name() + "." + pair.name() + ": " + String.join(", ", targets));
            }
        }

        List<String> observedTypes = observedTypes(table, pair);
        List<String> observedTables = toTables(observedTypes, schema, stiGroups);

        if (targets.isEmpty()) {
            source = observedTypes.isEmpty() ? DiscoverySource.UNRESOLVED : DiscoverySource.OBSERVED;
            warn("No declared or inferred targets for " + table.name() + "." + pair.name()
                    + (observedTypes.isEmpty() ? "" : "; observed types " + observedTypes + " are not used for generation"));
        }

        logger.debug("{}.{} -> {} ({})", table.name(), pair.name(), targets, source);

        return new PolymorphicAssociation(
                table.name(),
                pair.name(),
                pair.typeColumn(),
                pair.idColumn(),
                targets,
                source,
                new ArrayList<>(stiGroups.values()),
                observedTypes,
                observedTables,
                statistics(table, pair));
    }

    private List<String> inferTargets(Schema schema, String association) {
        Set<String> tables = new LinkedHashSet<>();
        for (EntityDescriptor entity : registry.declaringAs(association)) {
            tables.add(entity.table());
        }
        for (EntityDescriptor entity : registry.includingConcern(Inflector.pascalCase(association))) {
            tables.add(entity.table());
        }
        return tables.stream().filter(schema::hasTable).sorted().toList();
    }

    /**
     * Maps type values to introspected tables, recording STI subclasses under their base class.
     */
    private List<String> toTables(List<String> types, Schema schema, Map<String, StiGroup> stiGroups) {
        Set<String> tables = new LinkedHashSet<>();
        for (String type : types) {
            int separator = type.indexOf(stiSeparator);
            String baseClass = separator > 0 ? type.substring(0, separator) : type;
            String table = tableFor(baseClass, schema);
            if (separator > 0) {
                StiGroup existing = stiGroups.get(baseClass);
                List<String> subclasses = new ArrayList<>(existing == null ? List.of() : existing.subclasses());
                if (!subclasses.contains(type)) subclasses.add(type);
                stiGroups.put(baseClass, new StiGroup(baseClass, table, subclasses));
            }
            if (schema.hasTable(table)) {
                tables.add(table);
            } else {
                logger.debug("Type '{}' maps to table '{}' which was not introspected", type, table);
            }
        }
        return new ArrayList<>(tables);
    }

    /**
     * Table of a type value. Besides class names ({@code ActivityLog}), accepts the compact
     * lowercase form written into generated declarations ({@code activitylog}).
     */
    String tableFor(String typeName, Schema schema) {
        Optional<EntityDescriptor> entity = registry.byName(typeName);
        if (entity.isPresent()) {
            return entity.get().table();
        }
        String compact = compact(typeName);
        for (EntityDescriptor candidate : registry.entities()) {
            if (compact(candidate.name()).equals(compact)) {
                return candidate.table();
            }
        }
        for (Table table : schema.tables()) {
            if (compact(Inflector.singularize(table.name())).equals(compact)) {
                return table.name();
            }
        }
        return Inflector.tableize(typeName);
    }

    static String compact(String typeName) {
        return typeName.replace("_", "").replace(":", "").toLowerCase(Locale.ROOT);
    }

    private List<String> observedTypes(Table table, PolymorphicPair pair) {
        if (observed == null) return List.of();
        try {
            return observed.distinctTypes(table.name(), pair.typeColumn());
        } catch (SQLException e) {
            warn("Could not read observed types for " + table.name() + "." + pair.typeColumn() + ": " + e.getMessage());
            return List.of();
        }
    }

    private UsageStatistics statistics(Table table, PolymorphicPair pair) {
        if (observed == null) return UsageStatistics.empty();
        String timestampColumn = table.hasColumn("created_at") ? "created_at"
                : table.hasColumn("updated_at") ? "updated_at" : null;
        try {
            return observed.statistics(table.name(), pair.typeColumn(), timestampColumn);
        } catch (SQLException e) {
            warn("Could not read statistics for " + table.name() + "." + pair.name() + ": " + e.getMessage());
            return UsageStatistics.empty();
        }
    }

    private void warn(String message) {
        logger.warn(message);
        warnings.add(message);
    }
}
