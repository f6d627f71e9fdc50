package com.syncgen.schemagen.model;

import com.syncgen.schemagen.pattern.TablePatterns;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The introspected schema model, rebuilt from scratch on each run.
 */
public record Schema(
        List<Table> tables,
        List<Relationship> relationships,
        Map<String, TablePatterns> patterns
) {
    public Schema {
        tables = tables == null ? List.of() : List.copyOf(tables);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        patterns = patterns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
    }

    public Optional<Table> table(String name) {
        return tables.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    public boolean hasTable(String name) {
        return table(name).isPresent();
    }

    public List<String> tableNames() {
        return tables.stream().map(Table::name).toList();
    }

    public List<Relationship> relationshipsFor(String table) {
        return relationships.stream().filter(r -> r.table().equals(table)).toList();
    }

    public TablePatterns patternsFor(String table) {
        return patterns.getOrDefault(table, TablePatterns.none(table));
    }

    public List<Index> indexes() {
        return tables.stream().flatMap(t -> t.indexes().stream()).toList();
    }

    public List<Constraint> constraints() {
        return tables.stream().flatMap(t -> t.constraints().stream()).toList();
    }
}
