package com.syncgen.schemagen.polymorphic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Declarations collected from existing sources, keyed by table and association.
 * A later declaration of the same association replaces an earlier one.
 */
public class PolymorphicDeclarations {
    private final Map<String, Map<String, PolymorphicDeclaration>> belongsTo = new TreeMap<>();
    private final Map<String, Map<String, PolymorphicDeclaration>> hasMany = new TreeMap<>();

    public static PolymorphicDeclarations none() {
        return new PolymorphicDeclarations();
    }

    public void add(PolymorphicDeclaration declaration) {
        Map<String, Map<String, PolymorphicDeclaration>> side =
                declaration.side() == PolymorphicDeclaration.Side.BELONGS_TO ? belongsTo : hasMany;
        side.computeIfAbsent(declaration.table(), t -> new TreeMap<>())
                .put(declaration.association(), declaration);
    }

    /**
     * Copy without the belongs-to declarations still holding exactly the types the generator
     * seeded, keyed by {@code table.association}. Those were never narrowed by hand, so
     * resolution falls through to inference as on the run that seeded them.
     */
    public PolymorphicDeclarations withoutUnedited(Map<String, List<String>> seeded) {
        PolymorphicDeclarations result = new PolymorphicDeclarations();
        for (PolymorphicDeclaration declaration : all()) {
            boolean unedited = declaration.side() == PolymorphicDeclaration.Side.BELONGS_TO
                    && declaration.allowedTypes().equals(
                            seeded.get(declaration.table() + "." + declaration.association()));
            if (!unedited) {
                result.add(declaration);
            }
        }
        return result;
    }

    public Optional<PolymorphicDeclaration> belongsTo(String table, String association) {
        return Optional.ofNullable(belongsTo.getOrDefault(table, Map.of()).get(association));
    }

    public List<String> allowedTypes(String table, String association) {
        return belongsTo(table, association).map(PolymorphicDeclaration::allowedTypes).orElse(List.of());
    }

    public List<PolymorphicDeclaration> all() {
        List<PolymorphicDeclaration> result = new ArrayList<>();
        belongsTo.values().forEach(m -> result.addAll(m.values()));
        hasMany.values().forEach(m -> result.addAll(m.values()));
        return result;
    }

    public int tableCount() {
        TreeSet<String> tables = new TreeSet<>(belongsTo.keySet());
        tables.addAll(hasMany.keySet());
        return tables.size();
    }

    public boolean isEmpty() {
        return belongsTo.isEmpty() && hasMany.isEmpty();
    }

    public String report() {
        StringBuilder out = new StringBuilder();
        out.append("Polymorphic declarations\n");
        if (isEmpty()) {
            out.append("  none found\n");
            return out.toString();
        }
        for (PolymorphicDeclaration d : all()) {
            out.append("  ").append(d.table()).append('.').append(d.association())
                    .append(" [").append(d.side().key()).append("] ")
                    .append(d.typeField()).append('/').append(d.idField())
                    .append(" -> ").append(String.join(", ", d.allowedTypes()))
                    .append('\n');
        }
        return out.toString();
    }
}
