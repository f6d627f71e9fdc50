package com.syncgen.schemagen.change;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares previously generated schema text with fresh output. Works on the text alone, so the
 * prior run needs no stored model.
 */
public class ChangeDetector {
    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    private static final Pattern TABLE = Pattern.compile("const (\\w+) = table\\('([^']+)'\\)");
    private static final Pattern RELATIONSHIPS_START = Pattern.compile("const (\\w+)Relationships = relationships\\((\\w+),");
    private static final Pattern ACCESSOR = Pattern.compile("^\\s+(\\w+): (?:one|many)\\(\\{");
    private static final String RELATIONSHIPS_END = "}));";

    /**
     * @param prior previously generated text, or null on a first run
     */
    public SchemaChanges detect(String prior, String fresh) {
        if (prior == null) {
            return SchemaChanges.none();
        }

        Set<String> oldTables = tables(prior);
        Set<String> newTables = tables(fresh);
        Set<String> oldAccessors = accessors(prior);
        Set<String> newAccessors = accessors(fresh);

        List<String> addedTables = difference(newTables, oldTables);
        List<String> removedTables = difference(oldTables, newTables);
        List<String> addedRelationships = difference(newAccessors, oldAccessors);
        List<String> removedRelationships = difference(oldAccessors, newAccessors);

        List<String> notes = new ArrayList<>();
        for (String table : addedTables) {
            notes.add("New table '" + table + "' is available to clients");
        }
        for (String table : removedTables) {
            notes.add("Table '" + table + "' was removed; delete client code that queries it");
        }
        for (String relationship : removedRelationships) {
            String accessor = relationship.substring(relationship.indexOf('.') + 1);
            notes.add("Relationship '" + relationship + "' was removed; update queries using .related('"
                    + accessor + "')");
        }

        SchemaChanges changes = new SchemaChanges(addedTables, removedTables, addedRelationships,
                removedRelationships, notes);
        if (changes.hasChanges()) {
            logger.info("Schema changes: +{} / -{} tables, +{} / -{} relationships",
                    addedTables.size(), removedTables.size(), addedRelationships.size(), removedRelationships.size());
        }
        return changes;
    }

    static Set<String> tables(String content) {
        Set<String> result = new LinkedHashSet<>();
        Matcher m = TABLE.matcher(content);
        while (m.find()) {
            result.add(m.group(2));
        }
        return result;
    }

    static Set<String> accessors(String content) {
        Set<String> result = new LinkedHashSet<>();
        String table = null;
        for (String line : content.split("\n")) {
            Matcher start = RELATIONSHIPS_START.matcher(line);
            if (start.find()) {
                table = start.group(2);
                continue;
            }
            if (table == null) continue;
            if (line.startsWith(RELATIONSHIPS_END)) {
                table = null;
                continue;
            }
            Matcher accessor = ACCESSOR.matcher(line);
            if (accessor.find()) {
                result.add(table + "." + accessor.group(1));
            }
        }
        return result;
    }

    private static List<String> difference(Set<String> left, Set<String> right) {
        return left.stream().filter(v -> !right.contains(v)).sorted().toList();
    }
}
