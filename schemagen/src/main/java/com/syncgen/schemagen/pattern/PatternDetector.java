package com.syncgen.schemagen.pattern;

import com.syncgen.schemagen.model.Column;
import com.syncgen.schemagen.model.ColumnKind;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.registry.EntityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Detects naming-convention patterns on a table. Each kind is detected independently;
 * detections are heuristics over column names and kinds only.
 */
public class PatternDetector {
    private static final Logger logger = LoggerFactory.getLogger(PatternDetector.class);

    static final String DISCARD_COLUMN = "discarded_at";
    static final String DELETED_COLUMN = "deleted_at";
    static final String POSITION_COLUMN = "position";
    static final String NORMALIZED_SUFFIX = "_normalized";
    static final String TIME_SET_SUFFIX = "_time_set";

    public TablePatterns detect(Table table, EntityDescriptor entity) {
        return detect(table, entity, Set.of());
    }

    public TablePatterns detect(Table table, EntityDescriptor entity, Set<PatternKind> excluded) {
        SoftDeletion softDeletion = excluded.contains(PatternKind.SOFT_DELETION) ? null : softDeletion(table, entity);
        Positioning positioning = excluded.contains(PatternKind.POSITIONING) ? null : positioning(table);
        List<NormalizedField> normalized = excluded.contains(PatternKind.NORMALIZED_FIELD) ? List.of() : normalizedFields(table);
        List<TimestampPair> pairs = excluded.contains(PatternKind.TIMESTAMP_PAIR) ? List.of() : timestampPairs(table);
        List<EnumField> enums = excluded.contains(PatternKind.ENUM) ? List.of() : enums(table);
        List<PolymorphicPair> polymorphic = excluded.contains(PatternKind.POLYMORPHIC) ? List.of() : polymorphicPairs(table);

        TablePatterns patterns = new TablePatterns(table.name(), softDeletion, positioning, normalized, pairs, enums, polymorphic);
        if (patterns.count() > 0) {
            logger.debug("{}: {} patterns detected", table.name(), patterns.count());
        }
        return patterns;
    }

    SoftDeletion softDeletion(Table table, EntityDescriptor entity) {
        boolean discardModule = entity != null && entity.declaresDiscard();
        if (isDeletionMarker(table, DISCARD_COLUMN)) {
            return new SoftDeletion(DISCARD_COLUMN, SoftDeletion.Convention.DISCARD, discardModule);
        }
        if (isDeletionMarker(table, DELETED_COLUMN)) {
            return new SoftDeletion(DELETED_COLUMN, SoftDeletion.Convention.TIMESTAMP_DELETE, discardModule);
        }
        return null;
    }

    // Restoring writes null, so the marker must be a nullable timestamp
    private static boolean isDeletionMarker(Table table, String columnName) {
        Optional<Column> column = table.column(columnName);
        if (column.isEmpty()) return false;
        if (!column.get().nullable() || !column.get().kind().isTimestamp()) {
            logger.debug("{}.{} is not a nullable timestamp; not a soft-deletion marker", table.name(), columnName);
            return false;
        }
        return true;
    }

    Positioning positioning(Table table) {
        if (!table.hasColumn(POSITION_COLUMN)) return null;
        List<String> scopes = table.columns().stream()
                .map(Column::name)
                .filter(name -> name.endsWith("_id") && !name.equals("id"))
                .toList();
        return new Positioning(POSITION_COLUMN, scopes, Positioning.OPERATIONS);
    }

    List<NormalizedField> normalizedFields(Table table) {
        List<NormalizedField> result = new ArrayList<>();
        for (Column column : table.columns()) {
            String name = column.name();
            if (!name.endsWith(NORMALIZED_SUFFIX)) continue;
            String source = name.substring(0, name.length() - NORMALIZED_SUFFIX.length());
            if (!source.isEmpty() && table.hasColumn(source)) {
                result.add(new NormalizedField(name, source));
            }
        }
        return result;
    }

    List<TimestampPair> timestampPairs(Table table) {
        List<TimestampPair> result = new ArrayList<>();
        for (Column column : table.columns()) {
            String name = column.name();
            if (!name.endsWith(TIME_SET_SUFFIX) || column.kind() != ColumnKind.BOOLEAN) continue;
            String base = name.substring(0, name.length() - TIME_SET_SUFFIX.length());
            table.column(base + "_at")
                    .filter(c -> c.kind().isTimestamp())
                    .ifPresent(c -> result.add(new TimestampPair(name, c.name())));
        }
        return result;
    }

    List<EnumField> enums(Table table) {
        return table.columns().stream()
                .filter(Column::isEnum)
                .map(c -> new EnumField(c.name(), c.enumValues()))
                .toList();
    }

    List<PolymorphicPair> polymorphicPairs(Table table) {
        List<PolymorphicPair> result = new ArrayList<>();
        for (Column column : table.columns()) {
            String name = column.name();
            if (!name.endsWith("_type") || name.length() <= "_type".length()) continue;
            String base = name.substring(0, name.length() - "_type".length());
            if (table.hasColumn(base + "_id")) {
                result.add(new PolymorphicPair(base, name, base + "_id"));
            }
        }
        return result;
    }
}
