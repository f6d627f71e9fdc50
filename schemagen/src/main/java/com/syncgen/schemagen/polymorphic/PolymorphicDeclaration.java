package com.syncgen.schemagen.polymorphic;

import java.util.List;

/**
 * One association entry of a {@code declarePolymorphicRelationships} call.
 *
 * @param table        value of the call's {@code tableName}
 * @param association  association key, e.g. {@code notable}
 * @param side         {@code belongsTo} or {@code hasMany}
 * @param typeField    declared type column
 * @param idField      declared id column
 * @param allowedTypes allowed target types in declaration order
 * @param source       file the declaration was read from
 */
public record PolymorphicDeclaration(
        String table,
        String association,
        Side side,
        String typeField,
        String idField,
        List<String> allowedTypes,
        String source
) {
    public PolymorphicDeclaration {
        allowedTypes = allowedTypes == null ? List.of() : List.copyOf(allowedTypes);
    }

    public enum Side {
        BELONGS_TO("belongsTo"),
        HAS_MANY("hasMany");

        private final String key;

        Side(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }
}
