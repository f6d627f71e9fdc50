package com.syncgen.schemagen.model;

/**
 * A declared association between two tables.
 * <p>
 * {@code target} is null for polymorphic belongs-to associations; their targets come from
 * {@link PolymorphicAssociation}. {@code foreignType} is only set when polymorphic.
 */
public record Relationship(
        String table,
        RelationshipKind kind,
        String name,
        String foreignKey,
        String foreignType,
        String target,
        String through,
        boolean polymorphic
) {
    public boolean isThrough() {
        return through != null && !through.isBlank();
    }

    public boolean isSelfReferential() {
        return table.equals(target);
    }
}
