package com.syncgen.schemagen.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A statically declared association of an entity.
 *
 * @param kind        association kind
 * @param name        association name, e.g. {@code client} or {@code notes}
 * @param foreignKey  explicit foreign key column; derived from naming conventions when null
 * @param foreignType type column of a polymorphic belongs-to; defaults to {@code <name>_type}
 * @param className   target entity name; derived from {@code name} when null
 * @param polymorphic whether the target is chosen by a type column
 * @param through     join association for has-many-through
 * @param as          polymorphic interface this has-many/has-one satisfies
 * @param optional    whether a belongs-to may be absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssociationDescriptor(
        @JsonProperty("kind") AssociationKind kind,
        @JsonProperty("name") String name,
        @JsonProperty("foreignKey") String foreignKey,
        @JsonProperty("foreignType") String foreignType,
        @JsonProperty("className") String className,
        @JsonProperty("polymorphic") boolean polymorphic,
        @JsonProperty("through") String through,
        @JsonProperty("as") String as,
        @JsonProperty("optional") boolean optional
) {
    public static AssociationDescriptor belongsTo(String name) {
        return new AssociationDescriptor(AssociationKind.BELONGS_TO, name, null, null, null, false, null, null, false);
    }

    public static AssociationDescriptor polymorphicBelongsTo(String name) {
        return new AssociationDescriptor(AssociationKind.BELONGS_TO, name, null, null, null, true, null, null, false);
    }

    public static AssociationDescriptor hasMany(String name) {
        return new AssociationDescriptor(AssociationKind.HAS_MANY, name, null, null, null, false, null, null, false);
    }

    public static AssociationDescriptor hasManyAs(String name, String as) {
        return new AssociationDescriptor(AssociationKind.HAS_MANY, name, null, null, null, false, null, as, false);
    }

    public static AssociationDescriptor hasManyThrough(String name, String through) {
        return new AssociationDescriptor(AssociationKind.HAS_MANY, name, null, null, null, false, through, null, false);
    }

    public static AssociationDescriptor hasOne(String name) {
        return new AssociationDescriptor(AssociationKind.HAS_ONE, name, null, null, null, false, null, null, false);
    }
}
