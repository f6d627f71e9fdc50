package com.syncgen.schemagen.generate;

/**
 * Either an accessor ({@code accessor} set) or an explanatory comment ({@code comment} set).
 */
public record RelationshipEntry(
        String accessor,
        String cardinality,
        String sourceField,
        String destField,
        String destSchema,
        String comment
) {
    public static RelationshipEntry toOne(String accessor, String sourceField, String destField, String destSchema) {
        return new RelationshipEntry(accessor, "one", sourceField, destField, destSchema, null);
    }

    public static RelationshipEntry toMany(String accessor, String sourceField, String destField, String destSchema) {
        return new RelationshipEntry(accessor, "many", sourceField, destField, destSchema, null);
    }

    public static RelationshipEntry note(String text) {
        return new RelationshipEntry(null, null, null, null, null, text);
    }
}
