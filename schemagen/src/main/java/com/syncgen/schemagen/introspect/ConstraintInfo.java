package com.syncgen.schemagen.introspect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A CHECK or UNIQUE constraint. {@code definition} is the check clause or the unique column list.
 */
public record ConstraintInfo(
        @JsonProperty("tableSchema") String tableSchema,
        @JsonProperty("tableName") String tableName,
        @JsonProperty("constraintName") String constraintName,
        @JsonProperty("constraintType") String constraintType,
        @JsonProperty("definition") String definition
) {}
