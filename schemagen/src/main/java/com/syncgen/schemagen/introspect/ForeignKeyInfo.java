package com.syncgen.schemagen.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ForeignKeyInfo(
        @JsonProperty("constraintName") String constraintName,
        @JsonProperty("childSchema") String childSchema,
        @JsonProperty("childTable") String childTable,
        @JsonProperty("childColumn") String childColumn,
        @JsonProperty("parentSchema") String parentSchema,
        @JsonProperty("parentTable") String parentTable,
        @JsonProperty("parentColumn") String parentColumn,
        @JsonProperty("updateRule") String updateRule,
        @JsonProperty("deleteRule") String deleteRule,
        @JsonProperty("ordinalPosition") int ordinalPosition
) {}
