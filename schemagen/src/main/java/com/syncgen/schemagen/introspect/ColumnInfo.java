package com.syncgen.schemagen.introspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnInfo(
        @JsonProperty("tableSchema") String tableSchema,
        @JsonProperty("tableName") String tableName,
        @JsonProperty("columnName") String columnName,
        @JsonProperty("dataType") String dataType,
        @JsonProperty("udtName") String udtName,
        @JsonProperty("characterMaximumLength") Integer characterMaximumLength,
        @JsonProperty("numericPrecision") Integer numericPrecision,
        @JsonProperty("numericScale") Integer numericScale,
        @JsonProperty("nullable") boolean nullable,
        @JsonProperty("columnDefault") String columnDefault,
        @JsonProperty("ordinalPosition") int ordinalPosition,
        @JsonProperty("comment") String comment
) {}
