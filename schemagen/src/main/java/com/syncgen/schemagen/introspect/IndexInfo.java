package com.syncgen.schemagen.introspect;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IndexInfo(
        @JsonProperty("tableSchema") String tableSchema,
        @JsonProperty("tableName") String tableName,
        @JsonProperty("indexName") String indexName,
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("unique") boolean unique,
        @JsonProperty("method") String method,
        @JsonProperty("predicate") String predicate
) {}
