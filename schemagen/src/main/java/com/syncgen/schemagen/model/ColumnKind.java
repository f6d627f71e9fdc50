package com.syncgen.schemagen.model;

import java.util.Locale;

/**
 * Primitive storage kind of a column, normalized from the database's declared type.
 */
public enum ColumnKind {
    UUID,
    STRING,
    TEXT,
    INTEGER,
    BIGINT,
    DECIMAL,
    FLOAT,
    BOOLEAN,
    DATE,
    DATETIME,
    TIMESTAMP,
    TIME,
    JSON,
    JSONB,
    BINARY,
    ARRAY,
    UNKNOWN;

    public boolean isTemporal() {
        return this == DATE || this == DATETIME || this == TIMESTAMP || this == TIME;
    }

    public boolean isTimestamp() {
        return this == DATETIME || this == TIMESTAMP;
    }

    public boolean isInteger() {
        return this == INTEGER || this == BIGINT;
    }

    /**
     * Maps an {@code information_schema.columns} data_type / udt_name pair to a kind.
     * Types outside the table map to {@link #UNKNOWN}.
     */
    public static ColumnKind fromPostgres(String dataType, String udtName) {
        if (dataType == null) return UNKNOWN;
        String type = dataType.toLowerCase(Locale.ROOT);
        return switch (type) {
            case "uuid" -> UUID;
            case "character varying", "character", "varchar", "char", "citext" -> STRING;
            case "text" -> TEXT;
            case "integer", "smallint", "int", "int2", "int4", "serial" -> INTEGER;
            case "bigint", "int8", "bigserial" -> BIGINT;
            case "numeric", "decimal", "money" -> DECIMAL;
            case "real", "double precision", "float4", "float8" -> FLOAT;
            case "boolean", "bool" -> BOOLEAN;
            case "date" -> DATE;
            case "timestamp without time zone", "timestamp" -> DATETIME;
            case "timestamp with time zone", "timestamptz" -> TIMESTAMP;
            case "time without time zone", "time with time zone", "time" -> TIME;
            case "json" -> JSON;
            case "jsonb" -> JSONB;
            case "bytea" -> BINARY;
            case "array" -> ARRAY;
            case "user-defined" -> "citext".equalsIgnoreCase(udtName) ? STRING : UNKNOWN;
            default -> UNKNOWN;
        };
    }
}
