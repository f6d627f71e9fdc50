package com.syncgen.schemagen.generate;

/**
 * A TypeScript interface member: {@code name?: type | null}.
 */
public record FieldDefinition(String name, String type, boolean optional, boolean nullable) {
}
