package com.syncgen.schemagen.generate;

import com.syncgen.schemagen.GenerationException;

import java.util.List;

/**
 * Raised when generated schema text fails validation. Nothing has been written when it is thrown.
 */
public class SchemaValidationException extends GenerationException {
    private final ValidationResult result;

    public SchemaValidationException(ValidationResult result) {
        super("Generated schema failed validation:\n  - " + String.join("\n  - ", result.errors()));
        this.result = result;
    }

    public ValidationResult result() {
        return result;
    }

    public List<String> errors() {
        return result.errors();
    }
}
