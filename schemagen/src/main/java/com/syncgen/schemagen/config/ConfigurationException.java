package com.syncgen.schemagen.config;

import com.syncgen.schemagen.GenerationException;

import java.util.List;

/**
 * Raised when configuration is unreadable or invalid. Always raised before any generation work.
 */
public class ConfigurationException extends GenerationException {
    private final List<String> errors;

    public ConfigurationException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public ConfigurationException(List<String> errors) {
        super("Configuration validation failed:\n  - " + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
