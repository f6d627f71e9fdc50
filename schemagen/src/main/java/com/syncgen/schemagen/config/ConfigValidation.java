package com.syncgen.schemagen.config;

import java.util.List;

public record ConfigValidation(List<String> errors, List<String> warnings) {
    public ConfigValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
