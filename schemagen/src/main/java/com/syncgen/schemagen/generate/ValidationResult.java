package com.syncgen.schemagen.generate;

import java.util.List;
import java.util.Map;

/**
 * Outcome of validating generated schema text. Any error blocks writing.
 */
public record ValidationResult(List<String> errors, List<String> warnings, Map<String, Integer> statistics) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        statistics = Map.copyOf(statistics);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
