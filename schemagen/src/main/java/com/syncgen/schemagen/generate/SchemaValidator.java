package com.syncgen.schemagen.generate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural checks on generated schema text before anything is written.
 */
public class SchemaValidator {
    private static final Logger logger = LoggerFactory.getLogger(SchemaValidator.class);

    private static final Pattern IMPORT_BLOCK = Pattern.compile("import\\s*\\{([^}]*)}\\s*from\\s*'@rocicorp/zero'");
    private static final Pattern TABLE = Pattern.compile("const \\w+ = table\\('");
    private static final Pattern RELATIONSHIPS = Pattern.compile("const \\w+Relationships = relationships\\(");
    private static final Pattern ACCESSOR = Pattern.compile("^\\s+\\w+: (one|many)\\(\\{", Pattern.MULTILINE);
    private static final Pattern SKIPPED = Pattern.compile("// SKIPPED:");

    public ValidationResult validate(String content) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<String> imported = importedNames(content);
        for (String required : SchemaGenerator.REQUIRED_IMPORTS) {
            if (!imported.contains(required)) {
                errors.add("Missing import: " + required);
            }
        }
        if (!content.contains("export const schema")) {
            errors.add("Missing schema export (export const schema)");
        }
        if (!content.contains("export type ZeroClient")) {
            errors.add("Missing ZeroClient type export");
        }
        if (content.contains("inferZodType")) {
            errors.add("Unsupported inferZodType usage found");
        }

        int tables = count(TABLE, content);
        if (tables == 0) {
            errors.add("No table definitions found");
        }

        if (content.contains(".offset(")) {
            warnings.add("Deprecated query method .offset( found");
        }
        if (content.contains(".value")) {
            warnings.add("Deprecated .value access found");
        }
        int relationshipMaps = count(RELATIONSHIPS, content);
        if (relationshipMaps == 0) {
            warnings.add("No relationships defined");
        }

        Map<String, Integer> statistics = new LinkedHashMap<>();
        statistics.put("tables", tables);
        statistics.put("relationshipMaps", relationshipMaps);
        statistics.put("accessors", count(ACCESSOR, content));
        statistics.put("skipped", count(SKIPPED, content));
        statistics.put("lines", content.isEmpty() ? 0 : content.split("\n", -1).length);

        ValidationResult result = new ValidationResult(errors, warnings, statistics);
        if (!result.valid()) {
            logger.error("Schema validation failed with {} errors", errors.size());
        }
        warnings.forEach(w -> logger.warn("Schema validation: {}", w));
        return result;
    }

    /**
     * Validates and throws {@link SchemaValidationException} on any error.
     */
    public ValidationResult validateOrThrow(String content) {
        ValidationResult result = validate(content);
        if (!result.valid()) {
            throw new SchemaValidationException(result);
        }
        return result;
    }

    private static List<String> importedNames(String content) {
        List<String> names = new ArrayList<>();
        Matcher m = IMPORT_BLOCK.matcher(content);
        while (m.find()) {
            for (String part : m.group(1).split(",")) {
                String name = part.trim();
                if (name.startsWith("type ")) name = name.substring(5).trim();
                if (!name.isEmpty()) names.add(name);
            }
        }
        return names;
    }

    private static int count(Pattern pattern, String content) {
        Matcher m = pattern.matcher(content);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
