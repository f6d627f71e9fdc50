package com.syncgen.schemagen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.syncgen.schemagen.pattern.PatternKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads and validates {@link GeneratorConfig} documents in JSON or YAML.
 */
public final class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /** YAML mapper for {@code .yml}/{@code .yaml} paths, JSON otherwise. */
    public static ObjectMapper mapperFor(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yml") || name.endsWith(".yaml")) {
            return new ObjectMapper(new YAMLFactory());
        }
        return new ObjectMapper();
    }

    public static GeneratorConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try {
            GeneratorConfig config = mapperFor(path).readValue(path.toFile(), GeneratorConfig.class);
            logger.info("Loaded configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /** Loads {@code path} when given, otherwise returns the defaults. */
    public static GeneratorConfig loadOrDefault(Path path) {
        return path == null ? GeneratorConfig.defaults() : load(path);
    }

    public static ConfigValidation validate(GeneratorConfig config) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        validateOutputDirectory(config.outputDirectory(), errors);

        if (config.excludeTables() == null) {
            errors.add("excludeTables must be a list of table names");
        } else {
            for (int i = 0; i < config.excludeTables().size(); i++) {
                String table = config.excludeTables().get(i);
                if (table == null || table.isBlank()) {
                    errors.add("excludeTables[" + i + "] is empty");
                } else if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                    errors.add("excludeTables[" + i + "] is not a table name: " + table);
                }
            }
        }

        if (config.stiSeparator() == null || config.stiSeparator().isEmpty()) {
            errors.add("stiSeparator must not be empty");
        }

        if (config.schema() == null || config.schema().isBlank()) {
            errors.add("schema must not be empty");
        }

        for (Map.Entry<String, List<String>> entry : config.excludePatterns().entrySet()) {
            if (entry.getValue() == null) {
                errors.add("excludePatterns." + entry.getKey() + " must be a list");
                continue;
            }
            List<String> invalid = entry.getValue().stream()
                    .filter(key -> PatternKind.fromConfigKey(key).isEmpty())
                    .toList();
            if (!invalid.isEmpty()) {
                warnings.add("Invalid pattern types for " + entry.getKey() + ": " + String.join(", ", invalid));
            }
        }

        List<String> invalidNaming = config.customNaming().keySet().stream()
                .filter(key -> !GeneratorConfig.NAMING_KEYS.contains(key))
                .sorted()
                .toList();
        if (!invalidNaming.isEmpty()) {
            warnings.add("Invalid custom naming keys: " + String.join(", ", invalidNaming));
        }

        for (String key : config.typeOverrides().keySet()) {
            if (!key.contains(".")) {
                warnings.add("Type override '" + key + "' is not of the form table.column; use columnOverrides instead");
            }
        }

        for (String source : config.declarationSources()) {
            if (!Files.isDirectory(Path.of(source))) {
                warnings.add("Declaration source is not a directory: " + source);
            }
        }

        return new ConfigValidation(errors, warnings);
    }

    private static void validateOutputDirectory(String outputDirectory, List<String> errors) {
        if (outputDirectory == null || outputDirectory.isBlank()) {
            errors.add("outputDirectory must not be empty");
            return;
        }
        Path path = Path.of(outputDirectory).toAbsolutePath();
        if (Files.exists(path)) {
            if (!Files.isDirectory(path)) {
                errors.add("Output directory is not a directory: " + outputDirectory);
            } else if (!Files.isWritable(path)) {
                errors.add("Output directory is not writable: " + outputDirectory);
            }
            return;
        }
        Path ancestor = path.getParent();
        while (ancestor != null && !Files.exists(ancestor)) {
            ancestor = ancestor.getParent();
        }
        if (ancestor == null || !Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
            errors.add("Output directory cannot be created: " + outputDirectory);
        }
    }
}
