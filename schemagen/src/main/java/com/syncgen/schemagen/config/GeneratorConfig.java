package com.syncgen.schemagen.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.syncgen.schemagen.pattern.PatternKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generator configuration. Absent fields in a configuration document take the builder defaults.
 */
@JsonDeserialize(builder = GeneratorConfig.Builder.class)
public record GeneratorConfig(
        String schema,
        List<String> excludeTables,
        Map<String, List<String>> excludePatterns,
        Map<String, String> typeOverrides,
        Map<String, String> columnOverrides,
        Map<String, String> customNaming,
        String outputDirectory,
        String schemaFile,
        String typesFile,
        String mutationsDirectory,
        String discoveryFile,
        String manifestFile,
        List<String> declarationSources,
        Map<String, List<String>> polymorphicFallbacks,
        String stiSeparator,
        boolean generateMutations,
        boolean dryRun,
        boolean forceGeneration,
        boolean incrementalGeneration
) {
    public static final List<String> DEFAULT_EXCLUDED_TABLES = List.of(
            "solid_cache_entries",
            "solid_queue_jobs",
            "solid_queue_blocked_executions",
            "solid_queue_claimed_executions",
            "solid_queue_failed_executions",
            "solid_queue_paused_executions",
            "solid_queue_ready_executions",
            "solid_queue_recurring_executions",
            "solid_queue_scheduled_executions",
            "solid_queue_semaphores",
            "solid_queue_processes",
            "solid_queue_pauses",
            "solid_queue_recurring_tasks",
            "solid_cable_messages",
            "good_jobs",
            "good_job_batches",
            "good_job_executions",
            "good_job_processes",
            "good_job_settings",
            "refresh_tokens",
            "revoked_tokens",
            "unique_ids",
            "ar_internal_metadata",
            "schema_migrations",
            "versions");

    public static final Map<String, List<String>> DEFAULT_POLYMORPHIC_FALLBACKS = fallbacks();

    public static final Set<String> NAMING_KEYS = Set.of(
            "softDelete", "restore", "moveBefore", "moveAfter", "moveToTop", "moveToBottom");

    private static Map<String, List<String>> fallbacks() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("notable", List.of("jobs", "tasks", "clients"));
        map.put("loggable", List.of("jobs", "tasks", "clients", "users", "people"));
        map.put("schedulable", List.of("jobs", "tasks"));
        map.put("author", List.of("front_contacts", "front_teammates"));
        map.put("parseable", List.of("front_messages"));
        return Collections.unmodifiableMap(map);
    }

    // Unlike List.copyOf, keeps null entries so validation can report them
    private static <T> List<T> frozen(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static <K, V> Map<K, V> frozen(Map<K, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static GeneratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .schema(schema)
                .excludeTables(excludeTables)
                .excludePatterns(excludePatterns)
                .typeOverrides(typeOverrides)
                .columnOverrides(columnOverrides)
                .customNaming(customNaming)
                .outputDirectory(outputDirectory)
                .schemaFile(schemaFile)
                .typesFile(typesFile)
                .mutationsDirectory(mutationsDirectory)
                .discoveryFile(discoveryFile)
                .manifestFile(manifestFile)
                .declarationSources(declarationSources)
                .polymorphicFallbacks(polymorphicFallbacks)
                .stiSeparator(stiSeparator)
                .generateMutations(generateMutations)
                .dryRun(dryRun)
                .forceGeneration(forceGeneration)
                .incrementalGeneration(incrementalGeneration);
    }

    public boolean excludesTable(String table) {
        return excludeTables.contains(table);
    }

    public Set<PatternKind> excludedPatterns(String table) {
        Set<PatternKind> result = EnumSet.noneOf(PatternKind.class);
        for (String key : excludePatterns.getOrDefault(table, List.of())) {
            PatternKind.fromConfigKey(key).ifPresent(result::add);
        }
        return result;
    }

    /** Configured replacement for a standard operation name, or the name itself. */
    public String customName(String standardName) {
        return customNaming.getOrDefault(standardName, standardName);
    }

    public Path outputPath() {
        return Path.of(outputDirectory);
    }

    public Path schemaPath() {
        return outputPath().resolve(schemaFile);
    }

    public Path typesPath() {
        return outputPath().resolve(typesFile);
    }

    public Path mutationsPath() {
        return outputPath().resolve(mutationsDirectory);
    }

    public Path discoveryPath() {
        return outputPath().resolve(discoveryFile);
    }

    public Path manifestPath() {
        return outputPath().resolve(manifestFile);
    }

    /**
     * Directories scanned for {@code declarePolymorphicRelationships} calls. Without configured
     * sources this is the mutations directory, where custom scaffolds carry the declarations.
     */
    public List<Path> declarationRoots() {
        if (declarationSources.isEmpty()) {
            return List.of(mutationsPath());
        }
        return declarationSources.stream().map(Path::of).toList();
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String schema = "public";
        private List<String> excludeTables = new ArrayList<>(DEFAULT_EXCLUDED_TABLES);
        private Map<String, List<String>> excludePatterns = new LinkedHashMap<>();
        private Map<String, String> typeOverrides = new LinkedHashMap<>();
        private Map<String, String> columnOverrides = new LinkedHashMap<>();
        private Map<String, String> customNaming = new LinkedHashMap<>();
        private String outputDirectory = "frontend/src/lib/zero";
        private String schemaFile = "generated-schema.ts";
        private String typesFile = "generated-types.ts";
        private String mutationsDirectory = "mutations";
        private String discoveryFile = "polymorphic-discovery.yml";
        private String manifestFile = ".generation-manifest.json";
        private List<String> declarationSources = new ArrayList<>();
        private Map<String, List<String>> polymorphicFallbacks = new LinkedHashMap<>(DEFAULT_POLYMORPHIC_FALLBACKS);
        private String stiSeparator = "::";
        private boolean generateMutations = true;
        private boolean dryRun = false;
        private boolean forceGeneration = false;
        private boolean incrementalGeneration = true;

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder excludeTables(List<String> excludeTables) {
            this.excludeTables = excludeTables == null ? new ArrayList<>() : new ArrayList<>(excludeTables);
            return this;
        }

        public Builder excludeTable(String table) {
            this.excludeTables.add(table);
            return this;
        }

        public Builder excludePatterns(Map<String, List<String>> excludePatterns) {
            this.excludePatterns = excludePatterns == null ? new LinkedHashMap<>() : new LinkedHashMap<>(excludePatterns);
            return this;
        }

        public Builder typeOverrides(Map<String, String> typeOverrides) {
            this.typeOverrides = typeOverrides == null ? new LinkedHashMap<>() : new LinkedHashMap<>(typeOverrides);
            return this;
        }

        public Builder typeOverride(String tableAndColumn, String expression) {
            this.typeOverrides.put(tableAndColumn, expression);
            return this;
        }

        public Builder columnOverrides(Map<String, String> columnOverrides) {
            this.columnOverrides = columnOverrides == null ? new LinkedHashMap<>() : new LinkedHashMap<>(columnOverrides);
            return this;
        }

        public Builder customNaming(Map<String, String> customNaming) {
            this.customNaming = customNaming == null ? new LinkedHashMap<>() : new LinkedHashMap<>(customNaming);
            return this;
        }

        public Builder outputDirectory(String outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder schemaFile(String schemaFile) {
            this.schemaFile = schemaFile;
            return this;
        }

        public Builder typesFile(String typesFile) {
            this.typesFile = typesFile;
            return this;
        }

        public Builder mutationsDirectory(String mutationsDirectory) {
            this.mutationsDirectory = mutationsDirectory;
            return this;
        }

        public Builder discoveryFile(String discoveryFile) {
            this.discoveryFile = discoveryFile;
            return this;
        }

        public Builder manifestFile(String manifestFile) {
            this.manifestFile = manifestFile;
            return this;
        }

        public Builder declarationSources(List<String> declarationSources) {
            this.declarationSources = declarationSources == null ? new ArrayList<>() : new ArrayList<>(declarationSources);
            return this;
        }

        public Builder polymorphicFallbacks(Map<String, List<String>> polymorphicFallbacks) {
            this.polymorphicFallbacks = polymorphicFallbacks == null
                    ? new LinkedHashMap<>() : new LinkedHashMap<>(polymorphicFallbacks);
            return this;
        }

        public Builder stiSeparator(String stiSeparator) {
            this.stiSeparator = stiSeparator;
            return this;
        }

        public Builder generateMutations(boolean generateMutations) {
            this.generateMutations = generateMutations;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder forceGeneration(boolean forceGeneration) {
            this.forceGeneration = forceGeneration;
            return this;
        }

        public Builder incrementalGeneration(boolean incrementalGeneration) {
            this.incrementalGeneration = incrementalGeneration;
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(
                    schema,
                    frozen(excludeTables),
                    frozen(excludePatterns),
                    frozen(typeOverrides),
                    frozen(columnOverrides),
                    frozen(customNaming),
                    outputDirectory,
                    schemaFile,
                    typesFile,
                    mutationsDirectory,
                    discoveryFile,
                    manifestFile,
                    frozen(declarationSources),
                    frozen(polymorphicFallbacks),
                    stiSeparator,
                    generateMutations,
                    dryRun,
                    forceGeneration,
                    incrementalGeneration
            );
        }
    }
}
