package com.syncgen.schemagen.change;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cross-run state: per-table fingerprints for incremental generation, the hash of every file
 * written last time (keyed by path relative to the output directory), and the polymorphic
 * declarations seeded into custom scaffolds (keyed by {@code table.association}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationManifest(
        @JsonProperty("version") int version,
        @JsonProperty("tables") Map<String, TableEntry> tables,
        @JsonProperty("files") Map<String, String> files,
        @JsonProperty("seededDeclarations") Map<String, List<String>> seededDeclarations
) {
    public static final int CURRENT_VERSION = 1;

    @JsonCreator
    public GenerationManifest {
        tables = tables == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(tables));
        files = files == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(files));
        seededDeclarations = seededDeclarations == null
                ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(seededDeclarations));
    }

    public GenerationManifest(int version, Map<String, TableEntry> tables, Map<String, String> files) {
        this(version, tables, files, Map.of());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TableEntry(
            @JsonProperty("patternHash") String patternHash,
            @JsonProperty("columnHash") String columnHash
    ) {}

    public static GenerationManifest empty() {
        return new GenerationManifest(CURRENT_VERSION, Map.of(), Map.of());
    }

    public TableEntry table(String name) {
        return tables.get(name);
    }

    public String fileHash(String relativePath) {
        return files.get(relativePath);
    }

    public List<String> seededDeclaration(String table, String association) {
        return seededDeclarations.get(table + "." + association);
    }
}
