package com.syncgen.schemagen.change;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.syncgen.schemagen.GenerationException;
import com.syncgen.schemagen.generate.ArtifactWriter;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.pattern.TablePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Reads and writes the generation manifest and computes the hashes stored in it.
 * <p>
 * Hashes are SHA-256 over canonical JSON: properties and map entries sorted, no whitespace.
 */
public class ManifestStore {
    private static final Logger logger = LoggerFactory.getLogger(ManifestStore.class);

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final ArtifactWriter writer;

    public ManifestStore(ArtifactWriter writer) {
        this.writer = writer;
    }

    /**
     * Missing manifests yield an empty one. An unreadable manifest is logged and treated as
     * missing, which forces full regeneration.
     */
    public GenerationManifest load(Path path) throws IOException {
        if (!Files.exists(path)) {
            logger.debug("No manifest at {}", path);
            return GenerationManifest.empty();
        }
        try {
            GenerationManifest manifest = mapper.readValue(path.toFile(), GenerationManifest.class);
            if (manifest.version() != GenerationManifest.CURRENT_VERSION) {
                logger.warn("Manifest {} has version {}, expected {}; regenerating everything",
                        path, manifest.version(), GenerationManifest.CURRENT_VERSION);
                return GenerationManifest.empty();
            }
            return manifest;
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring unreadable manifest {}: {}", path, e.getOriginalMessage());
            return GenerationManifest.empty();
        }
    }

    public void save(Path path, GenerationManifest manifest) throws IOException {
        writer.write(path, mapper.writeValueAsString(manifest) + "\n");
    }

    public static String patternHash(TablePatterns patterns) {
        return sha256(canonicalJson(patterns));
    }

    public static String columnHash(Table table) {
        return sha256(canonicalJson(table.columns()));
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Could not serialize " + value.getClass().getSimpleName() + " for hashing", e);
        }
    }
}
