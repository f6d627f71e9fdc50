package com.syncgen.schemagen;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.introspect.IntrospectionResult;
import com.syncgen.schemagen.introspect.SchemaIntrospector;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.registry.EntityRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

/**
 * Shared test data: a saved introspection of a small job/task schema and its entity registry.
 */
public final class Fixtures {
    private static final ObjectMapper mapper = new ObjectMapper();

    private Fixtures() {}

    public static IntrospectionResult introspection() {
        try (InputStream in = Fixtures.class.getResourceAsStream("/introspection.json")) {
            return mapper.readValue(in, IntrospectionResult.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path registryPath() {
        try {
            return Path.of(Fixtures.class.getResource("/entities.json").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static EntityRegistry registry() {
        return EntityRegistry.load(registryPath());
    }

    public static Schema schema(GeneratorConfig config) {
        return new SchemaIntrospector(registry(), config).extractSchema(introspection());
    }

    public static Schema schema() {
        return schema(GeneratorConfig.defaults());
    }
}
