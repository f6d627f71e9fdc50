package com.syncgen.schemagen.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncgen.schemagen.config.ConfigLoader;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.introspect.DatabaseIntrospector;
import com.syncgen.schemagen.introspect.IntrospectionResult;
import com.syncgen.schemagen.registry.EntityRegistry;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;

/**
 * Options shared by commands that read a schema: configuration, entity registry, and either a
 * live database or a saved introspection file.
 */
public class SourceOptions {

    @Option(names = {"--config", "-c"}, description = "Generator configuration (JSON or YAML)")
    File config;

    @Option(names = {"--registry", "-r"}, description = "Entity registry (JSON or YAML)")
    File registry;

    @Option(names = {"--introspection", "-i"}, description = "Saved introspection JSON, used instead of a live database")
    File introspection;

    @Option(names = {"--jdbc-url"}, description = "JDBC connection URL")
    String jdbcUrl;

    @Option(names = {"--username", "-u"}, description = "Database username")
    String username;

    @Option(names = {"--password", "-p"}, description = "Database password")
    String password;

    GeneratorConfig loadConfig() {
        return ConfigLoader.loadOrDefault(config == null ? null : config.toPath());
    }

    EntityRegistry loadRegistry() {
        return registry == null ? EntityRegistry.empty() : EntityRegistry.load(registry.toPath());
    }

    boolean live() {
        return introspection == null;
    }

    DatabaseIntrospector introspector() {
        if (jdbcUrl == null) {
            throw new IllegalArgumentException("Either --introspection or --jdbc-url is required");
        }
        return username != null
                ? new DatabaseIntrospector(jdbcUrl, username, password)
                : new DatabaseIntrospector(jdbcUrl);
    }

    IntrospectionResult readIntrospection() throws IOException {
        return new ObjectMapper().readValue(introspection, IntrospectionResult.class);
    }
}
