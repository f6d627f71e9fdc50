package com.syncgen.schemagen.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.introspect.IntrospectionResult;
import com.syncgen.schemagen.introspect.TableInfo;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Saves the catalog of the configured schema as JSON, minus the configured table exclusions,
 * so {@code generate} and {@code discover} can run offline with {@code --introspection}.
 * A saved introspection can be given instead of a database to re-apply the exclusions.
 */
@Command(
        name = "introspect",
        description = "Introspect a PostgreSQL database and save the catalog as JSON for offline generation",
        mixinStandardHelpOptions = true
)
public class IntrospectCommand implements Callable<Integer> {

    @Mixin
    private SourceOptions source;

    @Option(names = {"--output", "-o"}, description = "Output file (default: stdout)")
    private File output;

    @Override
    public Integer call() {
        try {
            GeneratorConfig config = source.loadConfig();
            IntrospectionResult raw = source.live()
                    ? source.introspector().introspect(config.schema())
                    : source.readIntrospection();

            IntrospectionResult result = raw.withoutTables(config::excludesTable);
            List<String> excluded = raw.tables().stream()
                    .map(TableInfo::name)
                    .filter(config::excludesTable)
                    .sorted()
                    .toList();

            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            if (output != null) {
                mapper.writeValue(output, result);
                System.out.println("Introspected " + result.tables().size() + " tables of schema '"
                        + config.schema() + "' to " + output.getAbsolutePath());
                if (!excluded.isEmpty()) {
                    System.out.println("Excluded " + excluded.size() + " tables: " + String.join(", ", excluded));
                }
            } else {
                System.out.println(mapper.writeValueAsString(result));
                if (!excluded.isEmpty()) {
                    System.err.println("Excluded " + excluded.size() + " tables: " + String.join(", ", excluded));
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
