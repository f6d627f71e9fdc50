package com.syncgen.schemagen.cli;

import com.syncgen.schemagen.GenerationPipeline;
import com.syncgen.schemagen.GenerationReport;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.introspect.DatabaseIntrospector;
import com.syncgen.schemagen.introspect.IntrospectionResult;
import com.syncgen.schemagen.polymorphic.JdbcObservedDataSource;
import com.syncgen.schemagen.registry.EntityRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.File;
import java.sql.Connection;
import java.util.concurrent.Callable;

@Command(
        name = "generate",
        description = "Generate the sync schema, record types and mutation modules",
        mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    @Mixin
    private SourceOptions source;

    @Option(names = {"--output", "-o"}, description = "Output directory (overrides the configuration)")
    private File outputDir;

    @Option(names = {"--dry-run"}, description = "Report what would be written without writing")
    private boolean dryRun;

    @Option(names = {"--force", "-f"}, description = "Regenerate everything and overwrite files not created by this tool")
    private boolean force;

    @Option(names = {"--no-mutations"}, description = "Only generate the schema and types")
    private boolean noMutations;

    @Override
    public Integer call() {
        try {
            GeneratorConfig.Builder builder = source.loadConfig().toBuilder();
            if (outputDir != null) builder.outputDirectory(outputDir.getPath());
            if (dryRun) builder.dryRun(true);
            if (force) builder.forceGeneration(true);
            if (noMutations) builder.generateMutations(false);
            GeneratorConfig config = builder.build();

            EntityRegistry registry = source.loadRegistry();
            GenerationPipeline pipeline = new GenerationPipeline(config, registry);

            GenerationReport report;
            if (source.live()) {
                DatabaseIntrospector introspector = source.introspector();
                try (Connection conn = introspector.connect()) {
                    IntrospectionResult raw = DatabaseIntrospector.introspect(conn, config.schema());
                    report = pipeline.run(raw, new JdbcObservedDataSource(conn, config.schema()));
                }
            } else {
                report = pipeline.run(source.readIntrospection(), null);
            }

            System.out.print(report.render());
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
