package com.syncgen.schemagen.cli;

import com.syncgen.schemagen.change.GenerationManifest;
import com.syncgen.schemagen.change.ManifestStore;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.generate.ArtifactWriter;
import com.syncgen.schemagen.introspect.DatabaseIntrospector;
import com.syncgen.schemagen.introspect.IntrospectionResult;
import com.syncgen.schemagen.introspect.SchemaIntrospector;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.polymorphic.DiscoveryDocument;
import com.syncgen.schemagen.polymorphic.JdbcObservedDataSource;
import com.syncgen.schemagen.polymorphic.ObservedDataSource;
import com.syncgen.schemagen.polymorphic.PolymorphicDeclarationCollector;
import com.syncgen.schemagen.polymorphic.PolymorphicDeclarations;
import com.syncgen.schemagen.polymorphic.PolymorphicResolver;
import com.syncgen.schemagen.registry.EntityRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "discover",
        description = "Resolve polymorphic associations and write the discovery document",
        mixinStandardHelpOptions = true
)
public class DiscoverCommand implements Callable<Integer> {

    @Mixin
    private SourceOptions source;

    @Option(names = {"--output", "-o"}, description = "Discovery document path (default: from configuration)")
    private File output;

    @Override
    public Integer call() {
        try {
            GeneratorConfig config = source.loadConfig();
            EntityRegistry registry = source.loadRegistry();

            DiscoveryDocument document;
            if (source.live()) {
                DatabaseIntrospector introspector = source.introspector();
                try (Connection conn = introspector.connect()) {
                    IntrospectionResult raw = DatabaseIntrospector.introspect(conn, config.schema());
                    document = discover(config, registry, raw, new JdbcObservedDataSource(conn, config.schema()));
                }
            } else {
                document = discover(config, registry, source.readIntrospection(), null);
            }

            Path target = output != null ? output.toPath() : config.discoveryPath();
            new ArtifactWriter().write(target, document.toYaml());
            System.out.print(document.renderReport());
            System.out.println("Discovery document written to " + target.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static DiscoveryDocument discover(GeneratorConfig config, EntityRegistry registry,
                                              IntrospectionResult raw, ObservedDataSource observed) throws IOException {
        Schema schema = new SchemaIntrospector(registry, config).extractSchema(raw);
        GenerationManifest manifest = new ManifestStore(new ArtifactWriter()).load(config.manifestPath());
        PolymorphicDeclarations declarations = new PolymorphicDeclarationCollector()
                .collect(config.declarationRoots())
                .withoutUnedited(manifest.seededDeclarations());
        List<PolymorphicAssociation> associations =
                new PolymorphicResolver(registry, declarations, observed, config).resolve(schema);
        return DiscoveryDocument.of(associations);
    }
}
