package com.syncgen.schemagen;

import com.syncgen.schemagen.change.ChangeDetector;
import com.syncgen.schemagen.change.CustomizationDetector;
import com.syncgen.schemagen.change.GenerationManifest;
import com.syncgen.schemagen.change.ManifestStore;
import com.syncgen.schemagen.change.SchemaChanges;
import com.syncgen.schemagen.config.ConfigLoader;
import com.syncgen.schemagen.config.ConfigValidation;
import com.syncgen.schemagen.config.ConfigurationException;
import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.generate.ArtifactKind;
import com.syncgen.schemagen.generate.ArtifactWriter;
import com.syncgen.schemagen.generate.DeclarationEntry;
import com.syncgen.schemagen.generate.GeneratedArtifact;
import com.syncgen.schemagen.generate.HandlebarsEngine;
import com.syncgen.schemagen.generate.MutationGenerator;
import com.syncgen.schemagen.generate.SchemaGenerator;
import com.syncgen.schemagen.generate.SchemaValidator;
import com.syncgen.schemagen.generate.TypesGenerator;
import com.syncgen.schemagen.generate.ValidationResult;
import com.syncgen.schemagen.introspect.IntrospectionResult;
import com.syncgen.schemagen.introspect.SchemaIntrospector;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.pattern.PatternReport;
import com.syncgen.schemagen.pattern.TablePatterns;
import com.syncgen.schemagen.polymorphic.DiscoveryDocument;
import com.syncgen.schemagen.polymorphic.ObservedDataSource;
import com.syncgen.schemagen.polymorphic.PolymorphicDeclarationCollector;
import com.syncgen.schemagen.polymorphic.PolymorphicDeclarations;
import com.syncgen.schemagen.polymorphic.PolymorphicResolver;
import com.syncgen.schemagen.registry.EntityRegistry;
import com.syncgen.schemagen.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one generation pass: introspect, resolve, generate in memory, validate, detect changes,
 * then write. Validation or configuration errors abort before any file is touched.
 */
public class GenerationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(GenerationPipeline.class);

    private final GeneratorConfig config;
    private final EntityRegistry registry;
    private final HandlebarsEngine engine;
    private final ArtifactWriter writer;
    private final ManifestStore manifestStore;
    private final SchemaValidator validator = new SchemaValidator();
    private final ChangeDetector changeDetector = new ChangeDetector();
    private final CustomizationDetector customizationDetector = new CustomizationDetector();

    public GenerationPipeline(GeneratorConfig config, EntityRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.engine = new HandlebarsEngine();
        this.writer = new ArtifactWriter();
        this.manifestStore = new ManifestStore(writer);
    }

    /**
     * @param observed live data for polymorphic statistics; null when working from a saved introspection
     */
    public GenerationReport run(IntrospectionResult raw, ObservedDataSource observed) throws IOException {
        List<String> warnings = new ArrayList<>();

        ConfigValidation configValidation = ConfigLoader.validate(config);
        if (!configValidation.valid()) {
            throw new ConfigurationException(configValidation.errors());
        }
        warnings.addAll(configValidation.warnings());

        GenerationManifest manifest = manifestStore.load(config.manifestPath());

        logger.info("Extracting schema");
        SchemaIntrospector introspector = new SchemaIntrospector(registry, config);
        Schema schema = introspector.extractSchema(raw);
        warnings.addAll(introspector.warnings());

        logger.info("Resolving polymorphic associations");
        PolymorphicDeclarationCollector collector = new PolymorphicDeclarationCollector();
        PolymorphicDeclarations declarations = collector.collect(config.declarationRoots())
                .withoutUnedited(manifest.seededDeclarations());
        warnings.addAll(collector.warnings());
        PolymorphicResolver resolver = new PolymorphicResolver(registry, declarations, observed, config);
        List<PolymorphicAssociation> polymorphic = resolver.resolve(schema);
        warnings.addAll(resolver.warnings());
        DiscoveryDocument discovery = DiscoveryDocument.of(polymorphic);

        logger.info("Generating artifacts");
        TypeMapper typeMapper = TypeMapper.from(config);
        SchemaGenerator schemaGenerator = new SchemaGenerator(engine, typeMapper);
        GeneratedArtifact schemaArtifact = schemaGenerator.generate(schema, polymorphic, config.schemaPath());
        warnings.addAll(schemaGenerator.warnings());

        ValidationResult validation = validator.validateOrThrow(schemaArtifact.text());
        warnings.addAll(validation.warnings());

        GeneratedArtifact typesArtifact = new TypesGenerator(engine, typeMapper).generate(schema, config.typesPath());

        String priorSchema = readIfExists(config.schemaPath());
        SchemaChanges changes = changeDetector.detect(priorSchema, schemaArtifact.text());

        List<GeneratedArtifact> artifacts = new ArrayList<>();
        artifacts.add(withCustomizations(schemaArtifact, priorSchema));
        artifacts.add(withCustomizations(typesArtifact, readIfExists(config.typesPath())));

        Map<String, GenerationManifest.TableEntry> tableEntries = new LinkedHashMap<>();
        Map<String, String> fileHashes = new LinkedHashMap<>();
        Map<String, List<String>> seeded = new LinkedHashMap<>(manifest.seededDeclarations());
        List<String> generated = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        if (config.generateMutations()) {
            MutationGenerator mutationGenerator = new MutationGenerator(engine, typeMapper, config);
            for (Table table : schema.tables()) {
                TablePatterns patterns = schema.patternsFor(table.name());
                GenerationManifest.TableEntry entry = new GenerationManifest.TableEntry(
                        ManifestStore.patternHash(patterns), ManifestStore.columnHash(table));
                tableEntries.put(table.name(), entry);

                GeneratedArtifact module = mutationGenerator.generate(table, patterns);
                String existing = readIfExists(module.path());
                String key = relativeKey(module.path());

                if (existing != null && !config.forceGeneration() && !MutationGenerator.isGeneratedByUs(existing)) {
                    warnings.add(module.path() + " was not generated by this tool; leaving it untouched (use force to overwrite)");
                    skipped.add(table.name());
                    continue;
                }
                if (existing != null && unchanged(manifest, table.name(), entry)) {
                    logger.debug("Patterns of {} unchanged, skipping mutations", table.name());
                    skipped.add(table.name());
                    String previousHash = manifest.fileHash(key);
                    fileHashes.put(key, previousHash != null ? previousHash : ManifestStore.sha256(existing));
                    continue;
                }

                artifacts.add(withCustomizations(module, existing));
                generated.add(table.name());

                GeneratedArtifact scaffold = mutationGenerator.scaffold(table, patterns, polymorphic);
                if (!Files.exists(scaffold.path())) {
                    artifacts.add(scaffold);
                    seeded.keySet().removeIf(seededKey -> seededKey.startsWith(table.name() + "."));
                    for (DeclarationEntry declaration : MutationGenerator.declarations(table, polymorphic)) {
                        seeded.put(table.name() + "." + declaration.name(), declaration.allowedTypes());
                    }
                }
            }
        }

        artifacts.add(new GeneratedArtifact(config.discoveryPath(), ArtifactKind.DISCOVERY, discovery.toYaml()));

        Map<Path, List<String>> customizations = new LinkedHashMap<>();
        List<Path> handEdited = new ArrayList<>();
        for (GeneratedArtifact artifact : artifacts) {
            if (!artifact.customizationWarnings().isEmpty()) {
                customizations.put(artifact.path(), artifact.customizationWarnings());
            }
            if (artifact.kind() == ArtifactKind.CUSTOM_SCAFFOLD) continue;

            String key = relativeKey(artifact.path());
            String recorded = manifest.fileHash(key);
            String onDisk = readIfExists(artifact.path());
            if (recorded != null && onDisk != null && !recorded.equals(ManifestStore.sha256(onDisk))) {
                handEdited.add(artifact.path());
                warnings.add(artifact.path() + " was edited by hand since the last run");
            }
            fileHashes.put(key, ManifestStore.sha256(artifact.text()));
        }

        List<Path> written = new ArrayList<>();
        if (config.dryRun()) {
            logger.info("Dry run: {} artifacts not written", artifacts.size());
            artifacts.forEach(a -> written.add(a.path()));
        } else {
            for (GeneratedArtifact artifact : artifacts) {
                writer.write(artifact);
                written.add(artifact.path());
            }
            manifestStore.save(config.manifestPath(),
                    new GenerationManifest(GenerationManifest.CURRENT_VERSION, tableEntries, fileHashes, seeded));
        }

        logger.info("Generation complete: {} tables, {} mutation modules generated, {} skipped",
                schema.tables().size(), generated.size(), skipped.size());

        return new GenerationReport(generated, skipped, written, warnings, changes, customizations, handEdited,
                validation, PatternReport.of(schema.patterns()), discovery, config.dryRun());
    }

    private boolean unchanged(GenerationManifest manifest, String table, GenerationManifest.TableEntry entry) {
        return config.incrementalGeneration()
                && !config.forceGeneration()
                && entry.equals(manifest.table(table));
    }

    private GeneratedArtifact withCustomizations(GeneratedArtifact artifact, String existing) {
        List<String> findings = customizationDetector.detect(existing, artifact.text());
        findings.forEach(f -> logger.warn("{}: {}", artifact.path().getFileName(), f));
        return artifact.withCustomizationWarnings(findings);
    }

    private String relativeKey(Path path) {
        return config.outputPath().normalize().relativize(path.normalize()).toString().replace('\\', '/');
    }

    private static String readIfExists(Path path) throws IOException {
        return Files.isRegularFile(path) ? Files.readString(path) : null;
    }
}
