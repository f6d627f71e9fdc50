package com.syncgen.schemagen.generate;

import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.model.Column;
import com.syncgen.schemagen.model.ColumnKind;
import com.syncgen.schemagen.model.PolymorphicAssociation;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.naming.Inflector;
import com.syncgen.schemagen.pattern.EnumField;
import com.syncgen.schemagen.pattern.Positioning;
import com.syncgen.schemagen.pattern.SoftDeletion;
import com.syncgen.schemagen.pattern.TablePatterns;
import com.syncgen.schemagen.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-table mutation modules: typed inputs, create/update/delete/upsert, pattern-driven
 * operations and a reactive query facade. Also renders the once-only custom scaffold.
 */
public class MutationGenerator {
    private static final Logger logger = LoggerFactory.getLogger(MutationGenerator.class);

    /** First content line of every generated mutation module. */
    public static final String GENERATED_HEADER = "// AUTO-GENERATED SYNC MUTATIONS";

    private static final Set<String> TIMESTAMP_COLUMNS = Set.of("created_at", "updated_at");
    private static final String ZERO_CLIENT_MODULE = "zero-client";
    private static final String POLYMORPHIC_MODULE = "polymorphic";

    private final HandlebarsEngine engine;
    private final TypeMapper typeMapper;
    private final GeneratorConfig config;

    public MutationGenerator(HandlebarsEngine engine, TypeMapper typeMapper, GeneratorConfig config) {
        this.engine = engine;
        this.typeMapper = typeMapper;
        this.config = config;
    }

    public GeneratedArtifact generate(Table table, TablePatterns patterns) throws IOException {
        MutationModule module = module(table, patterns);
        logger.info("  Generating {}", module.generatedFileName());
        Map<String, Object> context = new HashMap<>();
        context.put("module", module);
        context.put("header", GENERATED_HEADER);
        return new GeneratedArtifact(config.mutationsPath().resolve(module.generatedFileName()),
                ArtifactKind.MUTATIONS, engine.render("mutations", context));
    }

    /**
     * @param polymorphic all resolved associations; those of {@code table} with targets are
     *                    declared in the scaffold so later runs read them back
     */
    public GeneratedArtifact scaffold(Table table, TablePatterns patterns, List<PolymorphicAssociation> polymorphic)
            throws IOException {
        MutationModule module = module(table, patterns);
        Map<String, Object> context = new HashMap<>();
        context.put("module", module);
        context.put("declarations", declarations(table, polymorphic));
        context.put("polymorphicImport", importPath(config.outputPath().resolve(POLYMORPHIC_MODULE)));
        return new GeneratedArtifact(config.mutationsPath().resolve(module.customFileName()),
                ArtifactKind.CUSTOM_SCAFFOLD, engine.render("mutations-custom", context));
    }

    public static List<DeclarationEntry> declarations(Table table, List<PolymorphicAssociation> polymorphic) {
        return polymorphic.stream()
                .filter(a -> a.table().equals(table.name()) && a.isResolved())
                .map(DeclarationEntry::of)
                .toList();
    }

    public static boolean isGeneratedByUs(String content) {
        return content.contains(GENERATED_HEADER);
    }

    public MutationModule module(Table table, TablePatterns patterns) {
        String singular = Inflector.singularize(table.name());
        String className = Inflector.classify(table.name());
        String primaryKey = table.primaryKey() != null ? table.primaryKey() : "id";

        SoftDeletion softDeletion = patterns.softDeletion();
        Positioning positioning = patterns.positioning();

        Set<String> derived = new HashSet<>();
        patterns.normalizedFields().forEach(f -> derived.add(f.column()));
        patterns.timestampPairs().forEach(p -> derived.add(p.flagColumn()));

        List<FieldDefinition> recordFields = new ArrayList<>();
        List<FieldDefinition> createFields = new ArrayList<>();
        List<FieldDefinition> updateFields = new ArrayList<>();
        List<MutationModule.RequiredCheck> requiredChecks = new ArrayList<>();
        List<String> uuidFields = new ArrayList<>();

        for (Column column : table.columns()) {
            String type = typeMapper.fieldType(table.name(), column);
            boolean isKey = column.name().equals(primaryKey);
            recordFields.add(new FieldDefinition(column.name(), type, false, column.nullable() && !isKey));

            boolean softDeleteMarker = softDeletion != null && softDeletion.column().equals(column.name());
            if (isKey || TIMESTAMP_COLUMNS.contains(column.name()) || softDeleteMarker) {
                continue;
            }

            boolean optional = column.nullable()
                    || column.hasDefault()
                    || derived.contains(column.name())
                    || (positioning != null && positioning.column().equals(column.name()));
            createFields.add(new FieldDefinition(column.name(), type, optional, column.nullable()));
            updateFields.add(new FieldDefinition(column.name(), type, true, column.nullable()));

            if (!optional) {
                requiredChecks.add(new MutationModule.RequiredCheck(
                        column.name(), Inflector.humanize(column.name()), type.equals("string")));
            }
            if (column.kind() == ColumnKind.UUID) {
                uuidFields.add(column.name());
            }
        }

        return new MutationModule(
                table.name(),
                singular,
                className,
                primaryKey,
                importPath(config.outputPath().resolve(ZERO_CLIENT_MODULE)),
                importPath(config.schemaPath()),
                recordFields,
                createFields,
                updateFields,
                requiredChecks,
                uuidFields,
                table.hasColumn("created_at"),
                table.hasColumn("updated_at"),
                softDeleteOps(softDeletion, className),
                positionOps(positioning, className),
                statusOp(patterns, singular, className),
                patterns.normalizedFields(),
                patterns.timestampPairs(),
                enumTransitions(patterns, className),
                scopes(softDeletion));
    }

    private MutationModule.SoftDeleteOps softDeleteOps(SoftDeletion softDeletion, String className) {
        if (softDeletion == null) return null;
        if (softDeletion.convention() == SoftDeletion.Convention.DISCARD) {
            return new MutationModule.SoftDeleteOps(softDeletion.column(),
                    "discard" + className, "undiscard" + className);
        }
        return new MutationModule.SoftDeleteOps(softDeletion.column(),
                operationName("softDelete", className), operationName("restore", className));
    }

    private MutationModule.PositionOps positionOps(Positioning positioning, String className) {
        if (positioning == null) return null;
        String scope = positioning.scopes().isEmpty() ? null : positioning.scopes().get(0);
        return new MutationModule.PositionOps(
                positioning.column(),
                scope,
                operationName("moveBefore", className),
                operationName("moveAfter", className),
                operationName("moveToTop", className),
                operationName("moveToBottom", className));
    }

    private static MutationModule.StatusOp statusOp(TablePatterns patterns, String singular, String className) {
        return patterns.enumFor("status")
                .map(e -> new MutationModule.StatusOp(
                        e.column(),
                        "update" + className + "Status",
                        Inflector.underscore(singular).toUpperCase(Locale.ROOT) + "_STATUS_VALUES",
                        e.values(),
                        TypeMapper.literals(e.values(), ", ")))
                .orElse(null);
    }

    private static List<MutationModule.EnumTransition> enumTransitions(TablePatterns patterns, String className) {
        List<MutationModule.EnumTransition> result = new ArrayList<>();
        for (EnumField field : patterns.enums()) {
            result.add(new MutationModule.EnumTransition(field.column(),
                    "transition" + className + Inflector.pascalCase(field.column()), field.values()));
        }
        return result;
    }

    private static List<MutationModule.ScopeQuery> scopes(SoftDeletion softDeletion) {
        if (softDeletion == null) return List.of();
        if (softDeletion.convention() == SoftDeletion.Convention.DISCARD) {
            return List.of(
                    new MutationModule.ScopeQuery("kept", softDeletion.column(), "IS"),
                    new MutationModule.ScopeQuery("discarded", softDeletion.column(), "IS NOT"));
        }
        return List.of(
                new MutationModule.ScopeQuery("active", softDeletion.column(), "IS"),
                new MutationModule.ScopeQuery("deleted", softDeletion.column(), "IS NOT"));
    }

    private String operationName(String standard, String className) {
        return Inflector.camelCase(config.customName(standard)) + className;
    }

    /** Module specifier of {@code target} as imported from the mutations directory, without extension. */
    private String importPath(Path target) {
        String relative = config.mutationsPath().normalize()
                .relativize(target.normalize())
                .toString()
                .replace('\\', '/');
        if (relative.endsWith(".ts")) {
            relative = relative.substring(0, relative.length() - 3);
        }
        return relative.startsWith(".") ? relative : "./" + relative;
    }
}
