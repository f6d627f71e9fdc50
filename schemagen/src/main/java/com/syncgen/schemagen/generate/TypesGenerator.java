package com.syncgen.schemagen.generate;

import com.syncgen.schemagen.model.Column;
import com.syncgen.schemagen.model.Schema;
import com.syncgen.schemagen.model.Table;
import com.syncgen.schemagen.naming.Inflector;
import com.syncgen.schemagen.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Record interfaces for every table plus {@code TableNames} and {@code ModelNames} unions.
 */
public class TypesGenerator {
    private static final Logger logger = LoggerFactory.getLogger(TypesGenerator.class);

    private final HandlebarsEngine engine;
    private final TypeMapper typeMapper;

    public TypesGenerator(HandlebarsEngine engine, TypeMapper typeMapper) {
        this.engine = engine;
        this.typeMapper = typeMapper;
    }

    public GeneratedArtifact generate(Schema schema, Path path) throws IOException {
        List<InterfaceDefinition> interfaces = new ArrayList<>();
        for (Table table : schema.tables()) {
            interfaces.add(interfaceFor(table));
        }

        Map<String, Object> context = new HashMap<>();
        context.put("interfaces", interfaces);
        context.put("tableNames", schema.tableNames());
        context.put("modelNames", interfaces.stream().map(InterfaceDefinition::name).toList());

        logger.info("  Generating {} ({} interfaces)", path.getFileName(), interfaces.size());
        return new GeneratedArtifact(path, ArtifactKind.TYPES, engine.render("types", context));
    }

    InterfaceDefinition interfaceFor(Table table) {
        List<FieldDefinition> fields = new ArrayList<>();
        for (Column column : table.columns()) {
            fields.add(new FieldDefinition(column.name(), typeMapper.fieldType(table.name(), column),
                    false, column.nullable() && !column.primaryKey()));
        }
        return new InterfaceDefinition(Inflector.classify(table.name()), table.name(), fields);
    }
}
