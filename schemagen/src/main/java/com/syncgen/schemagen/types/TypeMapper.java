package com.syncgen.schemagen.types;

import com.syncgen.schemagen.config.GeneratorConfig;
import com.syncgen.schemagen.model.Column;
import com.syncgen.schemagen.model.ColumnKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps columns to sync-schema column builder expressions such as {@code string().optional()}.
 * <p>
 * Resolution order for the base expression:
 * <ol>
 *   <li>per-table-and-column override ({@code tasks.metadata})</li>
 *   <li>column-name override; time and ordering columns are numeric on the client</li>
 *   <li>declared enum values, as an {@code enumeration<...>()} literal union</li>
 *   <li>the kind table</li>
 *   <li>{@code string()} with a warning</li>
 * </ol>
 * Nullable columns are wrapped with {@code .optional()} unless they are the primary key.
 */
public class TypeMapper {
    private static final Logger logger = LoggerFactory.getLogger(TypeMapper.class);

    public static final Map<String, String> DEFAULT_COLUMN_OVERRIDES = defaultColumnOverrides();

    private static final Map<ColumnKind, String> KIND_EXPRESSIONS = kindExpressions();

    private final Map<String, String> typeOverrides;
    private final Map<String, String> columnOverrides;
    private final Set<String> warnings = new LinkedHashSet<>();

    public TypeMapper() {
        this(Map.of(), Map.of());
    }

    public TypeMapper(Map<String, String> typeOverrides, Map<String, String> columnOverrides) {
        this.typeOverrides = new LinkedHashMap<>(typeOverrides);
        this.columnOverrides = new LinkedHashMap<>(DEFAULT_COLUMN_OVERRIDES);
        this.columnOverrides.putAll(columnOverrides);
    }

    public static TypeMapper from(GeneratorConfig config) {
        return new TypeMapper(config.typeOverrides(), config.columnOverrides());
    }

    public String map(String table, Column column) {
        String base = baseExpression(table, column);
        if (column.primaryKey() || !column.nullable()) {
            return base;
        }
        return base + ".optional()";
    }

    public String baseExpression(String table, Column column) {
        String override = typeOverrides.get(table + "." + column.name());
        if (override != null) return override;

        override = columnOverrides.get(column.name());
        if (override != null) return override;

        if (column.isEnum()) {
            return "enumeration<" + literalUnion(column.enumValues()) + ">()";
        }

        String expression = KIND_EXPRESSIONS.get(column.kind());
        if (expression != null) return expression;

        String warning = "Unknown column type '" + column.sqlType() + "' for " + table + "." + column.name()
                + ", defaulting to string()";
        if (warnings.add(warning)) {
            logger.warn(warning);
        }
        return "string()";
    }

    /**
     * TypeScript field type used in generated interfaces and mutation inputs.
     */
    public String fieldType(String table, Column column) {
        if (column.isEnum()) {
            return literalUnion(column.enumValues());
        }
        String base = baseExpression(table, column);
        if (base.startsWith("number(")) return "number";
        if (base.startsWith("boolean(")) return "boolean";
        if (base.startsWith("json(")) return "unknown";
        if (base.startsWith("enumeration<")) {
            return base.substring("enumeration<".length(), base.lastIndexOf(">"));
        }
        return "string";
    }

    public List<String> warnings() {
        return new ArrayList<>(warnings);
    }

    public static String literalUnion(List<String> values) {
        return literals(values, " | ");
    }

    /** Single-quoted TypeScript string literals joined by {@code separator}. */
    public static String literals(List<String> values, String separator) {
        return values.stream()
                .map(TypeMapper::quote)
                .collect(Collectors.joining(separator));
    }

    public static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static Map<String, String> defaultColumnOverrides() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("created_at", "number()");
        map.put("updated_at", "number()");
        map.put("lock_version", "number()");
        map.put("position", "number()");
        map.put("sort_order", "number()");
        return Collections.unmodifiableMap(map);
    }

    private static Map<ColumnKind, String> kindExpressions() {
        Map<ColumnKind, String> map = new EnumMap<>(ColumnKind.class);
        map.put(ColumnKind.UUID, "string()");
        map.put(ColumnKind.STRING, "string()");
        map.put(ColumnKind.TEXT, "string()");
        map.put(ColumnKind.BINARY, "string()");
        map.put(ColumnKind.INTEGER, "number()");
        map.put(ColumnKind.BIGINT, "number()");
        map.put(ColumnKind.DECIMAL, "number()");
        map.put(ColumnKind.FLOAT, "number()");
        map.put(ColumnKind.DATE, "number()");
        map.put(ColumnKind.DATETIME, "number()");
        map.put(ColumnKind.TIMESTAMP, "number()");
        map.put(ColumnKind.TIME, "number()");
        map.put(ColumnKind.BOOLEAN, "boolean()");
        map.put(ColumnKind.JSON, "json()");
        map.put(ColumnKind.JSONB, "json()");
        map.put(ColumnKind.ARRAY, "json()");
        return Collections.unmodifiableMap(map);
    }
}
