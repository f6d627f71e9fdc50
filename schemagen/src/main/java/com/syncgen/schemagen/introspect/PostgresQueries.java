package com.syncgen.schemagen.introspect;

/**
 * SQL queries for PostgreSQL catalog introspection.
 * <p>
 * Every query takes the schema name as its single parameter and returns rows in
 * deterministic order.
 */
public final class PostgresQueries {
    private PostgresQueries() {}

    public static final String TABLES = """
            SELECT table_schema,
                   table_name
            FROM information_schema.tables
            WHERE table_type = 'BASE TABLE'
              AND table_schema = ?
            ORDER BY table_name
            """;

    public static final String COLUMNS = """
            SELECT c.table_schema,
                   c.table_name,
                   c.column_name,
                   c.data_type,
                   c.udt_name,
                   c.character_maximum_length,
                   c.numeric_precision,
                   c.numeric_scale,
                   c.is_nullable,
                   c.column_default,
                   c.ordinal_position,
                   col_description(format('%I.%I', c.table_schema, c.table_name)::regclass,
                                   c.ordinal_position::int) AS column_comment
            FROM information_schema.columns c
            JOIN information_schema.tables t
              ON t.table_schema = c.table_schema
             AND t.table_name = c.table_name
             AND t.table_type = 'BASE TABLE'
            WHERE c.table_schema = ?
            ORDER BY c.table_name, c.ordinal_position
            """;

    public static final String PRIMARY_KEYS = """
            SELECT tc.table_schema,
                   tc.table_name,
                   kcu.column_name,
                   kcu.ordinal_position
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
            WHERE tc.constraint_type = 'PRIMARY KEY'
              AND tc.table_schema = ?
            ORDER BY tc.table_name, kcu.ordinal_position
            """;

    public static final String FOREIGN_KEYS = """
            SELECT tc.constraint_name,
                   tc.table_schema AS child_schema,
                   tc.table_name AS child_table,
                   kcu.column_name AS child_column,
                   pku.table_schema AS parent_schema,
                   pku.table_name AS parent_table,
                   pku.column_name AS parent_column,
                   rc.update_rule,
                   rc.delete_rule,
                   kcu.ordinal_position
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
            JOIN information_schema.referential_constraints rc
              ON rc.constraint_name = tc.constraint_name
             AND rc.constraint_schema = tc.table_schema
            JOIN information_schema.key_column_usage pku
              ON pku.constraint_name = rc.unique_constraint_name
             AND pku.constraint_schema = rc.unique_constraint_schema
             AND pku.ordinal_position = kcu.position_in_unique_constraint
            WHERE tc.constraint_type = 'FOREIGN KEY'
              AND tc.table_schema = ?
            ORDER BY tc.table_name, tc.constraint_name, kcu.ordinal_position
            """;

    public static final String INDEXES = """
            SELECT n.nspname AS table_schema,
                   t.relname AS table_name,
                   i.relname AS index_name,
                   ix.indisunique AS is_unique,
                   am.amname AS index_method,
                   pg_get_expr(ix.indpred, ix.indrelid) AS index_predicate,
                   array_to_string(ARRAY(
                       SELECT a.attname
                       FROM unnest(ix.indkey::int2[]) WITH ORDINALITY AS k(attnum, ord)
                       JOIN pg_attribute a
                         ON a.attrelid = t.oid
                        AND a.attnum = k.attnum
                       ORDER BY k.ord
                   ), ',') AS column_names
            FROM pg_index ix
            JOIN pg_class t ON t.oid = ix.indrelid
            JOIN pg_class i ON i.oid = ix.indexrelid
            JOIN pg_namespace n ON n.oid = t.relnamespace
            JOIN pg_am am ON am.oid = i.relam
            WHERE NOT ix.indisprimary
              AND n.nspname = ?
            ORDER BY t.relname, i.relname
            """;

    public static final String CONSTRAINTS = """
            SELECT tc.table_schema,
                   tc.table_name,
                   tc.constraint_name,
                   tc.constraint_type,
                   cc.check_clause,
                   (SELECT string_agg(kcu.column_name, ', ' ORDER BY kcu.ordinal_position)
                    FROM information_schema.key_column_usage kcu
                    WHERE kcu.constraint_name = tc.constraint_name
                      AND kcu.constraint_schema = tc.constraint_schema) AS unique_columns
            FROM information_schema.table_constraints tc
            LEFT JOIN information_schema.check_constraints cc
              ON cc.constraint_name = tc.constraint_name
             AND cc.constraint_schema = tc.constraint_schema
            WHERE tc.constraint_type IN ('CHECK', 'UNIQUE')
              AND tc.constraint_name NOT LIKE '%\\_not\\_null'
              AND tc.table_schema = ?
            ORDER BY tc.table_name, tc.constraint_name
            """;

    /** Identifier quoting for the dynamic statistics queries. */
    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
