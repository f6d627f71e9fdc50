package com.syncgen.schemagen.introspect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Introspects one PostgreSQL schema over JDBC.
 * Executes the queries from {@link PostgresQueries} sequentially on a single read-only
 * connection and assembles an {@link IntrospectionResult}.
 */
public class DatabaseIntrospector {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseIntrospector.class);

    private final String jdbcUrl;
    private final String username;
    private final String password;

    public DatabaseIntrospector(String jdbcUrl, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
    }

    public DatabaseIntrospector(String jdbcUrl) {
        this(jdbcUrl, null, null);
    }

    public IntrospectionResult introspect(String schema) throws SQLException {
        logger.info("Introspecting schema '{}' of {}", schema, jdbcUrl);

        try (Connection conn = connect()) {
            return introspect(conn, schema);
        }
    }

    /** Introspects over a caller-owned connection. The connection is left open. */
    public static IntrospectionResult introspect(Connection conn, String schema) throws SQLException {
        conn.setReadOnly(true);

        List<TableInfo> tables = queryTables(conn, schema);
        List<ColumnInfo> columns = queryColumns(conn, schema);
        List<PrimaryKeyInfo> primaryKeys = queryPrimaryKeys(conn, schema);
        List<ForeignKeyInfo> foreignKeys = queryForeignKeys(conn, schema);
        List<IndexInfo> indexes = queryIndexes(conn, schema);
        List<ConstraintInfo> constraints = queryConstraints(conn, schema);

        logger.info("Introspection complete: {} tables, {} columns, {} PKs, {} FKs, {} indexes, {} constraints",
                tables.size(), columns.size(), primaryKeys.size(),
                foreignKeys.size(), indexes.size(), constraints.size());

        return new IntrospectionResult(tables, columns, primaryKeys, foreignKeys, indexes, constraints);
    }

    public Connection connect() throws SQLException {
        if (username != null) {
            return DriverManager.getConnection(jdbcUrl, username, password);
        }
        return DriverManager.getConnection(jdbcUrl);
    }

    private static List<TableInfo> queryTables(Connection conn, String schema) throws SQLException {
        List<TableInfo> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.TABLES)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new TableInfo(
                            rs.getString("table_schema"),
                            rs.getString("table_name")
                    ));
                }
            }
        }
        return result;
    }

    private static List<ColumnInfo> queryColumns(Connection conn, String schema) throws SQLException {
        List<ColumnInfo> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.COLUMNS)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new ColumnInfo(
                            rs.getString("table_schema"),
                            rs.getString("table_name"),
                            rs.getString("column_name"),
                            rs.getString("data_type"),
                            rs.getString("udt_name"),
                            getIntOrNull(rs, "character_maximum_length"),
                            getIntOrNull(rs, "numeric_precision"),
                            getIntOrNull(rs, "numeric_scale"),
                            "YES".equals(rs.getString("is_nullable")),
                            rs.getString("column_default"),
                            rs.getInt("ordinal_position"),
                            rs.getString("column_comment")
                    ));
                }
            }
        }
        return result;
    }

    private static List<PrimaryKeyInfo> queryPrimaryKeys(Connection conn, String schema) throws SQLException {
        List<PrimaryKeyInfo> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.PRIMARY_KEYS)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new PrimaryKeyInfo(
                            rs.getString("table_schema"),
                            rs.getString("table_name"),
                            rs.getString("column_name"),
                            rs.getInt("ordinal_position")
                    ));
                }
            }
        }
        return result;
    }

    private static List<ForeignKeyInfo> queryForeignKeys(Connection conn, String schema) throws SQLException {
        List<ForeignKeyInfo> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.FOREIGN_KEYS)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new ForeignKeyInfo(
                            rs.getString("constraint_name"),
                            rs.getString("child_schema"),
                            rs.getString("child_table"),
                            rs.getString("child_column"),
                            rs.getString("parent_schema"),
                            rs.getString("parent_table"),
                            rs.getString("parent_column"),
                            rs.getString("update_rule"),
                            rs.getString("delete_rule"),
                            rs.getInt("ordinal_position")
                    ));
                }
            }
        }
        return result;
    }

    private static List<IndexInfo> queryIndexes(Connection conn, String schema) throws SQLException {
        List<IndexInfo> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.INDEXES)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String names = rs.getString("column_names");
                    List<String> columns = names == null || names.isEmpty()
                            ? List.of()
                            : Arrays.asList(names.split(","));
                    result.add(new IndexInfo(
                            rs.getString("table_schema"),
                            rs.getString("table_name"),
                            rs.getString("index_name"),
                            columns,
                            rs.getBoolean("is_unique"),
                            rs.getString("index_method"),
                            rs.getString("index_predicate")
                    ));
                }
            }
        }
        return result;
    }

    private static List<ConstraintInfo> queryConstraints(Connection conn, String schema) throws SQLException {
        List<ConstraintInfo> result = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(PostgresQueries.CONSTRAINTS)) {
            stmt.setString(1, schema);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String type = rs.getString("constraint_type");
                    String definition = "CHECK".equals(type)
                            ? rs.getString("check_clause")
                            : rs.getString("unique_columns");
                    result.add(new ConstraintInfo(
                            rs.getString("table_schema"),
                            rs.getString("table_name"),
                            rs.getString("constraint_name"),
                            type,
                            definition
                    ));
                }
            }
        }
        return result;
    }

    private static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
