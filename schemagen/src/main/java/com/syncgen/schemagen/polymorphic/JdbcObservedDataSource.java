package com.syncgen.schemagen.polymorphic;

import com.syncgen.schemagen.model.UsageStatistics;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static com.syncgen.schemagen.introspect.PostgresQueries.quoteIdentifier;

/**
 * {@link ObservedDataSource} over a caller-owned JDBC connection.
 */
public class JdbcObservedDataSource implements ObservedDataSource {
    private final Connection connection;
    private final String schema;

    public JdbcObservedDataSource(Connection connection, String schema) {
        this.connection = connection;
        this.schema = schema;
    }

    @Override
    public List<String> distinctTypes(String table, String typeColumn) throws SQLException {
        String column = quoteIdentifier(typeColumn);
        String sql = "SELECT DISTINCT " + column + " AS type_value FROM " + qualified(table)
                + " WHERE " + column + " IS NOT NULL ORDER BY " + column;
        List<String> result = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                result.add(rs.getString("type_value"));
            }
        }
        return result;
    }

    @Override
    public UsageStatistics statistics(String table, String typeColumn, String timestampColumn) throws SQLException {
        String column = quoteIdentifier(typeColumn);
        String range = timestampColumn == null
                ? "NULL AS first_seen, NULL AS last_seen"
                : "MIN(" + quoteIdentifier(timestampColumn) + ")::text AS first_seen, MAX("
                        + quoteIdentifier(timestampColumn) + ")::text AS last_seen";
        String sql = "SELECT COUNT(*) AS total_records, " + range + " FROM " + qualified(table)
                + " WHERE " + column + " IS NOT NULL";
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            if (!rs.next()) {
                return UsageStatistics.empty();
            }
            return new UsageStatistics(
                    rs.getLong("total_records"),
                    rs.getString("first_seen"),
                    rs.getString("last_seen"));
        }
    }

    private String qualified(String table) {
        return quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }
}
