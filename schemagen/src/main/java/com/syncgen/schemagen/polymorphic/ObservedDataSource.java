package com.syncgen.schemagen.polymorphic;

import com.syncgen.schemagen.model.UsageStatistics;

import java.sql.SQLException;
import java.util.List;

/**
 * Read access to live rows of polymorphic tables, used for discovery statistics only.
 */
public interface ObservedDataSource {

    /** Distinct non-null values of {@code typeColumn}, sorted. */
    List<String> distinctTypes(String table, String typeColumn) throws SQLException;

    /**
     * Row count with a non-null type, and the earliest and latest value of
     * {@code timestampColumn} when one is given.
     */
    UsageStatistics statistics(String table, String typeColumn, String timestampColumn) throws SQLException;
}
