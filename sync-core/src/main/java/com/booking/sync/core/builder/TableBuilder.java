package com.booking.sync.core.builder;

import com.booking.sync.model.schema.SyncFilter;
import com.booking.sync.model.schema.SyncTable;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Per table DDL primitives of a storage engine.
 * <p>
 * Every create method treats an existing artifact as success and every drop method treats a missing one as success,
 * so provisioning the same schema twice leaves the same artifacts in place.
 */
public interface TableBuilder {

    SyncTable getTable();

    void setUseBulkProcedures(boolean useBulkProcedures);

    void setUseChangeTracking(boolean useChangeTracking);

    void setFilter(SyncFilter filter);

    void createTable(Connection connection) throws SQLException;

    void createTrackingTable(Connection connection) throws SQLException;

    void createTriggers(Connection connection) throws SQLException;

    void createStoredProcedures(Connection connection) throws SQLException;

    void createForeignKeys(Connection connection) throws SQLException;

    void dropTable(Connection connection) throws SQLException;

    void dropTrackingTable(Connection connection) throws SQLException;

    void dropTriggers(Connection connection) throws SQLException;

    void dropProcedures(Connection connection) throws SQLException;

    /**
     * Removes tracking rows older than the given timestamp.
     *
     * @return the number of rows removed
     */
    int deleteMetadata(Connection connection, long timestampLimit) throws SQLException;
}
