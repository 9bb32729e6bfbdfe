package com.booking.sync.core.builder;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Database level prerequisites of a storage engine. Must be idempotent.
 */
public interface DatabaseBuilder {

    void setUseChangeTracking(boolean useChangeTracking);

    void setUseBulkProcedures(boolean useBulkProcedures);

    void ensureDatabase(Connection connection) throws SQLException;
}
