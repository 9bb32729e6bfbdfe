package com.booking.sync.core.provider;

import com.booking.sync.core.builder.DatabaseBuilder;
import com.booking.sync.core.builder.ScopeBuilder;
import com.booking.sync.core.builder.TableBuilder;
import com.booking.sync.core.exception.SyncException;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.schema.SyncSetup;
import com.booking.sync.model.schema.SyncTable;

import java.lang.reflect.InvocationTargetException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;

/**
 * Storage engine capabilities consumed by the orchestrators.
 */
public interface SyncProvider {

    interface Configuration {
        String PROVIDER_CLASS = "sync.provider.class";
    }

    String getProviderTypeName();

    /**
     * Opens a new connection. Closing a connection that is already closed must be a no-op, as the
     * {@link Connection#close()} contract requires.
     */
    Connection createConnection() throws SQLException;

    DatabaseBuilder getDatabaseBuilder();

    TableBuilder getTableBuilder(SyncTable table);

    ScopeBuilder getScopeBuilder();

    /**
     * Reads the columns, primary keys and relations of the tables named by the setup.
     */
    SyncSet readSchema(SyncSetup setup, Connection connection) throws SQLException;

    default boolean supportsBulkOperations() {
        return false;
    }

    default boolean useChangeTracking() {
        return false;
    }

    /**
     * Whether the client has fallen behind the server cleanup horizon and needs a reinitialization.
     */
    default boolean isOutdated(long lastCleanupTimestamp, long lastSyncTimestamp) {
        return lastSyncTimestamp < lastCleanupTimestamp;
    }

    default void onConnectionOpened(Connection connection) {
    }

    default void onConnectionClosed(Connection connection) {
    }

    /**
     * Adds engine details (data source, catalog) to an error about to leave an orchestrator.
     */
    default void enrichException(SyncException exception) {
    }

    static SyncProvider build(Map<String, Object> configuration) {
        Object providerClass = configuration.get(Configuration.PROVIDER_CLASS);

        Objects.requireNonNull(providerClass, String.format("Configuration required: %s", Configuration.PROVIDER_CLASS));

        try {
            return Class.forName(providerClass.toString())
                    .asSubclass(SyncProvider.class)
                    .getConstructor(Map.class)
                    .newInstance(configuration);
        } catch (ClassNotFoundException | NoSuchMethodException | InstantiationException | IllegalAccessException exception) {
            throw new IllegalArgumentException(String.format("Cannot build provider %s", providerClass), exception);
        } catch (InvocationTargetException exception) {
            throw new IllegalStateException(String.format("Cannot build provider %s", providerClass), exception.getCause());
        }
    }
}
