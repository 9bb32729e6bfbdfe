package com.booking.sync.core.provision;

import com.booking.sync.core.args.DatabaseDeprovisionedArgs;
import com.booking.sync.core.args.DatabaseDeprovisioningArgs;
import com.booking.sync.core.args.DatabaseProvisionedArgs;
import com.booking.sync.core.args.DatabaseProvisioningArgs;
import com.booking.sync.core.args.MetadataCleaningArgs;
import com.booking.sync.core.args.ProgressArgs;
import com.booking.sync.core.args.TableDeprovisionedArgs;
import com.booking.sync.core.args.TableDeprovisioningArgs;
import com.booking.sync.core.args.TableProvisionedArgs;
import com.booking.sync.core.args.TableProvisioningArgs;
import com.booking.sync.core.builder.DatabaseBuilder;
import com.booking.sync.core.builder.ScopeInfoBuilder;
import com.booking.sync.core.builder.TableBuilder;
import com.booking.sync.core.exception.MissingTablesException;
import com.booking.sync.core.interceptor.Interceptors;
import com.booking.sync.core.provider.SyncProvider;
import com.booking.sync.core.util.DependencySorter;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;
import com.booking.sync.model.provision.ProvisionFlags;
import com.booking.sync.model.provision.SyncProvision;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.schema.SyncTable;
import com.booking.sync.model.scope.ScopeInfoTableType;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.util.List;
import java.util.function.Consumer;

/**
 * Creates and drops the sync artifacts of a schema inside a caller owned transaction.
 * <p>
 * Tables are provisioned parents first and deprovisioned children first. The base tables themselves are only
 * touched when {@link SyncProvision#TABLE} is requested explicitly.
 */
public class ProvisioningEngine {
    private static final Logger LOG = LogManager.getLogger(ProvisioningEngine.class);

    private final SyncProvider provider;
    private final Interceptors interceptors;

    public ProvisioningEngine(SyncProvider provider, Interceptors interceptors) {
        this.provider = provider;
        this.interceptors = interceptors;
    }

    public SyncSet provision(SyncContext context, SyncSet schema, ProvisionFlags provision, String scopeInfoTableName, SyncSide side, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        ProvisioningEngine.requireTables(schema);

        this.interceptors.intercept(new DatabaseProvisioningArgs(context, provision, schema, connection));

        this.getDatabaseBuilder().ensureDatabase(connection);

        if (provision.has(SyncProvision.SCOPE)) {
            ScopeInfoBuilder scopeInfoBuilder = this.provider.getScopeBuilder().createScopeInfoBuilder(scopeInfoTableName, connection);

            for (ScopeInfoTableType type : ScopeInfoTableType.of(side)) {
                if (scopeInfoBuilder.needToCreateScopeInfoTable(type)) {
                    scopeInfoBuilder.createScopeInfoTable(type);
                }
            }
        }

        for (SyncTable table : DependencySorter.sort(schema.getTables(), schema::getParentTables)) {
            this.interceptors.intercept(new TableProvisioningArgs(context, provision, table, connection));

            TableBuilder builder = this.getTableBuilder(table);

            if (provision.has(SyncProvision.TABLE)) {
                builder.createTable(connection);
            }

            if (provision.has(SyncProvision.TRACKING_TABLE)) {
                builder.createTrackingTable(connection);
            }

            if (provision.has(SyncProvision.TRIGGERS)) {
                builder.createTriggers(connection);
            }

            if (provision.has(SyncProvision.STORED_PROCEDURES)) {
                builder.createStoredProcedures(connection);
            }

            TableProvisionedArgs args = new TableProvisionedArgs(context, provision, table, connection);

            this.interceptors.intercept(args);
            ProvisioningEngine.report(progress, args);
        }

        DatabaseProvisionedArgs args = new DatabaseProvisionedArgs(context, provision, schema, connection);

        this.interceptors.intercept(args);
        ProvisioningEngine.report(progress, args);

        ProvisioningEngine.LOG.info(String.format("provisioned %d tables with %s", schema.getTables().size(), provision));

        return schema;
    }

    public SyncSet deprovision(SyncContext context, SyncSet schema, ProvisionFlags provision, String scopeInfoTableName, SyncSide side, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        ProvisioningEngine.requireTables(schema);

        this.interceptors.intercept(new DatabaseDeprovisioningArgs(context, provision, schema, connection));

        for (SyncTable table : DependencySorter.sortReversed(schema.getTables(), schema::getParentTables)) {
            this.interceptors.intercept(new TableDeprovisioningArgs(context, provision, table, connection));

            TableBuilder builder = this.getTableBuilder(table);

            if (provision.has(SyncProvision.STORED_PROCEDURES)) {
                builder.dropProcedures(connection);
            }

            if (provision.has(SyncProvision.TRIGGERS)) {
                builder.dropTriggers(connection);
            }

            if (provision.has(SyncProvision.TRACKING_TABLE)) {
                builder.dropTrackingTable(connection);
            }

            if (provision.has(SyncProvision.TABLE)) {
                builder.dropTable(connection);
            }

            TableDeprovisionedArgs args = new TableDeprovisionedArgs(context, provision, table, connection);

            this.interceptors.intercept(args);
            ProvisioningEngine.report(progress, args);
        }

        if (provision.has(SyncProvision.SCOPE)) {
            ScopeInfoBuilder scopeInfoBuilder = this.provider.getScopeBuilder().createScopeInfoBuilder(scopeInfoTableName, connection);

            for (ScopeInfoTableType type : ScopeInfoTableType.of(side)) {
                if (!scopeInfoBuilder.needToCreateScopeInfoTable(type)) {
                    scopeInfoBuilder.dropScopeInfoTable(type);
                }
            }
        }

        DatabaseDeprovisionedArgs args = new DatabaseDeprovisionedArgs(context, provision, schema, connection);

        this.interceptors.intercept(args);
        ProvisioningEngine.report(progress, args);

        ProvisioningEngine.LOG.info(String.format("deprovisioned %d tables with %s", schema.getTables().size(), provision));

        return schema;
    }

    /**
     * Creates the base tables of a fully described schema together with their tracking artifacts and foreign keys.
     */
    public SyncSet ensureDatabase(SyncContext context, SyncSet schema, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        ProvisioningEngine.requireTables(schema);

        ProvisionFlags provision = ProvisionFlags.of(SyncProvision.TABLE, SyncProvision.TRACKING_TABLE, SyncProvision.TRIGGERS, SyncProvision.STORED_PROCEDURES);

        this.interceptors.intercept(new DatabaseProvisioningArgs(context, provision, schema, connection));

        this.getDatabaseBuilder().ensureDatabase(connection);

        for (SyncTable table : DependencySorter.sort(schema.getTables(), schema::getParentTables)) {
            context.setSyncStage(SyncStage.TABLE_SCHEMA_APPLYING);

            this.interceptors.intercept(new TableProvisioningArgs(context, provision, table, connection));

            TableBuilder builder = this.getTableBuilder(table);

            builder.createTable(connection);
            builder.createForeignKeys(connection);
            builder.createTrackingTable(connection);
            builder.createTriggers(connection);
            builder.createStoredProcedures(connection);

            context.setSyncStage(SyncStage.TABLE_SCHEMA_APPLIED);

            TableProvisionedArgs args = new TableProvisionedArgs(context, provision, table, connection);

            this.interceptors.intercept(args);
            ProvisioningEngine.report(progress, args);
        }

        DatabaseProvisionedArgs args = new DatabaseProvisionedArgs(context, provision, schema, connection);

        this.interceptors.intercept(args);
        ProvisioningEngine.report(progress, args);

        return schema;
    }

    public int deleteMetadata(SyncContext context, SyncSet schema, long timestampLimit, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        ProvisioningEngine.requireTables(schema);

        MetadataCleaningArgs args = new MetadataCleaningArgs(context, schema, timestampLimit, connection);

        this.interceptors.intercept(args);
        ProvisioningEngine.report(progress, args);

        int rowsCleaned = 0;

        for (SyncTable table : DependencySorter.sortReversed(schema.getTables(), schema::getParentTables)) {
            rowsCleaned += this.getTableBuilder(table).deleteMetadata(connection, timestampLimit);
        }

        ProvisioningEngine.LOG.info(String.format("cleaned %d metadata rows older than %d", rowsCleaned, timestampLimit));

        return rowsCleaned;
    }

    private DatabaseBuilder getDatabaseBuilder() {
        DatabaseBuilder builder = this.provider.getDatabaseBuilder();

        builder.setUseChangeTracking(this.provider.useChangeTracking());
        builder.setUseBulkProcedures(this.provider.supportsBulkOperations());

        return builder;
    }

    private TableBuilder getTableBuilder(SyncTable table) {
        TableBuilder builder = this.provider.getTableBuilder(table);

        builder.setUseChangeTracking(this.provider.useChangeTracking());
        builder.setUseBulkProcedures(this.provider.supportsBulkOperations());
        builder.setFilter(table.getFilter());

        return builder;
    }

    private static void requireTables(SyncSet schema) throws MissingTablesException {
        if (schema == null || !schema.hasTables()) {
            throw new MissingTablesException();
        }
    }

    public static void report(Consumer<ProgressArgs> progress, ProgressArgs args) {
        if (progress != null) {
            progress.accept(args);
        }
    }
}
