package com.booking.sync.core.orchestrator;

import com.booking.sync.core.args.ConnectionClosedArgs;
import com.booking.sync.core.args.ConnectionOpenedArgs;
import com.booking.sync.core.args.DeprovisionedArgs;
import com.booking.sync.core.args.MetadataCleanedArgs;
import com.booking.sync.core.args.OutdatedArgs;
import com.booking.sync.core.args.ProgressArgs;
import com.booking.sync.core.args.ProvisionedArgs;
import com.booking.sync.core.args.SchemaArgs;
import com.booking.sync.core.args.TransactionCommitArgs;
import com.booking.sync.core.args.TransactionOpenedArgs;
import com.booking.sync.core.exception.MissingTablesException;
import com.booking.sync.core.exception.SyncException;
import com.booking.sync.core.interceptor.InterceptorHandler;
import com.booking.sync.core.interceptor.Interceptors;
import com.booking.sync.core.provider.SyncProvider;
import com.booking.sync.core.provision.ProvisioningEngine;
import com.booking.sync.core.scope.ScopeDirectory;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;
import com.booking.sync.model.provision.ProvisionFlags;
import com.booking.sync.model.schema.SyncFilter;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.schema.SyncSetup;
import com.booking.sync.model.schema.SyncTable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Runs every operation through the same pipeline: set the start stage, validate, open a connection, open a
 * transaction, run the step, commit, set the end stage, close the connection and fire the completion event.
 * Any failure rolls the transaction back and surfaces as a {@link SyncException} carrying the stage reached.
 */
public abstract class BaseOrchestrator {
    private static final Logger LOG = LogManager.getLogger(BaseOrchestrator.class);

    @FunctionalInterface
    protected interface Validation {
        void validate() throws Exception;
    }

    @FunctionalInterface
    protected interface Step<T> {
        T run(SyncContext context, Connection connection) throws Exception;
    }

    @FunctionalInterface
    protected interface Completion<T> {
        ProgressArgs completed(SyncContext context, T result, Connection connection);
    }

    private final SyncProvider provider;
    private final SyncOptions options;
    private final SyncSetup setup;
    private final String scopeName;
    private final ProvisioningEngine engine;
    private final ScopeDirectory directory;

    private final Interceptors interceptors;
    private SyncContext context;
    private Long startTime;
    private Long completeTime;

    protected BaseOrchestrator(SyncProvider provider, SyncOptions options, SyncSetup setup, String scopeName) {
        Objects.requireNonNull(provider, "Provider required");

        this.provider = provider;
        this.options = (options != null) ? options : new SyncOptions();
        this.setup = (setup != null) ? setup : new SyncSetup();
        this.scopeName = (scopeName != null) ? scopeName : SyncOptions.DEFAULT_SCOPE_NAME;
        this.interceptors = new Interceptors();
        this.engine = new ProvisioningEngine(provider, this.interceptors);
        this.directory = new ScopeDirectory(provider, this.interceptors);
    }

    public abstract SyncSide getSide();

    public <T extends ProgressArgs> void on(Class<T> type, InterceptorHandler<T> handler) {
        this.interceptors.on(type, handler);
    }

    public SyncSet provision(ProvisionFlags provision) throws SyncException {
        return this.provision(provision, null);
    }

    public SyncSet provision(ProvisionFlags provision, Consumer<ProgressArgs> progress) throws SyncException {
        return this.provision(new SyncSet(this.setup), provision, progress);
    }

    /**
     * Provisions the given schema. A schema without columns is completed from the storage engine first.
     */
    public SyncSet provision(SyncSet schema, ProvisionFlags provision, Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.PROVISIONING,
                SyncStage.PROVISIONED,
                () -> BaseOrchestrator.requireTables(schema),
                (context, connection) -> {
                    SyncSet described = schema.hasColumns()
                            ? schema
                            : this.provider.readSchema(BaseOrchestrator.setupOf(schema), connection);

                    return this.engine.provision(context, described, provision, this.options.getScopeInfoTableName(), this.getSide(), connection, progress);
                },
                (context, result, connection) -> new ProvisionedArgs(context, provision, result, connection),
                progress
        );
    }

    public SyncSet deprovision(ProvisionFlags provision) throws SyncException {
        return this.deprovision(provision, null);
    }

    public SyncSet deprovision(ProvisionFlags provision, Consumer<ProgressArgs> progress) throws SyncException {
        return this.deprovision(new SyncSet(this.setup), provision, progress);
    }

    /**
     * Deprovisions the given schema. Table names are enough, columns are not required.
     */
    public SyncSet deprovision(SyncSet schema, ProvisionFlags provision, Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.DEPROVISIONING,
                SyncStage.DEPROVISIONED,
                () -> BaseOrchestrator.requireTables(schema),
                (context, connection) -> this.engine.deprovision(context, schema, provision, this.options.getScopeInfoTableName(), this.getSide(), connection, progress),
                (context, result, connection) -> new DeprovisionedArgs(context, provision, result, connection),
                progress
        );
    }

    public SyncSet getSchema() throws SyncException {
        return this.getSchema(null);
    }

    public SyncSet getSchema(Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCHEMA_READING,
                SyncStage.SCHEMA_READ,
                () -> {
                    if (!this.setup.hasTables()) {
                        throw new MissingTablesException();
                    }
                },
                (context, connection) -> this.provider.readSchema(this.setup, connection),
                SchemaArgs::new,
                progress
        );
    }

    public int deleteMetadata(long timestampLimit) throws SyncException {
        return this.deleteMetadata(timestampLimit, null);
    }

    public int deleteMetadata(long timestampLimit, Consumer<ProgressArgs> progress) throws SyncException {
        SyncSet schema = new SyncSet(this.setup);

        return this.execute(
                SyncStage.METADATA_CLEANING,
                SyncStage.METADATA_CLEANED,
                () -> BaseOrchestrator.requireTables(schema),
                (context, connection) -> this.engine.deleteMetadata(context, schema, timestampLimit, connection, progress),
                MetadataCleanedArgs::new,
                progress
        );
    }

    /**
     * Whether a client that last synced at the given timestamp is behind the cleanup horizon. Leaves the stage as is.
     */
    public boolean isOutdated(long lastCleanupTimestamp, long lastSyncTimestamp) throws SyncException {
        SyncStage stage = this.getContext().getSyncStage();

        return this.execute(
                stage,
                stage,
                () -> { },
                (context, connection) -> this.provider.isOutdated(lastCleanupTimestamp, lastSyncTimestamp),
                OutdatedArgs::new,
                null
        );
    }

    protected <T> T execute(SyncStage startStage, SyncStage endStage, Validation validation, Step<T> step, Completion<T> completion, Consumer<ProgressArgs> progress) throws SyncException {
        if (this.startTime == null) {
            this.startTime = System.currentTimeMillis();
        }

        SyncContext context = this.getContext();
        Connection connection = null;
        boolean transactionOpened = false;

        try {
            context.setSyncStage(startStage);

            validation.validate();

            connection = this.provider.createConnection();

            this.provider.onConnectionOpened(connection);
            this.interceptors.intercept(new ConnectionOpenedArgs(context, connection));

            connection.setAutoCommit(false);
            transactionOpened = true;

            this.interceptors.intercept(new TransactionOpenedArgs(context, connection));

            T result = step.run(context, connection);

            this.interceptors.intercept(new TransactionCommitArgs(context, connection));

            connection.commit();
            transactionOpened = false;

            context.setSyncStage(endStage);

            connection.close();

            this.interceptors.intercept(new ConnectionClosedArgs(context, connection));
            this.provider.onConnectionClosed(connection);

            if (completion != null) {
                ProgressArgs args = completion.completed(context, result, connection);

                this.interceptors.intercept(args);
                ProvisioningEngine.report(progress, args);
            }

            this.completeTime = System.currentTimeMillis();

            return result;
        } catch (Exception exception) {
            if (transactionOpened) {
                BaseOrchestrator.rollback(connection, exception);
            }

            throw this.raiseError(exception);
        } finally {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException exception) {
                    BaseOrchestrator.LOG.warn("error closing connection", exception);
                }
            }
        }
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException exception) {
            cause.addSuppressed(exception);
        }
    }

    /**
     * Wraps a failure once. An error that is already a {@link SyncException} keeps its original stage.
     */
    protected SyncException raiseError(Exception exception) {
        if (SyncException.class.isInstance(exception)) {
            return SyncException.class.cast(exception);
        }

        if (InterruptedException.class.isInstance(exception)) {
            Thread.currentThread().interrupt();
        }

        SyncException syncException = new SyncException(exception, this.getContext().getSyncStage());

        syncException.setSide(this.getSide());

        this.provider.enrichException(syncException);

        BaseOrchestrator.LOG.error(String.format("%s failed at %s", this.getSide(), syncException.getStage()), exception);

        return syncException;
    }

    private static void requireTables(SyncSet schema) throws MissingTablesException {
        if (schema == null || !schema.hasTables()) {
            throw new MissingTablesException();
        }
    }

    private static SyncSetup setupOf(SyncSet schema) {
        SyncSetup setup = new SyncSetup();

        for (SyncTable table : schema.getTables()) {
            setup.getTables().add(table.getFullName());

            SyncFilter filter = table.getFilter();

            if (filter != null) {
                setup.withFilter(filter);
            }
        }

        return setup;
    }

    public SyncContext getContext() {
        if (this.context == null) {
            this.context = new SyncContext(UUID.randomUUID(), this.scopeName);
        }

        return this.context;
    }

    public void setContext(SyncContext context) {
        this.context = context;
    }

    public SyncProvider getProvider() {
        return this.provider;
    }

    public SyncOptions getOptions() {
        return this.options;
    }

    public SyncSetup getSetup() {
        return this.setup;
    }

    public String getScopeName() {
        return this.scopeName;
    }

    public Interceptors getInterceptors() {
        return this.interceptors;
    }

    protected ProvisioningEngine getEngine() {
        return this.engine;
    }

    protected ScopeDirectory getDirectory() {
        return this.directory;
    }

    public Long getStartTime() {
        return this.startTime;
    }

    public Long getCompleteTime() {
        return this.completeTime;
    }
}
