package com.booking.sync.core.orchestrator;

import com.booking.sync.core.args.ProgressArgs;
import com.booking.sync.core.args.SchemaAppliedArgs;
import com.booking.sync.core.exception.MissingTablesException;
import com.booking.sync.core.exception.SyncException;
import com.booking.sync.core.provider.SyncProvider;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.schema.SyncSetup;
import com.booking.sync.model.scope.ScopeInfo;
import com.booking.sync.model.scope.ScopeInfoTableType;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Orchestrator of the client node.
 */
public class LocalOrchestrator extends BaseOrchestrator {

    public LocalOrchestrator(SyncProvider provider, SyncOptions options, SyncSetup setup, String scopeName) {
        super(provider, options, setup, scopeName);
    }

    public LocalOrchestrator(SyncProvider provider, SyncOptions options, SyncSetup setup) {
        this(provider, options, setup, SyncOptions.DEFAULT_SCOPE_NAME);
    }

    @Override
    public SyncSide getSide() {
        return SyncSide.CLIENT;
    }

    public ScopeInfo getClientScope() throws SyncException {
        return this.getClientScope(null);
    }

    /**
     * Creates the client scope table when missing and returns the stored scope, storing a new one on first use.
     */
    public ScopeInfo getClientScope(Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCOPE_LOADING,
                SyncStage.SCOPE_LOADED,
                () -> { },
                (context, connection) -> {
                    this.getDirectory().ensureScope(ScopeInfoTableType.CLIENT, this.getOptions().getScopeInfoTableName(), connection);

                    return this.getDirectory().getClientScope(context, this.getOptions().getScopeInfoTableName(), this.getScopeName(), connection, progress);
                },
                null,
                progress
        );
    }

    public ScopeInfo writeClientScope(ScopeInfo scope) throws SyncException {
        return this.writeClientScope(scope, null);
    }

    public ScopeInfo writeClientScope(ScopeInfo scope, Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCOPE_WRITING,
                SyncStage.SCOPE_SAVED,
                () -> Objects.requireNonNull(scope, "Scope required"),
                (context, connection) -> this.getDirectory().writeClientScope(context, this.getOptions().getScopeInfoTableName(), scope, connection, progress),
                null,
                progress
        );
    }

    public SyncSet applySchema(SyncSet schema) throws SyncException {
        return this.applySchema(schema, null);
    }

    /**
     * Creates the tables of a schema received from the server, parents first, with their tracking artifacts.
     */
    public SyncSet applySchema(SyncSet schema, Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCHEMA_APPLYING,
                SyncStage.SCHEMA_APPLIED,
                () -> {
                    if (schema == null || !schema.hasTables()) {
                        throw new MissingTablesException();
                    }
                },
                (context, connection) -> this.getEngine().ensureDatabase(context, schema, connection, progress),
                SchemaAppliedArgs::new,
                progress
        );
    }
}
