package com.booking.sync.core.orchestrator;

import com.booking.sync.core.args.ProgressArgs;
import com.booking.sync.core.exception.SyncException;
import com.booking.sync.core.provider.SyncProvider;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;
import com.booking.sync.model.schema.SyncSetup;
import com.booking.sync.model.scope.ScopeInfoTableType;
import com.booking.sync.model.scope.ServerHistoryScopeInfo;
import com.booking.sync.model.scope.ServerScopeInfo;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Orchestrator of the server node.
 */
public class RemoteOrchestrator extends BaseOrchestrator {

    public RemoteOrchestrator(SyncProvider provider, SyncOptions options, SyncSetup setup, String scopeName) {
        super(provider, options, setup, scopeName);
    }

    public RemoteOrchestrator(SyncProvider provider, SyncOptions options, SyncSetup setup) {
        this(provider, options, setup, SyncOptions.DEFAULT_SCOPE_NAME);
    }

    @Override
    public SyncSide getSide() {
        return SyncSide.SERVER;
    }

    public ServerScopeInfo getServerScope() throws SyncException {
        return this.getServerScope(null);
    }

    public ServerScopeInfo getServerScope(Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCOPE_LOADING,
                SyncStage.SCOPE_LOADED,
                () -> { },
                (context, connection) -> {
                    this.getDirectory().ensureScope(ScopeInfoTableType.SERVER, this.getOptions().getScopeInfoTableName(), connection);

                    return this.getDirectory().getServerScope(context, this.getOptions().getScopeInfoTableName(), this.getScopeName(), connection, progress);
                },
                null,
                progress
        );
    }

    public ServerScopeInfo writeServerScope(ServerScopeInfo scope) throws SyncException {
        return this.writeServerScope(scope, null);
    }

    public ServerScopeInfo writeServerScope(ServerScopeInfo scope, Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCOPE_WRITING,
                SyncStage.SCOPE_SAVED,
                () -> Objects.requireNonNull(scope, "Scope required"),
                (context, connection) -> this.getDirectory().writeServerScope(context, this.getOptions().getScopeInfoTableName(), scope, connection, progress),
                null,
                progress
        );
    }

    public List<ServerHistoryScopeInfo> getServerHistoryScopes() throws SyncException {
        return this.getServerHistoryScopes(null);
    }

    public List<ServerHistoryScopeInfo> getServerHistoryScopes(Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCOPE_LOADING,
                SyncStage.SCOPE_LOADED,
                () -> { },
                (context, connection) -> {
                    this.getDirectory().ensureScope(ScopeInfoTableType.SERVER_HISTORY, this.getOptions().getScopeInfoTableName(), connection);

                    return this.getDirectory().getServerHistoryScopes(context, this.getOptions().getScopeInfoTableName(), this.getScopeName(), connection, progress);
                },
                null,
                progress
        );
    }

    public ServerHistoryScopeInfo writeServerHistoryScope(ServerHistoryScopeInfo scope) throws SyncException {
        return this.writeServerHistoryScope(scope, null);
    }

    public ServerHistoryScopeInfo writeServerHistoryScope(ServerHistoryScopeInfo scope, Consumer<ProgressArgs> progress) throws SyncException {
        return this.execute(
                SyncStage.SCOPE_WRITING,
                SyncStage.SCOPE_SAVED,
                () -> Objects.requireNonNull(scope, "Scope required"),
                (context, connection) -> this.getDirectory().writeServerHistoryScope(context, this.getOptions().getScopeInfoTableName(), scope, connection, progress),
                null,
                progress
        );
    }
}
