package com.booking.sync.core.scope;

import com.booking.sync.core.args.ProgressArgs;
import com.booking.sync.core.args.ScopeLoadedArgs;
import com.booking.sync.core.args.ScopeSavedArgs;
import com.booking.sync.core.builder.ScopeInfoBuilder;
import com.booking.sync.core.interceptor.Interceptors;
import com.booking.sync.core.provision.ProvisioningEngine;
import com.booking.sync.core.provider.SyncProvider;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.scope.AbstractScopeInfo;
import com.booking.sync.model.scope.ScopeInfo;
import com.booking.sync.model.scope.ScopeInfoTableType;
import com.booking.sync.model.scope.ServerHistoryScopeInfo;
import com.booking.sync.model.scope.ServerScopeInfo;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Reads and writes scope records inside a caller owned transaction. A missing record is synthesized with a fresh
 * id, stored and returned as a new scope.
 */
public class ScopeDirectory {
    private static final Logger LOG = LogManager.getLogger(ScopeDirectory.class);

    @FunctionalInterface
    private interface ScopeReader<S extends AbstractScopeInfo> {
        List<S> read(ScopeInfoBuilder builder, String scopeName) throws SQLException;
    }

    @FunctionalInterface
    private interface ScopeWriter<S extends AbstractScopeInfo> {
        S write(ScopeInfoBuilder builder, S scope) throws SQLException;
    }

    private final SyncProvider provider;
    private final Interceptors interceptors;

    public ScopeDirectory(SyncProvider provider, Interceptors interceptors) {
        this.provider = provider;
        this.interceptors = interceptors;
    }

    public void ensureScope(ScopeInfoTableType type, String scopeInfoTableName, Connection connection) throws SQLException {
        ScopeInfoBuilder builder = this.provider.getScopeBuilder().createScopeInfoBuilder(scopeInfoTableName, connection);

        if (builder.needToCreateScopeInfoTable(type)) {
            builder.createScopeInfoTable(type);

            ScopeDirectory.LOG.info(String.format("created %s scope table %s", type, scopeInfoTableName));
        }
    }

    public ScopeInfo getClientScope(SyncContext context, String scopeInfoTableName, String scopeName, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        return this.load(context, scopeInfoTableName, scopeName, connection, progress, ScopeInfoBuilder::getAllClientScopes, ScopeInfoBuilder::insertOrUpdateClientScopeInfo, ScopeInfo::new);
    }

    public ServerScopeInfo getServerScope(SyncContext context, String scopeInfoTableName, String scopeName, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        return this.load(context, scopeInfoTableName, scopeName, connection, progress, ScopeInfoBuilder::getAllServerScopes, ScopeInfoBuilder::insertOrUpdateServerScopeInfo, ServerScopeInfo::new);
    }

    /**
     * History keeps one record per sync attempt, so every stored record is returned. An empty history gets one
     * synthesized record.
     */
    public List<ServerHistoryScopeInfo> getServerHistoryScopes(SyncContext context, String scopeInfoTableName, String scopeName, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        ScopeInfoBuilder builder = this.provider.getScopeBuilder().createScopeInfoBuilder(scopeInfoTableName, connection);

        List<ServerHistoryScopeInfo> scopes = builder.getAllServerHistoryScopes(scopeName);

        if (scopes == null || scopes.isEmpty()) {
            scopes = new ArrayList<>();
            scopes.add(this.synthesize(builder, scopeName, ScopeInfoBuilder::insertOrUpdateServerHistoryScopeInfo, ServerHistoryScopeInfo::new));
        }

        for (ServerHistoryScopeInfo scope : scopes) {
            this.loaded(context, scope, connection, progress);
        }

        return scopes;
    }

    public ScopeInfo writeClientScope(SyncContext context, String scopeInfoTableName, ScopeInfo scope, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        return this.write(context, scopeInfoTableName, scope, connection, progress, ScopeInfoBuilder::insertOrUpdateClientScopeInfo);
    }

    public ServerScopeInfo writeServerScope(SyncContext context, String scopeInfoTableName, ServerScopeInfo scope, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        return this.write(context, scopeInfoTableName, scope, connection, progress, ScopeInfoBuilder::insertOrUpdateServerScopeInfo);
    }

    public ServerHistoryScopeInfo writeServerHistoryScope(SyncContext context, String scopeInfoTableName, ServerHistoryScopeInfo scope, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        return this.write(context, scopeInfoTableName, scope, connection, progress, ScopeInfoBuilder::insertOrUpdateServerHistoryScopeInfo);
    }

    private <S extends AbstractScopeInfo> S load(SyncContext context, String scopeInfoTableName, String scopeName, Connection connection, Consumer<ProgressArgs> progress, ScopeReader<S> reader, ScopeWriter<S> writer, BiFunction<UUID, String, S> factory) throws Exception {
        ScopeInfoBuilder builder = this.provider.getScopeBuilder().createScopeInfoBuilder(scopeInfoTableName, connection);

        List<S> scopes = reader.read(builder, scopeName);

        S scope;

        if (scopes == null || scopes.isEmpty()) {
            scope = this.synthesize(builder, scopeName, writer, factory);
        } else {
            scope = scopes.get(0);
        }

        this.loaded(context, scope, connection, progress);

        return scope;
    }

    private <S extends AbstractScopeInfo> S synthesize(ScopeInfoBuilder builder, String scopeName, ScopeWriter<S> writer, BiFunction<UUID, String, S> factory) throws SQLException {
        S scope = writer.write(builder, factory.apply(UUID.randomUUID(), scopeName));

        ScopeDirectory.LOG.debug(String.format("no stored scope %s, stored new scope %s", scopeName, scope.getId()));

        return scope;
    }

    private void loaded(SyncContext context, AbstractScopeInfo scope, Connection connection, Consumer<ProgressArgs> progress) throws Exception {
        ScopeLoadedArgs args = new ScopeLoadedArgs(context, scope, connection);

        this.interceptors.intercept(args);
        ProvisioningEngine.report(progress, args);
    }

    private <S extends AbstractScopeInfo> S write(SyncContext context, String scopeInfoTableName, S scope, Connection connection, Consumer<ProgressArgs> progress, ScopeWriter<S> writer) throws Exception {
        ScopeInfoBuilder builder = this.provider.getScopeBuilder().createScopeInfoBuilder(scopeInfoTableName, connection);

        S saved = writer.write(builder, scope);

        ScopeSavedArgs args = new ScopeSavedArgs(context, saved, connection);

        this.interceptors.intercept(args);
        ProvisioningEngine.report(progress, args);

        return saved;
    }
}
