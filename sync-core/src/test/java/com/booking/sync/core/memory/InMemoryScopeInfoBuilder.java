package com.booking.sync.core.memory;

import com.booking.sync.core.builder.ScopeInfoBuilder;
import com.booking.sync.model.scope.AbstractScopeInfo;
import com.booking.sync.model.scope.ScopeInfo;
import com.booking.sync.model.scope.ScopeInfoTableType;
import com.booking.sync.model.scope.ServerHistoryScopeInfo;
import com.booking.sync.model.scope.ServerScopeInfo;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Scope tables are named {@code <table>_client}, {@code <table>_server} and {@code <table>_history}.
 */
public class InMemoryScopeInfoBuilder implements ScopeInfoBuilder {
    private final InMemoryDatabase database;
    private final String scopeInfoTableName;
    private final Connection connection;

    public InMemoryScopeInfoBuilder(InMemoryDatabase database, String scopeInfoTableName, Connection connection) {
        this.database = database;
        this.scopeInfoTableName = scopeInfoTableName;
        this.connection = connection;
    }

    public static String tableName(String scopeInfoTableName, ScopeInfoTableType type) {
        switch (type) {
            case CLIENT:
                return String.format("%s_client", scopeInfoTableName);
            case SERVER:
                return String.format("%s_server", scopeInfoTableName);
            default:
                return String.format("%s_history", scopeInfoTableName);
        }
    }

    @Override
    public boolean needToCreateScopeInfoTable(ScopeInfoTableType type) throws SQLException {
        this.database.check(String.format("needToCreateScopeInfoTable:%s", type));
        return !this.database.state(this.connection).getScopes().containsKey(this.tableName(type));
    }

    @Override
    public void createScopeInfoTable(ScopeInfoTableType type) throws SQLException {
        this.database.check(String.format("createScopeInfoTable:%s", type));
        this.database.state(this.connection).getScopes().putIfAbsent(this.tableName(type), new LinkedHashMap<>());
    }

    @Override
    public void dropScopeInfoTable(ScopeInfoTableType type) throws SQLException {
        this.database.check(String.format("dropScopeInfoTable:%s", type));
        this.database.state(this.connection).getScopes().remove(this.tableName(type));
    }

    @Override
    public List<ScopeInfo> getAllClientScopes(String scopeName) throws SQLException {
        return this.read(ScopeInfoTableType.CLIENT, scopeName, ScopeInfo.class, InMemoryScopeInfoBuilder::copy);
    }

    @Override
    public List<ServerScopeInfo> getAllServerScopes(String scopeName) throws SQLException {
        return this.read(ScopeInfoTableType.SERVER, scopeName, ServerScopeInfo.class, InMemoryScopeInfoBuilder::copy);
    }

    @Override
    public List<ServerHistoryScopeInfo> getAllServerHistoryScopes(String scopeName) throws SQLException {
        return this.read(ScopeInfoTableType.SERVER_HISTORY, scopeName, ServerHistoryScopeInfo.class, InMemoryScopeInfoBuilder::copy);
    }

    @Override
    public ScopeInfo insertOrUpdateClientScopeInfo(ScopeInfo scope) throws SQLException {
        this.rows(ScopeInfoTableType.CLIENT).put(scope.getId(), InMemoryScopeInfoBuilder.copy(scope));
        return InMemoryScopeInfoBuilder.copy(scope);
    }

    @Override
    public ServerScopeInfo insertOrUpdateServerScopeInfo(ServerScopeInfo scope) throws SQLException {
        this.rows(ScopeInfoTableType.SERVER).put(scope.getId(), InMemoryScopeInfoBuilder.copy(scope));
        return InMemoryScopeInfoBuilder.copy(scope);
    }

    @Override
    public ServerHistoryScopeInfo insertOrUpdateServerHistoryScopeInfo(ServerHistoryScopeInfo scope) throws SQLException {
        this.rows(ScopeInfoTableType.SERVER_HISTORY).put(scope.getId(), InMemoryScopeInfoBuilder.copy(scope));
        return InMemoryScopeInfoBuilder.copy(scope);
    }

    private String tableName(ScopeInfoTableType type) {
        return InMemoryScopeInfoBuilder.tableName(this.scopeInfoTableName, type);
    }

    private Map<UUID, AbstractScopeInfo> rows(ScopeInfoTableType type) throws SQLException {
        this.database.check(String.format("writeScope:%s", type));

        Map<UUID, AbstractScopeInfo> rows = this.database.state(this.connection).getScopes().get(this.tableName(type));

        if (rows == null) {
            throw new SQLException(String.format("Table %s doesn't exist", this.tableName(type)), "42S02", 1146);
        }

        return rows;
    }

    private <S extends AbstractScopeInfo> List<S> read(ScopeInfoTableType type, String scopeName, Class<S> scopeClass, Function<S, S> copy) throws SQLException {
        return this.rows(type).values()
                .stream()
                .filter(scope -> scopeName.equals(scope.getName()))
                .map(scopeClass::cast)
                .map(copy)
                .collect(Collectors.toList());
    }

    private static ScopeInfo copy(ScopeInfo scope) {
        ScopeInfo copy = new ScopeInfo(scope.getId(), scope.getName());

        copy.setLastSync(scope.getLastSync());
        copy.setLastServerSyncTimestamp(scope.getLastServerSyncTimestamp());
        copy.setLastSyncTimestamp(scope.getLastSyncTimestamp());
        copy.setLastSyncDuration(scope.getLastSyncDuration());

        return copy;
    }

    private static ServerScopeInfo copy(ServerScopeInfo scope) {
        ServerScopeInfo copy = new ServerScopeInfo(scope.getId(), scope.getName());

        copy.setLastSync(scope.getLastSync());
        copy.setVersion(scope.getVersion());
        copy.setLastCleanupTimestamp(scope.getLastCleanupTimestamp());
        copy.setSchema(scope.getSchema());

        return copy;
    }

    private static ServerHistoryScopeInfo copy(ServerHistoryScopeInfo scope) {
        ServerHistoryScopeInfo copy = new ServerHistoryScopeInfo(scope.getId(), scope.getName());

        copy.setLastSync(scope.getLastSync());
        copy.setLastSyncTimestamp(scope.getLastSyncTimestamp());
        copy.setLastSyncDuration(scope.getLastSyncDuration());

        return copy;
    }
}
