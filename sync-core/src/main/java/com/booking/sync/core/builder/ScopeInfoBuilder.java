package com.booking.sync.core.builder;

import com.booking.sync.model.scope.ScopeInfo;
import com.booking.sync.model.scope.ScopeInfoTableType;
import com.booking.sync.model.scope.ServerHistoryScopeInfo;
import com.booking.sync.model.scope.ServerScopeInfo;

import java.sql.SQLException;
import java.util.List;

/**
 * Access to the scope-info tables, bound to one table name and one connection.
 */
public interface ScopeInfoBuilder {

    boolean needToCreateScopeInfoTable(ScopeInfoTableType type) throws SQLException;

    void createScopeInfoTable(ScopeInfoTableType type) throws SQLException;

    void dropScopeInfoTable(ScopeInfoTableType type) throws SQLException;

    List<ScopeInfo> getAllClientScopes(String scopeName) throws SQLException;

    List<ServerScopeInfo> getAllServerScopes(String scopeName) throws SQLException;

    List<ServerHistoryScopeInfo> getAllServerHistoryScopes(String scopeName) throws SQLException;

    ScopeInfo insertOrUpdateClientScopeInfo(ScopeInfo scope) throws SQLException;

    ServerScopeInfo insertOrUpdateServerScopeInfo(ServerScopeInfo scope) throws SQLException;

    ServerHistoryScopeInfo insertOrUpdateServerHistoryScopeInfo(ServerHistoryScopeInfo scope) throws SQLException;
}
