package com.booking.sync.core.builder;

import java.sql.Connection;

public interface ScopeBuilder {

    ScopeInfoBuilder createScopeInfoBuilder(String scopeInfoTableName, Connection connection);
}
