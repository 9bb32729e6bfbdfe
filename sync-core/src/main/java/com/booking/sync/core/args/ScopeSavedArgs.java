package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.scope.AbstractScopeInfo;

import java.sql.Connection;

public class ScopeSavedArgs extends ProgressArgs {
    private final AbstractScopeInfo scope;

    public ScopeSavedArgs(SyncContext context, AbstractScopeInfo scope, Connection connection) {
        super(context, connection, String.format("Scope %s saved (%s)", scope.getName(), scope.getClass().getSimpleName()));

        this.scope = scope;
    }

    public AbstractScopeInfo getScope() {
        return this.scope;
    }
}
