package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;

import java.sql.Connection;

public class OutdatedArgs extends ProgressArgs {
    private final boolean outdated;

    public OutdatedArgs(SyncContext context, boolean outdated, Connection connection) {
        super(context, connection, outdated ? "Client is outdated" : "Client is up to date");

        this.outdated = outdated;
    }

    public boolean isOutdated() {
        return this.outdated;
    }
}
