package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;

import java.sql.Connection;

public class ConnectionClosedArgs extends ProgressArgs {

    public ConnectionClosedArgs(SyncContext context, Connection connection) {
        super(context, connection, "Connection closed");
    }
}
