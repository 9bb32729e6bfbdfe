package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;

import java.sql.Connection;

public class ConnectionOpenedArgs extends ProgressArgs {

    public ConnectionOpenedArgs(SyncContext context, Connection connection) {
        super(context, connection, "Connection opened");
    }
}
