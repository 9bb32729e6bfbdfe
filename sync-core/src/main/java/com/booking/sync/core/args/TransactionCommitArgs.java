package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;

import java.sql.Connection;

public class TransactionCommitArgs extends ProgressArgs {

    public TransactionCommitArgs(SyncContext context, Connection connection) {
        super(context, connection, "Transaction committing");
    }
}
