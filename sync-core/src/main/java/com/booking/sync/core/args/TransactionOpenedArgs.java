package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;

import java.sql.Connection;

public class TransactionOpenedArgs extends ProgressArgs {

    public TransactionOpenedArgs(SyncContext context, Connection connection) {
        super(context, connection, "Transaction opened");
    }
}
