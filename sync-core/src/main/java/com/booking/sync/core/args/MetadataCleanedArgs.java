package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;

import java.sql.Connection;

public class MetadataCleanedArgs extends ProgressArgs {
    private final int rowsCleaned;

    public MetadataCleanedArgs(SyncContext context, int rowsCleaned, Connection connection) {
        super(context, connection, String.format("Cleaned %d metadata rows", rowsCleaned));

        this.rowsCleaned = rowsCleaned;
    }

    public int getRowsCleaned() {
        return this.rowsCleaned;
    }
}
