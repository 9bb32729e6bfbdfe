package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;

import java.sql.Connection;

/**
 * Base of every event raised by the orchestrators. Events are dispatched to interceptors by their concrete class.
 */
public class ProgressArgs {
    private final SyncContext context;
    private final Connection connection;
    private final long timestamp;
    private final String message;

    public ProgressArgs(SyncContext context, Connection connection, String message) {
        this.context = context;
        this.connection = connection;
        this.message = message;
        this.timestamp = System.currentTimeMillis();
    }

    public SyncContext getContext() {
        return this.context;
    }

    public Connection getConnection() {
        return this.connection;
    }

    public long getTimestamp() {
        return this.timestamp;
    }

    public String getMessage() {
        return this.message;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s", this.getClass().getSimpleName(), this.message);
    }
}
