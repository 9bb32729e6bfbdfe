package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.schema.SyncSet;

import java.sql.Connection;

public class MetadataCleaningArgs extends ProgressArgs {
    private final SyncSet schema;
    private final long timestampLimit;

    public MetadataCleaningArgs(SyncContext context, SyncSet schema, long timestampLimit, Connection connection) {
        super(context, connection, String.format("Cleaning metadata older than %d", timestampLimit));

        this.schema = schema;
        this.timestampLimit = timestampLimit;
    }

    public SyncSet getSchema() {
        return this.schema;
    }

    public long getTimestampLimit() {
        return this.timestampLimit;
    }
}
