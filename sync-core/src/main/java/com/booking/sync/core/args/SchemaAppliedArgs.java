package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.schema.SyncSet;

import java.sql.Connection;

public class SchemaAppliedArgs extends ProgressArgs {
    private final SyncSet schema;

    public SchemaAppliedArgs(SyncContext context, SyncSet schema, Connection connection) {
        super(context, connection, String.format("Schema applied with %d tables", schema.getTables().size()));

        this.schema = schema;
    }

    public SyncSet getSchema() {
        return this.schema;
    }
}
