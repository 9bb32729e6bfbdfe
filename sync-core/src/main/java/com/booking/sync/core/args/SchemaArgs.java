package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.schema.SyncSet;

import java.sql.Connection;

public class SchemaArgs extends ProgressArgs {
    private final SyncSet schema;

    public SchemaArgs(SyncContext context, SyncSet schema, Connection connection) {
        super(context, connection, String.format("Schema read with %d tables", schema.getTables().size()));

        this.schema = schema;
    }

    public SyncSet getSchema() {
        return this.schema;
    }
}
