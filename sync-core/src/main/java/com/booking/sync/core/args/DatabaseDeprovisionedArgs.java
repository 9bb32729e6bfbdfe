package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.provision.ProvisionFlags;
import com.booking.sync.model.schema.SyncSet;

import java.sql.Connection;

public class DatabaseDeprovisionedArgs extends ProgressArgs {
    private final ProvisionFlags provision;
    private final SyncSet schema;

    public DatabaseDeprovisionedArgs(SyncContext context, ProvisionFlags provision, SyncSet schema, Connection connection) {
        super(context, connection, String.format("Deprovisioned %d tables with %s", schema.getTables().size(), provision));

        this.provision = provision;
        this.schema = schema;
    }

    public ProvisionFlags getProvision() {
        return this.provision;
    }

    public SyncSet getSchema() {
        return this.schema;
    }
}
