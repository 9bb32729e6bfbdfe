package com.booking.sync.core.args;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.provision.ProvisionFlags;
import com.booking.sync.model.schema.SyncTable;

import java.sql.Connection;

public class TableDeprovisioningArgs extends ProgressArgs {
    private final ProvisionFlags provision;
    private final SyncTable table;

    public TableDeprovisioningArgs(SyncContext context, ProvisionFlags provision, SyncTable table, Connection connection) {
        super(context, connection, String.format("Deprovisioning table %s with %s", table.getFullName(), provision));

        this.provision = provision;
        this.table = table;
    }

    public ProvisionFlags getProvision() {
        return this.provision;
    }

    public SyncTable getTable() {
        return this.table;
    }
}
