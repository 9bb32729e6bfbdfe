package com.booking.sync.model.scope;

import com.booking.sync.model.schema.SyncSet;

import java.util.UUID;

/**
 * Server side scope record, shared by every client syncing the same scope name.
 */
@SuppressWarnings("unused")
public class ServerScopeInfo extends AbstractScopeInfo {
    private String version;
    private long lastCleanupTimestamp;
    private SyncSet schema;

    public ServerScopeInfo() {
    }

    public ServerScopeInfo(UUID id, String name) {
        super(id, name);
    }

    public String getVersion() {
        return this.version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public long getLastCleanupTimestamp() {
        return this.lastCleanupTimestamp;
    }

    public void setLastCleanupTimestamp(long lastCleanupTimestamp) {
        this.lastCleanupTimestamp = lastCleanupTimestamp;
    }

    public SyncSet getSchema() {
        return this.schema;
    }

    public void setSchema(SyncSet schema) {
        this.schema = schema;
    }
}
