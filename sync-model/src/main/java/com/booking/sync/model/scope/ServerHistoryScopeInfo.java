package com.booking.sync.model.scope;

import java.util.UUID;

/**
 * One row per sync attempt a client made against the server.
 */
@SuppressWarnings("unused")
public class ServerHistoryScopeInfo extends AbstractScopeInfo {
    private long lastSyncTimestamp;
    private long lastSyncDuration;

    public ServerHistoryScopeInfo() {
    }

    public ServerHistoryScopeInfo(UUID id, String name) {
        super(id, name);
    }

    public long getLastSyncTimestamp() {
        return this.lastSyncTimestamp;
    }

    public void setLastSyncTimestamp(long lastSyncTimestamp) {
        this.lastSyncTimestamp = lastSyncTimestamp;
    }

    public long getLastSyncDuration() {
        return this.lastSyncDuration;
    }

    public void setLastSyncDuration(long lastSyncDuration) {
        this.lastSyncDuration = lastSyncDuration;
    }
}
