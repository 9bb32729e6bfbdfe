package com.booking.sync.model.scope;

import java.util.UUID;

/**
 * Client side scope record.
 */
@SuppressWarnings("unused")
public class ScopeInfo extends AbstractScopeInfo {
    private long lastServerSyncTimestamp;
    private long lastSyncTimestamp;
    private long lastSyncDuration;

    public ScopeInfo() {
    }

    public ScopeInfo(UUID id, String name) {
        super(id, name);
    }

    public long getLastServerSyncTimestamp() {
        return this.lastServerSyncTimestamp;
    }

    public void setLastServerSyncTimestamp(long lastServerSyncTimestamp) {
        this.lastServerSyncTimestamp = lastServerSyncTimestamp;
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
