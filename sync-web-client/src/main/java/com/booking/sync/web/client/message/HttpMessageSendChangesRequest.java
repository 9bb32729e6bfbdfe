package com.booking.sync.web.client.message;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.scope.ScopeInfo;

/**
 * One batch of client changes. The payload is opaque to the relay.
 */
@SuppressWarnings("unused")
public class HttpMessageSendChangesRequest {
    private SyncContext syncContext;
    private ScopeInfo scope;
    private int batchIndex;
    private boolean lastBatch;
    private byte[] changes;

    public HttpMessageSendChangesRequest() {
    }

    public HttpMessageSendChangesRequest(SyncContext syncContext, ScopeInfo scope) {
        this.syncContext = syncContext;
        this.scope = scope;
        this.lastBatch = true;
    }

    public SyncContext getSyncContext() {
        return this.syncContext;
    }

    public void setSyncContext(SyncContext syncContext) {
        this.syncContext = syncContext;
    }

    public ScopeInfo getScope() {
        return this.scope;
    }

    public void setScope(ScopeInfo scope) {
        this.scope = scope;
    }

    public int getBatchIndex() {
        return this.batchIndex;
    }

    public void setBatchIndex(int batchIndex) {
        this.batchIndex = batchIndex;
    }

    public boolean isLastBatch() {
        return this.lastBatch;
    }

    public void setLastBatch(boolean lastBatch) {
        this.lastBatch = lastBatch;
    }

    public byte[] getChanges() {
        return this.changes;
    }

    public void setChanges(byte[] changes) {
        this.changes = changes;
    }
}
