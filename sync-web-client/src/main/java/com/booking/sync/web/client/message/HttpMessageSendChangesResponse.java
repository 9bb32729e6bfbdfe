package com.booking.sync.web.client.message;

import com.booking.sync.model.SyncContext;

@SuppressWarnings("unused")
public class HttpMessageSendChangesResponse {
    private SyncContext syncContext;
    private int batchIndex;
    private boolean lastBatch;
    private long remoteClientTimestamp;
    private byte[] changes;

    public HttpMessageSendChangesResponse() {
    }

    public HttpMessageSendChangesResponse(SyncContext syncContext, int batchIndex, boolean lastBatch) {
        this.syncContext = syncContext;
        this.batchIndex = batchIndex;
        this.lastBatch = lastBatch;
    }

    public SyncContext getSyncContext() {
        return this.syncContext;
    }

    public void setSyncContext(SyncContext syncContext) {
        this.syncContext = syncContext;
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

    public long getRemoteClientTimestamp() {
        return this.remoteClientTimestamp;
    }

    public void setRemoteClientTimestamp(long remoteClientTimestamp) {
        this.remoteClientTimestamp = remoteClientTimestamp;
    }

    public byte[] getChanges() {
        return this.changes;
    }

    public void setChanges(byte[] changes) {
        this.changes = changes;
    }
}
