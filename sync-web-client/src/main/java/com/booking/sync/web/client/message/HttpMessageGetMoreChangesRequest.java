package com.booking.sync.web.client.message;

import com.booking.sync.model.SyncContext;

@SuppressWarnings("unused")
public class HttpMessageGetMoreChangesRequest {
    private SyncContext syncContext;
    private int batchIndexRequested;

    public HttpMessageGetMoreChangesRequest() {
    }

    public HttpMessageGetMoreChangesRequest(SyncContext syncContext, int batchIndexRequested) {
        this.syncContext = syncContext;
        this.batchIndexRequested = batchIndexRequested;
    }

    public SyncContext getSyncContext() {
        return this.syncContext;
    }

    public void setSyncContext(SyncContext syncContext) {
        this.syncContext = syncContext;
    }

    public int getBatchIndexRequested() {
        return this.batchIndexRequested;
    }

    public void setBatchIndexRequested(int batchIndexRequested) {
        this.batchIndexRequested = batchIndexRequested;
    }
}
