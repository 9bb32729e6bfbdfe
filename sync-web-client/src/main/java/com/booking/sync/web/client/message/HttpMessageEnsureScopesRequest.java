package com.booking.sync.web.client.message;

import com.booking.sync.model.SyncContext;

@SuppressWarnings("unused")
public class HttpMessageEnsureScopesRequest {
    private SyncContext syncContext;

    public HttpMessageEnsureScopesRequest() {
    }

    public HttpMessageEnsureScopesRequest(SyncContext syncContext) {
        this.syncContext = syncContext;
    }

    public SyncContext getSyncContext() {
        return this.syncContext;
    }

    public void setSyncContext(SyncContext syncContext) {
        this.syncContext = syncContext;
    }
}
