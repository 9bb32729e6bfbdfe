package com.booking.sync.web.client.message;

import com.booking.sync.model.SyncContext;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.scope.ServerScopeInfo;

@SuppressWarnings("unused")
public class HttpMessageEnsureScopesResponse {
    private SyncContext syncContext;
    private ServerScopeInfo serverScopeInfo;
    private SyncSet schema;

    public HttpMessageEnsureScopesResponse() {
    }

    public HttpMessageEnsureScopesResponse(SyncContext syncContext, ServerScopeInfo serverScopeInfo, SyncSet schema) {
        this.syncContext = syncContext;
        this.serverScopeInfo = serverScopeInfo;
        this.schema = schema;
    }

    public SyncContext getSyncContext() {
        return this.syncContext;
    }

    public void setSyncContext(SyncContext syncContext) {
        this.syncContext = syncContext;
    }

    public ServerScopeInfo getServerScopeInfo() {
        return this.serverScopeInfo;
    }

    public void setServerScopeInfo(ServerScopeInfo serverScopeInfo) {
        this.serverScopeInfo = serverScopeInfo;
    }

    public SyncSet getSchema() {
        return this.schema;
    }

    public void setSchema(SyncSet schema) {
        this.schema = schema;
    }
}
