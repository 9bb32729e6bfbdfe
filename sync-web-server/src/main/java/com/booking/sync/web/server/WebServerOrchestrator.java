package com.booking.sync.web.server;

import com.booking.sync.core.exception.SyncException;
import com.booking.sync.core.orchestrator.RemoteOrchestrator;
import com.booking.sync.core.orchestrator.SyncOptions;
import com.booking.sync.core.provider.SyncProvider;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;
import com.booking.sync.model.provision.ProvisionFlags;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.schema.SyncSetup;
import com.booking.sync.model.scope.ScopeInfoTableType;
import com.booking.sync.model.scope.ServerHistoryScopeInfo;
import com.booking.sync.model.scope.ServerScopeInfo;
import com.booking.sync.web.client.message.HttpMessageEnsureScopesRequest;
import com.booking.sync.web.client.message.HttpMessageEnsureScopesResponse;
import com.booking.sync.web.client.message.HttpMessageGetMoreChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesResponse;
import com.booking.sync.web.client.serialization.Converter;
import com.booking.sync.web.client.serialization.SerializerFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.UUID;

/**
 * Server orchestrator bound to one client session. Each step adopts the context sent by the client so the session
 * keeps one id across requests.
 */
public class WebServerOrchestrator extends RemoteOrchestrator {
    private static final Logger LOG = LogManager.getLogger(WebServerOrchestrator.class);

    private final WebServerOptions webServerOptions;

    private SerializerFactory serializerFactory;
    private Converter converter;

    public WebServerOrchestrator(SyncProvider provider, SyncOptions options, SyncSetup setup, String scopeName, WebServerOptions webServerOptions) {
        super(provider, options, setup, scopeName);

        this.webServerOptions = (webServerOptions != null) ? webServerOptions : new WebServerOptions();
    }

    /**
     * Creates the server scope tables and returns the server scope. The first call for a scope reads the schema of
     * the setup, provisions it and records it in the scope.
     */
    public HttpMessageEnsureScopesResponse ensureScopes(HttpMessageEnsureScopesRequest request) throws SyncException {
        this.adopt((request != null) ? request.getSyncContext() : null);

        return this.execute(
                SyncStage.SCOPE_LOADING,
                SyncStage.SCOPE_LOADED,
                () -> Objects.requireNonNull(request, "Request required"),
                (context, connection) -> {
                    String scopeInfoTableName = this.getOptions().getScopeInfoTableName();

                    this.getDirectory().ensureScope(ScopeInfoTableType.SERVER, scopeInfoTableName, connection);
                    this.getDirectory().ensureScope(ScopeInfoTableType.SERVER_HISTORY, scopeInfoTableName, connection);

                    ServerScopeInfo scope = this.getDirectory().getServerScope(context, scopeInfoTableName, this.getScopeName(), connection, null);

                    if (scope.getSchema() == null) {
                        SyncSet schema = this.getProvider().readSchema(this.getSetup(), connection);

                        this.getEngine().provision(context, schema, ProvisionFlags.all(), scopeInfoTableName, SyncSide.SERVER, connection, null);

                        scope.setSchema(schema);
                        scope.setLastCleanupTimestamp(System.currentTimeMillis());
                        scope = this.getDirectory().writeServerScope(context, scopeInfoTableName, scope, connection, null);

                        WebServerOrchestrator.LOG.info(String.format("provisioned scope %s with %d tables", scope.getName(), schema.getTables().size()));
                    }

                    return new HttpMessageEnsureScopesResponse(context, scope, scope.getSchema());
                },
                null,
                null
        );
    }

    /**
     * Hands the client batch to the changes handler in one transaction. The last batch of a session is recorded in
     * the server history.
     */
    public HttpMessageSendChangesResponse applyThenGetChanges(HttpMessageSendChangesRequest request, int batchSize) throws SyncException {
        this.adopt((request != null) ? request.getSyncContext() : null);

        ChangesHandler changesHandler = this.webServerOptions.getChangesHandler();

        return this.execute(
                SyncStage.CHANGES_APPLYING,
                SyncStage.CHANGES_SELECTED,
                () -> {
                    Objects.requireNonNull(request, "Request required");
                    WebServerOrchestrator.requireHandler(changesHandler);
                },
                (context, connection) -> {
                    HttpMessageSendChangesResponse response = changesHandler.applyThenGetChanges(context, request, batchSize, this.converter, connection);

                    if (request.isLastBatch()) {
                        String scopeInfoTableName = this.getOptions().getScopeInfoTableName();
                        long now = System.currentTimeMillis();

                        ServerHistoryScopeInfo history = new ServerHistoryScopeInfo(UUID.randomUUID(), this.getScopeName());

                        history.setLastSync(now);
                        history.setLastSyncTimestamp(response.getRemoteClientTimestamp());
                        history.setLastSyncDuration(now - context.getStartTime());

                        this.getDirectory().ensureScope(ScopeInfoTableType.SERVER_HISTORY, scopeInfoTableName, connection);
                        this.getDirectory().writeServerHistoryScope(context, scopeInfoTableName, history, connection, null);
                    }

                    return this.completed(response, context);
                },
                null,
                null
        );
    }

    public HttpMessageSendChangesResponse getMoreChanges(HttpMessageGetMoreChangesRequest request) throws SyncException {
        this.adopt((request != null) ? request.getSyncContext() : null);

        try {
            Objects.requireNonNull(request, "Request required");

            ChangesHandler changesHandler = this.webServerOptions.getChangesHandler();

            WebServerOrchestrator.requireHandler(changesHandler);

            return this.completed(changesHandler.getMoreChanges(this.getContext(), request, this.converter), this.getContext());
        } catch (Exception exception) {
            throw this.raiseError(exception);
        }
    }

    private HttpMessageSendChangesResponse completed(HttpMessageSendChangesResponse response, SyncContext context) {
        Objects.requireNonNull(response, "Changes handler returned no response");

        if (response.getSyncContext() == null) {
            response.setSyncContext(context);
        }

        return response;
    }

    private static void requireHandler(ChangesHandler changesHandler) {
        if (changesHandler == null) {
            throw new UnsupportedOperationException("No changes handler configured");
        }
    }

    private void adopt(SyncContext context) {
        if (context != null) {
            this.setContext(context);
        }
    }

    public WebServerOptions getWebServerOptions() {
        return this.webServerOptions;
    }

    public SerializerFactory getSerializerFactory() {
        return this.serializerFactory;
    }

    public void setSerializerFactory(SerializerFactory serializerFactory) {
        this.serializerFactory = serializerFactory;
    }

    public Converter getConverter() {
        return this.converter;
    }

    public void setConverter(Converter converter) {
        this.converter = converter;
    }
}
