package com.booking.sync.web.client;

import com.booking.sync.core.exception.SyncException;
import com.booking.sync.core.orchestrator.SyncOptions;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.SyncSide;
import com.booking.sync.web.client.message.HttpErrorMessage;
import com.booking.sync.web.client.message.HttpMessageEnsureScopesRequest;
import com.booking.sync.web.client.message.HttpMessageEnsureScopesResponse;
import com.booking.sync.web.client.message.HttpMessageGetMoreChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesResponse;
import com.booking.sync.web.client.message.SerializationFormat;
import com.booking.sync.web.client.serialization.Converter;
import com.booking.sync.web.client.serialization.JsonSerializerFactory;
import com.booking.sync.web.client.serialization.SerializerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.util.EntityUtils;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.UUID;

/**
 * Client side of the relay protocol. Every request of one instance carries the same session id, so the relay
 * routes them all to the same server orchestrator.
 */
public class WebClientOrchestrator implements Closeable {
    private static final Logger LOG = LogManager.getLogger(WebClientOrchestrator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String serviceUri;
    private final SerializerFactory serializerFactory;
    private final Converter converter;
    private final int batchSize;
    private final CloseableHttpClient client;
    private final String sessionId;

    public WebClientOrchestrator(String serviceUri) {
        this(serviceUri, new JsonSerializerFactory(), null, SyncOptions.DEFAULT_BATCH_SIZE);
    }

    public WebClientOrchestrator(String serviceUri, SerializerFactory serializerFactory, Converter converter, int batchSize) {
        this(serviceUri, serializerFactory, converter, batchSize, HttpClientBuilder.create().build());
    }

    WebClientOrchestrator(String serviceUri, SerializerFactory serializerFactory, Converter converter, int batchSize, CloseableHttpClient client) {
        Objects.requireNonNull(serviceUri, "Service uri required");
        Objects.requireNonNull(serializerFactory, "Serializer factory required");

        this.serviceUri = serviceUri;
        this.serializerFactory = serializerFactory;
        this.converter = converter;
        this.batchSize = batchSize;
        this.client = client;
        this.sessionId = UUID.randomUUID().toString();
    }

    public HttpMessageEnsureScopesResponse ensureScopes(SyncContext context) throws SyncException {
        return this.send(HttpStep.ENSURE_SCOPES, new HttpMessageEnsureScopesRequest(context), HttpMessageEnsureScopesRequest.class, HttpMessageEnsureScopesResponse.class);
    }

    public HttpMessageSendChangesResponse sendChanges(HttpMessageSendChangesRequest request) throws SyncException {
        if (this.converter != null && request.getChanges() != null) {
            request.setChanges(this.converter.beforeSerialize(request.getChanges()));
        }

        return this.converted(this.send(HttpStep.SEND_CHANGES, request, HttpMessageSendChangesRequest.class, HttpMessageSendChangesResponse.class));
    }

    public HttpMessageSendChangesResponse getMoreChanges(HttpMessageGetMoreChangesRequest request) throws SyncException {
        return this.converted(this.send(HttpStep.GET_CHANGES, request, HttpMessageGetMoreChangesRequest.class, HttpMessageSendChangesResponse.class));
    }

    private HttpMessageSendChangesResponse converted(HttpMessageSendChangesResponse response) {
        if (this.converter != null && response.getChanges() != null) {
            response.setChanges(this.converter.afterDeserialized(response.getChanges()));
        }

        return response;
    }

    private <Q, R> R send(HttpStep step, Q message, Class<Q> requestType, Class<R> responseType) throws SyncException {
        try {
            HttpPost post = new HttpPost(this.serviceUri);

            post.setHeader(SyncHeaders.SESSION_ID, this.sessionId);
            post.setHeader(SyncHeaders.STEP, String.valueOf(step.getCode()));
            post.setHeader(SyncHeaders.SERIALIZATION_FORMAT, new SerializationFormat(this.serializerFactory.getKey(), this.batchSize).toHeader());

            if (this.converter != null) {
                post.setHeader(SyncHeaders.CONVERTER, this.converter.getKey());
            }

            post.setEntity(new ByteArrayEntity(
                    this.serializerFactory.getSerializer(requestType).serialize(message),
                    ContentType.APPLICATION_OCTET_STREAM
            ));

            try (CloseableHttpResponse response = this.client.execute(post)) {
                int status = response.getStatusLine().getStatusCode();
                byte[] body = (response.getEntity() != null) ? EntityUtils.toByteArray(response.getEntity()) : new byte[0];

                if (status == HttpStatus.SC_BAD_REQUEST) {
                    HttpErrorMessage error = WebClientOrchestrator.MAPPER.readValue(body, HttpErrorMessage.class);

                    WebClientOrchestrator.LOG.warn(String.format("relay rejected %s: %s", step, error.getMessage()));

                    throw error.toException();
                }

                if (status != HttpStatus.SC_OK) {
                    throw new IOException(String.format("Unexpected status %d from %s", status, this.serviceUri));
                }

                return this.serializerFactory.getSerializer(responseType).deserialize(body);
            }
        } catch (IOException exception) {
            SyncException syncException = new SyncException(exception, step.getStage());

            syncException.setSide(SyncSide.CLIENT);
            syncException.setDataSource(this.serviceUri);

            throw syncException;
        }
    }

    public String getSessionId() {
        return this.sessionId;
    }

    @Override
    public void close() throws IOException {
        this.client.close();
    }
}
