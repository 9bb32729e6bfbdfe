package com.booking.sync.web.client;

import com.booking.sync.core.exception.SyncException;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.schema.SyncTable;
import com.booking.sync.model.scope.ScopeInfo;
import com.booking.sync.model.scope.ServerScopeInfo;
import com.booking.sync.web.client.message.HttpErrorMessage;
import com.booking.sync.web.client.message.HttpMessageEnsureScopesResponse;
import com.booking.sync.web.client.message.HttpMessageSendChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesResponse;
import com.booking.sync.web.client.message.SerializationFormat;
import com.booking.sync.web.client.serialization.Converter;
import com.booking.sync.web.client.serialization.JsonSerializerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WebClientOrchestratorTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CloseableHttpClient client;

    @Before
    public void before() {
        this.client = mock(CloseableHttpClient.class);
    }

    private void respond(int status, byte[] body) throws IOException {
        CloseableHttpResponse response = mock(CloseableHttpResponse.class);
        StatusLine statusLine = mock(StatusLine.class);

        when(statusLine.getStatusCode()).thenReturn(status);
        when(response.getStatusLine()).thenReturn(statusLine);
        when(response.getEntity()).thenReturn(new ByteArrayEntity(body));
        when(this.client.execute(any(HttpUriRequest.class))).thenReturn(response);
    }

    @Test
    public void testEnsureScopesSendsProtocolHeaders() throws Exception {
        SyncContext context = new SyncContext(UUID.randomUUID(), "default");
        HttpMessageEnsureScopesResponse expected = new HttpMessageEnsureScopesResponse(
                context,
                new ServerScopeInfo(UUID.randomUUID(), "default"),
                new SyncSet().withTable(new SyncTable("customer"))
        );

        this.respond(200, WebClientOrchestratorTest.MAPPER.writeValueAsBytes(expected));

        WebClientOrchestrator orchestrator = new WebClientOrchestrator("http://localhost/sync", new JsonSerializerFactory(), null, 100, this.client);

        HttpMessageEnsureScopesResponse response = orchestrator.ensureScopes(context);

        assertEquals(expected.getServerScopeInfo().getId(), response.getServerScopeInfo().getId());
        assertEquals("customer", response.getSchema().getTables().get(0).getTableName());

        ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);

        verify(this.client).execute(captor.capture());

        HttpPost post = (HttpPost) captor.getValue();

        assertEquals(orchestrator.getSessionId(), post.getFirstHeader(SyncHeaders.SESSION_ID).getValue());
        assertEquals("0", post.getFirstHeader(SyncHeaders.STEP).getValue());
        assertEquals(100, SerializationFormat.parse(post.getFirstHeader(SyncHeaders.SERIALIZATION_FORMAT).getValue()).getBatchSize());
        assertNull(post.getFirstHeader(SyncHeaders.CONVERTER));

        String body = new String(EntityUtils.toByteArray(post.getEntity()), StandardCharsets.UTF_8);

        assertTrue(body.contains(context.getSessionId().toString()));
    }

    @Test
    public void testSessionIdIsStableAcrossRequests() throws Exception {
        this.respond(200, WebClientOrchestratorTest.MAPPER.writeValueAsBytes(new HttpMessageEnsureScopesResponse()));

        WebClientOrchestrator orchestrator = new WebClientOrchestrator("http://localhost/sync", new JsonSerializerFactory(), null, 100, this.client);

        orchestrator.ensureScopes(new SyncContext(UUID.randomUUID(), "default"));
        orchestrator.ensureScopes(new SyncContext(UUID.randomUUID(), "default"));

        ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);

        verify(this.client, times(2)).execute(captor.capture());

        assertEquals(
                captor.getAllValues().get(0).getFirstHeader(SyncHeaders.SESSION_ID).getValue(),
                captor.getAllValues().get(1).getFirstHeader(SyncHeaders.SESSION_ID).getValue()
        );
    }

    @Test
    public void testErrorEnvelopeBecomesSyncException() throws Exception {
        SyncException remote = new SyncException(new IllegalStateException("deadlock"), SyncStage.CHANGES_APPLYING);

        remote.setSide(SyncSide.SERVER);
        remote.setNumber(1213);
        remote.setInitialCatalog("sales");

        this.respond(400, WebClientOrchestratorTest.MAPPER.writeValueAsBytes(HttpErrorMessage.of(remote)));

        WebClientOrchestrator orchestrator = new WebClientOrchestrator("http://localhost/sync", new JsonSerializerFactory(), null, 100, this.client);

        try {
            orchestrator.sendChanges(new HttpMessageSendChangesRequest(new SyncContext(UUID.randomUUID(), "default"), new ScopeInfo(UUID.randomUUID(), "default")));
            fail("envelope ignored");
        } catch (SyncException exception) {
            assertEquals("deadlock", exception.getMessage());
            assertEquals(SyncStage.CHANGES_APPLYING, exception.getStage());
            assertEquals(SyncSide.SERVER, exception.getSide());
            assertEquals(Integer.valueOf(1213), exception.getNumber());
            assertEquals("sales", exception.getInitialCatalog());
            assertEquals("IllegalStateException", exception.getTypeName());
        }
    }

    @Test
    public void testTransportFailureIsClientSide() throws Exception {
        this.respond(502, new byte[0]);

        WebClientOrchestrator orchestrator = new WebClientOrchestrator("http://localhost/sync", new JsonSerializerFactory(), null, 100, this.client);

        try {
            orchestrator.ensureScopes(new SyncContext(UUID.randomUUID(), "default"));
            fail("bad gateway ignored");
        } catch (SyncException exception) {
            assertEquals(SyncSide.CLIENT, exception.getSide());
            assertEquals(SyncStage.SCOPE_LOADING, exception.getStage());
            assertTrue(exception.getCause() instanceof IOException);
        }
    }

    @Test
    public void testConverterWrapsChanges() throws Exception {
        Converter reverse = new Converter() {
            @Override
            public String getKey() {
                return "reverse";
            }

            @Override
            public byte[] beforeSerialize(byte[] changes) {
                return new StringBuilder(new String(changes, StandardCharsets.UTF_8)).reverse().toString().getBytes(StandardCharsets.UTF_8);
            }

            @Override
            public byte[] afterDeserialized(byte[] changes) {
                return this.beforeSerialize(changes);
            }
        };

        HttpMessageSendChangesResponse serverResponse = new HttpMessageSendChangesResponse(null, 0, true);

        serverResponse.setChanges("cba".getBytes(StandardCharsets.UTF_8));

        this.respond(200, WebClientOrchestratorTest.MAPPER.writeValueAsBytes(serverResponse));

        WebClientOrchestrator orchestrator = new WebClientOrchestrator("http://localhost/sync", new JsonSerializerFactory(), reverse, 100, this.client);
        HttpMessageSendChangesRequest request = new HttpMessageSendChangesRequest(new SyncContext(UUID.randomUUID(), "default"), new ScopeInfo(UUID.randomUUID(), "default"));

        request.setChanges("xyz".getBytes(StandardCharsets.UTF_8));

        HttpMessageSendChangesResponse response = orchestrator.sendChanges(request);

        assertArrayEquals("zyx".getBytes(StandardCharsets.UTF_8), request.getChanges());
        assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), response.getChanges());

        ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);

        verify(this.client).execute(captor.capture());

        assertEquals("reverse", captor.getValue().getFirstHeader(SyncHeaders.CONVERTER).getValue());
        assertEquals("1", captor.getValue().getFirstHeader(SyncHeaders.STEP).getValue());
    }
}
