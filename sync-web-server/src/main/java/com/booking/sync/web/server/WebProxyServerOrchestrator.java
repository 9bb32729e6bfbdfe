package com.booking.sync.web.server;

import com.booking.sync.commons.metrics.Metrics;
import com.booking.sync.commons.util.NamedRegistry;
import com.booking.sync.core.exception.SyncException;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;
import com.booking.sync.web.client.HttpStep;
import com.booking.sync.web.client.SyncHeaders;
import com.booking.sync.web.client.message.HttpErrorMessage;
import com.booking.sync.web.client.message.HttpMessageEnsureScopesRequest;
import com.booking.sync.web.client.message.HttpMessageEnsureScopesResponse;
import com.booking.sync.web.client.message.HttpMessageGetMoreChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesResponse;
import com.booking.sync.web.client.message.SerializationFormat;
import com.booking.sync.web.client.serialization.Converter;
import com.booking.sync.web.client.serialization.SerializerFactory;
import com.booking.sync.web.server.exception.HttpConverterNotConfiguredException;
import com.booking.sync.web.server.exception.HttpHeaderMissingException;
import com.booking.sync.web.server.exception.HttpSerializerNotConfiguredException;
import com.booking.sync.web.server.exception.HttpUnsupportedStepException;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.zip.GZIPOutputStream;

/**
 * HTTP front of the server side. Each request names a session and a step; the relay routes it to the cached
 * {@link WebServerOrchestrator} of that session, creating one on first use, and answers either with the serialized
 * step response or with a 400 error envelope.
 */
public class WebProxyServerOrchestrator {
    private static final Logger LOG = LogManager.getLogger(WebProxyServerOrchestrator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String METRIC_SESSIONS = "relay.sessions";

    private final Supplier<WebServerOrchestrator> factory;
    private final WebServerSessionCache cache;
    private final Metrics<?> metrics;

    public WebProxyServerOrchestrator(Supplier<WebServerOrchestrator> factory, WebServerSessionCache cache, Metrics<?> metrics) {
        Objects.requireNonNull(factory, "Orchestrator factory required");
        Objects.requireNonNull(cache, "Session cache required");
        Objects.requireNonNull(metrics, "Metrics required");

        this.factory = factory;
        this.cache = cache;
        this.metrics = metrics;

        this.metrics.register(WebProxyServerOrchestrator.METRIC_SESSIONS, (Gauge<Long>) this.cache::size);
    }

    public void handleRequest(HttpServletRequest request, HttpServletResponse response) {
        this.handleRequest(request, response, null);
    }

    /**
     * Serves one relay request. Failures are written to the response as an error envelope and never thrown.
     *
     * @param customizer applied to the session orchestrator before the step runs, may be null
     */
    public void handleRequest(HttpServletRequest request, HttpServletResponse response, Consumer<WebServerOrchestrator> customizer) {
        try (Timer.Context ignored = this.metrics.timer("relay", "duration").time()) {
            String sessionId = WebProxyServerOrchestrator.requireHeader(request, SyncHeaders.SESSION_ID);
            HttpStep step = WebProxyServerOrchestrator.parseStep(WebProxyServerOrchestrator.requireHeader(request, SyncHeaders.STEP));

            this.metrics.counter("relay", "requests", step.name().toLowerCase(Locale.ROOT)).inc();

            WebServerOrchestrator orchestrator = this.orchestrator(sessionId);

            if (customizer != null) {
                customizer.accept(orchestrator);
            }

            SerializationFormat format = WebProxyServerOrchestrator.parseFormat(request.getHeader(SyncHeaders.SERIALIZATION_FORMAT));
            SerializerFactory serializerFactory = WebProxyServerOrchestrator.resolveSerializer(orchestrator.getWebServerOptions(), format);
            Converter converter = WebProxyServerOrchestrator.resolveConverter(orchestrator.getWebServerOptions(), request.getHeader(SyncHeaders.CONVERTER));

            orchestrator.setSerializerFactory(serializerFactory);
            orchestrator.setConverter(converter);

            int batchSize = (format.getBatchSize() > 0) ? format.getBatchSize() : orchestrator.getOptions().getBatchSize();
            byte[] body = WebProxyServerOrchestrator.readBody(request);
            byte[] payload;

            switch (step) {
                case ENSURE_SCOPES: {
                    HttpMessageEnsureScopesResponse result = orchestrator.ensureScopes(
                            serializerFactory.getSerializer(HttpMessageEnsureScopesRequest.class).deserialize(body)
                    );

                    payload = serializerFactory.getSerializer(HttpMessageEnsureScopesResponse.class).serialize(result);
                    break;
                }
                case SEND_CHANGES: {
                    HttpMessageSendChangesResponse result = orchestrator.applyThenGetChanges(
                            serializerFactory.getSerializer(HttpMessageSendChangesRequest.class).deserialize(body),
                            batchSize
                    );

                    payload = serializerFactory.getSerializer(HttpMessageSendChangesResponse.class).serialize(result);
                    break;
                }
                case GET_CHANGES: {
                    HttpMessageSendChangesResponse result = orchestrator.getMoreChanges(
                            serializerFactory.getSerializer(HttpMessageGetMoreChangesRequest.class).deserialize(body)
                    );

                    payload = serializerFactory.getSerializer(HttpMessageSendChangesResponse.class).serialize(result);
                    break;
                }
                default:
                    throw new HttpUnsupportedStepException(step.name());
            }

            this.cache.put(sessionId, orchestrator);

            response.setHeader(SyncHeaders.SESSION_ID, sessionId);
            response.setHeader(SyncHeaders.SERIALIZATION_FORMAT, serializerFactory.getKey());
            response.setContentType("application/octet-stream");
            response.setStatus(HttpServletResponse.SC_OK);

            WebProxyServerOrchestrator.write(request, response, payload);
        } catch (Exception exception) {
            this.metrics.counter("relay", "errors").inc();
            this.writeError(response, exception);
        }
    }

    private WebServerOrchestrator orchestrator(String sessionId) {
        Optional<WebServerOrchestrator> cached = this.cache.get(sessionId);

        if (cached.isPresent()) {
            return cached.get();
        }

        WebServerOrchestrator orchestrator = this.factory.get();

        this.cache.put(sessionId, orchestrator);

        WebProxyServerOrchestrator.LOG.debug(String.format("new session %s", sessionId));

        return orchestrator;
    }

    private void writeError(HttpServletResponse response, Exception exception) {
        SyncException syncException;

        if (SyncException.class.isInstance(exception)) {
            syncException = SyncException.class.cast(exception);
        } else {
            syncException = new SyncException(exception, SyncStage.NONE);
            syncException.setSide(SyncSide.SERVER);
        }

        WebProxyServerOrchestrator.LOG.warn(String.format("relay request failed at %s: %s", syncException.getStage(), syncException.getMessage()));

        try {
            byte[] envelope = WebProxyServerOrchestrator.MAPPER.writeValueAsBytes(HttpErrorMessage.of(syncException));

            if (!response.isCommitted()) {
                response.reset();
            }

            response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
            response.setContentType("application/json");
            response.setContentLength(envelope.length);

            try (OutputStream outputStream = response.getOutputStream()) {
                outputStream.write(envelope);
            }
        } catch (IOException ioException) {
            WebProxyServerOrchestrator.LOG.error("error writing relay error response", ioException);
        }
    }

    private static String requireHeader(HttpServletRequest request, String name) throws HttpHeaderMissingException {
        String value = request.getHeader(name);

        if (value == null || value.isEmpty()) {
            throw new HttpHeaderMissingException(name);
        }

        return value;
    }

    private static HttpStep parseStep(String value) throws HttpUnsupportedStepException {
        HttpStep step;

        try {
            step = HttpStep.of(Integer.parseInt(value.trim()));
        } catch (IllegalArgumentException exception) {
            throw new HttpUnsupportedStepException(value);
        }

        if (step == HttpStep.IN_PROGRESS) {
            throw new HttpUnsupportedStepException(step.name());
        }

        return step;
    }

    private static SerializationFormat parseFormat(String header) {
        if (header == null || header.isEmpty()) {
            return new SerializationFormat();
        }

        try {
            return SerializationFormat.parse(header);
        } catch (IOException exception) {
            WebProxyServerOrchestrator.LOG.debug(String.format("unreadable serialization format header: %s", header), exception);

            return new SerializationFormat();
        }
    }

    private static SerializerFactory resolveSerializer(WebServerOptions options, SerializationFormat format) throws HttpSerializerNotConfiguredException {
        NamedRegistry<SerializerFactory> serializers = options.getSerializers();
        Optional<SerializerFactory> serializerFactory = (format.getFormat() != null) ? serializers.find(format.getFormat()) : Optional.empty();

        return serializerFactory.orElseThrow(() -> new HttpSerializerNotConfiguredException(serializers.names()));
    }

    private static Converter resolveConverter(WebServerOptions options, String name) throws HttpConverterNotConfiguredException {
        if (name == null || name.isEmpty()) {
            return null;
        }

        NamedRegistry<Converter> converters = options.getConverters();

        return converters.find(name).orElseThrow(() -> new HttpConverterNotConfiguredException(converters.names()));
    }

    private static byte[] readBody(HttpServletRequest request) throws IOException {
        try (InputStream inputStream = request.getInputStream()) {
            return (inputStream != null) ? inputStream.readAllBytes() : new byte[0];
        }
    }

    private static void write(HttpServletRequest request, HttpServletResponse response, byte[] payload) throws IOException {
        String acceptEncoding = request.getHeader("Accept-Encoding");

        if (acceptEncoding != null) {
            String encodings = acceptEncoding.toLowerCase(Locale.ROOT);

            if (encodings.contains("gzip") || encodings.contains("deflate")) {
                ByteArrayOutputStream compressed = new ByteArrayOutputStream();

                try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
                    gzip.write(payload);
                }

                payload = compressed.toByteArray();
                response.setHeader("Content-Encoding", "gzip");
            }
        }

        response.setContentLength(payload.length);

        try (OutputStream outputStream = response.getOutputStream()) {
            outputStream.write(payload);
        }
    }
}
