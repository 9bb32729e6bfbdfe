package com.booking.sync.web.server;

import com.booking.sync.web.server.servlet.HealthCheckServlet;
import com.booking.sync.web.server.servlet.SyncRelayServlet;

import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Embedded Jetty serving the relay on POST and a health check on GET.
 */
public class JettyWebServer implements Closeable {
    private static final Logger LOG = LogManager.getLogger(JettyWebServer.class);

    public interface Configuration {
        String PORT = "webserver.port";
        String RELAY_PATH = "webserver.relay.path";
        String HEALTHCHECK_PATH = "webserver.healthcheck.path";
    }

    public static final int DEFAULT_PORT = 9999;
    public static final String DEFAULT_RELAY_PATH = "/sync";
    public static final String DEFAULT_HEALTHCHECK_PATH = "/healthcheck";

    private final Server server;
    private final String relayPath;

    public JettyWebServer(Map<String, Object> configuration, WebProxyServerOrchestrator relay, WebServerSessionCache cache) {
        int port = Integer.parseInt(configuration.getOrDefault(Configuration.PORT, JettyWebServer.DEFAULT_PORT).toString());

        this.relayPath = configuration.getOrDefault(Configuration.RELAY_PATH, JettyWebServer.DEFAULT_RELAY_PATH).toString();
        this.server = new Server(port);

        ServletHandler servletHandler = new ServletHandler();
        this.server.setHandler(servletHandler);

        servletHandler.addServletWithMapping(new ServletHolder(new SyncRelayServlet(relay)), this.relayPath);
        servletHandler.addServletWithMapping(
                new ServletHolder(new HealthCheckServlet(cache)),
                configuration.getOrDefault(Configuration.HEALTHCHECK_PATH, JettyWebServer.DEFAULT_HEALTHCHECK_PATH).toString()
        );
    }

    public void start() throws IOException {
        try {
            this.server.start();

            JettyWebServer.LOG.info(String.format("relay listening on port %d at %s", this.getPort(), this.relayPath));
        } catch (Exception exception) {
            throw new IOException("Error while starting server", exception);
        }
    }

    public void stop() throws IOException {
        try {
            this.server.stop();
        } catch (Exception exception) {
            throw new IOException("Error while stopping server", exception);
        }
    }

    /**
     * Port the server is bound to, resolved after start when configured as 0.
     */
    public int getPort() {
        return ((ServerConnector) this.server.getConnectors()[0]).getLocalPort();
    }

    public String getRelayPath() {
        return this.relayPath;
    }

    public Server getServer() {
        return this.server;
    }

    @Override
    public void close() throws IOException {
        this.stop();
    }
}
