package com.booking.sync.web.server;

import com.booking.sync.commons.conf.ConfigurationLoader;
import com.booking.sync.commons.metrics.Metrics;
import com.booking.sync.core.orchestrator.SyncOptions;
import com.booking.sync.core.provider.SyncProvider;
import com.booking.sync.model.schema.SyncSetup;

import com.google.common.base.Splitter;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Standalone relay: one provider, one setup and one scope served over embedded Jetty.
 */
public class SyncRelayServer {

    public interface Configuration {
        String SCOPE_NAME = "sync.scope.name";
        String SETUP_TABLES = "sync.setup.tables";
        String CHANGES_HANDLER_CLASS = "sync.changes.handler.class";
    }

    private static final Logger LOG = LogManager.getLogger(SyncRelayServer.class);
    private static final String COMMAND_LINE_SYNTAX = "java -jar sync-web-server-<version>.jar";

    private final SyncProvider provider;
    private final Metrics<?> metrics;
    private final WebServerSessionCache cache;
    private final WebProxyServerOrchestrator relay;
    private final JettyWebServer webServer;

    public SyncRelayServer(Map<String, Object> configuration) {
        Object tables = configuration.get(Configuration.SETUP_TABLES);

        Objects.requireNonNull(tables, String.format("Configuration required: %s", Configuration.SETUP_TABLES));

        SyncSetup setup = new SyncSetup(SyncRelayServer.tables(tables).toArray(new String[0]));
        SyncOptions options = SyncOptions.build(configuration);
        String scopeName = configuration.getOrDefault(Configuration.SCOPE_NAME, SyncOptions.DEFAULT_SCOPE_NAME).toString();
        ChangesHandler changesHandler = SyncRelayServer.changesHandler(configuration);

        this.provider = SyncProvider.build(configuration);
        this.metrics = Metrics.build(configuration);
        this.cache = new WebServerSessionCache(configuration);
        this.relay = new WebProxyServerOrchestrator(
                () -> new WebServerOrchestrator(
                        this.provider,
                        options,
                        setup,
                        scopeName,
                        new WebServerOptions().withChangesHandler(changesHandler)
                ),
                this.cache,
                this.metrics
        );
        this.webServer = new JettyWebServer(configuration, this.relay, this.cache);
    }

    public void start() throws IOException {
        SyncRelayServer.LOG.info(String.format("starting relay for provider %s", this.provider.getProviderTypeName()));

        this.webServer.start();
    }

    public void stop() {
        SyncRelayServer.LOG.info("stopping web server");
        SyncRelayServer.close(this.webServer);

        SyncRelayServer.LOG.info("closing metrics");
        SyncRelayServer.close(this.metrics);

        if (Closeable.class.isInstance(this.provider)) {
            SyncRelayServer.LOG.info("closing provider");
            SyncRelayServer.close(Closeable.class.cast(this.provider));
        }
    }

    public JettyWebServer getWebServer() {
        return this.webServer;
    }

    public WebProxyServerOrchestrator getRelay() {
        return this.relay;
    }

    private static void close(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException exception) {
            SyncRelayServer.LOG.error("error stopping relay", exception);
        }
    }

    static List<String> tables(Object value) {
        List<String> tables = new ArrayList<>();

        if (Collection.class.isInstance(value)) {
            for (Object table : Collection.class.cast(value)) {
                tables.add(table.toString().trim());
            }
        } else {
            Splitter.on(',').trimResults().omitEmptyStrings().split(value.toString()).forEach(tables::add);
        }

        return tables;
    }

    static ChangesHandler changesHandler(Map<String, Object> configuration) {
        Object handlerClass = configuration.get(Configuration.CHANGES_HANDLER_CLASS);

        if (handlerClass == null) {
            SyncRelayServer.LOG.warn(String.format("%s not set, change exchange steps will be rejected", Configuration.CHANGES_HANDLER_CLASS));
            return null;
        }

        try {
            return Class.forName(handlerClass.toString())
                    .asSubclass(ChangesHandler.class)
                    .getConstructor()
                    .newInstance();
        } catch (ClassNotFoundException | NoSuchMethodException | InstantiationException | IllegalAccessException exception) {
            throw new IllegalArgumentException(String.format("Cannot build changes handler %s", handlerClass), exception);
        } catch (InvocationTargetException exception) {
            throw new IllegalStateException(String.format("Cannot build changes handler %s", handlerClass), exception.getCause());
        }
    }

    static Options options() {
        Options options = new Options();

        options.addOption(Option.builder().longOpt("help").desc("print the help message").build());
        options.addOption(Option.builder().longOpt("config").argName("key-value").desc("the configuration to be used with the format <key>=<value>").hasArgs().build());
        options.addOption(Option.builder().longOpt("config-file").argName("filename").desc("the configuration file to be used (YAML)").hasArg().build());

        return options;
    }

    static Map<String, Object> configuration(CommandLine line) throws IOException {
        ConfigurationLoader loader = new ConfigurationLoader();

        if (line.hasOption("config-file")) {
            loader.withYaml(new File(line.getOptionValue("config-file")));
        }

        if (line.hasOption("config")) {
            loader.withKeyValues(line.getOptionValues("config"));
        }

        return loader.load();
    }

    /*
     * Start the JVM with the argument -Djava.util.logging.manager=org.apache.logging.log4j.jul.LogManager
     */
    public static void main(String[] arguments) {
        Options options = SyncRelayServer.options();

        try {
            CommandLine line = new DefaultParser().parse(options, arguments);

            if (line.hasOption("help")) {
                new HelpFormatter().printHelp(SyncRelayServer.COMMAND_LINE_SYNTAX, options);
            } else {
                SyncRelayServer server = new SyncRelayServer(SyncRelayServer.configuration(line));

                Runtime.getRuntime().addShutdownHook(new Thread(server::stop));

                server.start();
            }
        } catch (Exception exception) {
            SyncRelayServer.LOG.error("Error in relay", exception);
            new HelpFormatter().printHelp(SyncRelayServer.COMMAND_LINE_SYNTAX, null, options, exception.getMessage());
        }
    }
}
