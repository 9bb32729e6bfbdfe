package com.booking.sync.commons.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Reporter;
import com.codahale.metrics.Timer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

public abstract class Metrics<CloseableReporter extends Closeable & Reporter> implements Closeable {
    private static final Logger LOG = LogManager.getLogger(Metrics.class);

    public enum Type {
        CONSOLE {
            @Override
            protected Metrics<?> newInstance(Map<String, Object> configuration) {
                return new LogReporterMetrics(configuration);
            }
        },
        JMX {
            @Override
            protected Metrics<?> newInstance(Map<String, Object> configuration) {
                return new JmxReporterMetrics(configuration);
            }
        };

        protected abstract Metrics<?> newInstance(Map<String, Object> configuration);
    }

    public interface Configuration {
        String TYPE = "metrics.type";
        String BASE_PATH = "metrics.base_path";
        String REPORT_INTERVAL_SECONDS = "metrics.report.interval.seconds";
    }

    public static final String DEFAULT_BASE_PATH = "sync";
    public static final String DEFAULT_REPORT_INTERVAL_SECONDS = "60";

    private final MetricRegistry registry;
    private final CloseableReporter reporter;
    private final String basePath;

    public Metrics(Map<String, Object> configuration) {
        this.registry = new MetricRegistry();
        this.reporter = this.getReporter(configuration, this.registry);
        this.basePath = Metrics.basePathOf(configuration);
    }

    public MetricRegistry getRegistry() {
        return this.registry;
    }

    public String basePath() {
        return this.basePath;
    }

    public Counter counter(String... names) {
        return this.registry.counter(MetricRegistry.name(this.basePath, names));
    }

    public Timer timer(String... names) {
        return this.registry.timer(MetricRegistry.name(this.basePath, names));
    }

    public void incrementCounter(String name, long value) {
        this.counter(name).inc(value);
    }

    public <T extends Metric> T register(String name, T metric) {
        String fullName = MetricRegistry.name(this.basePath, name);

        if (this.registry.remove(fullName)) {
            Metrics.LOG.warn(String.format("Metric %s already registered.", fullName));
        }

        T response = this.registry.register(fullName, metric);

        Metrics.LOG.info(String.format("Metric %s registered", fullName));

        return response;
    }

    @Override
    public void close() throws IOException {
        this.reporter.close();
    }

    protected abstract CloseableReporter getReporter(Map<String, Object> configuration, MetricRegistry registry);

    static String basePathOf(Map<String, Object> configuration) {
        return String.valueOf(configuration.getOrDefault(Configuration.BASE_PATH, Metrics.DEFAULT_BASE_PATH));
    }

    public static Metrics<?> build(Map<String, Object> configuration) {
        return Metrics.Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.CONSOLE.name()).toString().toUpperCase()
        ).newInstance(configuration);
    }
}
