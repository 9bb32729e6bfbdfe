package com.booking.sync.commons.metrics;

import com.codahale.metrics.MetricFilter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;

import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Periodically logs the sync metrics (sessions, per step request counters, errors, request timings) through the
 * {@code com.booking.sync.metrics} logger.
 */
public class LogReporterMetrics extends Metrics<Slf4jReporter> {
    static final String LOGGER_NAME = "com.booking.sync.metrics";

    public LogReporterMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected Slf4jReporter getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        long interval = Long.parseLong(
                configuration.getOrDefault(Metrics.Configuration.REPORT_INTERVAL_SECONDS, Metrics.DEFAULT_REPORT_INTERVAL_SECONDS).toString()
        );

        Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
                .outputTo(LoggerFactory.getLogger(LogReporterMetrics.LOGGER_NAME))
                .filter(MetricFilter.startsWith(Metrics.basePathOf(configuration)))
                .convertRatesTo(TimeUnit.SECONDS)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();

        reporter.start(interval, TimeUnit.SECONDS);

        return reporter;
    }
}
