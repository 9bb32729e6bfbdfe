package com.booking.sync.commons.metrics;

import com.codahale.metrics.MetricFilter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Exposes the sync metrics as MBeans under a JMX domain named after the metrics base path.
 */
public class JmxReporterMetrics extends Metrics<JmxReporter> {

    public JmxReporterMetrics(Map<String, Object> configuration) {
        super(configuration);
    }

    @Override
    protected JmxReporter getReporter(Map<String, Object> configuration, MetricRegistry registry) {
        String basePath = Metrics.basePathOf(configuration);

        JmxReporter reporter = JmxReporter.forRegistry(registry)
                .inDomain(basePath)
                .filter(MetricFilter.startsWith(basePath))
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .build();

        reporter.start();

        return reporter;
    }
}
