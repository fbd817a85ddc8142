package com.keyhive.coordinator.metrics;

import com.keyhive.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Prometheus scrape endpoint backed by reactor-netty's global composite registry.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this(Metrics.REGISTRY, nodeId);
    }

    /**
     * @param registry registry the pool meters are written to; scraped directly
     *                 when it is a Prometheus registry, joined when it is a composite
     */
    public PrometheusMetricsExporter(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        if (registry instanceof PrometheusMeterRegistry prometheus) {
            this.prometheusRegistry = prometheus;
        } else {
            this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
            if (registry instanceof CompositeMeterRegistry composite) {
                composite.add(prometheusRegistry);
            }
        }
        registry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Metrics exporter initialized for node {}", nodeId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
