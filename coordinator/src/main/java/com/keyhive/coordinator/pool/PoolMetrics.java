package com.keyhive.coordinator.pool;

import com.keyhive.core.metrics.MetricsNames;
import com.keyhive.core.metrics.MetricsTags;
import com.keyhive.core.model.RangeTier;
import com.keyhive.core.model.RecordOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.function.Supplier;

/**
 * Assignment lifecycle meters.
 */
class PoolMetrics {
    private final MeterRegistry registry;
    private final Counter expired;
    private final Counter abandoned;

    PoolMetrics(MeterRegistry registry, Supplier<Number> liveAssignments) {
        this.registry = registry;
        this.expired = Counter.builder(MetricsNames.ASSIGNMENTS_EXPIRED_TOTAL)
            .description("Assignments whose lease ran out")
            .register(registry);
        this.abandoned = Counter.builder(MetricsNames.ASSIGNMENTS_ABANDONED_TOTAL)
            .description("Assignments released voluntarily")
            .register(registry);
        Gauge.builder(MetricsNames.ASSIGNMENTS_LIVE, liveAssignments)
            .description("Assignments currently live")
            .register(registry);
    }

    void granted(RangeTier tier) {
        Counter.builder(MetricsNames.ASSIGNMENTS_GRANTED_TOTAL)
            .tag(MetricsTags.TIER, tier == null ? "unknown" : tier.name().toLowerCase())
            .register(registry)
            .increment();
    }

    void completed(RecordOutcome outcome) {
        Counter.builder(MetricsNames.ASSIGNMENTS_COMPLETED_TOTAL)
            .tag(MetricsTags.OUTCOME, outcome.name().toLowerCase())
            .register(registry)
            .increment();
    }

    void expired() {
        expired.increment();
    }

    void abandoned() {
        abandoned.increment();
    }
}
