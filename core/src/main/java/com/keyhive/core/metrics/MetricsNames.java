package com.keyhive.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code keyhive.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Assignments handed out.
     * <p>
     * Tags: tier
     * </p>
     */
    public static final String ASSIGNMENTS_GRANTED_TOTAL = "keyhive.pool.assignments.granted.total";

    /**
     * Counter: Assignments whose lease ran out without a report.
     */
    public static final String ASSIGNMENTS_EXPIRED_TOTAL = "keyhive.pool.assignments.expired.total";

    /**
     * Counter: Assignments released voluntarily.
     */
    public static final String ASSIGNMENTS_ABANDONED_TOTAL = "keyhive.pool.assignments.abandoned.total";

    /**
     * Counter: Assignments finished.
     * <p>
     * Tags: outcome (exhausted/found)
     * </p>
     */
    public static final String ASSIGNMENTS_COMPLETED_TOTAL = "keyhive.pool.assignments.completed.total";

    /**
     * Gauge: Assignments currently live.
     */
    public static final String ASSIGNMENTS_LIVE = "keyhive.pool.assignments.live";

    /**
     * Counter: Accepted progress updates written to the ledger.
     */
    public static final String LEDGER_UPDATES_TOTAL = "keyhive.ledger.updates.total";

    /**
     * Gauge: Aggregate keyspace coverage in percent.
     */
    public static final String COVERAGE_PERCENT = "keyhive.ledger.coverage.percent";

    /**
     * Counter: Ranges split by the scheduler.
     */
    public static final String RANGES_SPLIT_TOTAL = "keyhive.scheduler.splits.total";
}
