package com.keyhive.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Range tier (high/fallback/custom).
     */
    public static final String TIER = "tier";

    public static final String OUTCOME = "outcome";
}
