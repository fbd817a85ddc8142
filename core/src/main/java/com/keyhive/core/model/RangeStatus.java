package com.keyhive.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a keyspace range.
 * <p>
 * {@code pending -> active -> completed}; {@code abandoned} and {@code split}
 * are operator and scheduler exits. A terminal range is never scheduled again.
 * </p>
 */
public enum RangeStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("active")
    ACTIVE,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("abandoned")
    ABANDONED,
    /**
     * Interval handed over to child ranges; kept for audit only.
     */
    @JsonProperty("split")
    SPLIT;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED || this == SPLIT;
    }
}
