package com.keyhive.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a range reached {@link RangeStatus#COMPLETED}.
 */
public enum RecordOutcome {
    @JsonProperty("exhausted")
    EXHAUSTED,
    @JsonProperty("found")
    FOUND,
    /**
     * Overlapped a range in which the target was found.
     */
    @JsonProperty("superseded")
    SUPERSEDED
}
