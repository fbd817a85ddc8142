package com.keyhive.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Band a range belongs to. Children inherit their parent's tier.
 */
public enum RangeTier {
    /**
     * Estimator's high-likelihood core band and its splits.
     */
    @JsonProperty("high")
    HIGH,
    @JsonProperty("fallback")
    FALLBACK,
    /**
     * Registered from caller-supplied bounds.
     */
    @JsonProperty("custom")
    CUSTOM
}
