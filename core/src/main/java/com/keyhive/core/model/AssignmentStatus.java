package com.keyhive.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AssignmentStatus {
    @JsonProperty("assigned")
    ASSIGNED,
    @JsonProperty("reporting")
    REPORTING,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("abandoned")
    ABANDONED,
    @JsonProperty("expired")
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}
