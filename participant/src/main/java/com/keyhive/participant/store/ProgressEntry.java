package com.keyhive.participant.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One line of the local progress history, written before the pool hears about it.
 */
@Value
@Builder
@Jacksonized
public class ProgressEntry {
    String assignmentId;
    String rangeId;
    BigInteger searchedKeys;
    Double searchRate;
    Status status;
    Instant recordedAt;

    public enum Status {
        @JsonProperty("searching")
        SEARCHING,
        @JsonProperty("completed")
        COMPLETED,
        @JsonProperty("abandoned")
        ABANDONED
    }
}
