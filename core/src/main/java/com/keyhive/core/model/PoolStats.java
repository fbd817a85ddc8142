package com.keyhive.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Read-only, eventually consistent view of pool progress.
 * <p>
 * {@code stale} is set by the participant when the snapshot is a cached copy
 * served because the coordinator could not be reached in time.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class PoolStats {
    /**
     * Distinct participants that ever held an assignment.
     */
    int participantCount;

    /**
     * Participants currently holding a live assignment.
     */
    int activeParticipants;

    int rangesCompleted;

    int rangesTotal;

    BigInteger totalKeyspace;

    BigInteger searchedKeyspace;

    BigDecimal keyspaceCoveredPct;

    List<Contribution> contributions;

    Contribution yourContribution;

    Instant generatedAt;

    boolean stale;

    @Value
    @Builder
    @Jacksonized
    public static class Contribution {
        String clientId;

        int rangesCompleted;

        BigInteger keysSearched;

        /**
         * 1-based; by keys searched, then ranges completed.
         */
        int rank;
    }
}
