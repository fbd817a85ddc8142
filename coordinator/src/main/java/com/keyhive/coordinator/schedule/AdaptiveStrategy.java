package com.keyhive.coordinator.schedule;

import com.keyhive.core.model.Coverage;
import com.keyhive.core.model.Range;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.model.RangeTier;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Scheduler snapshot written to {@code strategy.json} on every tick.
 */
@Value
@Builder
@Jacksonized
public class AdaptiveStrategy {
    Instant generatedAt;

    /**
     * Schedulable ranges with their live score.
     */
    List<ScoredRange> currentRanges;

    List<String> completedRanges;

    List<Range> nextRecommended;

    Coverage coverage;

    /**
     * Exact coverage of the high band alone.
     */
    BigDecimal highPriorityComplete;

    List<String> recommendations;

    @Value
    @Builder
    @Jacksonized
    public static class ScoredRange {
        String id;
        BigInteger start;
        BigInteger end;
        RangeTier tier;
        RangeStatus status;
        int score;
        int storedPriority;
        BigDecimal percentComplete;
        double searchRate;
    }
}
