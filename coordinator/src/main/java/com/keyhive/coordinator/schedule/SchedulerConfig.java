package com.keyhive.coordinator.schedule;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Thresholds of the priority and recommendation rules.
 */
@Value
@Builder(toBuilder = true)
public class SchedulerConfig {

    @Builder.Default
    double highRateThreshold = 1e9;

    @Builder.Default
    double slowRateFloor = 5e8;

    @Builder.Default
    Duration staleAfter = Duration.ofHours(2);

    @Builder.Default
    int selectionSize = 3;

    /**
     * Percent at which a high-band range counts as exhausted.
     */
    @Builder.Default
    BigDecimal highBandExhaustedPct = BigDecimal.valueOf(95);

    @Builder.Default
    int splitPriorityActive = 70;

    @Builder.Default
    int splitPriorityPending = 50;

    public static SchedulerConfig defaults() {
        return SchedulerConfig.builder().build();
    }
}
