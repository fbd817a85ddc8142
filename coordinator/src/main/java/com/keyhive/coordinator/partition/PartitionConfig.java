package com.keyhive.coordinator.partition;

import com.keyhive.core.keyspace.KeyRange;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Fixed constants the manifest is generated from.
 */
@Value
@Builder(toBuilder = true)
public class PartitionConfig {

    KeyRange keyspace;

    @Builder.Default
    int splitCount = 3;

    /**
     * Percent points added below the lower and above the upper confidence bound.
     */
    @Builder.Default
    BigDecimal bandPaddingPct = BigDecimal.ZERO;

    // Priority buckets
    @Builder.Default
    int corePriority = 90;
    @Builder.Default
    int splitPriority = 80;
    @Builder.Default
    int fallbackBasePriority = 40;
    @Builder.Default
    int fallbackPriorityStep = 5;
}
