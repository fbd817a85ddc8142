package com.keyhive.coordinator.partition;

import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.keyspace.KeyspaceMath;
import com.keyhive.core.model.Range;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.model.RangeTier;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a probability estimate over the keyspace into concrete range bounds.
 * <p>
 * Manifest generation is a pure function of the estimate and the partition
 * config; only {@code created_at} stamps come from the clock.
 * </p>
 */
public class KeyspacePartitioner {
    public static final String CORE_ID = "high_priority";
    public static final String FALLBACK_PREFIX = "fallback_";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Clock clock;

    public KeyspacePartitioner(Clock clock) {
        this.clock = clock;
    }

    /**
     * {@code rangeMin + floor(percent / 100 * rangeSize)} in exact integer arithmetic.
     */
    public BigInteger positionToOffset(BigDecimal percent, BigInteger rangeMin, BigInteger rangeSize) {
        return KeyspaceMath.positionToOffset(percent, rangeMin, rangeSize);
    }

    public Manifest generateManifest(Estimate estimate, PartitionConfig config) {
        if (estimate == null) {
            throw new ValidationException("Missing estimate");
        }
        estimate.validate();
        if (config.getSplitCount() < 1) {
            throw new ValidationException("Split count must be at least 1, got " + config.getSplitCount());
        }
        BigDecimal padding = config.getBandPaddingPct();
        if (padding == null || padding.signum() < 0) {
            throw new ValidationException("Band padding must be a non-negative percentage");
        }

        KeyRange keyspace = config.getKeyspace();
        BigInteger coreStart = positionToOffset(clampPercent(estimate.getCiLower().subtract(padding)),
            keyspace.start(), keyspace.size());
        BigInteger coreEnd = positionToOffset(clampPercent(estimate.getCiUpper().add(padding)),
            keyspace.start(), keyspace.size());
        if (coreStart.compareTo(coreEnd) >= 0) {
            throw new ValidationException("Confidence band [" + estimate.getCiLower().toPlainString() + ", "
                + estimate.getCiUpper().toPlainString() + "] is empty over " + keyspace);
        }

        Instant now = clock.instant();
        KeyRange coreRange = KeyRange.of(coreStart, coreEnd);
        Range core = Range.builder()
            .id(CORE_ID)
            .start(coreStart)
            .end(coreEnd)
            .priority(config.getCorePriority())
            .status(RangeStatus.PENDING)
            .tier(RangeTier.HIGH)
            .description("High-likelihood band " + estimate.getCiLower().toPlainString() + "%-"
                + estimate.getCiUpper().toPlainString() + "% (central " + estimate.getCentralEstimate().toPlainString() + "%)")
            .createdAt(now)
            .build();

        List<KeyRange> pieces = coreRange.split(config.getSplitCount());
        List<Range> splits = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            KeyRange piece = pieces.get(i);
            splits.add(Range.builder()
                .id(CORE_ID + "_split_" + i)
                .start(piece.start())
                .end(piece.end())
                .priority(config.getSplitPriority())
                .status(RangeStatus.PENDING)
                .tier(RangeTier.HIGH)
                .parentId(CORE_ID)
                .splitReason("parallel")
                .description("Parallel split " + (i + 1) + " of " + pieces.size())
                .createdAt(now)
                .build());
        }

        List<Range> fallback = new ArrayList<>(2);
        if (keyspace.start().compareTo(coreStart) < 0) {
            fallback.add(fallbackRange(fallback.size(), keyspace.start(), coreStart, "Below high-likelihood band", config, now));
        }
        if (coreEnd.compareTo(keyspace.end()) < 0) {
            fallback.add(fallbackRange(fallback.size(), coreEnd, keyspace.end(), "Above high-likelihood band", config, now));
        }

        return Manifest.builder()
            .core(core)
            .parallelSplits(splits)
            .fallback(fallback)
            .build();
    }

    private Range fallbackRange(int idx, BigInteger start, BigInteger end, String description,
                                PartitionConfig config, Instant now) {
        int priority = config.getFallbackBasePriority() - idx * config.getFallbackPriorityStep();
        return Range.builder()
            .id(FALLBACK_PREFIX + idx)
            .start(start)
            .end(end)
            .priority(Math.max(0, Math.min(100, priority)))
            .status(RangeStatus.PENDING)
            .tier(RangeTier.FALLBACK)
            .description(description)
            .createdAt(now)
            .build();
    }

    private static BigDecimal clampPercent(BigDecimal percent) {
        if (percent.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return percent.compareTo(HUNDRED) > 0 ? HUNDRED : percent;
    }
}
