package com.keyhive.coordinator.schedule;

import com.keyhive.coordinator.ledger.ProgressLedger;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.keyspace.KeyspaceMath;
import com.keyhive.core.metrics.MetricsNames;
import com.keyhive.core.model.Coverage;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.model.Range;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.model.RangeTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores ranges from live throughput and coverage, recommends operator
 * actions, picks the next ranges to hand out and splits ranges on demand.
 * <p>
 * Every read works on a snapshot passed in by the caller, so scoring never
 * blocks ledger writers. The only mutating operation is {@link #splitRange}.
 * </p>
 */
public class AdaptiveScheduler {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveScheduler.class);

    private static final int BASE_PRIORITY = 50;
    private static final BigDecimal HEAVILY_SEARCHED_PCT = BigDecimal.valueOf(75);
    private static final BigDecimal HALF_SEARCHED_PCT = BigDecimal.valueOf(50);
    private static final BigDecimal NEARLY_DONE_PCT = BigDecimal.valueOf(90);
    private static final BigDecimal JUST_STARTED_PCT = BigDecimal.valueOf(10);

    private final ProgressLedger ledger;
    private final SchedulerConfig config;
    private final Clock clock;
    private final Counter splitCounter;

    public AdaptiveScheduler(ProgressLedger ledger, SchedulerConfig config, Clock clock, MeterRegistry meterRegistry) {
        this.ledger = ledger;
        this.config = config;
        this.clock = clock;
        this.splitCounter = Counter.builder(MetricsNames.RANGES_SPLIT_TOTAL)
            .description("Ranges split into children")
            .register(meterRegistry);
    }

    // ========== Scoring ==========

    /**
     * Base 50; +20 above the high-throughput threshold; -30 above 75% searched,
     * -15 above 50%; clamped to {@code [0, 100]}.
     */
    public int priority(ProgressRecord record) {
        int priority = BASE_PRIORITY;
        if (record.getSearchRate() > config.getHighRateThreshold()) {
            priority += 20;
        }
        BigDecimal percent = record.getPercentComplete();
        if (percent.compareTo(HEAVILY_SEARCHED_PCT) > 0) {
            priority -= 30;
        } else if (percent.compareTo(HALF_SEARCHED_PCT) > 0) {
            priority -= 15;
        }
        return Math.max(0, Math.min(100, priority));
    }

    /**
     * True when every high-band range is searched past the exhaustion threshold.
     * Split parents and abandoned ranges are not counted. Vacuously true when
     * there is no high band at all.
     */
    public boolean highBandExhausted(Collection<ProgressRecord> all) {
        return all.stream()
            .filter(AdaptiveScheduler::inHighBand)
            .allMatch(r -> r.getStatus() == RangeStatus.COMPLETED
                || r.getPercentComplete().compareTo(config.getHighBandExhaustedPct()) >= 0);
    }

    // ========== Recommendations ==========

    /**
     * Independent operator hints; any number of rules may fire at once.
     */
    public List<String> recommendations(List<ProgressRecord> all, Set<String> completed) {
        List<String> messages = new ArrayList<>();

        boolean hasHighBand = all.stream().anyMatch(AdaptiveScheduler::inHighBand);
        if (hasHighBand && highBandExhausted(all)) {
            boolean fallbackLeft = all.stream()
                .anyMatch(r -> r.getTier() == RangeTier.FALLBACK && isSchedulable(r, completed));
            messages.add("High-priority band exhausted (every range >= "
                + config.getHighBandExhaustedPct().toPlainString() + "%)"
                + (fallbackLeft ? ": activate fallback ranges." : "; no fallback ranges left."));
        }

        List<String> slow = all.stream()
            .filter(r -> r.getStatus() == RangeStatus.ACTIVE)
            .filter(r -> r.getSearchRate() > 0 && r.getSearchRate() < config.getSlowRateFloor())
            .map(ProgressRecord::getRangeId)
            .collect(Collectors.toList());
        if (!slow.isEmpty()) {
            messages.add(slow.size() + " range(s) below " + String.format("%.1e", config.getSlowRateFloor())
                + " keys/s; consider faster workers: " + String.join(", ", slow));
        }

        List<ProgressRecord> stalled = stalled(all);
        if (!stalled.isEmpty()) {
            messages.add(stalled.size() + " range(s) appear stalled (no update for "
                + config.getStaleAfter().toMinutes() + " min): "
                + stalled.stream().map(ProgressRecord::getRangeId).collect(Collectors.joining(", ")));
        }

        Coverage coverage = ProgressLedger.coverageOf(all);
        if (coverage.getTotalKeyspace().signum() > 0) {
            BigDecimal percent = coverage.getPercentComplete();
            if (percent.compareTo(NEARLY_DONE_PCT) > 0) {
                messages.add("Over 90% of the keyspace searched: activate any remaining fallback ranges.");
            } else if (percent.compareTo(HALF_SEARCHED_PCT) > 0) {
                messages.add("Over 50% of the keyspace searched: review coverage and consider reallocating ranges.");
            } else if (percent.compareTo(JUST_STARTED_PCT) < 0) {
                messages.add("Search just started (under 10% covered): monitor to establish baseline rates.");
            }
        }
        return messages;
    }

    /**
     * Active ranges whose last update is older than the staleness window.
     */
    public List<ProgressRecord> stalled(List<ProgressRecord> all) {
        Instant cutoff = clock.instant().minus(config.getStaleAfter());
        return all.stream()
            .filter(r -> r.getStatus() == RangeStatus.ACTIVE)
            .filter(r -> lastActivity(r) != null && lastActivity(r).isBefore(cutoff))
            .collect(Collectors.toList());
    }

    // ========== Selection ==========

    /**
     * Top ranges of the preferred band: fallback once the high band is
     * exhausted, the high band otherwise.
     */
    public List<Range> selectNext(List<ProgressRecord> all, Set<String> completed) {
        RangeTier preferred = preferredTier(all);
        return all.stream()
            .filter(r -> r.getTier() == preferred && isSchedulable(r, completed))
            .sorted(candidateOrder())
            .limit(config.getSelectionSize())
            .map(ProgressRecord::toRange)
            .collect(Collectors.toList());
    }

    /**
     * Every schedulable range in assignment order: the preferred band first,
     * then the rest; within a band by score, stored priority, then insertion order.
     */
    public List<ProgressRecord> candidates(List<ProgressRecord> all, Set<String> completed) {
        RangeTier preferred = preferredTier(all);
        Comparator<ProgressRecord> bandFirst = Comparator.comparingInt(r -> r.getTier() == preferred ? 0 : 1);
        return all.stream()
            .filter(r -> isSchedulable(r, completed))
            .sorted(bandFirst.thenComparing(candidateOrder()))
            .collect(Collectors.toList());
    }

    private RangeTier preferredTier(List<ProgressRecord> all) {
        return highBandExhausted(all) ? RangeTier.FALLBACK : RangeTier.HIGH;
    }

    private Comparator<ProgressRecord> candidateOrder() {
        return Comparator.comparingInt((ProgressRecord r) -> priority(r)).reversed()
            .thenComparing(Comparator.comparingInt(ProgressRecord::getPriority).reversed())
            .thenComparingLong(ProgressRecord::getSequence);
    }

    private static boolean inHighBand(ProgressRecord record) {
        return record.getTier() == RangeTier.HIGH
            && record.getStatus() != RangeStatus.SPLIT
            && record.getStatus() != RangeStatus.ABANDONED;
    }

    private static boolean isSchedulable(ProgressRecord record, Set<String> completed) {
        return !record.isTerminal() && !completed.contains(record.getRangeId());
    }

    // ========== Splitting ==========

    /**
     * Replaces a range with {@code n} contiguous children; the last absorbs the
     * remainder so the children cover the parent exactly. Progress already made
     * on the parent stays with the children that hold those keys.
     *
     * @throws ValidationException   {@code n < 1}, unknown id, or more pieces than keys
     * @throws InvalidStateException the range is completed or otherwise terminal
     */
    public List<Range> splitRange(String rangeId, int n) {
        if (n < 1) {
            throw new ValidationException("Split count must be at least 1, got " + n);
        }
        ProgressRecord parent = ledger.require(rangeId);
        if (parent.isTerminal()) {
            throw new InvalidStateException("Range " + rangeId + " is "
                + parent.getStatus().name().toLowerCase() + " and cannot be split");
        }
        if (BigInteger.valueOf(n).compareTo(parent.getTotalKeys()) > 0) {
            throw new ValidationException("Cannot split " + parent.getTotalKeys() + " keys of " + rangeId
                + " into " + n + " pieces");
        }

        int priority = parent.getStatus() == RangeStatus.ACTIVE
            ? config.getSplitPriorityActive()
            : config.getSplitPriorityPending();
        Instant now = clock.instant();
        List<KeyRange> pieces = parent.keyRange().split(n);
        List<Range> children = new ArrayList<>(n);
        for (int i = 0; i < pieces.size(); i++) {
            KeyRange piece = pieces.get(i);
            children.add(Range.builder()
                .id(rangeId + "_split_" + i)
                .start(piece.start())
                .end(piece.end())
                .priority(priority)
                .status(RangeStatus.PENDING)
                .tier(parent.getTier())
                .parentId(rangeId)
                .splitReason("manual_split")
                .description("Split " + (i + 1) + " of " + n + " of " + rangeId)
                .createdAt(now)
                .build());
        }

        List<ProgressRecord> created = ledger.replaceWithChildren(rangeId, children);
        splitCounter.increment();
        log.info("Split {} {} into {} ranges (priority {}, {} keys already searched carried over)",
            rangeId, parent.keyRange(), n, priority, parent.getSearchedKeys());
        return created.stream().map(ProgressRecord::toRange).collect(Collectors.toList());
    }

    // ========== Strategy ==========

    public AdaptiveStrategy strategy(List<ProgressRecord> all) {
        Set<String> completed = all.stream()
            .filter(r -> r.getStatus() == RangeStatus.COMPLETED)
            .map(ProgressRecord::getRangeId)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        List<AdaptiveStrategy.ScoredRange> current = all.stream()
            .filter(r -> !r.isTerminal())
            .map(r -> AdaptiveStrategy.ScoredRange.builder()
                .id(r.getRangeId())
                .start(r.getStart())
                .end(r.getEnd())
                .tier(r.getTier())
                .status(r.getStatus())
                .score(priority(r))
                .storedPriority(r.getPriority())
                .percentComplete(r.getPercentComplete())
                .searchRate(r.getSearchRate())
                .build())
            .collect(Collectors.toList());

        List<ProgressRecord> highBand = all.stream()
            .filter(r -> r.getTier() == RangeTier.HIGH)
            .collect(Collectors.toList());
        Coverage high = ProgressLedger.coverageOf(highBand);

        return AdaptiveStrategy.builder()
            .generatedAt(clock.instant())
            .currentRanges(current)
            .completedRanges(new ArrayList<>(completed))
            .nextRecommended(selectNext(all, completed))
            .coverage(ProgressLedger.coverageOf(all))
            .highPriorityComplete(KeyspaceMath.percentOf(high.getSearchedKeyspace(), high.getTotalKeyspace()))
            .recommendations(recommendations(all, completed))
            .build();
    }

    private static Instant lastActivity(ProgressRecord record) {
        if (record.getLastUpdate() != null) {
            return record.getLastUpdate();
        }
        return record.getStartedAt() != null ? record.getStartedAt() : record.getCreatedAt();
    }
}
