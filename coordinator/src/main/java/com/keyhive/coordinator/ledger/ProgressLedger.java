package com.keyhive.coordinator.ledger;

import com.keyhive.coordinator.partition.Manifest;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.KeyspaceException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.metrics.MetricsNames;
import com.keyhive.core.model.Coverage;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.model.Range;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.model.RecordOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable store of per-range progress; the only shared mutable state of the pool.
 * <p>
 * <b>Concurrency:</b> each range has its own lock, so writers to different
 * ranges proceed independently while writers to the same range are serialized.
 * Readers get a snapshot ordered by insertion sequence and never block writers.
 * </p>
 * <p>
 * <b>Durability:</b> every mutation is written to the ledger file before it
 * returns. If the write fails the in-memory change is rolled back.
 * </p>
 */
public class ProgressLedger {
    private static final Logger log = LoggerFactory.getLogger(ProgressLedger.class);

    private final LedgerStore store;
    private final Clock clock;
    private final Counter updateCounter;

    private final Map<String, ProgressRecord> records = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public ProgressLedger(LedgerStore store, Clock clock, MeterRegistry meterRegistry) {
        this.store = store;
        this.clock = clock;
        this.updateCounter = Counter.builder(MetricsNames.LEDGER_UPDATES_TOTAL)
            .description("Accepted progress updates")
            .register(meterRegistry);
        Gauge.builder(MetricsNames.COVERAGE_PERCENT, this, l -> l.aggregateCoverage().getPercentComplete().doubleValue())
            .description("Keyspace coverage in percent")
            .register(meterRegistry);
    }

    /**
     * Replaces the in-memory state with the ledger file.
     *
     * @throws com.keyhive.core.error.LedgerCorruptedException when the file exists but is unusable
     */
    public synchronized void load() {
        List<ProgressRecord> loaded = store.load();
        records.clear();
        long maxSequence = 0;
        for (ProgressRecord record : loaded) {
            records.put(record.getRangeId(), record);
            maxSequence = Math.max(maxSequence, record.getSequence());
        }
        sequence.set(maxSequence);
        log.info("Loaded {} ranges from {}", loaded.size(), store.path());
    }

    public synchronized void save() {
        store.save(snapshot());
    }

    // ========== Reads ==========

    public Optional<ProgressRecord> get(String rangeId) {
        return Optional.ofNullable(records.get(rangeId));
    }

    /**
     * @throws ValidationException when the id is unknown
     */
    public ProgressRecord require(String rangeId) {
        ProgressRecord record = rangeId == null ? null : records.get(rangeId);
        if (record == null) {
            throw new ValidationException("Unknown range id: " + rangeId);
        }
        return record;
    }

    public Optional<ProgressRecord> findByBounds(KeyRange bounds) {
        return records.values().stream()
            .filter(r -> r.getStart().equals(bounds.start()) && r.getEnd().equals(bounds.end()))
            .filter(r -> r.getStatus() != RangeStatus.SPLIT)
            .findFirst();
    }

    /**
     * All records in insertion order.
     */
    public List<ProgressRecord> snapshot() {
        return records.values().stream()
            .sorted(Comparator.comparingLong(ProgressRecord::getSequence))
            .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public Coverage aggregateCoverage() {
        return coverageOf(records.values());
    }

    /**
     * Exact sum over every record except split parents, whose keys are counted by their children.
     */
    public static Coverage coverageOf(Collection<ProgressRecord> records) {
        BigInteger total = BigInteger.ZERO;
        BigInteger searched = BigInteger.ZERO;
        for (ProgressRecord record : records) {
            if (record.getStatus() == RangeStatus.SPLIT) {
                continue;
            }
            total = total.add(record.getTotalKeys());
            searched = searched.add(record.getSearchedKeys());
        }
        return Coverage.builder()
            .totalKeyspace(total)
            .searchedKeyspace(searched)
            .build();
    }

    // ========== Progress ==========

    /**
     * Records the absolute searched-key counter of a range.
     * <p>
     * The first update moves a pending range to active; reaching
     * {@code total_keys} completes it with outcome {@code exhausted}.
     * </p>
     *
     * @param rangeId      range to update
     * @param searchedKeys new counter, never below the current one
     * @param rate         keys per second, or {@code null} to keep the last one
     * @return the updated record
     * @throws ValidationException   unknown id, counter out of bounds or decreasing, invalid rate
     * @throws InvalidStateException the range is already terminal
     */
    public ProgressRecord update(String rangeId, BigInteger searchedKeys, Double rate) {
        ProgressRecord current = require(rangeId);
        if (searchedKeys == null || searchedKeys.signum() < 0) {
            throw new ValidationException("searched_keys must be a non-negative integer, got " + searchedKeys);
        }
        if (rate != null && (rate.isNaN() || rate.isInfinite() || rate < 0)) {
            throw new ValidationException("search_rate must be a finite non-negative number, got " + rate);
        }
        if (searchedKeys.compareTo(current.getTotalKeys()) > 0) {
            throw new ValidationException("searched_keys " + searchedKeys + " exceeds total_keys "
                + current.getTotalKeys() + " of " + rangeId);
        }

        return withLock(rangeId, () -> {
            ProgressRecord record = require(rangeId);
            if (record.isTerminal()) {
                throw new InvalidStateException("Range " + rangeId + " is " + statusName(record) + " and cannot be updated");
            }
            if (searchedKeys.compareTo(record.getSearchedKeys()) < 0) {
                throw new ValidationException("searched_keys must not decrease: " + record.getSearchedKeys()
                    + " -> " + searchedKeys + " for " + rangeId);
            }

            Instant now = clock.instant();
            double effectiveRate = rate != null ? rate : record.getSearchRate();
            ProgressRecord.ProgressRecordBuilder next = record.toBuilder()
                .searchedKeys(searchedKeys)
                .searchRate(effectiveRate)
                .lastUpdate(now)
                .estimatedCompletion(eta(now, record.getTotalKeys().subtract(searchedKeys), effectiveRate));
            if (record.getStatus() == RangeStatus.PENDING) {
                next.status(RangeStatus.ACTIVE);
            }
            if (record.getStartedAt() == null) {
                next.startedAt(now);
            }
            if (searchedKeys.equals(record.getTotalKeys())) {
                next.status(RangeStatus.COMPLETED)
                    .outcome(RecordOutcome.EXHAUSTED)
                    .estimatedCompletion(now);
            }
            ProgressRecord updated = commit(record, next.build());
            updateCounter.increment();

            if (updated.getStatus() == RangeStatus.COMPLETED) {
                log.info("Range {} fully searched ({} keys)", rangeId, updated.getTotalKeys());
            } else {
                log.debug("Range {} at {}% ({} keys/s)", rangeId, updated.getPercentComplete(), effectiveRate);
            }
            return updated;
        });
    }

    // ========== Lifecycle ==========

    /**
     * Adds a new range as a pending record.
     *
     * @throws InvalidStateException when a range with the same id already exists
     */
    public ProgressRecord register(Range range) {
        validateNewRange(range);
        return withLock(range.getId(), () -> {
            if (records.containsKey(range.getId())) {
                throw new InvalidStateException("Range " + range.getId() + " already exists");
            }
            ProgressRecord record = ProgressRecord.of(range.withStatus(RangeStatus.PENDING), sequence.incrementAndGet());
            records.put(record.getRangeId(), record);
            try {
                persist();
            } catch (RuntimeException e) {
                records.remove(record.getRangeId());
                throw e;
            }
            log.info("Registered range {} {} ({})", record.getRangeId(), record.keyRange(), record.getTier());
            return record;
        });
    }

    /**
     * Moves a pending range to active; an active range is returned unchanged.
     */
    public ProgressRecord markActive(String rangeId) {
        require(rangeId);
        return withLock(rangeId, () -> {
            ProgressRecord record = require(rangeId);
            if (record.isTerminal()) {
                throw new InvalidStateException("Range " + rangeId + " is " + statusName(record));
            }
            if (record.getStatus() == RangeStatus.ACTIVE) {
                return record;
            }
            Instant now = clock.instant();
            return commit(record, record.toBuilder()
                .status(RangeStatus.ACTIVE)
                .startedAt(record.getStartedAt() == null ? now : record.getStartedAt())
                .lastUpdate(now)
                .build());
        });
    }

    /**
     * Returns an active range to the pending pool, keeping its progress.
     * Terminal and pending ranges are returned unchanged.
     */
    public ProgressRecord release(String rangeId) {
        require(rangeId);
        return withLock(rangeId, () -> {
            ProgressRecord record = require(rangeId);
            if (record.getStatus() != RangeStatus.ACTIVE) {
                return record;
            }
            return commit(record, record.withStatus(RangeStatus.PENDING));
        });
    }

    /**
     * Terminal transition to {@code completed}.
     * <p>
     * {@code exhausted} also sets the counter to {@code total_keys}.
     * {@code evidence} is kept opaque and never logged.
     * </p>
     */
    public ProgressRecord complete(String rangeId, RecordOutcome outcome, String evidence) {
        require(rangeId);
        return withLock(rangeId, () -> {
            ProgressRecord record = require(rangeId);
            if (record.isTerminal()) {
                throw new InvalidStateException("Range " + rangeId + " is already " + statusName(record));
            }
            Instant now = clock.instant();
            ProgressRecord.ProgressRecordBuilder next = record.toBuilder()
                .status(RangeStatus.COMPLETED)
                .outcome(outcome)
                .evidence(evidence)
                .lastUpdate(now)
                .estimatedCompletion(now);
            if (outcome == RecordOutcome.EXHAUSTED) {
                next.searchedKeys(record.getTotalKeys());
            }
            ProgressRecord updated = commit(record, next.build());
            log.info("Range {} completed ({})", rangeId, outcome.name().toLowerCase());
            return updated;
        });
    }

    /**
     * Operator withdrawal of a range from scheduling.
     */
    public ProgressRecord abandon(String rangeId, String reason) {
        require(rangeId);
        return withLock(rangeId, () -> {
            ProgressRecord record = require(rangeId);
            if (record.isTerminal()) {
                throw new InvalidStateException("Range " + rangeId + " is already " + statusName(record));
            }
            ProgressRecord updated = commit(record, record.toBuilder()
                .status(RangeStatus.ABANDONED)
                .lastUpdate(clock.instant())
                .build());
            log.info("Range {} abandoned: {}", rangeId, reason);
            return updated;
        });
    }

    /**
     * Retires {@code parentId} as {@code split} and registers its children in one write.
     * <p>
     * Workers scan a range upward from its start, so the parent's searched keys
     * are the prefix {@code [start, start + searched_keys)}. That prefix is
     * carried into the leading children; a child it covers entirely is
     * recorded as {@code completed/exhausted}. Coverage totals are unchanged
     * by the split.
     * </p>
     *
     * @param children ranges partitioning the parent's interval
     * @return the children's records in order
     */
    public List<ProgressRecord> replaceWithChildren(String parentId, List<Range> children) {
        require(parentId);
        children.forEach(this::validateNewRange);
        return withLock(parentId, () -> {
            ProgressRecord parent = require(parentId);
            if (parent.isTerminal()) {
                throw new InvalidStateException("Range " + parentId + " is " + statusName(parent) + " and cannot be split");
            }
            for (Range child : children) {
                if (records.containsKey(child.getId())) {
                    throw new InvalidStateException("Range " + child.getId() + " already exists");
                }
            }

            Instant now = clock.instant();
            BigInteger searchedEnd = parent.getStart().add(parent.getSearchedKeys());
            List<ProgressRecord> created = new ArrayList<>(children.size());
            for (Range child : children) {
                ProgressRecord fresh = ProgressRecord.of(child.withStatus(RangeStatus.PENDING), sequence.incrementAndGet());
                ProgressRecord record = inheritSearchedPrefix(fresh, searchedEnd, now);
                records.put(record.getRangeId(), record);
                created.add(record);
            }
            try {
                commit(parent, parent.toBuilder()
                    .status(RangeStatus.SPLIT)
                    .lastUpdate(now)
                    .build());
            } catch (RuntimeException e) {
                created.forEach(r -> records.remove(r.getRangeId()));
                throw e;
            }
            return created;
        });
    }

    private static ProgressRecord inheritSearchedPrefix(ProgressRecord child, BigInteger searchedEnd, Instant now) {
        BigInteger covered = searchedEnd.min(child.getEnd()).subtract(child.getStart()).max(BigInteger.ZERO);
        if (covered.signum() == 0) {
            return child;
        }
        if (covered.equals(child.getTotalKeys())) {
            return child.toBuilder()
                .searchedKeys(covered)
                .status(RangeStatus.COMPLETED)
                .outcome(RecordOutcome.EXHAUSTED)
                .lastUpdate(now)
                .estimatedCompletion(now)
                .build();
        }
        return child.toBuilder()
            .searchedKeys(covered)
            .lastUpdate(now)
            .build();
    }

    /**
     * Loads an initial manifest: the core band is recorded as {@code split}
     * for audit, its parallel splits and the fallbacks as pending ranges.
     *
     * @param force replace a non-empty ledger
     * @throws InvalidStateException when the ledger already holds ranges and {@code force} is false
     */
    public synchronized List<ProgressRecord> seed(Manifest manifest, boolean force) {
        if (!records.isEmpty() && !force) {
            throw new InvalidStateException("Ledger already holds " + records.size()
                + " ranges; refusing to seed without force");
        }
        manifest.allRanges().forEach(this::validateNewRange);

        Map<String, ProgressRecord> previous = Map.copyOf(records);
        long previousSequence = sequence.get();
        records.clear();
        sequence.set(0);

        ProgressRecord core = ProgressRecord.of(manifest.getCore(), sequence.incrementAndGet())
            .withStatus(RangeStatus.SPLIT);
        records.put(core.getRangeId(), core);
        for (Range range : manifest.getParallelSplits()) {
            records.put(range.getId(), ProgressRecord.of(range.withStatus(RangeStatus.PENDING), sequence.incrementAndGet()));
        }
        for (Range range : manifest.getFallback()) {
            records.put(range.getId(), ProgressRecord.of(range.withStatus(RangeStatus.PENDING), sequence.incrementAndGet()));
        }
        try {
            persist();
        } catch (RuntimeException e) {
            records.clear();
            records.putAll(previous);
            sequence.set(previousSequence);
            throw e;
        }
        log.info("Seeded ledger with {} ranges (force={})", records.size(), force);
        return snapshot();
    }

    // ========== Internals ==========

    private void validateNewRange(Range range) {
        if (range == null || range.getId() == null || range.getId().isBlank()) {
            throw new ValidationException("Range must have an id");
        }
        if (range.getStart() == null || range.getEnd() == null) {
            throw new ValidationException("Range " + range.getId() + " must have bounds");
        }
        KeyRange.of(range.getStart(), range.getEnd());
        if (range.getPriority() < 0 || range.getPriority() > 100) {
            throw new ValidationException("Priority of " + range.getId() + " must be within [0, 100]");
        }
    }

    private ProgressRecord commit(ProgressRecord previous, ProgressRecord next) {
        records.put(next.getRangeId(), next);
        try {
            persist();
        } catch (RuntimeException e) {
            records.put(previous.getRangeId(), previous);
            throw e;
        }
        return next;
    }

    private synchronized void persist() {
        try {
            store.save(snapshot());
        } catch (KeyspaceException e) {
            log.error("Failed to persist ledger to {}", store.path(), e);
            throw e;
        }
    }

    private <T> T withLock(String rangeId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(rangeId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static Instant eta(Instant now, BigInteger remaining, double rate) {
        if (rate <= 0) {
            return null;
        }
        BigInteger seconds = new BigDecimal(remaining)
            .divide(BigDecimal.valueOf(rate), 0, RoundingMode.CEILING)
            .toBigInteger();
        BigInteger limit = BigInteger.valueOf(Instant.MAX.getEpochSecond() - now.getEpochSecond());
        if (seconds.compareTo(limit) > 0) {
            return null;
        }
        return now.plusSeconds(seconds.longValueExact());
    }

    private static String statusName(ProgressRecord record) {
        return record.getStatus().name().toLowerCase();
    }
}
