package com.keyhive.coordinator.pool;

import com.keyhive.coordinator.config.CoordinatorConfig;
import com.keyhive.coordinator.ledger.ProgressLedger;
import com.keyhive.coordinator.schedule.AdaptiveScheduler;
import com.keyhive.coordinator.schedule.AdaptiveStrategy;
import com.keyhive.coordinator.schedule.StrategyStore;
import com.keyhive.core.api.PoolApi;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.keyspace.KeyspaceMath;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.AssignmentStatus;
import com.keyhive.core.model.Coverage;
import com.keyhive.core.model.PoolStats;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.model.Range;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.model.RangeTier;
import com.keyhive.core.model.RecordOutcome;
import com.keyhive.core.msg.PoolMessages.AbandonRequest;
import com.keyhive.core.msg.PoolMessages.AssignmentRequest;
import com.keyhive.core.msg.PoolMessages.CompletionReport;
import com.keyhive.core.msg.PoolMessages.ProgressReport;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-process pool: hands out ranges, tracks leases and aggregates statistics.
 * <p>
 * <b>Exclusivity:</b> all assignment transitions run under one claim lock, and
 * a range is only granted when no live assignment covers an overlapping
 * interval. Concurrent requests therefore resolve to exactly one winner per range.
 * </p>
 * <p>
 * <b>Liveness:</b> every accepted report extends the lease to
 * {@code now + report_interval * grace_factor}. A scheduler tick expires
 * overdue assignments and releases their ranges; claims also ignore expired
 * leases on their own, so correctness never depends on the tick.
 * </p>
 * <p>
 * Every {@link PoolApi} call takes the claim lock and writes state files, so
 * it runs on {@code boundedElastic}, never on the caller's event loop.
 * </p>
 */
public class PoolCoordinator implements PoolApi {
    private static final Logger log = LoggerFactory.getLogger(PoolCoordinator.class);

    private static final int CUSTOM_RANGE_PRIORITY = 60;

    private final ProgressLedger ledger;
    private final AdaptiveScheduler scheduler;
    private final AssignmentRegistry registry;
    private final StrategyStore strategyStore;
    private final CoordinatorConfig config;
    private final Clock clock;
    private final PoolMetrics metrics;

    private final ReentrantLock claimLock = new ReentrantLock();
    private final AtomicReference<Disposable> ticker = new AtomicReference<>();

    public PoolCoordinator(
        ProgressLedger ledger,
        AdaptiveScheduler scheduler,
        AssignmentRegistry registry,
        StrategyStore strategyStore,
        CoordinatorConfig config,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.ledger = ledger;
        this.scheduler = scheduler;
        this.registry = registry;
        this.strategyStore = strategyStore;
        this.config = config;
        this.clock = clock;
        this.metrics = new PoolMetrics(meterRegistry, () -> registry.liveAt(clock.instant()).size());
    }

    // ========== PoolApi ==========

    @Override
    public Mono<Assignment> requestAssignment(AssignmentRequest request) {
        return Mono.fromCallable(() -> locked(() -> claim(request)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<ProgressRecord> reportProgress(ProgressReport report) {
        return Mono.fromCallable(() -> locked(() -> progress(report)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Assignment> reportCompletion(CompletionReport report) {
        return Mono.fromCallable(() -> locked(() -> completion(report)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Assignment> abandonAssignment(AbandonRequest request) {
        return Mono.fromCallable(() -> locked(() -> abandon(request)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<PoolStats> getStats(String clientId) {
        return Mono.fromCallable(() -> stats(clientId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Scheduler tick ==========

    /**
     * Starts the periodic tick: expire overdue leases, then persist the strategy.
     * Calling it twice keeps the running loop.
     */
    public void start() {
        Duration tick = config.getSchedulerTick();
        Disposable loop = Flux.interval(tick, tick, Schedulers.boundedElastic())
            .subscribe(
                t -> tick(),
                error -> log.error("Scheduler tick loop terminated", error)
            );
        if (!ticker.compareAndSet(null, loop)) {
            loop.dispose();
            return;
        }
        log.info("Scheduler tick started every {}s", tick.toSeconds());
    }

    public void stop() {
        Disposable loop = ticker.getAndSet(null);
        if (loop != null) {
            loop.dispose();
            log.info("Scheduler tick stopped");
        }
    }

    /**
     * One scheduler pass. Failures are logged; the next tick runs regardless.
     */
    public AdaptiveStrategy tick() {
        try {
            expireOverdue();
            AdaptiveStrategy strategy = scheduler.strategy(ledger.snapshot());
            strategyStore.save(strategy);
            scheduler.stalled(ledger.snapshot()).forEach(r ->
                log.warn("Range {} stalled: last update {}", r.getRangeId(), r.getLastUpdate()));
            return strategy;
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
            return null;
        }
    }

    /**
     * Expires every assignment whose lease ran out and releases its range.
     *
     * @return the assignments expired by this call
     */
    public List<Assignment> expireOverdue() {
        return locked(() -> {
            Instant now = clock.instant();
            List<Assignment> expired = new ArrayList<>();
            for (Assignment overdue : registry.overdueAt(now)) {
                Assignment updated = registry.put(overdue.toBuilder()
                    .status(AssignmentStatus.EXPIRED)
                    .reason("lease expired at " + overdue.getExpiresAt())
                    .build());
                releaseIfUnclaimed(updated, now);
                metrics.expired();
                log.warn("Assignment {} of {} on range {} expired (last report {})",
                    overdue.getAssignmentId(), overdue.getClientId(), overdue.getRangeId(), overdue.getLastReportAt());
                expired.add(updated);
            }
            return expired;
        });
    }

    // ========== Claim ==========

    private Assignment claim(AssignmentRequest request) {
        if (request == null || request.getClientId() == null || request.getClientId().isBlank()) {
            throw new ValidationException("client_id is required");
        }
        if (request.getReportIntervalSeconds() < 0 || request.getGraceFactor() < 0) {
            throw new ValidationException("report_interval_seconds and grace_factor must not be negative");
        }
        Instant now = clock.instant();
        Optional<ProgressRecord> target = request.getCustomRange() != null
            ? customTarget(request, now)
            : scheduledTarget(now);
        if (target.isEmpty()) {
            log.info("No range available for client {}", request.getClientId());
            return null;
        }
        return grant(target.get(), request, now);
    }

    private Optional<ProgressRecord> scheduledTarget(Instant now) {
        List<ProgressRecord> snapshot = ledger.snapshot();
        List<KeyRange> completed = completedIntervals(snapshot);
        return scheduler.candidates(snapshot, Set.of()).stream()
            .filter(r -> registry.liveOverlapping(r.keyRange(), now, null).isEmpty())
            .filter(r -> completed.stream().noneMatch(c -> c.overlaps(r.keyRange())))
            .findFirst();
    }

    private Optional<ProgressRecord> customTarget(AssignmentRequest request, Instant now) {
        KeyRange bounds = request.getCustomRange();
        Optional<ProgressRecord> existing = ledger.findByBounds(bounds);
        if (existing.isPresent() && existing.get().isTerminal()) {
            log.info("Custom range {} is already {}", bounds, existing.get().getStatus().name().toLowerCase());
            return Optional.empty();
        }
        if (completedIntervals(ledger.snapshot()).stream().anyMatch(c -> c.overlaps(bounds))) {
            log.info("Custom range {} overlaps a completed range", bounds);
            return Optional.empty();
        }
        if (!registry.liveOverlapping(bounds, now, null).isEmpty()) {
            log.info("Custom range {} overlaps a live assignment", bounds);
            return Optional.empty();
        }
        if (existing.isPresent()) {
            return existing;
        }
        return Optional.of(ledger.register(Range.builder()
            .id("custom_" + KeyspaceMath.toHex(bounds.start()) + "_" + KeyspaceMath.toHex(bounds.end()))
            .start(bounds.start())
            .end(bounds.end())
            .priority(CUSTOM_RANGE_PRIORITY)
            .status(RangeStatus.PENDING)
            .tier(RangeTier.CUSTOM)
            .description("Custom range requested by " + request.getClientId())
            .createdAt(now)
            .build()));
    }

    private Assignment grant(ProgressRecord target, AssignmentRequest request, Instant now) {
        ProgressRecord record = ledger.markActive(target.getRangeId());
        long interval = request.getReportIntervalSeconds() > 0
            ? request.getReportIntervalSeconds()
            : config.getDefaultReportInterval().toSeconds();
        int grace = request.getGraceFactor() > 0 ? request.getGraceFactor() : config.getDefaultGraceFactor();

        Assignment assignment = registry.put(Assignment.builder()
            .assignmentId(UUID.randomUUID().toString())
            .rangeId(record.getRangeId())
            .clientId(request.getClientId())
            .start(record.getStart())
            .end(record.getEnd())
            .priority(record.getPriority())
            .tier(record.getTier())
            .status(AssignmentStatus.ASSIGNED)
            .assignedAt(now)
            .expiresAt(now.plusSeconds(interval * grace))
            .lastReportAt(now)
            .baselineKeys(record.getSearchedKeys())
            .searchedKeys(record.getSearchedKeys())
            .reportIntervalSeconds(interval)
            .graceFactor(grace)
            .build());
        metrics.granted(record.getTier());
        log.info("Granted range {} {} to {} (assignment {}, lease {}s)",
            record.getRangeId(), record.keyRange(), request.getClientId(), assignment.getAssignmentId(), interval * grace);
        return assignment;
    }

    // ========== Reports ==========

    private ProgressRecord progress(ProgressReport report) {
        if (report == null) {
            throw new ValidationException("Missing progress report");
        }
        Instant now = clock.instant();
        Assignment assignment = owned(report.getAssignmentId(), report.getClientId());
        assignment = reviveIfExpired(assignment, now);

        ProgressRecord record = ledger.update(assignment.getRangeId(), report.getSearchedKeys(), report.getSearchRate());
        boolean done = record.getStatus() == RangeStatus.COMPLETED;
        registry.put(assignment.toBuilder()
            .status(done ? AssignmentStatus.COMPLETED : AssignmentStatus.REPORTING)
            .searchedKeys(record.getSearchedKeys())
            .lastReportAt(now)
            .expiresAt(now.plusSeconds(assignment.getReportIntervalSeconds() * assignment.getGraceFactor()))
            .reason(done ? "exhausted" : null)
            .build());
        if (done) {
            metrics.completed(RecordOutcome.EXHAUSTED);
            log.info("Assignment {} finished range {} by reporting its last key", assignment.getAssignmentId(),
                record.getRangeId());
        } else {
            log.debug("Assignment {} reported {}% of {}", assignment.getAssignmentId(), record.getPercentComplete(),
                record.getRangeId());
        }
        return record;
    }

    private Assignment completion(CompletionReport report) {
        if (report == null) {
            throw new ValidationException("Missing completion report");
        }
        Instant now = clock.instant();
        Assignment assignment = reviveIfExpired(owned(report.getAssignmentId(), report.getClientId()), now);

        RecordOutcome outcome = report.isFound() ? RecordOutcome.FOUND : RecordOutcome.EXHAUSTED;
        ProgressRecord record = ledger.complete(assignment.getRangeId(), outcome, report.isFound() ? report.getEvidence() : null);
        Assignment completed = registry.put(assignment.toBuilder()
            .status(AssignmentStatus.COMPLETED)
            .searchedKeys(record.getSearchedKeys())
            .lastReportAt(now)
            .reason(outcome.name().toLowerCase())
            .build());
        metrics.completed(outcome);
        log.info("Range {} completed by {} (found={})", record.getRangeId(), assignment.getClientId(), report.isFound());

        if (report.isFound()) {
            supersedeOverlapping(record, now);
        }
        return completed;
    }

    private Assignment abandon(AbandonRequest request) {
        if (request == null) {
            throw new ValidationException("Missing abandon request");
        }
        Instant now = clock.instant();
        Assignment assignment = owned(request.getAssignmentId(), request.getClientId());
        String reason = request.getReason() == null || request.getReason().isBlank() ? "abandoned" : request.getReason();
        Assignment abandoned = registry.put(assignment.toBuilder()
            .status(AssignmentStatus.ABANDONED)
            .reason(reason)
            .build());
        releaseIfUnclaimed(abandoned, now);
        metrics.abandoned();
        log.info("Assignment {} on range {} abandoned by {}: {}", assignment.getAssignmentId(),
            assignment.getRangeId(), assignment.getClientId(), reason);
        return abandoned;
    }

    /**
     * Target found in {@code found}: every overlapping range is done too, and
     * the assignments searching them stop.
     */
    private void supersedeOverlapping(ProgressRecord found, Instant now) {
        for (ProgressRecord other : ledger.snapshot()) {
            if (other.getRangeId().equals(found.getRangeId()) || other.isTerminal()
                || !other.keyRange().overlaps(found.keyRange())) {
                continue;
            }
            ledger.complete(other.getRangeId(), RecordOutcome.SUPERSEDED, null);
            metrics.completed(RecordOutcome.SUPERSEDED);
        }
        for (Assignment live : registry.liveOverlapping(found.keyRange(), now, null)) {
            registry.put(live.toBuilder()
                .status(AssignmentStatus.COMPLETED)
                .reason("superseded by " + found.getRangeId())
                .build());
            log.info("Assignment {} of {} superseded by {}", live.getAssignmentId(), live.getClientId(),
                found.getRangeId());
        }
    }

    // ========== Stats ==========

    private PoolStats stats(String clientId) {
        Instant now = clock.instant();
        List<ProgressRecord> snapshot = ledger.snapshot();
        List<Assignment> assignments = registry.all();
        Coverage coverage = ProgressLedger.coverageOf(snapshot);

        Map<String, BigInteger> keysByClient = new LinkedHashMap<>();
        Map<String, Integer> rangesByClient = new HashMap<>();
        for (Assignment a : assignments) {
            keysByClient.merge(a.getClientId(), a.contributedKeys(), BigInteger::add);
            if (a.getStatus() == AssignmentStatus.COMPLETED) {
                rangesByClient.merge(a.getClientId(), 1, Integer::sum);
            } else {
                rangesByClient.putIfAbsent(a.getClientId(), 0);
            }
        }

        List<String> ranked = keysByClient.keySet().stream()
            .sorted(Comparator.comparing((String c) -> keysByClient.get(c)).reversed()
                .thenComparing(Comparator.comparing((String c) -> rangesByClient.get(c)).reversed())
                .thenComparing(Comparator.naturalOrder()))
            .collect(Collectors.toList());
        List<PoolStats.Contribution> contributions = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            String client = ranked.get(i);
            contributions.add(PoolStats.Contribution.builder()
                .clientId(client)
                .keysSearched(keysByClient.get(client))
                .rangesCompleted(rangesByClient.get(client))
                .rank(i + 1)
                .build());
        }

        int active = (int) registry.liveAt(now).stream().map(Assignment::getClientId).distinct().count();
        return PoolStats.builder()
            .participantCount(keysByClient.size())
            .activeParticipants(active)
            .rangesCompleted((int) snapshot.stream().filter(r -> r.getStatus() == RangeStatus.COMPLETED).count())
            .rangesTotal((int) snapshot.stream().filter(r -> r.getStatus() != RangeStatus.SPLIT).count())
            .totalKeyspace(coverage.getTotalKeyspace())
            .searchedKeyspace(coverage.getSearchedKeyspace())
            .keyspaceCoveredPct(coverage.getPercentComplete())
            .contributions(contributions)
            .yourContribution(contributions.stream().filter(c -> c.getClientId().equals(clientId)).findFirst().orElse(null))
            .generatedAt(now)
            .stale(false)
            .build();
    }

    // ========== Internals ==========

    private Assignment owned(String assignmentId, String clientId) {
        Assignment assignment = registry.require(assignmentId);
        if (clientId != null && !clientId.equals(assignment.getClientId())) {
            throw new InvalidStateException("Assignment " + assignmentId + " belongs to another client");
        }
        if (assignment.getStatus().isTerminal()) {
            throw new InvalidStateException("Assignment " + assignmentId + " is already "
                + assignment.getStatus().name().toLowerCase());
        }
        return assignment;
    }

    /**
     * A missed heartbeat is not fatal: an expired assignment comes back to
     * life as long as nobody else claimed an overlapping interval meanwhile.
     */
    private Assignment reviveIfExpired(Assignment assignment, Instant now) {
        if (assignment.isLiveAt(now)) {
            return assignment;
        }
        if (!registry.liveOverlapping(assignment.keyRange(), now, assignment.getAssignmentId()).isEmpty()) {
            throw new InvalidStateException("Assignment " + assignment.getAssignmentId()
                + " expired and range " + assignment.getRangeId() + " was reassigned");
        }
        ProgressRecord record = ledger.require(assignment.getRangeId());
        if (record.isTerminal()) {
            throw new InvalidStateException("Assignment " + assignment.getAssignmentId() + " expired and range "
                + assignment.getRangeId() + " is " + record.getStatus().name().toLowerCase());
        }
        ledger.markActive(record.getRangeId());
        log.info("Assignment {} of {} resumed after missing its lease", assignment.getAssignmentId(),
            assignment.getClientId());
        return assignment.toBuilder()
            .status(AssignmentStatus.REPORTING)
            .reason(null)
            .build();
    }

    private void releaseIfUnclaimed(Assignment ended, Instant now) {
        boolean stillClaimed = registry.liveAt(now).stream()
            .anyMatch(a -> a.getRangeId().equals(ended.getRangeId()));
        if (!stillClaimed) {
            ledger.get(ended.getRangeId()).ifPresent(r -> ledger.release(r.getRangeId()));
        }
    }

    private static List<KeyRange> completedIntervals(List<ProgressRecord> snapshot) {
        return snapshot.stream()
            .filter(r -> r.getStatus() == RangeStatus.COMPLETED)
            .map(ProgressRecord::keyRange)
            .collect(Collectors.toList());
    }

    private <T> T locked(Supplier<T> action) {
        claimLock.lock();
        try {
            return action.get();
        } finally {
            claimLock.unlock();
        }
    }
}
