package com.keyhive.participant.session;

import com.keyhive.core.api.PoolApi;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.PoolUnavailableException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.AssignmentStatus;
import com.keyhive.core.model.PoolStats;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.msg.PoolMessages.AbandonRequest;
import com.keyhive.core.msg.PoolMessages.AssignmentRequest;
import com.keyhive.core.msg.PoolMessages.CompletionReport;
import com.keyhive.core.msg.PoolMessages.ProgressReport;
import com.keyhive.core.util.JsonFileStore;
import com.keyhive.participant.config.ParticipantConfig;
import com.keyhive.participant.config.PoolConfig;
import com.keyhive.participant.config.ScanType;
import com.keyhive.participant.store.PoolConfigStore;
import com.keyhive.participant.store.ProgressEntry;
import com.keyhive.participant.store.ProgressHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * One participant's session with the pool.
 * <p>
 * The current assignment lives in {@code assignment.json}, so separate
 * processes continue the same session. Every report is appended to the local
 * history before it is sent; a failed remote call leaves local state as it was
 * written.
 * </p>
 */
public class PoolParticipant {
    private static final Logger log = LoggerFactory.getLogger(PoolParticipant.class);

    private final ParticipantConfig config;
    private final PoolApi pool;
    private final Clock clock;
    private final PoolConfigStore poolConfigStore;
    private final JsonFileStore<Assignment> assignmentFile;
    private final JsonFileStore<PoolStats> statsFile;
    private final ProgressHistory history;

    private final AtomicReference<PoolConfig> poolConfig = new AtomicReference<>();
    private final AtomicReference<AutoReport> autoReporter = new AtomicReference<>();

    public PoolParticipant(ParticipantConfig config, PoolApi pool, Clock clock) {
        this.config = config;
        this.pool = pool;
        this.clock = clock;
        this.poolConfigStore = new PoolConfigStore(config);
        this.assignmentFile = new JsonFileStore<>(config.assignmentFile(), Assignment.class);
        this.statsFile = new JsonFileStore<>(config.statsFile(), PoolStats.class);
        this.history = new ProgressHistory(config.progressFile());
    }

    // ========== Setup ==========

    /**
     * Loads or creates the pool config. Calling it again returns the same
     * identity; a custom range switches the scan type to {@code customRange}.
     */
    public PoolConfig initialize(KeyRange customRange) {
        PoolConfig loaded = poolConfigStore.loadOrCreate(customRange);
        poolConfig.set(loaded);
        log.info("Participant {} initialized (scan type {})", loaded.getClientId(), loaded.getScanType());
        return loaded;
    }

    public Optional<PoolConfig> poolConfig() {
        PoolConfig current = poolConfig.get();
        return current != null ? Optional.of(current) : poolConfigStore.load();
    }

    public Optional<Assignment> currentAssignment() {
        return assignmentFile.load();
    }

    public ProgressHistory history() {
        return history;
    }

    // ========== Assignment lifecycle ==========

    /**
     * Asks the pool for a range. Completes empty when the pool has nothing to hand out.
     *
     * @throws InvalidStateException when the previous assignment is still open
     */
    public Mono<Assignment> requestAssignment() {
        return Mono.defer(() -> {
            PoolConfig settings = requireConfig();
            Optional<Assignment> open = currentAssignment().filter(a -> !isClosed(a.getStatus()));
            if (open.isPresent()) {
                return Mono.error(new InvalidStateException("Assignment " + open.get().getAssignmentId()
                    + " is still open; complete or abandon it first"));
            }
            AssignmentRequest request = AssignmentRequest.builder()
                .clientId(settings.getClientId())
                .customRange(settings.getScanType() == ScanType.CUSTOM_RANGE ? settings.getCustomRange() : null)
                .reportIntervalSeconds(settings.getReportIntervalSeconds())
                .graceFactor(settings.getGraceFactor())
                .build();
            return pool.requestAssignment(request)
                .doOnNext(assignment -> {
                    assignmentFile.save(assignment);
                    log.info("Assigned range {} {} (assignment {})", assignment.getRangeId(),
                        assignment.keyRange(), assignment.getAssignmentId());
                })
                .switchIfEmpty(Mono.fromRunnable(() -> log.info("Pool has no range available")));
        });
    }

    /**
     * Records progress locally, then reports it to the pool.
     *
     * @param searchedKeys keys searched in the assigned range so far
     * @param searchRate   keys per second
     */
    public Mono<ProgressRecord> reportProgress(BigInteger searchedKeys, double searchRate) {
        return Mono.defer(() -> {
            PoolConfig settings = requireConfig();
            Assignment assignment = requireOpenAssignment();
            if (searchedKeys == null || searchedKeys.signum() < 0
                || searchedKeys.compareTo(assignment.keyRange().size()) > 0) {
                return Mono.error(new ValidationException("searched_keys must be within [0, "
                    + assignment.keyRange().size() + "], got " + searchedKeys));
            }
            if (Double.isNaN(searchRate) || Double.isInfinite(searchRate) || searchRate < 0) {
                return Mono.error(new ValidationException("search_rate must be a finite non-negative number"));
            }

            history.append(entry(assignment, searchedKeys, searchRate, ProgressEntry.Status.SEARCHING));
            ProgressReport report = ProgressReport.builder()
                .assignmentId(assignment.getAssignmentId())
                .clientId(settings.getClientId())
                .searchedKeys(searchedKeys)
                .searchRate(searchRate)
                .build();
            return pool.reportProgress(report)
                .doOnNext(record -> {
                    boolean done = record.getStatus() == RangeStatus.COMPLETED;
                    assignmentFile.save(assignment.toBuilder()
                        .searchedKeys(record.getSearchedKeys())
                        .lastReportAt(clock.instant())
                        .status(done ? AssignmentStatus.COMPLETED : AssignmentStatus.REPORTING)
                        .build());
                    log.debug("Reported {}% of {}", record.getPercentComplete(), record.getRangeId());
                });
        });
    }

    /**
     * Closes the current assignment. {@code evidence} is passed through to the pool
     * and kept out of the local history and logs.
     */
    public Mono<Assignment> reportCompletion(boolean found, String evidence) {
        return Mono.defer(() -> {
            PoolConfig settings = requireConfig();
            Assignment assignment = requireOpenAssignment();
            BigInteger searched = found ? assignment.getSearchedKeys() : assignment.keyRange().size();
            history.append(entry(assignment, searched, null, ProgressEntry.Status.COMPLETED));
            CompletionReport report = CompletionReport.builder()
                .assignmentId(assignment.getAssignmentId())
                .clientId(settings.getClientId())
                .found(found)
                .evidence(found ? evidence : null)
                .build();
            return pool.reportCompletion(report)
                .doOnNext(completed -> {
                    assignmentFile.save(completed);
                    log.info("Assignment {} completed (found={})", completed.getAssignmentId(), found);
                });
        });
    }

    public Mono<Assignment> abandonAssignment(String reason) {
        return Mono.defer(() -> {
            PoolConfig settings = requireConfig();
            Assignment assignment = requireOpenAssignment();
            history.append(entry(assignment, assignment.getSearchedKeys(), null, ProgressEntry.Status.ABANDONED));
            AbandonRequest request = AbandonRequest.builder()
                .assignmentId(assignment.getAssignmentId())
                .clientId(settings.getClientId())
                .reason(reason)
                .build();
            return pool.abandonAssignment(request)
                .doOnNext(abandoned -> {
                    assignmentFile.save(abandoned);
                    log.info("Assignment {} abandoned: {}", abandoned.getAssignmentId(), reason);
                });
        });
    }

    // ========== Stats ==========

    /**
     * Pool statistics within the request timeout. When the pool cannot answer
     * in time the last snapshot obtained is returned flagged {@code stale}.
     *
     * @throws PoolUnavailableException when no snapshot was ever obtained
     */
    public Mono<PoolStats> getStats() {
        return Mono.defer(() -> {
            PoolConfig settings = requireConfig();
            return pool.getStats(settings.getClientId())
                .timeout(config.getRequestTimeout())
                .doOnNext(statsFile::save)
                .onErrorResume(err -> {
                    Optional<PoolStats> cached = statsFile.load();
                    if (cached.isEmpty()) {
                        return Mono.error(err instanceof PoolUnavailableException
                            ? err
                            : new PoolUnavailableException("Pool stats unavailable: " + err.getMessage(), err));
                    }
                    log.warn("Pool stats unavailable ({}); serving snapshot from {}", err.getMessage(),
                        cached.get().getGeneratedAt());
                    return Mono.just(cached.get().withStale(true));
                });
        });
    }

    // ========== Auto-reporting ==========

    /**
     * Reports {@code snapshots} every {@code report_interval_seconds}. A failed
     * report is logged and the next tick tries again. Calling it twice keeps
     * the running loop.
     */
    public void startAutoReporting(Supplier<ProgressSnapshot> snapshots) {
        startAutoReporting(snapshots, Duration.ofSeconds(requireConfig().getReportIntervalSeconds()));
    }

    public void startAutoReporting(Supplier<ProgressSnapshot> snapshots, Duration interval) {
        requireConfig();
        if (interval.isZero() || interval.isNegative()) {
            throw new ValidationException("Report interval must be positive, got " + interval);
        }
        Disposable loop = Flux.interval(interval, interval, Schedulers.boundedElastic())
            .concatMap(tick -> sendSnapshot(snapshots.get()))
            .subscribe(
                record -> log.debug("Auto-report accepted at {}%", record.getPercentComplete()),
                error -> log.error("Auto-reporting terminated", error)
            );
        // loop and source are published together so a concurrent stop always sees both
        if (!autoReporter.compareAndSet(null, new AutoReport(loop, snapshots))) {
            loop.dispose();
            log.info("Auto-reporting already active");
            return;
        }
        log.info("Auto-reporting started (every {}s)", interval.toSeconds());
    }

    /**
     * Cancels the loop and sends one last report, waiting at most the request
     * timeout for it. No-op when auto-reporting is not running.
     */
    public void stopAutoReporting() {
        AutoReport running = autoReporter.getAndSet(null);
        if (running == null) {
            return;
        }
        running.loop.dispose();
        sendSnapshot(running.snapshots.get())
            .timeout(config.getRequestTimeout())
            .onErrorResume(err -> {
                log.error("Final progress report failed: {}", err.getMessage());
                return Mono.empty();
            })
            .block();
        log.info("Auto-reporting stopped");
    }

    public boolean isAutoReporting() {
        return autoReporter.get() != null;
    }

    private Mono<ProgressRecord> sendSnapshot(ProgressSnapshot snapshot) {
        if (currentAssignment().filter(a -> !isClosed(a.getStatus())).isEmpty()) {
            return Mono.empty();
        }
        return reportProgress(snapshot.getSearchedKeys(), snapshot.getSearchRate())
            .onErrorResume(err -> {
                log.warn("Auto-report failed: {}", err.getMessage());
                return Mono.empty();
            });
    }

    // ========== Internals ==========

    private PoolConfig requireConfig() {
        return poolConfig().orElseThrow(() -> new InvalidStateException("Pool not initialized; run init first"));
    }

    private Assignment requireOpenAssignment() {
        Assignment assignment = currentAssignment()
            .orElseThrow(() -> new InvalidStateException("No current assignment; request one first"));
        if (isClosed(assignment.getStatus())) {
            throw new InvalidStateException("Assignment " + assignment.getAssignmentId() + " is already "
                + assignment.getStatus().name().toLowerCase());
        }
        return assignment;
    }

    private static boolean isClosed(AssignmentStatus status) {
        return status.isTerminal();
    }

    private ProgressEntry entry(Assignment assignment, BigInteger searched, Double rate, ProgressEntry.Status status) {
        return ProgressEntry.builder()
            .assignmentId(assignment.getAssignmentId())
            .rangeId(assignment.getRangeId())
            .searchedKeys(searched)
            .searchRate(rate)
            .status(status)
            .recordedAt(clock.instant())
            .build();
    }

    private static final class AutoReport {
        private final Disposable loop;
        private final Supplier<ProgressSnapshot> snapshots;

        private AutoReport(Disposable loop, Supplier<ProgressSnapshot> snapshots) {
            this.loop = loop;
            this.snapshots = snapshots;
        }
    }
}
