package com.keyhive.coordinator.pool;

import com.keyhive.coordinator.config.CoordinatorConfig;
import com.keyhive.coordinator.ledger.LedgerStore;
import com.keyhive.coordinator.ledger.ProgressLedger;
import com.keyhive.coordinator.schedule.AdaptiveScheduler;
import com.keyhive.coordinator.schedule.StrategyStore;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.metrics.MetricsNames;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.AssignmentStatus;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PoolCoordinatorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ProgressLedger ledger;
    private AssignmentRegistry registry;
    private PoolCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        meterRegistry = new SimpleMeterRegistry();
        CoordinatorConfig config = CoordinatorConfig.builder()
            .nodeId("test-coordinator")
            .httpPort(0)
            .dataDir(dir)
            .keyspaceStart(BigInteger.ZERO)
            .keyspaceEnd(BigInteger.valueOf(1000))
            .splitCount(3)
            .bandPaddingPct(BigDecimal.ZERO)
            .highRateThreshold(1e9)
            .slowRateFloor(5e8)
            .staleAfter(Duration.ofHours(2))
            .schedulerTick(Duration.ofMillis(50))
            .selectionSize(3)
            .defaultReportInterval(Duration.ofSeconds(10))
            .defaultGraceFactor(3)
            .build();
        ledger = new ProgressLedger(new LedgerStore(config.ledgerFile()), clock, meterRegistry);
        AdaptiveScheduler scheduler = new AdaptiveScheduler(ledger, config.schedulerConfig(), clock, meterRegistry);
        registry = new AssignmentRegistry(dir.resolve("assignments.json"));
        coordinator = new PoolCoordinator(ledger, scheduler, registry, new StrategyStore(config.strategyFile()),
            config, clock, meterRegistry);
    }

    // ========== Claims ==========

    @Test
    @DisplayName("Highest scored range is granted with a lease of interval times grace")
    void grantsBestRange() {
        ledger.register(range("low", 0, 100, 40));
        ledger.register(range("high", 100, 200, 80));

        StepVerifier.create(coordinator.requestAssignment(request("alice")))
            .assertNext(a -> {
                assertEquals("high", a.getRangeId());
                assertEquals(AssignmentStatus.ASSIGNED, a.getStatus());
                assertEquals(T0.plusSeconds(30), a.getExpiresAt());
                assertEquals(BigInteger.valueOf(100), a.getStart());
            })
            .verifyComplete();

        assertEquals(RangeStatus.ACTIVE, ledger.require("high").getStatus());
        assertEquals(1.0, meterRegistry.get(MetricsNames.ASSIGNMENTS_GRANTED_TOTAL).counter().count());
    }

    @Test
    @DisplayName("Concurrent requests never share a range")
    void concurrentClaimsAreExclusive() throws Exception {
        int ranges = 5;
        int clients = 20;
        for (int i = 0; i < ranges; i++) {
            ledger.register(range("r" + i, i * 100L, (i + 1) * 100L, 50));
        }

        ExecutorService executor = Executors.newFixedThreadPool(clients);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Assignment>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < clients; i++) {
                String clientId = "client-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return coordinator.requestAssignment(request(clientId)).block(Duration.ofSeconds(10));
                }));
            }
            start.countDown();

            Set<String> granted = new HashSet<>();
            int empty = 0;
            for (Future<Assignment> future : futures) {
                Assignment assignment = future.get(30, TimeUnit.SECONDS);
                if (assignment == null) {
                    empty++;
                } else {
                    assertTrue(granted.add(assignment.getRangeId()), "range granted twice: " + assignment.getRangeId());
                }
            }
            assertEquals(ranges, granted.size());
            assertEquals(clients - ranges, empty);
            assertEquals(ranges, registry.liveAt(clock.instant()).size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A custom range is granted exactly and never handed out twice")
    void customRangeIsExact() {
        KeyRange custom = KeyRange.of(BigInteger.valueOf(0x1000), BigInteger.valueOf(0x2000));

        Assignment assignment = coordinator.requestAssignment(request("alice").withCustomRange(custom)).block();

        assertNotNull(assignment);
        assertEquals(custom, assignment.keyRange());
        assertEquals(RangeTier.CUSTOM, assignment.getTier());
        StepVerifier.create(coordinator.requestAssignment(request("bob").withCustomRange(custom)))
            .verifyComplete();
    }

    @Test
    @DisplayName("Ranges overlapping a completed interval are never granted")
    void completedIntervalBlocksOverlappingRanges() {
        ledger.register(range("wide", 0, 0x10000, 80));
        ledger.register(range("tail", 0x10000, 0x20000, 40));
        KeyRange custom = KeyRange.of(BigInteger.valueOf(0x1000), BigInteger.valueOf(0x2000));

        Assignment alice = coordinator.requestAssignment(request("alice").withCustomRange(custom)).block();
        coordinator.reportProgress(progress(alice, "alice", 0x800)).block();
        coordinator.reportCompletion(CompletionReport.builder()
            .assignmentId(alice.getAssignmentId())
            .clientId("alice")
            .found(false)
            .build()).block();

        StepVerifier.create(coordinator.requestAssignment(request("bob")))
            .assertNext(a -> {
                assertEquals("tail", a.getRangeId());
                assertFalse(a.keyRange().overlaps(custom));
            })
            .verifyComplete();
        StepVerifier.create(coordinator.requestAssignment(request("carol")))
            .verifyComplete();
        StepVerifier.create(coordinator.requestAssignment(
                request("dave").withCustomRange(KeyRange.of(BigInteger.valueOf(0x1800), BigInteger.valueOf(0x3000)))))
            .verifyComplete();
        assertEquals(RangeStatus.PENDING, ledger.require("wide").getStatus());
    }

    @Test
    @DisplayName("Pool calls run on the bounded elastic scheduler")
    void callsLeaveTheCallerThread() {
        ledger.register(range("r1", 0, 100, 50));

        StepVerifier.create(coordinator.requestAssignment(request("alice")).map(a -> Thread.currentThread().getName()))
            .assertNext(thread -> assertTrue(thread.startsWith("boundedElastic"), thread))
            .verifyComplete();
        StepVerifier.create(coordinator.getStats("alice").map(s -> Thread.currentThread().getName()))
            .assertNext(thread -> assertTrue(thread.startsWith("boundedElastic"), thread))
            .verifyComplete();
    }

    @Test
    @DisplayName("Requests without a client id are rejected")
    void missingClientRejected() {
        StepVerifier.create(coordinator.requestAssignment(request(" ")))
            .expectError(ValidationException.class)
            .verify();
    }

    // ========== Reports ==========

    @Test
    @DisplayName("Progress extends the lease and the last key completes the assignment")
    void progressToExhaustion() {
        ledger.register(range("r1", 0, 100, 50));
        Assignment assignment = coordinator.requestAssignment(request("alice")).block();
        clock.advance(Duration.ofSeconds(20));

        StepVerifier.create(coordinator.reportProgress(progress(assignment, "alice", 40)))
            .assertNext(r -> assertEquals(new BigDecimal("40.00"), r.getPercentComplete()))
            .verifyComplete();
        assertEquals(AssignmentStatus.REPORTING, registry.require(assignment.getAssignmentId()).getStatus());
        assertEquals(T0.plusSeconds(50), registry.require(assignment.getAssignmentId()).getExpiresAt());

        ProgressRecord done = coordinator.reportProgress(progress(assignment, "alice", 100)).block();

        assertEquals(RangeStatus.COMPLETED, done.getStatus());
        assertEquals(AssignmentStatus.COMPLETED, registry.require(assignment.getAssignmentId()).getStatus());
    }

    @Test
    @DisplayName("Reports from another client or for unknown assignments are refused")
    void ownershipEnforced() {
        ledger.register(range("r1", 0, 100, 50));
        Assignment assignment = coordinator.requestAssignment(request("alice")).block();

        StepVerifier.create(coordinator.reportProgress(progress(assignment, "mallory", 10)))
            .expectError(InvalidStateException.class)
            .verify();
        StepVerifier.create(coordinator.reportProgress(ProgressReport.builder()
                .assignmentId("nope").clientId("alice").searchedKeys(BigInteger.ONE).build()))
            .expectError(ValidationException.class)
            .verify();
        StepVerifier.create(coordinator.reportProgress(progress(assignment, "alice", 101)))
            .expectError(ValidationException.class)
            .verify();
    }

    @Test
    @DisplayName("Completion without a find exhausts the range; later requests skip it")
    void completionExhausts() {
        ledger.register(range("r1", 0, 100, 80));
        ledger.register(range("r2", 100, 200, 50));
        Assignment assignment = coordinator.requestAssignment(request("alice")).block();

        Assignment completed = coordinator.reportCompletion(CompletionReport.builder()
            .assignmentId(assignment.getAssignmentId())
            .clientId("alice")
            .found(false)
            .build()).block();

        assertEquals(AssignmentStatus.COMPLETED, completed.getStatus());
        assertEquals(BigInteger.valueOf(100), ledger.require("r1").getSearchedKeys());
        assertEquals("r2", coordinator.requestAssignment(request("alice")).block().getRangeId());
        StepVerifier.create(coordinator.reportCompletion(CompletionReport.builder()
                .assignmentId(assignment.getAssignmentId()).clientId("alice").build()))
            .expectError(InvalidStateException.class)
            .verify();
    }

    @Test
    @DisplayName("A find supersedes overlapping ranges and stops their assignments")
    void foundSupersedesOverlaps() {
        ledger.register(range("r1", 0, 100, 80));
        ledger.register(range("overlap", 50, 150, 50));
        ledger.register(range("apart", 150, 250, 40));
        Assignment assignment = coordinator.requestAssignment(request("alice")).block();

        coordinator.reportCompletion(CompletionReport.builder()
            .assignmentId(assignment.getAssignmentId())
            .clientId("alice")
            .found(true)
            .evidence("0xKEY")
            .build()).block();

        ProgressRecord found = ledger.require("r1");
        assertEquals(RecordOutcome.FOUND, found.getOutcome());
        assertEquals("0xKEY", found.getEvidence());
        assertEquals(RecordOutcome.SUPERSEDED, ledger.require("overlap").getOutcome());
        assertEquals(RangeStatus.PENDING, ledger.require("apart").getStatus());
    }

    @Test
    @DisplayName("Abandoning returns the range to the pool with its progress")
    void abandonReleasesRange() {
        ledger.register(range("r1", 0, 100, 50));
        Assignment assignment = coordinator.requestAssignment(request("alice")).block();
        coordinator.reportProgress(progress(assignment, "alice", 30)).block();

        Assignment abandoned = coordinator.abandonAssignment(AbandonRequest.builder()
            .assignmentId(assignment.getAssignmentId())
            .clientId("alice")
            .reason("gpu died")
            .build()).block();

        assertEquals(AssignmentStatus.ABANDONED, abandoned.getStatus());
        assertEquals(RangeStatus.PENDING, ledger.require("r1").getStatus());
        Assignment next = coordinator.requestAssignment(request("bob")).block();
        assertEquals("r1", next.getRangeId());
        assertEquals(BigInteger.valueOf(30), next.getBaselineKeys());
    }

    // ========== Leases ==========

    @Test
    @DisplayName("An overdue lease expires and the range goes to the next client")
    void expiredLeaseIsReassigned() {
        ledger.register(range("r1", 0, 100, 50));
        Assignment first = coordinator.requestAssignment(request("alice")).block();

        clock.advance(Duration.ofSeconds(31));
        List<Assignment> expired = coordinator.expireOverdue();

        assertEquals(1, expired.size());
        assertEquals(AssignmentStatus.EXPIRED, registry.require(first.getAssignmentId()).getStatus());
        assertEquals(RangeStatus.PENDING, ledger.require("r1").getStatus());

        Assignment second = coordinator.requestAssignment(request("bob")).block();
        assertEquals("r1", second.getRangeId());
        StepVerifier.create(coordinator.reportProgress(progress(first, "alice", 10)))
            .expectError(InvalidStateException.class)
            .verify();
    }

    @Test
    @DisplayName("A late report revives an expired lease nobody took over")
    void lateReportRevives() {
        ledger.register(range("r1", 0, 100, 50));
        Assignment assignment = coordinator.requestAssignment(request("alice")).block();
        clock.advance(Duration.ofMinutes(5));
        coordinator.expireOverdue();

        coordinator.reportProgress(progress(assignment, "alice", 10)).block();

        Assignment revived = registry.require(assignment.getAssignmentId());
        assertEquals(AssignmentStatus.REPORTING, revived.getStatus());
        assertTrue(revived.isLiveAt(clock.instant()));
        assertEquals(RangeStatus.ACTIVE, ledger.require("r1").getStatus());
    }

    @Test
    @DisplayName("The scheduler tick expires leases and writes the strategy")
    void tickPersistsStrategy() {
        ledger.register(range("r1", 0, 100, 50));
        coordinator.requestAssignment(request("alice")).block();
        clock.advance(Duration.ofMinutes(1));

        assertNotNull(coordinator.tick());

        assertTrue(Files.exists(dir.resolve("strategy.json")));
        assertEquals(1.0, meterRegistry.get(MetricsNames.ASSIGNMENTS_EXPIRED_TOTAL).counter().count());
    }

    // ========== Stats ==========

    @Test
    @DisplayName("Contributions are ranked by keys searched")
    void statsRankContributors() {
        ledger.register(range("r1", 0, 100, 80));
        ledger.register(range("r2", 100, 300, 70));
        ledger.register(range("r3", 300, 400, 60));
        Assignment alice = coordinator.requestAssignment(request("alice")).block();
        Assignment bob = coordinator.requestAssignment(request("bob")).block();
        coordinator.reportProgress(progress(alice, "alice", 20)).block();
        coordinator.reportProgress(progress(bob, "bob", 150)).block();

        PoolStats stats = coordinator.getStats("alice").block();

        assertEquals(2, stats.getParticipantCount());
        assertEquals(2, stats.getActiveParticipants());
        assertEquals(3, stats.getRangesTotal());
        assertEquals(0, stats.getRangesCompleted());
        assertEquals(BigInteger.valueOf(170), stats.getSearchedKeyspace());
        assertEquals(new BigDecimal("42.50"), stats.getKeyspaceCoveredPct());
        assertEquals("bob", stats.getContributions().get(0).getClientId());
        assertEquals(1, stats.getContributions().get(0).getRank());
        assertEquals(2, stats.getYourContribution().getRank());
        assertFalse(stats.isStale());
        assertNull(coordinator.getStats("nobody").block().getYourContribution());
    }

    private static AssignmentRequest request(String clientId) {
        return AssignmentRequest.builder()
            .clientId(clientId)
            .build();
    }

    private static ProgressReport progress(Assignment assignment, String clientId, long searched) {
        return ProgressReport.builder()
            .assignmentId(assignment.getAssignmentId())
            .clientId(clientId)
            .searchedKeys(BigInteger.valueOf(searched))
            .searchRate(1e9)
            .build();
    }

    private static Range range(String id, long start, long end, int priority) {
        return Range.builder()
            .id(id)
            .start(BigInteger.valueOf(start))
            .end(BigInteger.valueOf(end))
            .priority(priority)
            .status(RangeStatus.PENDING)
            .tier(RangeTier.HIGH)
            .createdAt(T0)
            .build();
    }
}
