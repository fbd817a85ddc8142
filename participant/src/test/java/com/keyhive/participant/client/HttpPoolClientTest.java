package com.keyhive.participant.client;

import com.keyhive.coordinator.CoordinatorContext;
import com.keyhive.coordinator.http.HttpServer;
import com.keyhive.coordinator.metrics.PrometheusMetricsExporter;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.PoolUnavailableException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.AssignmentStatus;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.msg.PoolMessages.AbandonRequest;
import com.keyhive.core.msg.PoolMessages.AssignmentRequest;
import com.keyhive.core.msg.PoolMessages.CompletionReport;
import com.keyhive.core.msg.PoolMessages.ProgressReport;
import com.keyhive.participant.InProcessPool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Client contract against a coordinator served on an ephemeral port.
 */
class HttpPoolClientTest {

    @TempDir
    Path dir;

    private HttpServer server;
    private CoordinatorContext context;
    private HttpPoolClient client;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        context = InProcessPool.open(dir, meterRegistry);
        context.getLedger().register(InProcessPool.range("r1", 0, 100, 50));
        server = new HttpServer(context.getConfig(), context.getCoordinator(), context.getLedger(),
            context.getScheduler(), new PrometheusMetricsExporter(meterRegistry, "client-test"));
        server.start();
        client = new HttpPoolClient("http://localhost:" + server.port(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    // ========== Success paths ==========

    @Test
    @DisplayName("Full lifecycle over HTTP keeps exact key counts")
    void lifecycle() {
        Assignment assignment = client.requestAssignment(request("alice", null)).block();
        assertNotNull(assignment);
        assertEquals("r1", assignment.getRangeId());
        assertEquals(AssignmentStatus.ASSIGNED, assignment.getStatus());

        StepVerifier.create(client.reportProgress(progress(assignment, "alice", 50)))
            .assertNext(record -> {
                assertEquals(new BigDecimal("50.00"), record.getPercentComplete());
                assertEquals(BigInteger.valueOf(50), record.getSearchedKeys());
            })
            .verifyComplete();

        StepVerifier.create(client.reportCompletion(CompletionReport.builder()
                .assignmentId(assignment.getAssignmentId())
                .clientId("alice")
                .found(false)
                .build()))
            .assertNext(done -> assertEquals(AssignmentStatus.COMPLETED, done.getStatus()))
            .verifyComplete();

        StepVerifier.create(client.getStats("alice"))
            .assertNext(stats -> {
                assertEquals(1, stats.getRangesCompleted());
                assertEquals(1, stats.getYourContribution().getRank());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("204 from the pool completes the request empty")
    void noRangeAvailable() {
        client.requestAssignment(request("alice", null)).block();

        StepVerifier.create(client.requestAssignment(request("bob", null)))
            .verifyComplete();
    }

    @Test
    @DisplayName("Custom range is granted with exactly the requested bounds")
    void customRange() {
        KeyRange custom = KeyRange.of(BigInteger.valueOf(0x1000), BigInteger.valueOf(0x2000));

        StepVerifier.create(client.requestAssignment(request("alice", custom)))
            .assertNext(a -> assertEquals(custom, a.keyRange()))
            .verifyComplete();
    }

    // ========== Error mapping ==========

    @Test
    @DisplayName("400 maps to ValidationException with the server's message")
    void badRequestIsValidation() {
        Assignment assignment = client.requestAssignment(request("alice", null)).block();

        StepVerifier.create(client.reportProgress(progress(assignment, "alice", 101)))
            .expectErrorSatisfies(err -> {
                assertTrue(err instanceof ValidationException, err.toString());
                assertTrue(err.getMessage().contains("101"), err.getMessage());
            })
            .verify();
    }

    @Test
    @DisplayName("409 maps to InvalidStateException")
    void conflictIsInvalidState() {
        Assignment assignment = client.requestAssignment(request("alice", null)).block();

        StepVerifier.create(client.abandonAssignment(AbandonRequest.builder()
                .assignmentId(assignment.getAssignmentId())
                .clientId("mallory")
                .reason("test")
                .build()))
            .expectError(InvalidStateException.class)
            .verify();
        assertEquals(RangeStatus.ACTIVE, context.getLedger().require("r1").getStatus());
    }

    @Test
    @DisplayName("Unreachable pool maps to PoolUnavailableException")
    void unreachableIsUnavailable() {
        int port = server.port();
        server.stop();
        HttpPoolClient offline = new HttpPoolClient("http://localhost:" + port, Duration.ofSeconds(2));

        StepVerifier.create(offline.getStats("alice"))
            .expectError(PoolUnavailableException.class)
            .verify(Duration.ofSeconds(10));
    }

    private static AssignmentRequest request(String clientId, KeyRange custom) {
        return AssignmentRequest.builder()
            .clientId(clientId)
            .customRange(custom)
            .reportIntervalSeconds(60)
            .graceFactor(3)
            .build();
    }

    private static ProgressReport progress(Assignment assignment, String clientId, long searched) {
        return ProgressReport.builder()
            .assignmentId(assignment.getAssignmentId())
            .clientId(clientId)
            .searchedKeys(BigInteger.valueOf(searched))
            .searchRate(1e6)
            .build();
    }
}
