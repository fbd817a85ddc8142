package com.keyhive.participant;

import com.keyhive.coordinator.CoordinatorContext;
import com.keyhive.coordinator.config.CoordinatorConfig;
import com.keyhive.core.model.Range;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.model.RangeTier;
import com.keyhive.participant.config.ParticipantConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Coordinator fixtures shared by participant tests.
 */
public final class InProcessPool {
    private InProcessPool() {
    }

    public static CoordinatorConfig coordinatorConfig(Path dir) {
        return CoordinatorConfig.builder()
            .nodeId("participant-test")
            .httpPort(0)
            .dataDir(dir)
            .keyspaceStart(BigInteger.ZERO)
            .keyspaceEnd(BigInteger.valueOf(0x10000))
            .splitCount(3)
            .bandPaddingPct(BigDecimal.ZERO)
            .highRateThreshold(1e9)
            .slowRateFloor(5e8)
            .staleAfter(Duration.ofHours(2))
            .schedulerTick(Duration.ofSeconds(30))
            .selectionSize(3)
            .defaultReportInterval(Duration.ofSeconds(60))
            .defaultGraceFactor(3)
            .build();
    }

    public static CoordinatorContext open(Path dir) {
        return open(dir, new SimpleMeterRegistry());
    }

    public static CoordinatorContext open(Path dir, MeterRegistry meterRegistry) {
        return CoordinatorContext.open(coordinatorConfig(dir), Clock.systemUTC(), meterRegistry);
    }

    public static ParticipantConfig participantConfig(Path dir, String clientId) {
        return ParticipantConfig.builder()
            .dataDir(dir)
            .poolUrl("http://localhost:8090")
            .reportInterval(Duration.ofSeconds(60))
            .graceFactor(3)
            .requestTimeout(Duration.ofSeconds(2))
            .clientId(clientId)
            .build();
    }

    public static Range range(String id, long start, long end, int priority) {
        return Range.builder()
            .id(id)
            .start(BigInteger.valueOf(start))
            .end(BigInteger.valueOf(end))
            .priority(priority)
            .status(RangeStatus.PENDING)
            .tier(RangeTier.HIGH)
            .createdAt(Instant.now())
            .build();
    }
}
