package com.keyhive.coordinator.config;

import com.keyhive.coordinator.partition.PartitionConfig;
import com.keyhive.coordinator.schedule.SchedulerConfig;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.keyspace.KeyspaceMath;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration for the pool coordinator, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class CoordinatorConfig {

    String nodeId;
    int httpPort;

    /**
     * Root for manifest.json, ledger.json and strategy.json.
     */
    Path dataDir;

    // Keyspace and manifest
    BigInteger keyspaceStart;
    BigInteger keyspaceEnd;     // exclusive
    int splitCount;
    BigDecimal bandPaddingPct;  // percent points added around the estimate band

    // Scheduling
    double highRateThreshold;  // keys/s that earns a priority boost
    double slowRateFloor;      // keys/s below which an active range is reported slow
    Duration staleAfter;
    Duration schedulerTick;
    int selectionSize;

    // Leases handed to participants that do not state their own
    Duration defaultReportInterval;
    int defaultGraceFactor;

    public static CoordinatorConfig fromEnv() {
        return CoordinatorConfig.builder()
            .nodeId(getEnv("NODE_ID", "coordinator-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8090")))
            .dataDir(Paths.get(getEnv("DATA_DIR", "data/keyhive")))
            .keyspaceStart(KeyspaceMath.parseHex(getEnv("KEYSPACE_START", "400000000000000000")))
            .keyspaceEnd(KeyspaceMath.parseHex(getEnv("KEYSPACE_END", "800000000000000000")))
            .splitCount(Integer.parseInt(getEnv("SPLIT_COUNT", "3")))
            .bandPaddingPct(new BigDecimal(getEnv("BAND_PADDING_PCT", "0")))
            .highRateThreshold(Double.parseDouble(getEnv("HIGH_RATE_THRESHOLD", "1e9")))
            .slowRateFloor(Double.parseDouble(getEnv("SLOW_RATE_FLOOR", "5e8")))
            .staleAfter(Duration.ofMinutes(Integer.parseInt(getEnv("STALE_AFTER_MIN", "120"))))
            .schedulerTick(Duration.ofSeconds(Integer.parseInt(getEnv("SCHEDULER_TICK_SEC", "30"))))
            .selectionSize(Integer.parseInt(getEnv("SELECTION_SIZE", "3")))
            .defaultReportInterval(Duration.ofSeconds(Integer.parseInt(getEnv("REPORT_INTERVAL_SEC", "300"))))
            .defaultGraceFactor(Integer.parseInt(getEnv("GRACE_FACTOR", "3")))
            .build();
    }

    public KeyRange keyspace() {
        return KeyRange.of(keyspaceStart, keyspaceEnd);
    }

    public PartitionConfig partitionConfig() {
        return PartitionConfig.builder()
            .keyspace(keyspace())
            .splitCount(splitCount)
            .bandPaddingPct(bandPaddingPct)
            .build();
    }

    public SchedulerConfig schedulerConfig() {
        return SchedulerConfig.builder()
            .highRateThreshold(highRateThreshold)
            .slowRateFloor(slowRateFloor)
            .staleAfter(staleAfter)
            .selectionSize(selectionSize)
            .build();
    }

    public Path manifestFile() {
        return dataDir.resolve("manifest.json");
    }

    public Path ledgerFile() {
        return dataDir.resolve("ledger.json");
    }

    public Path strategyFile() {
        return dataDir.resolve("strategy.json");
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
