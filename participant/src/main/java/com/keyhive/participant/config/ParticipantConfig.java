package com.keyhive.participant.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration for a participant, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class ParticipantConfig {

    Path dataDir;
    String poolUrl;
    Duration reportInterval;
    int graceFactor;
    Duration requestTimeout;

    /**
     * Fixed client id for new pool configs; generated when absent.
     */
    String clientId;

    public static ParticipantConfig fromEnv() {
        return ParticipantConfig.builder()
            .dataDir(Paths.get(getEnv("DATA_DIR", "data/keyhive-participant")))
            .poolUrl(getEnv("POOL_URL", "http://localhost:8090"))
            .reportInterval(Duration.ofSeconds(Integer.parseInt(getEnv("REPORT_INTERVAL_SEC", "300"))))
            .graceFactor(Integer.parseInt(getEnv("GRACE_FACTOR", "3")))
            .requestTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("REQUEST_TIMEOUT_SEC", "10"))))
            .clientId(System.getenv("CLIENT_ID"))
            .build();
    }

    public Path poolConfigFile() {
        return dataDir.resolve("pool_config.json");
    }

    public Path assignmentFile() {
        return dataDir.resolve("assignment.json");
    }

    public Path progressFile() {
        return dataDir.resolve("pool_progress.json");
    }

    public Path statsFile() {
        return dataDir.resolve("pool_stats.json");
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
