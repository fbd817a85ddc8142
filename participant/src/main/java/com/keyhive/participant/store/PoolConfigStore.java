package com.keyhive.participant.store;

import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.util.JsonFileStore;
import com.keyhive.participant.config.ParticipantConfig;
import com.keyhive.participant.config.PoolConfig;
import com.keyhive.participant.config.ScanType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * Load-or-create of {@code pool_config.json}.
 */
public class PoolConfigStore {
    private static final Logger log = LoggerFactory.getLogger(PoolConfigStore.class);

    private final JsonFileStore<PoolConfig> file;
    private final ParticipantConfig defaults;

    public PoolConfigStore(ParticipantConfig defaults) {
        this.defaults = defaults;
        this.file = new JsonFileStore<>(defaults.poolConfigFile(), PoolConfig.class);
    }

    public Optional<PoolConfig> load() {
        return file.load();
    }

    /**
     * Returns the stored config, creating it on first use. A custom range
     * replaces the stored scan settings; without one an existing config is
     * returned untouched.
     */
    public synchronized PoolConfig loadOrCreate(KeyRange customRange) {
        Optional<PoolConfig> existing = file.load();
        if (existing.isPresent() && customRange == null) {
            return existing.get();
        }

        PoolConfig config = existing.orElseGet(this::fresh);
        if (customRange != null) {
            config = config.toBuilder()
                .scanType(ScanType.CUSTOM_RANGE)
                .customRange(customRange)
                .build();
        }
        file.save(config);
        if (existing.isEmpty()) {
            log.info("Created pool configuration {} for client {}", file.path(), config.getClientId());
        } else {
            log.info("Pool configuration switched to custom range {}", customRange);
        }
        return config;
    }

    private PoolConfig fresh() {
        String clientId = defaults.getClientId() != null && !defaults.getClientId().isBlank()
            ? defaults.getClientId()
            : "client_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return PoolConfig.builder()
            .poolUrl(defaults.getPoolUrl())
            .clientId(clientId)
            .scanType(ScanType.INCLUDE_DEFEATED)
            .reportIntervalSeconds(defaults.getReportInterval().toSeconds())
            .graceFactor(defaults.getGraceFactor())
            .build();
    }
}
