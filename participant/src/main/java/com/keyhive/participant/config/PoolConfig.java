package com.keyhive.participant.config;

import com.keyhive.core.keyspace.KeyRange;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Persisted pool identity of this participant ({@code pool_config.json}).
 * <p>
 * The client id is created once and reused by every later session, so
 * contributions accumulate under one name.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class PoolConfig {
    String poolUrl;
    String clientId;
    ScanType scanType;
    long reportIntervalSeconds;
    int graceFactor;

    /**
     * Only set for {@link ScanType#CUSTOM_RANGE}.
     */
    KeyRange customRange;
}
