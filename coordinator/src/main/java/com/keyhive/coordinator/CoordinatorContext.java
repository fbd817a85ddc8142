package com.keyhive.coordinator;

import com.keyhive.coordinator.config.CoordinatorConfig;
import com.keyhive.coordinator.ledger.LedgerStore;
import com.keyhive.coordinator.ledger.ProgressLedger;
import com.keyhive.coordinator.partition.KeyspacePartitioner;
import com.keyhive.coordinator.partition.ManifestStore;
import com.keyhive.coordinator.pool.AssignmentRegistry;
import com.keyhive.coordinator.pool.PoolCoordinator;
import com.keyhive.coordinator.schedule.AdaptiveScheduler;
import com.keyhive.coordinator.schedule.StrategyStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;

import java.time.Clock;

/**
 * Coordinator components wired over one data directory.
 * <p>
 * Opening a context loads the ledger and the assignment table; a corrupt
 * file fails here, before anything is served.
 * </p>
 */
@Getter
public class CoordinatorContext {
    private final CoordinatorConfig config;
    private final KeyspacePartitioner partitioner;
    private final ManifestStore manifestStore;
    private final ProgressLedger ledger;
    private final AdaptiveScheduler scheduler;
    private final StrategyStore strategyStore;
    private final AssignmentRegistry registry;
    private final PoolCoordinator coordinator;

    private CoordinatorContext(CoordinatorConfig config, Clock clock, MeterRegistry meterRegistry) {
        this.config = config;
        this.partitioner = new KeyspacePartitioner(clock);
        this.manifestStore = new ManifestStore(config.manifestFile());
        this.ledger = new ProgressLedger(new LedgerStore(config.ledgerFile()), clock, meterRegistry);
        this.scheduler = new AdaptiveScheduler(ledger, config.schedulerConfig(), clock, meterRegistry);
        this.strategyStore = new StrategyStore(config.strategyFile());
        this.registry = new AssignmentRegistry(config.getDataDir().resolve("assignments.json"));
        this.coordinator = new PoolCoordinator(ledger, scheduler, registry, strategyStore, config, clock, meterRegistry);
    }

    /**
     * @throws com.keyhive.core.error.LedgerCorruptedException when a state file is unusable
     */
    public static CoordinatorContext open(CoordinatorConfig config, Clock clock, MeterRegistry meterRegistry) {
        CoordinatorContext context = new CoordinatorContext(config, clock, meterRegistry);
        context.ledger.load();
        context.registry.load();
        return context;
    }
}
