package com.keyhive.coordinator.cli;

import com.keyhive.coordinator.CoordinatorContext;
import com.keyhive.coordinator.config.CoordinatorConfig;
import com.keyhive.coordinator.http.HttpServer;
import com.keyhive.coordinator.metrics.PrometheusMetricsExporter;
import com.keyhive.coordinator.partition.Estimate;
import com.keyhive.coordinator.partition.Manifest;
import com.keyhive.coordinator.schedule.AdaptiveStrategy;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyspaceMath;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.model.Range;
import com.keyhive.core.util.JsonUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import reactor.netty.DisposableServer;

import java.io.IOException;
import java.io.PrintWriter;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Operator commands for the coordinator. Everything except {@code serve}
 * works directly on the data directory and is meant for a stopped coordinator.
 * <p>
 * Exit codes: 0 success, 2 validation failure, 3 invalid state, 1 anything else.
 * </p>
 */
@CommandLine.Command(
    name = "keyhive-coordinator",
    mixinStandardHelpOptions = true,
    description = "Partition a keyspace and coordinate a pool of searchers",
    subcommands = {
        CoordinatorCli.Serve.class,
        CoordinatorCli.ManifestCommand.class,
        CoordinatorCli.Status.class,
        CoordinatorCli.Update.class,
        CoordinatorCli.Split.class,
        CoordinatorCli.AbandonRange.class
    }
)
public class CoordinatorCli {
    private static final Logger log = LoggerFactory.getLogger(CoordinatorCli.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_VALIDATION = 2;
    public static final int EXIT_INVALID_STATE = 3;

    @CommandLine.Option(names = {"--data-dir"}, description = "State directory (default: $DATA_DIR or data/keyhive)")
    private Path dataDir;

    @CommandLine.Option(names = {"--port"}, description = "HTTP port for serve (default: $HTTP_PORT or 8090)")
    private Integer port;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Clock clock;

    public CoordinatorCli(Clock clock) {
        this.clock = clock;
    }

    public static int execute(String... args) {
        return commandLine(Clock.systemUTC()).execute(args);
    }

    /**
     * Command line with the exit-code mapping installed; tests swap its writers.
     */
    public static CommandLine commandLine(Clock clock) {
        CommandLine commandLine = new CommandLine(new CoordinatorCli(clock));
        commandLine.setExecutionExceptionHandler(CoordinatorCli::handleFailure);
        return commandLine;
    }

    static int handleFailure(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        PrintWriter err = commandLine.getErr();
        if (e instanceof ValidationException) {
            err.println("Invalid input: " + e.getMessage());
            return EXIT_VALIDATION;
        }
        if (e instanceof InvalidStateException) {
            err.println("Rejected: " + e.getMessage());
            return EXIT_INVALID_STATE;
        }
        log.error("Command failed", e);
        err.println("Error: " + (e.getMessage() != null ? e.getMessage() : JsonUtils.rootMessage(e)));
        return EXIT_ERROR;
    }

    CoordinatorConfig config() {
        CoordinatorConfig.CoordinatorConfigBuilder builder = CoordinatorConfig.fromEnv().toBuilder();
        if (dataDir != null) {
            builder.dataDir(dataDir);
        }
        if (port != null) {
            builder.httpPort(port);
        }
        return builder.build();
    }

    CoordinatorContext open(MeterRegistry meterRegistry) {
        return CoordinatorContext.open(config(), clock, meterRegistry);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    // ========== Subcommands ==========

    @CommandLine.Command(name = "serve", description = "Run the HTTP coordinator and the scheduler tick")
    static class Serve implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CoordinatorCli parent;

        @Override
        public Integer call() {
            CoordinatorConfig config = parent.config();
            log.info("Starting coordinator {}", config.getNodeId());
            log.info("  Data dir: {}", config.getDataDir().toAbsolutePath());
            log.info("  Keyspace: {}", config.keyspace());

            PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
            CoordinatorContext context = CoordinatorContext.open(config, parent.clock, metricsExporter.getRegistry());
            if (context.getLedger().isEmpty()) {
                log.warn("Ledger is empty; run 'manifest <estimate.json>' to seed it");
            }

            HttpServer httpServer = new HttpServer(
                config,
                context.getCoordinator(),
                context.getLedger(),
                context.getScheduler(),
                metricsExporter
            );
            DisposableServer server = httpServer.start();
            context.getCoordinator().start();
            log.info("Coordinator is ready");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown signal received");
                context.getCoordinator().stop();
                httpServer.stop();
                context.getLedger().save();
                log.info("Shutdown complete");
            }));

            server.onDispose().block();
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "manifest", description = "Partition the keyspace from a probability estimate and seed the ledger")
    static class ManifestCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CoordinatorCli parent;

        @CommandLine.Parameters(index = "0", description = "Estimate file with central_estimate, ci_lower, ci_upper")
        private Path estimateFile;

        @CommandLine.Option(names = {"--force"}, description = "Replace a ledger that already holds ranges")
        private boolean force;

        @Override
        public Integer call() {
            Estimate estimate;
            try {
                estimate = JsonUtils.readFile(estimateFile, Estimate.class);
            } catch (IOException e) {
                throw new ValidationException("Cannot read estimate " + estimateFile + ": " + JsonUtils.rootMessage(e), e);
            }
            CoordinatorContext context = parent.open(new SimpleMeterRegistry());
            Manifest manifest = context.getPartitioner().generateManifest(estimate, context.getConfig().partitionConfig());
            context.getLedger().seed(manifest, force);
            context.getManifestStore().save(manifest);

            PrintWriter out = parent.out();
            out.println(JsonUtils.writeValueAsString(manifest));
            out.println("Seeded " + manifest.allRanges().size() + " ranges into " + context.getConfig().ledgerFile());
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "status", description = "Print the adaptive strategy report and save strategy.json")
    static class Status implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CoordinatorCli parent;

        @Override
        public Integer call() {
            CoordinatorContext context = parent.open(new SimpleMeterRegistry());
            AdaptiveStrategy strategy = context.getScheduler().strategy(context.getLedger().snapshot());
            context.getStrategyStore().save(strategy);
            StatusReport.print(strategy, parent.out());
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "update", description = "Record searched keys for a range")
    static class Update implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CoordinatorCli parent;

        @CommandLine.Parameters(index = "0", description = "Range id")
        private String rangeId;

        @CommandLine.Parameters(index = "1", description = "Keys searched so far (decimal or 0x hex)")
        private String searchedKeys;

        @CommandLine.Parameters(index = "2", arity = "0..1", description = "Search rate in keys/s")
        private Double rate;

        @Override
        public Integer call() {
            BigInteger searched = KeyspaceMath.parseCount(searchedKeys);
            CoordinatorContext context = parent.open(new SimpleMeterRegistry());
            ProgressRecord record = context.getLedger().update(rangeId, searched, rate);
            parent.out().println("Updated " + rangeId + ": " + record.getPercentComplete().toPlainString()
                + "% complete (" + record.getStatus().name().toLowerCase() + ")");
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "split", description = "Split a range into contiguous pending children")
    static class Split implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CoordinatorCli parent;

        @CommandLine.Parameters(index = "0", description = "Range id")
        private String rangeId;

        @CommandLine.Parameters(index = "1", arity = "0..1", defaultValue = "2", description = "Number of pieces (default: 2)")
        private int count;

        @Override
        public Integer call() {
            CoordinatorContext context = parent.open(new SimpleMeterRegistry());
            List<Range> children = context.getScheduler().splitRange(rangeId, count);
            parent.out().println(JsonUtils.writeValueAsString(children));
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "abandon-range", description = "Mark a range abandoned so it is never scheduled again")
    static class AbandonRange implements Callable<Integer> {
        @CommandLine.ParentCommand
        private CoordinatorCli parent;

        @CommandLine.Parameters(index = "0", description = "Range id")
        private String rangeId;

        @CommandLine.Parameters(index = "1", arity = "0..1", defaultValue = "operator", description = "Reason")
        private String reason;

        @Override
        public Integer call() {
            CoordinatorContext context = parent.open(new SimpleMeterRegistry());
            context.getLedger().abandon(rangeId, reason);
            parent.out().println("Abandoned " + rangeId);
            return EXIT_SUCCESS;
        }
    }
}
