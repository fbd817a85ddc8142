package com.keyhive.participant.cli;

import com.keyhive.core.api.PoolApi;
import com.keyhive.core.error.InvalidStateException;
import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.keyspace.KeyspaceMath;
import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.PoolStats;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.util.JsonUtils;
import com.keyhive.participant.client.HttpPoolClient;
import com.keyhive.participant.config.ParticipantConfig;
import com.keyhive.participant.config.PoolConfig;
import com.keyhive.participant.session.PoolParticipant;
import com.keyhive.participant.store.PoolConfigStore;
import com.keyhive.participant.store.ProgressEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

/**
 * Participant commands. Each invocation reloads the session from the data
 * directory, so {@code request}, {@code report} and {@code complete} can run
 * as separate processes.
 * <p>
 * Exit codes: 0 success, 2 validation failure, 3 invalid state, 1 anything else
 * (including an unreachable pool).
 * </p>
 */
@CommandLine.Command(
    name = "keyhive-participant",
    mixinStandardHelpOptions = true,
    description = "Search assigned keyspace ranges as a member of a pool",
    subcommands = {
        ParticipantCli.Init.class,
        ParticipantCli.Request.class,
        ParticipantCli.Report.class,
        ParticipantCli.Complete.class,
        ParticipantCli.Abandon.class,
        ParticipantCli.Stats.class,
        ParticipantCli.Status.class
    }
)
public class ParticipantCli {
    private static final Logger log = LoggerFactory.getLogger(ParticipantCli.class);

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_VALIDATION = 2;
    public static final int EXIT_INVALID_STATE = 3;

    @CommandLine.Option(names = {"--data-dir"}, description = "State directory (default: $DATA_DIR or data/keyhive-participant)")
    private Path dataDir;

    @CommandLine.Option(names = {"--pool-url"}, description = "Coordinator URL (default: stored pool_url, then $POOL_URL)")
    private String poolUrl;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Clock clock;
    private final BiFunction<String, Duration, PoolApi> clientFactory;

    public ParticipantCli(Clock clock, BiFunction<String, Duration, PoolApi> clientFactory) {
        this.clock = clock;
        this.clientFactory = clientFactory;
    }

    public static int execute(String... args) {
        return commandLine(Clock.systemUTC(), HttpPoolClient::new).execute(args);
    }

    public static CommandLine commandLine(Clock clock, BiFunction<String, Duration, PoolApi> clientFactory) {
        CommandLine commandLine = new CommandLine(new ParticipantCli(clock, clientFactory));
        commandLine.setExecutionExceptionHandler(ParticipantCli::handleFailure);
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
        log.debug("Command failed", e);
        err.println("Error: " + (e.getMessage() != null ? e.getMessage() : JsonUtils.rootMessage(e)));
        return EXIT_ERROR;
    }

    ParticipantConfig config() {
        ParticipantConfig.ParticipantConfigBuilder builder = ParticipantConfig.fromEnv().toBuilder();
        if (dataDir != null) {
            builder.dataDir(dataDir);
        }
        if (poolUrl != null) {
            builder.poolUrl(poolUrl);
        }
        return builder.build();
    }

    /**
     * Session against the pool named by {@code --pool-url}, the stored config, or the environment.
     */
    PoolParticipant participant() {
        ParticipantConfig config = config();
        String url = poolUrl != null
            ? poolUrl
            : new PoolConfigStore(config).load().map(PoolConfig::getPoolUrl).orElse(config.getPoolUrl());
        return new PoolParticipant(config, clientFactory.apply(url, config.getRequestTimeout()), clock);
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    Duration timeout() {
        return config().getRequestTimeout().plusSeconds(5);
    }

    static void printAssignment(PrintWriter out, Assignment assignment) {
        out.println("Assignment: " + assignment.getAssignmentId());
        out.println("Range:      " + assignment.getRangeId() + " [" + KeyspaceMath.toHex(assignment.getStart())
            + ", " + KeyspaceMath.toHex(assignment.getEnd()) + ")");
        out.println("Keys:       " + assignment.keyRange().size());
        out.println("Priority:   " + assignment.getPriority());
        out.println("Status:     " + assignment.getStatus().name().toLowerCase());
        out.println("Expires:    " + assignment.getExpiresAt());
    }

    static void printStats(PrintWriter out, PoolStats stats) {
        out.println("Participants:     " + stats.getParticipantCount() + " (" + stats.getActiveParticipants() + " active)");
        out.println("Ranges completed: " + stats.getRangesCompleted() + " / " + stats.getRangesTotal());
        out.println("Keyspace covered: " + stats.getKeyspaceCoveredPct().toPlainString() + "%");
        if (stats.getYourContribution() != null) {
            out.println("Your rank:        #" + stats.getYourContribution().getRank());
            out.println("Your ranges:      " + stats.getYourContribution().getRangesCompleted());
            out.println("Your keys:        " + stats.getYourContribution().getKeysSearched());
        }
        if (stats.isStale()) {
            out.println("(stale snapshot from " + stats.getGeneratedAt() + ")");
        }
    }

    // ========== Subcommands ==========

    @CommandLine.Command(name = "init", description = "Create or load the pool configuration")
    static class Init implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ParticipantCli parent;

        @CommandLine.Parameters(index = "0", arity = "0..1", description = "Custom range start (hex)")
        private String start;

        @CommandLine.Parameters(index = "1", arity = "0..1", description = "Custom range end (hex)")
        private String end;

        @Override
        public Integer call() {
            if ((start == null) != (end == null)) {
                throw new ValidationException("A custom range needs both start and end");
            }
            KeyRange custom = start == null ? null : KeyRange.of(KeyspaceMath.parseHex(start), KeyspaceMath.parseHex(end));
            PoolConfig config = parent.participant().initialize(custom);

            PrintWriter out = parent.out();
            out.println("Client ID: " + config.getClientId());
            out.println("Pool URL:  " + config.getPoolUrl());
            out.println("Scan type: " + config.getScanType());
            if (config.getCustomRange() != null) {
                out.println("Range:     " + config.getCustomRange());
            }
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "request", description = "Request a range from the pool")
    static class Request implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ParticipantCli parent;

        @Override
        public Integer call() {
            Optional<Assignment> assignment = parent.participant().requestAssignment().blockOptional(parent.timeout());
            if (assignment.isEmpty()) {
                parent.out().println("No range available");
                return EXIT_SUCCESS;
            }
            printAssignment(parent.out(), assignment.get());
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "report", description = "Report keys searched in the current range")
    static class Report implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ParticipantCli parent;

        @CommandLine.Parameters(index = "0", description = "Keys searched so far (decimal or 0x hex)")
        private String searched;

        @CommandLine.Parameters(index = "1", description = "Search rate in keys/s")
        private double rate;

        @Override
        public Integer call() {
            ProgressRecord record = parent.participant()
                .reportProgress(KeyspaceMath.parseCount(searched), rate)
                .block(parent.timeout());
            parent.out().println("Progress: " + record.getPercentComplete().toPlainString() + "% of "
                + record.getRangeId() + " (" + record.getStatus().name().toLowerCase() + ")");
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "complete", description = "Close the current range")
    static class Complete implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ParticipantCli parent;

        @CommandLine.Parameters(index = "0", description = "true when the key was found")
        private boolean found;

        @CommandLine.Parameters(index = "1", arity = "0..1", description = "Evidence of the find")
        private String evidence;

        @Override
        public Integer call() {
            Assignment completed = parent.participant().reportCompletion(found, evidence).block(parent.timeout());
            parent.out().println("Completed " + completed.getRangeId() + (found ? " (found)" : ""));
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "abandon", description = "Give the current range back to the pool")
    static class Abandon implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ParticipantCli parent;

        @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = "user_requested", description = "Reason")
        private String reason;

        @Override
        public Integer call() {
            Assignment abandoned = parent.participant().abandonAssignment(reason).block(parent.timeout());
            parent.out().println("Abandoned " + abandoned.getRangeId());
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "stats", description = "Show pool statistics")
    static class Stats implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ParticipantCli parent;

        @Override
        public Integer call() {
            printStats(parent.out(), parent.participant().getStats().block(parent.timeout()));
            return EXIT_SUCCESS;
        }
    }

    @CommandLine.Command(name = "status", description = "Show configuration, current assignment and pool statistics")
    static class Status implements Callable<Integer> {
        @CommandLine.ParentCommand
        private ParticipantCli parent;

        @Override
        public Integer call() {
            PoolParticipant participant = parent.participant();
            PrintWriter out = parent.out();
            Optional<PoolConfig> config = participant.poolConfig();
            if (config.isEmpty()) {
                out.println("Pool not initialized; run 'init' first");
                return EXIT_SUCCESS;
            }

            out.println("=== Configuration ===");
            out.println("Pool URL:  " + config.get().getPoolUrl());
            out.println("Client ID: " + config.get().getClientId());
            out.println("Scan type: " + config.get().getScanType());
            out.println();

            out.println("=== Current assignment ===");
            Optional<Assignment> assignment = participant.currentAssignment();
            if (assignment.isPresent()) {
                printAssignment(out, assignment.get());
            } else {
                out.println("None");
            }
            Optional<ProgressEntry> last = participant.history().latest();
            last.ifPresent(entry -> out.println("Last local report: " + entry.getSearchedKeys() + " keys at "
                + entry.getRecordedAt() + " (" + entry.getStatus().name().toLowerCase() + ")"));
            out.println();

            out.println("=== Pool statistics ===");
            try {
                printStats(out, participant.getStats().block(parent.timeout()));
            } catch (RuntimeException e) {
                log.debug("Stats unavailable", e);
                out.println("Unable to retrieve: " + e.getMessage());
            }
            return EXIT_SUCCESS;
        }
    }
}
