package com.keyhive.coordinator.cli;

import com.keyhive.coordinator.schedule.AdaptiveStrategy;
import com.keyhive.core.keyspace.KeyspaceMath;
import com.keyhive.core.model.Coverage;
import com.keyhive.core.model.Range;

import java.io.PrintWriter;

/**
 * Plain-text rendering of an {@link AdaptiveStrategy} for the {@code status} command.
 */
final class StatusReport {
    private StatusReport() {
    }

    static void print(AdaptiveStrategy strategy, PrintWriter out) {
        Coverage coverage = strategy.getCoverage();
        out.println("=== Keyspace coverage ===");
        out.println("Total keys:     " + coverage.getTotalKeyspace());
        out.println("Searched keys:  " + coverage.getSearchedKeyspace());
        out.println("Complete:       " + coverage.getPercentComplete().toPlainString() + "%");
        out.println("High band:      " + strategy.getHighPriorityComplete().toPlainString() + "%");
        out.println();

        out.println("=== Open ranges (" + strategy.getCurrentRanges().size() + ") ===");
        for (AdaptiveStrategy.ScoredRange range : strategy.getCurrentRanges()) {
            out.printf("%-28s %-9s %-8s score %3d  %6s%%  %.2e keys/s  [%s, %s)%n",
                range.getId(),
                range.getStatus().name().toLowerCase(),
                range.getTier().name().toLowerCase(),
                range.getScore(),
                range.getPercentComplete().toPlainString(),
                range.getSearchRate(),
                KeyspaceMath.toHex(range.getStart()),
                KeyspaceMath.toHex(range.getEnd()));
        }
        out.println();

        out.println("=== Completed (" + strategy.getCompletedRanges().size() + ") ===");
        strategy.getCompletedRanges().forEach(id -> out.println("  " + id));
        out.println();

        out.println("=== Next recommended ===");
        for (Range range : strategy.getNextRecommended()) {
            out.println("  " + range.getId() + " " + range.keyRange());
        }
        out.println();

        out.println("=== Recommendations ===");
        if (strategy.getRecommendations().isEmpty()) {
            out.println("  none");
        }
        strategy.getRecommendations().forEach(message -> out.println("  - " + message));
        out.flush();
    }
}
