package com.keyhive.core.msg;

import com.keyhive.core.keyspace.KeyRange;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * Request bodies exchanged between participants and the pool coordinator.
 * <p>
 * These messages travel as JSON over the coordinator's HTTP API, or are passed
 * directly to an in-process coordinator.
 * </p>
 */
public final class PoolMessages {
    private PoolMessages() {
    }

    /**
     * Asks the pool for one range to search.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class AssignmentRequest {
        String clientId;

        /**
         * Bounds to claim instead of a scheduler pick; registered on first use.
         */
        KeyRange customRange;

        /**
         * Heartbeat cadence the participant commits to.
         */
        long reportIntervalSeconds;

        /**
         * Missed heartbeats tolerated before the lease runs out.
         */
        int graceFactor;
    }

    /**
     * Heartbeat carrying the absolute searched-key counter of the assignment's range.
     */
    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class ProgressReport {
        String assignmentId;

        String clientId;

        BigInteger searchedKeys;

        /**
         * Keys per second; {@code null} when unknown.
         */
        Double searchRate;
    }

    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class CompletionReport {
        String assignmentId;

        String clientId;

        boolean found;

        /**
         * Opaque proof for a positive result. Stored, never logged.
         */
        String evidence;

        @Override
        public String toString() {
            return "CompletionReport(assignmentId=" + assignmentId + ", clientId=" + clientId
                + ", found=" + found + ")";
        }
    }

    @Value
    @Builder(toBuilder = true)
    @With
    @Jacksonized
    public static class AbandonRequest {
        String assignmentId;

        String clientId;

        String reason;
    }

    /**
     * Error body returned by the HTTP API.
     */
    @Value
    @Builder
    @Jacksonized
    public static class ErrorResponse {
        String error;

        /**
         * Simple name of the exception class, used to rebuild it client-side.
         */
        String type;
    }
}
