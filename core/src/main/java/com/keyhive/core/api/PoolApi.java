package com.keyhive.core.api;

import com.keyhive.core.model.Assignment;
import com.keyhive.core.model.PoolStats;
import com.keyhive.core.model.ProgressRecord;
import com.keyhive.core.msg.PoolMessages.AbandonRequest;
import com.keyhive.core.msg.PoolMessages.AssignmentRequest;
import com.keyhive.core.msg.PoolMessages.CompletionReport;
import com.keyhive.core.msg.PoolMessages.ProgressReport;
import reactor.core.publisher.Mono;

/**
 * Assignment lifecycle offered by a search pool.
 * <p>
 * Implemented in-process by the coordinator and over HTTP by the participant's
 * client; both honor the same contract:
 * <ul>
 *   <li>validation failures signal {@link com.keyhive.core.error.ValidationException}</li>
 *   <li>illegal transitions signal {@link com.keyhive.core.error.InvalidStateException}</li>
 *   <li>transport failures signal {@link com.keyhive.core.error.PoolUnavailableException}</li>
 * </ul>
 * </p>
 */
public interface PoolApi {

    /**
     * Claims exactly one range for the requesting client.
     *
     * @return the new assignment, or an empty {@code Mono} when nothing is available
     */
    Mono<Assignment> requestAssignment(AssignmentRequest request);

    /**
     * Records progress and refreshes the assignment's lease.
     *
     * @return the updated ledger record of the assigned range
     */
    Mono<ProgressRecord> reportProgress(ProgressReport report);

    Mono<Assignment> reportCompletion(CompletionReport report);

    /**
     * Voluntarily releases an assignment without a grace period.
     */
    Mono<Assignment> abandonAssignment(AbandonRequest request);

    /**
     * Pool statistics, with {@code your_contribution} filled for {@code clientId} when known.
     */
    Mono<PoolStats> getStats(String clientId);
}
