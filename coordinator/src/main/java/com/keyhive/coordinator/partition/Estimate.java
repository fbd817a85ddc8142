package com.keyhive.coordinator.partition;

import com.keyhive.core.keyspace.KeyspaceMath;
import com.keyhive.core.error.ValidationException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Probability estimate over the keyspace, as percentage positions.
 * <p>
 * Produced by an external estimator; read from {@code estimate.json}.
 * </p>
 */
@Value
@Builder
@Jacksonized
public class Estimate {
    BigDecimal centralEstimate;
    BigDecimal ciLower;
    BigDecimal ciUpper;

    /**
     * Rejects positions outside {@code [0, 100]} and an inverted confidence interval.
     */
    public void validate() {
        KeyspaceMath.requirePercent(centralEstimate, "central_estimate");
        KeyspaceMath.requirePercent(ciLower, "ci_lower");
        KeyspaceMath.requirePercent(ciUpper, "ci_upper");
        if (ciLower.compareTo(ciUpper) > 0) {
            throw new ValidationException("ci_lower " + ciLower.toPlainString()
                + " is above ci_upper " + ciUpper.toPlainString());
        }
    }
}
