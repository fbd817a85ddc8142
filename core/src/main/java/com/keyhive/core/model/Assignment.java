package com.keyhive.core.model;

import com.keyhive.core.keyspace.KeyRange;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Time-bounded claim by one participant on exactly one range.
 * <p>
 * An assignment is <i>live</i> while it is {@code assigned} or
 * {@code reporting} and its lease has not run out. Every accepted report
 * pushes {@code expires_at} to {@code now + report_interval * grace_factor}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class Assignment {
    String assignmentId;

    String rangeId;

    String clientId;

    BigInteger start;

    BigInteger end;

    int priority;

    RangeTier tier;

    AssignmentStatus status;

    Instant assignedAt;

    Instant expiresAt;

    Instant lastReportAt;

    /**
     * Ledger counter when the claim was granted; contribution is measured from here.
     */
    BigInteger baselineKeys;

    BigInteger searchedKeys;

    long reportIntervalSeconds;

    int graceFactor;

    /**
     * Why the assignment ended (abandon reason, expiry, supersession).
     */
    String reason;

    public KeyRange keyRange() {
        return KeyRange.of(start, end);
    }

    public boolean isLiveAt(Instant now) {
        return (status == AssignmentStatus.ASSIGNED || status == AssignmentStatus.REPORTING)
            && (expiresAt == null || now.isBefore(expiresAt));
    }

    /**
     * Keys this assignment added to the ledger since it was granted.
     */
    public BigInteger contributedKeys() {
        if (searchedKeys == null || baselineKeys == null) {
            return BigInteger.ZERO;
        }
        return searchedKeys.subtract(baselineKeys).max(BigInteger.ZERO);
    }
}
