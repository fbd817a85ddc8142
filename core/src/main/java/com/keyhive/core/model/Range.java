package com.keyhive.core.model;

import com.keyhive.core.keyspace.KeyRange;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A contiguous sub-interval {@code [start, end)} of the keyspace with its own
 * priority and status.
 * <p>
 * Created by the partitioner (initial manifest), the scheduler (split) or the
 * coordinator (custom bounds). Once persisted, it is mutated only through the
 * progress ledger.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class Range {
    String id;

    BigInteger start;

    /**
     * Exclusive upper bound.
     */
    BigInteger end;

    /**
     * Scheduling priority in {@code [0, 100]}.
     */
    int priority;

    RangeStatus status;

    RangeTier tier;

    /**
     * Id of the range this one was split from, if any.
     */
    String parentId;

    String splitReason;

    String description;

    Instant createdAt;

    public KeyRange keyRange() {
        return KeyRange.of(start, end);
    }

    public BigInteger totalKeys() {
        return end.subtract(start);
    }
}
