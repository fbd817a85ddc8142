package com.keyhive.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.keyspace.KeyspaceMath;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Ledger entry tracking exact search progress over one range.
 * <p>
 * {@code percent_complete} is written to JSON for readers but never read back:
 * it is always recomputed from {@code searched_keys} and {@code total_keys}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonIgnoreProperties(value = "percent_complete", allowGetters = true)
public class ProgressRecord {
    String rangeId;

    BigInteger start;

    BigInteger end;

    /**
     * Always {@code end - start}.
     */
    BigInteger totalKeys;

    /**
     * Keys searched so far; {@code 0 <= searched_keys <= total_keys}.
     */
    BigInteger searchedKeys;

    /**
     * Last reported throughput in keys per second.
     */
    double searchRate;

    RangeStatus status;

    RangeTier tier;

    int priority;

    String parentId;

    String splitReason;

    String description;

    /**
     * Insertion order; ties in scheduling fall back to it.
     */
    long sequence;

    Instant createdAt;

    Instant startedAt;

    Instant lastUpdate;

    Instant estimatedCompletion;

    RecordOutcome outcome;

    /**
     * Opaque proof supplied with a positive completion. Never logged.
     */
    String evidence;

    public BigDecimal getPercentComplete() {
        return KeyspaceMath.percentOf(searchedKeys, totalKeys);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public KeyRange keyRange() {
        return KeyRange.of(start, end);
    }

    public Range toRange() {
        return Range.builder()
            .id(rangeId)
            .start(start)
            .end(end)
            .priority(priority)
            .status(status)
            .tier(tier)
            .parentId(parentId)
            .splitReason(splitReason)
            .description(description)
            .createdAt(createdAt)
            .build();
    }

    /**
     * Fresh, unsearched record for {@code range}.
     */
    public static ProgressRecord of(Range range, long sequence) {
        return ProgressRecord.builder()
            .rangeId(range.getId())
            .start(range.getStart())
            .end(range.getEnd())
            .totalKeys(range.totalKeys())
            .searchedKeys(BigInteger.ZERO)
            .status(range.getStatus() == null ? RangeStatus.PENDING : range.getStatus())
            .tier(range.getTier())
            .priority(range.getPriority())
            .parentId(range.getParentId())
            .splitReason(range.getSplitReason())
            .description(range.getDescription())
            .sequence(sequence)
            .createdAt(range.getCreatedAt())
            .build();
    }
}
