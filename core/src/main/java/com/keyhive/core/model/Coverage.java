package com.keyhive.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.keyhive.core.keyspace.KeyspaceMath;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact aggregate of searched keys over the tracked keyspace.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(value = "percent_complete", allowGetters = true)
public class Coverage {
    BigInteger totalKeyspace;

    BigInteger searchedKeyspace;

    public BigDecimal getPercentComplete() {
        return KeyspaceMath.percentOf(searchedKeyspace, totalKeyspace);
    }
}
