package com.keyhive.participant.session;

import lombok.Value;

import java.math.BigInteger;

/**
 * Point-in-time counters of the local search, sampled by the auto-reporter.
 */
@Value(staticConstructor = "of")
public class ProgressSnapshot {
    BigInteger searchedKeys;
    double searchRate;
}
