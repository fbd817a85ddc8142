package com.keyhive.coordinator.partition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keyhive.core.model.Range;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Initial division of the keyspace: one high-priority core band, its parallel
 * splits, and the fallback ranges covering the rest.
 */
@Value
@Builder
@Jacksonized
public class Manifest {

    @JsonProperty("high_priority")
    Range core;

    @JsonProperty("multi_gpu_splits")
    List<Range> parallelSplits;

    List<Range> fallback;

    /**
     * Every range in seeding order: core, splits, fallbacks.
     */
    public List<Range> allRanges() {
        List<Range> all = new ArrayList<>(1 + parallelSplits.size() + fallback.size());
        all.add(core);
        all.addAll(parallelSplits);
        all.addAll(fallback);
        return all;
    }
}
