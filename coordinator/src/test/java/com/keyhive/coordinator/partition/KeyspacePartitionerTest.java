package com.keyhive.coordinator.partition;

import com.keyhive.core.error.ValidationException;
import com.keyhive.core.keyspace.KeyRange;
import com.keyhive.core.model.Range;
import com.keyhive.core.model.RangeStatus;
import com.keyhive.core.model.RangeTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyspacePartitionerTest {

    private static final BigInteger MIN = BigInteger.TWO.pow(70);
    private static final BigInteger MAX = BigInteger.TWO.pow(71);

    private KeyspacePartitioner partitioner;
    private PartitionConfig config;

    @BeforeEach
    void setUp() {
        partitioner = new KeyspacePartitioner(Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
        config = PartitionConfig.builder()
            .keyspace(KeyRange.of(MIN, MAX))
            .build();
    }

    // ========== Position scaling ==========

    @Test
    @DisplayName("Position scaling stays exact at 2^70")
    void positionToOffsetIsExact() {
        BigInteger size = MAX.subtract(MIN);

        assertEquals(MIN, partitioner.positionToOffset(new BigDecimal("0"), MIN, size));
        assertEquals(MAX, partitioner.positionToOffset(new BigDecimal("100"), MIN, size));
        assertEquals(MIN.add(BigInteger.TWO.pow(69)), partitioner.positionToOffset(new BigDecimal("50"), MIN, size));
        // 2^70 * 12.5 / 100 = 2^67
        assertEquals(MIN.add(BigInteger.TWO.pow(67)), partitioner.positionToOffset(new BigDecimal("12.5"), MIN, size));
    }

    // ========== Manifest ==========

    @Test
    @DisplayName("Manifest covers the keyspace with core splits and two fallbacks")
    void manifestPartitionsKeyspace() {
        Estimate estimate = estimate("50", "40", "60");

        Manifest manifest = partitioner.generateManifest(estimate, config);

        BigInteger size = MAX.subtract(MIN);
        Range core = manifest.getCore();
        assertEquals(KeyspacePartitioner.CORE_ID, core.getId());
        assertEquals(RangeTier.HIGH, core.getTier());
        assertEquals(partitioner.positionToOffset(new BigDecimal("40"), MIN, size), core.getStart());
        assertEquals(partitioner.positionToOffset(new BigDecimal("60"), MIN, size), core.getEnd());

        List<Range> splits = manifest.getParallelSplits();
        assertEquals(3, splits.size());
        assertEquals(core.getStart(), splits.get(0).getStart());
        assertEquals(core.getEnd(), splits.get(2).getEnd());
        for (int i = 0; i < splits.size(); i++) {
            Range split = splits.get(i);
            assertEquals("high_priority_split_" + i, split.getId());
            assertEquals(KeyspacePartitioner.CORE_ID, split.getParentId());
            assertEquals(RangeStatus.PENDING, split.getStatus());
            if (i > 0) {
                assertEquals(splits.get(i - 1).getEnd(), split.getStart());
            }
        }

        List<Range> fallback = manifest.getFallback();
        assertEquals(2, fallback.size());
        assertEquals("fallback_0", fallback.get(0).getId());
        assertEquals(MIN, fallback.get(0).getStart());
        assertEquals(core.getStart(), fallback.get(0).getEnd());
        assertEquals(core.getEnd(), fallback.get(1).getStart());
        assertEquals(MAX, fallback.get(1).getEnd());
        assertEquals(40, fallback.get(0).getPriority());
        assertEquals(35, fallback.get(1).getPriority());
    }

    @Test
    @DisplayName("A band touching the keyspace edge produces a single fallback")
    void bandAtEdgeHasOneFallback() {
        Manifest manifest = partitioner.generateManifest(estimate("5", "0", "20"), config);

        assertEquals(MIN, manifest.getCore().getStart());
        assertEquals(1, manifest.getFallback().size());
        assertEquals(MAX, manifest.getFallback().get(0).getEnd());
    }

    @Test
    @DisplayName("Padding widens the band and is clamped to the keyspace")
    void paddingIsClamped() {
        PartitionConfig padded = config.toBuilder().bandPaddingPct(new BigDecimal("10")).build();

        Manifest manifest = partitioner.generateManifest(estimate("50", "5", "95"), padded);

        assertEquals(MIN, manifest.getCore().getStart());
        assertEquals(MAX, manifest.getCore().getEnd());
        assertTrue(manifest.getFallback().isEmpty());
    }

    @Test
    @DisplayName("Invalid estimates and configs are rejected")
    void invalidInputsRejected() {
        assertThrows(ValidationException.class, () -> partitioner.generateManifest(null, config));
        assertThrows(ValidationException.class, () -> partitioner.generateManifest(estimate("50", "60", "40"), config));
        assertThrows(ValidationException.class, () -> partitioner.generateManifest(estimate("50", "-1", "40"), config));
        assertThrows(ValidationException.class, () -> partitioner.generateManifest(estimate("50", "40", "101"), config));
        assertThrows(ValidationException.class, () -> partitioner.generateManifest(estimate("50", "40", "40"), config));
        assertThrows(ValidationException.class,
            () -> partitioner.generateManifest(estimate("50", "40", "60"), config.toBuilder().splitCount(0).build()));
    }

    @Test
    @DisplayName("Manifest survives a save and load through the store")
    void manifestStoreRoundTrip(@TempDir Path dir) {
        ManifestStore store = new ManifestStore(dir.resolve("manifest.json"));
        assertFalse(store.load().isPresent());

        Manifest manifest = partitioner.generateManifest(estimate("50", "40", "60"), config);
        store.save(manifest);

        assertEquals(manifest, store.load().orElseThrow());
    }

    private static Estimate estimate(String central, String lower, String upper) {
        return Estimate.builder()
            .centralEstimate(new BigDecimal(central))
            .ciLower(new BigDecimal(lower))
            .ciUpper(new BigDecimal(upper))
            .build();
    }
}
