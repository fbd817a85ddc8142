package com.keyhive.core.keyspace;

import com.keyhive.core.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeyRangeTest {

    private static KeyRange range(long start, long end) {
        return KeyRange.of(BigInteger.valueOf(start), BigInteger.valueOf(end));
    }

    @Test
    void testInvalidBoundsRejected() {
        assertThrows(ValidationException.class, () -> range(10, 10));
        assertThrows(ValidationException.class, () -> range(10, 5));
        assertThrows(ValidationException.class, () -> range(-1, 5));
        assertThrows(ValidationException.class, () -> new KeyRange(null, BigInteger.ONE));
    }

    @Test
    @DisplayName("Split pieces are contiguous, disjoint and cover the parent exactly")
    void testSplitPartitionsExactly() {
        for (long width : new long[]{7, 10, 1000, 4097}) {
            for (int parts = 1; parts <= 7; parts++) {
                KeyRange parent = range(0x1000, 0x1000 + width);

                List<KeyRange> pieces = parent.split(parts);

                assertEquals(parts, pieces.size());
                assertEquals(parent.start(), pieces.get(0).start());
                assertEquals(parent.end(), pieces.get(parts - 1).end());
                BigInteger covered = BigInteger.ZERO;
                for (int i = 0; i < pieces.size(); i++) {
                    covered = covered.add(pieces.get(i).size());
                    if (i > 0) {
                        assertEquals(pieces.get(i - 1).end(), pieces.get(i).start(), "gap or overlap at " + i);
                    }
                }
                assertEquals(parent.size(), covered);
            }
        }
    }

    @Test
    void testLastPieceAbsorbsRemainder() {
        List<KeyRange> pieces = range(0, 10).split(3);

        assertEquals(range(0, 3), pieces.get(0));
        assertEquals(range(3, 6), pieces.get(1));
        assertEquals(range(6, 10), pieces.get(2));
    }

    @Test
    void testSplitAtHugeMagnitude() {
        BigInteger start = BigInteger.TWO.pow(70);
        KeyRange parent = KeyRange.of(start, start.shiftLeft(1));

        List<KeyRange> pieces = parent.split(3);

        assertEquals(start.shiftLeft(1), pieces.get(2).end());
        assertEquals(parent.size(), pieces.stream().map(KeyRange::size).reduce(BigInteger.ZERO, BigInteger::add));
    }

    @Test
    void testSplitCountOutOfBounds() {
        assertThrows(ValidationException.class, () -> range(0, 10).split(0));
        assertThrows(ValidationException.class, () -> range(0, 3).split(4));
    }

    @Test
    void testOverlaps() {
        KeyRange base = range(0x1000, 0x2000);

        assertTrue(base.overlaps(range(0x1FFF, 0x3000)));
        assertFalse(base.overlaps(range(0x2000, 0x3000)), "half-open bounds touch, not overlap");
        assertTrue(base.overlaps(range(0x0800, 0x1001)));
        assertTrue(base.overlaps(range(0x1400, 0x1800)));
    }
}
