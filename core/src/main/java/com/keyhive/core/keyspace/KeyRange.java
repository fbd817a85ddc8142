package com.keyhive.core.keyspace;

import com.keyhive.core.error.ValidationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Half-open interval {@code [start, end)} over the unsigned key space.
 * <p>
 * All arithmetic stays in {@link BigInteger}; widths of 2^70 and beyond are
 * represented exactly.
 * </p>
 */
public record KeyRange(BigInteger start, BigInteger end) {

    public KeyRange {
        if (start == null || end == null) {
            throw new ValidationException("Range bounds must not be null");
        }
        if (start.signum() < 0) {
            throw new ValidationException("Range start must be unsigned: " + start);
        }
        if (start.compareTo(end) >= 0) {
            throw new ValidationException("Range start must be below end: "
                + KeyspaceMath.toHex(start) + " >= " + KeyspaceMath.toHex(end));
        }
    }

    public static KeyRange of(BigInteger start, BigInteger end) {
        return new KeyRange(start, end);
    }

    /**
     * Number of keys in the interval ({@code end - start}).
     */
    public BigInteger size() {
        return end.subtract(start);
    }

    public boolean overlaps(KeyRange other) {
        return start.compareTo(other.end) < 0 && other.start.compareTo(end) < 0;
    }

    /**
     * Partitions the interval into {@code parts} contiguous pieces of equal
     * width; the last piece absorbs the remainder of the integer division so
     * the union is exactly {@code [start, end)}.
     *
     * @param parts number of pieces, at least 1 and at most {@link #size()}
     * @return pieces in ascending order
     */
    public List<KeyRange> split(int parts) {
        if (parts < 1) {
            throw new ValidationException("Split count must be at least 1, got " + parts);
        }
        BigInteger count = BigInteger.valueOf(parts);
        if (count.compareTo(size()) > 0) {
            throw new ValidationException("Cannot split " + size() + " keys into " + parts + " non-empty pieces");
        }
        if (parts == 1) {
            return Collections.singletonList(this);
        }

        BigInteger width = size().divide(count);
        List<KeyRange> pieces = new ArrayList<>(parts);
        for (int i = 0; i < parts; i++) {
            BigInteger pieceStart = start.add(width.multiply(BigInteger.valueOf(i)));
            BigInteger pieceEnd = i == parts - 1 ? end : start.add(width.multiply(BigInteger.valueOf(i + 1L)));
            pieces.add(new KeyRange(pieceStart, pieceEnd));
        }
        return pieces;
    }

    @Override
    public String toString() {
        return "[" + KeyspaceMath.toHex(start) + ", " + KeyspaceMath.toHex(end) + ")";
    }
}
