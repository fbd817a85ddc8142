package com.keyhive.core.keyspace;

import com.keyhive.core.error.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Exact arithmetic over key counts and percentage positions.
 * <p>
 * Nothing in here converts a key count to {@code double}: a 64-bit float
 * cannot hold interval widths around 2^70 exactly, so percentages are scaled
 * to integers and every division happens in {@link BigInteger} space.
 * </p>
 */
public final class KeyspaceMath {
    private KeyspaceMath() {
    }

    public static final BigDecimal ZERO_PERCENT = BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
    public static final BigDecimal FULL_PERCENT = BigDecimal.valueOf(100).setScale(2, RoundingMode.UNNECESSARY);

    private static final BigInteger TEN_THOUSAND = BigInteger.valueOf(10_000);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int HEX_WIDTH = 18;

    /**
     * {@code floor(searched * 100 / total)} with two decimals.
     *
     * @return percentage in {@code [0.00, 100.00]} for valid counters, {@code 0.00} for an empty total
     */
    public static BigDecimal percentOf(BigInteger searched, BigInteger total) {
        if (total.signum() <= 0) {
            return ZERO_PERCENT;
        }
        BigInteger basisPoints = searched.multiply(TEN_THOUSAND).divide(total);
        return new BigDecimal(basisPoints, 2);
    }

    /**
     * Absolute key at {@code percent} of the way through {@code [rangeMin, rangeMin + rangeSize)}:
     * {@code rangeMin + floor(percent / 100 * rangeSize)}.
     * <p>
     * The percentage is taken as an exact decimal {@code unscaled * 10^-scale};
     * the offset is {@code rangeSize * unscaled / (100 * 10^scale)}.
     * </p>
     */
    public static BigInteger positionToOffset(BigDecimal percent, BigInteger rangeMin, BigInteger rangeSize) {
        requirePercent(percent, "position");
        if (rangeSize.signum() < 0) {
            throw new ValidationException("Range size must not be negative: " + rangeSize);
        }
        BigDecimal normalized = percent.stripTrailingZeros();
        if (normalized.scale() < 0) {
            normalized = normalized.setScale(0, RoundingMode.UNNECESSARY);
        }
        BigInteger numerator = rangeSize.multiply(normalized.unscaledValue());
        BigInteger denominator = BigInteger.valueOf(100).multiply(BigInteger.TEN.pow(normalized.scale()));
        return rangeMin.add(numerator.divide(denominator));
    }

    public static BigInteger positionToOffset(double percent, BigInteger rangeMin, BigInteger rangeSize) {
        if (Double.isNaN(percent) || Double.isInfinite(percent)) {
            throw new ValidationException("Position percentage must be finite: " + percent);
        }
        return positionToOffset(BigDecimal.valueOf(percent), rangeMin, rangeSize);
    }

    public static void requirePercent(BigDecimal percent, String what) {
        if (percent == null) {
            throw new ValidationException("Missing " + what + " percentage");
        }
        if (percent.signum() < 0 || percent.compareTo(HUNDRED) > 0) {
            throw new ValidationException(what + " percentage must be within [0, 100]: " + percent.toPlainString());
        }
    }

    /**
     * Parses a hexadecimal key bound, with or without a {@code 0x} prefix.
     */
    public static BigInteger parseHex(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Missing hexadecimal key");
        }
        String digits = text.trim();
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        }
        try {
            BigInteger value = new BigInteger(digits, 16);
            if (value.signum() < 0) {
                throw new ValidationException("Key must be unsigned: " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException("Malformed hexadecimal key: " + text, e);
        }
    }

    /**
     * Parses a key count: decimal, or hexadecimal when prefixed with {@code 0x}.
     */
    public static BigInteger parseCount(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Missing key count");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            return parseHex(trimmed);
        }
        try {
            BigInteger value = new BigInteger(trimmed);
            if (value.signum() < 0) {
                throw new ValidationException("Key count must not be negative: " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException("Malformed key count: " + text, e);
        }
    }

    /**
     * Upper-case hexadecimal, zero-padded to the width used by search tools (18 digits).
     */
    public static String toHex(BigInteger key) {
        String hex = key.toString(16).toUpperCase();
        if (hex.length() >= HEX_WIDTH) {
            return hex;
        }
        return "0".repeat(HEX_WIDTH - hex.length()) + hex;
    }
}
