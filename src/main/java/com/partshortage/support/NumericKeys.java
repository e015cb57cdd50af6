package com.partshortage.support;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Canonical string form for numeric join keys that arrive as {@code 10}, {@code 10.0},
 * {@code "10 "} or a {@link BigDecimal} depending on the source system.
 */
public final class NumericKeys {

    /** Key of every value that does not parse as a number. Only matches itself. */
    public static final String SENTINEL = "-1";

    private static final int MAX_INTEGER_DIGITS = 19;
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private NumericKeys() {
    }

    /**
     * Parses the value as a number and renders it without decimals (truncating toward
     * zero); unparsable or missing values map to {@link #SENTINEL}.
     */
    public static String canonicalize(Object raw) {
        BigDecimal number = parse(raw);
        if (number == null) {
            return SENTINEL;
        }
        return number.toBigInteger().toString();
    }

    /**
     * Order ids compare numerically when they parse, otherwise by their trimmed text.
     * Unlike line numbers they never collapse onto the sentinel, so two unrelated
     * unparsable order ids stay apart.
     */
    public static String orderKey(Object raw) {
        BigDecimal number = parse(raw);
        if (number != null) {
            return number.toBigInteger().toString();
        }
        return raw == null ? "" : raw.toString().strip();
    }

    public static boolean isSentinel(String key) {
        return SENTINEL.equals(key);
    }

    private static BigDecimal parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof BigDecimal) {
            return bounded((BigDecimal) raw);
        }
        if (raw instanceof BigInteger) {
            return bounded(new BigDecimal((BigInteger) raw));
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : bounded(BigDecimal.valueOf(d));
        }
        if (raw instanceof Number) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        String text = raw.toString().strip();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return bounded(new BigDecimal(text));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Keys must fit a {@code long} once truncated; anything larger is treated as
     * unparsable. Magnitudes below one truncate to zero without expanding the exponent.
     */
    private static BigDecimal bounded(BigDecimal number) {
        long integerDigits = (long) number.precision() - number.scale();
        if (integerDigits <= 0) {
            return BigDecimal.ZERO;
        }
        if (integerDigits > MAX_INTEGER_DIGITS) {
            return null;
        }
        BigDecimal truncated = number.setScale(0, RoundingMode.DOWN);
        if (truncated.compareTo(LONG_MIN) < 0 || truncated.compareTo(LONG_MAX) > 0) {
            return null;
        }
        return truncated;
    }
}
