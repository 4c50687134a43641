package com.billing.benchmark.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Lenient amount parsing and cent rounding for billing exports.
 */
public final class Amounts {

    private static final Pattern STRIP = Pattern.compile("[\\s$€£¥]");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private Amounts() {}

    /**
     * Parses a currency cell. Blank, malformed or non-finite input yields 0.
     */
    public static double parse(String raw) {
        return parseStrict(raw).orElse(0.0);
    }

    /**
     * Parses a currency cell, returning empty for blank, malformed or non-finite input.
     */
    public static OptionalDouble parseStrict(String raw) {
        if (raw == null) return OptionalDouble.empty();
        String cleaned = STRIP.matcher(raw).replaceAll("");
        if (cleaned.isEmpty() || !PLAIN_NUMBER.matcher(cleaned).matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(cleaned);
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public static double round2(double value) {
        if (!Double.isFinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public static boolean approxEqual(double a, double b, double tolerance) {
        return Math.abs(a - b) < tolerance;
    }
}
