package com.tallybook.ledger.util;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Parses numbers out of spreadsheet cells such as {@code "¥1,250.00"} or {@code " 12 元"}.
 */
public class LenientNumberParser {

    private static final Pattern NOT_NUMERIC = Pattern.compile("[^\\d.\\-]");
    private static final Pattern SHAPE = Pattern.compile("-?\\d*\\.?\\d*");

    private LenientNumberParser() {}

    /** Returns null when the cell is empty or does not reduce to a single number. */
    public static BigDecimal parse(String raw) {
        if (raw == null) return null;
        String s = NOT_NUMERIC.matcher(raw.trim()).replaceAll("");
        if (s.isEmpty() || !SHAPE.matcher(s).matches()) return null;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Whole part of the cell; the default when missing, zero or outside the int range. */
    public static Integer parseInteger(String raw, int defaultValue) {
        BigDecimal v = parse(raw);
        if (v == null || v.signum() == 0) return defaultValue;
        try {
            return v.toBigInteger().intValueExact();
        } catch (ArithmeticException overflow) {
            return defaultValue;
        }
    }
}
