package com.luauprinter.printer;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Canonical spelling of number constants that have no recorded source text.
 */
public final class NumberFormatter {

    private static final MathContext SEVENTEEN_DIGITS = new MathContext(17);

    private NumberFormatter() {
    }

    public static String format(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "1e500" : "-1e500";
        }
        if (Double.isNaN(value)) {
            return "0/0";
        }
        if (isIntegerish(value)) {
            return Integer.toString((int) value);
        }
        return formatSignificant(value);
    }

    static boolean isIntegerish(double value) {
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return false;
        }
        return (double) (int) value == value && !(value == 0.0 && 1 / value < 0);
    }

    /**
     * Same output as C's {@code %.17g}: 17 significant digits, trailing zeros
     * removed, scientific notation for exponents below -4 or from 17 up.
     */
    static String formatSignificant(double value) {
        if (value == 0.0) {
            return 1 / value < 0 ? "-0" : "0";
        }
        BigDecimal rounded = new BigDecimal(value).round(SEVENTEEN_DIGITS);
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= 17) {
            BigDecimal mantissa = rounded.movePointLeft(exponent).stripTrailingZeros();
            String digits = mantissa.toPlainString();
            String sign = exponent < 0 ? "-" : "+";
            int magnitude = Math.abs(exponent);
            return digits + "e" + sign + (magnitude < 10 ? "0" : "") + magnitude;
        }
        BigDecimal stripped = rounded.stripTrailingZeros();
        return stripped.scale() <= 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
    }
}
