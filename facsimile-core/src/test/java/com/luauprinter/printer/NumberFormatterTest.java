package com.luauprinter.printer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumberFormatterTest {

    @Test
    void testSpecialValues() {
        assertEquals("1e500", NumberFormatter.format(Double.POSITIVE_INFINITY));
        assertEquals("-1e500", NumberFormatter.format(Double.NEGATIVE_INFINITY));
        assertEquals("0/0", NumberFormatter.format(Double.NaN));
    }

    @Test
    void testIntegers() {
        assertEquals("3", NumberFormatter.format(3));
        assertEquals("-42", NumberFormatter.format(-42));
        assertEquals("0", NumberFormatter.format(0));
    }

    @Test
    void testFractions() {
        assertEquals("3.5", NumberFormatter.format(3.5));
        assertEquals("0.10000000000000001", NumberFormatter.format(0.1));
    }

    @Test
    void testNegativeZeroKeepsSign() {
        assertEquals("-0", NumberFormatter.format(-0.0));
    }

    @Test
    void testLargeAndSmallUseExponent() {
        assertEquals("1e+20", NumberFormatter.format(1e20));
        assertEquals("1.0000000000000001e-05", NumberFormatter.format(1e-5));
    }

    @Test
    void testFormattedValuesReadBack() {
        double[] values = {3.25, 1.0 / 3, 123456789.125, 2.5e-300, 9007199254740993.0};
        for (double value : values) {
            assertEquals(value, Double.parseDouble(NumberFormatter.format(value)), "for " + value);
        }
    }
}
