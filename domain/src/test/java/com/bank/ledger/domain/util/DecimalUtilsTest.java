package com.bank.ledger.domain.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DecimalUtilsTest {

    @Test
    void testToDecimalKeepsTextExact() {
        assertEquals(new BigDecimal("0.1"), DecimalUtils.toDecimal("0.1"));
        assertEquals(new BigDecimal("123.4500"), DecimalUtils.toDecimal(" 123.4500 "));
    }

    @Test
    void testToDecimalAvoidsBinaryRoundingForDoubles() {
        assertEquals(new BigDecimal("0.1"), DecimalUtils.toDecimal(0.1d));
        assertEquals(new BigDecimal("42"), DecimalUtils.toDecimal(42));
        assertEquals(new BigDecimal("42"), DecimalUtils.toDecimal(42L));
    }

    @Test
    void testToDecimalRejectsText() {
        assertThrows(NumberFormatException.class, () -> DecimalUtils.toDecimal("abc"));
        assertThrows(NumberFormatException.class, () -> DecimalUtils.toDecimal(null));
    }

    @Test
    void testToDecimalOrDefaultForBlank() {
        assertEquals(BigDecimal.ONE, DecimalUtils.toDecimalOrDefault("", BigDecimal.ONE));
        assertEquals(BigDecimal.ONE, DecimalUtils.toDecimalOrDefault(null, BigDecimal.ONE));
        assertEquals(new BigDecimal("2"), DecimalUtils.toDecimalOrDefault("2", BigDecimal.ONE));
    }

    @Test
    void testSafeDivideByZeroIsZero() {
        assertEquals(BigDecimal.ZERO, DecimalUtils.safeDivide(new BigDecimal("5"), BigDecimal.ZERO));
        assertEquals(BigDecimal.ZERO, DecimalUtils.safeDivide(new BigDecimal("5"), new BigDecimal("0.000")));
    }

    @Test
    void testSafeDivideRoundsNonTerminatingResult() {
        BigDecimal third = DecimalUtils.safeDivide(BigDecimal.ONE, new BigDecimal("3"));

        assertEquals(28, third.precision());
        assertEquals("0.3333333333333333333333333333", third.toPlainString());
    }

    @Test
    void testToPlainText() {
        assertEquals("0", DecimalUtils.toPlainText(new BigDecimal("0.0000")));
        assertEquals("9990", DecimalUtils.toPlainText(new BigDecimal("9.99E+3")));
        assertEquals("0.6", DecimalUtils.toPlainText(new BigDecimal("0.60")));
        assertEquals("0.0000001", DecimalUtils.toPlainText(new BigDecimal("1E-7")));
    }
}
