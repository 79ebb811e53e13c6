package io.streamshub.tilde.format;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import io.streamshub.tilde.value.Complex;
import io.streamshub.tilde.value.Rational;
import io.streamshub.tilde.value.Symbol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NumberRendererTest {

    private static FixedFormat precision(int digits) {
        return new FixedFormat(null, digits);
    }

    // ========== Radix ==========

    @Test
    void testRadix() {
        assertEquals("ff", NumberRenderer.radix(255, 16, DirectiveType.HEXADECIMAL));
        assertEquals("-101", NumberRenderer.radix(-5L, 2, DirectiveType.BINARY));
        assertEquals("17", NumberRenderer.radix((short) 15, 8, DirectiveType.OCTAL));
        assertEquals("123456789012345678901234567890",
                NumberRenderer.radix(new BigInteger("123456789012345678901234567890"), 10, DirectiveType.DECIMAL));
    }

    @Test
    void testRadixRejectsInexactAndRational() {
        assertThrows(TypeMismatchException.class, () -> NumberRenderer.radix(1.0, 10, DirectiveType.DECIMAL));
        assertThrows(TypeMismatchException.class,
                () -> NumberRenderer.radix(Rational.of(1, 2), 10, DirectiveType.DECIMAL));
        assertThrows(TypeMismatchException.class, () -> NumberRenderer.radix(null, 10, DirectiveType.DECIMAL));
    }

    // ========== Fixed Format: Strings ==========

    @Test
    void testStringsArePaddedNotTruncated() {
        assertEquals("     foo", NumberRenderer.fixed("foo", FixedFormat.of(8, 3)));
        assertEquals("toolong", NumberRenderer.fixed("toolong", FixedFormat.width(3)));
        assertEquals("bare", NumberRenderer.fixed("bare", FixedFormat.NONE));
    }

    @Test
    void testNonNumbersAreRejected() {
        assertThrows(TypeMismatchException.class, () -> NumberRenderer.fixed(Symbol.of("x"), FixedFormat.NONE));
        assertThrows(TypeMismatchException.class, () -> NumberRenderer.fixed('c', FixedFormat.width(3)));
    }

    // ========== Fixed Format: Without Precision ==========

    @Test
    void testNaturalRepresentation() {
        assertEquals("    32", NumberRenderer.fixed(32, FixedFormat.width(6)));
        assertEquals("1/3", NumberRenderer.fixed(Rational.of(1, 3), FixedFormat.NONE));
        assertEquals("  1/3", NumberRenderer.fixed(Rational.of(1, 3), FixedFormat.width(5)));
        assertEquals("0.5", NumberRenderer.fixed(0.5, FixedFormat.NONE));
    }

    // ========== Fixed Format: With Precision ==========

    @Test
    void testPrecisionMakesInexact() {
        assertEquals("    0.33", NumberRenderer.fixed(Rational.of(1, 3), FixedFormat.of(8, 2)));
        assertEquals("   32.00", NumberRenderer.fixed(32, FixedFormat.of(8, 2)));
        assertEquals("4321.00", NumberRenderer.fixed(4321, FixedFormat.of(1, 2)));
        assertEquals("2.500", NumberRenderer.fixed(2.5, precision(3)));
        assertEquals("1.50", NumberRenderer.fixed(1.5f, precision(2)));
    }

    @Test
    void testRoundsHalfUp() {
        assertEquals("0.13", NumberRenderer.fixed(0.125, precision(2)));
        assertEquals("2.35", NumberRenderer.fixed(new BigDecimal("2.345"), precision(2)));
        assertEquals("-2.", NumberRenderer.fixed(-1.5, precision(0)));
    }

    @Test
    void testZeroDigitsKeepsPoint() {
        assertEquals("32.", NumberRenderer.fixed(32, precision(0)));
    }

    @Test
    void testNegativeZero() {
        assertEquals("-0.00", NumberRenderer.fixed(-0.0, precision(2)));
        assertEquals("0.00", NumberRenderer.fixed(0.0, precision(2)));
    }

    @Test
    void testNegativeValueRoundingToZeroKeepsSign() {
        assertEquals("-0.00", NumberRenderer.fixed(-0.001, precision(2)));
        assertEquals("-0.", NumberRenderer.fixed(-0.4, precision(0)));
        assertEquals("0.00", NumberRenderer.fixed(0.001, precision(2)));
    }

    @Test
    void testRationalBeyondDoubleRange() {
        BigInteger numerator = BigInteger.valueOf(3).multiply(BigInteger.TEN.pow(307));
        BigInteger denominator = BigInteger.valueOf(7).multiply(BigInteger.TEN.pow(308)).add(BigInteger.ONE);
        Number ratio = Rational.of(numerator, denominator);

        assertEquals("    0.04", NumberRenderer.fixed(ratio, FixedFormat.of(8, 2)));
        assertEquals("  0.43", NumberRenderer.fixed(Rational.of(numerator, denominator.divide(BigInteger.TEN)), FixedFormat.of(6, 2)));
    }

    @Test
    void testExponentialValuesKeepExponent() {
        assertEquals("1.00e21", NumberRenderer.fixed(1e21, precision(2)));
        assertEquals("1.00e-8", NumberRenderer.fixed(1e-8, precision(2)));
        assertEquals("1.0e23", NumberRenderer.fixed(9.999e22, precision(1)));
    }

    @Test
    void testLargePlainValues() {
        assertEquals("12345678.9", NumberRenderer.fixed(12345678.9, precision(1)));
        assertEquals("10000000.00", NumberRenderer.fixed(1e7, precision(2)));
    }

    @Test
    void testNonFiniteValues() {
        assertEquals("  +nan.0", NumberRenderer.fixed(Double.NaN, FixedFormat.of(8, 2)));
        assertEquals("+inf.0", NumberRenderer.fixed(Double.POSITIVE_INFINITY, precision(2)));
        assertEquals("-inf.0", NumberRenderer.fixed(Double.NEGATIVE_INFINITY, precision(2)));
    }

    @Test
    void testSameInputSameOutput() {
        String first = NumberRenderer.fixed(1.0e25, FixedFormat.of(12, 3));
        assertEquals(first, NumberRenderer.fixed(1.0e25, FixedFormat.of(12, 3)));
        assertEquals("    1.000e25", first);
    }

    // ========== Fixed Format: Complex ==========

    @Test
    void testComplexParts() {
        assertEquals("-1.3+2.5i", NumberRenderer.fixed(new Complex(-1.25, 2.5), precision(1)));
        assertEquals("1.50-0.25i", NumberRenderer.fixed(new Complex(1.5, -0.25), precision(2)));
        assertEquals("0.0+inf.0i", NumberRenderer.fixed(new Complex(0, Double.POSITIVE_INFINITY), precision(1)));
    }

    @Test
    void testRealValuedComplexIsReal() {
        assertEquals("1.00", NumberRenderer.fixed(new Complex(1.0, 0.0), precision(2)));
        assertEquals("1.0", NumberRenderer.fixed(new Complex(1.0, 0.0), FixedFormat.NONE));
    }

    @Test
    void testComplexWithoutPrecision() {
        assertEquals("1.0-2.0i", NumberRenderer.fixed(new Complex(1, -2), FixedFormat.NONE));
    }

    // ========== Padding ==========

    @Test
    void testPadLeft() {
        assertEquals("  ab", NumberRenderer.padLeft("ab", 4));
        assertEquals("ab", NumberRenderer.padLeft("ab", 2));
        assertEquals("ab", NumberRenderer.padLeft("ab", null));
        assertEquals("ab", NumberRenderer.padLeft("ab", 0));
    }
}
