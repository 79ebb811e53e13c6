package io.streamshub.tilde.format;

import java.math.BigDecimal;
import java.math.RoundingMode;

import io.streamshub.tilde.value.Complex;
import io.streamshub.tilde.value.SchemeRenderer;
import io.streamshub.tilde.value.Values;

/**
 * Integer radix output and the fixed-format ({@code ~w,dF}) algorithm.
 */
final class NumberRenderer {

    private NumberRenderer() {
        // Static utility class
    }

    /**
     * Render an exact integer in the given radix, with a leading '-' for
     * negative values and no prefix or padding.
     *
     * @throws TypeMismatchException if the value is not an exact integer
     */
    static String radix(Object value, int radix, DirectiveType directive) {
        if (!Values.isExactInteger(value)) {
            throw new TypeMismatchException(
                    "Directive " + directive.display() + " requires an exact integer, got: " + describe(value));
        }
        return Values.toBigInteger(value).toString(radix);
    }

    /**
     * Render a string or number right-justified in a field.
     *
     * Strings are padded to the width and never truncated; the precision does
     * not apply to them. Numbers with a precision are made inexact and written
     * with exactly that many fractional digits, complex numbers part by part.
     * Numbers without a precision keep their natural representation.
     *
     * @throws TypeMismatchException if the value is neither a string nor a number
     */
    static String fixed(Object value, FixedFormat format) {
        if (value instanceof CharSequence text) {
            return padLeft(text.toString(), format.width());
        }
        if (!Values.isNumber(value)) {
            throw new TypeMismatchException(
                    "Directive " + DirectiveType.FIXED.display() + " requires a number or string, got: " + describe(value));
        }

        // A complex number without an imaginary part is written as a real
        Object number = value;
        if (value instanceof Complex complex && complex.isReal()) {
            number = complex.real();
        }

        Integer precision = format.precision();
        String text;

        if (precision == null) {
            text = SchemeRenderer.numberToString(number);
        } else if (number instanceof Complex complex) {
            String imag = fixedDigits(complex.imag(), precision);
            if (!imag.startsWith("-") && !imag.startsWith("+")) {
                imag = "+" + imag;
            }
            text = fixedDigits(complex.real(), precision) + imag + "i";
        } else {
            text = fixedDigits(Values.toInexact((Number) number), precision);
        }

        return padLeft(text, format.width());
    }

    /**
     * Write an inexact value with exactly {@code digits} fractional digits,
     * rounding half up. Values whose natural text is exponential keep their
     * exponent, and the digits apply to the mantissa.
     */
    static String fixedDigits(double value, int digits) {
        if (!Double.isFinite(value)) {
            return SchemeRenderer.inexactToString(value);
        }

        String natural = SchemeRenderer.inexactToString(value);
        int exponentIndex = natural.indexOf('e');

        if (exponentIndex < 0) {
            String text = withDecimalPoint(new BigDecimal(natural).setScale(digits, RoundingMode.HALF_UP), digits);
            // A negative value rounding to zero keeps its sign, as does -0.0
            return hasSignBit(value) && !text.startsWith("-") ? "-" + text : text;
        }

        BigDecimal mantissa = new BigDecimal(natural.substring(0, exponentIndex));
        int exponent = Integer.parseInt(natural.substring(exponentIndex + 1));
        BigDecimal rounded = mantissa.setScale(digits, RoundingMode.HALF_UP);

        if (rounded.abs().compareTo(BigDecimal.TEN) >= 0) {
            // 9.99e5 rounded to one digit is 1.0e6, not 10.0e5
            rounded = mantissa.movePointLeft(1).setScale(digits, RoundingMode.HALF_UP);
            exponent++;
        }

        return withDecimalPoint(rounded, digits) + "e" + exponent;
    }

    /**
     * Left-pad with spaces up to {@code width}; longer text is left as is.
     */
    static String padLeft(String text, Integer width) {
        if (width == null || text.length() >= width) {
            return text;
        }
        return " ".repeat(width - text.length()) + text;
    }

    private static String withDecimalPoint(BigDecimal value, int digits) {
        String text = value.toPlainString();
        // Zero fractional digits still keeps the point, as in "32."
        return digits == 0 ? text + "." : text;
    }

    private static boolean hasSignBit(double value) {
        return Double.doubleToRawLongBits(value) < 0L;
    }

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (Values.isCompound(value)) {
            return value.getClass().getSimpleName();
        }
        return SchemeRenderer.MACHINE.atomToString(value) + " (" + value.getClass().getSimpleName() + ")";
    }
}
