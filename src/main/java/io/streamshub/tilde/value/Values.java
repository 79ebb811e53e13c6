package io.streamshub.tilde.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Classification and construction helpers for the value model.
 */
public final class Values {

    private Values() {
        // Static utility class
    }

    /**
     * Builds a proper list of fresh pairs holding the given elements.
     */
    public static Object list(Object... elements) {
        Object result = EmptyList.INSTANCE;
        for (int i = elements.length - 1; i >= 0; i--) {
            result = new Pair(elements[i], result);
        }
        return result;
    }

    /**
     * Builds a list whose final cdr is {@code tail} instead of the empty list.
     */
    public static Object dotted(Object tail, Object... elements) {
        Object result = tail;
        for (int i = elements.length - 1; i >= 0; i--) {
            result = new Pair(elements[i], result);
        }
        return result;
    }

    public static boolean isExactInteger(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof BigInteger
                || value instanceof Short
                || value instanceof Byte;
    }

    public static boolean isExact(Object value) {
        return isExactInteger(value) || value instanceof Rational;
    }

    public static boolean isNumber(Object value) {
        return value instanceof Number || value instanceof Complex;
    }

    public static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger bigInteger) {
            return bigInteger;
        }
        if (isExactInteger(value)) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        throw new IllegalArgumentException("Not an exact integer: " + value);
    }

    /**
     * Coerces a real number to its inexact (double) form.
     */
    public static double toInexact(Number value) {
        if (value instanceof BigDecimal bigDecimal) {
            return bigDecimal.doubleValue();
        }
        return value.doubleValue();
    }

    /**
     * Aggregates that can be shared or form cycles: pairs, vectors and Java lists.
     */
    public static boolean isCompound(Object value) {
        return value instanceof Pair || value instanceof Object[] || value instanceof List;
    }

    /**
     * True for the empty list, a proper acyclic pair chain, or a Java list.
     */
    public static boolean isList(Object value) {
        if (value == EmptyList.INSTANCE || value instanceof List) {
            return true;
        }
        if (!(value instanceof Pair)) {
            return false;
        }
        Object slow = value;
        Object fast = value;
        while (true) {
            if (fast == EmptyList.INSTANCE) {
                return true;
            }
            if (!(fast instanceof Pair fastPair)) {
                return false;
            }
            fast = fastPair.cdr();
            if (fast == EmptyList.INSTANCE) {
                return true;
            }
            if (!(fast instanceof Pair fastNext)) {
                return false;
            }
            fast = fastNext.cdr();
            slow = ((Pair) slow).cdr();
            if (fast == slow) {
                return false;
            }
        }
    }

    /**
     * Views a sequence value (proper list, Java list or vector) as a Java list.
     *
     * @return the elements, or empty when the value is not a finite sequence
     */
    public static Optional<List<Object>> asSequence(Object value) {
        if (value instanceof Object[] array) {
            return Optional.of(Arrays.asList(array));
        }
        if (value instanceof List<?> list) {
            return Optional.of(Collections.unmodifiableList(list));
        }
        if (!isList(value)) {
            return Optional.empty();
        }
        List<Object> elements = new ArrayList<>();
        Object current = value;
        while (current instanceof Pair pair) {
            elements.add(pair.car());
            current = pair.cdr();
        }
        return Optional.of(elements);
    }
}
