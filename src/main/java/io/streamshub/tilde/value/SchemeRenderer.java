package io.streamshub.tilde.value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Default renderers producing Lisp-style external representations.
 *
 * <ul>
 * <li>{@link #HUMAN} displays strings and characters as their raw text</li>
 * <li>{@link #MACHINE} writes them in a form a reader can parse back</li>
 * </ul>
 *
 * Neither renderer detects shared structure; a cyclic list passed to them does
 * not terminate. Use the labelling writer for such values.
 */
public final class SchemeRenderer implements ValueRenderer {

    public static final SchemeRenderer HUMAN = new SchemeRenderer(false);
    public static final SchemeRenderer MACHINE = new SchemeRenderer(true);

    private static final Map<Character, String> CHARACTER_NAMES = Map.of(
            ' ', "space",
            '\n', "newline",
            '\t', "tab",
            '\r', "return",
            '\0', "nul",
            '\u0007', "alarm",
            '\b', "backspace",
            '\u001b', "escape",
            '\u007f', "delete");

    private static final double EXPONENT_ABOVE = 1e21;
    private static final double EXPONENT_BELOW = 1e-7;

    private final boolean machine;

    private SchemeRenderer(boolean machine) {
        this.machine = machine;
    }

    public boolean isMachine() {
        return machine;
    }

    @Override
    public String render(Object value) {
        StringBuilder out = new StringBuilder();
        append(out, value);
        return out.toString();
    }

    private void append(StringBuilder out, Object value) {
        if (value instanceof Pair pair) {
            appendList(out, pair);
        } else if (value instanceof List<?> list) {
            out.append('(');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    out.append(' ');
                }
                append(out, list.get(i));
            }
            out.append(')');
        } else if (value instanceof Object[] vector) {
            out.append("#(");
            for (int i = 0; i < vector.length; i++) {
                if (i > 0) {
                    out.append(' ');
                }
                append(out, vector[i]);
            }
            out.append(')');
        } else {
            out.append(atomToString(value));
        }
    }

    private void appendList(StringBuilder out, Pair pair) {
        out.append('(');
        append(out, pair.car());
        Object tail = pair.cdr();
        while (tail instanceof Pair next) {
            out.append(' ');
            append(out, next.car());
            tail = next.cdr();
        }
        if (tail != EmptyList.INSTANCE) {
            out.append(" . ");
            append(out, tail);
        }
        out.append(')');
    }

    /**
     * Renders a non-compound value.
     */
    public String atomToString(Object value) {
        if (value == null) {
            return "#<null>";
        }
        if (value instanceof CharSequence text) {
            return machine ? quote(text) : text.toString();
        }
        if (value instanceof Character c) {
            return machine ? characterName(c) : String.valueOf(c);
        }
        if (value instanceof Boolean b) {
            return b ? "#t" : "#f";
        }
        if (Values.isNumber(value)) {
            return numberToString(value);
        }
        return String.valueOf(value);
    }

    /**
     * The natural textual form of a number: exact values print exactly,
     * inexact ones with a decimal point and, for very large or very small
     * magnitudes, an exponent.
     */
    public static String numberToString(Object number) {
        if (number instanceof Complex complex) {
            String imag = inexactToString(complex.imag());
            if (!imag.startsWith("-") && !imag.startsWith("+")) {
                imag = "+" + imag;
            }
            return inexactToString(complex.real()) + imag + "i";
        }
        if (Values.isExact(number)) {
            return number.toString();
        }
        if (number instanceof Float f) {
            return inexactToString(Float.toString(f), f.doubleValue());
        }
        if (number instanceof BigDecimal bigDecimal) {
            return inexactToString(bigDecimal.doubleValue());
        }
        return inexactToString(((Number) number).doubleValue());
    }

    /**
     * Inexact text switches to exponential notation when the magnitude is at
     * least 10^21 or below 10^-7; in between the shortest round-tripping
     * digits are written in plain positional form.
     */
    public static String inexactToString(double value) {
        return inexactToString(Double.toString(value), value);
    }

    private static String inexactToString(String javaText, double value) {
        if (Double.isNaN(value)) {
            return "+nan.0";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+inf.0" : "-inf.0";
        }
        int exponent = javaText.indexOf('E');
        if (exponent < 0) {
            return javaText;
        }
        double magnitude = Math.abs(value);
        if (magnitude >= EXPONENT_ABOVE || magnitude < EXPONENT_BELOW) {
            return javaText.substring(0, exponent) + "e" + javaText.substring(exponent + 1);
        }
        String plain = new BigDecimal(javaText).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static String quote(CharSequence text) {
        StringBuilder out = new StringBuilder(text.length() + 2);
        out.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\t' -> out.append("\\t");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
        return out.append('"').toString();
    }

    private static String characterName(char c) {
        String name = CHARACTER_NAMES.get(c);
        if (name != null) {
            return "#\\" + name;
        }
        if (Character.isISOControl(c)) {
            return "#\\x" + Integer.toHexString(c);
        }
        return "#\\" + c;
    }
}
