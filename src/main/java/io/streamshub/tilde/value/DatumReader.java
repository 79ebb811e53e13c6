package io.streamshub.tilde.value;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads values from their machine-readable text, the inverse of
 * {@link SchemeRenderer#MACHINE} for acyclic data.
 *
 * Supported syntax:
 * - Numbers: 42, -7, 1/3, 2.5, 1e10, +inf.0, +nan.0, 1.0+2.0i, -3i
 * - Strings: "text" with \" \\ \n \t \r escapes
 * - Characters: #\a, #\space, #\newline, #\x41
 * - Booleans: #t, #f, #true, #false
 * - Lists: (a b c), (a . b); vectors: #(1 2 3)
 * - Quote: 'datum reads as the datum itself
 * - Anything else is a symbol
 */
public final class DatumReader {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern RATIONAL = Pattern.compile("([+-]?\\d+)/(\\d+)");
    private static final String REAL_TEXT = "[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:e[+-]?\\d+)?|[+-]inf\\.0|[+-]nan\\.0";
    private static final Pattern REAL = Pattern.compile(REAL_TEXT);
    private static final Pattern COMPLEX = Pattern.compile("(" + REAL_TEXT + ")?([+-](?:\\d+\\.?\\d*|\\.\\d+)?(?:e[+-]?\\d+)?|[+-]inf\\.0|[+-]nan\\.0)i");

    private static final Map<String, Character> CHARACTER_NAMES = Map.of(
            "space", ' ',
            "newline", '\n',
            "tab", '\t',
            "return", '\r',
            "nul", '\0',
            "null", '\0',
            "alarm", '\u0007',
            "backspace", '\b',
            "escape", '\u001b',
            "delete", '\u007f');

    private final String text;
    private int pos;

    private DatumReader(String text) {
        this.text = text;
    }

    /**
     * Read exactly one datum from the text.
     *
     * @throws IllegalArgumentException if the text is empty, malformed, or has trailing data
     */
    public static Object read(String text) {
        DatumReader reader = new DatumReader(text);
        reader.skipWhitespace();
        if (reader.atEnd()) {
            throw new IllegalArgumentException("No datum found in: '" + text + "'");
        }
        Object datum = reader.readDatum();
        reader.skipWhitespace();
        if (!reader.atEnd()) {
            throw new IllegalArgumentException("Unexpected text after datum at position " + reader.pos + ": " + text);
        }
        return datum;
    }

    /**
     * Read all whitespace-separated data from the text.
     */
    public static List<Object> readAll(String text) {
        DatumReader reader = new DatumReader(text);
        List<Object> data = new ArrayList<>();
        reader.skipWhitespace();
        while (!reader.atEnd()) {
            data.add(reader.readDatum());
            reader.skipWhitespace();
        }
        return data;
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private void skipWhitespace() {
        while (!atEnd()) {
            char c = text.charAt(pos);
            if (c == ';') {
                // Comment to end of line
                while (!atEnd() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else {
                return;
            }
        }
    }

    private Object readDatum() {
        char c = text.charAt(pos);

        switch (c) {
            case '(' -> {
                pos++;
                return readListTail();
            }
            case ')' -> throw new IllegalArgumentException("Unexpected ')' at position " + pos);
            case '"' -> {
                return readString();
            }
            case '\'' -> {
                pos++;
                skipWhitespace();
                if (atEnd()) {
                    throw new IllegalArgumentException("Quote without datum at end of input");
                }
                return readDatum();
            }
            case '#' -> {
                return readHash();
            }
            default -> {
                return parseAtom(readToken());
            }
        }
    }

    private Object readListTail() {
        List<Object> elements = new ArrayList<>();
        Object tail = EmptyList.INSTANCE;

        while (true) {
            skipWhitespace();
            if (atEnd()) {
                throw new IllegalArgumentException("Unclosed list at end of input");
            }
            char c = text.charAt(pos);
            if (c == ')') {
                pos++;
                break;
            }
            if (c == '.' && isDelimiter(pos + 1)) {
                if (elements.isEmpty()) {
                    throw new IllegalArgumentException("Dot without preceding element at position " + pos);
                }
                pos++;
                skipWhitespace();
                if (atEnd()) {
                    throw new IllegalArgumentException("Dot without tail datum at end of input");
                }
                tail = readDatum();
                skipWhitespace();
                if (atEnd() || text.charAt(pos) != ')') {
                    throw new IllegalArgumentException("Expected ')' after dotted tail at position " + pos);
                }
                pos++;
                break;
            }
            elements.add(readDatum());
        }

        return Values.dotted(tail, elements.toArray());
    }

    private Object readHash() {
        if (pos + 1 >= text.length()) {
            throw new IllegalArgumentException("Incomplete '#' syntax at end of input");
        }
        char next = text.charAt(pos + 1);

        if (next == '(') {
            pos += 2;
            List<Object> elements = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (atEnd()) {
                    throw new IllegalArgumentException("Unclosed vector at end of input");
                }
                if (text.charAt(pos) == ')') {
                    pos++;
                    return elements.toArray();
                }
                elements.add(readDatum());
            }
        }

        if (next == '\\') {
            pos += 2;
            if (atEnd()) {
                throw new IllegalArgumentException("Incomplete character literal at end of input");
            }
            // The first character is always taken, even when it is a delimiter
            int start = pos++;
            while (!isDelimiter(pos)) {
                pos++;
            }
            return parseCharacter(text.substring(start, pos));
        }

        String token = readToken();
        return switch (token) {
            case "#t", "#true" -> Boolean.TRUE;
            case "#f", "#false" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Unknown '#' syntax: " + token);
        };
    }

    private static Character parseCharacter(String name) {
        if (name.length() == 1) {
            return name.charAt(0);
        }
        Character named = CHARACTER_NAMES.get(name.toLowerCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        if (name.charAt(0) == 'x' || name.charAt(0) == 'U' || name.charAt(0) == 'u') {
            String digits = name.substring(1);
            int codePoint;
            try {
                codePoint = digits.startsWith("+") || digits.startsWith("-") ? -1 : Integer.parseInt(digits, 16);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid character literal: #\\" + name, e);
            }
            if (codePoint < 0 || codePoint > Character.MAX_VALUE) {
                throw new IllegalArgumentException("Character literal out of range: #\\" + name);
            }
            return (char) codePoint;
        }
        throw new IllegalArgumentException("Unknown character name: #\\" + name);
    }

    private String readString() {
        StringBuilder result = new StringBuilder();
        int start = pos++;

        while (!atEnd()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return result.toString();
            }
            if (c == '\\') {
                if (atEnd()) {
                    break;
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> result.append('\n');
                    case 't' -> result.append('\t');
                    case 'r' -> result.append('\r');
                    case 'a' -> result.append('\u0007');
                    case '0' -> result.append('\0');
                    default -> result.append(escaped);
                }
            } else {
                result.append(c);
            }
        }

        throw new IllegalArgumentException("Unterminated string starting at position " + start);
    }

    private String readToken() {
        int start = pos;
        while (!isDelimiter(pos)) {
            pos++;
        }
        return text.substring(start, pos);
    }

    private boolean isDelimiter(int index) {
        if (index >= text.length()) {
            return true;
        }
        char c = text.charAt(index);
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';' || c == '\'';
    }

    private static Object parseAtom(String token) {
        String lower = token.toLowerCase(Locale.ROOT);

        if (INTEGER.matcher(token).matches()) {
            return parseInteger(token);
        }

        Matcher rational = RATIONAL.matcher(token);
        if (rational.matches()) {
            try {
                return Rational.of(new BigInteger(rational.group(1)), new BigInteger(rational.group(2)));
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Invalid rational: " + token, e);
            }
        }

        if (REAL.matcher(lower).matches()) {
            return parseReal(lower);
        }

        Matcher complex = COMPLEX.matcher(lower);
        if (complex.matches()) {
            double real = complex.group(1) == null ? 0.0 : parseReal(complex.group(1));
            String imagText = complex.group(2);
            double imag = imagText.length() == 1 ? (imagText.equals("-") ? -1.0 : 1.0) : parseReal(imagText);
            return new Complex(real, imag);
        }

        return Symbol.of(token);
    }

    private static Object parseInteger(String token) {
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            return new BigInteger(token.startsWith("+") ? token.substring(1) : token);
        }
    }

    private static double parseReal(String text) {
        return switch (text) {
            case "+inf.0" -> Double.POSITIVE_INFINITY;
            case "-inf.0" -> Double.NEGATIVE_INFINITY;
            case "+nan.0", "-nan.0" -> Double.NaN;
            default -> Double.parseDouble(text);
        };
    }
}
