package io.streamshub.tilde.format;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only scanner splitting a template into literal spans and directives.
 *
 * Tokens are produced on demand, so text preceding a malformed directive is
 * returned before the scan fails. A directive is the marker {@code ~} followed
 * by a code character; only {@code F} accepts a {@code w[,d]} parameter prefix
 * made of digits and at most one comma.
 *
 * Examples:
 * - "Hello ~a!" - literal, ~a directive, literal
 * - "~8,2F" - fixed format, width 8, precision 2
 * - "~,3f" - fixed format, precision 3, no padding
 */
public final class DirectiveScanner implements Iterator<FormatToken> {

    public static final char MARKER = '~';

    private final String template;
    private int pos;

    private DirectiveScanner(String template) {
        this.template = template;
    }

    /**
     * Start a scan at the beginning of the template.
     *
     * @throws IllegalArgumentException if the template is null
     */
    public static DirectiveScanner scan(String template) {
        if (template == null) {
            throw new IllegalArgumentException("Template cannot be null");
        }
        return new DirectiveScanner(template);
    }

    /**
     * Scan a whole template eagerly.
     *
     * @throws MalformedDirectiveException if any directive is malformed
     */
    public static List<FormatToken> tokenize(String template) {
        List<FormatToken> tokens = new ArrayList<>();
        scan(template).forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return pos < template.length();
    }

    @Override
    public FormatToken next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Template exhausted");
        }

        if (template.charAt(pos) == MARKER) {
            return scanDirective();
        }

        int end = template.indexOf(MARKER, pos);
        if (end < 0) {
            end = template.length();
        }
        LiteralToken literal = new LiteralToken(template.substring(pos, end));
        pos = end;
        return literal;
    }

    private DirectiveToken scanDirective() {
        int start = pos;
        pos++; // skip marker

        if (pos >= template.length()) {
            throw new MalformedDirectiveException("Template ends with incomplete directive", start);
        }

        char code = template.charAt(pos);

        if (isParameterChar(code)) {
            int paramStart = pos;
            while (pos < template.length() && isParameterChar(template.charAt(pos))) {
                pos++;
            }
            String params = template.substring(paramStart, pos);

            if (pos >= template.length()) {
                throw new MalformedDirectiveException(
                        "Parameters '" + params + "' are not followed by a directive code", start);
            }
            if (DirectiveType.forCode(template.charAt(pos)) != DirectiveType.FIXED) {
                throw new MalformedDirectiveException(
                        "Parameters '" + params + "' must be followed by F, found '" + template.charAt(pos) + "'", start);
            }
            pos++;
            return new DirectiveToken(DirectiveType.FIXED, parseFixedFormat(params, start), start);
        }

        DirectiveType type = DirectiveType.forCode(code);
        if (type == null) {
            throw new MalformedDirectiveException("Unknown directive: " + MARKER + code, start);
        }
        pos++;
        return DirectiveToken.simple(type, start);
    }

    private static boolean isParameterChar(char c) {
        return (c >= '0' && c <= '9') || c == ',';
    }

    /**
     * Parse a {@code w[,d]} parameter prefix: "8", "8,2", ",2".
     */
    static FixedFormat parseFixedFormat(String params, int position) {
        int comma = params.indexOf(',');
        if (comma >= 0 && params.indexOf(',', comma + 1) >= 0) {
            throw new MalformedDirectiveException("Too many parameters: " + params, position);
        }

        String widthText = comma < 0 ? params : params.substring(0, comma);
        String precisionText = comma < 0 ? null : params.substring(comma + 1);

        if (precisionText != null && precisionText.isEmpty()) {
            throw new MalformedDirectiveException("Missing precision after ',' in: " + params, position);
        }

        Integer width = widthText.isEmpty() ? null : parseParameter(widthText, "width", position);
        Integer precision = precisionText == null ? null : parseParameter(precisionText, "precision", position);

        return new FixedFormat(width, precision);
    }

    private static int parseParameter(String text, String name, int position) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new MalformedDirectiveException("Invalid " + name + ": " + text, position);
        }
    }
}
