package io.streamshub.tilde.value;

import java.util.List;
import java.util.Optional;

/**
 * Writes a value in machine-readable form, breaking lists and vectors that do
 * not fit the line width onto one line per element, aligned one column past
 * the opening parenthesis. The result always ends with a newline.
 */
public final class PrettyPrinter {

    public static final int DEFAULT_LINE_WIDTH = 79;

    private final ValueRenderer atoms;
    private final int lineWidth;

    public PrettyPrinter(ValueRenderer atoms, int lineWidth) {
        if (lineWidth < 1) {
            throw new IllegalArgumentException("Line width must be positive: " + lineWidth);
        }
        this.atoms = atoms;
        this.lineWidth = lineWidth;
    }

    public PrettyPrinter() {
        this(SchemeRenderer.MACHINE, DEFAULT_LINE_WIDTH);
    }

    public int lineWidth() {
        return lineWidth;
    }

    public String print(Object value) {
        StringBuilder out = new StringBuilder();
        write(out, value, 0);
        return out.append('\n').toString();
    }

    private void write(StringBuilder out, Object value, int column) {
        String flat = atoms.render(value);

        if (column + flat.length() <= lineWidth) {
            out.append(flat);
            return;
        }

        // Improper lists and atoms cannot be broken up
        Optional<List<Object>> elements = Values.isCompound(value) ? Values.asSequence(value) : Optional.empty();
        if (elements.isEmpty() || elements.get().isEmpty()) {
            out.append(flat);
            return;
        }

        String open = value instanceof Object[] ? "#(" : "(";
        int indent = column + open.length();
        String padding = " ".repeat(indent);
        out.append(open);

        List<Object> items = elements.get();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append('\n').append(padding);
            }
            write(out, items.get(i), indent);
        }

        out.append(')');
    }
}
