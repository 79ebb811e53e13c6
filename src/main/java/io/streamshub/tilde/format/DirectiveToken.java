package io.streamshub.tilde.format;

/**
 * A directive in a template.
 *
 * @param type        the directive
 * @param fixedFormat width/precision parameters; {@link FixedFormat#NONE} unless
 *                    the directive is {@link DirectiveType#FIXED}
 * @param position    offset of the directive marker in the template
 */
public record DirectiveToken(DirectiveType type, FixedFormat fixedFormat, int position) implements FormatToken {
    public DirectiveToken {
        if (type == null) {
            throw new IllegalArgumentException("Directive type cannot be null");
        }
        if (fixedFormat == null) {
            fixedFormat = FixedFormat.NONE;
        }
        if (!fixedFormat.equals(FixedFormat.NONE) && type != DirectiveType.FIXED) {
            throw new IllegalArgumentException("Only " + DirectiveType.FIXED.display() + " accepts parameters");
        }
    }

    public static DirectiveToken simple(DirectiveType type, int position) {
        return new DirectiveToken(type, FixedFormat.NONE, position);
    }
}
