package io.streamshub.tilde.format;

/**
 * A run of template text copied to the output unchanged.
 */
public record LiteralToken(String literal) implements FormatToken {
    public LiteralToken {
        if (literal == null) {
            throw new IllegalArgumentException("Literal cannot be null");
        }
    }
}
