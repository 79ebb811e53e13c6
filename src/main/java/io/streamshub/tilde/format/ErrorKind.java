package io.streamshub.tilde.format;

/**
 * Categories of format failures.
 */
public enum ErrorKind {
    /**
     * Marker at end of template, unknown directive code, or bad {@code ~F} parameters
     */
    MALFORMED_DIRECTIVE,

    /**
     * A consuming directive found no remaining argument
     */
    ARGUMENT_UNDERFLOW,

    /**
     * Arguments remained after the template was exhausted
     */
    ARGUMENT_OVERFLOW,

    /**
     * An argument does not have the shape its directive requires
     */
    TYPE_MISMATCH
}
