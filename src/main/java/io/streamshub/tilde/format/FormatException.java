package io.streamshub.tilde.format;

/**
 * Base class of all failures raised while interpreting a template. Output
 * written to a sink before the failure is not rolled back.
 */
public abstract class FormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected FormatException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected FormatException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
