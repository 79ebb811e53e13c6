package io.streamshub.tilde.format;

public class TypeMismatchException extends FormatException {

    private static final long serialVersionUID = 1L;

    public TypeMismatchException(String message) {
        super(ErrorKind.TYPE_MISMATCH, message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(ErrorKind.TYPE_MISMATCH, message, cause);
    }
}
