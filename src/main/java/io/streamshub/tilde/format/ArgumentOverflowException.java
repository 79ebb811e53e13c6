package io.streamshub.tilde.format;

public class ArgumentOverflowException extends FormatException {

    private static final long serialVersionUID = 1L;

    public ArgumentOverflowException(int consumed, int supplied) {
        super(ErrorKind.ARGUMENT_OVERFLOW,
                "Template consumed " + consumed + " of " + supplied + " arguments; "
                        + (supplied - consumed) + " left over");
    }
}
