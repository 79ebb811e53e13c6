package io.streamshub.tilde.format;

public class ArgumentUnderflowException extends FormatException {

    private static final long serialVersionUID = 1L;

    public ArgumentUnderflowException(DirectiveType directive, int supplied) {
        super(ErrorKind.ARGUMENT_UNDERFLOW,
                "Directive " + directive.display() + " requires an argument, but only "
                        + supplied + " were supplied");
    }
}
