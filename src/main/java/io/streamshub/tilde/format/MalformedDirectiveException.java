package io.streamshub.tilde.format;

public class MalformedDirectiveException extends FormatException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public MalformedDirectiveException(String message, int position) {
        super(ErrorKind.MALFORMED_DIRECTIVE, message + " at position " + position);
        this.position = position;
    }

    /**
     * Offset of the directive marker within the template.
     */
    public int position() {
        return position;
    }
}
