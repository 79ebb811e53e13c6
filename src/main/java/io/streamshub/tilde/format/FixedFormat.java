package io.streamshub.tilde.format;

/**
 * Width and precision of a {@code ~w,dF} directive. Either may be absent.
 *
 * @param width     minimum field width, or {@code null} for no padding
 * @param precision digits after the decimal point, or {@code null} to keep the
 *                  number's natural representation
 */
public record FixedFormat(Integer width, Integer precision) {

    public static final FixedFormat NONE = new FixedFormat(null, null);

    public FixedFormat {
        if (width != null && width < 0) {
            throw new IllegalArgumentException("Width cannot be negative: " + width);
        }
        if (precision != null && precision < 0) {
            throw new IllegalArgumentException("Precision cannot be negative: " + precision);
        }
    }

    public static FixedFormat of(int width, int precision) {
        return new FixedFormat(width, precision);
    }

    public static FixedFormat width(int width) {
        return new FixedFormat(width, null);
    }
}
