package io.streamshub.tilde.format;

import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Destination for rendered text: either a growable buffer whose contents can
 * be retrieved with {@link #text()}, or a forwarding handle onto an external
 * stream. The sink remembers whether the last character written ended a line,
 * which is what {@code ~&} consults. A sink is shared by every nested
 * {@code ~?} call of one interpretation, and may be reused across calls to
 * continue the same output.
 */
public final class OutputSink {

    private final Appendable destination;
    private final StringBuilder buffer;
    private boolean atLineStart = true;

    private OutputSink(Appendable destination, StringBuilder buffer) {
        this.destination = destination;
        this.buffer = buffer;
    }

    /**
     * A sink collecting output into memory.
     */
    public static OutputSink accumulating() {
        StringBuilder buffer = new StringBuilder();
        return new OutputSink(buffer, buffer);
    }

    /**
     * A sink forwarding output to the given destination as it is produced.
     */
    public static OutputSink forwarding(Appendable destination) {
        if (destination == null) {
            throw new IllegalArgumentException("Destination cannot be null");
        }
        return new OutputSink(destination, null);
    }

    /**
     * A sink forwarding UTF-8 encoded output to the given stream. Output is
     * flushed to the stream by {@link #flush()}.
     */
    public static OutputSink forwardingStream(OutputStream stream) {
        if (stream == null) {
            throw new IllegalArgumentException("Stream cannot be null");
        }
        return new OutputSink(new OutputStreamWriter(stream, StandardCharsets.UTF_8), null);
    }

    public boolean isAccumulating() {
        return buffer != null;
    }

    /**
     * True when nothing has been written yet or the last character written
     * was a line terminator.
     */
    public boolean atLineStart() {
        return atLineStart;
    }

    public void write(char c) {
        try {
            destination.append(c);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output", e);
        }
        atLineStart = isLineTerminator(c);
    }

    public void write(CharSequence text) {
        if (text.length() == 0) {
            return;
        }
        try {
            destination.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output", e);
        }
        atLineStart = isLineTerminator(text.charAt(text.length() - 1));
    }

    /**
     * Write a newline unless the output is already at the start of a line.
     */
    public void freshLine() {
        if (!atLineStart) {
            write('\n');
        }
    }

    /**
     * The accumulated output.
     *
     * @throws IllegalStateException if this sink forwards to a stream
     */
    public String text() {
        if (buffer == null) {
            throw new IllegalStateException("Forwarding sink does not retain its output");
        }
        return buffer.toString();
    }

    /**
     * Flush the forwarding destination, when it supports flushing.
     */
    public void flush() {
        if (destination instanceof Flushable flushable) {
            try {
                flushable.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to flush output", e);
            }
        }
    }

    private static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r';
    }
}
