package io.streamshub.tilde.format;

import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import io.streamshub.tilde.value.PrettyPrinter;
import io.streamshub.tilde.value.SchemeRenderer;
import io.streamshub.tilde.value.ValueRenderer;

/**
 * Renders templates made of literal text and {@code ~} directives.
 *
 * <pre>
 * TildeFormat.format("~a has ~d item~a~%", "cart", 3, "s");   // "cart has 3 items\n"
 * TildeFormat.format("~8,2F|", 1.0 / 3);                      // "    0.33|"
 * TildeFormat.formatTo(Boolean.TRUE, "~a~%", "to stdout");
 * </pre>
 *
 * Each argument is consumed by exactly one directive, in order; too few or
 * too many arguments is an error. Instances are immutable and may be shared
 * between threads.
 *
 * @see DirectiveType
 */
public final class TildeFormat {

    private static final TildeFormat DEFAULT = builder().build();

    private final FormatInterpreter interpreter;
    private final Appendable defaultOutput;

    private TildeFormat(Builder builder) {
        this.interpreter = new FormatInterpreter(builder.humanRenderer, builder.machineRenderer, builder.lineWidth);
        this.defaultOutput = builder.defaultOutput;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Render a template with the default renderers.
     *
     * @return the rendered text
     * @throws FormatException if the template is malformed or does not match the arguments
     */
    public static String format(String template, Object... args) {
        return DEFAULT.render(template, args);
    }

    /**
     * Render a template to a destination with the default renderers.
     *
     * @see #renderTo(Object, String, Object...)
     */
    public static String formatTo(Object destination, String template, Object... args) {
        return DEFAULT.renderTo(destination, template, args);
    }

    /**
     * Render a template, returning the text.
     */
    public String render(String template, Object... args) {
        OutputSink sink = OutputSink.accumulating();
        interpreter.interpret(template, arguments(args), sink);
        return sink.text();
    }

    /**
     * Render a template to a destination.
     *
     * @param destination {@code null} or {@code Boolean.FALSE} to return the text;
     *                    {@code Boolean.TRUE} for the default output; an
     *                    {@link OutputSink}, {@link Appendable} or {@link OutputStream}
     *                    to write to it
     * @return the rendered text when the destination is {@code null} or false,
     *         {@code null} otherwise
     * @throws TypeMismatchException if the destination is of another type
     */
    public String renderTo(Object destination, String template, Object... args) {
        if (destination == null || Boolean.FALSE.equals(destination)) {
            return render(template, args);
        }

        OutputSink sink;

        if (Boolean.TRUE.equals(destination)) {
            sink = OutputSink.forwarding(defaultOutput != null ? defaultOutput : System.out);
        } else if (destination instanceof OutputSink outputSink) {
            sink = outputSink;
        } else if (destination instanceof Appendable appendable) {
            sink = OutputSink.forwarding(appendable);
        } else if (destination instanceof OutputStream stream) {
            sink = OutputSink.forwardingStream(stream);
        } else {
            throw new TypeMismatchException("Unsupported destination: " + NumberRenderer.describe(destination));
        }

        renderInto(sink, template, arguments(args));
        return null;
    }

    /**
     * Render a template into a sink. The sink's line state carries over from
     * earlier output written to it. The sink is flushed even when rendering fails.
     */
    public void renderInto(OutputSink sink, String template, List<Object> args) {
        Objects.requireNonNull(sink, "Sink cannot be null");
        try {
            interpreter.interpret(template, args, sink);
        } finally {
            sink.flush();
        }
    }

    private static List<Object> arguments(Object[] args) {
        return args == null ? List.of() : Arrays.asList(args);
    }

    public static class Builder {
        private ValueRenderer humanRenderer = SchemeRenderer.HUMAN;
        private ValueRenderer machineRenderer = SchemeRenderer.MACHINE;
        private int lineWidth = PrettyPrinter.DEFAULT_LINE_WIDTH;
        private Appendable defaultOutput;

        private Builder() {
        }

        /**
         * Renderer for {@code ~a}.
         */
        public Builder humanRenderer(ValueRenderer humanRenderer) {
            this.humanRenderer = Objects.requireNonNull(humanRenderer);
            return this;
        }

        /**
         * Renderer for {@code ~s}, and for atoms within {@code ~w} and {@code ~y}.
         */
        public Builder machineRenderer(ValueRenderer machineRenderer) {
            this.machineRenderer = Objects.requireNonNull(machineRenderer);
            return this;
        }

        /**
         * Line width available to {@code ~y}.
         */
        public Builder lineWidth(int lineWidth) {
            if (lineWidth < 1) {
                throw new IllegalArgumentException("Line width must be positive: " + lineWidth);
            }
            this.lineWidth = lineWidth;
            return this;
        }

        /**
         * Where a {@code Boolean.TRUE} destination writes; {@code System.out} by default.
         */
        public Builder defaultOutput(Appendable defaultOutput) {
            this.defaultOutput = Objects.requireNonNull(defaultOutput);
            return this;
        }

        public TildeFormat build() {
            return new TildeFormat(this);
        }
    }
}
