package io.streamshub.tilde.format;

import java.util.List;

import org.jboss.logging.Logger;

import io.streamshub.tilde.value.PrettyPrinter;
import io.streamshub.tilde.value.ValueRenderer;
import io.streamshub.tilde.value.Values;

/**
 * Drives the scan of a template, consuming arguments for each directive and
 * writing the rendered results to a sink. {@code ~?} re-enters the
 * interpreter with its own template and arguments on the same sink, so line
 * state carries across the nested call while each call keeps its own cursor.
 */
final class FormatInterpreter {

    private static final Logger LOGGER = Logger.getLogger(FormatInterpreter.class);

    private final ValueRenderer humanRenderer;
    private final ValueRenderer machineRenderer;
    private final SharedStructureWriter sharedStructureWriter;
    private final PrettyPrinter prettyPrinter;

    FormatInterpreter(ValueRenderer humanRenderer, ValueRenderer machineRenderer, int lineWidth) {
        this.humanRenderer = humanRenderer;
        this.machineRenderer = machineRenderer;
        this.sharedStructureWriter = new SharedStructureWriter(machineRenderer);
        this.prettyPrinter = new PrettyPrinter(machineRenderer, lineWidth);
    }

    /**
     * Interpret a template against its arguments.
     *
     * @throws FormatException at the first malformed directive or argument
     *         mismatch; output already written stays in the sink
     */
    void interpret(String template, List<Object> arguments, OutputSink sink) {
        LOGGER.debugf("Interpreting template of length %d with %d arguments", template.length(), arguments.size());

        ArgumentCursor cursor = new ArgumentCursor(arguments);
        DirectiveScanner scanner = DirectiveScanner.scan(template);

        while (scanner.hasNext()) {
            FormatToken token = scanner.next();

            if (token instanceof LiteralToken literal) {
                sink.write(literal.literal());
            } else if (token instanceof DirectiveToken directive) {
                execute(directive, cursor, sink);
            }
        }

        cursor.finish();
    }

    private void execute(DirectiveToken directive, ArgumentCursor cursor, OutputSink sink) {
        DirectiveType type = directive.type();
        LOGGER.tracef("Directive %s at position %d, argument %d of %d",
                type.display(), directive.position(), cursor.consumed(), cursor.size());

        switch (type) {
            case TILDE -> sink.write(DirectiveScanner.MARKER);
            case TAB -> sink.write('\t');
            case NEWLINE -> sink.write('\n');
            case FRESHLINE -> sink.freshLine();
            case SPACE -> sink.write(' ');
            case HELP -> sink.write(HelpText.text());

            case ANY -> sink.write(humanRenderer.render(cursor.next(type)));
            case SLASHIFY -> sink.write(machineRenderer.render(cursor.next(type)));
            case WRITE_SHARED -> sink.write(sharedStructureWriter.write(cursor.next(type)));

            case DECIMAL -> sink.write(NumberRenderer.radix(cursor.next(type), 10, type));
            case HEXADECIMAL -> sink.write(NumberRenderer.radix(cursor.next(type), 16, type));
            case OCTAL -> sink.write(NumberRenderer.radix(cursor.next(type), 8, type));
            case BINARY -> sink.write(NumberRenderer.radix(cursor.next(type), 2, type));
            case FIXED -> sink.write(NumberRenderer.fixed(cursor.next(type), directive.fixedFormat()));

            case CHARACTER -> {
                Object value = cursor.next(type);
                if (!(value instanceof Character c)) {
                    throw new TypeMismatchException(
                            "Directive " + type.display() + " requires a character, got: " + NumberRenderer.describe(value));
                }
                sink.write(c);
            }

            case PRETTY -> {
                Object value = cursor.next(type);
                if (!Values.isList(value)) {
                    throw new TypeMismatchException(
                            "Directive " + type.display() + " requires a proper list, got: " + NumberRenderer.describe(value));
                }
                sink.write(prettyPrinter.print(value));
            }

            case INDIRECTION -> {
                Object template = cursor.next(type);
                Object arguments = cursor.next(type);

                if (!(template instanceof CharSequence subTemplate)) {
                    throw new TypeMismatchException(
                            "Directive " + type.display() + " requires a template string, got: " + NumberRenderer.describe(template));
                }
                List<Object> subArguments = Values.asSequence(arguments)
                        .orElseThrow(() -> new TypeMismatchException(
                                "Directive " + type.display() + " requires a list of arguments, got: "
                                        + NumberRenderer.describe(arguments)));

                interpret(subTemplate.toString(), subArguments, sink);
            }
        }
    }
}
