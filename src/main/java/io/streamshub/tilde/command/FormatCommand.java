package io.streamshub.tilde.command;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import io.streamshub.tilde.config.ArgumentLoader;
import io.streamshub.tilde.config.ArgumentSyntax;
import io.streamshub.tilde.config.TildeSettings;
import io.streamshub.tilde.format.FormatException;
import io.streamshub.tilde.format.OutputSink;
import io.streamshub.tilde.format.TildeFormat;
import picocli.CommandLine;
import picocli.CommandLine.ITypeConverter;

@CommandLine.Command(
        name = "format",
        description = "Render a template, consuming one argument per directive"
)
public class FormatCommand extends BaseCommand implements Callable<Integer> {

    @CommandLine.Parameters(
            index = "0",
            paramLabel = "TEMPLATE",
            description = "Template text containing ~ directives (see 'tilde directives')"
    )
    String template;

    @CommandLine.Parameters(
            index = "1..*",
            arity = "0..*",
            paramLabel = "ARG",
            description = "Template arguments, e.g. 42, 1/3, 2.5, \"text\", #\\c, (a b c)"
    )
    List<String> arguments = new ArrayList<>();

    @CommandLine.Option(
            names = {"-f", "--args-file"},
            description = "Read arguments from a YAML or JSON sequence; positional arguments are appended"
    )
    Path argsFile;

    @CommandLine.Option(
            names = {"-s", "--syntax"},
            description = "Syntax of positional arguments: ${COMPLETION-CANDIDATES} (default: tilde.arguments.default-syntax)",
            converter = SyntaxConverter.class
    )
    ArgumentSyntax syntax;

    @CommandLine.Option(
            names = {"-w", "--line-width"},
            description = "Line width for ~y pretty printing (default: tilde.pretty-print.line-width)"
    )
    Integer lineWidth;

    @CommandLine.Option(
            names = {"-n", "--fresh-line"},
            description = "End the output with a newline unless it already ends with one"
    )
    boolean freshLine;

    @Inject
    TildeSettings settings;

    @Inject
    ArgumentLoader argumentLoader;

    @Inject
    Logger logger;

    private static final class SyntaxConverter implements ITypeConverter<ArgumentSyntax> {
        @Override
        public ArgumentSyntax convert(String value) {
            return ArgumentSyntax.parse(value);
        }
    }

    @Override
    public Integer call() {
        if (argsFile != null && !Files.isRegularFile(argsFile)) {
            err().println("Error: Argument file not found: " + argsFile);
            return 1;
        }
        if (lineWidth != null && lineWidth < 1) {
            err().println("Error: --line-width must be positive");
            return 1;
        }

        List<Object> values;

        try {
            values = readArguments();
        } catch (UncheckedIOException e) {
            err().println("Error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err().println("Error: Invalid argument: " + e.getMessage());
            return 1;
        }

        logger.debugf("Rendering template with %d arguments", values.size());

        TildeFormat formatter = settings.formatter(lineWidth);
        OutputSink sink = OutputSink.forwarding(out());

        try {
            formatter.renderInto(sink, template, values);
            if (freshLine) {
                sink.freshLine();
                sink.flush();
            }
            return 0;
        } catch (FormatException e) {
            // Output rendered before the failure has already been written
            out().flush();
            err().println("Error: " + e.getMessage());
            return 1;
        } catch (UncheckedIOException e) {
            err().println("Error: Failed to write output: " + e.getMessage());
            return 1;
        }
    }

    private List<Object> readArguments() {
        List<Object> values = new ArrayList<>();

        if (argsFile != null) {
            values.addAll(argumentLoader.load(argsFile));
        }

        ArgumentSyntax effectiveSyntax = syntax != null ? syntax : settings.defaultSyntax();

        for (String argument : arguments) {
            try {
                values.add(argumentLoader.parse(argument, effectiveSyntax));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("'" + argument + "': " + e.getMessage(), e);
            }
        }

        return values;
    }
}
