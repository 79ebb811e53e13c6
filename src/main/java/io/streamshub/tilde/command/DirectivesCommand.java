package io.streamshub.tilde.command;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

import com.github.freva.asciitable.AsciiTable;
import com.github.freva.asciitable.HorizontalAlign;

import io.streamshub.tilde.format.DirectiveType;
import io.streamshub.tilde.format.TildeFormat;
import picocli.CommandLine;

@CommandLine.Command(
        name = "directives",
        description = "List the directives available in templates"
)
public class DirectivesCommand extends BaseCommand implements Callable<Integer> {

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Output format: table, text (default: table)",
            defaultValue = "table"
    )
    String outputFormat;

    @Override
    public Integer call() {
        switch (outputFormat.toLowerCase()) {
            case "table":
                printTable();
                break;
            case "text":
                // Same text the ~h directive produces
                out().print(TildeFormat.format("~h"));
                out().flush();
                break;
            default:
                err().println("Error: Unknown output format: " + outputFormat);
                err().println("Valid formats: table, text");
                return 1;
        }

        return 0;
    }

    private void printTable() {
        String table = AsciiTable.getTable(AsciiTable.NO_BORDERS, Arrays.asList(DirectiveType.values()), List.of(
                column("DIRECTIVE", HorizontalAlign.LEFT, DirectiveType::synopsis),
                column("ARGS", HorizontalAlign.RIGHT, (DirectiveType type) -> String.valueOf(type.arity())),
                column("MNEMONIC", HorizontalAlign.LEFT, DirectiveType::mnemonic),
                column("DESCRIPTION", HorizontalAlign.LEFT, DirectiveType::description)
        ));

        out().println(table);
    }
}
