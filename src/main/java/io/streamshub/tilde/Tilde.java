package io.streamshub.tilde;

import io.streamshub.tilde.command.DirectivesCommand;
import io.streamshub.tilde.command.FormatCommand;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine;
import picocli.CommandLine.IVersionProvider;

@TopCommand
@CommandLine.Command(name = Tilde.NAME,
        mixinStandardHelpOptions = true,
        versionProvider = Tilde.Version.class,
        description = "Render text templates with ~ directives",
        subcommands = {
                FormatCommand.class,
                DirectivesCommand.class,
                CommandLine.HelpCommand.class,
        }
)
public class Tilde {
    public static final String NAME = "tilde";

    @Singleton
    public static class Version implements IVersionProvider {
        @ConfigProperty(name = "quarkus.application.version")
        String applicationVersion;

        @Override
        public String[] getVersion() throws Exception {
            return new String[] { applicationVersion };
        }
    }
}
