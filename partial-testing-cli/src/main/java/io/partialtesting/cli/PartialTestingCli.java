package io.partialtesting.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.PropertiesDefaultProvider;

/**
 * Top-level CLI command for partial testing.
 * Routes to subcommands: select, cleanup.
 * <p>
 * Option values missing from the command line are read from {@code ~/.partialtesting.properties},
 * keyed by option name without dashes, e.g. {@code coverage-dir=/mnt/coverage}.
 */
@Command(
        name = "partialtesting",
        mixinStandardHelpOptions = true,
        version = "partialtesting 1.0.0",
        description = "Selects the tests affected by a change from recorded per-test coverage",
        defaultValueProvider = PropertiesDefaultProvider.class,
        subcommands = {
                SelectCommand.class,
                CleanupCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class PartialTestingCli implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine newCommandLine() {
        return new CommandLine(new PartialTestingCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }
}
