package io.partialtesting.cli;

import io.partialtesting.core.coverage.CoverageDataCleaner;
import io.partialtesting.core.coverage.CoverageDataCleaner.CleanupResult;
import io.partialtesting.core.coverage.IndexUnavailableException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: partialtesting cleanup
 * <p>
 * Keeps only the newest coverage build of a branch in every project under the coverage directory.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true,
        description = "Delete all but the newest coverage build of a branch")
public class CleanupCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--coverage-dir", description = "Root directory of the recorded coverage data")
    private Path coverageDir;

    @Option(names = "--branch", defaultValue = "master", description = "Branch directory name (default: ${DEFAULT-VALUE})")
    private String branch;

    @Option(names = {"--verbose", "-v"}, description = "Verbose logging")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            Logging.enableDebug();
        }
        ConsoleOutput console = new ConsoleOutput(spec.commandLine());
        if (coverageDir == null) {
            console.error("No coverage directory: pass --coverage-dir or set coverage-dir in ~/.partialtesting.properties");
            return 1;
        }

        CleanupResult result;
        try {
            result = new CoverageDataCleaner(coverageDir, branch).clean();
        } catch (IndexUnavailableException | IllegalArgumentException e) {
            console.error("Cleanup failed: " + e.getMessage());
            return SelectCommand.EXIT_FAILURE;
        }

        console.success("Deleted " + result.deleted().size() + " old builds");
        if (!result.failed().isEmpty()) {
            result.failed().forEach(p -> console.error("Could not delete " + p));
            return 1;
        }
        return 0;
    }
}
