package io.partialtesting.cli;

import io.partialtesting.core.PartialTestingEngine;
import io.partialtesting.core.PartialTestingEngine.PartialTestingResult;
import io.partialtesting.core.config.PartialTestingConfig;
import io.partialtesting.core.coverage.IndexUnavailableException;
import io.partialtesting.core.git.DiffUnavailableException;
import io.partialtesting.core.selection.SelectionDecision;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: partialtesting select
 * <p>
 * Diffs the working tree against the base ref, loads the reference coverage and writes the tests
 * to run. Exit codes: {@code 0} on a decision (unless {@code --fail-on-run-all} and the full
 * suite is required, then {@code 3}), {@code 1} without a coverage directory, {@code 2} when no
 * trustworthy decision could be made.
 */
@Command(name = "select", mixinStandardHelpOptions = true,
        description = "Select the test files affected by the current change")
public class SelectCommand implements Callable<Integer> {

    static final int EXIT_FAILURE = 2;
    static final int EXIT_RUN_ALL = 3;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", defaultValue = ".", description = "Project (git work tree) directory")
    private Path projectDir;

    @Option(names = "--base-ref", defaultValue = "origin/master", description = "Reference to compare against")
    private String baseRef;

    @Option(names = "--merge-base", description = "Compare against the merge base of HEAD and the base ref")
    private boolean useMergeBase;

    @Option(names = "--include-uncommitted", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Compare with the working tree (default: true)")
    private boolean includeUncommitted;

    @Option(names = "--include-staged", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Without the working tree, compare with the index (default: true)")
    private boolean includeStaged;

    @Option(names = "--coverage-dir", description = "Root directory of the recorded coverage data")
    private Path coverageDir;

    @Option(names = "--project", description = "Project path under the coverage directory, e.g. numpy/master (default: project dir name)")
    private String projectName;

    @Option(names = "--build", description = "Build number to read (default: most recent)")
    private String buildNumber;

    @Option(names = "--line-coverage", description = "The coverage data holds lines instead of arcs")
    private boolean lineCoverage;

    @Option(names = "--special-filenames", split = ",", description = "Files whose change requires the full suite")
    private Set<String> specialFilenames;

    @Option(names = "--special-extensions", split = ",", description = "Extensions whose change requires the full suite")
    private Set<String> specialExtensions;

    @Option(names = "--test-dirs", split = ",", description = "Test directory prefixes (default: tests/)")
    private Set<String> testDirectoryPrefixes;

    @Option(names = "--source-extensions", split = ",", description = "Code extensions (default: .py)")
    private Set<String> sourceExtensions;

    @Option(names = "--no-test-extensions", split = ",", description = "Extensions that never need tests")
    private Set<String> noTestExtensions;

    @Option(names = "--run-all-on-unknown-extensions",
            description = "Require the full suite for files with an unrecognized extension")
    private boolean runAllOnUnknownExtensions;

    @Option(names = "--exclude", split = ",", description = "Glob patterns of changed paths to ignore")
    private List<String> excludePaths;

    @Option(names = "--run-all-if-no-matches", description = "Require the full suite when no test is selected")
    private boolean runAllIfNoMatches;

    @Option(names = {"--output-file", "-o"}, defaultValue = "test_files_to_run.txt",
            description = "Where to write the selection (default: ${DEFAULT-VALUE})")
    private Path outputFile;

    @Option(names = "--format", defaultValue = "TEXT", description = "Output format: ${COMPLETION-CANDIDATES}")
    private DecisionWriter.Format format;

    @Option(names = "--fail-on-run-all", description = "Exit with 3 when the full suite is required")
    private boolean failOnRunAll;

    @Option(names = {"--verbose", "-v"}, description = "Log every classification and resolution")
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

        PartialTestingResult result;
        try {
            PartialTestingConfig config = buildConfig();
            result = new PartialTestingEngine(config, projectDir).run();
        } catch (DiffUnavailableException | IndexUnavailableException | IllegalArgumentException e) {
            console.error("Partial testing failed: " + e.getMessage());
            console.error("Run the full test suite.");
            return EXIT_FAILURE;
        }

        SelectionDecision decision = result.decision();
        try {
            new DecisionWriter().write(decision, outputFile, format);
        } catch (IOException e) {
            console.error("Partial testing failed: cannot write " + outputFile + ": " + e.getMessage());
            console.error("Run the full test suite.");
            return EXIT_FAILURE;
        }

        report(console, result);
        if (decision.runAll()) {
            return failOnRunAll ? EXIT_RUN_ALL : 0;
        }
        return 0;
    }

    PartialTestingConfig buildConfig() {
        Path dir = projectDir.toAbsolutePath().normalize();
        PartialTestingConfig.Builder builder = PartialTestingConfig.builder()
                .baseRef(baseRef)
                .useMergeBase(useMergeBase)
                .includeUncommitted(includeUncommitted)
                .includeStaged(includeStaged)
                .coverageDir(coverageDir)
                .projectName(projectName != null ? projectName : String.valueOf(dir.getFileName()))
                .buildNumber(buildNumber)
                .lineCoverage(lineCoverage)
                .runAllOnUnknownExtensions(runAllOnUnknownExtensions)
                .runAllIfNoMatches(runAllIfNoMatches);
        if (specialFilenames != null) builder.specialFilenames(new LinkedHashSet<>(specialFilenames));
        if (specialExtensions != null) builder.specialExtensions(new LinkedHashSet<>(specialExtensions));
        if (testDirectoryPrefixes != null) builder.testDirectoryPrefixes(new LinkedHashSet<>(testDirectoryPrefixes));
        if (sourceExtensions != null) builder.sourceExtensions(new LinkedHashSet<>(sourceExtensions));
        if (noTestExtensions != null) builder.noTestExtensions(new LinkedHashSet<>(noTestExtensions));
        if (excludePaths != null) builder.excludePaths(excludePaths);
        return builder.build();
    }

    private void report(ConsoleOutput console, PartialTestingResult result) {
        SelectionDecision decision = result.decision();
        console.info(result.changes().size() + " changed files, coverage from " + result.coverageFile());
        for (String warning : decision.warnings()) {
            console.warn(warning);
        }
        if (decision.runAll()) {
            console.fullSuite("Full test suite required");
            decision.escalations().forEach(console::item);
        } else if (decision.testFiles().isEmpty()) {
            console.success("No tests need to run");
        } else {
            console.success(decision.testFiles().size() + " test files to run, written to " + outputFile);
            decision.testFiles().forEach(console::item);
        }
    }
}
