package io.partialtesting.core;

import io.partialtesting.core.config.PartialTestingConfig;
import io.partialtesting.core.coverage.CoverageDataLocator;
import io.partialtesting.core.coverage.CoverageIndex;
import io.partialtesting.core.discovery.TestLocator;
import io.partialtesting.core.git.ChangeRecord;
import io.partialtesting.core.git.GitChangeDetector;
import io.partialtesting.core.selection.SelectionDecision;
import io.partialtesting.core.selection.SelectionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main orchestrator: detects changes, loads the reference coverage, selects the tests to run.
 *
 * <p>Usage:
 * <pre>{@code
 * PartialTestingConfig config = PartialTestingConfig.builder()
 *         .coverageDir(Path.of("/mnt/coverage"))
 *         .projectName("numpy")
 *         .build();
 * PartialTestingEngine engine = new PartialTestingEngine(config, repoDir);
 * PartialTestingResult result = engine.run();
 * // result.decision().runAll() or result.decision().testFiles()
 * }</pre>
 *
 * <p>{@link io.partialtesting.core.git.DiffUnavailableException} and
 * {@link io.partialtesting.core.coverage.IndexUnavailableException} propagate: without a change set
 * or coverage data no trustworthy decision exists and the caller should run the full suite.
 */
public final class PartialTestingEngine {

    private static final Logger log = LoggerFactory.getLogger(PartialTestingEngine.class);

    private final PartialTestingConfig config;
    private final Path projectDir;

    public PartialTestingEngine(PartialTestingConfig config, Path projectDir) {
        this.config = config;
        this.projectDir = projectDir.toAbsolutePath().normalize();
    }

    /**
     * Result of a partial testing run.
     */
    public record PartialTestingResult(
            List<ChangeRecord> changes,
            Path coverageFile,
            SelectionDecision decision
    ) {}

    /**
     * Runs the full pipeline: detect changes, load the coverage index, select tests.
     */
    public PartialTestingResult run() {
        log.info("=== Partial Testing Analysis ===");
        log.info("Project dir: {}", projectDir);
        log.info("Base ref: {}{}", config.baseRef(), config.useMergeBase() ? " (merge base)" : "");
        log.info("Coverage: {}/{}", config.coverageDir(), config.projectName());

        // Step 1: Detect changed files
        List<ChangeRecord> changes = new GitChangeDetector(projectDir, config).detectChanges();

        // Step 2: Load the reference coverage
        Path coverageFile = CoverageDataLocator.resolve(
                config.coverageDir(), config.projectName(), config.buildNumber());
        CoverageIndex index = CoverageIndex.load(coverageFile, config.lineCoverage());

        // Step 3: Select
        SelectionDecision decision = select(changes, index);
        return new PartialTestingResult(changes, coverageFile, decision);
    }

    /**
     * Selects tests for an already known change set against an already loaded index.
     */
    public SelectionDecision select(List<ChangeRecord> changes, CoverageIndex index) {
        TestLocator locator = TestLocator.create(projectDir, config.projectConfig());
        SelectionDecision decision = new SelectionEngine(config.projectConfig(), index, locator).select(changes);

        if (decision.nothingToRun() && config.runAllIfNoMatches() && !changes.isEmpty()) {
            log.warn("No affected tests found but runAllIfNoMatches=true. Running full suite.");
            List<String> escalations = new ArrayList<>();
            escalations.add("no affected tests found (runAllIfNoMatches=true)");
            decision = SelectionDecision.runAll(escalations, decision.warnings());
        }

        if (decision.runAll()) {
            log.info("=== Result: full test suite required ({} reasons) ===", decision.escalations().size());
        } else if (decision.testFiles().isEmpty()) {
            log.info("=== Result: no tests need to run ===");
        } else {
            log.info("=== Result: {} test files ===", decision.testFiles().size());
            decision.testFiles().forEach(t -> log.info("  -> {}", t));
        }
        if (!decision.warnings().isEmpty()) {
            log.warn("{} warnings during selection", decision.warnings().size());
        }
        return decision;
    }
}
