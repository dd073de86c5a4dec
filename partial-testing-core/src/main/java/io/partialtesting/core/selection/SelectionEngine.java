package io.partialtesting.core.selection;

import io.partialtesting.core.config.ProjectConfig;
import io.partialtesting.core.coverage.CoverageIndex;
import io.partialtesting.core.discovery.FileDefinitions;
import io.partialtesting.core.discovery.TestLocator;
import io.partialtesting.core.discovery.UnresolvedContextException;
import io.partialtesting.core.git.ChangeKind;
import io.partialtesting.core.git.ChangeRecord;
import io.partialtesting.core.mapping.FileCategory;
import io.partialtesting.core.mapping.FileClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a change set into a {@link SelectionDecision}.
 *
 * <p>Policy per category and change kind:
 * <pre>
 *                 ADDED                 MODIFIED                              DELETED
 * SOURCE_CODE     full suite            tests that executed the file          tests that executed the file
 * TEST_CODE       the file, if it       the file, if it defines tests,        nothing
 *                 defines tests         plus tests that executed the file
 * SPECIAL_CONFIG  full suite            full suite                            full suite
 * NON_CODE        nothing               nothing                               nothing
 * </pre>
 * A file without recorded coverage contributes nothing; absence of coverage is not evidence of relevance.
 *
 * <p>Every record is processed even after an escalation so that all reasons are reported, but no
 * further coverage lookups are made once the full suite is required.
 */
public final class SelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    private final FileClassifier classifier;
    private final CoverageIndex index;
    private final TestLocator locator;

    public SelectionEngine(ProjectConfig config, CoverageIndex index, TestLocator locator) {
        this.classifier = new FileClassifier(config);
        this.index = index;
        this.locator = locator;
    }

    public SelectionDecision select(List<ChangeRecord> changes) {
        Set<String> testFiles = new TreeSet<>();
        List<String> escalations = new ArrayList<>();
        Set<String> warnings = new LinkedHashSet<>();

        for (ChangeRecord change : changes) {
            FileCategory category = classifier.classify(change);

            if (escalates(category, change.kind())) {
                String reason = change.path() + ": " + category + " " + change.kind();
                log.info("Partial Testing: full test required by {}", reason);
                escalations.add(reason);
                continue;
            }
            if (!escalations.isEmpty()) {
                continue;
            }

            switch (category) {
                case SOURCE_CODE -> testFiles.addAll(testsThatExecuted(change.path(), warnings));
                case TEST_CODE -> {
                    if (change.kind() == ChangeKind.DELETED) {
                        log.debug("Deleted test file {} needs no run", change.path());
                        break;
                    }
                    testFiles.addAll(ownTests(change.path(), warnings));
                    if (change.kind() == ChangeKind.MODIFIED) {
                        testFiles.addAll(testsThatExecuted(change.path(), warnings));
                    }
                }
                default -> log.debug("No tests needed for {}", change.path());
            }
        }

        if (!escalations.isEmpty()) {
            return SelectionDecision.runAll(escalations, new ArrayList<>(warnings));
        }
        return SelectionDecision.runSpecific(testFiles, new ArrayList<>(warnings));
    }

    /** Category/kind combinations that force the full suite. */
    static boolean escalates(FileCategory category, ChangeKind kind) {
        return category == FileCategory.SPECIAL_CONFIG
                || (category == FileCategory.SOURCE_CODE && kind == ChangeKind.ADDED);
    }

    /**
     * Resolves every test context recorded against the file to its defining test file.
     * Contexts that no longer resolve are reported and skipped.
     */
    private Set<String> testsThatExecuted(String path, Set<String> warnings) {
        Set<String> contexts = index.testsTouchingFile(path);
        Set<String> files = new TreeSet<>();
        for (String context : contexts) {
            try {
                files.add(locator.locate(context));
            } catch (UnresolvedContextException e) {
                log.warn("Partial Testing: {} (recorded for {}), skipping it", e.getMessage(), path);
                warnings.add(e.getMessage());
            }
        }
        log.debug("{} was executed by {} test contexts in {} files", path, contexts.size(), files.size());
        return files;
    }

    /**
     * The file itself when it defines at least one test. An unreadable file is selected anyway.
     */
    private Set<String> ownTests(String path, Set<String> warnings) {
        try {
            FileDefinitions definitions = locator.definitionsOf(path);
            if (definitions.hasTests()) {
                log.debug("{} defines tests {}", path, definitions.tests());
                return Set.of(path);
            }
            log.debug("{} defines no tests", path);
            return Set.of();
        } catch (IOException e) {
            String message = "Cannot read test file " + path + " (" + e.getMessage() + "), selecting it anyway";
            log.warn("Partial Testing: {}", message);
            warnings.add(message);
            return Set.of(path);
        }
    }
}
