package io.partialtesting.core.selection;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of a selection run: either the full suite, or a specific (possibly empty) set of test files.
 *
 * @param runAll      whether the full suite must run; {@code testFiles} is then empty
 * @param testFiles   test files to run, sorted and de-duplicated
 * @param escalations why the full suite is required, in processing order
 * @param warnings    recoverable problems met along the way (e.g. unresolved test contexts)
 */
public record SelectionDecision(
        boolean runAll,
        SortedSet<String> testFiles,
        List<String> escalations,
        List<String> warnings
) {

    public SelectionDecision {
        testFiles = Collections.unmodifiableSortedSet(new TreeSet<>(runAll ? Set.of() : testFiles));
        escalations = List.copyOf(escalations);
        warnings = List.copyOf(warnings);
    }

    public static SelectionDecision runAll(List<String> escalations, List<String> warnings) {
        return new SelectionDecision(true, Collections.emptySortedSet(), escalations, warnings);
    }

    public static SelectionDecision runSpecific(Set<String> testFiles, List<String> warnings) {
        return new SelectionDecision(false, new TreeSet<>(testFiles), List.of(), warnings);
    }

    /** {@code true} for a specific selection with nothing in it: no tests need to run. */
    public boolean nothingToRun() {
        return !runAll && testFiles.isEmpty();
    }
}
