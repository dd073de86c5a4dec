package io.partialtesting.core.discovery;

import java.util.Set;

/**
 * Names defined in one test file.
 *
 * @param symbols every function, method and type name defined in the file
 * @param tests   the subset of {@code symbols} that the test runner collects as tests
 */
public record FileDefinitions(Set<String> symbols, Set<String> tests) {

    public FileDefinitions {
        symbols = Set.copyOf(symbols);
        tests = Set.copyOf(tests);
    }

    public boolean defines(String name) {
        return symbols.contains(name);
    }

    public boolean hasTests() {
        return !tests.isEmpty();
    }
}
