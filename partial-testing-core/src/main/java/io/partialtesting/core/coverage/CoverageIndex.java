package io.partialtesting.core.coverage;

import io.partialtesting.core.config.ProjectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable snapshot of a reference build's coverage: for every executed file, the test contexts
 * that executed it. Loaded once per run and never mutated afterwards.
 *
 * <p>Stored paths are usually absolute paths from the machine that recorded them, whereas changed
 * paths are relative to the repository root. A changed path therefore matches a stored path that
 * is equal to it or ends with {@code "/" + path}.
 */
public final class CoverageIndex {

    private static final Logger log = LoggerFactory.getLogger(CoverageIndex.class);

    private final Map<String, Set<String>> testsTouchingFile;
    private final Map<String, List<String>> storedPathsByFileName;

    private CoverageIndex(Map<String, Set<String>> testsTouchingFile) {
        Map<String, Set<String>> copy = new TreeMap<>();
        Map<String, List<String>> byFileName = new HashMap<>();
        for (var entry : testsTouchingFile.entrySet()) {
            String path = ProjectConfig.normalisePath(entry.getKey());
            Set<String> contexts = new TreeSet<>(entry.getValue());
            contexts.remove("");
            copy.merge(path, contexts, (a, b) -> {
                Set<String> merged = new TreeSet<>(a);
                merged.addAll(b);
                return merged;
            });
        }
        for (var entry : copy.entrySet()) {
            entry.setValue(Collections.unmodifiableSet(entry.getValue()));
            byFileName.computeIfAbsent(ProjectConfig.fileNameOf(entry.getKey()), k -> new ArrayList<>())
                    .add(entry.getKey());
        }
        this.testsTouchingFile = Collections.unmodifiableMap(copy);
        this.storedPathsByFileName = byFileName;
    }

    /**
     * Builds an index from an in-memory mapping of file path to test contexts.
     */
    public static CoverageIndex of(Map<String, Set<String>> testsTouchingFile) {
        return new CoverageIndex(testsTouchingFile);
    }

    /**
     * Builds an index by reading every file/context pair from the store. The store is left open.
     */
    public static CoverageIndex load(CoverageStore store) {
        CoverageIndex index = new CoverageIndex(store.readAll());
        log.info("Loaded coverage index: {} files, {} distinct test contexts",
                index.fileCount(), index.contexts().size());
        return index;
    }

    /**
     * Opens the coverage.py data file, loads it and releases it again.
     *
     * @throws IndexUnavailableException if the store is missing or unreadable
     */
    public static CoverageIndex load(Path storePath, boolean lineCoverage) {
        try (SqliteCoverageStore store = SqliteCoverageStore.open(storePath, lineCoverage)) {
            return load(store);
        }
    }

    /**
     * Returns every test context that executed the given file, matching stored paths by equality
     * or by a {@code /}-bounded suffix. Empty when the file has no recorded coverage.
     */
    public Set<String> testsTouchingFile(String path) {
        String normalized = ProjectConfig.normalisePath(path);
        Set<String> exact = testsTouchingFile.get(normalized);
        if (exact != null) {
            return exact;
        }

        List<String> candidates = storedPathsByFileName.getOrDefault(ProjectConfig.fileNameOf(normalized), List.of());
        Set<String> contexts = new TreeSet<>();
        for (String stored : candidates) {
            if (stored.endsWith("/" + normalized)) {
                contexts.addAll(testsTouchingFile.get(stored));
            }
        }
        return Collections.unmodifiableSet(contexts);
    }

    /** All distinct test contexts in the index, sorted. */
    public Set<String> contexts() {
        Set<String> all = new TreeSet<>();
        testsTouchingFile.values().forEach(all::addAll);
        return all;
    }

    /** Stored file paths, sorted. */
    public Set<String> files() {
        return testsTouchingFile.keySet();
    }

    public int fileCount() {
        return testsTouchingFile.size();
    }
}
