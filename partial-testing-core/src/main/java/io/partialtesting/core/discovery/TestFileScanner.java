package io.partialtesting.core.discovery;

import io.partialtesting.core.config.ProjectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Walks the configured test directories and collects the test files the Test Locator searches.
 */
public final class TestFileScanner {

    private static final Logger log = LoggerFactory.getLogger(TestFileScanner.class);

    /** Tool and cache directories that are never descended into, even inside a test root. */
    private static final Set<String> SKIP_DIRS = Set.of(
            ".git", ".gradle", ".idea", "node_modules",
            "__pycache__", ".tox", ".venv", ".pytest_cache", ".mypy_cache"
    );

    private TestFileScanner() {
        // utility class
    }

    /**
     * Collects every file under a test directory prefix whose extension is a code extension.
     *
     * @param projectDir repository root; prefixes are resolved against it
     * @param config     supplies the test directory prefixes and code extensions
     * @return sorted paths relative to {@code projectDir}, with forward slashes
     */
    public static SortedSet<String> collectTestFiles(Path projectDir, ProjectConfig config) {
        SortedSet<String> files = new TreeSet<>();
        for (String prefix : config.testDirectoryPrefixes()) {
            Path testRoot = projectDir.resolve(prefix).normalize();
            if (!testRoot.startsWith(projectDir.normalize())) {
                log.warn("Ignoring test directory prefix outside the project: {}", prefix);
                continue;
            }
            if (!Files.isDirectory(testRoot)) {
                log.debug("Test directory does not exist: {}", testRoot);
                continue;
            }
            collectCodeFiles(projectDir, testRoot, config.sourceExtensions(), files);
        }
        log.debug("Found {} test files under {}", files.size(), config.testDirectoryPrefixes());
        return files;
    }

    private static void collectCodeFiles(Path projectDir, Path root, Set<String> extensions, Set<String> result) {
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    String dirName = dir.getFileName() != null ? dir.getFileName().toString() : "";
                    if (!dir.equals(root) && SKIP_DIRS.contains(dirName)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String relative = toRelative(projectDir, file);
                    if (extensions.contains(ProjectConfig.extensionOf(relative))) {
                        result.add(relative);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Error collecting test files from {}: {}", root, e.getMessage());
        }
    }

    /**
     * Converts an absolute file path to a {@code /}-separated path relative to the project directory.
     */
    public static String toRelative(Path projectDir, Path file) {
        return projectDir.normalize().relativize(file.normalize()).toString()
                .replace(java.io.File.separatorChar, '/');
    }
}
