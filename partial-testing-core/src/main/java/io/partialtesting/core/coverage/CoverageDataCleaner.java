package io.partialtesting.core.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Removes superseded coverage data. Only the newest build of a branch is ever read, so every
 * older build directory under a {@code <branch>} directory can go.
 */
public final class CoverageDataCleaner {

    private static final Logger log = LoggerFactory.getLogger(CoverageDataCleaner.class);

    private final Path coverageDir;
    private final String branch;

    public CoverageDataCleaner(Path coverageDir, String branch) {
        if (branch == null || branch.isBlank()) {
            throw new IllegalArgumentException("branch must not be null or blank");
        }
        this.coverageDir = coverageDir;
        this.branch = branch;
    }

    /**
     * @param deleted build directories that were removed
     * @param failed  build directories that could not be (fully) removed
     */
    public record CleanupResult(List<Path> deleted, List<Path> failed) {}

    /**
     * Walks the coverage directory and, in every directory named after the branch, deletes all
     * build directories except the newest.
     *
     * @throws IndexUnavailableException if the coverage directory does not exist
     */
    public CleanupResult clean() {
        if (!Files.isDirectory(coverageDir)) {
            throw new IndexUnavailableException("Coverage directory not found: " + coverageDir);
        }

        List<Path> branchDirs = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(coverageDir)) {
            walk.filter(Files::isDirectory)
                .filter(d -> d.getFileName() != null && d.getFileName().toString().equals(branch))
                .forEach(branchDirs::add);
        } catch (IOException e) {
            throw new IndexUnavailableException("Cannot walk coverage directory " + coverageDir, e);
        }

        List<Path> deleted = new ArrayList<>();
        List<Path> failed = new ArrayList<>();
        for (Path branchDir : branchDirs) {
            List<Path> builds = CoverageDataLocator.listBuildDirectories(branchDir);
            if (builds.size() <= 1) {
                continue;
            }
            log.info("At {} the last build is: {} and there are {} builds.",
                    branchDir, builds.get(0).getFileName(), builds.size());
            for (Path older : builds.subList(1, builds.size())) {
                log.info("Deleting: {}", older);
                try {
                    deleteRecursively(older);
                    deleted.add(older);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", older, e.getMessage());
                    failed.add(older);
                }
            }
        }
        return new CleanupResult(List.copyOf(deleted), List.copyOf(failed));
    }

    private static void deleteRecursively(Path dir) throws IOException {
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
