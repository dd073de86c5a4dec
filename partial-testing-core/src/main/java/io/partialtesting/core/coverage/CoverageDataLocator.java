package io.partialtesting.core.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds the coverage data file of a project inside the shared coverage directory.
 *
 * <p>Layout written by reference builds:
 * <pre>
 * &lt;coverageDir&gt;/&lt;projectName&gt;/&lt;buildNumber&gt;/.coverage
 * </pre>
 * The project name may span several directories, e.g. {@code numpy/master} for the per-branch layout
 * that {@link CoverageDataCleaner} maintains. Without an explicit build number the newest build
 * directory holding a {@code .coverage} file wins. A project directory without build directories
 * may hold {@code .coverage} itself.
 */
public final class CoverageDataLocator {

    private static final Logger log = LoggerFactory.getLogger(CoverageDataLocator.class);

    public static final String COVERAGE_FILE = ".coverage";

    /** Newest first by modification time, then by name descending so that equal times stay stable. */
    static final Comparator<Path> NEWEST_FIRST = Comparator
            .comparing(CoverageDataLocator::lastModified).reversed()
            .thenComparing(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());

    private CoverageDataLocator() {
        // utility class
    }

    /**
     * @param coverageDir root of the shared coverage data
     * @param projectName project identifier, the directory name under {@code coverageDir}
     * @param buildNumber explicit build directory, or blank for the newest
     * @return path to an existing {@code .coverage} file
     * @throws IndexUnavailableException if any level of the layout is missing
     */
    public static Path resolve(Path coverageDir, String projectName, String buildNumber) {
        if (coverageDir == null) {
            throw new IndexUnavailableException("No coverage directory configured");
        }
        if (projectName == null || projectName.isBlank()) {
            throw new IndexUnavailableException("No project name configured");
        }
        Path projectDir = coverageDir.resolve(projectName).normalize();
        if (!projectDir.startsWith(coverageDir.normalize()) || !Files.isDirectory(projectDir)) {
            throw new IndexUnavailableException(
                    "Could not find coverage data for project '" + projectName + "' under " + coverageDir);
        }

        Path coverageFile;
        if (buildNumber != null && !buildNumber.isBlank()) {
            Path buildDir = projectDir.resolve(buildNumber).normalize();
            if (!buildDir.startsWith(projectDir)) {
                throw new IndexUnavailableException("Build number '" + buildNumber + "' escapes " + projectDir);
            }
            coverageFile = buildDir.resolve(COVERAGE_FILE);
        } else {
            coverageFile = newestCoverageFile(projectDir);
        }

        if (!Files.isRegularFile(coverageFile)) {
            throw new IndexUnavailableException("Coverage data file not found: " + coverageFile);
        }
        log.info("Partial Testing: using coverage file '{}'", coverageFile);
        return coverageFile;
    }

    private static Path newestCoverageFile(Path projectDir) {
        for (Path buildDir : listBuildDirectories(projectDir)) {
            Path candidate = buildDir.resolve(COVERAGE_FILE);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            log.warn("Skipping build directory without coverage data: {}", buildDir);
        }
        return projectDir.resolve(COVERAGE_FILE);
    }

    /**
     * Lists the immediate sub-directories of {@code dir}, newest first.
     */
    static List<Path> listBuildDirectories(Path dir) {
        List<Path> builds = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            children.filter(Files::isDirectory).forEach(builds::add);
        } catch (IOException e) {
            throw new IndexUnavailableException("Cannot list build directories in " + dir, e);
        }
        builds.sort(NEWEST_FIRST);
        return builds;
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}: {}", path, e.getMessage());
            return FileTime.fromMillis(0);
        }
    }
}
