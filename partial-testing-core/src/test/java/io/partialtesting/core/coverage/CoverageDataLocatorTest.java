package io.partialtesting.core.coverage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.junit.jupiter.api.Assertions.*;

class CoverageDataLocatorTest {

    @TempDir
    Path coverageDir;

    private Path build(String project, String build, long mtimeMillis, boolean withData) throws Exception {
        Path dir = Files.createDirectories(coverageDir.resolve(project).resolve(build));
        if (withData) {
            Files.writeString(dir.resolve(CoverageDataLocator.COVERAGE_FILE), "data");
        }
        Files.setLastModifiedTime(dir, FileTime.fromMillis(mtimeMillis));
        return dir;
    }

    @Test
    void picksNewestBuildDirectory() throws Exception {
        build("proj", "101", 1_000_000L, true);
        Path newest = build("proj", "102", 2_000_000L, true);

        Path resolved = CoverageDataLocator.resolve(coverageDir, "proj", "");

        assertEquals(newest.resolve(".coverage"), resolved);
    }

    @Test
    void skipsNewestBuildWithoutCoverageData() throws Exception {
        Path complete = build("proj", "101", 1_000_000L, true);
        build("proj", "102", 2_000_000L, false);

        assertEquals(complete.resolve(".coverage"), CoverageDataLocator.resolve(coverageDir, "proj", null));
    }

    @Test
    void explicitBuildNumberWins() throws Exception {
        Path older = build("proj", "101", 1_000_000L, true);
        build("proj", "102", 2_000_000L, true);

        assertEquals(older.resolve(".coverage"), CoverageDataLocator.resolve(coverageDir, "proj", "101"));
    }

    @Test
    void projectDirectoryMayHoldCoverageDirectly() throws Exception {
        Path projectDir = Files.createDirectories(coverageDir.resolve("flat"));
        Files.writeString(projectDir.resolve(".coverage"), "data");

        assertEquals(projectDir.resolve(".coverage"), CoverageDataLocator.resolve(coverageDir, "flat", ""));
    }

    @Test
    void missingProjectIsIndexUnavailable() {
        IndexUnavailableException ex = assertThrows(IndexUnavailableException.class,
                () -> CoverageDataLocator.resolve(coverageDir, "unknown", ""));
        assertTrue(ex.getMessage().contains("unknown"));
    }

    @Test
    void missingBuildIsIndexUnavailable() throws Exception {
        build("proj", "101", 1_000_000L, true);

        assertThrows(IndexUnavailableException.class, () -> CoverageDataLocator.resolve(coverageDir, "proj", "999"));
        assertThrows(IndexUnavailableException.class, () -> CoverageDataLocator.resolve(coverageDir, "proj", "../.."));
    }

    @Test
    void missingConfigurationIsIndexUnavailable() {
        assertThrows(IndexUnavailableException.class, () -> CoverageDataLocator.resolve(null, "proj", ""));
        assertThrows(IndexUnavailableException.class, () -> CoverageDataLocator.resolve(coverageDir, " ", ""));
    }
}
