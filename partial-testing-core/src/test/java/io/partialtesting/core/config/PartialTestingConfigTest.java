package io.partialtesting.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PartialTestingConfigTest {

    @Test
    void defaultsAreApplied() {
        PartialTestingConfig config = PartialTestingConfig.builder().build();

        assertEquals("origin/master", config.baseRef());
        assertFalse(config.useMergeBase());
        assertTrue(config.includeUncommitted());
        assertTrue(config.includeStaged());
        assertNull(config.coverageDir());
        assertNull(config.projectName());
        assertEquals("", config.buildNumber());
        assertFalse(config.lineCoverage());
        assertTrue(config.specialFilenames().contains("setup.py"));
        assertTrue(config.specialFilenames().contains("conftest.py"));
        assertTrue(config.specialExtensions().contains(".json"));
        assertEquals(Set.of("tests/"), config.testDirectoryPrefixes());
        assertEquals(Set.of(".py"), config.sourceExtensions());
        assertEquals(Set.of(".md", ".rst", ".tex", ".txt"), config.noTestExtensions());
        assertFalse(config.runAllOnUnknownExtensions());
        assertTrue(config.excludePaths().isEmpty());
        assertFalse(config.runAllIfNoMatches());
    }

    @Test
    void customValuesArePreserved() {
        PartialTestingConfig config = PartialTestingConfig.builder()
                .baseRef("origin/main")
                .useMergeBase(true)
                .includeUncommitted(false)
                .includeStaged(false)
                .coverageDir(Path.of("/mnt/coverage"))
                .projectName("numpy")
                .buildNumber(" 42 ")
                .lineCoverage(true)
                .specialFilenames(Set.of("Makefile"))
                .specialExtensions(Set.of(".yml"))
                .testDirectoryPrefixes(Set.of("src/test/java"))
                .sourceExtensions(Set.of(".java"))
                .noTestExtensions(Set.of(".adoc"))
                .runAllOnUnknownExtensions(true)
                .excludePaths(List.of("**/generated/**"))
                .runAllIfNoMatches(true)
                .build();

        assertEquals("origin/main", config.baseRef());
        assertTrue(config.useMergeBase());
        assertFalse(config.includeUncommitted());
        assertFalse(config.includeStaged());
        assertEquals(Path.of("/mnt/coverage"), config.coverageDir());
        assertEquals("numpy", config.projectName());
        assertEquals("42", config.buildNumber());
        assertTrue(config.lineCoverage());
        assertEquals(Set.of("Makefile"), config.specialFilenames());
        assertEquals(List.of("**/generated/**"), config.excludePaths());
        assertTrue(config.runAllIfNoMatches());
        assertTrue(config.runAllOnUnknownExtensions());
    }

    @Test
    void projectConfigIsDerivedAndNormalised() {
        ProjectConfig project = PartialTestingConfig.builder()
                .testDirectoryPrefixes(Set.of("src\\test\\java"))
                .sourceExtensions(Set.of("JAVA", ".kt"))
                .build()
                .projectConfig();

        assertEquals(Set.of("src/test/java/"), project.testDirectoryPrefixes());
        assertEquals(Set.of(".java", ".kt"), project.sourceExtensions());
    }

    @Test
    void rejectsBlankOrTraversingBaseRef() {
        assertThrows(IllegalArgumentException.class, () -> PartialTestingConfig.builder().baseRef(" "));
        assertThrows(IllegalArgumentException.class, () -> PartialTestingConfig.builder().baseRef("../../etc/passwd"));
        assertDoesNotThrow(() -> PartialTestingConfig.builder().baseRef("origin/release-1.2"));
    }

    @Test
    void rejectsProjectNameOutsideTheCoverageDirectory() {
        assertThrows(IllegalArgumentException.class, () -> PartialTestingConfig.builder().projectName(""));
        assertThrows(IllegalArgumentException.class, () -> PartialTestingConfig.builder().projectName(".."));
        assertThrows(IllegalArgumentException.class, () -> PartialTestingConfig.builder().projectName("proj/../.."));
        assertThrows(IllegalArgumentException.class, () -> PartialTestingConfig.builder().projectName("/mnt/other"));
        assertThrows(IllegalArgumentException.class, () -> PartialTestingConfig.builder().projectName("C:\\data"));
    }

    @Test
    void projectNameMayIncludeABranchDirectory() {
        assertEquals("proj/master", PartialTestingConfig.builder().projectName("proj/master").build().projectName());
        assertEquals("proj/master", PartialTestingConfig.builder().projectName("proj\\master").build().projectName());
    }

    @Test
    void configIsImmutable() {
        PartialTestingConfig config = PartialTestingConfig.builder().build();

        assertThrows(UnsupportedOperationException.class, () ->
                config.specialFilenames().add("Makefile"));
        assertThrows(UnsupportedOperationException.class, () ->
                config.excludePaths().add("foo"));
    }
}
