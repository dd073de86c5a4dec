package io.partialtesting.core.coverage;

import io.partialtesting.core.testutil.CoverageFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CoverageIndexTest {

    @TempDir
    Path tempDir;

    private final CoverageIndex index = CoverageIndex.of(Map.of(
            "/jenkins/workspace/proj/code1.py", Set.of("tests.test_code1.test_code1", "tests.test_code1.test_code2"),
            "/jenkins/workspace/proj/pkg/util.py", Set.of("tests.test_util.test_a"),
            "/jenkins/workspace/proj/other/util.py", Set.of("tests.test_other.test_b"),
            "tests/helpers.py", Set.of("tests.test_code1.test_code1")
    ));

    @Test
    void matchesRelativePathAgainstAbsoluteStoredPath() {
        assertEquals(Set.of("tests.test_code1.test_code1", "tests.test_code1.test_code2"),
                index.testsTouchingFile("code1.py"));
    }

    @Test
    void suffixMatchRespectsDirectoryBoundaries() {
        assertEquals(Set.of("tests.test_util.test_a"), index.testsTouchingFile("pkg/util.py"));
        assertTrue(index.testsTouchingFile("de1.py").isEmpty(), "'de1.py' is not a suffix segment of code1.py");
        assertEquals(Set.of("tests.test_util.test_a", "tests.test_other.test_b"), index.testsTouchingFile("util.py"));
    }

    @Test
    void exactMatchWins() {
        assertEquals(Set.of("tests.test_code1.test_code1"), index.testsTouchingFile("./tests/helpers.py"));
    }

    @Test
    void fileWithoutCoverageYieldsEmptySet() {
        assertTrue(index.testsTouchingFile("untested.py").isEmpty());
    }

    @Test
    void exposesContextsAndFiles() {
        assertEquals(4, index.fileCount());
        assertEquals(4, index.contexts().size());
        assertTrue(index.files().contains("tests/helpers.py"));
    }

    @Test
    void indexIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> index.testsTouchingFile("code1.py").add("tests.injected"));
        assertThrows(UnsupportedOperationException.class, () -> index.files().clear());
    }

    @Test
    void loadsFromCoverageDatabase() throws Exception {
        Path db = CoverageFixtures.createCoverageDb(tempDir.resolve(".coverage"), Map.of(
                "/ci/proj/nontestfile1.py", List.of("test_testfile1_test1"),
                "/ci/proj/nontestfile2.py", List.of("test_testfile1_test1", "test_testfile2_test1"),
                "/ci/proj/nontestfile3.py", List.of()
        ), false);

        CoverageIndex loaded = CoverageIndex.load(db, false);

        assertEquals(Set.of("test_testfile1_test1", "test_testfile2_test1"),
                loaded.testsTouchingFile("nontestfile2.py"));
        assertTrue(loaded.testsTouchingFile("nontestfile3.py").isEmpty());
    }
}
