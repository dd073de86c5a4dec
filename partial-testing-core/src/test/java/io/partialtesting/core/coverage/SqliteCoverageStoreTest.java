package io.partialtesting.core.coverage;

import io.partialtesting.core.testutil.CoverageFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SqliteCoverageStoreTest {

    @TempDir
    Path tempDir;

    private Path arcDb() throws Exception {
        return CoverageFixtures.createCoverageDb(tempDir.resolve(".coverage"), Map.of(
                "/builds/proj/code1.py", List.of("tests.test_code1.test_code1", "tests.test_code1.test_code2", ""),
                "/builds/proj/code2.py", List.of("tests.test_code2.test_x"),
                "/builds/proj/untested.py", List.of("")
        ), false);
    }

    @Test
    void readsContextsForAStoredPath() throws Exception {
        try (SqliteCoverageStore store = SqliteCoverageStore.open(arcDb(), false)) {
            assertEquals(Set.of("tests.test_code1.test_code1", "tests.test_code1.test_code2"),
                    store.contextsForFile("/builds/proj/code1.py"));
            assertTrue(store.contextsForFile("/builds/proj/missing.py").isEmpty());
        }
    }

    @Test
    void readAllSkipsEmptyContexts() throws Exception {
        try (SqliteCoverageStore store = SqliteCoverageStore.open(arcDb(), false)) {
            Map<String, Set<String>> all = store.readAll();

            assertEquals(Set.of("/builds/proj/code1.py", "/builds/proj/code2.py"), all.keySet());
            assertEquals(2, all.get("/builds/proj/code1.py").size());
        }
    }

    @Test
    void readsLineCoverageTable() throws Exception {
        Path db = CoverageFixtures.createCoverageDb(tempDir.resolve("lines/.coverage"), Map.of(
                "code1.py", List.of("tests.test_code1.test_code1")), true);

        try (SqliteCoverageStore store = SqliteCoverageStore.open(db, true)) {
            assertEquals(Set.of("tests.test_code1.test_code1"), store.contextsForFile("code1.py"));
        }
        try (SqliteCoverageStore arcs = SqliteCoverageStore.open(db, false)) {
            assertTrue(arcs.readAll().isEmpty(), "Line data is not visible through the arc table");
        }
    }

    @Test
    void missingFileIsIndexUnavailable() {
        IndexUnavailableException ex = assertThrows(IndexUnavailableException.class,
                () -> SqliteCoverageStore.open(tempDir.resolve("nope/.coverage"), false));
        assertTrue(ex.getMessage().contains("nope"));
    }

    @Test
    void fileWithoutCoverageTablesIsIndexUnavailable() throws Exception {
        Path notCoverage = tempDir.resolve(".coverage");
        Files.writeString(notCoverage, "this is not a database, just text long enough to be rejected by sqlite");

        assertThrows(IndexUnavailableException.class, () -> SqliteCoverageStore.open(notCoverage, false));
    }
}
