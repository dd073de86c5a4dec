package io.partialtesting.core.testutil;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes coverage.py-shaped SQLite databases for tests.
 */
public final class CoverageFixtures {

    private CoverageFixtures() {
    }

    /**
     * Creates a {@code .coverage} database at {@code dbFile} recording, for each file, the given contexts.
     * An empty context string records execution outside any test.
     *
     * @param lineCoverage write rows to {@code line_bits} instead of {@code arc}
     */
    public static Path createCoverageDb(Path dbFile, Map<String, List<String>> contextsByFile,
                                        boolean lineCoverage) throws Exception {
        Files.createDirectories(dbFile.getParent());
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE coverage_schema ( version integer )");
            stmt.execute("CREATE TABLE meta ( key text, value text, unique (key) )");
            stmt.execute("CREATE TABLE file ( id integer primary key, path text, unique (path) )");
            stmt.execute("CREATE TABLE context ( id integer primary key, context text, unique (context) )");
            stmt.execute("CREATE TABLE line_bits ( file_id integer, context_id integer, numbits blob, "
                    + "unique (file_id, context_id) )");
            stmt.execute("CREATE TABLE arc ( file_id integer, context_id integer, fromno integer, tono integer, "
                    + "unique (file_id, context_id, fromno, tono) )");
            stmt.execute("CREATE TABLE tracer ( file_id integer primary key, tracer text )");
            stmt.execute("INSERT INTO coverage_schema (version) VALUES (7)");

            Map<String, Integer> contextIds = new LinkedHashMap<>();
            int fileId = 0;
            for (var entry : contextsByFile.entrySet()) {
                fileId++;
                try (PreparedStatement insertFile = conn.prepareStatement("INSERT INTO file (id, path) VALUES (?, ?)")) {
                    insertFile.setInt(1, fileId);
                    insertFile.setString(2, entry.getKey());
                    insertFile.executeUpdate();
                }
                for (String context : entry.getValue()) {
                    Integer contextId = contextIds.get(context);
                    if (contextId == null) {
                        contextId = contextIds.size() + 1;
                        contextIds.put(context, contextId);
                        try (PreparedStatement insertContext =
                                     conn.prepareStatement("INSERT INTO context (id, context) VALUES (?, ?)")) {
                            insertContext.setInt(1, contextId);
                            insertContext.setString(2, context);
                            insertContext.executeUpdate();
                        }
                    }
                    if (lineCoverage) {
                        try (PreparedStatement insertLines = conn.prepareStatement(
                                "INSERT INTO line_bits (file_id, context_id, numbits) VALUES (?, ?, ?)")) {
                            insertLines.setInt(1, fileId);
                            insertLines.setInt(2, contextId);
                            insertLines.setBytes(3, new byte[] {0x7f});
                            insertLines.executeUpdate();
                        }
                    } else {
                        // two arcs per pair so that DISTINCT matters
                        for (int line = 1; line <= 2; line++) {
                            try (PreparedStatement insertArc = conn.prepareStatement(
                                    "INSERT INTO arc (file_id, context_id, fromno, tono) VALUES (?, ?, ?, ?)")) {
                                insertArc.setInt(1, fileId);
                                insertArc.setInt(2, contextId);
                                insertArc.setInt(3, line);
                                insertArc.setInt(4, line + 1);
                                insertArc.executeUpdate();
                            }
                        }
                    }
                }
            }
        }
        return dbFile;
    }

    /** Writes a Python test module defining the given test functions. */
    public static Path writePythonTests(Path file, String... testNames) throws Exception {
        Files.createDirectories(file.getParent());
        StringBuilder content = new StringBuilder("import pytest\n\n");
        for (String name : testNames) {
            content.append("def ").append(name).append("():\n    pass\n\n");
        }
        Files.writeString(file, content.toString());
        return file;
    }
}
