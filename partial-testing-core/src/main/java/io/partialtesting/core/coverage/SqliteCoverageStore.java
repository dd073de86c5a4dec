package io.partialtesting.core.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * {@link CoverageStore} backed by a coverage.py data file ({@code .coverage}), which is a SQLite
 * database recorded with dynamic contexts ({@code --cov-context=test} or {@code dynamic_context = test_function}).
 *
 * <p>Relevant tables:
 * <pre>
 * file(id, path)
 * context(id, context)
 * arc(file_id, context_id, fromno, tono)     -- branch coverage
 * line_bits(file_id, context_id, numbits)    -- line coverage
 * </pre>
 * Rows recorded under the empty context (code executed outside any test, e.g. at import time)
 * are ignored.
 */
public final class SqliteCoverageStore implements CoverageStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteCoverageStore.class);

    static final String ARC_TABLE = "arc";
    static final String LINE_TABLE = "line_bits";

    private static final String TABLE_EXISTS_SQL = """
            SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?
            """;

    private static final String SELECT_ALL_SQL = """
            SELECT DISTINCT file.path, context.context
            FROM %1$s
            JOIN file ON %1$s.file_id = file.id
            JOIN context ON %1$s.context_id = context.id
            WHERE context.context != ''
            """;

    private static final String SELECT_BY_FILE_SQL = """
            SELECT DISTINCT context.context
            FROM %1$s
            JOIN file ON %1$s.file_id = file.id
            JOIN context ON %1$s.context_id = context.id
            WHERE file.path = ? AND context.context != ''
            """;

    private final Path databasePath;
    private final String coverageTable;
    private final Connection connection;

    private SqliteCoverageStore(Path databasePath, String coverageTable, Connection connection) {
        this.databasePath = databasePath;
        this.coverageTable = coverageTable;
        this.connection = connection;
    }

    /**
     * Opens a coverage data file read-only.
     *
     * @param databasePath path to the {@code .coverage} file
     * @param lineCoverage {@code true} if the reference build recorded lines, {@code false} for arcs ({@code --branch})
     * @throws IndexUnavailableException if the file is missing, unreadable or not a coverage.py database
     */
    public static SqliteCoverageStore open(Path databasePath, boolean lineCoverage) {
        if (!Files.isRegularFile(databasePath)) {
            throw new IndexUnavailableException("Coverage data file not found: " + databasePath);
        }
        String table = lineCoverage ? LINE_TABLE : ARC_TABLE;

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setReadOnly(true);

        Connection connection;
        try {
            connection = DriverManager.getConnection(
                    "jdbc:sqlite:" + databasePath.toAbsolutePath(), sqliteConfig.toProperties());
        } catch (SQLException e) {
            throw new IndexUnavailableException("Cannot open coverage data file " + databasePath, e);
        }

        SqliteCoverageStore store = new SqliteCoverageStore(databasePath, table, connection);
        try {
            store.requireTables("file", "context", table);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
        log.debug("Opened coverage data {} using table '{}'", databasePath, table);
        return store;
    }

    @Override
    public Set<String> contextsForFile(String path) {
        Set<String> contexts = new LinkedHashSet<>();
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_BY_FILE_SQL.formatted(coverageTable))) {
            stmt.setString(1, path);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    contexts.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw new IndexUnavailableException("Failed to query coverage data " + databasePath, e);
        }
        return contexts;
    }

    @Override
    public Map<String, Set<String>> readAll() {
        Map<String, Set<String>> byFile = new TreeMap<>();
        int rows = 0;
        try (PreparedStatement stmt = connection.prepareStatement(SELECT_ALL_SQL.formatted(coverageTable));
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                byFile.computeIfAbsent(rs.getString(1), k -> new LinkedHashSet<>()).add(rs.getString(2));
                rows++;
            }
        } catch (SQLException e) {
            throw new IndexUnavailableException("Failed to read coverage data " + databasePath, e);
        }
        log.debug("Read {} file/context pairs for {} files from {}", rows, byFile.size(), databasePath);
        return byFile;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close coverage data {}: {}", databasePath, e.getMessage());
        }
    }

    private void requireTables(String... tables) {
        for (String table : tables) {
            try (PreparedStatement stmt = connection.prepareStatement(TABLE_EXISTS_SQL)) {
                stmt.setString(1, table);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        throw new IndexUnavailableException("Coverage data " + databasePath
                                + " has no '" + table + "' table. Was it recorded with "
                                + (LINE_TABLE.equals(table) ? "line" : "branch") + " coverage and contexts enabled?");
                    }
                }
            } catch (SQLException e) {
                throw new IndexUnavailableException("Coverage data " + databasePath + " is not readable", e);
            }
        }
    }
}
