package io.partialtesting.core.discovery;

import io.partialtesting.core.config.ProjectConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Resolves a recorded test context to the test file that defines it.
 *
 * <p>Understood context formats:
 * <ul>
 *   <li>dotted, as recorded by coverage.py's {@code test_function} context or a JVM agent:
 *       {@code tests.unit.test_foo.test_bar}, {@code tests.test_foo.TestFoo.test_bar},
 *       {@code com.example.FooTest.bar}</li>
 *   <li>pytest node ids, as recorded by pytest-cov's {@code --cov-context=test}:
 *       {@code tests/test_foo.py::TestFoo::test_bar[param]|run}</li>
 *   <li>a bare test name: {@code test_bar}</li>
 * </ul>
 *
 * <p>Resolution:
 * <ol>
 *   <li><strong>Direct:</strong> derive candidate files from the qualifier (longest first, with and
 *       without each test directory prefix) and accept the first that exists and defines the name.</li>
 *   <li><strong>Search:</strong> look the name up in an index of every test file's definitions, built
 *       once. Among several candidates the one whose module path shares the longest trailing run with
 *       the qualifier wins; ties go to the alphabetically first path.</li>
 * </ol>
 * Every context is resolved at most once; results, including failures, are cached.
 *
 * <p>Not thread-safe: one instance serves one single-threaded selection run.
 */
public final class TestLocator {

    private static final Logger log = LoggerFactory.getLogger(TestLocator.class);

    private final Path projectDir;
    private final ProjectConfig config;
    private final List<TestDefinitionScanner> scanners;

    private final Map<String, Optional<String>> contextDefinitionCache = new HashMap<>();
    private final Map<String, FileDefinitions> definitionsByFile = new HashMap<>();
    private Map<String, SortedSet<String>> filesByDefinedName;

    public TestLocator(Path projectDir, ProjectConfig config, List<TestDefinitionScanner> scanners) {
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.config = config;
        this.scanners = List.copyOf(scanners);
    }

    /** Creates a locator with the Java and Python scanners. */
    public static TestLocator create(Path projectDir, ProjectConfig config) {
        return new TestLocator(projectDir, config,
                List.of(new JavaDefinitionScanner(), new PythonDefinitionScanner()));
    }

    /**
     * A context identifier split into its parts.
     *
     * @param explicitPath file path given by a pytest node id, or {@code null}
     * @param qualifier    dotted qualifier segments (module, then classes), possibly empty
     * @param name         the test's own name
     */
    record ParsedContext(String explicitPath, List<String> qualifier, String name) {}

    /**
     * @param contextId a non-empty test context as stored by the coverage recorder
     * @return path of the defining test file, relative to the project directory
     * @throws UnresolvedContextException if no test file defines the context
     */
    public String locate(String contextId) {
        Optional<String> cached = contextDefinitionCache.get(contextId);
        if (cached == null) {
            cached = resolve(contextId);
            contextDefinitionCache.put(contextId, cached);
        }
        return cached.orElseThrow(() -> new UnresolvedContextException(contextId,
                "No test file defines context '" + contextId + "'"));
    }

    /**
     * Returns the definitions of a file relative to the project directory, scanning it on first use.
     *
     * @throws IOException if the file does not exist or cannot be read
     */
    public FileDefinitions definitionsOf(String relativePath) throws IOException {
        String normalized = ProjectConfig.normalisePath(relativePath);
        FileDefinitions cached = definitionsByFile.get(normalized);
        if (cached != null) {
            return cached;
        }
        Path file = projectDir.resolve(normalized).normalize();
        if (!file.startsWith(projectDir)) {
            throw new IOException("Path escapes the project directory: " + relativePath);
        }
        TestDefinitionScanner scanner = scannerFor(file);
        FileDefinitions definitions = scanner.scan(file);
        log.debug("Scanned {} with the {} scanner: {} symbols, {} tests",
                normalized, scanner.name(), definitions.symbols().size(), definitions.tests().size());
        definitionsByFile.put(normalized, definitions);
        return definitions;
    }

    private Optional<String> resolve(String contextId) {
        ParsedContext parsed = parse(contextId);
        if (parsed.name().isEmpty()) {
            log.debug("Context '{}' has no test name", contextId);
            return Optional.empty();
        }

        for (String candidate : directCandidates(parsed)) {
            if (definesName(candidate, parsed.name())) {
                log.debug("Resolved '{}' directly to {}", contextId, candidate);
                return Optional.of(candidate);
            }
        }

        SortedSet<String> candidates = filesByDefinedName().getOrDefault(parsed.name(), Collections.emptySortedSet());
        String best = null;
        int bestScore = -1;
        for (String candidate : candidates) {
            int score = qualifierMatch(parsed.qualifier(), moduleSegments(candidate));
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best != null) {
            if (candidates.size() > 1) {
                log.debug("Resolved ambiguous '{}' to {} among {}", contextId, best, candidates);
            } else {
                log.debug("Resolved '{}' by search to {}", contextId, best);
            }
        }
        return Optional.ofNullable(best);
    }

    static ParsedContext parse(String contextId) {
        String id = contextId.trim();
        int phase = id.indexOf('|');
        if (phase >= 0) {
            id = id.substring(0, phase);
        }

        if (id.contains("::")) {
            String[] parts = id.split("::");
            String name = stripParameters(parts[parts.length - 1]);
            List<String> qualifier = new ArrayList<>();
            String path = ProjectConfig.normalisePath(parts[0]);
            String module = path.contains(".") ? path.substring(0, path.lastIndexOf('.')) : path;
            qualifier.addAll(Arrays.asList(module.split("/")));
            for (int i = 1; i < parts.length - 1; i++) {
                qualifier.add(parts[i]);
            }
            return new ParsedContext(path, List.copyOf(qualifier), name);
        }

        id = stripParameters(id);
        int dot = id.lastIndexOf('.');
        if (dot < 0) {
            return new ParsedContext(null, List.of(), id);
        }
        List<String> qualifier = Arrays.asList(id.substring(0, dot).split("\\."));
        return new ParsedContext(null, List.copyOf(qualifier), id.substring(dot + 1));
    }

    private static String stripParameters(String name) {
        int bracket = name.indexOf('[');
        return bracket >= 0 ? name.substring(0, bracket) : name;
    }

    /**
     * Candidate files from the identifier itself, most specific first: the explicit node-id path,
     * then each qualifier prefix (longest first) as a module path, bare and under each test prefix.
     */
    private List<String> directCandidates(ParsedContext parsed) {
        Set<String> candidates = new LinkedHashSet<>();
        if (parsed.explicitPath() != null) {
            candidates.add(parsed.explicitPath());
        }
        List<String> qualifier = parsed.qualifier();
        for (int length = qualifier.size(); length > 0; length--) {
            String modulePath = String.join("/", qualifier.subList(0, length));
            for (String extension : new TreeSet<>(config.sourceExtensions())) {
                candidates.add(modulePath + extension);
                for (String prefix : new TreeSet<>(config.testDirectoryPrefixes())) {
                    if (!modulePath.startsWith(prefix)) {
                        candidates.add(prefix + modulePath + extension);
                    }
                }
            }
        }
        return new ArrayList<>(candidates);
    }

    private boolean definesName(String candidate, String name) {
        Path file = projectDir.resolve(candidate).normalize();
        if (!file.startsWith(projectDir) || !Files.isRegularFile(file)) {
            return false;
        }
        try {
            return definitionsOf(candidate).defines(name);
        } catch (IOException e) {
            log.warn("Cannot read test file {}: {}", candidate, e.getMessage());
            return false;
        }
    }

    /**
     * Index from defined name to the test files defining it, built on first use.
     */
    private Map<String, SortedSet<String>> filesByDefinedName() {
        if (filesByDefinedName != null) {
            return filesByDefinedName;
        }
        Map<String, SortedSet<String>> index = new HashMap<>();
        SortedSet<String> testFiles = TestFileScanner.collectTestFiles(projectDir, config);
        for (String testFile : testFiles) {
            try {
                for (String symbol : definitionsOf(testFile).symbols()) {
                    index.computeIfAbsent(symbol, k -> new TreeSet<>()).add(testFile);
                }
            } catch (IOException e) {
                log.warn("Cannot read test file {}: {}", testFile, e.getMessage());
            }
        }
        log.info("Indexed definitions of {} test files ({} distinct names)", testFiles.size(), index.size());
        filesByDefinedName = index;
        return index;
    }

    /** Path segments of a file without its extension: {@code tests/unit/test_a.py -> [tests, unit, test_a]}. */
    private static List<String> moduleSegments(String path) {
        String withoutExtension = path;
        int dot = path.lastIndexOf('.');
        if (dot > path.lastIndexOf('/')) {
            withoutExtension = path.substring(0, dot);
        }
        return Arrays.asList(withoutExtension.split("/"));
    }

    /**
     * Length of the longest run of trailing module segments equal to some prefix of the qualifier.
     * The prefix loop lets class names after the module in the qualifier be skipped.
     */
    static int qualifierMatch(List<String> qualifier, List<String> moduleSegments) {
        int best = 0;
        for (int end = qualifier.size(); end > 0; end--) {
            int matched = 0;
            while (matched < end && matched < moduleSegments.size()
                    && qualifier.get(end - 1 - matched).equals(moduleSegments.get(moduleSegments.size() - 1 - matched))) {
                matched++;
            }
            best = Math.max(best, matched);
        }
        return best;
    }

    private TestDefinitionScanner scannerFor(Path file) {
        for (TestDefinitionScanner scanner : scanners) {
            if (scanner.supports(file)) {
                return scanner;
            }
        }
        return new PythonDefinitionScanner();
    }
}
