package io.partialtesting.core.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Configuration for a partial testing run.
 * Immutable value object. Use the {@link Builder} to construct.
 */
public final class PartialTestingConfig {

    /** Files that trigger a full test run when added, modified or deleted. */
    public static final Set<String> DEFAULT_SPECIAL_FILENAMES = Set.of(
            "setup.py", "setup.cfg",
            "setup_ts1.py", "setup_ts1.cfg",
            "setup_ts2.py", "setup_ts2.cfg",
            "Jenkinsfile", "conftest.py", "tox.ini", "pytest.ini");

    /** Extensions that trigger a full test run. */
    public static final Set<String> DEFAULT_SPECIAL_EXTENSIONS = Set.of(
            ".pkl", ".h5", ".csv", ".gz", ".json", ".png", ".xml", ".p", ".groovy");

    public static final Set<String> DEFAULT_NO_TEST_EXTENSIONS = Set.of(".md", ".rst", ".tex", ".txt");

    private final String baseRef;
    private final boolean useMergeBase;
    private final boolean includeUncommitted;
    private final boolean includeStaged;
    private final Path coverageDir;
    private final String projectName;
    private final String buildNumber;
    private final boolean lineCoverage;
    private final Set<String> specialFilenames;
    private final Set<String> specialExtensions;
    private final Set<String> testDirectoryPrefixes;
    private final Set<String> sourceExtensions;
    private final Set<String> noTestExtensions;
    private final boolean runAllOnUnknownExtensions;
    private final List<String> excludePaths;
    private final boolean runAllIfNoMatches;
    private final ProjectConfig projectConfig;

    private PartialTestingConfig(Builder builder) {
        this.baseRef = builder.baseRef;
        this.useMergeBase = builder.useMergeBase;
        this.includeUncommitted = builder.includeUncommitted;
        this.includeStaged = builder.includeStaged;
        this.coverageDir = builder.coverageDir;
        this.projectName = builder.projectName;
        this.buildNumber = builder.buildNumber;
        this.lineCoverage = builder.lineCoverage;
        this.specialFilenames = Set.copyOf(builder.specialFilenames);
        this.specialExtensions = Set.copyOf(builder.specialExtensions);
        this.testDirectoryPrefixes = Set.copyOf(builder.testDirectoryPrefixes);
        this.sourceExtensions = Set.copyOf(builder.sourceExtensions);
        this.noTestExtensions = Set.copyOf(builder.noTestExtensions);
        this.runAllOnUnknownExtensions = builder.runAllOnUnknownExtensions;
        this.excludePaths = List.copyOf(builder.excludePaths);
        this.runAllIfNoMatches = builder.runAllIfNoMatches;
        this.projectConfig = new ProjectConfig(specialFilenames, specialExtensions, testDirectoryPrefixes,
                sourceExtensions, noTestExtensions, runAllOnUnknownExtensions);
    }

    public String baseRef() { return baseRef; }
    public boolean useMergeBase() { return useMergeBase; }
    public boolean includeUncommitted() { return includeUncommitted; }
    public boolean includeStaged() { return includeStaged; }
    public Path coverageDir() { return coverageDir; }
    public String projectName() { return projectName; }
    public String buildNumber() { return buildNumber; }
    public boolean lineCoverage() { return lineCoverage; }
    public Set<String> specialFilenames() { return specialFilenames; }
    public Set<String> specialExtensions() { return specialExtensions; }
    public Set<String> testDirectoryPrefixes() { return testDirectoryPrefixes; }
    public Set<String> sourceExtensions() { return sourceExtensions; }
    public Set<String> noTestExtensions() { return noTestExtensions; }
    public boolean runAllOnUnknownExtensions() { return runAllOnUnknownExtensions; }
    public List<String> excludePaths() { return excludePaths; }
    public boolean runAllIfNoMatches() { return runAllIfNoMatches; }

    /** The classification rules derived from this configuration. */
    public ProjectConfig projectConfig() { return projectConfig; }

    /** Creates a builder with sensible defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String baseRef = "origin/master";
        private boolean useMergeBase = false;
        private boolean includeUncommitted = true;
        private boolean includeStaged = true;
        private Path coverageDir;
        private String projectName;
        private String buildNumber = "";
        private boolean lineCoverage = false;
        private Set<String> specialFilenames = DEFAULT_SPECIAL_FILENAMES;
        private Set<String> specialExtensions = DEFAULT_SPECIAL_EXTENSIONS;
        private Set<String> testDirectoryPrefixes = Set.of("tests/");
        private Set<String> sourceExtensions = Set.of(".py");
        private Set<String> noTestExtensions = DEFAULT_NO_TEST_EXTENSIONS;
        private boolean runAllOnUnknownExtensions = false;
        private List<String> excludePaths = List.of();
        private boolean runAllIfNoMatches = false;

        public Builder baseRef(String baseRef) {
            if (baseRef == null || baseRef.isBlank()) {
                throw new IllegalArgumentException("baseRef must not be null or blank");
            }
            if (baseRef.contains("..") && baseRef.contains("/")) {
                // "../../etc/passwd" is rejected, "main..feature" style ranges are not refs anyway
                String normalized = baseRef.replace("\\", "/");
                if (normalized.contains("../")) {
                    throw new IllegalArgumentException("baseRef contains suspicious path traversal: " + baseRef);
                }
            }
            this.baseRef = baseRef;
            return this;
        }
        public Builder useMergeBase(boolean v) { this.useMergeBase = v; return this; }
        public Builder includeUncommitted(boolean v) { this.includeUncommitted = v; return this; }
        public Builder includeStaged(boolean v) { this.includeStaged = v; return this; }
        public Builder coverageDir(Path v) { this.coverageDir = v; return this; }
        public Builder projectName(String projectName) {
            if (projectName == null || projectName.isBlank()) {
                throw new IllegalArgumentException("projectName must not be null or blank");
            }
            String normalized = ProjectConfig.normalisePath(projectName.trim());
            if (normalized.startsWith("/") || normalized.matches("^[A-Za-z]:.*")) {
                throw new IllegalArgumentException("projectName must be relative to the coverage directory: " + projectName);
            }
            for (String segment : normalized.split("/")) {
                if (segment.equals("..")) {
                    throw new IllegalArgumentException("projectName must not contain '..': " + projectName);
                }
            }
            this.projectName = normalized;
            return this;
        }
        public Builder buildNumber(String v) { this.buildNumber = v == null ? "" : v.trim(); return this; }
        public Builder lineCoverage(boolean v) { this.lineCoverage = v; return this; }
        public Builder specialFilenames(Set<String> v) { this.specialFilenames = v; return this; }
        public Builder specialExtensions(Set<String> v) { this.specialExtensions = v; return this; }
        public Builder testDirectoryPrefixes(Set<String> v) { this.testDirectoryPrefixes = v; return this; }
        public Builder sourceExtensions(Set<String> v) { this.sourceExtensions = v; return this; }
        public Builder noTestExtensions(Set<String> v) { this.noTestExtensions = v; return this; }
        public Builder runAllOnUnknownExtensions(boolean v) { this.runAllOnUnknownExtensions = v; return this; }
        public Builder excludePaths(List<String> v) { this.excludePaths = v; return this; }
        public Builder runAllIfNoMatches(boolean v) { this.runAllIfNoMatches = v; return this; }

        public PartialTestingConfig build() {
            return new PartialTestingConfig(this);
        }
    }
}
