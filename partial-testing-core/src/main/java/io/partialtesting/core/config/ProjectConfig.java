package io.partialtesting.core.config;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Project-level rules consulted by the file classifier.
 * Immutable; all values are normalised on construction so that lookups are plain set membership.
 *
 * @param specialFilenames          paths or bare file names whose change requires the full suite
 * @param specialExtensions         extensions whose change requires the full suite
 * @param testDirectoryPrefixes     directory prefixes (forward slashes, trailing {@code /}) holding tests
 * @param sourceExtensions          extensions recognised as code
 * @param noTestExtensions          known extensions that never need tests (documentation, notes)
 * @param runAllOnUnknownExtensions whether an extension in none of the sets above is treated as special
 */
public record ProjectConfig(
        Set<String> specialFilenames,
        Set<String> specialExtensions,
        Set<String> testDirectoryPrefixes,
        Set<String> sourceExtensions,
        Set<String> noTestExtensions,
        boolean runAllOnUnknownExtensions
) {

    public ProjectConfig {
        specialFilenames = Set.copyOf(specialFilenames);
        specialExtensions = normaliseExtensions(specialExtensions);
        testDirectoryPrefixes = normalisePrefixes(testDirectoryPrefixes);
        sourceExtensions = normaliseExtensions(sourceExtensions);
        noTestExtensions = normaliseExtensions(noTestExtensions);
    }

    /** Convenience constructor for the four rule sets, without the unknown-extension escalation. */
    public ProjectConfig(Set<String> specialFilenames,
                         Set<String> specialExtensions,
                         Set<String> testDirectoryPrefixes,
                         Set<String> sourceExtensions) {
        this(specialFilenames, specialExtensions, testDirectoryPrefixes, sourceExtensions, Set.of(), false);
    }

    /**
     * Returns the lower-cased extension of the last path segment including the leading dot,
     * or an empty string when there is none. Dot files such as {@code .gitignore} have no extension.
     */
    public static String extensionOf(String path) {
        String name = fileNameOf(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** Returns the last segment of a forward- or back-slash separated path. */
    public static String fileNameOf(String path) {
        String normalized = normalisePath(path);
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }

    /** Normalises separators to {@code /} and strips a leading {@code ./}. */
    public static String normalisePath(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    private static Set<String> normaliseExtensions(Set<String> extensions) {
        Set<String> result = new TreeSet<>();
        for (String ext : extensions) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String trimmed = ext.trim().toLowerCase(Locale.ROOT);
            result.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
        }
        return Set.copyOf(result);
    }

    private static Set<String> normalisePrefixes(Set<String> prefixes) {
        Set<String> result = new TreeSet<>();
        for (String prefix : prefixes) {
            if (prefix == null || prefix.isBlank()) {
                continue;
            }
            String normalized = normalisePath(prefix.trim());
            result.add(normalized.endsWith("/") ? normalized : normalized + "/");
        }
        return Set.copyOf(result);
    }
}
