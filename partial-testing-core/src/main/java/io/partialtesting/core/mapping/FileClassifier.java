package io.partialtesting.core.mapping;

import io.partialtesting.core.config.ProjectConfig;
import io.partialtesting.core.git.ChangeKind;
import io.partialtesting.core.git.ChangeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns each changed path exactly one {@link FileCategory}.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>special file name or special extension: {@link FileCategory#SPECIAL_CONFIG}, even under a test directory</li>
 *   <li>code extension under a test directory prefix: {@link FileCategory#TEST_CODE}</li>
 *   <li>code extension elsewhere: {@link FileCategory#SOURCE_CODE}</li>
 *   <li>an extension nobody knows, when {@code runAllOnUnknownExtensions} is set: {@link FileCategory#SPECIAL_CONFIG}</li>
 *   <li>anything else: {@link FileCategory#NON_CODE}</li>
 * </ol>
 */
public final class FileClassifier {

    private static final Logger log = LoggerFactory.getLogger(FileClassifier.class);

    private final ProjectConfig config;

    public FileClassifier(ProjectConfig config) {
        this.config = config;
    }

    public FileCategory classify(ChangeRecord change) {
        FileCategory category = classify(change.path(), change.kind(), config);
        log.debug("Classified {} ({}) as {}", change.path(), change.kind(), category);
        return category;
    }

    /**
     * Classifies a path. The change kind does not influence the category; it is accepted so that
     * callers can classify a record without unpacking it.
     */
    public static FileCategory classify(String path, ChangeKind kind, ProjectConfig config) {
        String normalized = ProjectConfig.normalisePath(path);
        String extension = ProjectConfig.extensionOf(normalized);

        if (isSpecialFile(normalized, config) || config.specialExtensions().contains(extension)) {
            return FileCategory.SPECIAL_CONFIG;
        }

        boolean code = config.sourceExtensions().contains(extension);
        if (code && isUnderTestDirectory(normalized, config)) {
            return FileCategory.TEST_CODE;
        }
        if (code) {
            return FileCategory.SOURCE_CODE;
        }

        if (config.runAllOnUnknownExtensions() && !config.noTestExtensions().contains(extension)) {
            return FileCategory.SPECIAL_CONFIG;
        }
        return FileCategory.NON_CODE;
    }

    /** Whether the path lies under one of the configured test directory prefixes. */
    public static boolean isUnderTestDirectory(String path, ProjectConfig config) {
        String normalized = ProjectConfig.normalisePath(path);
        for (String prefix : config.testDirectoryPrefixes()) {
            if (normalized.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * An entry matches the whole path ({@code ci/Jenkinsfile}), a trailing part of it, or the bare
     * file name ({@code conftest.py} matches {@code tests/unit/conftest.py}).
     */
    private static boolean isSpecialFile(String path, ProjectConfig config) {
        String fileName = ProjectConfig.fileNameOf(path);
        for (String special : config.specialFilenames()) {
            String entry = ProjectConfig.normalisePath(special);
            if (entry.equals(path) || entry.equals(fileName) || path.endsWith("/" + entry)) {
                return true;
            }
        }
        return false;
    }
}
