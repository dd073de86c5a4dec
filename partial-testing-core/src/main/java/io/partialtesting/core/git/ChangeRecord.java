package io.partialtesting.core.git;

import io.partialtesting.core.config.ProjectConfig;

import java.util.Objects;

/**
 * A single changed path, relative to the repository root with forward slashes.
 */
public record ChangeRecord(String path, ChangeKind kind) {

    public ChangeRecord {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        path = ProjectConfig.normalisePath(path);
        if (path.isEmpty()) {
            throw new IllegalArgumentException("path must not be empty");
        }
    }

    public static ChangeRecord added(String path) {
        return new ChangeRecord(path, ChangeKind.ADDED);
    }

    public static ChangeRecord modified(String path) {
        return new ChangeRecord(path, ChangeKind.MODIFIED);
    }

    public static ChangeRecord deleted(String path) {
        return new ChangeRecord(path, ChangeKind.DELETED);
    }
}
