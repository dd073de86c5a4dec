package io.partialtesting.core.git;

/**
 * How a path changed between the comparison reference and the working tree.
 * Renames are never reported as such: the old path is {@link #DELETED} and the new one {@link #ADDED}.
 */
public enum ChangeKind {
    ADDED,
    MODIFIED,
    DELETED
}
