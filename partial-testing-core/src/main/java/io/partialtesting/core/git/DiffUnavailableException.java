package io.partialtesting.core.git;

/**
 * The change set could not be computed: the directory is not a git repository,
 * or the comparison reference does not resolve. A run cannot proceed without it.
 */
public class DiffUnavailableException extends IllegalStateException {

    public DiffUnavailableException(String message) {
        super(message);
    }

    public DiffUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
