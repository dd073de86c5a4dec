package io.partialtesting.core.coverage;

/**
 * The persisted coverage data could not be found or read.
 * Partial selection is impossible; callers should fall back to running the full suite.
 */
public class IndexUnavailableException extends IllegalStateException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
