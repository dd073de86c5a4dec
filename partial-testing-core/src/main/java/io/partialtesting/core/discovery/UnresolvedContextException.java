package io.partialtesting.core.discovery;

/**
 * A recorded test context could not be mapped to a test file, typically because the test was
 * renamed or removed after the reference build recorded it.
 */
public class UnresolvedContextException extends RuntimeException {

    private final String contextId;

    public UnresolvedContextException(String contextId, String message) {
        super(message);
        this.contextId = contextId;
    }

    public String contextId() {
        return contextId;
    }
}
