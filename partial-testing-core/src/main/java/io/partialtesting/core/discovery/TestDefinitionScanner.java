package io.partialtesting.core.discovery;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts the names a test file defines, for one language.
 */
public interface TestDefinitionScanner {

    /**
     * @return the scanner name (e.g. "python", "java")
     */
    String name();

    /**
     * @param file a test file
     * @return whether this scanner understands the file's language
     */
    boolean supports(Path file);

    /**
     * @param file an existing, readable test file
     * @return the symbols and tests defined in the file
     * @throws IOException if the file cannot be read or parsed
     */
    FileDefinitions scan(Path file) throws IOException;
}
