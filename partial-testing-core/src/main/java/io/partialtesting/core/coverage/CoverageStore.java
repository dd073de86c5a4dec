package io.partialtesting.core.coverage;

import java.util.Map;
import java.util.Set;

/**
 * Read-only access to a persisted "who tests what" record: which test contexts executed which files
 * during one full-suite run of the reference build.
 *
 * <p>Implementations hold an open resource and must be closed once the {@link CoverageIndex}
 * has been built from them.
 */
public interface CoverageStore extends AutoCloseable {

    /**
     * @param path a file path exactly as stored (usually absolute, from the reference build machine)
     * @return the non-empty test contexts that executed the file, empty if none
     */
    Set<String> contextsForFile(String path);

    /**
     * @return every stored file path mapped to the non-empty test contexts that executed it
     */
    Map<String, Set<String>> readAll();

    @Override
    void close();
}
