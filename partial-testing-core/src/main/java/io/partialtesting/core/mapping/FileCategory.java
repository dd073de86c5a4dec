package io.partialtesting.core.mapping;

/**
 * What a changed path is, as far as test selection is concerned.
 */
public enum FileCategory {
    /** Production code: covered by tests recorded in the coverage index. */
    SOURCE_CODE,
    /** Code under a test directory: may define tests and may be imported by other tests. */
    TEST_CODE,
    /** Build, CI, fixture or data file whose change can affect any test. */
    SPECIAL_CONFIG,
    /** Documentation and everything else that never needs tests. */
    NON_CODE
}
