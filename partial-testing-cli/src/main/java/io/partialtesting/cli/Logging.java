package io.partialtesting.cli;

/**
 * Log level switch for the bundled slf4j-simple binding. slf4j-simple looks up per-logger levels
 * from system properties when each logger is created, so this affects every logger obtained
 * afterwards, including the core's, which are first obtained while a command runs.
 */
final class Logging {

    static final String PROJECT_LOG_LEVEL_KEY = "org.slf4j.simpleLogger.log.io.partialtesting";

    private Logging() {
    }

    static void enableDebug() {
        System.setProperty(PROJECT_LOG_LEVEL_KEY, "debug");
    }
}
