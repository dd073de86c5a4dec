package io.partialtesting.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.partialtesting.core.selection.SelectionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a {@link SelectionDecision} for the test runner that follows.
 * <ul>
 *   <li>{@link Format#TEXT}: one test file per line, sorted. The file exists even when nothing needs to
 *       run. A full-suite decision writes no file and removes one left by an earlier run.</li>
 *   <li>{@link Format#JSON}: {@code {"runAll", "testFiles", "escalations", "warnings"}}, for both outcomes.</li>
 * </ul>
 */
public final class DecisionWriter {

    private static final Logger log = LoggerFactory.getLogger(DecisionWriter.class);

    public enum Format { TEXT, JSON }

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /** JSON shape of a decision. */
    record JsonDecision(boolean runAll, List<String> testFiles, List<String> escalations, List<String> warnings) {

        static JsonDecision of(SelectionDecision decision) {
            return new JsonDecision(decision.runAll(), List.copyOf(decision.testFiles()),
                    decision.escalations(), decision.warnings());
        }
    }

    /**
     * @return {@code true} if a file was written
     */
    public boolean write(SelectionDecision decision, Path outputFile, Format format) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (format == Format.JSON) {
            mapper.writeValue(outputFile.toFile(), JsonDecision.of(decision));
            log.info("Decision written to {}", outputFile);
            return true;
        }
        if (decision.runAll()) {
            if (Files.deleteIfExists(outputFile)) {
                log.info("Removed stale {}", outputFile);
            }
            return false;
        }
        StringBuilder content = new StringBuilder();
        for (String testFile : decision.testFiles()) {
            content.append(testFile).append('\n');
        }
        Files.writeString(outputFile, content, StandardCharsets.UTF_8);
        log.info("{} test files written to {}", decision.testFiles().size(), outputFile);
        return true;
    }
}
