package io.partialtesting.core.discovery;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PythonDefinitionScannerTest {

    @TempDir
    Path tempDir;

    private final PythonDefinitionScanner scanner = new PythonDefinitionScanner();

    @Test
    void collectsFunctionsMethodsAndClasses() throws IOException {
        Path file = tempDir.resolve("test_mod.py");
        Files.writeString(file, """
                import pytest

                def helper(x):
                    return x

                def test_top_level():
                    assert helper(1) == 1

                async def test_async():
                    pass

                class TestThing:
                    def setup_method(self):
                        pass

                    def test_method(self):
                        pass

                class Fixture(object):
                    pass
                """);

        FileDefinitions definitions = scanner.scan(file);

        assertEquals(Set.of("helper", "test_top_level", "test_async", "TestThing", "setup_method",
                "test_method", "Fixture"), definitions.symbols());
        assertEquals(Set.of("test_top_level", "test_async", "test_method"), definitions.tests());
        assertTrue(definitions.hasTests());
        assertTrue(definitions.defines("helper"));
    }

    @Test
    void helperModuleHasNoTests() throws IOException {
        Path file = tempDir.resolve("helpers.py");
        Files.writeString(file, "def make_user():\n    return {}\n");

        FileDefinitions definitions = scanner.scan(file);

        assertFalse(definitions.hasTests());
        assertTrue(definitions.defines("make_user"));
    }

    @Test
    void ignoresNamesInsideStringsAndCalls() throws IOException {
        Path file = tempDir.resolve("test_calls.py");
        Files.writeString(file, "x = 'def test_fake():'\nresult = undefined_test()\n");

        assertFalse(scanner.scan(file).hasTests());
    }

    @Test
    void handlesAnyFileAsPython() {
        assertEquals("python", scanner.name());
        assertTrue(scanner.supports(Path.of("tests/test_a.py")));
    }

    @Test
    void missingFileThrows() {
        assertThrows(IOException.class, () -> scanner.scan(tempDir.resolve("absent.py")));
    }
}
