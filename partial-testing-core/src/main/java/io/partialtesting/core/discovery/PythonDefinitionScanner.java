package io.partialtesting.core.discovery;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based scanner for Python test modules. Collects {@code def}, {@code async def} and
 * {@code class} names at any indentation; functions and methods named {@code test*} are tests,
 * matching pytest's default {@code python_functions}.
 *
 * <p>Also the fallback for code extensions no other scanner supports.
 */
public final class PythonDefinitionScanner implements TestDefinitionScanner {

    private static final Pattern DEF = Pattern.compile("^\\s*(?:async\\s+)?def\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");
    private static final Pattern CLASS = Pattern.compile("^\\s*class\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*[(:]");

    @Override
    public String name() {
        return "python";
    }

    @Override
    public boolean supports(Path file) {
        return true;
    }

    @Override
    public FileDefinitions scan(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        return scanLines(lines);
    }

    static FileDefinitions scanLines(List<String> lines) {
        Set<String> symbols = new LinkedHashSet<>();
        Set<String> tests = new LinkedHashSet<>();
        for (String line : lines) {
            Matcher def = DEF.matcher(line);
            if (def.find()) {
                String name = def.group(1);
                symbols.add(name);
                if (name.startsWith("test")) {
                    tests.add(name);
                }
                continue;
            }
            Matcher cls = CLASS.matcher(line);
            if (cls.find()) {
                symbols.add(cls.group(1));
            }
        }
        return new FileDefinitions(symbols, tests);
    }
}
