package io.partialtesting.core.discovery;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scanner for Java test classes, parsed with JavaParser at its newest language level.
 * <p>
 * Symbols are the declared type and method names; tests are methods carrying a JUnit test
 * annotation ({@code @Test}, {@code @ParameterizedTest}, {@code @RepeatedTest},
 * {@code @TestFactory}, {@code @TestTemplate}), simple or fully-qualified.
 * A file that does not parse is reported as unreadable rather than as a file without tests.
 */
public final class JavaDefinitionScanner implements TestDefinitionScanner {

    private static final Logger log = LoggerFactory.getLogger(JavaDefinitionScanner.class);

    private static final Set<String> TEST_ANNOTATIONS = Set.of(
            "Test", "ParameterizedTest", "RepeatedTest", "TestFactory", "TestTemplate");

    private final JavaParser parser = new JavaParser(
            new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.BLEEDING_EDGE));

    @Override
    public String name() {
        return "java";
    }

    @Override
    public boolean supports(Path file) {
        return file.toString().endsWith(".java");
    }

    @Override
    public FileDefinitions scan(Path file) throws IOException {
        ParseResult<CompilationUnit> result = parser.parse(file);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.warn("Failed to parse {}: {}", file, result.getProblems());
            throw new IOException("Cannot parse " + file.getFileName() + ": " + result.getProblems());
        }
        CompilationUnit cu = result.getResult().get();

        Set<String> symbols = new LinkedHashSet<>();
        Set<String> tests = new LinkedHashSet<>();

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            symbols.add(type.getNameAsString());
        }
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            String name = method.getNameAsString();
            symbols.add(name);
            boolean isTest = method.getAnnotations().stream()
                    .map(a -> simpleName(a.getNameAsString()))
                    .anyMatch(TEST_ANNOTATIONS::contains);
            if (isTest) {
                tests.add(name);
            }
        }
        return new FileDefinitions(symbols, tests);
    }

    private static String simpleName(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }
}
