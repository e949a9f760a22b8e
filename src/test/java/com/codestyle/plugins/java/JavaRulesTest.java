package com.codestyle.plugins.java;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.ProjectAnalysisContext;
import com.codestyle.api.error.CodeFixException;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Severity;
import com.codestyle.core.TextEditMerger;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.Project;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.codestyle.workspace.WorkspaceFixtures.project;
import static org.junit.jupiter.api.Assertions.*;

class JavaRulesTest {
    private static final String SOURCE = String.join("\n",
            "package demo;",
            "",
            "import java.util.List;",
            "import java.util.Map;",
            "import java.util.List;",
            "",
            "public class bad_name {",
            "    static final int maxCount = 3;",
            "    private int Counter;",
            "",
            "    void DoThing() {",
            "        int a = 1;",
            "        int b = 2;",
            "        int c = 3;",
            "    }",
            "}",
            "");

    private static ProjectAnalysisContext context(Project project, AnalyzerOptions options) {
        return new ProjectAnalysisContext(project, options, CancellationToken.NONE);
    }

    @Test
    void duplicateImportIsReportedAtTheRepeatedDeclaration() {
        Project project = project("Java.javaproj", "src/Demo.java", SOURCE);

        List<Diagnostic> diagnostics = new DuplicateImportAnalyzer().analyze(context(project, AnalyzerOptions.EMPTY));

        assertEquals(1, diagnostics.size());
        assertEquals(5, diagnostics.get(0).getLine());
        assertEquals(1, diagnostics.get(0).getColumn());
        assertEquals("Duplicate import: java.util.List", diagnostics.get(0).getMessage());
    }

    @Test
    void duplicateImportFixRemovesTheWholeLine() throws CodeFixException {
        Project project = project("Java.javaproj", "src/Demo.java", SOURCE);
        Document document = project.getDocuments().get(0);
        List<Diagnostic> diagnostics = new DuplicateImportAnalyzer().analyze(context(project, AnalyzerOptions.EMPTY));

        String fixed = TextEditMerger.apply(document.getText(),
                new DuplicateImportFixer().computeEdits(document, diagnostics, AnalyzerOptions.EMPTY));

        assertEquals(SOURCE.replace("import java.util.Map;\nimport java.util.List;\n", "import java.util.Map;\n"), fixed);
    }

    @Test
    void staticAndWildcardImportsAreDistinct() {
        Project project = project("Java.javaproj", "src/A.java", String.join("\n",
                "import java.util.List;",
                "import static java.util.List.of;",
                "import java.util.*;",
                "class A {}"));

        assertTrue(new DuplicateImportAnalyzer().analyze(context(project, AnalyzerOptions.EMPTY)).isEmpty());
    }

    @Test
    void namingViolationsAreReportedAsInfo() {
        Project project = project("Java.javaproj", "src/Demo.java", SOURCE);

        List<Diagnostic> diagnostics = new NamingConventionAnalyzer().analyze(context(project, AnalyzerOptions.EMPTY));

        List<String> messages = diagnostics.stream().map(Diagnostic::getMessage).collect(Collectors.toList());
        assertEquals(List.of(
                "Type name 'bad_name' doesn't follow PascalCase convention",
                "Method name 'DoThing' doesn't follow camelCase convention",
                "Constant 'maxCount' should use UPPER_SNAKE_CASE",
                "Field name 'Counter' doesn't follow camelCase convention"), messages);
        assertTrue(diagnostics.stream().allMatch(d -> d.getSeverity() == Severity.INFO));
        assertEquals(7, diagnostics.get(0).getLine());
        assertEquals(14, diagnostics.get(0).getColumn());
    }

    @Test
    void longMethodIsReportedAgainstTheConfiguredLimit() {
        Project project = project("Java.javaproj", "src/Demo.java", SOURCE);

        List<Diagnostic> withDefault = new MethodLengthAnalyzer().analyze(context(project, AnalyzerOptions.EMPTY));
        List<Diagnostic> withLimit = new MethodLengthAnalyzer().analyze(context(project,
                new AnalyzerOptions(Map.of("maxMethodLines", 2), Map.of())));

        assertTrue(withDefault.isEmpty());
        assertEquals(1, withLimit.size());
        assertEquals("Method 'DoThing' is too long (3 lines, max allowed is 2)", withLimit.get(0).getMessage());
        assertEquals(11, withLimit.get(0).getLine());
    }

    @Test
    void ruleOptionOverridesLanguageOption() {
        Project project = project("Java.javaproj", "src/Demo.java", SOURCE);
        AnalyzerOptions options = new AnalyzerOptions(Map.of("maxMethodLines", 2),
                Map.of(MethodLengthAnalyzer.RULE_ID, Map.of("maxLines", 5)));

        assertTrue(new MethodLengthAnalyzer().analyze(context(project, options)).isEmpty());
    }

    @Test
    void unparsableAndNonJavaDocumentsAreSkipped() {
        Project project = project("Mixed",
                "src/Broken.java", "class {",
                "web/app.js", "import a from 'a';\nimport a from 'a';\n");

        assertTrue(new DuplicateImportAnalyzer().analyze(context(project, AnalyzerOptions.EMPTY)).isEmpty());
        assertTrue(new NamingConventionAnalyzer().analyze(context(project, AnalyzerOptions.EMPTY)).isEmpty());
    }
}
