package com.codestyle.plugins.java;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.codestyle.api.Analyzer;
import com.codestyle.api.ProjectAnalysisContext;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Severity;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.FileType;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;

/**
 * Reports methods whose body spans more lines than {@code maxMethodLines}.
 */
public class MethodLengthAnalyzer implements Analyzer {
    public static final String RULE_ID = "JAVA003";

    @Override
    public String getId() {
        return "method-length";
    }

    @Override
    public Set<String> getSupportedDiagnosticIds() {
        return Set.of(RULE_ID);
    }

    @Override
    public List<Diagnostic> analyze(ProjectAnalysisContext context) {
        Severity severity = context.getOptions().getRuleSeverity(RULE_ID, Severity.WARNING);
        int maxMethodLines = context.getOptions().getRuleOption(RULE_ID, "maxLines",
                context.getOptions().get("maxMethodLines", 50));
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Document document : context.getDocuments()) {
            context.getCancellationToken().throwIfCancellationRequested();
            if (FileType.detect(document.getFilePath()) != FileType.JAVA) {
                continue;
            }

            Optional<CompilationUnit> cu = context.getCompilationUnit(document);
            if (cu.isEmpty()) {
                continue;
            }

            JavaLocations locations = new JavaLocations(document);
            for (MethodDeclaration method : cu.get().findAll(MethodDeclaration.class)) {
                Optional<BlockStmt> body = method.getBody();
                if (body.isEmpty()) {
                    continue;
                }

                int lineCount = _countBodyLines(body.get());
                if (lineCount <= maxMethodLines) {
                    continue;
                }
                locations.of(method.getName()).ifPresent(location -> diagnostics.add(new Diagnostic(
                        RULE_ID, getId(), severity,
                        "Method '" + method.getNameAsString() + "' is too long (" + lineCount +
                                " lines, max allowed is " + maxMethodLines + ")",
                        document.getId(), location,
                        "Consider breaking this method into smaller helper methods")));
            }
        }
        return diagnostics;
    }

    /**
     * Lines between the braces of the body, braces excluded.
     */
    private static int _countBodyLines(BlockStmt body) {
        return body.getRange()
                .map(range -> Math.max(0, range.end.line - range.begin.line - 1))
                .orElse(0);
    }
}
