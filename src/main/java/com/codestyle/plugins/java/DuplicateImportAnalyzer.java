package com.codestyle.plugins.java;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.codestyle.api.Analyzer;
import com.codestyle.api.ProjectAnalysisContext;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Location;
import com.codestyle.api.error.Severity;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.FileType;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;

/**
 * Flags every import declaration repeating an earlier one in the same file.
 */
public class DuplicateImportAnalyzer implements Analyzer {
    public static final String RULE_ID = "JAVA001";

    @Override
    public String getId() {
        return "duplicate-import";
    }

    @Override
    public Set<String> getSupportedDiagnosticIds() {
        return Set.of(RULE_ID);
    }

    @Override
    public List<Diagnostic> analyze(ProjectAnalysisContext context) {
        Severity severity = context.getOptions().getRuleSeverity(RULE_ID, Severity.WARNING);
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
            Set<String> seen = new HashSet<>();
            for (ImportDeclaration importDecl : cu.get().getImports()) {
                String key = _importKey(importDecl);
                if (seen.add(key)) {
                    continue;
                }

                Optional<Location> location = locations.of(importDecl);
                if (location.isEmpty()) {
                    continue;
                }
                diagnostics.add(new Diagnostic(RULE_ID, getId(), severity,
                        "Duplicate import: " + importDecl.getNameAsString(),
                        document.getId(), location.get(), "Remove the duplicate import"));
            }
        }
        return diagnostics;
    }

    private static String _importKey(ImportDeclaration importDecl) {
        return (importDecl.isStatic() ? "static " : "") + importDecl.getNameAsString()
                + (importDecl.isAsterisk() ? ".*" : "");
    }
}
