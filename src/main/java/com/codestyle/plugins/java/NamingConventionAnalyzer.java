package com.codestyle.plugins.java;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.codestyle.api.Analyzer;
import com.codestyle.api.ProjectAnalysisContext;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Severity;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.FileType;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;

/**
 * Reports type, method, field and constant names that break Java naming conventions.
 * Report only: renaming is left to the developer.
 */
public class NamingConventionAnalyzer implements Analyzer {
    public static final String RULE_ID = "JAVA002";

    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    private static final Pattern CAMEL_CASE = Pattern.compile("^[a-z][a-zA-Z0-9]*$");
    private static final Pattern SCREAMING_SNAKE_CASE = Pattern.compile("^[A-Z][A-Z0-9]*(_[A-Z0-9]+)*$");

    @Override
    public String getId() {
        return "naming-convention";
    }

    @Override
    public Set<String> getSupportedDiagnosticIds() {
        return Set.of(RULE_ID);
    }

    @Override
    public List<Diagnostic> analyze(ProjectAnalysisContext context) {
        Severity severity = context.getOptions().getRuleSeverity(RULE_ID, Severity.INFO);
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
            _checkTypeNaming(cu.get(), document, locations, severity, diagnostics);
            _checkMethodNaming(cu.get(), document, locations, severity, diagnostics);
            _checkFieldNaming(cu.get(), document, locations, severity, diagnostics);
        }
        return diagnostics;
    }

    private void _checkTypeNaming(CompilationUnit cu, Document document, JavaLocations locations,
                                  Severity severity, List<Diagnostic> diagnostics) {
        cu.findAll(ClassOrInterfaceDeclaration.class).forEach(type -> {
            String name = type.getNameAsString();
            if (!PASCAL_CASE.matcher(name).matches()) {
                _report(type.getName(), document, locations, severity,
                        "Type name '" + name + "' doesn't follow PascalCase convention", diagnostics);
            }
        });
    }

    private void _checkMethodNaming(CompilationUnit cu, Document document, JavaLocations locations,
                                    Severity severity, List<Diagnostic> diagnostics) {
        cu.findAll(MethodDeclaration.class).forEach(method -> {
            String name = method.getNameAsString();
            if (!CAMEL_CASE.matcher(name).matches()) {
                _report(method.getName(), document, locations, severity,
                        "Method name '" + name + "' doesn't follow camelCase convention", diagnostics);
            }
        });
    }

    private void _checkFieldNaming(CompilationUnit cu, Document document, JavaLocations locations,
                                   Severity severity, List<Diagnostic> diagnostics) {
        cu.findAll(FieldDeclaration.class).forEach(field -> {
            boolean constant = field.isStatic() && field.isFinal();
            for (VariableDeclarator variable : field.getVariables()) {
                String name = variable.getNameAsString();
                if (constant && !SCREAMING_SNAKE_CASE.matcher(name).matches()) {
                    _report(variable.getName(), document, locations, severity,
                            "Constant '" + name + "' should use UPPER_SNAKE_CASE", diagnostics);
                } else if (!constant && !CAMEL_CASE.matcher(name).matches()) {
                    _report(variable.getName(), document, locations, severity,
                            "Field name '" + name + "' doesn't follow camelCase convention", diagnostics);
                }
            }
        });
    }

    private void _report(Node node, Document document, JavaLocations locations, Severity severity,
                         String message, List<Diagnostic> diagnostics) {
        locations.of(node).ifPresent(location -> diagnostics.add(
                new Diagnostic(RULE_ID, getId(), severity, message, document.getId(), location)));
    }
}
