package com.codestyle.plugins.whitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.codestyle.api.Analyzer;
import com.codestyle.api.ProjectAnalysisContext;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Location;
import com.codestyle.api.error.Severity;
import com.codestyle.workspace.Document;

/**
 * Flags spaces and tabs at the end of a line.
 */
public class TrailingWhitespaceAnalyzer implements Analyzer {
    public static final String RULE_ID = "WS002";

    @Override
    public String getId() {
        return "trailing-whitespace";
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

            String text = document.getText();
            LineScanner lines = new LineScanner(text);
            while (lines.next()) {
                int trailingStart = lines.end();
                while (trailingStart > lines.start()
                        && (text.charAt(trailingStart - 1) == ' ' || text.charAt(trailingStart - 1) == '\t')) {
                    trailingStart--;
                }
                if (trailingStart == lines.end()) {
                    continue;
                }

                Location location = Location.builder()
                        .filePath(document.getFilePath())
                        .start(lines.lineNumber(), trailingStart - lines.start() + 1)
                        .end(lines.lineNumber(), lines.end() - lines.start() + 1)
                        .offsets(trailingStart, lines.end())
                        .build();
                diagnostics.add(new Diagnostic(RULE_ID, getId(), severity,
                        "Trailing whitespace.", document.getId(), location));
            }
        }
        return diagnostics;
    }
}
