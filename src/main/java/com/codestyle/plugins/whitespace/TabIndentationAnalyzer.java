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
 * Flags lines whose indentation contains a tab character.
 */
public class TabIndentationAnalyzer implements Analyzer {
    public static final String RULE_ID = "WS001";

    @Override
    public String getId() {
        return "tab-indentation";
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
                int indentEnd = lines.start();
                int firstTab = -1;
                while (indentEnd < lines.end() && (text.charAt(indentEnd) == ' ' || text.charAt(indentEnd) == '\t')) {
                    if (firstTab < 0 && text.charAt(indentEnd) == '\t') {
                        firstTab = indentEnd;
                    }
                    indentEnd++;
                }
                if (firstTab < 0) {
                    continue;
                }

                Location location = Location.builder()
                        .filePath(document.getFilePath())
                        .start(lines.lineNumber(), firstTab - lines.start() + 1)
                        .end(lines.lineNumber(), indentEnd - lines.start() + 1)
                        .offsets(lines.start(), indentEnd)
                        .build();
                diagnostics.add(new Diagnostic(RULE_ID, getId(), severity,
                        "Tab character used for indentation.", document.getId(), location,
                        "Indent with spaces"));
            }
        }
        return diagnostics;
    }
}
