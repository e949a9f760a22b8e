package com.codestyle.plugins.java;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CodeFixer;
import com.codestyle.api.TextEdit;
import com.codestyle.api.error.CodeFixException;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.workspace.Document;

/**
 * Removes duplicate import declarations. An import alone on its line is removed with its line.
 */
public class DuplicateImportFixer implements CodeFixer {

    @Override
    public String getId() {
        return "duplicate-import-fix";
    }

    @Override
    public Set<String> getFixableDiagnosticIds() {
        return Set.of(DuplicateImportAnalyzer.RULE_ID);
    }

    @Override
    public List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options)
            throws CodeFixException {
        String text = document.getText();
        List<TextEdit> edits = new ArrayList<>();

        for (Diagnostic diagnostic : diagnostics) {
            int start = diagnostic.getLocation().getStartOffset();
            int end = diagnostic.getLocation().getEndOffset();
            if (end > text.length() || !text.startsWith("import", start)) {
                throw new CodeFixException("Diagnostic " + diagnostic + " does not point at an import in "
                        + document.getFilePath());
            }

            int lineStart = start;
            while (lineStart > 0 && (text.charAt(lineStart - 1) == ' ' || text.charAt(lineStart - 1) == '\t')) {
                lineStart--;
            }
            int lineEnd = end;
            while (lineEnd < text.length() && (text.charAt(lineEnd) == ' ' || text.charAt(lineEnd) == '\t')) {
                lineEnd++;
            }

            boolean ownsLine = (lineStart == 0 || _isLineBreak(text.charAt(lineStart - 1)))
                    && (lineEnd == text.length() || _isLineBreak(text.charAt(lineEnd)));
            if (!ownsLine) {
                edits.add(TextEdit.delete(start, end));
                continue;
            }

            if (lineEnd < text.length() && text.charAt(lineEnd) == '\r') {
                lineEnd++;
            }
            if (lineEnd < text.length() && text.charAt(lineEnd) == '\n') {
                lineEnd++;
            }
            edits.add(TextEdit.delete(lineStart, lineEnd));
        }
        return edits;
    }

    private static boolean _isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
