package com.codestyle.plugins.whitespace;

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
 * Replaces indentation containing tabs by spaces, keeping every tab stop's column.
 */
public class TabIndentationFixer implements CodeFixer {

    @Override
    public String getId() {
        return "tab-indentation-fix";
    }

    @Override
    public Set<String> getFixableDiagnosticIds() {
        return Set.of(TabIndentationAnalyzer.RULE_ID);
    }

    @Override
    public List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options)
            throws CodeFixException {
        int tabWidth = Math.max(1, options.get("tabWidth", 4));
        String text = document.getText();
        List<TextEdit> edits = new ArrayList<>();

        for (Diagnostic diagnostic : diagnostics) {
            int start = diagnostic.getLocation().getStartOffset();
            int end = diagnostic.getLocation().getEndOffset();
            if (end > text.length()) {
                throw new CodeFixException("Diagnostic " + diagnostic + " is outside of " + document.getFilePath());
            }

            StringBuilder spaces = new StringBuilder();
            int column = 0;
            for (int i = start; i < end; i++) {
                char c = text.charAt(i);
                if (c == '\t') {
                    int width = tabWidth - (column % tabWidth);
                    spaces.append(" ".repeat(width));
                    column += width;
                } else if (c == ' ') {
                    spaces.append(' ');
                    column++;
                } else {
                    throw new CodeFixException("Unexpected character in indentation at offset " + i + " of " + document.getFilePath());
                }
            }
            edits.add(new TextEdit(start, end, spaces.toString()));
        }
        return edits;
    }
}
