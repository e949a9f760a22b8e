package com.codestyle.plugins.whitespace;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CodeFixer;
import com.codestyle.api.TextEdit;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.workspace.Document;

public class TrailingWhitespaceFixer implements CodeFixer {

    @Override
    public String getId() {
        return "trailing-whitespace-fix";
    }

    @Override
    public Set<String> getFixableDiagnosticIds() {
        return Set.of(TrailingWhitespaceAnalyzer.RULE_ID);
    }

    @Override
    public List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options) {
        return diagnostics.stream()
                .map(d -> TextEdit.delete(d.getLocation().getStartOffset(), d.getLocation().getEndOffset()))
                .collect(Collectors.toList());
    }
}
