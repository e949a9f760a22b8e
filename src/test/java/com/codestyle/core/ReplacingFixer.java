package com.codestyle.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CodeFixer;
import com.codestyle.api.TextEdit;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.workspace.Document;

/**
 * Fixer replacing each diagnostic span with a fixed text, optionally only the first one per document.
 */
class ReplacingFixer implements CodeFixer {
    private final String ruleId;
    private final String replacement;
    private final boolean firstOnly;

    ReplacingFixer(String ruleId, String replacement) {
        this(ruleId, replacement, false);
    }

    ReplacingFixer(String ruleId, String replacement, boolean firstOnly) {
        this.ruleId = ruleId;
        this.replacement = replacement;
        this.firstOnly = firstOnly;
    }

    @Override
    public String getId() {
        return "replace-" + ruleId;
    }

    @Override
    public Set<String> getFixableDiagnosticIds() {
        return Set.of(ruleId);
    }

    @Override
    public List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options) {
        List<TextEdit> edits = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            edits.add(new TextEdit(diagnostic.getLocation().getStartOffset(),
                    diagnostic.getLocation().getEndOffset(), replacement));
            if (firstOnly) {
                break;
            }
        }
        return edits;
    }
}
