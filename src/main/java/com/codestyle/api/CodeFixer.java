package com.codestyle.api;

import java.util.List;
import java.util.Set;

import com.codestyle.api.error.CodeFixException;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.workspace.Document;

/**
 * Computes the edits resolving diagnostics in a single document.
 * Implementations must be stateless; documents are fixed concurrently.
 */
public interface CodeFixer {

    String getId();

    /**
     * Rule ids whose diagnostics this fixer can resolve.
     */
    Set<String> getFixableDiagnosticIds();

    /**
     * Returns the edits for {@code document}. Offsets refer to the document's current text.
     *
     * @param diagnostics the fixable diagnostics reported for the document, in location order
     * @throws CodeFixException if no edit can be produced for the document
     */
    List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options)
            throws CodeFixException;

    default boolean canFix(Diagnostic diagnostic) {
        return getFixableDiagnosticIds().contains(diagnostic.getId());
    }
}
