package com.codestyle.core;

import java.util.logging.Logger;

import com.codestyle.api.CancellationToken;
import com.codestyle.api.CodeFixer;
import com.codestyle.workspace.Workspace;

/**
 * Applies one fixer to every document with fixable diagnostics.
 */
public interface CodeFixApplier {

    /**
     * Computes and applies {@code fixer}'s edits for the documents in {@code result}.
     * Failures are isolated per document: a failing document keeps its text, others still change.
     * The input snapshot is never modified.
     */
    CodeFixResult applyCodeFixes(Workspace workspace,
                                 AnalysisResult result,
                                 CodeFixer fixer,
                                 Logger logger,
                                 CancellationToken cancellationToken);
}
