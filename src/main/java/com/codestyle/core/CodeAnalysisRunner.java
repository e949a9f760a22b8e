package com.codestyle.core;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.codestyle.api.Analyzer;
import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.workspace.Project;

/**
 * Runs analyzers against a single project and records their findings.
 */
public interface CodeAnalysisRunner {

    /**
     * Runs {@code analyzers} as one batch against {@code project} and appends the retained
     * diagnostics to {@code result}. Safe to call concurrently for different projects sharing
     * the same result.
     *
     * @param restrictToPaths documents whose diagnostics are kept; empty keeps all documents
     * @throws com.codestyle.api.error.ProjectAnalysisException if an analyzer fails
     * @throws java.util.concurrent.CancellationException if cancellation was requested
     */
    void runCodeAnalysis(AnalysisResult result,
                         List<Analyzer> analyzers,
                         Project project,
                         AnalyzerOptions options,
                         Set<Path> restrictToPaths,
                         Logger logger,
                         CancellationToken cancellationToken);

    default void runCodeAnalysis(AnalysisResult result,
                                 Analyzer analyzer,
                                 Project project,
                                 AnalyzerOptions options,
                                 Set<Path> restrictToPaths,
                                 Logger logger,
                                 CancellationToken cancellationToken) {
        runCodeAnalysis(result, List.of(analyzer), project, options, restrictToPaths, logger, cancellationToken);
    }
}
