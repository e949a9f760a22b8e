package com.codestyle.api;

import java.util.List;
import java.util.Set;

import com.codestyle.api.error.Diagnostic;

/**
 * Inspects a project and reports style diagnostics.
 * Implementations must be stateless; the engine calls them concurrently for different projects.
 */
public interface Analyzer {

    /**
     * Unique id of the analyzer, used in logs and configuration.
     */
    String getId();

    /**
     * Rule ids this analyzer may report.
     */
    Set<String> getSupportedDiagnosticIds();

    /**
     * Analyzes the project held by {@code context}.
     * Implementations should poll {@link ProjectAnalysisContext#getCancellationToken()} between documents.
     */
    List<Diagnostic> analyze(ProjectAnalysisContext context);
}
