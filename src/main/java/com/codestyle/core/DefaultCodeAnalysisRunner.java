package com.codestyle.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.codestyle.api.Analyzer;
import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.ProjectAnalysisContext;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.ProjectAnalysisException;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.Project;

/**
 * Runs a batch of analyzers sequentially over one shared {@link ProjectAnalysisContext}.
 *
 * <p>Findings are buffered until the whole batch succeeds and only then merged into the
 * shared result, so a failing or cancelled project leaves no partial entries behind.
 */
public class DefaultCodeAnalysisRunner implements CodeAnalysisRunner {

    @Override
    public void runCodeAnalysis(AnalysisResult result,
                                List<Analyzer> analyzers,
                                Project project,
                                AnalyzerOptions options,
                                Set<Path> restrictToPaths,
                                Logger logger,
                                CancellationToken cancellationToken) {
        if (analyzers.isEmpty()) {
            throw new IllegalArgumentException("At least one analyzer is required");
        }
        cancellationToken.throwIfCancellationRequested();

        Set<Path> allowedPaths = normalize(restrictToPaths);
        ProjectAnalysisContext context = new ProjectAnalysisContext(project, options, cancellationToken);
        List<Diagnostic> retained = new ArrayList<>();

        for (Analyzer analyzer : analyzers) {
            cancellationToken.throwIfCancellationRequested();

            List<Diagnostic> found;
            try {
                found = analyzer.analyze(context);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ProjectAnalysisException(project.getName(), analyzer.getId(), e);
            }

            int kept = 0;
            for (Diagnostic diagnostic : found) {
                if (isRetained(diagnostic, project, context.getOptions(), allowedPaths)) {
                    retained.add(diagnostic);
                    kept++;
                }
            }
            logger.finer("Analyzer " + analyzer.getId() + " reported " + kept + " diagnostics in " + project.getName());
        }

        cancellationToken.throwIfCancellationRequested();
        int added = result.addDiagnostics(retained);
        logger.fine("Recorded " + added + " diagnostics for project " + project.getName());
    }

    private static boolean isRetained(Diagnostic diagnostic, Project project, AnalyzerOptions options, Set<Path> allowedPaths) {
        Document document = project.getDocument(diagnostic.getDocumentId()).orElse(null);
        if (document == null) {
            return false;
        }
        if (!options.isRuleEnabled(diagnostic.getId())) {
            return false;
        }
        return allowedPaths.isEmpty() || allowedPaths.contains(normalize(document.getFilePath()));
    }

    private static Set<Path> normalize(Set<Path> paths) {
        if (paths == null || paths.isEmpty()) {
            return Set.of();
        }
        return paths.stream().map(DefaultCodeAnalysisRunner::normalize).collect(Collectors.toSet());
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
