package com.codestyle.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.CodeFixer;
import com.codestyle.api.TextEdit;
import com.codestyle.api.error.CodeFixException;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.DocumentId;
import com.codestyle.workspace.Project;
import com.codestyle.workspace.Workspace;

/**
 * Computes document edits on a worker pool and folds them into a new workspace snapshot.
 */
public class DefaultCodeFixApplier implements CodeFixApplier {
    private final int threadCount;
    private final Function<Project, AnalyzerOptions> optionsProvider;

    public DefaultCodeFixApplier(AnalyzerRegistry registry, int threadCount) {
        this(threadCount, registry::getAnalyzerOptions);
    }

    public DefaultCodeFixApplier(int threadCount, Function<Project, AnalyzerOptions> optionsProvider) {
        this.threadCount = Math.max(1, threadCount);
        this.optionsProvider = optionsProvider;
    }

    @Override
    public CodeFixResult applyCodeFixes(Workspace workspace,
                                        AnalysisResult result,
                                        CodeFixer fixer,
                                        Logger logger,
                                        CancellationToken cancellationToken) {
        Map<Document, List<Diagnostic>> work = collectFixableDocuments(workspace, result, fixer, logger);
        if (work.isEmpty()) {
            logger.fine("No fixable diagnostics for " + fixer.getId());
            return new CodeFixResult(workspace, List.of(), List.of());
        }

        Map<Project, AnalyzerOptions> optionsByProject = new LinkedHashMap<>();
        Map<DocumentId, Future<String>> futures = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, work.size()));
        try {
            for (Map.Entry<Document, List<Diagnostic>> entry : work.entrySet()) {
                Document document = entry.getKey();
                Project project = workspace.getProject(document.getId().getProjectId()).orElseThrow();
                AnalyzerOptions options = optionsByProject.computeIfAbsent(project, optionsProvider);
                futures.put(document.getId(), executor.submit(
                        () -> fixDocument(document, entry.getValue(), fixer, options, logger, cancellationToken)));
            }

            Map<DocumentId, String> newTexts = new LinkedHashMap<>();
            List<DocumentId> failed = new ArrayList<>();
            for (Map.Entry<DocumentId, Future<String>> entry : futures.entrySet()) {
                Document document = workspace.getDocument(entry.getKey()).orElseThrow();
                try {
                    String text = entry.getValue().get();
                    if (!text.equals(document.getText())) {
                        newTexts.put(entry.getKey(), text);
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof CancellationException) {
                        logger.fine("Fix skipped after cancellation: " + document.getFilePath());
                        continue;
                    }
                    failed.add(entry.getKey());
                    logger.log(Level.WARNING, "Failed to apply " + fixer.getId() + " to " + document.getFilePath()
                            + ": " + cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancellationToken.cancel();
                    logger.log(Level.WARNING, "Interrupted while applying " + fixer.getId(), e);
                    break;
                }
            }

            Workspace updated = workspace.withDocumentTexts(newTexts);
            return new CodeFixResult(updated, updated.getChangedDocuments(workspace), failed);
        } finally {
            executor.shutdownNow();
        }
    }

    private Map<Document, List<Diagnostic>> collectFixableDocuments(Workspace workspace,
                                                                     AnalysisResult result,
                                                                     CodeFixer fixer,
                                                                     Logger logger) {
        Map<Document, List<Diagnostic>> work = new LinkedHashMap<>();
        for (Map.Entry<DocumentId, List<Diagnostic>> entry : result.getDiagnostics().entrySet()) {
            List<Diagnostic> fixable = entry.getValue().stream()
                    .filter(fixer::canFix)
                    .sorted(Comparator.comparingInt((Diagnostic d) -> d.getLocation().getStartOffset())
                            .thenComparingInt(d -> d.getLocation().getEndOffset()))
                    .collect(Collectors.toList());
            if (fixable.isEmpty()) {
                continue;
            }

            Document document = workspace.getDocument(entry.getKey()).orElse(null);
            if (document == null) {
                logger.warning("Diagnostics reported for a document missing from the workspace: " + entry.getKey());
                continue;
            }
            work.put(document, fixable);
        }
        return work;
    }

    private static String fixDocument(Document document,
                                      List<Diagnostic> diagnostics,
                                      CodeFixer fixer,
                                      AnalyzerOptions options,
                                      Logger logger,
                                      CancellationToken cancellationToken) throws CodeFixException {
        cancellationToken.throwIfCancellationRequested();

        List<TextEdit> edits = fixer.computeEdits(document, diagnostics, options);
        if (edits == null || edits.isEmpty()) {
            return document.getText();
        }

        TextEditMerger.Merge merge = TextEditMerger.merge(edits);
        for (TextEdit rejected : merge.getRejected()) {
            logger.fine("Rejected overlapping edit " + rejected + " in " + document.getFilePath());
        }
        try {
            return TextEditMerger.apply(document.getText(), merge.getAccepted());
        } catch (IllegalArgumentException e) {
            throw new CodeFixException("Invalid edit from " + fixer.getId() + " in " + document.getFilePath(), e);
        }
    }
}
