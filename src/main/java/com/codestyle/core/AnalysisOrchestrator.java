package com.codestyle.core;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.codestyle.api.Analyzer;
import com.codestyle.api.AnalyzerFixerPair;
import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.CodeFixer;
import com.codestyle.api.CodeFormatter;
import com.codestyle.api.FormatOptions;
import com.codestyle.api.FormatType;
import com.codestyle.api.FormatterResult;
import com.codestyle.api.error.ConfigurationException;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.util.DiagnosticFormatter;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.FormattableDocument;
import com.codestyle.workspace.Project;
import com.codestyle.workspace.Workspace;

/**
 * Runs the registered analyzers over a workspace and either reports their diagnostics or
 * applies their fixes.
 *
 * <p>Every analysis sweep runs one task per project and waits for all of them before moving
 * on. In fix mode the analyzer/fixer pairs are processed one at a time, in registry order,
 * each against the snapshot left behind by the previous pair. This is a single pass over the
 * pair list: a later fixer may reintroduce a violation an earlier pair already fixed.
 */
public class AnalysisOrchestrator implements CodeFormatter {

    public enum State {
        IDLE,
        ANALYZING,
        REPORTING,
        FIXING
    }

    private final AnalyzerRegistry registry;
    private final CodeAnalysisRunner runner;
    private final CodeFixApplier applier;
    private final int threadCount;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    public AnalysisOrchestrator(AnalyzerRegistry registry, CodeAnalysisRunner runner, CodeFixApplier applier) {
        this(registry, runner, applier, Runtime.getRuntime().availableProcessors());
    }

    public AnalysisOrchestrator(AnalyzerRegistry registry,
                                CodeAnalysisRunner runner,
                                CodeFixApplier applier,
                                int threadCount) {
        this.registry = registry;
        this.runner = runner;
        this.applier = applier;
        this.threadCount = Math.max(1, threadCount);
    }

    @Override
    public FormatType getFormatType() {
        return FormatType.CODE_STYLE;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Analyzes the formattable documents and, in fix mode, returns the fixed snapshot.
     * Cancellation is not an error: the result holds the best snapshot reached and is flagged cancelled.
     *
     * @throws ConfigurationException if no analyzers are registered or a document is unknown
     * @throws IllegalStateException if this orchestrator is already running
     */
    @Override
    public FormatterResult format(Workspace workspace,
                                  List<FormattableDocument> formattableDocuments,
                                  FormatOptions options,
                                  Logger logger,
                                  CancellationToken cancellationToken) {
        if (!state.compareAndSet(State.IDLE, State.ANALYZING)) {
            throw new IllegalStateException("A format run is already in progress");
        }

        Instant start = Instant.now();
        logger.fine("Analyzing code style.");
        FormatterResult.Builder result = FormatterResult.builder().workspace(workspace);

        try {
            List<AnalyzerFixerPair> pairs = registry.getAnalyzersAndFixers();
            if (pairs == null || pairs.isEmpty()) {
                throw new ConfigurationException("No analyzers are registered");
            }
            Set<Path> paths = resolvePaths(workspace, formattableDocuments);

            if (paths.isEmpty()) {
                logger.fine("No documents to analyze.");
            } else if (!options.isSaveFormattedFiles()) {
                logDiagnostics(workspace, pairs, paths, options, logger, cancellationToken, result);
            } else {
                fixDiagnostics(workspace, pairs, paths, options, logger, cancellationToken, result);
            }

            result.cancelled(cancellationToken.isCancellationRequested());
        } finally {
            Duration elapsed = Duration.between(start, Instant.now());
            result.elapsed(elapsed);
            logger.fine("Analysis complete in " + elapsed.toMillis() + "ms.");
            state.set(State.IDLE);
        }

        return result.build();
    }

    private void logDiagnostics(Workspace workspace,
                                List<AnalyzerFixerPair> pairs,
                                Set<Path> paths,
                                FormatOptions options,
                                Logger logger,
                                CancellationToken cancellationToken,
                                FormatterResult.Builder result) {
        // Fixes are never computed here since nothing is persisted.
        List<Analyzer> analyzers = pairs.stream()
                .map(AnalyzerFixerPair::getAnalyzer)
                .collect(Collectors.toList());

        AnalysisResult analysis = runSweep(workspace, analyzers, paths, logger, cancellationToken);
        result.addFailures(analysis.getFailures().size());

        state.set(State.REPORTING);
        List<Diagnostic> diagnostics = analysis.getAllDiagnostics();
        Path workspaceFolder = DiagnosticFormatter.resolveWorkspaceFolder(options.getWorkspaceFilePath() != null
                ? options.getWorkspaceFilePath()
                : workspace.getWorkspacePath());
        for (Diagnostic diagnostic : diagnostics) {
            String message = DiagnosticFormatter.toLogLine(diagnostic, workspaceFolder);
            if (options.isChangesAreErrors()) {
                logger.severe(message);
            } else {
                logger.warning(message);
            }
        }

        result.reportedDiagnostics(diagnostics)
                .errorsReported(options.isChangesAreErrors() && !diagnostics.isEmpty());
    }

    private void fixDiagnostics(Workspace workspace,
                                List<AnalyzerFixerPair> pairs,
                                Set<Path> paths,
                                FormatOptions options,
                                Logger logger,
                                CancellationToken cancellationToken,
                                FormatterResult.Builder result) {
        Workspace current = workspace;

        for (AnalyzerFixerPair pair : pairs) {
            if (cancellationToken.isCancellationRequested()) {
                break;
            }
            if (pair.isReportOnly()) {
                logger.finer("Skipping " + pair.getAnalyzer().getId() + ", it has no fixer.");
                continue;
            }

            CodeFixer fixer = pair.getFixer().get();
            boolean adopted = false;
            for (int pass = 1; pass <= options.getMaxFixPasses(); pass++) {
                state.set(State.ANALYZING);
                AnalysisResult analysis = runSweep(current, List.of(pair.getAnalyzer()), paths, logger, cancellationToken);
                result.addFailures(analysis.getFailures().size());

                if (cancellationToken.isCancellationRequested() || !analysis.hasDiagnostics()) {
                    break;
                }

                state.set(State.FIXING);
                logger.fine("Applying fixes for " + fixer.getId() + " (pass " + pass + ")");
                CodeFixResult fix = applier.applyCodeFixes(current, analysis, fixer, logger, cancellationToken);
                result.addFailures(fix.getFailedDocuments().size());

                Workspace fixed = fix.getWorkspace();
                if (fixed.getChangedDocuments(current).isEmpty()) {
                    break;
                }
                current = fixed;
                adopted = true;
            }

            if (adopted) {
                result.addAppliedFixer(fixer.getId());
            }
        }

        result.workspace(current);
    }

    /**
     * Runs {@code analyzers} over every project holding an eligible document, one task per
     * project, and waits for all tasks. A failing project is logged and recorded; cancelled
     * projects simply contribute nothing.
     */
    private AnalysisResult runSweep(Workspace workspace,
                                    List<Analyzer> analyzers,
                                    Set<Path> paths,
                                    Logger logger,
                                    CancellationToken cancellationToken) {
        AnalysisResult result = new AnalysisResult();
        List<Project> projects = workspace.getProjects().stream()
                .filter(project -> containsAny(project, paths))
                .collect(Collectors.toList());
        if (projects.isEmpty() || cancellationToken.isCancellationRequested()) {
            return result;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, projects.size()));
        try {
            Map<Project, Future<?>> futures = new LinkedHashMap<>();
            for (Project project : projects) {
                futures.put(project, executor.submit(() -> {
                    cancellationToken.throwIfCancellationRequested();
                    AnalyzerOptions projectOptions = registry.getAnalyzerOptions(project);
                    runner.runCodeAnalysis(result, analyzers, project, projectOptions, paths, logger, cancellationToken);
                }));
            }

            for (Map.Entry<Project, Future<?>> entry : futures.entrySet()) {
                Project project = entry.getKey();
                try {
                    entry.getValue().get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof CancellationException) {
                        logger.finer("Analysis of " + project.getName() + " cancelled.");
                        continue;
                    }
                    logger.log(Level.SEVERE, "Failed to analyze project " + project.getName() + ": " + cause.getMessage(), cause);
                    result.recordFailure(project.getId(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancellationToken.cancel();
                    logger.log(Level.WARNING, "Analysis interrupted", e);
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        return result;
    }

    private static Set<Path> resolvePaths(Workspace workspace, List<FormattableDocument> formattableDocuments) {
        Set<Path> paths = new LinkedHashSet<>();
        for (FormattableDocument formattable : formattableDocuments) {
            Document document = workspace.getDocument(formattable.getDocumentId())
                    .orElseThrow(() -> new ConfigurationException(
                            "Formattable document is not part of the workspace: " + formattable.getFilePath()));
            paths.add(document.getFilePath().toAbsolutePath().normalize());
        }
        return paths;
    }

    private static boolean containsAny(Project project, Set<Path> paths) {
        for (Document document : project.getDocuments()) {
            if (paths.contains(document.getFilePath().toAbsolutePath().normalize())) {
                return true;
            }
        }
        return false;
    }
}
