package com.codestyle.core;

import com.codestyle.api.Analyzer;
import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.ProjectAnalysisException;
import com.codestyle.util.CapturingHandler;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

import static com.codestyle.workspace.WorkspaceFixtures.ROOT;
import static com.codestyle.workspace.WorkspaceFixtures.project;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DefaultCodeAnalysisRunnerTest {

    private DefaultCodeAnalysisRunner runner;
    private Logger logger;
    private Project project;

    @BeforeEach
    void setUp() {
        runner = new DefaultCodeAnalysisRunner();
        logger = new CapturingHandler().newLogger();
        project = project("Java.javaproj",
                "src/A.java", "class A { TODO }",
                "src/B.java", "class B { TODO }");
    }

    @Test
    void emptyRestrictionKeepsEveryDocument() {
        AnalysisResult result = new AnalysisResult();

        runner.runCodeAnalysis(result, StubAnalyzer.marker("R1", "TODO"), project,
                AnalyzerOptions.EMPTY, Set.of(), logger, CancellationToken.NONE);

        assertEquals(2, result.getDiagnostics().size());
    }

    @Test
    void restrictionDropsDiagnosticsOfOtherDocuments() {
        AnalysisResult result = new AnalysisResult();
        Document a = project.getDocuments().get(0);

        runner.runCodeAnalysis(result, StubAnalyzer.marker("R1", "TODO"), project,
                AnalyzerOptions.EMPTY, Set.of(ROOT.resolve("src/../src/A.java")), logger, CancellationToken.NONE);

        assertEquals(Set.of(a.getId()), result.getDiagnostics().keySet());
    }

    @Test
    void diagnosticsForDocumentsOutsideTheProjectAreDropped() {
        AnalysisResult result = new AnalysisResult();
        Project other = project("Other", "src/C.java", "TODO");
        Document foreign = other.getDocuments().get(0);
        Analyzer analyzer = new StubAnalyzer("R1", context -> StubAnalyzer.occurrences("R1", foreign, "TODO"));

        runner.runCodeAnalysis(result, analyzer, project, AnalyzerOptions.EMPTY, Set.of(), logger, CancellationToken.NONE);

        assertFalse(result.hasDiagnostics());
    }

    @Test
    void disabledRuleIsFilteredOut() {
        AnalysisResult result = new AnalysisResult();
        AnalyzerOptions options = new AnalyzerOptions(Map.of(), Map.of("R1", Map.of("enabled", false)));

        runner.runCodeAnalysis(result, List.of(StubAnalyzer.marker("R1", "TODO"), StubAnalyzer.marker("R2", "class")),
                project, options, Set.of(), logger, CancellationToken.NONE);

        assertEquals(2, result.getDiagnosticCount());
        assertTrue(result.getAllDiagnostics().stream().allMatch(d -> d.getId().equals("R2")));
    }

    @Test
    void failingAnalyzerLeavesNoPartialResults() {
        AnalysisResult result = new AnalysisResult();
        Analyzer failing = new StubAnalyzer("R2", context -> {
            throw new IllegalStateException("analyzer bug");
        });

        ProjectAnalysisException e = assertThrows(ProjectAnalysisException.class, () ->
                runner.runCodeAnalysis(result, List.of(StubAnalyzer.marker("R1", "TODO"), failing),
                        project, AnalyzerOptions.EMPTY, Set.of(), logger, CancellationToken.NONE));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertFalse(result.hasDiagnostics());
    }

    @Test
    void cancellationStopsBeforeTheNextAnalyzer() {
        AnalysisResult result = new AnalysisResult();
        CancellationToken token = new CancellationToken();
        Analyzer cancelling = new StubAnalyzer("R1", context -> {
            token.cancel();
            return StubAnalyzer.occurrences("R1", project.getDocuments().get(0), "TODO");
        });
        Analyzer second = mock(Analyzer.class);

        assertThrows(CancellationException.class, () ->
                runner.runCodeAnalysis(result, List.of(cancelling, second), project,
                        AnalyzerOptions.EMPTY, Set.of(), logger, token));

        verify(second, never()).analyze(any());
        assertFalse(result.hasDiagnostics());
    }

    @Test
    void analyzersShareOneContext() {
        AnalysisResult result = new AnalysisResult();
        Analyzer first = mock(Analyzer.class);
        Analyzer second = mock(Analyzer.class);
        when(first.getId()).thenReturn("first");
        when(second.getId()).thenReturn("second");
        when(first.analyze(any())).thenReturn(List.<Diagnostic>of());
        when(second.analyze(any())).thenReturn(List.<Diagnostic>of());

        runner.runCodeAnalysis(result, List.of(first, second), project, AnalyzerOptions.EMPTY,
                Set.<Path>of(), logger, CancellationToken.NONE);

        verify(first).analyze(argThat(context -> context.getProject() == project));
        verify(second).analyze(argThat(context -> context.getProject() == project));
    }

    @Test
    void emptyAnalyzerListIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                runner.runCodeAnalysis(new AnalysisResult(), List.of(), project, AnalyzerOptions.EMPTY,
                        Set.of(), logger, CancellationToken.NONE));
    }
}
