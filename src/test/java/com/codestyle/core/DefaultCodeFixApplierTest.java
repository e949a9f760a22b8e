package com.codestyle.core;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.CodeFixer;
import com.codestyle.api.TextEdit;
import com.codestyle.api.error.CodeFixException;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.util.CapturingHandler;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.Project;
import com.codestyle.workspace.Workspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.codestyle.workspace.WorkspaceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DefaultCodeFixApplierTest {

    private CapturingHandler handler;
    private Logger logger;
    private DefaultCodeFixApplier applier;

    @BeforeEach
    void setUp() {
        handler = new CapturingHandler();
        logger = handler.newLogger();
        applier = new DefaultCodeFixApplier(4, project -> AnalyzerOptions.EMPTY);
    }

    private static AnalysisResult analyze(Workspace workspace, String ruleId, String marker) {
        AnalysisResult result = new AnalysisResult();
        for (Project project : workspace.getProjects()) {
            for (Document document : project.getDocuments()) {
                result.addDiagnostics(StubAnalyzer.occurrences(ruleId, document, marker));
            }
        }
        return result;
    }

    @Test
    void onlyDocumentsWithDiagnosticsChange() {
        Project first = project("First", "a.txt", "x FIXME y", "b.txt", "clean");
        Project second = project("Second", "c.txt", "clean too");
        Workspace workspace = workspace(first, second);

        CodeFixResult fix = applier.applyCodeFixes(workspace, analyze(workspace, "R1", "FIXME"),
                new ReplacingFixer("R1", "done"), logger, CancellationToken.NONE);

        Workspace updated = fix.getWorkspace();
        Document a = document(updated, "a.txt");
        assertEquals("x done y", a.getText());
        assertEquals(document(workspace, "a.txt").getId(), a.getId());
        assertSame(document(workspace, "b.txt"), document(updated, "b.txt"));
        assertSame(second, updated.getProject(second.getId()).orElseThrow());
        assertEquals(List.of(a.getId()), fix.getChangedDocuments());
        assertTrue(fix.getFailedDocuments().isEmpty());
        assertTrue(fix.isChanged());
    }

    @Test
    void failingDocumentDoesNotAffectOthers() {
        Workspace workspace = workspace(project("P", "good.txt", "FIXME", "bad.txt", "FIXME"));
        Document bad = document(workspace, "bad.txt");
        CodeFixer fixer = new ReplacingFixer("R1", "ok") {
            @Override
            public List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options) {
                if (document.getId().equals(bad.getId())) {
                    throw new IllegalStateException("cannot fix");
                }
                return super.computeEdits(document, diagnostics, options);
            }
        };

        CodeFixResult fix = applier.applyCodeFixes(workspace, analyze(workspace, "R1", "FIXME"), fixer,
                logger, CancellationToken.NONE);

        assertEquals("ok", document(fix.getWorkspace(), "good.txt").getText());
        assertSame(bad, document(fix.getWorkspace(), "bad.txt"));
        assertEquals(List.of(bad.getId()), fix.getFailedDocuments());
        assertEquals(1, handler.messagesAt(Level.WARNING).size());
    }

    @Test
    void editOutsideTheDocumentCountsAsFailure() {
        Workspace workspace = workspace(project("P", "a.txt", "FIXME"));
        CodeFixer fixer = new ReplacingFixer("R1", "") {
            @Override
            public List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options) {
                return List.of(TextEdit.delete(0, 100));
            }
        };

        CodeFixResult fix = applier.applyCodeFixes(workspace, analyze(workspace, "R1", "FIXME"), fixer,
                logger, CancellationToken.NONE);

        assertSame(workspace, fix.getWorkspace());
        assertEquals(1, fix.getFailedDocuments().size());
    }

    @Test
    void overlappingEditsKeepTheFirst() {
        Workspace workspace = workspace(project("P", "a.txt", "abcdef"));
        AnalysisResult result = analyze(workspace, "R1", "abc");
        CodeFixer fixer = new ReplacingFixer("R1", "") {
            @Override
            public List<TextEdit> computeEdits(Document document, List<Diagnostic> diagnostics, AnalyzerOptions options) {
                return List.of(new TextEdit(0, 3, "X"), new TextEdit(2, 5, "Y"));
            }
        };

        CodeFixResult fix = applier.applyCodeFixes(workspace, result, fixer, logger, CancellationToken.NONE);

        assertEquals("Xdef", document(fix.getWorkspace(), "a.txt").getText());
    }

    @Test
    void fixerIsNotCalledForDiagnosticsItCannotFix() throws CodeFixException {
        Workspace workspace = workspace(project("P", "a.txt", "FIXME"));
        CodeFixer fixer = mock(CodeFixer.class);
        when(fixer.getId()).thenReturn("other");
        when(fixer.getFixableDiagnosticIds()).thenReturn(Set.of("R9"));
        when(fixer.canFix(any())).thenCallRealMethod();

        CodeFixResult fix = applier.applyCodeFixes(workspace, analyze(workspace, "R1", "FIXME"), fixer,
                logger, CancellationToken.NONE);

        verify(fixer, never()).computeEdits(any(), any(), any());
        assertSame(workspace, fix.getWorkspace());
        assertFalse(fix.isChanged());
    }

    @Test
    void cancelledTokenLeavesWorkspaceUnchanged() {
        Workspace workspace = workspace(project("P", "a.txt", "FIXME"));
        CancellationToken token = new CancellationToken();
        token.cancel();

        CodeFixResult fix = applier.applyCodeFixes(workspace, analyze(workspace, "R1", "FIXME"),
                new ReplacingFixer("R1", "x"), logger, token);

        assertSame(workspace, fix.getWorkspace());
        assertTrue(fix.getFailedDocuments().isEmpty());
    }

    @Test
    void projectOptionsReachTheFixer() throws CodeFixException {
        Workspace workspace = workspace(project("P", "a.txt", "FIXME"));
        AnalyzerOptions options = new AnalyzerOptions(Map.of("tabWidth", 2), Map.of());
        CodeFixer fixer = mock(CodeFixer.class);
        when(fixer.getId()).thenReturn("mock");
        when(fixer.canFix(any())).thenReturn(true);
        when(fixer.computeEdits(any(), any(), any())).thenReturn(List.of());

        new DefaultCodeFixApplier(1, project -> options)
                .applyCodeFixes(workspace, analyze(workspace, "R1", "FIXME"), fixer, logger, CancellationToken.NONE);

        verify(fixer).computeEdits(any(), any(), eq(options));
    }
}
