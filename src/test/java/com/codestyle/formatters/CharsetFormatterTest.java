package com.codestyle.formatters;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.FormatOptions;
import com.codestyle.api.FormatType;
import com.codestyle.api.FormatterResult;
import com.codestyle.core.AnalyzerRegistry;
import com.codestyle.util.CapturingHandler;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.TextEncoding;
import com.codestyle.workspace.Workspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.codestyle.workspace.WorkspaceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CharsetFormatterTest {

    private AnalyzerRegistry registry;
    private CapturingHandler handler;
    private Logger logger;
    private Workspace workspace;

    @BeforeEach
    void setUp() {
        registry = mock(AnalyzerRegistry.class);
        handler = new CapturingHandler();
        logger = handler.newLogger();
        workspace = workspace(project("Java.javaproj", "src/A.java", "class A {}"));
    }

    private void charset(String value) {
        when(registry.getAnalyzerOptions(any())).thenReturn(new AnalyzerOptions(Map.of("charset", value), Map.of()));
    }

    @Test
    void isAWhitespaceFormatter() {
        assertEquals(FormatType.WHITESPACE, new CharsetFormatter(registry).getFormatType());
    }

    @Test
    void reportModeLogsTheEncodingMismatch() {
        charset("utf-8-bom");

        FormatterResult result = new CharsetFormatter(registry).format(workspace, allDocuments(workspace),
                FormatOptions.builder().build(), logger, CancellationToken.NONE);

        assertEquals(List.of("src/A.java(1,1): Fix file encoding."), handler.messagesAt(Level.WARNING));
        assertEquals(1, result.getReportedDiagnostics().size());
        assertSame(workspace, result.getWorkspace());
    }

    @Test
    void fixModeChangesTheDocumentEncoding() {
        charset("latin1");

        FormatterResult result = new CharsetFormatter(registry).format(workspace, allDocuments(workspace),
                FormatOptions.builder().saveFormattedFiles(true).build(), logger, CancellationToken.NONE);

        Document fixed = document(result.getWorkspace(), "src/A.java");
        assertEquals(TextEncoding.LATIN_1, fixed.getEncoding());
        assertEquals("class A {}", fixed.getText());
        assertEquals(List.of("charset"), result.getAppliedFixers());
        assertTrue(handler.messagesAt(Level.WARNING).isEmpty());
    }

    @Test
    void matchingEncodingIsLeftAlone() {
        charset("utf-8");

        FormatterResult result = new CharsetFormatter(registry).format(workspace, allDocuments(workspace),
                FormatOptions.builder().saveFormattedFiles(true).build(), logger, CancellationToken.NONE);

        assertSame(workspace, result.getWorkspace());
        assertTrue(result.getAppliedFixers().isEmpty());
    }

    @Test
    void documentsWithoutCharsetOptionAreSkipped() {
        when(registry.getAnalyzerOptions(any())).thenReturn(AnalyzerOptions.EMPTY);

        FormatterResult result = new CharsetFormatter(registry).format(workspace, allDocuments(workspace),
                FormatOptions.builder().changesAreErrors(true).build(), logger, CancellationToken.NONE);

        assertTrue(result.getReportedDiagnostics().isEmpty());
        assertFalse(result.isErrorsReported());
        assertTrue(handler.getRecords().stream().noneMatch(r -> r.getLevel().equals(Level.SEVERE)));
    }
}
