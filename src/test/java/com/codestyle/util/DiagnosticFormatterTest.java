package com.codestyle.util;

import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Location;
import com.codestyle.api.error.Severity;
import com.codestyle.workspace.DocumentId;
import com.codestyle.workspace.ProjectId;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticFormatterTest {
    private static final Path ROOT = Paths.get("/work/repo").toAbsolutePath();

    private final DocumentId documentId = DocumentId.createNewId(ProjectId.createNewId("p"), "d");

    private Diagnostic diagnostic(Severity severity, Location location) {
        return new Diagnostic("R1", "stub", severity, "Something is off", documentId, location, "Do better");
    }

    @Test
    void logLineUsesRelativePathAndMappedLocation() {
        Location mapped = Location.builder().filePath(ROOT.resolve("views/Page.cshtml")).start(7, 3).build();
        Location generated = Location.builder().filePath(ROOT.resolve("obj/Page.g.cs")).start(120, 9).mappedTo(mapped).build();

        assertEquals("views/Page.cshtml(7,3): Something is off",
                DiagnosticFormatter.toLogLine(diagnostic(Severity.WARNING, generated), ROOT));
    }

    @Test
    void pathsOutsideTheWorkspaceStayAbsolute() {
        Path outside = Paths.get("/elsewhere/A.java").toAbsolutePath();
        Location location = Location.builder().filePath(outside).start(1, 1).build();

        assertEquals(outside + "(1,1): Something is off",
                DiagnosticFormatter.toLogLine(diagnostic(Severity.WARNING, location), ROOT));
    }

    @Test
    void consoleOutputWithoutColors() {
        DiagnosticFormatter formatter = new DiagnosticFormatter(false);
        Location location = Location.builder().filePath(ROOT.resolve("A.java")).start(3, 5).build();

        assertEquals("ERROR R1: Something is off (Line 3, Column 5)\n  Suggestion: Do better",
                formatter.formatDiagnostic(diagnostic(Severity.ERROR, location)));
        assertEquals("plain", formatter.colorize(DiagnosticFormatter.ANSI_RED, "plain"));
    }

    @Test
    void summaryCountsPerFileAndSeverity() {
        DiagnosticFormatter formatter = new DiagnosticFormatter(false);
        Location a = Location.builder().filePath(ROOT.resolve("A.java")).build();
        Location b = Location.builder().filePath(ROOT.resolve("B.java")).build();

        String summary = formatter.formatSummary(List.of(
                diagnostic(Severity.WARNING, a),
                diagnostic(Severity.INFO, a),
                diagnostic(Severity.WARNING, b)), ROOT);

        assertTrue(summary.contains("A.java: 1 warnings, 1 info"));
        assertTrue(summary.contains("B.java: 1 warnings"));
        assertTrue(summary.endsWith("Total: 2 warnings, 1 info"));
    }
}
