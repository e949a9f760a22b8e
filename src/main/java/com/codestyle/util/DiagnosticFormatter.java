package com.codestyle.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Location;
import com.codestyle.api.error.Severity;

/**
 * Utility for rendering diagnostics consistently, both as log lines and as console summaries.
 */
public class DiagnosticFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to use ANSI colors in the output
     */
    public DiagnosticFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats a diagnostic as {@code relative/path(line,col): message} using its mapped location.
     * Paths outside {@code workspaceFolder} are printed as they are.
     */
    public static String toLogLine(Diagnostic diagnostic, Path workspaceFolder) {
        Location location = diagnostic.getLocation().getMappedLocation();
        return displayPath(location.getFilePath(), workspaceFolder)
                + "(" + location.getStartLine() + "," + location.getStartColumn() + "): "
                + diagnostic.getMessage();
    }

    /**
     * Folder diagnostics are reported relative to: the path itself, or its parent when it names a file.
     */
    public static Path resolveWorkspaceFolder(Path workspacePath) {
        if (workspacePath == null) {
            return null;
        }
        Path absolute = workspacePath.toAbsolutePath().normalize();
        if (Files.isRegularFile(absolute) && absolute.getParent() != null) {
            return absolute.getParent();
        }
        return absolute;
    }

    public static String displayPath(Path filePath, Path workspaceFolder) {
        if (workspaceFolder != null) {
            Path absolute = filePath.toAbsolutePath().normalize();
            if (absolute.startsWith(workspaceFolder)) {
                return workspaceFolder.relativize(absolute).toString();
            }
        }
        return filePath.toString();
    }

    /**
     * Formats a diagnostic for the console, with severity, rule id and suggestion.
     */
    public String formatDiagnostic(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();

        String severityStr;
        switch (diagnostic.getSeverity()) {
            case FATAL:
                severityStr = colorize(ANSI_RED, "FATAL");
                break;
            case ERROR:
                severityStr = colorize(ANSI_RED, "ERROR");
                break;
            case WARNING:
                severityStr = colorize(ANSI_YELLOW, "WARNING");
                break;
            default:
                severityStr = colorize(ANSI_BLUE, "INFO");
                break;
        }

        sb.append(severityStr).append(" ").append(diagnostic.getId()).append(": ");
        sb.append(diagnostic.getMessage());
        sb.append(" (Line ").append(diagnostic.getLine()).append(", Column ").append(diagnostic.getColumn()).append(")");

        if (diagnostic.getSuggestion() != null && !diagnostic.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(diagnostic.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Creates a per-file count of diagnostics by severity, followed by totals.
     */
    public String formatSummary(List<Diagnostic> diagnostics, Path workspaceFolder) {
        Map<Path, List<Diagnostic>> byFile = new LinkedHashMap<>();
        for (Diagnostic diagnostic : diagnostics) {
            byFile.computeIfAbsent(diagnostic.getLocation().getMappedLocation().getFilePath(), p -> new ArrayList<>())
                    .add(diagnostic);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Diagnostic Summary:")).append("\n");

        for (Map.Entry<Path, List<Diagnostic>> entry : byFile.entrySet()) {
            sb.append(displayPath(entry.getKey(), workspaceFolder)).append(": ")
                    .append(_formatCounts(groupBySeverity(entry.getValue())))
                    .append("\n");
        }

        sb.append("\nTotal: ");
        if (diagnostics.isEmpty()) {
            sb.append(colorize(ANSI_GREEN, "no issues"));
        } else {
            sb.append(_formatCounts(groupBySeverity(diagnostics)));
        }
        return sb.toString();
    }

    public Map<Severity, List<Diagnostic>> groupBySeverity(List<Diagnostic> diagnostics) {
        return diagnostics.stream().collect(Collectors.groupingBy(Diagnostic::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }

    private String _formatCounts(Map<Severity, List<Diagnostic>> bySeverity) {
        StringBuilder sb = new StringBuilder();
        _appendCount(sb, bySeverity, Severity.FATAL, ANSI_RED, "fatal");
        _appendCount(sb, bySeverity, Severity.ERROR, ANSI_RED, "errors");
        _appendCount(sb, bySeverity, Severity.WARNING, ANSI_YELLOW, "warnings");
        _appendCount(sb, bySeverity, Severity.INFO, ANSI_BLUE, "info");
        return sb.toString();
    }

    private void _appendCount(StringBuilder sb, Map<Severity, List<Diagnostic>> bySeverity,
                              Severity severity, String color, String label) {
        List<Diagnostic> matching = bySeverity.get(severity);
        if (matching == null || matching.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(colorize(color, matching.size() + " " + label));
    }
}
