package com.codestyle.formatters;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.codestyle.api.AnalyzerOptions;
import com.codestyle.api.CancellationToken;
import com.codestyle.api.CodeFormatter;
import com.codestyle.api.FormatOptions;
import com.codestyle.api.FormatType;
import com.codestyle.api.FormatterResult;
import com.codestyle.api.error.Diagnostic;
import com.codestyle.api.error.Location;
import com.codestyle.api.error.Severity;
import com.codestyle.core.AnalyzerRegistry;
import com.codestyle.util.DiagnosticFormatter;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.FormattableDocument;
import com.codestyle.workspace.Project;
import com.codestyle.workspace.TextEncoding;
import com.codestyle.workspace.Workspace;

/**
 * Brings documents to the encoding named by the {@code charset} option. Documents of projects
 * without a {@code charset} option are left alone.
 */
public class CharsetFormatter implements CodeFormatter {
    public static final String DIAGNOSTIC_ID = "CHARSET";
    static final String WARNING_DESCRIPTION = "Fix file encoding.";

    private final AnalyzerRegistry registry;

    public CharsetFormatter(AnalyzerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public FormatType getFormatType() {
        return FormatType.WHITESPACE;
    }

    @Override
    public FormatterResult format(Workspace workspace,
                                  List<FormattableDocument> formattableDocuments,
                                  FormatOptions options,
                                  Logger logger,
                                  CancellationToken cancellationToken) {
        Instant start = Instant.now();
        logger.fine("Checking file encodings.");

        Path workspaceFolder = DiagnosticFormatter.resolveWorkspaceFolder(options.getWorkspaceFilePath() != null
                ? options.getWorkspaceFilePath()
                : workspace.getWorkspacePath());
        List<Diagnostic> reported = new ArrayList<>();
        List<Document> reencoded = new ArrayList<>();

        for (FormattableDocument formattable : formattableDocuments) {
            if (cancellationToken.isCancellationRequested()) {
                break;
            }

            Document document = workspace.getDocument(formattable.getDocumentId()).orElse(null);
            if (document == null) {
                logger.finer("Skipping unknown document " + formattable.getFilePath());
                continue;
            }

            TextEncoding target = _getTargetEncoding(workspace, document);
            if (target == null || target.equals(document.getEncoding())) {
                continue;
            }

            if (options.isSaveFormattedFiles()) {
                logger.finer("Re-encoding " + document.getFilePath() + " from " + document.getEncoding() + " to " + target);
                reencoded.add(document.withEncoding(target));
            } else {
                Diagnostic diagnostic = _createDiagnostic(document, options);
                String message = DiagnosticFormatter.toLogLine(diagnostic, workspaceFolder);
                if (options.isChangesAreErrors()) {
                    logger.severe(message);
                } else {
                    logger.warning(message);
                }
                reported.add(diagnostic);
            }
        }

        Duration elapsed = Duration.between(start, Instant.now());
        logger.fine("Encoding check complete in " + elapsed.toMillis() + "ms.");

        FormatterResult.Builder result = FormatterResult.builder()
                .workspace(workspace.withDocuments(reencoded))
                .reportedDiagnostics(reported)
                .errorsReported(options.isChangesAreErrors() && !reported.isEmpty())
                .cancelled(cancellationToken.isCancellationRequested())
                .elapsed(elapsed);
        if (!reencoded.isEmpty()) {
            result.addAppliedFixer("charset");
        }
        return result.build();
    }

    private TextEncoding _getTargetEncoding(Workspace workspace, Document document) {
        Project project = workspace.getProject(document.getId().getProjectId()).orElse(null);
        if (project == null) {
            return null;
        }
        AnalyzerOptions projectOptions = registry.getAnalyzerOptions(project);
        String charset = projectOptions.get("charset", "");
        if (charset.isBlank()) {
            return null;
        }
        return TextEncoding.fromCharsetOption(charset);
    }

    private static Diagnostic _createDiagnostic(Document document, FormatOptions options) {
        Location location = Location.builder()
                .filePath(document.getFilePath())
                .start(1, 1)
                .end(1, 1)
                .offsets(0, 0)
                .build();
        return new Diagnostic(DIAGNOSTIC_ID, "charset",
                options.isChangesAreErrors() ? Severity.ERROR : Severity.WARNING,
                WARNING_DESCRIPTION, document.getId(), location);
    }
}
