package com.codestyle.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import com.codestyle.util.LoggerUtil;
import com.codestyle.workspace.Document;
import com.codestyle.workspace.DocumentId;
import com.codestyle.workspace.Project;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;

/**
 * What analyzers see while analyzing one project in one batch.
 *
 * <p>Parsed compilation units are cached for the lifetime of the context, so every analyzer
 * of a batch reuses the same syntax trees. Cached trees are shared: analyzers must not modify them.
 */
public final class ProjectAnalysisContext {
    private static final Logger logger = LoggerUtil.getLogger(ProjectAnalysisContext.class);

    private final Project project;
    private final AnalyzerOptions options;
    private final CancellationToken cancellationToken;
    private final Map<DocumentId, Optional<CompilationUnit>> syntaxTrees = new ConcurrentHashMap<>();

    public ProjectAnalysisContext(Project project, AnalyzerOptions options, CancellationToken cancellationToken) {
        this.project = project;
        this.options = options != null ? options : AnalyzerOptions.EMPTY;
        this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.NONE;
    }

    public Project getProject() {
        return project;
    }

    public List<Document> getDocuments() {
        return project.getDocuments();
    }

    public AnalyzerOptions getOptions() {
        return options;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Returns the Java syntax tree of {@code document}, parsing it on first use.
     * Empty when the document does not parse.
     */
    public Optional<CompilationUnit> getCompilationUnit(Document document) {
        return syntaxTrees.computeIfAbsent(document.getId(), id -> parse(document));
    }

    private static Optional<CompilationUnit> parse(Document document) {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(document.getText());

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            logger.fine("Failed to parse " + document.getFilePath() + ": " +
                    (result.getProblems().isEmpty() ? "Unknown error" : result.getProblems().get(0).getMessage()));
            return Optional.empty();
        }
        return result.getResult();
    }
}
