package com.codestyle.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

import com.codestyle.api.error.Diagnostic;
import com.codestyle.workspace.DocumentId;
import com.codestyle.workspace.ProjectId;

/**
 * Diagnostics collected by one analysis sweep, keyed by document.
 *
 * <p>Safe for concurrent appends from sibling project analyses. Each document owns its own
 * append-only list guarded by that list's monitor; an identical diagnostic is recorded once.
 * Documents are reported in the order they first received a diagnostic.
 */
public class AnalysisResult {
    private final Map<DocumentId, DocumentDiagnostics> diagnostics = new ConcurrentHashMap<>();
    private final AtomicLong arrivalCounter = new AtomicLong();
    private final Collection<ProjectFailure> failures = new ConcurrentLinkedQueue<>();

    /**
     * Appends diagnostics in iteration order. Duplicates of already-recorded diagnostics are dropped.
     *
     * @return the number of diagnostics actually recorded
     */
    public int addDiagnostics(Collection<Diagnostic> newDiagnostics) {
        int added = 0;
        for (Diagnostic diagnostic : newDiagnostics) {
            DocumentDiagnostics entry = diagnostics.computeIfAbsent(diagnostic.getDocumentId(),
                    id -> new DocumentDiagnostics(arrivalCounter.getAndIncrement()));
            if (entry.add(diagnostic)) {
                added++;
            }
        }
        return added;
    }

    public boolean addDiagnostic(Diagnostic diagnostic) {
        return addDiagnostics(List.of(diagnostic)) == 1;
    }

    /**
     * Immutable snapshot of all diagnostics, documents in first-seen order.
     */
    public Map<DocumentId, List<Diagnostic>> getDiagnostics() {
        List<Map.Entry<DocumentId, DocumentDiagnostics>> entries = new ArrayList<>(diagnostics.entrySet());
        entries.sort((a, b) -> Long.compare(a.getValue().arrival, b.getValue().arrival));

        Map<DocumentId, List<Diagnostic>> snapshot = new LinkedHashMap<>();
        for (Map.Entry<DocumentId, DocumentDiagnostics> entry : entries) {
            snapshot.put(entry.getKey(), entry.getValue().snapshot());
        }
        return Collections.unmodifiableMap(snapshot);
    }

    public List<Diagnostic> getDiagnostics(DocumentId documentId) {
        DocumentDiagnostics entry = diagnostics.get(documentId);
        return entry == null ? List.of() : entry.snapshot();
    }

    /**
     * All diagnostics flattened, documents in first-seen order.
     */
    public List<Diagnostic> getAllDiagnostics() {
        List<Diagnostic> all = new ArrayList<>();
        getDiagnostics().values().forEach(all::addAll);
        return all;
    }

    public boolean hasDiagnostics() {
        return diagnostics.values().stream().anyMatch(d -> d.size() > 0);
    }

    public int getDiagnosticCount() {
        return diagnostics.values().stream().mapToInt(DocumentDiagnostics::size).sum();
    }

    public void recordFailure(ProjectId projectId, Throwable cause) {
        failures.add(new ProjectFailure(projectId, cause));
    }

    public List<ProjectFailure> getFailures() {
        return List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    private static final class DocumentDiagnostics {
        private final long arrival;
        // Guarded by this
        private final Set<Diagnostic> items = new LinkedHashSet<>();

        DocumentDiagnostics(long arrival) {
            this.arrival = arrival;
        }

        synchronized boolean add(Diagnostic diagnostic) {
            return items.add(diagnostic);
        }

        synchronized List<Diagnostic> snapshot() {
            return List.copyOf(items);
        }

        synchronized int size() {
            return items.size();
        }
    }

    /**
     * An analysis failure attributed to one project.
     */
    public static final class ProjectFailure {
        private final ProjectId projectId;
        private final Throwable cause;

        ProjectFailure(ProjectId projectId, Throwable cause) {
            this.projectId = projectId;
            this.cause = cause;
        }

        public ProjectId getProjectId() {
            return projectId;
        }

        public Throwable getCause() {
            return cause;
        }
    }
}
