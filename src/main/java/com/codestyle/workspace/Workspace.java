package com.codestyle.workspace;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of all projects and documents at a point in time.
 *
 * <p>Snapshots are never mutated. Every {@code with*} method returns a new snapshot that
 * shares all unaffected projects and documents with this one, so snapshots can be read
 * concurrently without locking.
 */
public final class Workspace {
    private final Path workspacePath;
    private final Map<ProjectId, Project> projects;
    private final int version;

    public Workspace(Path workspacePath, List<Project> projects) {
        this(workspacePath, toMap(projects), 0);
    }

    private Workspace(Path workspacePath, Map<ProjectId, Project> projects, int version) {
        this.workspacePath = workspacePath;
        this.projects = Collections.unmodifiableMap(projects);
        this.version = version;
    }

    private static Map<ProjectId, Project> toMap(List<Project> projects) {
        Map<ProjectId, Project> map = new LinkedHashMap<>();
        for (Project project : projects) {
            map.put(project.getId(), project);
        }
        return map;
    }

    /**
     * Path of the workspace: a folder or a project/solution file inside one.
     */
    public Path getWorkspacePath() {
        return workspacePath;
    }

    /**
     * Number of edits that led to this snapshot; 0 for a freshly loaded workspace.
     */
    public int getVersion() {
        return version;
    }

    public List<Project> getProjects() {
        return new ArrayList<>(projects.values());
    }

    public Optional<Project> getProject(ProjectId projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    public Optional<Document> getDocument(DocumentId documentId) {
        Project project = projects.get(documentId.getProjectId());
        if (project == null) {
            return Optional.empty();
        }
        return project.getDocument(documentId);
    }

    public Workspace withDocument(Document document) {
        Map<DocumentId, Document> single = new LinkedHashMap<>();
        single.put(document.getId(), document);
        return withDocuments(single.values());
    }

    public Workspace withDocumentText(DocumentId documentId, String text) {
        Map<DocumentId, String> single = new LinkedHashMap<>();
        single.put(documentId, text);
        return withDocumentTexts(single);
    }

    /**
     * Returns a snapshot with the text of every listed document replaced.
     * Documents keep their identity, path and encoding.
     */
    public Workspace withDocumentTexts(Map<DocumentId, String> texts) {
        List<Document> updated = new ArrayList<>(texts.size());
        for (Map.Entry<DocumentId, String> entry : texts.entrySet()) {
            Document document = getDocument(entry.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown document " + entry.getKey()));
            updated.add(document.withText(entry.getValue()));
        }
        return withDocuments(updated);
    }

    public Workspace withDocuments(Iterable<Document> documents) {
        Map<ProjectId, Project> copy = new LinkedHashMap<>(projects);
        boolean changed = false;
        for (Document document : documents) {
            ProjectId projectId = document.getId().getProjectId();
            Project project = copy.get(projectId);
            if (project == null) {
                throw new IllegalArgumentException("Unknown project for document " + document.getId());
            }
            Project updated = project.withDocument(document);
            if (updated != project) {
                copy.put(projectId, updated);
                changed = true;
            }
        }
        if (!changed) {
            return this;
        }
        return new Workspace(workspacePath, copy, version + 1);
    }

    /**
     * Returns the ids of documents whose text or encoding differs between {@code original}
     * and this snapshot, in this snapshot's document order.
     */
    public List<DocumentId> getChangedDocuments(Workspace original) {
        List<DocumentId> changed = new ArrayList<>();
        for (Project project : projects.values()) {
            Project before = original.projects.get(project.getId());
            if (before == project) {
                continue;
            }
            for (Document document : project.getDocuments()) {
                Optional<Document> previous = before != null ? before.getDocument(document.getId()) : Optional.empty();
                if (previous.isEmpty() || document.hasChangedFrom(previous.get())) {
                    changed.add(document.getId());
                }
            }
        }
        return changed;
    }

    public boolean hasChangesFrom(Workspace original) {
        return !getChangedDocuments(original).isEmpty();
    }

    public int getDocumentCount() {
        return projects.values().stream().mapToInt(p -> p.getDocumentIds().size()).sum();
    }

    @Override
    public String toString() {
        return "Workspace[" + workspacePath + ", v" + version + ", " + projects.size() + " projects]";
    }
}
