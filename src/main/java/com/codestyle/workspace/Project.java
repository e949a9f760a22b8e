package com.codestyle.workspace;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named unit of compilation owning an ordered collection of documents. Immutable.
 */
public final class Project {
    private final ProjectId id;
    private final String name;
    private final String language;
    private final Path filePath;
    private final Map<DocumentId, Document> documents;

    public Project(ProjectId id, String name, String language, Path filePath, List<Document> documents) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.language = language;
        this.filePath = filePath;

        Map<DocumentId, Document> ordered = new LinkedHashMap<>();
        for (Document document : documents) {
            if (!document.getId().getProjectId().equals(id)) {
                throw new IllegalArgumentException("Document " + document.getFilePath() + " does not belong to project " + name);
            }
            ordered.put(document.getId(), document);
        }
        this.documents = Collections.unmodifiableMap(ordered);
    }

    private Project(Project source, Map<DocumentId, Document> documents) {
        this.id = source.id;
        this.name = source.name;
        this.language = source.language;
        this.filePath = source.filePath;
        this.documents = Collections.unmodifiableMap(documents);
    }

    public ProjectId getId() { return id; }
    public String getName() { return name; }
    public String getLanguage() { return language; }
    public Path getFilePath() { return filePath; }

    public List<Document> getDocuments() {
        return new ArrayList<>(documents.values());
    }

    public List<DocumentId> getDocumentIds() {
        return new ArrayList<>(documents.keySet());
    }

    public Optional<Document> getDocument(DocumentId documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public boolean containsDocument(DocumentId documentId) {
        return documents.containsKey(documentId);
    }

    /**
     * Returns a project with {@code document} replacing the document of the same id.
     * Other documents are shared with this project.
     */
    public Project withDocument(Document document) {
        Document existing = documents.get(document.getId());
        if (existing == null) {
            throw new IllegalArgumentException("Unknown document " + document.getId() + " in project " + name);
        }
        if (existing == document) {
            return this;
        }
        Map<DocumentId, Document> copy = new LinkedHashMap<>(documents);
        copy.put(document.getId(), document);
        return new Project(this, copy);
    }

    @Override
    public String toString() {
        return "Project[" + name + ", " + documents.size() + " documents]";
    }
}
