package com.codestyle.workspace;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A document selected for formatting, with its resolved file path.
 */
public final class FormattableDocument {
    private final DocumentId documentId;
    private final Path filePath;

    public FormattableDocument(DocumentId documentId, Path filePath) {
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.filePath = Objects.requireNonNull(filePath, "filePath");
    }

    public static FormattableDocument of(Document document) {
        return new FormattableDocument(document.getId(), document.getFilePath());
    }

    public DocumentId getDocumentId() {
        return documentId;
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormattableDocument)) return false;
        FormattableDocument that = (FormattableDocument) o;
        return documentId.equals(that.documentId) && filePath.equals(that.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, filePath);
    }
}
