package com.codestyle.workspace;

import java.util.Objects;
import java.util.UUID;

/**
 * Stable identity of a document. Independent of the document's content, so the same id
 * addresses a document before and after an edit.
 */
public final class DocumentId {
    private final ProjectId projectId;
    private final UUID id;
    private final String debugName;

    private DocumentId(ProjectId projectId, UUID id, String debugName) {
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.id = id;
        this.debugName = debugName;
    }

    public static DocumentId createNewId(ProjectId projectId, String debugName) {
        return new DocumentId(projectId, UUID.randomUUID(), debugName);
    }

    public ProjectId getProjectId() {
        return projectId;
    }

    public UUID getId() {
        return id;
    }

    public String getDebugName() {
        return debugName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentId)) return false;
        DocumentId that = (DocumentId) o;
        return id.equals(that.id) && projectId.equals(that.projectId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, id);
    }

    @Override
    public String toString() {
        return "(DocumentId " + debugName + ")";
    }
}
