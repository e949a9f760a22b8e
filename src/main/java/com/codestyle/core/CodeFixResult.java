package com.codestyle.core;

import java.util.List;

import com.codestyle.workspace.DocumentId;
import com.codestyle.workspace.Workspace;

/**
 * Outcome of applying one fixer: the new snapshot, the documents it changed and the
 * documents whose fix failed.
 */
public class CodeFixResult {
    private final Workspace workspace;
    private final List<DocumentId> changedDocuments;
    private final List<DocumentId> failedDocuments;

    public CodeFixResult(Workspace workspace, List<DocumentId> changedDocuments, List<DocumentId> failedDocuments) {
        this.workspace = workspace;
        this.changedDocuments = List.copyOf(changedDocuments);
        this.failedDocuments = List.copyOf(failedDocuments);
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public boolean isChanged() {
        return !changedDocuments.isEmpty();
    }

    public List<DocumentId> getChangedDocuments() {
        return changedDocuments;
    }

    public List<DocumentId> getFailedDocuments() {
        return failedDocuments;
    }
}
