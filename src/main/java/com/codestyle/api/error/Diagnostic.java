package com.codestyle.api.error;

import java.util.Objects;

import com.codestyle.workspace.DocumentId;

/**
 * Represents a style violation found by an analyzer. Immutable.
 */
public final class Diagnostic {
    private final String id;
    private final String analyzerId;
    private final Severity severity;
    private final String message;
    private final DocumentId documentId;
    private final Location location;
    private final String suggestion;

    public Diagnostic(String id, String analyzerId, Severity severity, String message,
                      DocumentId documentId, Location location) {
        this(id, analyzerId, severity, message, documentId, location, null);
    }

    public Diagnostic(String id, String analyzerId, Severity severity, String message,
                      DocumentId documentId, Location location, String suggestion) {
        this.id = Objects.requireNonNull(id, "id");
        this.analyzerId = Objects.requireNonNull(analyzerId, "analyzerId");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = Objects.requireNonNull(message, "message");
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.location = Objects.requireNonNull(location, "location");
        this.suggestion = suggestion;
    }

    // Getters
    public String getId() { return id; }
    public String getAnalyzerId() { return analyzerId; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public DocumentId getDocumentId() { return documentId; }
    public Location getLocation() { return location; }
    public String getSuggestion() { return suggestion; }

    public int getLine() {
        return location.getStartLine();
    }

    public int getColumn() {
        return location.getStartColumn();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return id.equals(that.id)
                && analyzerId.equals(that.analyzerId)
                && severity == that.severity
                && message.equals(that.message)
                && documentId.equals(that.documentId)
                && location.equals(that.location)
                && Objects.equals(suggestion, that.suggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, analyzerId, severity, message, documentId, location, suggestion);
    }

    @Override
    public String toString() {
        return id + " " + severity + " " + location + ": " + message;
    }
}
