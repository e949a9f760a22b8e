package com.codestyle.workspace;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A source document at one point in time. Immutable; edits produce a new instance
 * with the same {@link DocumentId}.
 */
public final class Document {
    private final DocumentId id;
    private final String name;
    private final Path filePath;
    private final String text;
    private final TextEncoding encoding;

    public Document(DocumentId id, String name, Path filePath, String text, TextEncoding encoding) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.text = Objects.requireNonNull(text, "text");
        this.encoding = encoding != null ? encoding : TextEncoding.UTF_8;
    }

    public static Document create(ProjectId projectId, Path filePath, String text) {
        return new Document(DocumentId.createNewId(projectId, filePath.toString()),
                filePath.getFileName().toString(), filePath, text, TextEncoding.UTF_8);
    }

    public DocumentId getId() { return id; }
    public String getName() { return name; }
    public Path getFilePath() { return filePath; }
    public String getText() { return text; }
    public TextEncoding getEncoding() { return encoding; }

    public Document withText(String newText) {
        if (text.equals(newText)) {
            return this;
        }
        return new Document(id, name, filePath, newText, encoding);
    }

    public Document withEncoding(TextEncoding newEncoding) {
        if (encoding.equals(newEncoding)) {
            return this;
        }
        return new Document(id, name, filePath, text, newEncoding);
    }

    /**
     * True when text or encoding differ from {@code other}.
     */
    public boolean hasChangedFrom(Document other) {
        return !text.equals(other.text) || !encoding.equals(other.encoding);
    }

    @Override
    public String toString() {
        return "Document[" + filePath + "]";
    }
}
