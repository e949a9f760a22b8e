package com.codestyle.api.error;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Source location of a diagnostic.
 * Lines and columns are 1-based; offsets are 0-based character indexes into the document text.
 * A location may carry a mapped span pointing into the file a generated document was produced from.
 */
public final class Location {
    private final Path filePath;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final int startOffset;
    private final int endOffset;
    private final Location mappedLocation;

    private Location(Builder builder) {
        this.filePath = Objects.requireNonNull(builder.filePath, "filePath");
        this.startLine = builder.startLine;
        this.startColumn = builder.startColumn;
        this.endLine = builder.endLine < builder.startLine ? builder.startLine : builder.endLine;
        this.endColumn = builder.endColumn;
        this.startOffset = builder.startOffset;
        this.endOffset = Math.max(builder.startOffset, builder.endOffset);
        this.mappedLocation = builder.mappedLocation;
    }

    public Path getFilePath() { return filePath; }
    public int getStartLine() { return startLine; }
    public int getStartColumn() { return startColumn; }
    public int getEndLine() { return endLine; }
    public int getEndColumn() { return endColumn; }
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }

    /**
     * Returns the location reported to users: the mapped span when present, this span otherwise.
     */
    public Location getMappedLocation() {
        return mappedLocation != null ? mappedLocation : this;
    }

    /**
     * Creates a location covering {@code [startOffset, endOffset)} of {@code text}.
     */
    public static Location fromOffsets(Path filePath, String text, int startOffset, int endOffset) {
        int[] start = lineAndColumn(text, startOffset);
        int[] end = lineAndColumn(text, endOffset);
        return builder()
                .filePath(filePath)
                .start(start[0], start[1])
                .end(end[0], end[1])
                .offsets(startOffset, endOffset)
                .build();
    }

    /**
     * Converts a character offset into a 1-based {line, column} pair.
     */
    public static int[] lineAndColumn(String text, int offset) {
        int line = 1;
        int column = 1;
        int limit = Math.min(offset, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new int[]{line, column};
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location that = (Location) o;
        return startLine == that.startLine
                && startColumn == that.startColumn
                && endLine == that.endLine
                && endColumn == that.endColumn
                && startOffset == that.startOffset
                && endOffset == that.endOffset
                && filePath.equals(that.filePath)
                && Objects.equals(mappedLocation, that.mappedLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath, startLine, startColumn, endLine, endColumn, startOffset, endOffset, mappedLocation);
    }

    @Override
    public String toString() {
        return filePath + "(" + startLine + "," + startColumn + ")";
    }

    public static class Builder {
        private Path filePath;
        private int startLine = 1;
        private int startColumn = 1;
        private int endLine = 1;
        private int endColumn = 1;
        private int startOffset;
        private int endOffset;
        private Location mappedLocation;

        public Builder filePath(Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder start(int line, int column) {
            this.startLine = line;
            this.startColumn = column;
            return this;
        }

        public Builder end(int line, int column) {
            this.endLine = line;
            this.endColumn = column;
            return this;
        }

        public Builder offsets(int startOffset, int endOffset) {
            this.startOffset = startOffset;
            this.endOffset = endOffset;
            return this;
        }

        public Builder mappedTo(Location mappedLocation) {
            this.mappedLocation = mappedLocation;
            return this;
        }

        public Location build() {
            return new Location(this);
        }
    }
}
