package com.codestyle.api;

import java.util.Objects;

/**
 * Replacement of the characters in {@code [start, end)} of a document with new text.
 */
public final class TextEdit {
    private final int start;
    private final int end;
    private final String newText;

    public TextEdit(int start, int end, String newText) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.newText = Objects.requireNonNull(newText, "newText");
    }

    public static TextEdit insert(int position, String text) {
        return new TextEdit(position, position, text);
    }

    public static TextEdit delete(int start, int end) {
        return new TextEdit(start, end, "");
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }
    public String getNewText() { return newText; }

    public int getLength() {
        return end - start;
    }

    /**
     * Two edits overlap when their spans intersect, or when both insert at the same position.
     * Touching spans such as {@code [0,2)} and {@code [2,4)} do not overlap.
     */
    public boolean overlaps(TextEdit other) {
        if (start == other.start && (getLength() == 0 || other.getLength() == 0)) {
            return true;
        }
        return start < other.end && other.start < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextEdit)) return false;
        TextEdit that = (TextEdit) o;
        return start == that.start && end == that.end && newText.equals(that.newText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, newText);
    }

    @Override
    public String toString() {
        return "TextEdit[" + start + ", " + end + ") -> \"" + newText + "\"";
    }
}
