package com.codestyle.plugins.whitespace;

/**
 * Walks the lines of a text, exposing each line's bounds without its terminator.
 */
final class LineScanner {
    private final String text;
    private int lineStart;
    private int lineEnd = -1;
    private int nextStart;
    private int lineNumber;

    LineScanner(String text) {
        this.text = text;
    }

    boolean next() {
        if (nextStart > text.length() || (nextStart == text.length() && lineEnd >= 0)) {
            return false;
        }
        lineStart = nextStart;
        int end = lineStart;
        while (end < text.length() && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
            end++;
        }
        lineEnd = end;
        if (end < text.length() && text.charAt(end) == '\r' && end + 1 < text.length() && text.charAt(end + 1) == '\n') {
            nextStart = end + 2;
        } else if (end < text.length()) {
            nextStart = end + 1;
        } else {
            nextStart = text.length() + 1;
        }
        lineNumber++;
        return true;
    }

    /** Offset of the first character of the current line. */
    int start() {
        return lineStart;
    }

    /** Offset just past the last character of the current line, before its terminator. */
    int end() {
        return lineEnd;
    }

    /** 1-based number of the current line. */
    int lineNumber() {
        return lineNumber;
    }
}
