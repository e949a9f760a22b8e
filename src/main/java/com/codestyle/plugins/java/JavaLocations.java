package com.codestyle.plugins.java;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.codestyle.api.error.Location;
import com.codestyle.workspace.Document;
import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;

/**
 * Converts JavaParser ranges (1-based, inclusive end) into {@link Location}s with character offsets.
 */
final class JavaLocations {
    private final Document document;
    private final int[] lineStarts;

    JavaLocations(Document document) {
        this.document = document;
        this.lineStarts = computeLineStarts(document.getText());
    }

    Optional<Location> of(Node node) {
        return node.getRange().map(this::of);
    }

    Location of(Range range) {
        int start = offset(range.begin.line, range.begin.column);
        int end = Math.min(offset(range.end.line, range.end.column) + 1, document.getText().length());
        return Location.builder()
                .filePath(document.getFilePath())
                .start(range.begin.line, range.begin.column)
                .end(range.end.line, range.end.column + 1)
                .offsets(start, Math.max(start, end))
                .build();
    }

    int offset(int line, int column) {
        int index = Math.max(0, Math.min(line - 1, lineStarts.length - 1));
        return Math.min(lineStarts[index] + column - 1, document.getText().length());
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                continue;
            }
            if (c == '\n' || c == '\r') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
