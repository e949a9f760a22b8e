package com.codestyle.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.codestyle.api.TextEdit;

/**
 * Applies a set of edits to one document text.
 *
 * <p>Edits are ordered by start offset, then end offset; ties keep the order the fixer
 * produced them in. An edit overlapping an already accepted edit is rejected, never merged.
 */
public final class TextEditMerger {

    private TextEditMerger() {
    }

    /**
     * Orders {@code edits} and drops every edit overlapping an earlier accepted one.
     */
    public static Merge merge(List<TextEdit> edits) {
        List<TextEdit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt(TextEdit::getStart).thenComparingInt(TextEdit::getEnd));

        List<TextEdit> accepted = new ArrayList<>();
        List<TextEdit> rejected = new ArrayList<>();
        TextEdit last = null;
        for (TextEdit edit : ordered) {
            if (last != null && (edit.overlaps(last) || edit.getStart() < last.getEnd())) {
                rejected.add(edit);
                continue;
            }
            accepted.add(edit);
            last = edit;
        }
        return new Merge(accepted, rejected);
    }

    /**
     * Applies non-overlapping, ordered edits to {@code text}.
     *
     * @throws IllegalArgumentException if an edit reaches past the end of the text
     */
    public static String apply(String text, List<TextEdit> orderedEdits) {
        StringBuilder sb = new StringBuilder(text.length());
        int position = 0;
        for (TextEdit edit : orderedEdits) {
            if (edit.getEnd() > text.length()) {
                throw new IllegalArgumentException("Edit " + edit + " exceeds document length " + text.length());
            }
            sb.append(text, position, edit.getStart());
            sb.append(edit.getNewText());
            position = edit.getEnd();
        }
        sb.append(text, position, text.length());
        return sb.toString();
    }

    public static final class Merge {
        private final List<TextEdit> accepted;
        private final List<TextEdit> rejected;

        Merge(List<TextEdit> accepted, List<TextEdit> rejected) {
            this.accepted = List.copyOf(accepted);
            this.rejected = List.copyOf(rejected);
        }

        public List<TextEdit> getAccepted() {
            return accepted;
        }

        public List<TextEdit> getRejected() {
            return rejected;
        }
    }
}
