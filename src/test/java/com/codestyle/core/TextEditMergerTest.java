package com.codestyle.core;

import com.codestyle.api.TextEdit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextEditMergerTest {

    @Test
    void editsAreAppliedInOffsetOrder() {
        TextEditMerger.Merge merge = TextEditMerger.merge(List.of(
                new TextEdit(6, 11, "there"),
                new TextEdit(0, 5, "Hi")));

        assertEquals(List.of(new TextEdit(0, 5, "Hi"), new TextEdit(6, 11, "there")), merge.getAccepted());
        assertEquals("Hi there", TextEditMerger.apply("hello world", merge.getAccepted()));
    }

    @Test
    void overlappingEditIsRejected() {
        TextEditMerger.Merge merge = TextEditMerger.merge(List.of(
                new TextEdit(0, 4, "x"),
                new TextEdit(2, 6, "y")));

        assertEquals(List.of(new TextEdit(0, 4, "x")), merge.getAccepted());
        assertEquals(List.of(new TextEdit(2, 6, "y")), merge.getRejected());
    }

    @Test
    void insertsAtTheSamePositionConflict() {
        TextEditMerger.Merge merge = TextEditMerger.merge(List.of(
                TextEdit.insert(3, "a"),
                TextEdit.insert(3, "b")));

        assertEquals(1, merge.getAccepted().size());
        assertEquals(1, merge.getRejected().size());
        assertEquals("abcadef", TextEditMerger.apply("abcdef", merge.getAccepted()));
    }

    @Test
    void touchingEditsAreBothAccepted() {
        TextEditMerger.Merge merge = TextEditMerger.merge(List.of(
                TextEdit.delete(0, 2),
                new TextEdit(2, 4, "--")));

        assertTrue(merge.getRejected().isEmpty());
        assertEquals("--ef", TextEditMerger.apply("abcdef", merge.getAccepted()));
    }

    @Test
    void editPastEndOfTextFails() {
        assertThrows(IllegalArgumentException.class,
                () -> TextEditMerger.apply("abc", List.of(TextEdit.delete(1, 10))));
    }

    @Test
    void invalidSpanIsRejectedOnConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new TextEdit(5, 2, ""));
        assertThrows(IllegalArgumentException.class, () -> new TextEdit(-1, 2, ""));
    }
}
