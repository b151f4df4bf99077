package io.kcl.tools.ls.lsp;

import org.junit.Test;

import java.util.List;

import static io.kcl.tools.ls.lsp.KclFixtures.full;
import static io.kcl.tools.ls.lsp.KclFixtures.replace;
import static org.junit.Assert.assertEquals;

public class DocumentChangesTest {

    @Test
    public void testChangeWithoutRangeReplacesEverything() {
        assertEquals("a = 1", DocumentChanges.apply("old text\nmore", List.of(full("a = 1"))));
    }

    @Test
    public void testEditsApplyToTheResultOfThePreviousEdit() {
        String updated = DocumentChanges.apply("abcdef", List.of(
                replace(0, 1, 0, 2, "X"),
                replace(0, 4, 0, 5, "Y")));
        assertEquals("aXcdYf", updated);
    }

    @Test
    public void testEditOnLaterLine() {
        String text = String.join("\n", "a = 1", "b = 2", "");
        assertEquals(String.join("\n", "a = 1", "b = 3", ""),
                DocumentChanges.apply(text, List.of(replace(1, 4, 1, 5, "3"))));
    }

    @Test
    public void testEditAcrossLines() {
        String text = String.join("\n", "a = 1", "b = 2", "c = 3");
        assertEquals("a = 3", DocumentChanges.apply(text, List.of(replace(0, 4, 2, 4, ""))));
    }

    @Test
    public void testInsertion() {
        assertEquals("a = 10", DocumentChanges.apply("a = 1", List.of(replace(0, 5, 0, 5, "0"))));
    }

    @Test
    public void testCharacterPastLineEndClampsToLineEnd() {
        assertEquals("ab!\ncd", DocumentChanges.apply("ab\ncd", List.of(replace(0, 10, 0, 10, "!"))));
    }

    @Test
    public void testLinePastEndAppends() {
        assertEquals("ab\n", DocumentChanges.apply("ab", List.of(replace(5, 0, 5, 0, "\n"))));
    }

    @Test
    public void testFullThenRangeEdit() {
        String updated = DocumentChanges.apply("ignored", List.of(
                full("x = 1"),
                replace(0, 0, 0, 1, "y")));
        assertEquals("y = 1", updated);
    }

    @Test
    public void testNullTextIsEmpty() {
        assertEquals("", DocumentChanges.apply(null, List.of()));
    }
}
