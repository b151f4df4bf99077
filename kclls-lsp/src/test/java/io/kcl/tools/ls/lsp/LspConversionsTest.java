package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.ast.Span;
import io.kcl.tools.ls.compile.PathConversionException;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LspConversionsTest {

    @Test
    public void testLspLinesStartAtZero() {
        Path file = Paths.get("/work/main.k");
        Pos pos = LspConversions.kclPos(file, new Position(0, 4));
        assertEquals(1, pos.getLine());
        assertEquals(Integer.valueOf(4), pos.getColumn());
        assertEquals(file.toString(), pos.getFilename());
        assertEquals(new Position(0, 4), LspConversions.lspPos(pos));
    }

    @Test
    public void testWholeLinePositionStartsTheLine() {
        assertEquals(new Position(2, 0), LspConversions.lspPos(Pos.wholeLine("/work/main.k", 3)));
    }

    @Test
    public void testSpanToLocation() {
        Path file = Paths.get("/work/main.k").toAbsolutePath();
        Location location = LspConversions.lspLocation(new Span(file.toString(), 2, 4, 2, 7));
        assertEquals(file.toUri().toString(), location.getUri());
        assertEquals(new Range(new Position(1, 4), new Position(1, 7)), location.getRange());
    }

    @Test
    public void testUriRoundTrip() {
        Path file = Paths.get("/work/pkg/../main.k").toAbsolutePath();
        assertEquals(file.normalize(), LspConversions.absPath(file.toUri().toString()));
    }

    @Test
    public void testNonFileUri() {
        try {
            LspConversions.absPath("http://example.com/main.k");
            fail("expected PathConversionException");
        } catch (PathConversionException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("can't convert url to path: "));
        }
    }

    @Test(expected = PathConversionException.class)
    public void testMalformedUri() {
        LspConversions.absPath("file://[bad");
    }

    @Test
    public void testOffsets() {
        String text = String.join("\n", "a = 1", "bb = 2", "");
        assertEquals(0, LspConversions.offset(text, new Position(0, 0)));
        assertEquals(8, LspConversions.offset(text, new Position(1, 2)));
        assertEquals(12, LspConversions.offset(text, new Position(1, 40)));
        assertEquals(text.length(), LspConversions.offset(text, new Position(7, 0)));
    }

    @Test
    public void testReversedRangeIsEmpty() {
        assertArrayEquals(new int[]{4, 4},
                LspConversions.textRange("a = 1", new Range(new Position(0, 4), new Position(0, 1))));
    }
}
