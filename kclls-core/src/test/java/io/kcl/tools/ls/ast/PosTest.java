package io.kcl.tools.ls.ast;

import org.junit.Test;

import static org.junit.Assert.*;

public class PosTest {

    @Test
    public void testLessEqualOrdersByLineThenColumn() {
        assertTrue(Pos.of("a.k", 1, 5).lessEqual(Pos.of("a.k", 2, 0)));
        assertTrue(Pos.of("a.k", 1, 5).lessEqual(Pos.of("a.k", 1, 5)));
        assertTrue(Pos.of("a.k", 1, 4).lessEqual(Pos.of("a.k", 1, 5)));
        assertFalse(Pos.of("a.k", 1, 6).lessEqual(Pos.of("a.k", 1, 5)));
        assertFalse(Pos.of("a.k", 3, 0).lessEqual(Pos.of("a.k", 2, 9)));
    }

    @Test
    public void testMissingColumnMatchesAnyColumnOnLine() {
        Pos wholeLine = Pos.wholeLine("a.k", 2);
        assertTrue(wholeLine.lessEqual(Pos.of("a.k", 2, 0)));
        assertTrue(Pos.of("a.k", 2, 80).lessEqual(wholeLine));
        assertFalse(wholeLine.lessEqual(Pos.of("a.k", 1, 80)));
        assertFalse(wholeLine.hasColumn());
    }

    @Test
    public void testLessIsStrict() {
        assertFalse(Pos.of("a.k", 1, 5).less(Pos.of("a.k", 1, 5)));
        assertTrue(Pos.of("a.k", 1, 4).less(Pos.of("a.k", 1, 5)));
        assertFalse(Pos.wholeLine("a.k", 1).less(Pos.of("a.k", 1, 5)));
    }

    @Test
    public void testEquality() {
        assertEquals(Pos.of("a.k", 1, 2), Pos.of("a.k", 1, 2));
        assertNotEquals(Pos.of("a.k", 1, 2), Pos.wholeLine("a.k", 1));
        assertEquals("", new Pos(null, 1, 0).getFilename());
    }
}
