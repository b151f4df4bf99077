package io.kcl.tools.ls.lsp;

import org.junit.Before;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static io.kcl.tools.ls.lsp.KclFixtures.replace;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class VfsTest {

    private Vfs vfs;
    private Path file;

    @Before
    public void setUp() {
        vfs = new Vfs();
        file = Paths.get("/work/main.k").toAbsolutePath();
    }

    @Test
    public void testOpenThenRead() {
        vfs.open(file, "a = 1");
        assertTrue(vfs.isOpen(file));
        assertEquals("a = 1", vfs.read(file));
        assertEquals(List.of(file), vfs.openPaths());
    }

    @Test
    public void testChangeUpdatesText() {
        vfs.open(file, "a = 1");
        assertEquals("a = 2", vfs.change(file, List.of(replace(0, 4, 0, 5, "2"))));
        assertEquals("a = 2", vfs.read(file));
    }

    @Test
    public void testChangeOfClosedDocument() {
        assertNull(vfs.change(file, List.of(replace(0, 0, 0, 0, "x"))));
        assertFalse(vfs.isOpen(file));
    }

    @Test
    public void testCloseForgetsText() {
        vfs.open(file, "a = 1");
        vfs.close(file);
        assertNull(vfs.read(file));
        assertTrue(vfs.openPaths().isEmpty());
    }

    @Test
    public void testOpenWithoutTextIsEmpty() {
        vfs.open(file, null);
        assertEquals("", vfs.read(file));
    }
}
