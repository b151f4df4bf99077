package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.ast.Program;
import io.kcl.tools.ls.compile.CompileUnitResolver;
import io.kcl.tools.ls.compile.CompiledProgram;
import io.kcl.tools.ls.compile.OverlayReadException;
import io.kcl.tools.ls.compile.ProgramCompiler;
import io.kcl.tools.ls.compile.ProgramLoader;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ProgramSnapshotsTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path main;
    private Path lib;
    private Vfs vfs;
    private RecordingLoader loader;
    private ProgramSnapshots snapshots;

    @Before
    public void setUp() {
        Path root = folder.getRoot().toPath();
        main = root.resolve("main.k");
        lib = root.resolve("lib.k");
        vfs = new Vfs();
        vfs.open(main, KclFixtures.SOURCE);
        vfs.open(lib, "import main\n");
        loader = new RecordingLoader(root);
        snapshots = new ProgramSnapshots(new ProgramCompiler(new CompileUnitResolver(null), loader), vfs);
    }

    @Test
    public void testSnapshotIsShared() {
        CompiledProgram first = snapshots.get(main);
        assertSame(first, snapshots.get(main));
        assertEquals(1, loader.loads());
        assertTrue(snapshots.isCached(main));
    }

    @Test
    public void testOpenBufferIsCompiled() {
        snapshots.get(main);
        assertEquals(List.of(main.toString()), loader.files.get(0));
        assertEquals(List.of(KclFixtures.SOURCE), loader.options.get(0).getKCodeList());
        assertTrue(loader.options.get(0).isLoadPlugins());
    }

    @Test
    public void testInvalidateRecompiles() {
        snapshots.get(main);
        snapshots.invalidate(main);
        assertFalse(snapshots.isCached(main));
        snapshots.get(main);
        assertEquals(2, loader.loads());
    }

    @Test
    public void testInvalidateDropsProgramsContainingTheFile() {
        // the fixture program holds main.k whatever file it is compiled for
        snapshots.get(lib);
        snapshots.invalidate(main);
        assertFalse(snapshots.isCached(lib));
    }

    @Test
    public void testInvalidateKeepsUnrelatedPrograms() {
        snapshots.get(main);
        snapshots.invalidate(lib);
        assertTrue(snapshots.isCached(main));
    }

    @Test
    public void testInvalidateAll() {
        snapshots.get(main);
        snapshots.get(lib);
        snapshots.invalidateAll();
        assertFalse(snapshots.isCached(main));
        assertFalse(snapshots.isCached(lib));
    }

    @Test(timeout = 10000)
    public void testEditDuringCompileIsNotCached() throws Exception {
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> compiledTexts = new CopyOnWriteArrayList<>();
        ProgramLoader blocking = (files, options) -> {
            compiledTexts.add(options.getKCodeList().get(0));
            if (compiledTexts.size() == 1) {
                loading.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return new CompiledProgram(Program.empty(folder.getRoot().toString()), List.of());
        };
        ProgramSnapshots racing = new ProgramSnapshots(new ProgramCompiler(new CompileUnitResolver(null), blocking), vfs);
        vfs.open(main, "a = 1");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<CompiledProgram> first = executor.submit(() -> racing.get(main));
            assertTrue(loading.await(5, TimeUnit.SECONDS));
            vfs.change(main, List.of(KclFixtures.full("a = 2")));
            racing.invalidate(main);
            release.countDown();

            CompiledProgram answered = first.get(5, TimeUnit.SECONDS);
            assertEquals(List.of("a = 1", "a = 2"), compiledTexts);
            assertSame(answered, racing.get(main));
            assertEquals("cached compile is reused", 2, compiledTexts.size());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(expected = OverlayReadException.class)
    public void testUnreadableFile() {
        snapshots.get(folder.getRoot().toPath().resolve("missing.k"));
    }
}
