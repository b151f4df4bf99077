package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.compile.CompileUnitResolver;
import io.kcl.tools.ls.compile.ProgramCompiler;
import io.kcl.tools.ls.pkg.ExternalPackages;
import io.kcl.tools.ls.pkg.ImportPositions;
import io.kcl.tools.ls.pkg.PackageMetadata;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.List;

import static io.kcl.tools.ls.lsp.KclFixtures.replace;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class KclTextDocumentServiceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path main;
    private String uri;
    private RecordingLoader loader;
    private RecordingClient client;
    private KclTextDocumentService service;

    @Before
    public void setUp() {
        Path root = folder.getRoot().toPath();
        main = root.resolve("main.k");
        uri = LspConversions.fileUri(main.toString());
        loader = new RecordingLoader(root);
        client = new RecordingClient();
        Vfs vfs = new Vfs();
        ProgramSnapshots snapshots = new ProgramSnapshots(new ProgramCompiler(new CompileUnitResolver(null), loader), vfs);
        ImportPositions importPositions = new ImportPositions(new ExternalPackages(path -> PackageMetadata.empty()));
        service = new KclTextDocumentService(vfs, snapshots, new DefinitionProvider(importPositions));
        service.setClient(client);
    }

    private void open() {
        service.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(uri, "kcl", 1, KclFixtures.SOURCE)));
    }

    @Test
    public void testOpenPublishesDiagnostics() {
        open();
        assertTrue(service.getVfs().isOpen(main));
        PublishDiagnosticsParams published = client.last();
        assertNotNull("diagnostics published on open", published);
        assertEquals(uri, published.getUri());
        assertEquals(1, published.getDiagnostics().size());
        assertEquals(DiagnosticSeverity.Error, published.getDiagnostics().get(0).getSeverity());
        assertEquals(new Range(new Position(0, 0), new Position(0, 6)), published.getDiagnostics().get(0).getRange());
    }

    @Test
    public void testDiagnosticsCanBeTurnedOff() {
        ServerSettings settings = new ServerSettings();
        settings.setPublishDiagnostics(false);
        service.setSettings(settings);
        open();
        assertTrue(client.diagnostics.isEmpty());
        assertEquals(0, loader.loads());
    }

    @Test
    public void testChangeRecompilesEditedText() {
        open();
        service.didChange(new DidChangeTextDocumentParams(new VersionedTextDocumentIdentifier(uri, 2),
                List.of(replace(3, 20, 3, 25, "Bob"))));
        assertEquals(2, loader.loads());
        assertTrue(loader.options.get(1).getKCodeList().get(0).contains("\"Bob\""));
        assertEquals(2, client.diagnostics.size());
    }

    @Test
    public void testChangeOfUnopenedDocumentIsIgnored() {
        service.didChange(new DidChangeTextDocumentParams(new VersionedTextDocumentIdentifier(uri, 2),
                List.of(replace(0, 0, 0, 0, "x"))));
        assertEquals(0, loader.loads());
        assertTrue(client.diagnostics.isEmpty());
    }

    @Test
    public void testCloseClearsDiagnostics() {
        open();
        service.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(uri)));
        assertFalse(service.getVfs().isOpen(main));
        assertTrue(client.last().getDiagnostics().isEmpty());
        assertFalse(service.getSnapshots().isCached(main));
    }

    @Test
    public void testSaveDropsSnapshot() {
        open();
        assertTrue(service.getSnapshots().isCached(main));
        service.didSave(new DidSaveTextDocumentParams(new TextDocumentIdentifier(uri)));
        assertFalse(service.getSnapshots().isCached(main));
    }

    @Test
    public void testHoverOnConfigKey() throws Exception {
        open();
        Hover hover = service.hover(new HoverParams(new TextDocumentIdentifier(uri), new Position(3, 13))).get();
        assertNotNull(hover);
        assertTrue(hover.getContents().getRight().getValue().startsWith("**name**"));
        assertEquals("hover reuses the snapshot built on open", 1, loader.loads());
    }

    @Test
    public void testHoverOnUnreadableFile() throws Exception {
        assertNull(service.hover(new HoverParams(new TextDocumentIdentifier(uri), new Position(3, 13))).get());
    }

    @Test
    public void testHoverOnBadUri() throws Exception {
        assertNull(service.hover(new HoverParams(new TextDocumentIdentifier("http://example.com/main.k"), new Position(0, 0))).get());
    }

    @Test
    public void testDefinitionOfSchema() throws Exception {
        open();
        List<? extends Location> locations = service.definition(
                new DefinitionParams(new TextDocumentIdentifier(uri), new Position(3, 6))).get().getLeft();
        assertEquals(1, locations.size());
        assertEquals(uri, locations.get(0).getUri());
        assertEquals(new Range(new Position(0, 7), new Position(0, 12)), locations.get(0).getRange());
    }

    @Test
    public void testDefinitionOnUnreadableFile() throws Exception {
        assertTrue(service.definition(new DefinitionParams(new TextDocumentIdentifier(uri), new Position(3, 6)))
                .get().getLeft().isEmpty());
    }
}
