package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.compile.ProgramLoaders;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class KclLanguageServerTest {

    private KclLanguageServer server;

    @Before
    public void setUp() {
        server = KclLspLauncher.createServer(List.of("kcl", "mod", "metadata"), ProgramLoaders.EMPTY);
    }

    @Test
    public void testCapabilities() throws Exception {
        InitializeResult result = server.initialize(new InitializeParams()).get();
        assertEquals(TextDocumentSyncKind.Incremental, result.getCapabilities().getTextDocumentSync().getLeft());
        assertTrue(result.getCapabilities().getHoverProvider().getLeft());
        assertTrue(result.getCapabilities().getDefinitionProvider().getLeft());
        assertEquals(KclLanguageServer.NAME, result.getServerInfo().getName());
    }

    @Test
    public void testShutdownClearsErrorCode() throws Exception {
        assertEquals(1, server.getErrorCode());
        server.shutdown().get();
        assertEquals(0, server.getErrorCode());
    }

    @Test
    public void testConnectReachesDocuments() {
        RecordingClient client = new RecordingClient();
        server.connect(client);
        assertNotNull(server.getTextDocumentService());
        assertNotNull(server.getWorkspaceService());
    }
}
