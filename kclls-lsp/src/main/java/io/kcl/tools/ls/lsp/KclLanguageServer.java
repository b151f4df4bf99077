package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.compile.ProgramCompiler;
import io.kcl.tools.ls.pkg.ImportPositions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.util.concurrent.CompletableFuture;

/**
 * KCL Language Server implementation.
 * Provides hover, go-to-definition and diagnostics for KCL files.
 */
public class KclLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final String NAME = "KCL Language Server";
    public static final String VERSION = "0.1.0-SNAPSHOT";

    private final KclTextDocumentService textDocumentService;
    private final KclWorkspaceService workspaceService;
    private LanguageClient client;
    private int errorCode = 1;

    public KclLanguageServer(ProgramCompiler compiler, ImportPositions importPositions) {
        Vfs vfs = new Vfs();
        ProgramSnapshots snapshots = new ProgramSnapshots(compiler, vfs);
        this.textDocumentService = new KclTextDocumentService(vfs, snapshots, new DefinitionProvider(importPositions));
        this.workspaceService = new KclWorkspaceService(textDocumentService);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        ServerCapabilities capabilities = new ServerCapabilities();

        capabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        capabilities.setHoverProvider(true);
        capabilities.setDefinitionProvider(true);

        InitializeResult result = new InitializeResult(capabilities);
        result.setServerInfo(new ServerInfo(NAME, VERSION));

        logger.info("KCL Language Server initialized");
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        errorCode = 0;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        System.exit(errorCode);
    }

    public int getErrorCode() {
        return errorCode;
    }

    @Override
    public KclTextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
        this.textDocumentService.setClient(client);
        logger.info("Language client connected");
    }
}
