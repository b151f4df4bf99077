package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.LanguageServiceException;
import io.kcl.tools.ls.ast.Pos;
import io.kcl.tools.ls.compile.CompiledProgram;
import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Text document service for the KCL language server.
 * Keeps open buffers in the {@link Vfs}, drops stale snapshots on every edit and answers
 * hover and definition requests against the compiled snapshot of the file.
 */
public class KclTextDocumentService implements TextDocumentService {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final Vfs vfs;
    private final ProgramSnapshots snapshots;
    private final HoverProvider hoverProvider;
    private final DefinitionProvider definitionProvider;
    private final DiagnosticsProvider diagnosticsProvider;
    private volatile ServerSettings settings = new ServerSettings();
    private LanguageClient client;

    public KclTextDocumentService(Vfs vfs, ProgramSnapshots snapshots, DefinitionProvider definitionProvider) {
        this.vfs = vfs;
        this.snapshots = snapshots;
        this.hoverProvider = new HoverProvider();
        this.definitionProvider = definitionProvider;
        this.diagnosticsProvider = new DiagnosticsProvider();
    }

    public void setClient(LanguageClient client) {
        this.client = client;
    }

    public ServerSettings getSettings() {
        return settings;
    }

    public void setSettings(ServerSettings settings) {
        this.settings = settings;
    }

    public ProgramSnapshots getSnapshots() {
        return snapshots;
    }

    public Vfs getVfs() {
        return vfs;
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        try {
            Path path = LspConversions.absPath(uri);
            vfs.open(path, params.getTextDocument().getText());
            snapshots.invalidate(path);
            publishDiagnostics(uri, path);
        } catch (LanguageServiceException e) {
            logger.errorf("didOpen %s failed: %s", uri, e.getMessage());
        }
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        try {
            Path path = LspConversions.absPath(uri);
            if (vfs.change(path, params.getContentChanges()) == null) {
                logger.warnf("change for %s which is not open", uri);
                return;
            }
            snapshots.invalidate(path);
            publishDiagnostics(uri, path);
        } catch (LanguageServiceException e) {
            logger.errorf("didChange %s failed: %s", uri, e.getMessage());
        }
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        try {
            Path path = LspConversions.absPath(uri);
            vfs.close(path);
            snapshots.invalidate(path);
        } catch (LanguageServiceException e) {
            logger.errorf("didClose %s failed: %s", uri, e.getMessage());
        }
        if (client != null) {
            client.publishDiagnostics(new PublishDiagnosticsParams(uri, Collections.emptyList()));
        }
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        try {
            snapshots.invalidate(LspConversions.absPath(uri));
        } catch (LanguageServiceException e) {
            logger.errorf("didSave %s failed: %s", uri, e.getMessage());
        }
    }

    @Override
    public CompletableFuture<Hover> hover(HoverParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String uri = params.getTextDocument().getUri();
            try {
                Path path = LspConversions.absPath(uri);
                CompiledProgram compiled = snapshots.get(path);
                Pos pos = LspConversions.kclPos(path, params.getPosition());
                return hoverProvider.hover(compiled.getProgram(), pos, settings.isShowSchemaContext());
            } catch (LanguageServiceException e) {
                logger.errorf("hover %s failed: %s", uri, e.getMessage());
                return null;
            }
        });
    }

    @Override
    public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(DefinitionParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String uri = params.getTextDocument().getUri();
            try {
                Path path = LspConversions.absPath(uri);
                CompiledProgram compiled = snapshots.get(path);
                Pos pos = LspConversions.kclPos(path, params.getPosition());
                return Either.forLeft(definitionProvider.definition(compiled.getProgram(), pos));
            } catch (LanguageServiceException e) {
                logger.errorf("definition %s failed: %s", uri, e.getMessage());
                return Either.forLeft(Collections.emptyList());
            }
        });
    }

    private void publishDiagnostics(String uri, Path path) {
        if (client == null || !settings.isPublishDiagnostics()) {
            return;
        }
        CompiledProgram compiled = snapshots.get(path);
        List<Diagnostic> diagnostics = diagnosticsProvider.diagnose(compiled, path.toString());
        client.publishDiagnostics(new PublishDiagnosticsParams(uri, diagnostics));
    }
}
