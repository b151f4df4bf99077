package io.kcl.tools.ls.lsp;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.kcl.tools.ls.LanguageServiceException;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;

/**
 * Workspace service for the KCL language server.
 */
public class KclWorkspaceService implements WorkspaceService {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final String SETTINGS_SECTION = "kcl";

    private final KclTextDocumentService documents;

    public KclWorkspaceService(KclTextDocumentService documents) {
        this.documents = documents;
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        JsonElement json = params.getSettings() instanceof JsonElement
                ? (JsonElement) params.getSettings()
                : JsonUtil.toJson(params.getSettings());
        if (json != null && json.isJsonObject() && ((JsonObject) json).has(SETTINGS_SECTION)) {
            json = ((JsonObject) json).get(SETTINGS_SECTION);
        }
        try {
            ServerSettings settings = JsonUtil.fromJson("ServerSettings", json, ServerSettings.class);
            documents.setSettings(settings);
            logger.infof("settings changed: %s", settings);
        } catch (DeserializationException e) {
            logger.warnf("ignoring settings: %s", e.getMessage());
        }
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        for (FileEvent event : params.getChanges()) {
            try {
                documents.getSnapshots().invalidate(LspConversions.absPath(event.getUri()));
            } catch (LanguageServiceException e) {
                logger.warnf("ignoring watched file %s: %s", event.getUri(), e.getMessage());
            }
        }
    }
}
