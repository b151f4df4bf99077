package io.kcl.tools.ls.lsp;

/**
 * Client side settings sent with {@code workspace/didChangeConfiguration}, under the
 * {@code kcl} section.
 */
public class ServerSettings {

    private boolean publishDiagnostics = true;
    private boolean showSchemaContext = true;

    public boolean isPublishDiagnostics() {
        return publishDiagnostics;
    }

    public void setPublishDiagnostics(boolean publishDiagnostics) {
        this.publishDiagnostics = publishDiagnostics;
    }

    /**
     * Whether hovers name the schema whose config body holds the cursor.
     */
    public boolean isShowSchemaContext() {
        return showSchemaContext;
    }

    public void setShowSchemaContext(boolean showSchemaContext) {
        this.showSchemaContext = showSchemaContext;
    }

    @Override
    public String toString() {
        return "ServerSettings{publishDiagnostics=" + publishDiagnostics + ", showSchemaContext=" + showSchemaContext + "}";
    }
}
