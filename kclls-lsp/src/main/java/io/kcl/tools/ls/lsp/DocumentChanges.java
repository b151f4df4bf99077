package io.kcl.tools.ls.lsp;

import org.eclipse.lsp4j.TextDocumentContentChangeEvent;

import java.util.List;

public final class DocumentChanges {

    private DocumentChanges() {
    }

    /**
     * Applies the edits in order, each against the text produced by the previous one. An
     * edit without a range replaces the whole text.
     */
    public static String apply(String text, List<TextDocumentContentChangeEvent> changes) {
        StringBuilder current = new StringBuilder(text == null ? "" : text);
        for (TextDocumentContentChangeEvent change : changes) {
            String replacement = change.getText() == null ? "" : change.getText();
            if (change.getRange() == null) {
                current.setLength(0);
                current.append(replacement);
            } else {
                int[] range = LspConversions.textRange(current.toString(), change.getRange());
                current.replace(range[0], range[1], replacement);
            }
        }
        return current.toString();
    }
}
