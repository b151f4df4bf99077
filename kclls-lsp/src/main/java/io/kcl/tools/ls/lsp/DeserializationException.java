package io.kcl.tools.ls.lsp;

import io.kcl.tools.ls.LanguageServiceException;

/**
 * Structured client input did not match the expected shape.
 */
public class DeserializationException extends LanguageServiceException {

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
