package io.kcl.tools.ls.pkg;

import io.kcl.tools.ls.LanguageServiceException;

public class MetadataFetchException extends LanguageServiceException {

    public MetadataFetchException(String message) {
        super(message);
    }

    public MetadataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
