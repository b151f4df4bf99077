package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.LanguageServiceException;

/**
 * Neither the open buffers nor the file system had readable content for a file.
 */
public class OverlayReadException extends LanguageServiceException {

    public OverlayReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
