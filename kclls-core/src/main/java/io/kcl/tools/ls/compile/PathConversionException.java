package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.LanguageServiceException;

/**
 * A file path could not be turned into a file URI, or a URI into a local path.
 */
public class PathConversionException extends LanguageServiceException {

    public PathConversionException(String message) {
        super(message);
    }

    public PathConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
