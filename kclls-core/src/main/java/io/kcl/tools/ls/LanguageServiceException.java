package io.kcl.tools.ls;

/**
 * Root of the errors raised while serving a single language request.
 */
public class LanguageServiceException extends RuntimeException {

    public LanguageServiceException(String message) {
        super(message);
    }

    public LanguageServiceException(Throwable cause) {
        super(cause);
    }

    public LanguageServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
