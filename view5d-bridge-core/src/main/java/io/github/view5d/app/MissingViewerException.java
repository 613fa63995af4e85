package io.github.view5d.app;

/**
 * Thrown when an operation needs an existing viewer but neither an explicit
 * handle nor an active one is available.
 */
public class MissingViewerException extends IllegalStateException {

    public MissingViewerException(String message) {
        super(message);
    }
}
