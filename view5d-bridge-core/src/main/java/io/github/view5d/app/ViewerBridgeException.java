package io.github.view5d.app;

/**
 * Thrown when a call across the viewer bridge fails, either because the
 * viewer class or method cannot be reached or because the viewer itself threw.
 */
public class ViewerBridgeException extends RuntimeException {

    public ViewerBridgeException(String message) {
        super(message);
    }

    public ViewerBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
