package com.example.mediasync.session;

/**
 * Failure reported by a browser-automation renderer.
 */
public class RendererException extends RuntimeException {
    public RendererException(String message) {
        super(message);
    }

    public RendererException(String message, Throwable cause) {
        super(message, cause);
    }
}
