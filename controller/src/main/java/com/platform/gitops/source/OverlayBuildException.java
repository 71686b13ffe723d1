package com.platform.gitops.source;

/**
 * The overlay could not be rendered.
 */
public class OverlayBuildException extends RuntimeException {

    public OverlayBuildException(String message) {
        super(message);
    }

    public OverlayBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
