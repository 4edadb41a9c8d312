package com.gamewright.core.error;

/**
 * Thrown when no marker file is found within the allowed number of parent directories.
 */
public class AnchorNotFoundException extends GenerationException {

    public AnchorNotFoundException(String message) {
        super(message);
    }

    public AnchorNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.ANCHOR_NOT_FOUND;
    }
}
