package com.gamewright.core.error;

/**
 * An input document could not be read or copied.
 */
public class InputUnreadableException extends GenerationException {

    public InputUnreadableException(String message) {
        super(message);
    }

    public InputUnreadableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.INPUT_UNREADABLE;
    }
}
