package com.gamewright.core.error;

/**
 * The calling thread was interrupted while the request was in flight.
 */
public class GenerationCancelledException extends GenerationException {

    public GenerationCancelledException(String message) {
        super(message);
    }

    public GenerationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.CANCELLED;
    }
}
