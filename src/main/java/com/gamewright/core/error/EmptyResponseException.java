package com.gamewright.core.error;

/**
 * The provider returned no text. Only raised when empty responses are configured as failures.
 */
public class EmptyResponseException extends GenerationException {

    public EmptyResponseException(String message) {
        super(message);
    }

    public EmptyResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.EMPTY_RESPONSE;
    }
}
