package com.gamewright.core.error;

/**
 * Thrown before any network call when the selected provider has no usable API key.
 */
public class MissingCredentialException extends GenerationException {

    public MissingCredentialException(String message) {
        super(message);
    }

    public MissingCredentialException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.MISSING_CREDENTIAL;
    }
}
