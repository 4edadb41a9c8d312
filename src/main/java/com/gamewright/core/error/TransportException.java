package com.gamewright.core.error;

/**
 * Network or HTTP failure while talking to a provider.
 */
public class TransportException extends GenerationException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.TRANSPORT_ERROR;
    }
}
