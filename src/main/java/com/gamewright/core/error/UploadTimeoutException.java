package com.gamewright.core.error;

/**
 * An uploaded file did not become ACTIVE before the polling timeout.
 */
public class UploadTimeoutException extends GenerationException {

    public UploadTimeoutException(String message) {
        super(message);
    }

    public UploadTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.UPLOAD_TIMEOUT;
    }
}
