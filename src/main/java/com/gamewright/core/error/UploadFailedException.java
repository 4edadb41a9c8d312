package com.gamewright.core.error;

/**
 * An upload was rejected, returned no handle, or the provider reported the file as FAILED.
 */
public class UploadFailedException extends GenerationException {

    public UploadFailedException(String message) {
        super(message);
    }

    public UploadFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.UPLOAD_FAILED;
    }
}
