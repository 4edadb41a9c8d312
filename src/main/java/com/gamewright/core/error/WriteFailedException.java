package com.gamewright.core.error;

/**
 * The artifact could not be written to the output directory.
 */
public class WriteFailedException extends GenerationException {

    public WriteFailedException(String message) {
        super(message);
    }

    public WriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public GenerationErrorKind kind() {
        return GenerationErrorKind.WRITE_FAILED;
    }
}
