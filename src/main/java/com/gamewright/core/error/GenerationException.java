package com.gamewright.core.error;

/**
 * Base type for every failure the generation pipeline raises on purpose.
 * The orchestrator turns these into a failed result using {@link #kind()}.
 */
public abstract class GenerationException extends RuntimeException {

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract GenerationErrorKind kind();
}
