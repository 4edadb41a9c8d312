package com.gamewright.core.error;

/**
 * Failure categories surfaced on a failed {@code GenerationResult}.
 */
public enum GenerationErrorKind {
    MISSING_CREDENTIAL,
    ANCHOR_NOT_FOUND,
    TRANSPORT_ERROR,
    UPLOAD_FAILED,
    UPLOAD_TIMEOUT,
    EMPTY_RESPONSE,
    WRITE_FAILED,
    INVALID_REQUEST,
    INPUT_UNREADABLE,
    CANCELLED,
    INTERNAL
}
