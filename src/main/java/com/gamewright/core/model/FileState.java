package com.gamewright.core.model;

/**
 * Readiness of an uploaded file on the remote side.
 */
public enum FileState {
    PENDING,
    ACTIVE,
    FAILED;

    /** Maps the remote API's state string; anything unrecognised is still processing. */
    public static FileState fromRemote(String state) {
        if ("ACTIVE".equalsIgnoreCase(state)) {
            return ACTIVE;
        }
        if ("FAILED".equalsIgnoreCase(state)) {
            return FAILED;
        }
        return PENDING;
    }
}
