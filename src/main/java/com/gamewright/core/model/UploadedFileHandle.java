package com.gamewright.core.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Remote identity of one uploaded document. Lives only for the duration of a single
 * generation call.
 *
 * @param remoteName  provider-assigned name, used for polling and deletion
 * @param uri         URI the model references the file by (known once ACTIVE)
 * @param contentType MIME type reported by the provider
 * @param displayName name the file was uploaded under
 * @param state       last observed readiness
 * @param stagedPath  local staging copy that was uploaded; null once staging is released
 * @param createdAt   when the upload was accepted; bounds how long we poll
 */
public record UploadedFileHandle(
        String remoteName,
        String uri,
        String contentType,
        String displayName,
        FileState state,
        Path stagedPath,
        Instant createdAt
) {
    public UploadedFileHandle withRemote(RemoteFile remote) {
        return new UploadedFileHandle(
                remoteName,
                remote.uri() != null ? remote.uri() : uri,
                remote.mimeType() != null ? remote.mimeType() : contentType,
                displayName,
                remote.state(),
                stagedPath,
                createdAt);
    }

    public UploadedFileHandle withoutStagedPath() {
        return new UploadedFileHandle(remoteName, uri, contentType, displayName, state, null, createdAt);
    }

    public boolean isActive() {
        return state == FileState.ACTIVE;
    }
}
