package com.gamewright.core.upload;

import com.gamewright.core.model.UploadedFileHandle;

import java.util.List;

/**
 * The ACTIVE handles for one request, in input order. Closing the batch deletes the
 * remote files; it never throws.
 */
public final class UploadBatch implements AutoCloseable {

    private final List<UploadedFileHandle> handles;
    private final Runnable remoteCleanup;
    private boolean closed;

    UploadBatch(List<UploadedFileHandle> handles, Runnable remoteCleanup) {
        this.handles = List.copyOf(handles);
        this.remoteCleanup = remoteCleanup;
    }

    public List<UploadedFileHandle> handles() {
        return handles;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        remoteCleanup.run();
    }
}
