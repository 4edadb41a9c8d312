package com.gamewright.core.upload;

import com.gamewright.core.model.RemoteFile;
import com.gamewright.core.model.UploadedFileHandle;

import java.nio.file.Path;
import java.util.List;

/**
 * A provider that only generates from files already materialized in its remote storage.
 * There is deliberately no plain text call: callers go through
 * {@link UploadLifecycleManager}, which hands out ACTIVE handles.
 * Implementations: {@link GoogleFilesApiClient}.
 */
public interface FileBackedProviderClient {

    /**
     * Uploads a local file.
     * @return the remote file as first reported; usually still processing
     */
    RemoteFile upload(Path file, String mimeType, String displayName);

    /**
     * Reads the current remote state of a previously uploaded file.
     */
    RemoteFile fetch(String remoteName);

    /**
     * Removes an uploaded file from remote storage.
     */
    void delete(String remoteName);

    /**
     * Generates text from a prompt that references the given ACTIVE files.
     *
     * @return generated text, possibly empty
     */
    String generate(String model, String prompt, String systemInstruction, List<UploadedFileHandle> files);
}
