package com.gamewright.core.llm;

import com.gamewright.core.model.ProviderConfig;
import com.gamewright.core.upload.FileBackedProviderClient;

import java.nio.file.Path;

/**
 * A provider resolved for one request. Direct providers take the prompt inline; the
 * file-backed provider only works through an upload batch and has no inline call.
 */
public interface ProviderBinding {

    ProviderConfig config();

    record Direct(ProviderConfig config, TextGenerationClient client) implements ProviderBinding {}

    /**
     * @param anchorDirectory directory holding the {@code .env} marker; staging happens under it
     */
    record FileBacked(ProviderConfig config, FileBackedProviderClient client, Path anchorDirectory)
            implements ProviderBinding {}
}
