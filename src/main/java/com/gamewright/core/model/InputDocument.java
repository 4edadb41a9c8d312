package com.gamewright.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A local document fed into a generation request.
 *
 * @param path        location of the bytes on local disk
 * @param displayName name shown to the model (usually the file name)
 * @param contentType MIME type used when the document is uploaded
 * @param role        source, guideline or specification
 */
public record InputDocument(
        Path path,
        String displayName,
        String contentType,
        DocumentRole role
) {
    public InputDocument {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(role, "role");
        if (displayName == null || displayName.isBlank()) {
            displayName = path.getFileName().toString();
        }
        if (contentType == null || contentType.isBlank()) {
            contentType = "application/octet-stream";
        }
    }
}
