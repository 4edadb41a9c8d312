package com.gamewright.core.upload;

import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * MIME type detection by file name, used for the upload content-type.
 */
public final class ContentTypes {

    public static final String FALLBACK = "application/octet-stream";

    // not in Spring's mime.types table, but common in game design folders
    private static final Map<String, String> OVERRIDES = Map.of(
            "md", "text/markdown",
            "markdown", "text/markdown"
    );

    private ContentTypes() {}

    public static String detect(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot >= 0) {
            String override = OVERRIDES.get(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (override != null) {
                return override;
            }
        }
        return MediaTypeFactory.getMediaType(fileName)
                .map(MediaType::toString)
                .orElse(FALLBACK);
    }
}
