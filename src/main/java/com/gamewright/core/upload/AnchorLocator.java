package com.gamewright.core.upload;

import com.gamewright.core.error.AnchorNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finds the anchor directory: the nearest directory, walking upward from a starting
 * point, that holds the marker file. The walk is bounded so a misconfigured output
 * path fails fast instead of scanning to the filesystem root.
 */
@Component
public class AnchorLocator {

    private static final Logger log = LoggerFactory.getLogger(AnchorLocator.class);

    private final String marker;
    private final int maxDepth;

    @Autowired
    public AnchorLocator(UploadProperties properties) {
        this(properties.getAnchorMarker(), properties.getMaxAnchorDepth());
    }

    AnchorLocator(String marker, int maxDepth) {
        this.marker = marker;
        this.maxDepth = maxDepth;
    }

    public Path locate(Path start) {
        Path current = start.toAbsolutePath().normalize();
        for (int level = 0; level < maxDepth && current != null; level++) {
            Path candidate = current.resolve(marker);
            log.debug("Checking for {} at {}", marker, candidate);
            if (Files.isRegularFile(candidate)) {
                log.info("Found {} at {}", marker, candidate);
                return current;
            }
            current = current.getParent();
        }
        throw new AnchorNotFoundException(
                "Could not find %s file. Searched %d levels up from: %s. Please create a %s file with GEMINI_API_KEY=your_key in your project root directory."
                        .formatted(marker, maxDepth, start, marker));
    }

    public Path markerFile(Path anchor) {
        return anchor.resolve(marker);
    }
}
