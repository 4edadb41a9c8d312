package com.gamewright.core.upload;

import com.gamewright.core.error.InputUnreadableException;
import com.gamewright.core.error.UploadFailedException;
import com.gamewright.core.model.InputDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-request staging folder holding the local copies that get uploaded.
 * Each request gets its own subfolder, so concurrent requests for the same project
 * never touch each other's files. {@link #release()} removes everything it staged.
 */
public final class StagingArea implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

    private final Path directory;
    private final List<Path> staged = new ArrayList<>();
    private boolean released;

    private StagingArea(Path directory) {
        this.directory = directory;
    }

    public static StagingArea create(Path stagingRoot, String requestId) {
        Path directory = stagingRoot.resolve(requestId);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UploadFailedException("Could not create staging folder " + directory, e);
        }
        return new StagingArea(directory);
    }

    /**
     * Copies a document into the staging folder. The index prefix keeps two inputs with
     * the same file name apart.
     */
    public Path stage(InputDocument document, int index) {
        Path target = directory.resolve("%02d-%s".formatted(index, document.path().getFileName()));
        try {
            Files.copy(document.path(), target);
        } catch (IOException e) {
            throw new InputUnreadableException("Could not stage " + document.path() + ": " + e.getMessage(), e);
        }
        staged.add(target);
        return target;
    }

    public Path directory() {
        return directory;
    }

    List<Path> stagedFiles() {
        return List.copyOf(staged);
    }

    /**
     * Deletes every staged copy and the request folder. Failures are logged, never thrown.
     *
     * @return number of paths that could not be deleted
     */
    public int release() {
        if (released) {
            return 0;
        }
        released = true;
        int failures = 0;
        for (Path file : staged) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                failures++;
                log.warn("Failed to delete staged file {}: {}", file, e.getMessage());
            }
        }
        try {
            Files.deleteIfExists(directory);
        } catch (IOException e) {
            failures++;
            log.warn("Failed to delete staging folder {}: {}", directory, e.getMessage());
        }
        return failures;
    }

    @Override
    public void close() {
        release();
    }
}
