package com.gamewright.core.output;

import com.gamewright.core.error.WriteFailedException;
import com.gamewright.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes a generated artifact as {@code {project}-{tag}-{timestamp}.{ext}}.
 * <p>
 * The content goes to a temp file beside the target first. Only the finished temp is then
 * given its final name, by hard link where the file system allows it and by a
 * non-replacing move otherwise, so the final name never refers to an empty or partial
 * file. Two writes in the same second get a {@code -2}, {@code -3}, ... suffix instead of
 * overwriting each other.
 */
@Component
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneOffset.UTC);

    private static final int MAX_COLLISIONS = 1000;

    private final Clock clock;

    public ArtifactWriter(Clock clock) {
        this.clock = clock;
    }

    public Path write(Path directory, String projectName, TaskKind kind, String content) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new WriteFailedException("Could not create output directory " + directory, e);
        }

        String baseName = sanitize(projectName) + "-" + kind.fileTag() + "-" + TIMESTAMP.format(clock.instant());

        Path temp = null;
        try {
            temp = writeTemp(directory, content == null ? "" : content);
            Path target = claim(temp, directory, baseName, kind.extension());
            log.info("Wrote {} ({} chars)", target, content == null ? 0 : content.length());
            return target;
        } catch (IOException e) {
            throw new WriteFailedException("Could not write artifact " + baseName + " in " + directory
                    + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    static String sanitize(String projectName) {
        String cleaned = projectName == null ? "" : projectName.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
        cleaned = cleaned.replaceAll("^[._]+", "");
        return cleaned.isEmpty() ? "project" : cleaned;
    }

    Path writeTemp(Path directory, String content) throws IOException {
        Path temp = Files.createTempFile(directory, ".gamewright-", ".tmp");
        try {
            return Files.writeString(temp, content, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    private Path claim(Path temp, Path directory, String baseName, String extension) throws IOException {
        boolean linkable = true;
        for (int attempt = 1; attempt <= MAX_COLLISIONS; attempt++) {
            String suffix = attempt == 1 ? "" : "-" + attempt;
            Path candidate = directory.resolve(baseName + suffix + "." + extension);
            try {
                if (linkable) {
                    Files.createLink(candidate, temp);
                } else {
                    Files.move(temp, candidate);
                }
                return candidate;
            } catch (FileAlreadyExistsException e) {
                log.debug("{} already exists, trying next suffix", candidate.getFileName());
            } catch (UnsupportedOperationException | FileSystemException e) {
                if (!linkable) {
                    throw e;
                }
                log.debug("Hard links unavailable in {}, falling back to move: {}", directory, e.getMessage());
                linkable = false;
                attempt--;
            }
        }
        throw new WriteFailedException("Too many artifacts named " + baseName + " in " + directory);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}
