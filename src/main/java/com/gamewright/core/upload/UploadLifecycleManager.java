package com.gamewright.core.upload;

import com.gamewright.core.error.GenerationCancelledException;
import com.gamewright.core.error.GenerationException;
import com.gamewright.core.error.UploadFailedException;
import com.gamewright.core.error.UploadTimeoutException;
import com.gamewright.core.metrics.GenerationMetrics;
import com.gamewright.core.model.FileState;
import com.gamewright.core.model.InputDocument;
import com.gamewright.core.model.RemoteFile;
import com.gamewright.core.model.UploadedFileHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the stage → upload → poll-until-ACTIVE protocol for one batch of documents.
 *
 * <p>The batch either succeeds as a whole or fails as a whole; a caller never sees a
 * partially usable set of handles. Whatever happens, the local staging copies are gone
 * when {@link #upload} returns or throws. On failure the remote files uploaded so far are
 * deleted too; on success they are deleted when the returned {@link UploadBatch} is closed.
 *
 * <p>Polling uses a fixed interval and a fixed timeout measured from each handle's creation
 * time. A thread interrupt aborts the batch with {@link GenerationCancelledException};
 * cleanup still runs.
 */
@Service
public class UploadLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(UploadLifecycleManager.class);

    private final UploadProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final GenerationMetrics metrics;

    public UploadLifecycleManager(UploadProperties properties, Clock clock, Sleeper sleeper,
                                  @Autowired(required = false) GenerationMetrics metrics) {
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * Stages, uploads and waits for every document.
     *
     * @param requestId       names the request's private staging folder
     * @param documents       documents in input order
     * @param anchorDirectory directory the staging folder lives under
     * @param client          the provider's files client
     * @return ACTIVE handles in input order; close it to delete the remote files
     */
    public UploadBatch upload(String requestId, List<InputDocument> documents,
                              Path anchorDirectory, FileBackedProviderClient client) {
        Path stagingRoot = anchorDirectory.resolve(properties.getStagingFolder());
        StagingArea staging = StagingArea.create(stagingRoot, requestId);
        var uploaded = new ArrayList<UploadedFileHandle>();
        boolean succeeded = false;

        try {
            var stagedPaths = new ArrayList<Path>();
            for (int i = 0; i < documents.size(); i++) {
                stagedPaths.add(staging.stage(documents.get(i), i));
            }
            log.info("Staged {} files in {}", stagedPaths.size(), staging.directory());

            for (int i = 0; i < documents.size(); i++) {
                checkNotCancelled();
                uploaded.add(uploadOne(client, documents.get(i), stagedPaths.get(i)));
            }

            var active = new ArrayList<UploadedFileHandle>(uploaded.size());
            for (UploadedFileHandle handle : uploaded) {
                active.add(awaitActive(client, handle).withoutStagedPath());
            }
            log.info("All {} files ACTIVE", active.size());

            succeeded = true;
            return new UploadBatch(active, () -> deleteRemote(client, active));
        } finally {
            releaseStaging(staging);
            if (!succeeded) {
                deleteRemote(client, uploaded);
            }
        }
    }

    private UploadedFileHandle uploadOne(FileBackedProviderClient client, InputDocument document, Path staged) {
        String displayName = document.displayName();
        log.info("Upload: {} ({})", displayName, document.contentType());

        RemoteFile remote;
        try {
            remote = client.upload(staged, document.contentType(), displayName);
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UploadFailedException("Upload failed for " + displayName + ": " + e.getMessage(), e);
        }
        if (remote == null || remote.name() == null || remote.name().isBlank()) {
            throw new UploadFailedException("Upload failed for " + displayName + ": no file name returned");
        }

        return new UploadedFileHandle(
                remote.name(),
                remote.uri(),
                remote.mimeType() != null ? remote.mimeType() : document.contentType(),
                displayName,
                remote.state() != null ? remote.state() : FileState.PENDING,
                staged,
                clock.instant());
    }

    UploadedFileHandle awaitActive(FileBackedProviderClient client, UploadedFileHandle handle) {
        Duration timeout = Duration.ofMillis(properties.getTimeoutMs());
        Duration interval = Duration.ofMillis(properties.getPollIntervalMs());
        String name = handle.remoteName();

        while (true) {
            checkNotCancelled();

            RemoteFile remote = null;
            try {
                remote = client.fetch(name);
            } catch (GenerationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                // remote storage is eventually consistent; a failed poll is not a failed file
                log.debug("Poll of {} failed, retrying: {}", name, e.getMessage());
            }

            Duration elapsed = Duration.between(handle.createdAt(), clock.instant());
            if (remote != null) {
                if (remote.state() == FileState.ACTIVE) {
                    if (metrics != null) {
                        metrics.recordUploadWait(elapsed);
                    }
                    log.info("{} ({}) is ACTIVE after {}ms", handle.displayName(), name, elapsed.toMillis());
                    return handle.withRemote(remote);
                }
                if (remote.state() == FileState.FAILED) {
                    throw new UploadFailedException("File failed processing: " + name);
                }
            }

            if (elapsed.compareTo(timeout) > 0) {
                throw new UploadTimeoutException("Timed out waiting for ACTIVE: %s (%s) after %dms"
                        .formatted(name, handle.displayName(), elapsed.toMillis()));
            }

            try {
                sleeper.sleep(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationCancelledException("Interrupted while waiting for " + name + " to become ACTIVE", e);
            }
        }
    }

    /**
     * Deletes remote files, logging and counting failures. An interrupt flag is parked for
     * the duration so the deletes still go out, then restored.
     */
    void deleteRemote(FileBackedProviderClient client, List<UploadedFileHandle> handles) {
        if (handles.isEmpty()) {
            return;
        }
        boolean interrupted = Thread.interrupted();
        try {
            for (UploadedFileHandle handle : handles) {
                try {
                    client.delete(handle.remoteName());
                    log.info("Deleted remote file {} ({})", handle.remoteName(), handle.displayName());
                } catch (RuntimeException e) {
                    log.warn("Failed to delete remote file {}: {}", handle.remoteName(), e.getMessage());
                    recordCleanupFailure("remote");
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void releaseStaging(StagingArea staging) {
        int failures = staging.release();
        for (int i = 0; i < failures; i++) {
            recordCleanupFailure("local");
        }
    }

    private void recordCleanupFailure(String resource) {
        if (metrics != null) {
            metrics.recordCleanupFailure(resource);
        }
    }

    private static void checkNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new GenerationCancelledException("Upload cancelled by interrupt");
        }
    }
}
