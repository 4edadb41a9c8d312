package com.gamewright.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * One generation call: ordered input documents, what to produce, and where to put it.
 * Immutable; the document list is copied on construction.
 */
public record GenerationRequest(
        String requestId,
        List<InputDocument> documents,
        TaskKind taskKind,
        String projectName,
        Path outputDirectory
) {
    public GenerationRequest {
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        if (taskKind == null) {
            throw new IllegalArgumentException("Task kind is required");
        }
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("Project name is required");
        }
        if (outputDirectory == null) {
            throw new IllegalArgumentException("Output directory is required");
        }
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("At least one input document is required");
        }
        documents = List.copyOf(documents);
        for (InputDocument doc : documents) {
            if (!taskKind.accepts(doc.role())) {
                throw new IllegalArgumentException(
                        "Document %s has role %s, which is not valid for %s"
                                .formatted(doc.displayName(), doc.role(), taskKind));
            }
        }
        if (taskKind == TaskKind.SPEC_GENERATION
                && documents.stream().noneMatch(d -> d.role() == DocumentRole.SOURCE)) {
            throw new IllegalArgumentException("Specification generation needs at least one source document");
        }
    }

    public GenerationRequest(List<InputDocument> documents, TaskKind taskKind,
                             String projectName, Path outputDirectory) {
        this(null, documents, taskKind, projectName, outputDirectory);
    }

    List<InputDocument> documentsWithRole(DocumentRole role) {
        return documents.stream().filter(d -> d.role() == role).toList();
    }
}
