package com.gamewright.core.engine;

import com.gamewright.core.error.EmptyResponseException;
import com.gamewright.core.error.GenerationErrorKind;
import com.gamewright.core.error.GenerationException;
import com.gamewright.core.error.InputUnreadableException;
import com.gamewright.core.llm.LlmProperties;
import com.gamewright.core.llm.ProviderBinding;
import com.gamewright.core.llm.ProviderClientFactory;
import com.gamewright.core.logging.MdcContext;
import com.gamewright.core.metrics.GenerationMetrics;
import com.gamewright.core.model.DocumentRole;
import com.gamewright.core.model.GenerationRequest;
import com.gamewright.core.model.GenerationResult;
import com.gamewright.core.model.InputDocument;
import com.gamewright.core.model.PromptDocument;
import com.gamewright.core.model.ProviderConfig;
import com.gamewright.core.model.TaskKind;
import com.gamewright.core.output.ArtifactWriter;
import com.gamewright.core.prompt.BuiltPrompt;
import com.gamewright.core.prompt.PromptBuilder;
import com.gamewright.core.upload.ContentTypes;
import com.gamewright.core.upload.UploadBatch;
import com.gamewright.core.upload.UploadLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs one generation request end to end: resolve the provider, build the prompt, call the
 * model, write the artifact.
 * <p>
 * Nothing thrown below this class reaches the caller. Every failure is folded into a
 * {@link GenerationResult} carrying its {@link GenerationErrorKind} and a single message.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final ProviderClientFactory providerClientFactory;
    private final UploadLifecycleManager uploadLifecycleManager;
    private final ArtifactWriter artifactWriter;
    private final LlmProperties llmProperties;
    private final GenerationMetrics metrics;

    public GenerationOrchestrator(ProviderClientFactory providerClientFactory,
                                  UploadLifecycleManager uploadLifecycleManager,
                                  ArtifactWriter artifactWriter,
                                  LlmProperties llmProperties,
                                  GenerationMetrics metrics) {
        this.providerClientFactory = providerClientFactory;
        this.uploadLifecycleManager = uploadLifecycleManager;
        this.artifactWriter = artifactWriter;
        this.llmProperties = llmProperties;
        this.metrics = metrics;
    }

    /**
     * Generates a game specification from source documents and optional guidelines.
     */
    public GenerationResult generateSpecification(List<Path> sources, List<Path> guidelines,
                                                  Path outputDirectory, String projectName,
                                                  ProviderConfig providerConfig) {
        return run(providerConfig, TaskKind.SPEC_GENERATION, () -> {
            var documents = new ArrayList<InputDocument>();
            documents.addAll(toDocuments(sources, DocumentRole.SOURCE));
            documents.addAll(toDocuments(guidelines, DocumentRole.GUIDELINE));
            return new GenerationRequest(documents, TaskKind.SPEC_GENERATION, projectName, outputDirectory);
        });
    }

    /**
     * Generates a game implementation from one or more specification documents.
     */
    public GenerationResult implementArtifact(List<Path> specifications, Path outputDirectory,
                                              String projectName, ProviderConfig providerConfig) {
        return run(providerConfig, TaskKind.IMPLEMENTATION_GENERATION, () -> new GenerationRequest(
                toDocuments(specifications, DocumentRole.SPECIFICATION),
                TaskKind.IMPLEMENTATION_GENERATION, projectName, outputDirectory));
    }

    public GenerationResult generate(GenerationRequest request, ProviderConfig providerConfig) {
        return run(providerConfig, request == null ? null : request.taskKind(), () -> {
            if (request == null) {
                throw new IllegalArgumentException("Generation request is required");
            }
            return request;
        });
    }

    private GenerationResult run(ProviderConfig providerConfig, TaskKind fallbackKind,
                                 Supplier<GenerationRequest> requestSupplier) {
        if (providerConfig == null) {
            return fail(GenerationErrorKind.INVALID_REQUEST, "Provider configuration is required", null);
        }
        long start = System.currentTimeMillis();
        TaskKind kind = fallbackKind;
        GenerationResult result;
        try {
            GenerationRequest request = requestSupplier.get();
            kind = request.taskKind();
            MdcContext.setGeneration(request.requestId(), request.projectName(),
                    kind.fileTag(), providerConfig.provider().id());
            log.info("Generating {} for '{}' from {} documents with {}",
                    kind, request.projectName(), request.documents().size(), providerConfig);

            Path written = execute(request, providerConfig);
            result = GenerationResult.succeeded(written);
            log.info("Generation complete: {}", written);
        } catch (GenerationException e) {
            result = fail(e.kind(), e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            result = fail(GenerationErrorKind.INVALID_REQUEST, e.getMessage(), e);
        } catch (Exception e) {
            result = fail(GenerationErrorKind.INTERNAL, "Unexpected error: " + e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
        if (kind != null) {
            metrics.recordGeneration(providerConfig.provider(), kind, result.success(),
                    System.currentTimeMillis() - start);
        }
        return result;
    }

    private Path execute(GenerationRequest request, ProviderConfig providerConfig) {
        ProviderBinding binding = providerClientFactory.bind(providerConfig, request.outputDirectory());

        String content;
        if (binding instanceof ProviderBinding.FileBacked files) {
            content = generateWithUploads(request, files);
        } else if (binding instanceof ProviderBinding.Direct direct) {
            content = generateInline(request, direct);
        } else {
            throw new IllegalStateException("Unsupported provider binding: " + binding);
        }

        checkContent(content, binding.config());
        return artifactWriter.write(request.outputDirectory(), request.projectName(), request.taskKind(), content);
    }

    private String generateWithUploads(GenerationRequest request, ProviderBinding.FileBacked binding) {
        try (UploadBatch batch = uploadLifecycleManager.upload(
                request.requestId(), request.documents(), binding.anchorDirectory(), binding.client())) {
            List<PromptDocument> attached = request.documents().stream()
                    .map(d -> PromptDocument.attached(d.role(), d.displayName()))
                    .toList();
            BuiltPrompt prompt = PromptBuilder.build(attached, request.taskKind(), request.projectName());
            log.info("Generating with {} attached files", batch.handles().size());
            return binding.client().generate(binding.config().model(), prompt.prompt(),
                    prompt.systemInstruction(), batch.handles());
        }
    }

    private String generateInline(GenerationRequest request, ProviderBinding.Direct binding) {
        var blocks = new ArrayList<PromptDocument>(request.documents().size());
        for (InputDocument document : request.documents()) {
            blocks.add(PromptDocument.inline(document.role(), document.displayName(), read(document)));
        }
        BuiltPrompt prompt = PromptBuilder.build(blocks, request.taskKind(), request.projectName());
        return binding.client().sendText(prompt.prompt(), prompt.systemInstruction());
    }

    private void checkContent(String content, ProviderConfig config) {
        if (content != null && !content.isEmpty()) {
            return;
        }
        if (llmProperties.isFailOnEmptyResponse()) {
            throw new EmptyResponseException(config.provider().id() + " returned no content");
        }
        log.warn("{} returned an empty response; writing an empty artifact", config.provider().id());
    }

    /** Malformed UTF-8 is replaced rather than rejected; a Latin-1 note is still a usable input. */
    private static String read(InputDocument document) {
        try {
            return new String(Files.readAllBytes(document.path()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputUnreadableException("Could not read " + document.path() + ": " + e.getMessage(), e);
        }
    }

    private static List<InputDocument> toDocuments(List<Path> paths, DocumentRole role) {
        if (paths == null) {
            return List.of();
        }
        return paths.stream()
                .map(p -> new InputDocument(p, null, ContentTypes.detect(p), role))
                .toList();
    }

    private GenerationResult fail(GenerationErrorKind kind, String message, Exception e) {
        String text = message == null || message.isBlank() ? kind.name() : message;
        if (kind == GenerationErrorKind.INTERNAL) {
            log.error("Generation failed ({}): {}", kind, text, e);
        } else {
            log.error("Generation failed ({}): {}", kind, text);
        }
        metrics.recordError(kind);
        return GenerationResult.failed(kind, text);
    }
}
