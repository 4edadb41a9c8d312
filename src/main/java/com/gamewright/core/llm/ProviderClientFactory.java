package com.gamewright.core.llm;

import com.gamewright.core.error.InputUnreadableException;
import com.gamewright.core.error.MissingCredentialException;
import com.gamewright.core.model.ProviderConfig;
import com.gamewright.core.model.ProviderKind;
import com.gamewright.core.upload.AnchorLocator;
import com.gamewright.core.upload.EnvFile;
import com.gamewright.core.upload.FilesClientFactory;
import com.gamewright.core.upload.UploadProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Resolves a {@link ProviderConfig} into a fresh {@link ProviderBinding} for one request.
 * <p>
 * No client or model is built unless a credential is present, so a missing key fails
 * without any network traffic.
 */
@Component
public class ProviderClientFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderClientFactory.class);

    private final ChatModelFactory chatModelFactory;
    private final FilesClientFactory filesClientFactory;
    private final AnchorLocator anchorLocator;
    private final UploadProperties uploadProperties;

    public ProviderClientFactory(ChatModelFactory chatModelFactory,
                                 FilesClientFactory filesClientFactory,
                                 AnchorLocator anchorLocator,
                                 UploadProperties uploadProperties) {
        this.chatModelFactory = chatModelFactory;
        this.filesClientFactory = filesClientFactory;
        this.anchorLocator = anchorLocator;
        this.uploadProperties = uploadProperties;
    }

    /**
     * @param config          provider, model and configured credential
     * @param outputDirectory where the artifact goes; the files provider searches upward from here
     */
    public ProviderBinding bind(ProviderConfig config, Path outputDirectory) {
        ProviderConfig resolved = withDefaultModel(config);
        if (resolved.provider().requiresUpload()) {
            return bindFiles(resolved, outputDirectory);
        }

        if (!resolved.hasCredential()) {
            throw new MissingCredentialException("No API key configured for " + resolved.provider().id());
        }
        var chatModel = chatModelFactory.create(resolved.provider(), resolved.model(), resolved.credential());
        log.info("Using {} model {}", resolved.provider().id(), resolved.model());
        return new ProviderBinding.Direct(resolved,
                new ChatClientTextGenerationClient(resolved.provider(), ChatClient.create(chatModel)));
    }

    private ProviderBinding bindFiles(ProviderConfig config, Path outputDirectory) {
        Path anchor = anchorLocator.locate(outputDirectory);
        Path marker = anchorLocator.markerFile(anchor);

        EnvFile env;
        try {
            env = EnvFile.load(marker);
        } catch (IOException e) {
            throw new InputUnreadableException("Could not read " + marker, e);
        }

        String apiKey = env.firstOf(uploadProperties.getCredentialKeys())
                .orElse(config.credential());
        if (apiKey.isBlank()) {
            throw new MissingCredentialException("No API key found in " + marker + " (looked for "
                    + String.join(", ", uploadProperties.getCredentialKeys()) + ") and none configured");
        }

        log.info("Using {} model {} (anchor {})", config.provider().id(), config.model(), anchor);
        var resolved = new ProviderConfig(config.provider(), config.model(), apiKey);
        return new ProviderBinding.FileBacked(resolved, filesClientFactory.create(apiKey), anchor);
    }

    private static ProviderConfig withDefaultModel(ProviderConfig config) {
        if (config.model() != null && !config.model().isBlank()) {
            return config;
        }
        ProviderKind kind = config.provider();
        return new ProviderConfig(kind, ModelCatalog.getDefaultModel(kind), config.credential());
    }
}
