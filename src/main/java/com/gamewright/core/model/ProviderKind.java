package com.gamewright.core.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Generation backends. The first three take the prompt inline; {@link #GOOGLE_FILES}
 * needs the documents uploaded to remote storage first.
 */
public enum ProviderKind {
    ANTHROPIC_DIRECT("anthropic"),
    OPENAI_DIRECT("openai"),
    GOOGLE_DIRECT("google"),
    GOOGLE_FILES("google-files");

    private final String id;

    ProviderKind(String id) {
        this.id = id;
    }

    /** Short name used in configuration and on the command line. */
    public String id() {
        return id;
    }

    public boolean requiresUpload() {
        return this == GOOGLE_FILES;
    }

    public static ProviderKind fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(k -> k.id.equals(normalized) || k.name().toLowerCase(Locale.ROOT).replace('_', '-').equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + value
                        + ". Valid providers: anthropic, openai, google, google-files"));
    }
}
