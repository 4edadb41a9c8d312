package com.gamewright.core.llm;

import com.gamewright.core.model.ProviderKind;

import java.util.List;
import java.util.Map;

/**
 * Known models per provider family, and the model used when none is configured.
 */
public final class ModelCatalog {

    private ModelCatalog() {}

    public record ModelInfo(
            String id,
            String name,
            String family,
            int contextWindow,
            boolean acceptsFileUploads,
            String description
    ) {
        public String contextDisplay() {
            return contextWindow >= 1_000_000
                    ? (contextWindow / 1_000_000) + "M tokens"
                    : (contextWindow / 1_000) + "K tokens";
        }
    }

    public static final List<ModelInfo> ANTHROPIC_MODELS = List.of(
            new ModelInfo("claude-sonnet-4-20250514", "Claude Sonnet 4", "anthropic",
                    200_000, false, "Balanced quality and speed for long design documents"),
            new ModelInfo("claude-opus-4-20250514", "Claude Opus 4", "anthropic",
                    200_000, false, "Most capable, best for complex game implementations"),
            new ModelInfo("claude-3-5-sonnet-20240620", "Claude 3.5 Sonnet", "anthropic",
                    200_000, false, "Previous generation, still solid for specifications")
    );

    public static final List<ModelInfo> OPENAI_MODELS = List.of(
            new ModelInfo("gpt-4o", "GPT-4o", "openai",
                    128_000, false, "General purpose flagship"),
            new ModelInfo("gpt-4o-mini", "GPT-4o Mini", "openai",
                    128_000, false, "Fast and affordable drafts"),
            new ModelInfo("o3-mini", "o3-mini", "openai",
                    200_000, false, "Reasoning model for intricate game rules")
    );

    public static final List<ModelInfo> GOOGLE_MODELS = List.of(
            new ModelInfo("gemini-2.5-flash", "Gemini 2.5 Flash", "google",
                    1_000_000, true, "Fast, reads uploaded PDFs and long sources"),
            new ModelInfo("gemini-2.5-pro", "Gemini 2.5 Pro", "google",
                    1_000_000, true, "Most capable Gemini model"),
            new ModelInfo("gemini-2.0-flash", "Gemini 2.0 Flash", "google",
                    1_000_000, true, "Previous generation fast model")
    );

    private static final Map<String, List<ModelInfo>> BY_FAMILY = Map.of(
            "anthropic", ANTHROPIC_MODELS,
            "openai", OPENAI_MODELS,
            "google", GOOGLE_MODELS
    );

    /** Both Google providers share one model family. */
    public static String familyOf(ProviderKind provider) {
        return switch (provider) {
            case ANTHROPIC_DIRECT -> "anthropic";
            case OPENAI_DIRECT -> "openai";
            case GOOGLE_DIRECT, GOOGLE_FILES -> "google";
        };
    }

    public static List<ModelInfo> modelsFor(ProviderKind provider) {
        return BY_FAMILY.get(familyOf(provider));
    }

    public static ModelInfo findModel(ProviderKind provider, String modelId) {
        return modelsFor(provider).stream()
                .filter(m -> m.id().equals(modelId))
                .findFirst()
                .orElse(null);
    }

    public static String getDefaultModel(ProviderKind provider) {
        return switch (provider) {
            case ANTHROPIC_DIRECT -> "claude-sonnet-4-20250514";
            case OPENAI_DIRECT -> "gpt-4o";
            case GOOGLE_DIRECT, GOOGLE_FILES -> "gemini-2.5-flash";
        };
    }
}
