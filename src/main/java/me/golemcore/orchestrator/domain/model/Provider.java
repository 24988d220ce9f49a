package me.golemcore.orchestrator.domain.model;

import java.util.Locale;

/**
 * LLM provider families the core distinguishes. Only the prompt-cache marker
 * style differs between them; everything else is provider-agnostic.
 */
public enum Provider {

    ANTHROPIC, BEDROCK, OPENAI, AZURE_OPENAI, GOOGLE, VERTEXAI, OTHER;

    public static Provider fromId(String id) {
        if (id == null || id.isBlank()) {
            return OTHER;
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Provider provider : values()) {
            if (provider.name().equals(normalized)) {
                return provider;
            }
        }
        return OTHER;
    }
}
