package me.golemcore.orchestrator.domain.model;

/**
 * Provider prompt-cache hint. {@link #EPHEMERAL} is the inline annotation used
 * on Anthropic text blocks, {@link #DEFAULT} the payload of a Bedrock cache
 * point block.
 */
public record CacheControl(String type) {

    public static final CacheControl EPHEMERAL = new CacheControl("ephemeral");
    public static final CacheControl DEFAULT = new CacheControl("default");
}
