package me.golemcore.orchestrator.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Outcome of fitting a conversation log into an agent's context window.
 *
 * @param context
 *            the messages to send, in log order
 * @param messagesToRefine
 *            messages that did not fit (candidates for summarization)
 * @param remainingContextTokens
 *            budget left after the window, clamped to {@code [0, max]}
 * @param prePruneTotalTokens
 *            sum of per-message counts before the window was cut
 */
@Builder
public record PruningResult(
        List<Message> context,
        List<Message> messagesToRefine,
        int remainingContextTokens,
        int prePruneTotalTokens) {

    public PruningResult {
        context = context != null ? List.copyOf(context) : List.of();
        messagesToRefine = messagesToRefine != null ? List.copyOf(messagesToRefine) : List.of();
    }
}
