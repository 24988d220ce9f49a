package me.golemcore.orchestrator.domain.model;

import lombok.Builder;

/**
 * Snapshot of how an agent's context window is split between fixed overhead
 * and conversation messages.
 *
 * @param maxContextTokens
 *            the model's window, {@code 0} when unknown
 * @param instructionTokens
 *            total overhead (system prompt, tool schemas and summary)
 * @param systemMessageTokens
 *            system prompt plus summary, without tool schemas
 * @param toolSchemaTokens
 *            tokens spent on bound tool schemas
 * @param summaryTokens
 *            tokens of the durable conversation summary
 * @param toolCount
 *            number of tools whose schemas were counted
 * @param messageCount
 *            number of messages counted in {@code messageTokens}
 * @param messageTokens
 *            sum of per-message counts currently recorded
 * @param availableForMessages
 *            {@code maxContextTokens - instructionTokens}, never negative
 */
@Builder
public record TokenBudgetBreakdown(
        int maxContextTokens,
        int instructionTokens,
        int systemMessageTokens,
        int toolSchemaTokens,
        int summaryTokens,
        int toolCount,
        int messageCount,
        int messageTokens,
        int availableForMessages) {
}
