package me.golemcore.orchestrator.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.port.outbound.TokenCounter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Per-agent mutable state: identity, bound tools, instruction and summary token
 * accounting, the per-message token map, discovered tools and rate-limit
 * bookkeeping.
 *
 * <p>
 * Tool schema tokens are counted asynchronously. Callers that need a correct
 * budget must call {@link #awaitTokenCalculation()} before reading
 * {@link #getTokenBudgetBreakdown()}.
 *
 * <p>
 * {@link #reset()} clears turn-scoped state only. The conversation summary is
 * restored from its durable copy, so it keeps appearing in the system message
 * of the next run.
 */
@Slf4j
public class AgentContext {

    public static final String SUMMARY_HEADER = "## Conversation Summary";
    private static final String PROMPT_CACHING_BETA = "prompt-caching";

    @Getter
    private final String agentId;
    @Getter
    private final Provider provider;
    @Getter
    private final Map<String, Object> clientOptions;
    @Getter
    private final Map<String, String> defaultHeaders;
    @Getter
    private final List<AgentTool> tools;
    @Getter
    private final Map<String, ToolDefinition> toolRegistry;
    @Getter
    private final String instructions;
    @Getter
    private final String additionalInstructions;
    @Getter
    private final Integer maxContextTokens;
    @Getter
    private final Duration streamBuffer;
    @Getter
    private final ContextPruningSettings contextPruning;
    @Getter
    private final TokenCounter tokenCounter;

    private final Set<String> discoveredToolNames = ConcurrentHashMap.newKeySet();

    private volatile Map<Integer, Integer> indexTokenCountMap = new ConcurrentHashMap<>();
    private volatile int systemPromptTokens;
    private volatile int toolSchemaTokens;
    private volatile int toolSchemaCount;
    private volatile CompletableFuture<Void> tokenCalculation = CompletableFuture.completedFuture(null);
    private Executor schemaExecutor;
    private ObjectMapper schemaMapper;

    private String summaryText;
    private int summaryTokens;
    private String durableSummaryText;
    private int durableSummaryTokens;

    @Getter
    @Setter
    private TokenUsage currentUsage;

    @Getter
    private Instant lastStreamCall;

    private int overflowRecoveryAttempts;

    private AgentContext(AgentConfig config, TokenCounter tokenCounter) {
        this.agentId = config.getAgentId();
        this.provider = config.getProvider() != null ? config.getProvider() : Provider.OTHER;
        this.clientOptions = config.getClientOptions() != null
                ? Map.copyOf(config.getClientOptions())
                : Map.of();
        this.defaultHeaders = config.getDefaultHeaders() != null
                ? Map.copyOf(config.getDefaultHeaders())
                : Map.of();
        this.tools = config.getTools() != null ? List.copyOf(config.getTools()) : List.of();
        this.toolRegistry = config.getToolRegistry() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config.getToolRegistry()))
                : Map.of();
        this.instructions = config.getInstructions();
        this.additionalInstructions = config.getAdditionalInstructions();
        this.maxContextTokens = config.getMaxContextTokens();
        this.streamBuffer = config.getStreamBuffer();
        this.contextPruning = config.getContextPruning() != null
                ? config.getContextPruning()
                : ContextPruningSettings.DEFAULTS;
        this.tokenCounter = tokenCounter;
        this.summaryText = config.getInitialSummary();
        this.durableSummaryText = config.getInitialSummary();
    }

    public static AgentContext fromConfig(AgentConfig config, TokenCounter tokenCounter,
            Map<Integer, Integer> indexTokenCountMap, Executor executor) {
        return fromConfig(config, tokenCounter, indexTokenCountMap, executor, new ObjectMapper());
    }

    /**
     * Builds the context and starts token accounting. The system prompt is
     * counted synchronously; tool schemas are counted on {@code executor}.
     */
    public static AgentContext fromConfig(AgentConfig config, TokenCounter tokenCounter,
            Map<Integer, Integer> indexTokenCountMap, Executor executor, ObjectMapper objectMapper) {
        AgentContext context = new AgentContext(config, tokenCounter);
        if (indexTokenCountMap != null) {
            context.indexTokenCountMap = new ConcurrentHashMap<>(indexTokenCountMap);
        }
        context.initSummaryTokens(config.getInitialSummary(), config.getInitialSummaryTokens());
        if (tokenCounter == null) {
            return context;
        }

        Message instructionMessage = context.buildInstructionMessage();
        if (instructionMessage != null) {
            context.systemPromptTokens = tokenCounter.count(instructionMessage);
        }

        context.schemaExecutor = executor;
        context.schemaMapper = objectMapper;
        context.tokenCalculation = context.scheduleSchemaCount(CompletableFuture.completedFuture(null));
        return context;
    }

    private CompletableFuture<Void> scheduleSchemaCount(CompletableFuture<Void> previous) {
        return previous
                .thenRunAsync(() -> calculateToolSchemaTokens(schemaMapper), schemaExecutor)
                .exceptionally(e -> {
                    log.error("[Budget] Error calculating tool schema tokens for agent {}", agentId, e);
                    return null;
                });
    }

    private void initSummaryTokens(String text, Integer tokens) {
        int resolved;
        if (tokens != null) {
            resolved = Math.max(0, tokens);
        } else if (text != null && !text.isBlank() && tokenCounter != null) {
            resolved = tokenCounter.count(Message.system(SUMMARY_HEADER + "\n" + text));
        } else {
            resolved = 0;
        }
        this.summaryTokens = resolved;
        this.durableSummaryTokens = resolved;
    }

    private void calculateToolSchemaTokens(ObjectMapper objectMapper) {
        int total = 0;
        int counted = 0;
        for (AgentTool tool : getToolsForBinding()) {
            ToolDefinition definition = tool.getDefinition();
            if (definition == null || definition.getInputSchema() == null) {
                continue;
            }
            Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("name", definition.getName());
            schema.put("description", definition.getDescription() != null ? definition.getDescription() : "");
            schema.put("schema", definition.getInputSchema());
            try {
                total += tokenCounter.count(Message.system(objectMapper.writeValueAsString(schema)));
                counted++;
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialize schema of tool " + definition.getName(), e);
            }
        }
        this.toolSchemaTokens = total;
        this.toolSchemaCount = counted;
        log.debug("[Budget] Agent {}: {} tool schemas, {} tokens", agentId, counted, total);
    }

    /**
     * Handle completed once tool schema tokens are counted. Never completes
     * exceptionally; failures are logged and leave the schema count at zero.
     */
    public CompletableFuture<Void> getTokenCalculation() {
        return tokenCalculation;
    }

    public void awaitTokenCalculation() {
        tokenCalculation.join();
    }

    // ==================== INSTRUCTIONS ====================

    /**
     * Instructions joined with additional instructions, or {@code null} when
     * both are empty.
     */
    public String getFinalInstructions() {
        boolean hasBase = instructions != null && !instructions.isEmpty();
        boolean hasAdditional = additionalInstructions != null && !additionalInstructions.isEmpty();
        if (hasBase && hasAdditional) {
            return instructions + "\n\n" + additionalInstructions;
        }
        if (hasAdditional) {
            return additionalInstructions;
        }
        return hasBase ? instructions : null;
    }

    public boolean isSystemPromptCachingEnabled() {
        if (provider != Provider.ANTHROPIC) {
            return false;
        }
        String beta = defaultHeaders.get(AgentConfig.ANTHROPIC_BETA_HEADER);
        return beta != null && beta.contains(PROMPT_CACHING_BETA);
    }

    private Message buildInstructionMessage() {
        String finalInstructions = getFinalInstructions();
        if (finalInstructions == null) {
            return null;
        }
        if (isSystemPromptCachingEnabled()) {
            ContentBlock block = ContentBlock.text(finalInstructions).toBuilder()
                    .cacheControl(CacheControl.EPHEMERAL)
                    .build();
            return Message.builder()
                    .type(MessageType.SYSTEM)
                    .blocks(new ArrayList<>(List.of(block)))
                    .build();
        }
        return Message.system(finalInstructions);
    }

    /**
     * System message prepended to every model call: instructions plus the
     * conversation summary section. {@code null} when there is nothing to send.
     */
    public Message getSystemMessage() {
        Message base = buildInstructionMessage();
        String text = getSummaryText();
        String summary = text != null && !text.isBlank() ? text : null;
        if (summary == null) {
            return base;
        }
        String section = SUMMARY_HEADER + "\n" + summary;
        if (base == null) {
            return Message.system(section);
        }
        if (base.hasBlocks()) {
            List<ContentBlock> blocks = new ArrayList<>(base.getBlocks());
            blocks.add(ContentBlock.text("\n\n" + section));
            return base.toBuilder().blocks(blocks).build();
        }
        return Message.system(base.getContent() + "\n\n" + section);
    }

    // ==================== SUMMARY ====================

    public synchronized void setSummary(String text, int tokens) {
        this.summaryText = text;
        this.summaryTokens = Math.max(0, tokens);
        this.durableSummaryText = text;
        this.durableSummaryTokens = this.summaryTokens;
    }

    public synchronized void clearSummary() {
        this.summaryText = null;
        this.summaryTokens = 0;
        this.durableSummaryText = null;
        this.durableSummaryTokens = 0;
    }

    public synchronized String getSummaryText() {
        return summaryText;
    }

    public synchronized int getSummaryTokens() {
        return summaryTokens;
    }

    // ==================== BUDGET ====================

    /**
     * System prompt, tool schemas and summary: everything sent besides the
     * conversation messages.
     */
    public int getInstructionTokens() {
        return systemPromptTokens + toolSchemaTokens + getSummaryTokens();
    }

    public TokenBudgetBreakdown getTokenBudgetBreakdown() {
        return getTokenBudgetBreakdown(null);
    }

    public TokenBudgetBreakdown getTokenBudgetBreakdown(List<Message> messages) {
        int summary = getSummaryTokens();
        int instructionTokens = systemPromptTokens + toolSchemaTokens + summary;
        int max = maxContextTokens != null ? maxContextTokens : 0;

        Map<Integer, Integer> tokenMap = indexTokenCountMap;
        int messageCount = messages != null ? messages.size() : tokenMap.size();
        int messageTokens = 0;
        for (int i = 0; i < messageCount; i++) {
            messageTokens += tokenMap.getOrDefault(i, 0);
        }

        return TokenBudgetBreakdown.builder()
                .maxContextTokens(max)
                .instructionTokens(instructionTokens)
                .systemMessageTokens(systemPromptTokens + summary)
                .toolSchemaTokens(toolSchemaTokens)
                .summaryTokens(summary)
                .toolCount(toolSchemaCount)
                .messageCount(messageCount)
                .messageTokens(messageTokens)
                .availableForMessages(Math.max(0, max - instructionTokens))
                .build();
    }

    public String formatTokenBudgetBreakdown(List<Message> messages) {
        TokenBudgetBreakdown breakdown = getTokenBudgetBreakdown(messages);
        int totalEstimated = breakdown.instructionTokens() + breakdown.messageTokens();
        StringBuilder sb = new StringBuilder();
        sb.append("Token Budget Breakdown (agent ").append(agentId).append("):\n");
        sb.append("  Max Context Tokens: ").append(breakdown.maxContextTokens()).append('\n');
        sb.append("  Instruction Tokens: ").append(breakdown.instructionTokens()).append('\n');
        sb.append("    System Message: ").append(breakdown.systemMessageTokens()).append('\n');
        sb.append("    Tool Schemas: ").append(breakdown.toolSchemaTokens())
                .append(" (").append(breakdown.toolCount()).append(" tools)\n");
        sb.append("    Summary: ").append(breakdown.summaryTokens()).append('\n');
        sb.append("  Messages: ").append(breakdown.messageCount())
                .append(" (").append(breakdown.messageTokens()).append(" tokens)\n");
        sb.append("  Available for Messages: ").append(breakdown.availableForMessages()).append('\n');
        sb.append("  Total Estimated: ").append(totalEstimated);
        if (breakdown.maxContextTokens() > 0 && totalEstimated > breakdown.maxContextTokens()) {
            sb.append(" (exceeds max by ").append(totalEstimated - breakdown.maxContextTokens()).append(')');
        }
        return sb.toString();
    }

    /**
     * Live per-message token counts keyed by log position. Shared with the
     * pruner, which fills and updates it.
     */
    public Map<Integer, Integer> getIndexTokenCountMap() {
        return indexTokenCountMap;
    }

    // ==================== TOOLS ====================

    /**
     * Tools to bind to the model. A tool without a registry entry is always
     * bound. Otherwise it must be directly callable, and either not deferred or
     * discovered through tool search in this run.
     */
    public List<AgentTool> getToolsForBinding() {
        if (toolRegistry.isEmpty()) {
            return tools;
        }
        List<AgentTool> bound = new ArrayList<>();
        for (AgentTool tool : tools) {
            String name = tool.getToolName();
            ToolDefinition definition = name != null ? toolRegistry.get(name) : null;
            if (definition == null) {
                bound.add(tool);
            } else if (discoveredToolNames.contains(name)) {
                if (definition.isDirectlyCallable()) {
                    bound.add(tool);
                }
            } else if (definition.isDirectlyCallable() && !definition.isDeferLoading()) {
                bound.add(tool);
            }
        }
        return bound;
    }

    /**
     * Name-keyed view of all configured tools, used by the routing engine.
     */
    public Map<String, AgentTool> getToolMap() {
        Map<String, AgentTool> map = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            map.put(tool.getToolName(), tool);
        }
        return map;
    }

    public Map<String, ToolDefinition> getDeferredToolRegistry(boolean onlyDeferred) {
        Map<String, ToolDefinition> registry = new LinkedHashMap<>();
        for (Map.Entry<String, ToolDefinition> entry : toolRegistry.entrySet()) {
            if (!onlyDeferred || entry.getValue().isDeferLoading()) {
                registry.put(entry.getKey(), entry.getValue());
            }
        }
        return registry;
    }

    /**
     * Newly discovered tools become bound, so their schemas are counted again;
     * {@link #getTokenCalculation()} completes once the new count is in.
     */
    public void markToolsAsDiscovered(Collection<String> toolNames) {
        if (toolNames == null) {
            return;
        }
        if (discoveredToolNames.addAll(toolNames) && tokenCounter != null && schemaExecutor != null) {
            synchronized (this) {
                tokenCalculation = scheduleSchemaCount(tokenCalculation);
            }
        }
    }

    public Set<String> getDiscoveredToolNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(discoveredToolNames));
    }

    // ==================== RATE LIMITING ====================

    /**
     * Time the caller should wait before the next model call of this agent.
     */
    public synchronized Duration getRemainingCallDelay(Instant now) {
        if (streamBuffer == null || streamBuffer.isZero() || streamBuffer.isNegative() || lastStreamCall == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(lastStreamCall, now);
        Duration remaining = streamBuffer.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized void recordModelCall(Instant now) {
        this.lastStreamCall = now;
    }

    // ==================== OVERFLOW RECOVERY ====================

    /**
     * Counts overflow recoveries over the whole run, for diagnostics.
     */
    public synchronized int incrementOverflowRecovery() {
        return ++overflowRecoveryAttempts;
    }

    public synchronized int getOverflowRecoveryAttempts() {
        return overflowRecoveryAttempts;
    }

    // ==================== LIFECYCLE ====================

    /**
     * Clears turn-scoped state. The summary is restored from its durable copy.
     */
    public synchronized void reset() {
        this.indexTokenCountMap = new ConcurrentHashMap<>();
        this.currentUsage = null;
        this.lastStreamCall = null;
        this.overflowRecoveryAttempts = 0;
        if (!discoveredToolNames.isEmpty()) {
            discoveredToolNames.clear();
            if (tokenCounter != null && schemaExecutor != null) {
                tokenCalculation = scheduleSchemaCount(tokenCalculation);
            }
        }
        this.summaryText = durableSummaryText;
        this.summaryTokens = durableSummaryTokens;
    }

    /**
     * Replaces the per-message token map, e.g. after the host restored a log.
     */
    public void setIndexTokenCountMap(Map<Integer, Integer> tokenMap) {
        this.indexTokenCountMap = tokenMap != null ? new ConcurrentHashMap<>(tokenMap) : new ConcurrentHashMap<>();
    }
}
