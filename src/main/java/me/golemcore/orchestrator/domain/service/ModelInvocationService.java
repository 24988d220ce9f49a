package me.golemcore.orchestrator.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.OverflowClassification;
import me.golemcore.orchestrator.domain.model.PruningResult;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.system.LlmErrorClassifier;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * One model call for an agent: prune the log to the context window, place
 * cache markers, prepend the system message and call the provider.
 *
 * <p>
 * When the provider rejects the request as too large, tool results and
 * tool-call inputs in the window are truncated to a halving character limit
 * and the call is retried, at most
 * {@code orchestrator.overflow.max-recovery-attempts} times. Other failures
 * propagate unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelInvocationService {

    private final MessagePruner messagePruner;
    private final CacheControlService cacheControlService;
    private final ToolResultTruncator truncator;
    private final OrchestratorProperties properties;
    private final Clock clock;

    public LlmResponse invoke(AgentContext context, List<Message> messages, LlmPort llmPort) {
        context.awaitTokenCalculation();
        awaitCallSlot(context);

        PruningResult pruned = messagePruner.prune(context, messages);
        if (!pruned.messagesToRefine().isEmpty()) {
            log.debug("[Budget] Agent {}: {} messages outside the context window",
                    context.getAgentId(), pruned.messagesToRefine().size());
        }

        List<Message> window = pruned.context();
        int maxAttempts = Math.max(0, properties.getOverflow().getMaxRecoveryAttempts());
        int attempt = 0;
        while (true) {
            if (attempt > 0) {
                awaitCallSlot(context);
            }
            try {
                LlmResponse response = call(context, window, llmPort, attempt);
                if (attempt > 0) {
                    log.info("[Overflow] Agent {}: retry {} after truncation succeeded", context.getAgentId(),
                            attempt);
                }
                return response;
            } catch (RuntimeException e) {
                Throwable cause = LlmErrorClassifier.unwrap(e);
                if (cause instanceof CancellationException) {
                    throw (CancellationException) cause;
                }
                OverflowClassification classification = LlmErrorClassifier.classifyOverflow(cause);
                if (!classification.isOverflow()) {
                    throw cause instanceof RuntimeException runtime ? runtime : e;
                }
                String message = LlmErrorClassifier.extractErrorMessage(cause);
                if (attempt >= maxAttempts) {
                    throw overflow(context, window, "Context overflow persisted after " + attempt
                            + " recovery attempts: " + message, classification, cause);
                }

                attempt++;
                context.incrementOverflowRecovery();
                int limit = truncationLimit(context.getMaxContextTokens(), attempt);
                if (classification.isLowConfidence()) {
                    log.warn("[Overflow] Agent {}: error looks like a context overflow (low confidence), "
                            + "truncating tool content to {} chars and retrying: {}",
                            context.getAgentId(), limit, message);
                } else {
                    log.warn("[Overflow] Agent {}: context overflow, truncating tool content to {} chars "
                            + "and retrying: {}", context.getAgentId(), limit, message);
                }

                List<Message> truncated = truncateWindow(window, limit);
                if (truncated == null) {
                    throw overflow(context, window, "Context overflow with nothing left to truncate: " + message,
                            classification, cause);
                }
                window = truncated;
            }
        }
    }

    /**
     * {@code max(minTruncationChars, maxToolResultChars(window) / 2^attempt)}.
     */
    int truncationLimit(Integer maxContextTokens, int attempt) {
        int base = ToolResultTruncator.maxToolResultChars(maxContextTokens);
        int halved = (int) Math.floor(base * Math.pow(0.5, attempt));
        return Math.max(properties.getOverflow().getMinTruncationChars(), halved);
    }

    /**
     * Returns the truncated window, or {@code null} when no message changed.
     */
    private List<Message> truncateWindow(List<Message> window, int limit) {
        List<Message> updated = new ArrayList<>(window.size());
        boolean changed = false;
        for (Message message : window) {
            Message truncated = message.isTool()
                    ? truncator.truncateToolResult(message, limit)
                    : truncator.truncateToolCallInputs(message, limit);
            changed |= truncated != message;
            updated.add(truncated);
        }
        return changed ? updated : null;
    }

    private LlmResponse call(AgentContext context, List<Message> window, LlmPort llmPort, int attempt) {
        List<Message> payload = properties.getCache().isEnabled()
                ? cacheControlService.applyForProvider(context.getProvider(), window)
                : window;

        List<Message> requestMessages = new ArrayList<>(payload.size() + 1);
        Message systemMessage = context.getSystemMessage();
        if (systemMessage != null) {
            requestMessages.add(systemMessage);
        }
        requestMessages.addAll(payload);

        List<ToolDefinition> tools = new ArrayList<>();
        for (AgentTool tool : context.getToolsForBinding()) {
            tools.add(tool.getDefinition());
        }

        LlmRequest request = LlmRequest.builder()
                .agentId(context.getAgentId())
                .provider(context.getProvider())
                .messages(requestMessages)
                .tools(tools)
                .clientOptions(new HashMap<>(context.getClientOptions()))
                .attempt(attempt)
                .build();

        log.debug("[Turn] Agent {}: calling {} with {} messages and {} tools", context.getAgentId(),
                llmPort.getProviderId(), requestMessages.size(), tools.size());
        // stamped before the call so failed calls are spaced as well
        context.recordModelCall(clock.instant());
        LlmResponse response = llmPort.chat(request).join();
        if (response == null || response.getMessage() == null) {
            throw new IllegalStateException("Provider " + llmPort.getProviderId() + " returned no message");
        }
        context.setCurrentUsage(response.getUsage() != null ? response.getUsage() : response.getMessage().getUsage());
        return response;
    }

    private void awaitCallSlot(AgentContext context) {
        Duration delay = context.getRemainingCallDelay(clock.instant());
        if (delay.isZero()) {
            return;
        }
        log.debug("[Turn] Agent {}: waiting {} ms before the next model call", context.getAgentId(),
                delay.toMillis());
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for the model call slot");
        }
    }

    private ContextOverflowException overflow(AgentContext context, List<Message> window, String message,
            OverflowClassification classification, Throwable cause) {
        String breakdown = context.formatTokenBudgetBreakdown(window);
        log.error("[Overflow] Agent {}: {}\n{}", context.getAgentId(), message, breakdown);
        return new ContextOverflowException(message, classification, breakdown, cause);
    }
}
