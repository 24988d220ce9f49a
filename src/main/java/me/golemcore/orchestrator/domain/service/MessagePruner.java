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
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.model.ContentBlock;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.PruningResult;
import me.golemcore.orchestrator.port.outbound.TokenCounter;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Selects the newest messages that fit an agent's context window.
 *
 * <p>
 * Before cutting, oversized tool results and tool-call inputs are truncated and
 * optional position-based pruning degrades old tool results. The window never
 * starts with a tool result, and tool calls and results that lost their
 * counterpart are repaired so providers accept the request. When nothing fits,
 * tool payloads are reduced to short stubs and the selection runs once more.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessagePruner {

    /**
     * Every reply is primed with a few tokens for the assistant label.
     */
    static final int REPLY_PRIMING_TOKENS = 3;

    private final ToolResultTruncator truncator;
    private final ContextPruningService contextPruningService;

    public PruningResult prune(AgentContext context, List<Message> messages) {
        Integer maxContextTokens = context.getMaxContextTokens();
        int maxTokens = maxContextTokens != null ? maxContextTokens : 0;
        if (messages.isEmpty()) {
            return PruningResult.builder()
                    .context(List.of())
                    .messagesToRefine(List.of())
                    .remainingContextTokens(maxTokens)
                    .prePruneTotalTokens(0)
                    .build();
        }

        TokenCounter tokenCounter = context.getTokenCounter();
        List<Message> working = new ArrayList<>(messages);
        fillTokenCounts(working, context.getIndexTokenCountMap(), tokenCounter);
        // truncation and pruning only change this call's copies, so their counts stay local
        Map<Integer, Integer> tokenMap = new HashMap<>(context.getIndexTokenCountMap());

        int instructionTokens = context.getInstructionTokens();
        if (maxContextTokens == null || maxContextTokens <= 0) {
            int total = sumTokens(tokenMap, working.size());
            return PruningResult.builder()
                    .context(working)
                    .messagesToRefine(List.of())
                    .remainingContextTokens(0)
                    .prePruneTotalTokens(total)
                    .build();
        }

        int effectiveMaxTokens = Math.max(0, maxTokens - instructionTokens);
        preFlightTruncate(working, tokenMap, tokenCounter, effectiveMaxTokens);
        contextPruningService.apply(working, tokenMap, tokenCounter, context.getContextPruning());

        int totalTokens = sumTokens(tokenMap, working.size());
        if (totalTokens + instructionTokens <= maxTokens) {
            return PruningResult.builder()
                    .context(working)
                    .messagesToRefine(List.of())
                    .remainingContextTokens(maxTokens - totalTokens - instructionTokens)
                    .prePruneTotalTokens(totalTokens)
                    .build();
        }

        Window window = selectWindow(working, tokenMap, maxTokens, instructionTokens);
        Repair repair = repairOrphans(window, tokenMap, tokenCounter);
        List<Message> toRefine = new ArrayList<>(window.messagesToRefine());
        int remaining = window.remainingTokens() + repair.reclaimedTokens();

        if (repair.context().isEmpty() && effectiveMaxTokens > 0) {
            log.warn("[Prune] Agent {}: no message fits {} tokens, applying emergency truncation",
                    context.getAgentId(), effectiveMaxTokens);
            emergencyTruncate(working, tokenMap, tokenCounter);
            Window retry = selectWindow(working, tokenMap, maxTokens, instructionTokens);
            repair = repairOrphans(retry, tokenMap, tokenCounter);
            toRefine.addAll(retry.messagesToRefine());
            remaining = retry.remainingTokens() + repair.reclaimedTokens();
        }

        log.debug("[Prune] Agent {}: kept {} of {} messages ({} tokens before pruning)",
                context.getAgentId(), repair.context().size(), working.size(), totalTokens);
        return PruningResult.builder()
                .context(repair.context())
                .messagesToRefine(toRefine)
                .remainingContextTokens(Math.max(0, Math.min(maxTokens, remaining)))
                .prePruneTotalTokens(totalTokens)
                .build();
    }

    private static void fillTokenCounts(List<Message> messages, Map<Integer, Integer> tokenMap,
            TokenCounter tokenCounter) {
        tokenMap.keySet().removeIf(index -> index >= messages.size());
        for (int i = 0; i < messages.size(); i++) {
            if (!tokenMap.containsKey(i)) {
                tokenMap.put(i, tokenCounter.count(messages.get(i)));
            }
        }
    }

    private static int sumTokens(Map<Integer, Integer> tokenMap, int size) {
        int total = 0;
        for (int i = 0; i < size; i++) {
            total += tokenMap.getOrDefault(i, 0);
        }
        return total;
    }

    private void preFlightTruncate(List<Message> messages, Map<Integer, Integer> tokenMap,
            TokenCounter tokenCounter, int effectiveMaxTokens) {
        int maxResultChars = ToolResultTruncator.maxToolResultChars(effectiveMaxTokens);
        int maxInputChars = ToolResultTruncator.maxToolInputChars(effectiveMaxTokens);
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            Message truncated = message.isTool()
                    ? truncator.truncateToolResult(message, maxResultChars)
                    : truncator.truncateToolCallInputs(message, maxInputChars);
            if (truncated != message) {
                messages.set(i, truncated);
                tokenMap.put(i, tokenCounter.count(truncated));
            }
        }
    }

    private void emergencyTruncate(List<Message> messages, Map<Integer, Integer> tokenMap,
            TokenCounter tokenCounter) {
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            Message truncated = message.isTool()
                    ? truncator.emergencyTruncateToolResult(message)
                    : truncator.truncateToolCallInputs(message, ToolResultTruncator.EMERGENCY_MAX_CHARS);
            if (truncated != message) {
                messages.set(i, truncated);
                tokenMap.put(i, tokenCounter.count(truncated));
            }
        }
    }

    /**
     * Walks backwards keeping whole messages while they fit. A leading system
     * message is always kept and paid from its own count.
     */
    Window selectWindow(List<Message> messages, Map<Integer, Integer> tokenMap, int maxTokens,
            int instructionTokens) {
        int size = messages.size();
        boolean hasSystem = messages.get(0).isSystem();
        int overhead = hasSystem ? tokenMap.getOrDefault(0, 0) : instructionTokens;
        int remaining = maxTokens - overhead;
        int endIndex = hasSystem ? 1 : 0;
        int currentTokens = REPLY_PRIMING_TOKENS;

        // newest first
        List<Integer> kept = new ArrayList<>();
        if (currentTokens < remaining) {
            int index = size;
            while (index > endIndex && currentTokens < remaining) {
                index--;
                int tokens = tokenMap.getOrDefault(index, 0);
                if (currentTokens + tokens > remaining) {
                    break;
                }
                kept.add(index);
                currentTokens += tokens;
            }

            if (!kept.isEmpty() && messages.get(kept.get(kept.size() - 1)).isTool()) {
                int required = -1;
                int droppedTokens = 0;
                for (int k = kept.size() - 1; k >= 0; k--) {
                    Message candidate = messages.get(kept.get(k));
                    if (candidate.isAi() || candidate.isHuman()) {
                        required = k + 1;
                        break;
                    }
                    droppedTokens += tokenMap.getOrDefault(kept.get(k), 0);
                }
                if (required > 0) {
                    currentTokens -= droppedTokens;
                    kept = new ArrayList<>(kept.subList(0, required));
                }
            }
        }

        int firstKept = kept.isEmpty() ? size : kept.get(kept.size() - 1);
        List<Message> toRefine = new ArrayList<>(messages.subList(endIndex, Math.max(endIndex, firstKept)));

        List<Integer> indices = new ArrayList<>();
        if (hasSystem) {
            indices.add(0);
        }
        for (int k = kept.size() - 1; k >= 0; k--) {
            indices.add(kept.get(k));
        }
        List<Message> selected = new ArrayList<>(indices.size());
        for (int index : indices) {
            selected.add(messages.get(index));
        }
        return new Window(selected, indices, toRefine, remaining - currentTokens);
    }

    /**
     * Drops tool results whose call is outside the window and strips tool calls
     * whose result is outside it. AI messages with nothing left are dropped.
     */
    Repair repairOrphans(Window window, Map<Integer, Integer> tokenMap, TokenCounter tokenCounter) {
        Set<String> callIds = new HashSet<>();
        Set<String> resultIds = new HashSet<>();
        for (Message message : window.messages()) {
            callIds.addAll(message.toolCallIds());
            if (message.isTool() && message.getToolCallId() != null) {
                resultIds.add(message.getToolCallId());
            }
        }

        List<Message> repaired = new ArrayList<>(window.messages().size());
        int reclaimed = 0;
        int dropped = 0;
        for (int k = 0; k < window.messages().size(); k++) {
            Message message = window.messages().get(k);
            int tokens = tokenMap.getOrDefault(window.indices().get(k), 0);
            if (message.isTool()) {
                if (message.getToolCallId() == null || !callIds.contains(message.getToolCallId())) {
                    reclaimed += tokens;
                    dropped++;
                    continue;
                }
                repaired.add(message);
                continue;
            }
            Set<String> ownCalls = message.toolCallIds();
            if (!ownCalls.isEmpty() && !resultIds.containsAll(ownCalls)) {
                Message stripped = stripUnansweredCalls(message, resultIds);
                if (stripped == null) {
                    reclaimed += tokens;
                    dropped++;
                } else {
                    reclaimed += tokens - tokenCounter.count(stripped);
                    repaired.add(stripped);
                }
                continue;
            }
            repaired.add(message);
        }
        if (dropped > 0) {
            log.warn("[Prune] Dropped {} orphaned tool messages from the context window", dropped);
        }
        return new Repair(repaired, reclaimed);
    }

    private static Message stripUnansweredCalls(Message message, Set<String> answeredIds) {
        List<Message.ToolCall> keptCalls = new ArrayList<>();
        if (message.getToolCalls() != null) {
            for (Message.ToolCall call : message.getToolCalls()) {
                if (call.getId() != null && answeredIds.contains(call.getId())) {
                    keptCalls.add(call);
                }
            }
        }

        if (message.hasBlocks()) {
            List<ContentBlock> keptBlocks = new ArrayList<>();
            for (ContentBlock block : message.getBlocks()) {
                if (!block.isToolUse() || answeredIds.contains(block.getToolUseId())) {
                    keptBlocks.add(block);
                }
            }
            if (keptBlocks.isEmpty()) {
                return null;
            }
            return message.toBuilder()
                    .blocks(keptBlocks)
                    .toolCalls(keptCalls.isEmpty() ? null : keptCalls)
                    .build();
        }

        boolean noText = message.getContent() == null || message.getContent().isEmpty();
        if (noText && keptCalls.isEmpty()) {
            return null;
        }
        return message.toBuilder().toolCalls(keptCalls.isEmpty() ? null : keptCalls).build();
    }

    record Window(List<Message> messages, List<Integer> indices, List<Message> messagesToRefine,
            int remainingTokens) {
    }

    record Repair(List<Message> context, int reclaimedTokens) {
    }
}
