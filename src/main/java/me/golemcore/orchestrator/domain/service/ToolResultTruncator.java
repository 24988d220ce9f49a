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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ContentBlock;
import me.golemcore.orchestrator.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shrinks oversized tool results and tool-call inputs so that a single
 * message cannot take over the context window.
 *
 * <p>
 * Results keep about 70% of the budget from the head and 30% from the tail,
 * cut at a nearby newline when one exists, with a visible indicator of the
 * original and retained sizes. Tool-call inputs keep their head inside a
 * {@code _truncated} entry so the arguments stay a JSON object.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolResultTruncator {

    public static final int HARD_MAX_TOOL_RESULT_CHARS = 400_000;
    public static final int HARD_MAX_TOOL_INPUT_CHARS = 200_000;
    public static final int EMERGENCY_MAX_CHARS = 150;

    static final int CHARS_PER_TOKEN = 4;
    static final int NEWLINE_WINDOW = 200;
    static final int MIN_TAIL_BUDGET = 200;
    static final double HEAD_SHARE = 0.7;

    private final ObjectMapper objectMapper;

    /**
     * 30% of the context window in estimated characters, capped at
     * {@link #HARD_MAX_TOOL_RESULT_CHARS}.
     */
    public static int maxToolResultChars(Integer contextWindowTokens) {
        if (contextWindowTokens == null || contextWindowTokens <= 0) {
            return HARD_MAX_TOOL_RESULT_CHARS;
        }
        long chars = (long) Math.floor(contextWindowTokens * 0.3) * CHARS_PER_TOKEN;
        return (int) Math.min(chars, HARD_MAX_TOOL_RESULT_CHARS);
    }

    /**
     * 15% of the context window in estimated characters, capped at
     * {@link #HARD_MAX_TOOL_INPUT_CHARS}.
     */
    public static int maxToolInputChars(int contextWindowTokens) {
        long chars = (long) Math.floor(Math.max(0, contextWindowTokens) * 0.15) * CHARS_PER_TOKEN;
        return (int) Math.min(chars, HARD_MAX_TOOL_INPUT_CHARS);
    }

    /**
     * Returns {@code content} unchanged when it fits, otherwise a head/tail
     * excerpt whose length never exceeds {@code maxChars}.
     */
    public static String truncateToolResultContent(String content, int maxChars) {
        if (content == null || content.length() <= maxChars) {
            return content;
        }
        int length = content.length();
        if (maxChars <= 0) {
            return "";
        }

        int available = maxChars - headTailIndicator(length, maxChars, maxChars).length();
        if (available < MIN_TAIL_BUDGET) {
            return truncateHeadOnly(content, maxChars);
        }

        int headBudget = (int) Math.floor(available * HEAD_SHARE);
        int tailBudget = available - headBudget;

        int headEnd = headBudget;
        int lastNewline = content.lastIndexOf('\n', headBudget);
        if (lastNewline > 0 && lastNewline > headBudget - NEWLINE_WINDOW) {
            headEnd = lastNewline;
        }

        int tailStart = length - tailBudget;
        int nextNewline = content.indexOf('\n', tailStart);
        if (nextNewline >= 0 && nextNewline < tailStart + NEWLINE_WINDOW && nextNewline + 1 < length) {
            tailStart = nextNewline + 1;
        }

        return content.substring(0, headEnd)
                + headTailIndicator(length, headEnd, length - tailStart)
                + content.substring(tailStart);
    }

    private static String truncateHeadOnly(String content, int maxChars) {
        int available = maxChars - headOnlyIndicator(content.length(), maxChars).length();
        if (available <= 0) {
            return content.substring(0, maxChars);
        }
        int breakPoint = available;
        int lastNewline = content.lastIndexOf('\n', available);
        if (lastNewline > 0 && lastNewline > available - NEWLINE_WINDOW) {
            breakPoint = lastNewline;
        }
        return content.substring(0, breakPoint) + headOnlyIndicator(content.length(), breakPoint);
    }

    private static String headTailIndicator(int originalChars, int headChars, int tailChars) {
        return "\n\n… [truncated: " + originalChars + " chars total, kept first " + headChars
                + " and last " + tailChars + " chars] …\n\n";
    }

    private static String headOnlyIndicator(int originalChars, int headChars) {
        return "\n\n… [truncated: " + originalChars + " chars total, showing first " + headChars + " chars]";
    }

    /**
     * Replaces an oversized tool input with
     * {@code {_truncated: head + marker, _originalChars: n}}.
     */
    public Map<String, Object> truncateToolInput(Object input, int maxChars) {
        String serialized = serialize(input);
        String head = serialized.substring(0, Math.min(maxChars, serialized.length()));
        Map<String, Object> truncated = new LinkedHashMap<>();
        truncated.put("_truncated", head + "\n… [truncated: " + serialized.length() + " → " + maxChars + " chars]");
        truncated.put("_originalChars", serialized.length());
        return truncated;
    }

    public String serialize(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tool payload", e);
        }
    }

    /**
     * Returns a truncated copy of a tool result message, or the same instance
     * when its text content already fits.
     */
    public Message truncateToolResult(Message message, int maxChars) {
        if (!message.isTool() || message.hasBlocks() || message.getContent() == null
                || message.getContent().length() <= maxChars) {
            return message;
        }
        log.warn("[Tools] Truncating '{}' result: {} chars -> {} chars",
                message.getName(), message.getContent().length(), maxChars);
        return message.toBuilder()
                .content(truncateToolResultContent(message.getContent(), maxChars))
                .build();
    }

    /**
     * Last-resort stub: the first {@link #EMERGENCY_MAX_CHARS} characters plus a
     * marker.
     */
    public Message emergencyTruncateToolResult(Message message) {
        if (!message.isTool() || message.hasBlocks() || message.getContent() == null
                || message.getContent().length() <= EMERGENCY_MAX_CHARS) {
            return message;
        }
        String content = message.getContent();
        return message.toBuilder()
                .content(content.substring(0, EMERGENCY_MAX_CHARS)
                        + "\n… [emergency truncated: " + content.length() + " → " + EMERGENCY_MAX_CHARS + " chars]")
                .build();
    }

    /**
     * Truncates tool-use block inputs and tool call arguments of an AI message
     * whose serialized form exceeds {@code maxChars}. Returns the same instance
     * when nothing had to change.
     */
    public Message truncateToolCallInputs(Message message, int maxChars) {
        if (!message.isAi()) {
            return message;
        }
        boolean changed = false;

        List<ContentBlock> blocks = message.getBlocks();
        if (blocks != null) {
            List<ContentBlock> updated = new ArrayList<>(blocks.size());
            for (ContentBlock block : blocks) {
                if (block.isToolUse() && block.getInput() != null
                        && serialize(block.getInput()).length() > maxChars) {
                    updated.add(block.toBuilder().input(truncateToolInput(block.getInput(), maxChars)).build());
                    changed = true;
                } else {
                    updated.add(block);
                }
            }
            blocks = updated;
        }

        List<Message.ToolCall> toolCalls = message.getToolCalls();
        if (toolCalls != null) {
            List<Message.ToolCall> updated = new ArrayList<>(toolCalls.size());
            for (Message.ToolCall call : toolCalls) {
                if (call.getArguments() != null && serialize(call.getArguments()).length() > maxChars) {
                    updated.add(call.toBuilder().arguments(truncateToolInput(call.getArguments(), maxChars)).build());
                    changed = true;
                } else {
                    updated.add(call);
                }
            }
            toolCalls = updated;
        }

        if (!changed) {
            return message;
        }
        log.warn("[Tools] Truncated tool call inputs of message {} to {} chars", message.getId(), maxChars);
        return message.toBuilder().blocks(blocks).toolCalls(toolCalls).build();
    }
}
