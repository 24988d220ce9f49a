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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single entry of the shared conversation log. Content is either plain text
 * ({@link #content}) or an ordered list of typed {@link ContentBlock}s
 * ({@link #blocks}); when blocks are present they take precedence.
 *
 * <p>
 * Messages are immutable by convention: services that need to change a message
 * work on a {@link #copy()} and publish a new log.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    /**
     * Id of the marker that discards every existing message during a merge.
     */
    public static final String REMOVE_ALL_MESSAGES = "__remove_all__";

    private String id;
    private MessageType type;
    private String content;
    private List<ContentBlock> blocks;

    /**
     * Tool name for tool results, agent name for AI messages.
     */
    private String name;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool result messages
    private ToolStatus status;
    private ToolFailureKind failureKind;

    /**
     * Structured tool payload kept next to the message but never sent to the
     * model.
     */
    private Object artifact;

    private TokenUsage usage;
    private Map<String, Object> responseMetadata;

    public static Message human(String content) {
        return Message.builder().type(MessageType.HUMAN).content(content).build();
    }

    public static Message system(String content) {
        return Message.builder().type(MessageType.SYSTEM).content(content).build();
    }

    public static Message ai(String content) {
        return Message.builder().type(MessageType.AI).content(content).build();
    }

    public static Message ai(String content, List<ToolCall> toolCalls) {
        return Message.builder().type(MessageType.AI).content(content).toolCalls(toolCalls).build();
    }

    public static Message tool(String toolCallId, String toolName, String content) {
        return Message.builder()
                .type(MessageType.TOOL)
                .toolCallId(toolCallId)
                .name(toolName)
                .content(content)
                .status(ToolStatus.SUCCESS)
                .build();
    }

    public static Message toolError(String toolCallId, String toolName, String content) {
        return Message.builder()
                .type(MessageType.TOOL)
                .toolCallId(toolCallId)
                .name(toolName)
                .content(content)
                .status(ToolStatus.ERROR)
                .build();
    }

    /**
     * Marker deleting the message with the given id.
     */
    public static Message remove(String id) {
        return Message.builder().type(MessageType.REMOVE).id(id).content("").build();
    }

    /**
     * Marker that makes the reducer keep only the messages following it in the
     * same batch.
     */
    public static Message removeAll() {
        return remove(REMOVE_ALL_MESSAGES);
    }

    public boolean isHuman() {
        return type == MessageType.HUMAN;
    }

    public boolean isAi() {
        return type == MessageType.AI;
    }

    public boolean isSystem() {
        return type == MessageType.SYSTEM;
    }

    public boolean isTool() {
        return type == MessageType.TOOL;
    }

    public boolean isRemoval() {
        return type == MessageType.REMOVE;
    }

    public boolean isRemoveAll() {
        return isRemoval() && REMOVE_ALL_MESSAGES.equals(id);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Ids of tool calls requested by this message, from both the tool call list
     * and tool-use content blocks. Empty for non-AI messages.
     */
    public Set<String> toolCallIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (!isAi()) {
            return ids;
        }
        if (toolCalls != null) {
            for (ToolCall call : toolCalls) {
                if (call.getId() != null && !call.getId().isEmpty()) {
                    ids.add(call.getId());
                }
            }
        }
        if (blocks != null) {
            for (ContentBlock block : blocks) {
                if (block.isToolUse() && block.getToolUseId() != null && !block.getToolUseId().isEmpty()) {
                    ids.add(block.getToolUseId());
                }
            }
        }
        return ids;
    }

    public boolean hasBlocks() {
        return blocks != null;
    }

    public boolean hasArtifact() {
        return artifact != null;
    }

    /**
     * Returns the textual content regardless of representation. Block content is
     * flattened by concatenating its text blocks.
     */
    public String getText() {
        if (blocks == null) {
            return content != null ? content : "";
        }
        StringBuilder sb = new StringBuilder();
        for (ContentBlock block : blocks) {
            if (block.isText() && block.getText() != null) {
                sb.append(block.getText());
            }
        }
        return sb.toString();
    }

    /**
     * Deep copy: lists, blocks and tool calls are fresh instances. The artifact
     * is shared since it is opaque to the core.
     */
    public Message copy() {
        return toBuilder()
                .blocks(blocks != null ? copyBlocks(blocks) : null)
                .toolCalls(toolCalls != null ? copyToolCalls(toolCalls) : null)
                .responseMetadata(responseMetadata != null ? new LinkedHashMap<>(responseMetadata) : null)
                .build();
    }

    private static List<ContentBlock> copyBlocks(List<ContentBlock> source) {
        List<ContentBlock> copied = new ArrayList<>(source.size());
        for (ContentBlock block : source) {
            copied.add(block.copy());
        }
        return copied;
    }

    private static List<ToolCall> copyToolCalls(List<ToolCall> source) {
        List<ToolCall> copied = new ArrayList<>(source.size());
        for (ToolCall call : source) {
            copied.add(call.toBuilder()
                    .arguments(call.getArguments() != null ? new LinkedHashMap<>(call.getArguments()) : null)
                    .build());
        }
        return copied;
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and JSON arguments.
     */
    @Data
    @Builder(toBuilder = true)
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }

    /**
     * Outcome flag carried by tool result messages.
     */
    public enum ToolStatus {
        SUCCESS, ERROR
    }
}
