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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.MessageType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Merges message batches into the conversation log.
 *
 * <ul>
 * <li>A remove-all marker at index {@code k} of the batch makes the result
 * exactly {@code incoming[k+1:]}.</li>
 * <li>Otherwise messages with a known id replace the existing entry in place,
 * removal markers delete their target and new messages are appended.</li>
 * <li>Removing an unknown id fails with
 * {@link UnknownRemovalTargetException}.</li>
 * </ul>
 *
 * The returned log never shares message instances with the input.
 */
@Service
@Slf4j
public class MessageStateReducer {

    public List<Message> merge(List<?> existing, List<?> incoming) {
        List<Message> left = coerceAll(existing);
        List<Message> right = coerceAll(incoming);

        int removeAllIndex = -1;
        for (int i = 0; i < right.size(); i++) {
            if (right.get(i).isRemoveAll()) {
                removeAllIndex = i;
            }
        }
        if (removeAllIndex >= 0) {
            log.debug("[Reducer] Remove-all marker at {}: dropping {} existing messages", removeAllIndex,
                    left.size());
            List<Message> reset = new ArrayList<>(right.subList(removeAllIndex + 1, right.size()));
            requireAnsweredCalls(reset, reset);
            return reset;
        }

        List<Message> merged = new ArrayList<>(left);
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < merged.size(); i++) {
            indexById.put(merged.get(i).getId(), i);
        }
        Set<String> idsToRemove = new HashSet<>();

        for (Message message : right) {
            Integer existingIndex = indexById.get(message.getId());
            if (existingIndex != null) {
                if (message.isRemoval()) {
                    idsToRemove.add(message.getId());
                } else {
                    idsToRemove.remove(message.getId());
                    merged.set(existingIndex, carryArtifact(message, merged));
                }
            } else {
                if (message.isRemoval()) {
                    throw new UnknownRemovalTargetException(message.getId());
                }
                indexById.put(message.getId(), merged.size());
                merged.add(carryArtifact(message, merged));
            }
        }

        List<Message> result = merged;
        if (!idsToRemove.isEmpty()) {
            result = new ArrayList<>(merged.size() - idsToRemove.size());
            for (Message message : merged) {
                if (!idsToRemove.contains(message.getId())) {
                    result.add(message);
                }
            }
        }
        requireAnsweredCalls(result, right);
        return result;
    }

    /**
     * Every tool result arriving in this batch must answer a tool call that
     * appears earlier in the log.
     */
    private void requireAnsweredCalls(List<Message> messages, List<Message> batch) {
        Set<Message> incoming = Collections.newSetFromMap(new IdentityHashMap<>());
        incoming.addAll(batch);
        Set<String> seenCallIds = new HashSet<>();
        for (Message message : messages) {
            if (message.isAi()) {
                seenCallIds.addAll(message.toolCallIds());
            } else if (message.isTool() && incoming.contains(message)
                    && !seenCallIds.contains(message.getToolCallId())) {
                throw new IllegalStateException("Tool result '" + message.getId()
                        + "' references unknown tool call '" + message.getToolCallId() + "'");
            }
        }
    }

    /**
     * Tool results rebuilt from loose input lose their artifact; reuse the one
     * already recorded for the same tool call.
     */
    private Message carryArtifact(Message message, List<Message> merged) {
        if (!message.isTool() || message.hasArtifact() || message.getToolCallId() == null) {
            return message;
        }
        for (Message candidate : merged) {
            if (candidate.isTool() && candidate.hasArtifact()
                    && message.getToolCallId().equals(candidate.getToolCallId())) {
                message.setArtifact(candidate.getArtifact());
                return message;
            }
        }
        return message;
    }

    private List<Message> coerceAll(List<?> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        List<Message> messages = new ArrayList<>(values.size());
        for (Object value : values) {
            Message message = coerce(value);
            if (message.getId() == null || message.getId().isBlank()) {
                message.setId(UUID.randomUUID().toString());
            }
            messages.add(message);
        }
        return messages;
    }

    /**
     * Converts loose input into a fresh {@link Message}: messages are copied,
     * strings become human messages and maps are read by role.
     */
    Message coerce(Object value) {
        if (value instanceof Message message) {
            return message.copy();
        }
        if (value instanceof String text) {
            return Message.human(text);
        }
        if (value instanceof Map<?, ?> map) {
            return fromMap(map);
        }
        throw new IllegalArgumentException("Unsupported message shape: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    private Message fromMap(Map<?, ?> map) {
        Object role = map.get("role") != null ? map.get("role") : map.get("type");
        if (!(role instanceof String roleName)) {
            throw new IllegalArgumentException("Message map requires a 'role' or 'type' entry");
        }
        MessageType type = MessageType.fromRole(roleName);
        Object content = map.get("content");
        Message.MessageBuilder builder = Message.builder()
                .type(type)
                .content(content != null ? content.toString() : "")
                .id(asString(map.get("id")))
                .name(asString(map.get("name")));
        if (type == MessageType.TOOL) {
            String toolCallId = asString(map.get("tool_call_id"));
            if (toolCallId == null) {
                throw new IllegalArgumentException("Tool message map requires 'tool_call_id'");
            }
            builder.toolCallId(toolCallId).status(Message.ToolStatus.SUCCESS);
        }
        return builder.build();
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
