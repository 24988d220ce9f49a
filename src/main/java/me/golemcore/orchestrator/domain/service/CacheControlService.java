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
import me.golemcore.orchestrator.domain.model.CacheControl;
import me.golemcore.orchestrator.domain.model.ContentBlock;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Provider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Places prompt-cache markers on the newest messages of a log.
 *
 * <p>
 * Two marker styles are supported:
 * <ul>
 * <li>{@link MarkerStyle#INLINE_ANNOTATION} (Anthropic): an ephemeral
 * {@code cache_control} annotation on the last text block of the last two human
 * messages.</li>
 * <li>{@link MarkerStyle#SIBLING_BLOCK} (Bedrock): a separate cache-point block
 * right after the last non-empty text block of the last two non-tool, non-empty
 * messages.</li>
 * </ul>
 * Both styles strip every existing marker of either kind in the same backward
 * pass, so repeated calls never accumulate markers. Only changed messages are
 * copied; the input list and its messages are left untouched.
 */
@Service
@Slf4j
public class CacheControlService {

    static final int MARKED_MESSAGES = 2;

    public enum MarkerStyle {
        INLINE_ANNOTATION, SIBLING_BLOCK
    }

    public List<Message> addCacheControl(List<Message> messages) {
        return apply(messages, MarkerStyle.INLINE_ANNOTATION);
    }

    public List<Message> addBedrockCacheControl(List<Message> messages) {
        return apply(messages, MarkerStyle.SIBLING_BLOCK);
    }

    /**
     * Applies the marker style of {@code provider}; other providers get a log
     * with all markers removed.
     */
    public List<Message> applyForProvider(Provider provider, List<Message> messages) {
        return switch (provider) {
        case ANTHROPIC -> addCacheControl(messages);
        case BEDROCK -> addBedrockCacheControl(messages);
        default -> stripBedrockCacheControl(stripAnthropicCacheControl(messages));
        };
    }

    public List<Message> apply(List<Message> messages, MarkerStyle style) {
        if (messages == null || messages.size() < MARKED_MESSAGES) {
            return messages;
        }
        List<Message> updated = new ArrayList<>(messages);
        int marked = 0;
        for (int i = updated.size() - 1; i >= 0; i--) {
            Message message = strip(updated.get(i), true, true);
            if (marked < MARKED_MESSAGES && isEligible(message, style)) {
                Message withMarker = style == MarkerStyle.INLINE_ANNOTATION
                        ? annotateLastText(message)
                        : insertCachePoint(message);
                if (withMarker != null) {
                    message = withMarker;
                    marked++;
                }
            }
            updated.set(i, message);
        }
        log.debug("[Cache] {} markers placed on {} messages", marked, updated.size());
        return updated;
    }

    /**
     * Removes inline {@code cache_control} annotations from all messages.
     */
    public List<Message> stripAnthropicCacheControl(List<Message> messages) {
        return stripAll(messages, false, true);
    }

    /**
     * Removes cache-point blocks from all messages.
     */
    public List<Message> stripBedrockCacheControl(List<Message> messages) {
        return stripAll(messages, true, false);
    }

    private List<Message> stripAll(List<Message> messages, boolean cachePoints, boolean annotations) {
        if (messages == null) {
            return null;
        }
        List<Message> updated = new ArrayList<>(messages.size());
        for (Message message : messages) {
            updated.add(strip(message, cachePoints, annotations));
        }
        return updated;
    }

    private boolean isEligible(Message message, MarkerStyle style) {
        return switch (style) {
        case INLINE_ANNOTATION -> message.isHuman();
        case SIBLING_BLOCK -> !message.isTool() && !isEmptyText(message);
        };
    }

    private static boolean isEmptyText(Message message) {
        return !message.hasBlocks() && (message.getContent() == null || message.getContent().isEmpty());
    }

    private Message strip(Message message, boolean cachePoints, boolean annotations) {
        if (!message.hasBlocks() || !hasMarkers(message.getBlocks(), cachePoints, annotations)) {
            return message;
        }
        List<ContentBlock> kept = new ArrayList<>(message.getBlocks().size());
        for (ContentBlock block : message.getBlocks()) {
            if (cachePoints && block.isCachePoint()) {
                continue;
            }
            if (annotations && !block.isCachePoint() && block.getCacheControl() != null) {
                kept.add(block.toBuilder().cacheControl(null).build());
            } else {
                kept.add(block);
            }
        }
        return message.toBuilder().blocks(kept).build();
    }

    private static boolean hasMarkers(List<ContentBlock> blocks, boolean cachePoints, boolean annotations) {
        for (ContentBlock block : blocks) {
            if (cachePoints && block.isCachePoint()) {
                return true;
            }
            if (annotations && !block.isCachePoint() && block.getCacheControl() != null) {
                return true;
            }
        }
        return false;
    }

    private Message annotateLastText(Message message) {
        if (!message.hasBlocks()) {
            String text = message.getContent() != null ? message.getContent() : "";
            ContentBlock block = ContentBlock.text(text).toBuilder()
                    .cacheControl(CacheControl.EPHEMERAL)
                    .build();
            return message.toBuilder().content(null).blocks(new ArrayList<>(List.of(block))).build();
        }
        List<ContentBlock> blocks = message.getBlocks();
        for (int j = blocks.size() - 1; j >= 0; j--) {
            if (blocks.get(j).isText()) {
                List<ContentBlock> updated = new ArrayList<>(blocks);
                updated.set(j, blocks.get(j).toBuilder().cacheControl(CacheControl.EPHEMERAL).build());
                return message.toBuilder().blocks(updated).build();
            }
        }
        return null;
    }

    private Message insertCachePoint(Message message) {
        if (!message.hasBlocks()) {
            List<ContentBlock> blocks = new ArrayList<>();
            blocks.add(ContentBlock.text(message.getContent()));
            blocks.add(ContentBlock.cachePoint());
            return message.toBuilder().content(null).blocks(blocks).build();
        }
        List<ContentBlock> blocks = message.getBlocks();
        int lastText = -1;
        for (int j = blocks.size() - 1; j >= 0; j--) {
            if (blocks.get(j).isText() && blocks.get(j).hasNonEmptyText()) {
                lastText = j;
                break;
            }
        }
        if (lastText < 0) {
            return null;
        }
        List<ContentBlock> updated = new ArrayList<>(blocks);
        updated.add(lastText + 1, ContentBlock.cachePoint());
        return message.toBuilder().blocks(updated).build();
    }
}
