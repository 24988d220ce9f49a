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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A typed element of structured message content: text, image, tool use,
 * thinking or a provider cache point.
 */
@Data
@Builder(toBuilder = true)
public class ContentBlock {

    private Type type;
    private String text;

    /**
     * Inline cache annotation (Anthropic style). Only meaningful on text blocks.
     */
    private CacheControl cacheControl;

    // Tool use blocks
    private String toolUseId;
    private String toolName;
    private Map<String, Object> input;

    private String imageUrl;

    /**
     * Side-channel data (e.g. UI resources) that must never reach the model.
     */
    private Map<String, Object> metadata;

    public enum Type {
        TEXT, IMAGE, TOOL_USE, THINKING, CACHE_POINT
    }

    public static ContentBlock text(String text) {
        return ContentBlock.builder().type(Type.TEXT).text(text).build();
    }

    public static ContentBlock cachePoint() {
        return ContentBlock.builder().type(Type.CACHE_POINT).cacheControl(CacheControl.DEFAULT).build();
    }

    public static ContentBlock toolUse(String id, String name, Map<String, Object> input) {
        return ContentBlock.builder()
                .type(Type.TOOL_USE)
                .toolUseId(id)
                .toolName(name)
                .input(input)
                .build();
    }

    public static ContentBlock image(String url) {
        return ContentBlock.builder().type(Type.IMAGE).imageUrl(url).build();
    }

    public boolean isText() {
        return type == Type.TEXT;
    }

    public boolean isCachePoint() {
        return type == Type.CACHE_POINT;
    }

    public boolean isToolUse() {
        return type == Type.TOOL_USE;
    }

    public boolean isImage() {
        return type == Type.IMAGE;
    }

    public boolean hasNonEmptyText() {
        return isText() && text != null && !text.isEmpty();
    }

    public boolean hasMetadata() {
        return metadata != null;
    }

    /**
     * Copies the block so that later edits never leak into the source log.
     */
    public ContentBlock copy() {
        return toBuilder()
                .input(input != null ? new LinkedHashMap<>(input) : null)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : null)
                .build();
    }
}
