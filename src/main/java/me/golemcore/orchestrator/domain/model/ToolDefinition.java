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

import java.util.List;
import java.util.Map;

/**
 * Registry entry describing a tool the LLM can call: name, description, JSON
 * Schema for input parameters, plus binding metadata (who may call it and
 * whether it is loaded only after discovery via tool search).
 */
@Data
@Builder(toBuilder = true)
public class ToolDefinition {

    public static final String CALLER_DIRECT = "direct";

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    private boolean deferLoading;

    /**
     * Callers allowed to invoke the tool. {@code null} means direct only.
     */
    private List<String> allowedCallers;

    /**
     * Creates a simple tool definition without input parameters.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    public boolean isDirectlyCallable() {
        return allowedCallers == null || allowedCallers.contains(CALLER_DIRECT);
    }
}
