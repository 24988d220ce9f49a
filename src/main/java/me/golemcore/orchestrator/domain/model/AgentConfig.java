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
import me.golemcore.orchestrator.domain.component.AgentTool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static per-agent inputs used to build an {@link AgentContext}.
 */
@Data
@Builder(toBuilder = true)
public class AgentConfig {

    public static final String ANTHROPIC_BETA_HEADER = "anthropic-beta";

    private String agentId;

    @Builder.Default
    private Provider provider = Provider.OTHER;

    @Builder.Default
    private Map<String, Object> clientOptions = new HashMap<>();

    /**
     * Default HTTP headers the provider client sends with every request.
     */
    @Builder.Default
    private Map<String, String> defaultHeaders = new HashMap<>();

    @Builder.Default
    private List<AgentTool> tools = new ArrayList<>();

    /**
     * Tool metadata keyed by tool name (deferred loading, allowed callers).
     * Tools without an entry are always bound.
     */
    @Builder.Default
    private Map<String, ToolDefinition> toolRegistry = new LinkedHashMap<>();

    private String instructions;
    private String additionalInstructions;

    private Integer maxContextTokens;

    /**
     * Minimum interval between two consecutive model calls of this agent.
     */
    private Duration streamBuffer;

    private String initialSummary;
    private Integer initialSummaryTokens;

    private ContextPruningSettings contextPruning;
}
