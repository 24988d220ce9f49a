package me.golemcore.orchestrator.domain.component;

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

import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolResult;

import java.util.concurrent.CompletableFuture;

/**
 * Executable tool that a model can call. Tools expose their JSON Schema
 * definition for binding and implement the execution logic. Hand-off tools
 * return a routing command instead of plain output.
 */
public interface AgentTool {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool for one tool call. Failures may be reported either as an
     * exceptionally completed future or as {@link ToolResult#failure(String)};
     * the routing engine treats both the same way.
     *
     * @param invocation
     *            arguments plus call metadata
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolInvocation invocation);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
