package me.golemcore.orchestrator.tools;

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

import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.RoutingCommand;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hand-off tool that transfers control to another agent.
 *
 * <p>
 * The tool takes no arguments. Its result is a {@link RoutingCommand} whose
 * messages are the current log plus a tool message confirming the transfer, so
 * the receiving agent sees a complete tool call/result pair.
 */
public class HandoffTool implements AgentTool {

    public static final String NAME_PREFIX = "transfer_to_";

    private final String destination;
    private final ToolDefinition definition;

    public HandoffTool(String destination) {
        this(destination, null);
    }

    public HandoffTool(String destination, String description) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("Hand-off destination is required");
        }
        this.destination = destination;
        this.definition = ToolDefinition.builder()
                .name(NAME_PREFIX + destination)
                .description(description != null ? description : "Transfer control to the " + destination + " agent")
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    /**
     * One hand-off tool per destination, in the given order.
     */
    public static List<AgentTool> forDestinations(List<String> destinations) {
        List<AgentTool> tools = new ArrayList<>(destinations.size());
        for (String destination : destinations) {
            tools.add(new HandoffTool(destination));
        }
        return tools;
    }

    public String getDestination() {
        return destination;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
        String toolCallId = invocation.getToolCallId() != null ? invocation.getToolCallId() : "unknown";
        List<Message> messages = new ArrayList<>();
        if (invocation.getMessages() != null) {
            messages.addAll(invocation.getMessages());
        }
        messages.add(Message.tool(toolCallId, definition.getName(), "Successfully transferred to " + destination));
        return CompletableFuture.completedFuture(ToolResult.route(new RoutingCommand(destination, messages)));
    }
}
