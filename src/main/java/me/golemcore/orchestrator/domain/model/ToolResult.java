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

/**
 * Value returned by an {@code AgentTool}. A tool either produces plain output
 * (text and/or structured data), a ready-made tool message, or a routing
 * command handing control to another agent. Failed results are treated the same
 * way as a thrown exception by the routing engine.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;

    /**
     * Structured payload. Serialized to JSON when no text output is given, and
     * attached to the tool message as its artifact.
     */
    private Object data;

    private String error;
    private ToolFailureKind failureKind;

    private Message message;
    private RoutingCommand command;

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .build();
    }

    /**
     * Creates a successful tool result with output text and structured data.
     */
    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Wraps a tool message built by the tool itself; it is passed through as-is.
     */
    public static ToolResult message(Message message) {
        return ToolResult.builder()
                .success(true)
                .message(message)
                .build();
    }

    public static ToolResult route(RoutingCommand command) {
        return ToolResult.builder()
                .success(true)
                .command(command)
                .build();
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    public static ToolResult failure(ToolFailureKind failureKind, String error) {
        return ToolResult.builder()
                .success(false)
                .failureKind(failureKind)
                .error(error)
                .build();
    }

    public boolean isRouting() {
        return command != null;
    }

    public boolean isToolMessage() {
        return message != null && message.isTool();
    }
}
