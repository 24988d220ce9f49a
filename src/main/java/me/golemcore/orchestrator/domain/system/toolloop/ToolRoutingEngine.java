package me.golemcore.orchestrator.domain.system.toolloop;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.model.ContentBlock;
import me.golemcore.orchestrator.domain.model.GraphInterruptException;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.RoutingCommand;
import me.golemcore.orchestrator.domain.model.ToolFailureKind;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolNodeOutput;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.service.ToolResultTruncator;
import me.golemcore.orchestrator.domain.system.LlmErrorClassifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches the tool calls of the last AI message in the log.
 *
 * <p>
 * Calls already answered in the log and provider-executed server tool calls are
 * skipped. The rest run concurrently; a failing tool becomes an error tool
 * message and never aborts its siblings. Output messages keep tool-call order.
 * When any tool returns a {@link RoutingCommand}, all commands are coalesced
 * into one parent command for the host graph.
 */
@Slf4j
public class ToolRoutingEngine {

    public static final String DEFAULT_SERVER_TOOL_ID_PREFIX = "srvtoolu_";
    static final String ERROR_HINT = "\n Please fix your mistakes.";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private volatile Map<String, AgentTool> toolMap;
    private final AgentContext agentContext;
    private final boolean handleToolErrors;
    private final ToolErrorHandler errorHandler;
    private final RuntimeToolLoader runtimeToolLoader;
    private final String serverToolIdPrefix;
    private final Duration toolTimeout;
    private final Executor executor;
    private final ToolResultTruncator truncator;

    private final Map<String, String> toolCallStepIds = new ConcurrentHashMap<>();
    private final Map<String, Integer> toolUsageCount = new ConcurrentHashMap<>();

    @Builder
    private ToolRoutingEngine(List<AgentTool> tools, AgentContext agentContext, Boolean handleToolErrors,
            ToolErrorHandler errorHandler, RuntimeToolLoader runtimeToolLoader, String serverToolIdPrefix,
            Duration toolTimeout, Executor executor, ToolResultTruncator truncator) {
        List<AgentTool> initial = tools != null ? tools
                : agentContext != null ? agentContext.getTools() : List.of();
        this.toolMap = toToolMap(initial);
        this.agentContext = agentContext;
        this.handleToolErrors = handleToolErrors == null || handleToolErrors;
        this.errorHandler = errorHandler;
        this.runtimeToolLoader = runtimeToolLoader;
        this.serverToolIdPrefix = serverToolIdPrefix != null ? serverToolIdPrefix : DEFAULT_SERVER_TOOL_ID_PREFIX;
        this.toolTimeout = toolTimeout != null ? toolTimeout : DEFAULT_TIMEOUT;
        this.executor = executor != null ? executor : ForkJoinPool.commonPool();
        this.truncator = truncator;
    }

    /**
     * Associates a host step id with a tool call before dispatch.
     */
    public void registerStepId(String toolCallId, String stepId) {
        toolCallStepIds.put(toolCallId, stepId);
    }

    public Map<String, Integer> getToolUsageCounts() {
        return Map.copyOf(toolUsageCount);
    }

    /**
     * Accepts either a message list or a state map with a {@code messages}
     * entry.
     *
     * @throws MalformedToolInputException
     *             when no AI message ends the log
     */
    public ToolNodeOutput invoke(Object input) {
        List<Message> messages = resolveMessages(input);
        Message last = messages.get(messages.size() - 1);
        if (!last.isAi()) {
            throw new MalformedToolInputException("Tool routing only accepts AI messages as input, got "
                    + (last.getType() != null ? last.getType().getWireName() : "untyped") + " message");
        }

        List<Message.ToolCall> allCalls = last.getToolCalls() != null ? last.getToolCalls() : List.of();
        if (runtimeToolLoader != null) {
            this.toolMap = toToolMap(runtimeToolLoader.loadTools(allCalls));
        }

        Set<String> answered = new HashSet<>();
        for (Message message : messages) {
            if (message.isTool() && message.getToolCallId() != null) {
                answered.add(message.getToolCallId());
            }
        }

        List<Message.ToolCall> pending = new ArrayList<>();
        for (Message.ToolCall call : allCalls) {
            String id = call.getId();
            if (id == null || id.isEmpty()) {
                // a result could never be matched to this call in the log
                log.warn("[Tools] Skipping tool call '{}' without an id", call.getName());
                continue;
            }
            if (answered.contains(id) || id.startsWith(serverToolIdPrefix)) {
                continue;
            }
            pending.add(call);
        }
        if (pending.isEmpty()) {
            return ToolNodeOutput.builder().build();
        }

        log.info("[Tools] Dispatching {} tool calls: {}", pending.size(),
                pending.stream().map(Message.ToolCall::getName).toList());

        List<Message> view = Collections.unmodifiableList(messages);
        Map<String, AgentTool> tools = this.toolMap;
        List<CompletableFuture<Object>> futures = new ArrayList<>(pending.size());
        for (Message.ToolCall call : pending) {
            futures.add(CompletableFuture.supplyAsync(() -> dispatch(call, tools, view), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = LlmErrorClassifier.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }

        List<Object> outputs = new ArrayList<>(futures.size());
        for (CompletableFuture<Object> future : futures) {
            outputs.add(future.join());
        }
        return buildOutput(outputs);
    }

    private ToolNodeOutput buildOutput(List<Object> outputs) {
        List<Message> messages = new ArrayList<>();
        List<RoutingCommand> commands = new ArrayList<>();
        for (Object output : outputs) {
            if (output instanceof RoutingCommand command) {
                commands.add(command);
            } else {
                messages.add((Message) output);
            }
        }
        if (commands.isEmpty()) {
            return ToolNodeOutput.builder().messages(messages).build();
        }
        ToolNodeOutput.ParentCommand parent = ToolNodeOutput.ParentCommand.coalesce(commands);
        log.info("[Tools] Hand-off requested to {}", parent.targetAgents());
        return ToolNodeOutput.builder()
                .messages(messages)
                .parentCommand(parent)
                .build();
    }

    /**
     * Runs one tool call. Returns a tool {@link Message} or a
     * {@link RoutingCommand}.
     */
    private Object dispatch(Message.ToolCall call, Map<String, AgentTool> tools, List<Message> view) {
        try {
            AgentTool tool = tools.get(call.getName());
            if (tool == null) {
                throw new ToolNotFoundException(call.getName());
            }
            int turn = toolUsageCount.merge(call.getName(), 1, Integer::sum) - 1;

            ToolInvocation invocation = ToolInvocation.builder()
                    .toolCallId(call.getId())
                    .toolName(call.getName())
                    .arguments(call.getArguments() != null ? call.getArguments() : Map.of())
                    .stepId(toolCallStepIds.get(call.getId()))
                    .turn(turn)
                    .messages(view)
                    .agentContext(agentContext)
                    .build();

            ToolResult result = awaitResult(tool.execute(invocation), call.getName());
            if (result == null) {
                throw new ToolExecutionException("Tool returned no result", ToolFailureKind.EXECUTION_FAILED);
            }
            if (!result.isSuccess()) {
                ToolFailureKind kind = result.getFailureKind() != null ? result.getFailureKind()
                        : ToolFailureKind.EXECUTION_FAILED;
                throw new ToolExecutionException(result.getError(), kind);
            }
            return toOutput(result, call, tool);
        } catch (RuntimeException e) {
            return handleFailure(e, call);
        }
    }

    private ToolResult awaitResult(CompletableFuture<ToolResult> future, String toolName) {
        try {
            return future.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Interrupted while waiting for tool " + toolName);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolExecutionException("Tool execution timed out after " + toolTimeout.toSeconds() + "s",
                    ToolFailureKind.EXECUTION_FAILED);
        } catch (ExecutionException e) {
            Throwable cause = LlmErrorClassifier.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ToolExecutionException(LlmErrorClassifier.extractErrorMessage(cause),
                    ToolFailureKind.EXECUTION_FAILED, cause);
        }
    }

    private Object handleFailure(RuntimeException error, Message.ToolCall call) {
        if (!handleToolErrors) {
            throw error;
        }
        if (error instanceof GraphInterruptException || error instanceof CancellationException) {
            throw error;
        }

        log.error("[Tools] Tool '{}' failed (call {}): {}", call.getName(), call.getId(), error.getMessage());
        if (errorHandler != null) {
            try {
                errorHandler.onToolError(new ToolErrorHandler.ToolError(error, call.getId(), call.getName(),
                        call.getArguments()));
            } catch (RuntimeException handlerError) {
                log.warn("[Tools] Error handler failed for tool '{}'", call.getName(), handlerError);
            }
        }

        ToolFailureKind kind = ToolFailureKind.EXECUTION_FAILED;
        if (error instanceof ToolNotFoundException) {
            kind = ToolFailureKind.NOT_FOUND;
        } else if (error instanceof ToolExecutionException execution) {
            kind = execution.getFailureKind();
        }
        Message message = Message.toolError(call.getId(), call.getName(),
                "Error: " + error.getMessage() + ERROR_HINT);
        message.setFailureKind(kind);
        return message;
    }

    private Object toOutput(ToolResult result, Message.ToolCall call, AgentTool tool) {
        if (result.isRouting()) {
            return result.getCommand();
        }
        if (result.isToolMessage()) {
            return truncate(stripMetadataBlocks(result.getMessage()));
        }

        String content;
        if (result.getMessage() != null) {
            content = result.getMessage().getText();
        } else if (result.getOutput() != null) {
            content = result.getOutput();
        } else if (result.getData() != null) {
            content = serialize(result.getData());
        } else {
            content = "";
        }
        Message message = Message.tool(call.getId(), tool.getToolName(), content);
        message.setArtifact(result.getData());
        return truncate(message);
    }

    /**
     * Blocks with metadata carry UI resources for the host and are not sent to
     * the model.
     */
    private static Message stripMetadataBlocks(Message message) {
        if (!message.hasBlocks()) {
            return message;
        }
        List<ContentBlock> kept = new ArrayList<>();
        for (ContentBlock block : message.getBlocks()) {
            if (!block.hasMetadata()) {
                kept.add(block);
            }
        }
        if (kept.size() == message.getBlocks().size()) {
            return message;
        }
        return message.toBuilder().blocks(kept).build();
    }

    private Message truncate(Message message) {
        if (truncator == null) {
            return message;
        }
        Integer maxContextTokens = agentContext != null ? agentContext.getMaxContextTokens() : null;
        return truncator.truncateToolResult(message, ToolResultTruncator.maxToolResultChars(maxContextTokens));
    }

    private String serialize(Object data) {
        if (truncator != null) {
            return truncator.serialize(data);
        }
        return String.valueOf(data);
    }

    @SuppressWarnings("unchecked")
    private static List<Message> resolveMessages(Object input) {
        Object candidate = input;
        if (input instanceof Map<?, ?> state) {
            candidate = state.get("messages");
        }
        if (!(candidate instanceof List<?> list) || list.isEmpty()) {
            throw new MalformedToolInputException("Tool routing expects a non-empty message list or a state "
                    + "with 'messages'");
        }
        for (Object item : list) {
            if (!(item instanceof Message)) {
                throw new MalformedToolInputException("Unsupported message shape: "
                        + (item == null ? "null" : item.getClass().getName()));
            }
        }
        return (List<Message>) list;
    }

    private static Map<String, AgentTool> toToolMap(List<AgentTool> tools) {
        Map<String, AgentTool> map = new LinkedHashMap<>();
        if (tools != null) {
            for (AgentTool tool : tools) {
                map.put(tool.getToolName(), tool);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Decides whether the last message still needs tool dispatch.
     *
     * @param invokedToolIds
     *            ids of tool calls already executed in this run
     */
    public static RoutingDecision toolsCondition(List<Message> messages, Set<String> invokedToolIds) {
        if (messages == null || messages.isEmpty()) {
            return RoutingDecision.END;
        }
        Message last = messages.get(messages.size() - 1);
        if (!last.isAi() || !last.hasToolCalls()) {
            return RoutingDecision.END;
        }
        if (invokedToolIds != null && !invokedToolIds.isEmpty()) {
            boolean allInvoked = last.getToolCalls().stream()
                    .allMatch(call -> call.getId() == null || invokedToolIds.contains(call.getId()));
            if (allInvoked) {
                return RoutingDecision.END;
            }
        }
        return RoutingDecision.TOOLS;
    }

    /**
     * Failure reported by a tool through its result rather than an exception.
     */
    static class ToolExecutionException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final transient ToolFailureKind failureKind;

        ToolExecutionException(String message, ToolFailureKind failureKind) {
            super(message);
            this.failureKind = failureKind;
        }

        ToolExecutionException(String message, ToolFailureKind failureKind, Throwable cause) {
            super(message, cause);
            this.failureKind = failureKind;
        }

        ToolFailureKind getFailureKind() {
            return failureKind;
        }
    }
}
