package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Arguments plus call metadata handed to a tool for one dispatch.
 */
@Data
@Builder
public class ToolInvocation {

    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;

    /**
     * Host step id registered for this tool call, if any.
     */
    private String stepId;

    /**
     * Zero-based ordinal of this invocation among all calls of the same tool.
     */
    private int turn;

    /**
     * Conversation log as seen by the routing engine (read-only view).
     */
    private List<Message> messages;

    private AgentContext agentContext;
}
