package me.golemcore.orchestrator.domain.system.toolloop;

import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.domain.model.Message;

import java.util.List;

/**
 * Supplies the tool set for one dispatch from the tool calls of the current AI
 * message (just-in-time tool loading).
 */
@FunctionalInterface
public interface RuntimeToolLoader {

    List<AgentTool> loadTools(List<Message.ToolCall> toolCalls);
}
