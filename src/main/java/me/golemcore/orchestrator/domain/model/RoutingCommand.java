package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Hand-off directive produced by a tool: switch the active agent to
 * {@code targetAgent} and append {@code messages} through the reducer. Consumed
 * by the host graph engine, never persisted.
 */
public record RoutingCommand(String targetAgent, List<Message> messages) {

    public RoutingCommand {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }
}
