package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Result of one agent turn: the merged log, the model's reply and, when a
 * hand-off tool ran, the coalesced command for the host graph.
 */
public record TurnOutcome(
        List<Message> messages,
        Message aiMessage,
        ToolNodeOutput.ParentCommand parentCommand) {

    public TurnOutcome {
        messages = List.copyOf(messages);
    }

    public boolean hasRouting() {
        return parentCommand != null;
    }
}
