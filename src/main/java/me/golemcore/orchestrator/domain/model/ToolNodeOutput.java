package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one routing-engine invocation. Ordinary tool messages are kept in
 * tool-call order; hand-off commands, if any, are coalesced into a single
 * {@link ParentCommand} for the host graph.
 */
@Data
@Builder
public class ToolNodeOutput {

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private ParentCommand parentCommand;

    public boolean hasRouting() {
        return parentCommand != null;
    }

    /**
     * Aggregate of every routing command produced in one batch.
     */
    public record ParentCommand(List<String> targetAgents, List<Message> messages) {

        public ParentCommand {
            targetAgents = List.copyOf(targetAgents);
            messages = List.copyOf(messages);
        }

        public static ParentCommand coalesce(List<RoutingCommand> commands) {
            List<String> targets = new ArrayList<>();
            List<Message> combined = new ArrayList<>();
            for (RoutingCommand command : commands) {
                if (command.targetAgent() != null && !targets.contains(command.targetAgent())) {
                    targets.add(command.targetAgent());
                }
                combined.addAll(command.messages());
            }
            return new ParentCommand(targets, combined);
        }
    }
}
