package me.golemcore.orchestrator.port.outbound;

import me.golemcore.orchestrator.domain.model.Message;

/**
 * Host-supplied token counter. The orchestrator never estimates tokens on its
 * own except for the character heuristic used by overflow truncation.
 */
@FunctionalInterface
public interface TokenCounter {

    int count(Message message);
}
