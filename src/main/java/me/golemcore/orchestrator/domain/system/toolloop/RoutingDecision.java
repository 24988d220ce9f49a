package me.golemcore.orchestrator.domain.system.toolloop;

/**
 * Next step after a model reply: dispatch tools or finish the turn.
 */
public enum RoutingDecision {
    TOOLS, END
}
