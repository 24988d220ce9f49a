package me.golemcore.orchestrator.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The model called a tool that is not in the active tool map.
     */
    NOT_FOUND,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, etc.).
     */
    EXECUTION_FAILED
}
