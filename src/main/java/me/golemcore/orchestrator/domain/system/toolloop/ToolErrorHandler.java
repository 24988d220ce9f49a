package me.golemcore.orchestrator.domain.system.toolloop;

import java.util.Map;

/**
 * Callback notified of every contained tool failure. Exceptions thrown here
 * are logged and never replace the original tool error.
 */
@FunctionalInterface
public interface ToolErrorHandler {

    void onToolError(ToolError error);

    record ToolError(Throwable error, String toolCallId, String toolName, Map<String, Object> input) {
    }
}
