package me.golemcore.orchestrator.domain.system.toolloop;

import lombok.Getter;

/**
 * The model called a tool that is not in the active tool map.
 */
@Getter
public class ToolNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Tool \"" + toolName + "\" not found.");
        this.toolName = toolName;
    }
}
