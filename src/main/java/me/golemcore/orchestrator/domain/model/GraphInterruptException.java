package me.golemcore.orchestrator.domain.model;

/**
 * Interrupt raised by the host graph engine (e.g. human-in-the-loop pause).
 * Never contained by tool error handling.
 */
public class GraphInterruptException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GraphInterruptException(String message) {
        super(message);
    }
}
