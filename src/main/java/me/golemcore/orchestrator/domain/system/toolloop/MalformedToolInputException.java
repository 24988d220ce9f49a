package me.golemcore.orchestrator.domain.system.toolloop;

/**
 * The routing engine was invoked without a trailing AI message or with an input
 * it cannot read. Never retried.
 */
public class MalformedToolInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedToolInputException(String message) {
        super(message);
    }
}
