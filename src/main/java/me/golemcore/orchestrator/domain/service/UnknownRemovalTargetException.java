package me.golemcore.orchestrator.domain.service;

import lombok.Getter;

/**
 * A removal marker referenced a message id that is not in the log.
 */
@Getter
public class UnknownRemovalTargetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String messageId;

    public UnknownRemovalTargetException(String messageId) {
        super("Attempting to delete a message with an ID that doesn't exist ('" + messageId + "')");
        this.messageId = messageId;
    }
}
