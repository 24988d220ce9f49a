package me.golemcore.orchestrator.domain.service;

import lombok.Getter;
import me.golemcore.orchestrator.domain.model.OverflowClassification;
import me.golemcore.orchestrator.domain.system.LlmErrorClassifier;

/**
 * The provider still rejected the request as too large after truncation, or
 * nothing was left to truncate.
 */
@Getter
public class ContextOverflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient OverflowClassification classification;
    private final String budgetBreakdown;

    public ContextOverflowException(String message, OverflowClassification classification, String budgetBreakdown,
            Throwable cause) {
        super(LlmErrorClassifier.withCode(LlmErrorClassifier.CONTEXT_LENGTH_EXCEEDED, message), cause);
        this.classification = classification;
        this.budgetBreakdown = budgetBreakdown;
    }
}
