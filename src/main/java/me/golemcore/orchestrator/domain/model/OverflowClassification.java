package me.golemcore.orchestrator.domain.model;

/**
 * Result of matching a provider error message against known context-overflow
 * signatures. {@code definite} implies {@code likely}.
 */
public record OverflowClassification(boolean definite, boolean likely) {

    public static final OverflowClassification NONE = new OverflowClassification(false, false);

    public boolean isOverflow() {
        return definite || likely;
    }

    public boolean isLowConfidence() {
        return likely && !definite;
    }
}
