package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Final result of a provider call.
 */
@Data
@Builder
public class LlmResponse {

    private Message message;
    private TokenUsage usage;
    private String model;
}
