package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.AgentConfig;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.TokenCounter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Builds agent contexts with the configured pruning defaults and the shared
 * executor for tool schema token counting.
 */
@Component
@RequiredArgsConstructor
public class AgentContextFactory {

    private final OrchestratorProperties properties;
    private final ExecutorService toolExecutor;
    private final ObjectMapper objectMapper;

    public AgentContext create(AgentConfig config, TokenCounter tokenCounter) {
        return create(config, tokenCounter, null);
    }

    /**
     * @param indexTokenCountMap
     *            token counts restored by the host, or {@code null}
     */
    public AgentContext create(AgentConfig config, TokenCounter tokenCounter,
            Map<Integer, Integer> indexTokenCountMap) {
        AgentConfig resolved = config.getContextPruning() != null
                ? config
                : config.toBuilder().contextPruning(properties.resolveContextPruning()).build();
        return AgentContext.fromConfig(resolved, tokenCounter, indexTokenCountMap, toolExecutor, objectMapper);
    }
}
