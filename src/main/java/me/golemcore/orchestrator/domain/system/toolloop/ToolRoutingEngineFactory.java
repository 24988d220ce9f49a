package me.golemcore.orchestrator.domain.system.toolloop;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.service.ToolResultTruncator;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Creates one {@link ToolRoutingEngine} per agent with the configured error
 * handling, timeout and server tool id prefix.
 */
@Component
@RequiredArgsConstructor
public class ToolRoutingEngineFactory {

    private final OrchestratorProperties properties;
    private final ExecutorService toolExecutor;
    private final ToolResultTruncator truncator;

    public ToolRoutingEngine create(AgentContext context) {
        return create(context, null, null);
    }

    public ToolRoutingEngine create(AgentContext context, ToolErrorHandler errorHandler,
            RuntimeToolLoader runtimeToolLoader) {
        OrchestratorProperties.ToolsProperties tools = properties.getTools();
        return ToolRoutingEngine.builder()
                .agentContext(context)
                .handleToolErrors(tools.isHandleErrors())
                .errorHandler(errorHandler)
                .runtimeToolLoader(runtimeToolLoader)
                .serverToolIdPrefix(tools.getServerToolIdPrefix())
                .toolTimeout(tools.getTimeout())
                .executor(toolExecutor)
                .truncator(truncator)
                .build();
    }
}
