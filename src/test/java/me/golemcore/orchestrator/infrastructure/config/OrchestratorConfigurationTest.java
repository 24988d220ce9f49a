package me.golemcore.orchestrator.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.golemcore.orchestrator.domain.model.AgentConfig;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.model.ContextPruningSettings;
import me.golemcore.orchestrator.domain.service.AgentContextFactory;
import me.golemcore.orchestrator.domain.service.ToolResultTruncator;
import me.golemcore.orchestrator.domain.system.toolloop.ToolRoutingEngineFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(OrchestratorConfiguration.class, ToolResultTruncator.class,
                    ToolRoutingEngineFactory.class, AgentContextFactory.class);

    @Test
    void shouldBindDefaults() {
        runner.run(context -> {
            OrchestratorProperties properties = context.getBean(OrchestratorProperties.class);

            assertTrue(properties.getTools().isHandleErrors());
            assertEquals(Duration.ofSeconds(60), properties.getTools().getTimeout());
            assertEquals(1, properties.getOverflow().getMaxRecoveryAttempts());
            assertTrue(properties.getCache().isEnabled());
            assertEquals(ContextPruningSettings.DEFAULTS, properties.resolveContextPruning());
            assertNotNull(context.getBean(Clock.class));
            assertNotNull(context.getBean(ExecutorService.class));
            assertFalse(context.getBean(ObjectMapper.class)
                    .isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        });
    }

    @Test
    void shouldBindNestedOverrides() {
        runner.withPropertyValues(
                "orchestrator.tools.timeout=5s",
                "orchestrator.tools.parallelism=2",
                "orchestrator.overflow.max-recovery-attempts=3",
                "orchestrator.context-pruning.enabled=true",
                "orchestrator.context-pruning.soft-trim.max-chars=800",
                "orchestrator.context-pruning.hard-clear.placeholder=[gone]")
                .run(context -> {
                    OrchestratorProperties properties = context.getBean(OrchestratorProperties.class);
                    ContextPruningSettings pruning = properties.resolveContextPruning();

                    assertEquals(Duration.ofSeconds(5), properties.getTools().getTimeout());
                    assertEquals(3, properties.getOverflow().getMaxRecoveryAttempts());
                    assertTrue(pruning.isEnabled());
                    assertEquals(800, pruning.getSoftTrim().maxChars());
                    assertEquals(1_500, pruning.getSoftTrim().headChars());
                    assertEquals("[gone]", pruning.getHardClear().placeholder());
                });
    }

    @Test
    void shouldApplyConfiguredPruningToNewContexts() {
        runner.withPropertyValues("orchestrator.context-pruning.enabled=true",
                "orchestrator.context-pruning.keep-last-assistants=1")
                .run(context -> {
                    AgentContextFactory factory = context.getBean(AgentContextFactory.class);

                    AgentContext agent = factory.create(AgentConfig.builder().agentId("a").build(), null);

                    assertTrue(agent.getContextPruning().isEnabled());
                    assertEquals(1, agent.getContextPruning().getKeepLastAssistants());
                });
    }

    @Test
    void shouldKeepExplicitPruningOfAgentConfig() {
        runner.withPropertyValues("orchestrator.context-pruning.enabled=true").run(context -> {
            AgentConfig config = AgentConfig.builder()
                    .agentId("a")
                    .contextPruning(ContextPruningSettings.DEFAULTS)
                    .build();

            AgentContext agent = context.getBean(AgentContextFactory.class).create(config, null);

            assertFalse(agent.getContextPruning().isEnabled());
        });
    }

    @Test
    void shouldBuildRoutingEngineFromFactory() {
        runner.run(context -> {
            AgentContext agent = context.getBean(AgentContextFactory.class)
                    .create(AgentConfig.builder().agentId("a").build(), null);

            assertNotNull(context.getBean(ToolRoutingEngineFactory.class).create(agent));
        });
    }
}
