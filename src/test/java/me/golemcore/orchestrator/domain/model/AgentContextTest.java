package me.golemcore.orchestrator.domain.model;

import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.port.outbound.TokenCounter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentContextTest {

    private static final TokenCounter COUNTER = message -> Math.max(1, message.getText().length());
    private static final Executor DIRECT = Runnable::run;

    private static AgentTool tool(String name) {
        AgentTool tool = mock(AgentTool.class);
        ToolDefinition definition = ToolDefinition.builder()
                .name(name)
                .description("Tool " + name)
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .build();
        when(tool.getDefinition()).thenReturn(definition);
        when(tool.getToolName()).thenReturn(name);
        return tool;
    }

    @Test
    void shouldCountInstructionsAndToolSchemas() {
        AgentConfig config = AgentConfig.builder()
                .agentId("writer")
                .instructions("You write.")
                .additionalInstructions("Be brief.")
                .tools(List.of(tool("search")))
                .maxContextTokens(1_000)
                .build();

        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);
        context.awaitTokenCalculation();
        TokenBudgetBreakdown breakdown = context.getTokenBudgetBreakdown();

        assertEquals("You write.\n\nBe brief.", context.getFinalInstructions());
        assertEquals("You write.\n\nBe brief.".length(), breakdown.systemMessageTokens());
        assertTrue(breakdown.toolSchemaTokens() > 0);
        assertEquals(1, breakdown.toolCount());
        assertEquals(breakdown.systemMessageTokens() + breakdown.toolSchemaTokens(), breakdown.instructionTokens());
        assertEquals(1_000 - breakdown.instructionTokens(), breakdown.availableForMessages());
    }

    @Test
    void shouldNeverReportNegativeAvailableTokens() {
        AgentConfig config = AgentConfig.builder()
                .agentId("tiny")
                .instructions("x".repeat(500))
                .initialSummary("long summary")
                .initialSummaryTokens(400)
                .maxContextTokens(100)
                .build();

        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);

        assertEquals(0, context.getTokenBudgetBreakdown().availableForMessages());
        assertEquals(900, context.getInstructionTokens());
    }

    @Test
    void shouldExposeCalculationHandleForAsyncSchemaCounting() {
        List<Runnable> pending = new ArrayList<>();
        AgentConfig config = AgentConfig.builder()
                .agentId("async")
                .tools(List.of(tool("search")))
                .maxContextTokens(1_000)
                .build();

        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, pending::add);

        assertFalse(context.getTokenCalculation().isDone());
        assertEquals(0, context.getTokenBudgetBreakdown().toolSchemaTokens());
        pending.forEach(Runnable::run);
        context.awaitTokenCalculation();
        assertTrue(context.getTokenBudgetBreakdown().toolSchemaTokens() > 0);
    }

    @Test
    void shouldKeepSummaryAcrossReset() {
        AgentConfig config = AgentConfig.builder()
                .agentId("summarized")
                .instructions("Rules")
                .maxContextTokens(1_000)
                .build();
        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);
        context.setSummary("Earlier we discussed pricing.", 12);
        context.getIndexTokenCountMap().put(0, 42);
        context.setCurrentUsage(TokenUsage.of(10, 5));
        context.recordModelCall(Instant.parse("2026-01-01T00:00:00Z"));
        context.markToolsAsDiscovered(List.of("search"));

        context.reset();

        assertEquals("Earlier we discussed pricing.", context.getSummaryText());
        assertEquals(12, context.getSummaryTokens());
        assertTrue(context.getIndexTokenCountMap().isEmpty());
        assertNull(context.getCurrentUsage());
        assertNull(context.getLastStreamCall());
        assertTrue(context.getDiscoveredToolNames().isEmpty());
        assertTrue(context.getSystemMessage().getContent()
                .endsWith("## Conversation Summary\nEarlier we discussed pricing."));
    }

    @Test
    void shouldDropSummaryOnlyWhenCleared() {
        AgentConfig config = AgentConfig.builder().agentId("a").initialSummary("old").initialSummaryTokens(3).build();
        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);

        context.clearSummary();
        context.reset();

        assertNull(context.getSummaryText());
        assertEquals(0, context.getSummaryTokens());
        assertNull(context.getSystemMessage());
    }

    @Test
    void shouldBindDeferredToolsOnlyAfterDiscovery() {
        Map<String, ToolDefinition> registry = new LinkedHashMap<>();
        registry.put("deferred", ToolDefinition.builder().name("deferred").deferLoading(true).build());
        registry.put("programmatic", ToolDefinition.builder().name("programmatic")
                .allowedCallers(List.of("code_execution")).build());
        registry.put("plain", ToolDefinition.builder().name("plain").build());
        AgentConfig config = AgentConfig.builder()
                .agentId("a")
                .tools(List.of(tool("deferred"), tool("programmatic"), tool("plain"), tool("unregistered")))
                .toolRegistry(registry)
                .build();
        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);

        assertEquals(List.of("plain", "unregistered"),
                context.getToolsForBinding().stream().map(AgentTool::getToolName).toList());

        context.markToolsAsDiscovered(List.of("deferred", "programmatic"));

        assertEquals(List.of("deferred", "plain", "unregistered"),
                context.getToolsForBinding().stream().map(AgentTool::getToolName).toList());
        assertEquals(Set.of("deferred"), context.getDeferredToolRegistry(true).keySet());
    }

    @Test
    void shouldCacheSystemPromptForAnthropicPromptCachingBeta() {
        AgentConfig config = AgentConfig.builder()
                .agentId("a")
                .provider(Provider.ANTHROPIC)
                .defaultHeaders(Map.of(AgentConfig.ANTHROPIC_BETA_HEADER, "prompt-caching-2024-07-31"))
                .instructions("Rules")
                .build();
        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);

        Message system = context.getSystemMessage();

        assertTrue(context.isSystemPromptCachingEnabled());
        assertEquals(CacheControl.EPHEMERAL, system.getBlocks().get(0).getCacheControl());
    }

    @Test
    void shouldComputeRemainingCallDelay() {
        AgentConfig config = AgentConfig.builder().agentId("a").streamBuffer(Duration.ofSeconds(2)).build();
        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);
        Instant start = Instant.parse("2026-01-01T00:00:00Z");

        assertEquals(Duration.ZERO, context.getRemainingCallDelay(start));
        context.recordModelCall(start);
        assertEquals(Duration.ofMillis(1_500), context.getRemainingCallDelay(start.plusMillis(500)));
        assertEquals(Duration.ZERO, context.getRemainingCallDelay(start.plusSeconds(5)));
    }

    @Test
    void shouldLogAndSwallowSchemaCountingFailures() {
        AgentTool broken = mock(AgentTool.class);
        when(broken.getToolName()).thenReturn("broken");
        when(broken.getDefinition()).thenThrow(new IllegalStateException("no schema"));
        AgentConfig config = AgentConfig.builder().agentId("a").tools(List.of(broken)).build();

        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);

        CompletableFuture<Void> calculation = context.getTokenCalculation();
        assertTrue(calculation.isDone());
        assertFalse(calculation.isCompletedExceptionally());
        assertEquals(0, context.getTokenBudgetBreakdown().toolSchemaTokens());
    }

    @Test
    void shouldFormatBudgetBreakdown() {
        AgentConfig config = AgentConfig.builder().agentId("fmt").instructions("abc").maxContextTokens(2).build();
        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);

        String formatted = context.formatTokenBudgetBreakdown(List.of());

        assertTrue(formatted.contains("Max Context Tokens: 2"));
        assertTrue(formatted.contains("(exceeds max by 1)"));
    }

    @Test
    void shouldCountSchemasOfDiscoveredTools() {
        ToolDefinition big = ToolDefinition.builder()
                .name("big")
                .description("d".repeat(500))
                .inputSchema(Map.of("type", "object", "properties", Map.of()))
                .deferLoading(true)
                .build();
        AgentTool bigTool = mock(AgentTool.class);
        when(bigTool.getToolName()).thenReturn("big");
        when(bigTool.getDefinition()).thenReturn(big);
        AgentConfig config = AgentConfig.builder()
                .agentId("a")
                .tools(List.of(bigTool))
                .toolRegistry(Map.of("big", big))
                .maxContextTokens(10_000)
                .build();
        AgentContext context = AgentContext.fromConfig(config, COUNTER, null, DIRECT);
        assertEquals(0, context.getTokenBudgetBreakdown().toolSchemaTokens());

        context.markToolsAsDiscovered(List.of("big"));
        context.awaitTokenCalculation();

        TokenBudgetBreakdown breakdown = context.getTokenBudgetBreakdown();
        assertTrue(breakdown.toolSchemaTokens() > 500);
        assertEquals(1, breakdown.toolCount());
        assertEquals(10_000 - breakdown.toolSchemaTokens(), breakdown.availableForMessages());

        context.reset();
        context.awaitTokenCalculation();

        assertEquals(0, context.getTokenBudgetBreakdown().toolSchemaTokens());
    }
}
