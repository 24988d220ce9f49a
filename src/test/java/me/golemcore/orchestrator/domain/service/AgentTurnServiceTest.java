package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.AgentConfig;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.TurnOutcome;
import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.system.toolloop.ToolRoutingEngine;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import me.golemcore.orchestrator.tools.HandoffTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AgentTurnServiceTest {

    private ModelInvocationService modelInvocationService;
    private AgentTurnService service;
    private AgentContext context;
    private LlmPort llmPort;

    @BeforeEach
    void setUp() {
        modelInvocationService = mock(ModelInvocationService.class);
        service = new AgentTurnService(new MessageStateReducer(), modelInvocationService);
        context = AgentContext.fromConfig(AgentConfig.builder().agentId("router").build(), null, null,
                Runnable::run);
        llmPort = mock(LlmPort.class);
    }

    private void modelReplies(Message reply) {
        when(modelInvocationService.invoke(any(), any(), any()))
                .thenReturn(LlmResponse.builder().message(reply).build());
    }

    private static Message callTo(String id, String toolName) {
        return Message.ai("", List.of(Message.ToolCall.builder().id(id).name(toolName).arguments(Map.of()).build()));
    }

    private static AgentTool calculator() {
        return new AgentTool() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple("calculator", "Adds numbers");
            }

            @Override
            public CompletableFuture<ToolResult> execute(ToolInvocation invocation) {
                return CompletableFuture.completedFuture(ToolResult.success("42"));
            }
        };
    }

    @Test
    void shouldMergeToolResultsAfterModelReply() {
        modelReplies(callTo("t1", "calculator"));
        ToolRoutingEngine engine = ToolRoutingEngine.builder()
                .tools(List.of(calculator()))
                .executor(Runnable::run)
                .build();

        TurnOutcome outcome = service.runTurn(context, List.of(), List.of(Message.human("hi")), llmPort, engine);

        List<Message> messages = outcome.messages();
        assertEquals(3, messages.size());
        assertTrue(messages.get(0).isHuman());
        assertTrue(messages.get(1).isAi());
        assertEquals("t1", messages.get(2).getToolCallId());
        assertEquals("42", messages.get(2).getContent());
        assertTrue(messages.stream().allMatch(m -> m.getId() != null));
        assertSame(messages.get(1), outcome.aiMessage());
        assertFalse(outcome.hasRouting());
    }

    @Test
    void shouldStopAfterReplyWithoutToolCalls() {
        modelReplies(Message.ai("hello"));
        ToolRoutingEngine engine = mock(ToolRoutingEngine.class);

        TurnOutcome outcome = service.runTurn(context, List.of(Message.human("hi")), List.of(), llmPort, engine);

        assertEquals(2, outcome.messages().size());
        assertEquals("hello", outcome.aiMessage().getContent());
        verifyNoInteractions(engine);
    }

    @Test
    void shouldReturnParentCommandOnHandOff() {
        modelReplies(callTo("t1", "transfer_to_writer"));
        ToolRoutingEngine engine = ToolRoutingEngine.builder()
                .tools(HandoffTool.forDestinations(List.of("writer")))
                .executor(Runnable::run)
                .build();

        TurnOutcome outcome = service.runTurn(context, List.of(), List.of(Message.human("draft a poem")), llmPort,
                engine);

        assertTrue(outcome.hasRouting());
        assertEquals(List.of("writer"), outcome.parentCommand().targetAgents());
        List<Message> messages = outcome.messages();
        assertEquals(3, messages.size());
        assertEquals("Successfully transferred to writer", messages.get(2).getContent());
        assertEquals("t1", messages.get(2).getToolCallId());
    }

    @Test
    void shouldRejectNonAiReply() {
        modelReplies(Message.human("echo"));

        assertThrows(IllegalStateException.class,
                () -> service.runTurn(context, List.of(), List.of(Message.human("hi")), llmPort, null));
    }

    @Test
    void shouldCompleteTurnWhenModelEmitsCallWithoutId() {
        Message reply = Message.ai("", List.of(
                Message.ToolCall.builder().name("calculator").arguments(Map.of()).build(),
                Message.ToolCall.builder().id("t2").name("calculator").arguments(Map.of()).build()));
        modelReplies(reply);
        ToolRoutingEngine engine = ToolRoutingEngine.builder()
                .tools(List.of(calculator()))
                .executor(Runnable::run)
                .build();

        TurnOutcome outcome = service.runTurn(context, List.of(), List.of(Message.human("hi")), llmPort, engine);

        assertEquals(3, outcome.messages().size());
        assertEquals("t2", outcome.messages().get(2).getToolCallId());
    }
}
