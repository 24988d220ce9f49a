package me.golemcore.orchestrator.tools;

import me.golemcore.orchestrator.domain.component.AgentTool;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.RoutingCommand;
import me.golemcore.orchestrator.domain.model.ToolInvocation;
import me.golemcore.orchestrator.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HandoffToolTest {

    @Test
    void shouldNameToolAfterDestination() {
        HandoffTool tool = new HandoffTool("billing");

        assertEquals("transfer_to_billing", tool.getToolName());
        assertEquals("Transfer control to the billing agent", tool.getDefinition().getDescription());
        assertEquals(Map.of(), tool.getDefinition().getInputSchema().get("properties"));
    }

    @Test
    void shouldKeepCustomDescription() {
        HandoffTool tool = new HandoffTool("billing", "Escalate invoices");

        assertEquals("Escalate invoices", tool.getDefinition().getDescription());
    }

    @Test
    void shouldRejectBlankDestination() {
        assertThrows(IllegalArgumentException.class, () -> new HandoffTool(" "));
    }

    @Test
    void shouldRouteWithLogAndConfirmation() {
        HandoffTool tool = new HandoffTool("writer");
        List<Message> log = List.of(Message.human("write something"));
        ToolInvocation invocation = ToolInvocation.builder()
                .toolCallId("call-7")
                .toolName(tool.getToolName())
                .arguments(Map.of())
                .messages(log)
                .build();

        ToolResult result = tool.execute(invocation).join();

        assertTrue(result.isSuccess());
        RoutingCommand command = result.getCommand();
        assertEquals("writer", command.targetAgent());
        assertEquals(2, command.messages().size());
        Message confirmation = command.messages().get(1);
        assertEquals("call-7", confirmation.getToolCallId());
        assertEquals("transfer_to_writer", confirmation.getName());
        assertEquals("Successfully transferred to writer", confirmation.getContent());
    }

    @Test
    void shouldFallBackToUnknownCallId() {
        ToolResult result = new HandoffTool("writer").execute(ToolInvocation.builder().build()).join();

        assertEquals("unknown", result.getCommand().messages().get(0).getToolCallId());
    }

    @Test
    void shouldCreateOneToolPerDestination() {
        List<AgentTool> tools = HandoffTool.forDestinations(List.of("a", "b"));

        assertEquals(List.of("transfer_to_a", "transfer_to_b"), tools.stream().map(AgentTool::getToolName).toList());
    }
}
