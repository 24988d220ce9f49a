package me.golemcore.orchestrator.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.ContentBlock;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.MessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolResultTruncatorTest {

    private ToolResultTruncator truncator;

    @BeforeEach
    void setUp() {
        truncator = new ToolResultTruncator(new ObjectMapper());
    }

    private static String lines(int count, int width) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(String.format("%05d ", i)).append("x".repeat(width)).append('\n');
        }
        return sb.toString();
    }

    @Test
    void shouldComputeResultBudgetFromContextWindow() {
        assertEquals(120_000, ToolResultTruncator.maxToolResultChars(100_000));
        assertEquals(ToolResultTruncator.HARD_MAX_TOOL_RESULT_CHARS, ToolResultTruncator.maxToolResultChars(2_000_000));
        assertEquals(ToolResultTruncator.HARD_MAX_TOOL_RESULT_CHARS, ToolResultTruncator.maxToolResultChars(null));
        assertEquals(60_000, ToolResultTruncator.maxToolInputChars(100_000));
        assertEquals(ToolResultTruncator.HARD_MAX_TOOL_INPUT_CHARS, ToolResultTruncator.maxToolInputChars(5_000_000));
    }

    @Test
    void shouldLeaveFittingContentUntouched() {
        String content = "short output";

        assertSame(content, ToolResultTruncator.truncateToolResultContent(content, 200));
    }

    @ParameterizedTest
    @ValueSource(ints = { 200, 201, 250, 333, 500, 1_000, 4_096, 10_000 })
    void shouldNeverExceedMaxChars(int maxChars) {
        String[] inputs = {
                "y".repeat(50_000),
                lines(2_000, 40),
                lines(50, 1_000),
                "a\nb\n".repeat(20_000)
        };
        for (String input : inputs) {
            String truncated = ToolResultTruncator.truncateToolResultContent(input, maxChars);
            assertTrue(truncated.length() <= maxChars,
                    "length " + truncated.length() + " exceeds " + maxChars);
        }
    }

    @Test
    void shouldKeepHeadAndTailWithIndicator() {
        String content = lines(1_000, 60);

        String truncated = ToolResultTruncator.truncateToolResultContent(content, 5_000);

        assertTrue(truncated.startsWith("00000 "));
        assertTrue(truncated.contains("[truncated: " + content.length() + " chars total, kept first"));
        assertTrue(truncated.endsWith("00999 " + "x".repeat(60) + "\n"));
    }

    @Test
    void shouldCutHeadAtNewline() {
        String content = lines(1_000, 60);

        String truncated = ToolResultTruncator.truncateToolResultContent(content, 5_000);
        String head = truncated.substring(0, truncated.indexOf("\n\n… [truncated"));

        assertTrue(head.endsWith("x"), "head should end at a line boundary");
    }

    @Test
    void shouldFallBackToHeadOnlyForSmallBudgets() {
        String content = "z".repeat(10_000);

        String truncated = ToolResultTruncator.truncateToolResultContent(content, 250);

        assertTrue(truncated.contains("showing first"));
        assertTrue(truncated.length() <= 250);
    }

    @Test
    void shouldTruncateToolResultMessage() {
        Message message = Message.tool("c1", "shell", "q".repeat(5_000));

        Message truncated = truncator.truncateToolResult(message, 1_000);

        assertNotSame(message, truncated);
        assertTrue(truncated.getContent().length() <= 1_000);
        assertEquals("c1", truncated.getToolCallId());
        assertEquals(5_000, message.getContent().length());
    }

    @Test
    void shouldReturnSameInstanceWhenNothingToTruncate() {
        Message tool = Message.tool("c1", "shell", "ok");
        Message human = Message.human("q".repeat(10_000));

        assertSame(tool, truncator.truncateToolResult(tool, 1_000));
        assertSame(human, truncator.truncateToolResult(human, 1_000));
        assertSame(human, truncator.truncateToolCallInputs(human, 10));
    }

    @Test
    void shouldEmergencyTruncateToStub() {
        Message message = Message.tool("c1", "shell", "w".repeat(1_000));

        Message truncated = truncator.emergencyTruncateToolResult(message);

        assertTrue(truncated.getContent().startsWith("w".repeat(150) + "\n… [emergency truncated: 1000 → 150 chars]"));
    }

    @Test
    void shouldTruncateToolCallArgumentsAndBlocks() {
        Map<String, Object> bigInput = Map.of("payload", "p".repeat(2_000));
        Message message = Message.builder()
                .type(MessageType.AI)
                .content("")
                .blocks(List.of(ContentBlock.toolUse("c1", "write", bigInput)))
                .toolCalls(List.of(Message.ToolCall.builder().id("c1").name("write").arguments(bigInput).build()))
                .build();

        Message truncated = truncator.truncateToolCallInputs(message, 500);

        Map<String, Object> args = truncated.getToolCalls().get(0).getArguments();
        assertTrue(args.containsKey("_truncated"));
        assertTrue(((Integer) args.get("_originalChars")) > 2_000);
        assertTrue(truncated.getBlocks().get(0).getInput().containsKey("_truncated"));
        assertEquals(bigInput, message.getToolCalls().get(0).getArguments());
    }

    @Test
    void shouldSerializeStructuredValues() {
        assertEquals("", truncator.serialize(null));
        assertEquals("text", truncator.serialize("text"));
        assertEquals("{\"a\":1}", truncator.serialize(Map.of("a", 1)));
    }
}
