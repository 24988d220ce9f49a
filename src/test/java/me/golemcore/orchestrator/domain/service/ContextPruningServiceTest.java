package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ContextPruningSettings;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.port.outbound.TokenCounter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContextPruningServiceTest {

    private static final TokenCounter COUNTER = message -> Math.max(1, message.getText().length());

    private ContextPruningService service;
    private ContextPruningSettings settings;

    @BeforeEach
    void setUp() {
        service = new ContextPruningService();
        settings = ContextPruningSettings.DEFAULTS.toBuilder()
                .enabled(true)
                .keepLastAssistants(1)
                .minPrunableToolChars(100)
                .softTrim(new ContextPruningSettings.SoftTrim(200, 50, 50))
                .build();
    }

    private static Message call(String id) {
        return Message.ai("", List.of(Message.ToolCall.builder().id(id).name("read").arguments(Map.of()).build()));
    }

    private static List<Message> conversation() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.human("read the first file"));
        messages.add(call("c1"));
        messages.add(Message.tool("c1", "read", "a".repeat(1_000)));
        messages.add(Message.ai("done"));
        messages.add(Message.human("read the second file"));
        messages.add(call("c2"));
        messages.add(Message.tool("c2", "read", "b".repeat(1_000)));
        messages.add(Message.ai("done again"));
        messages.add(Message.human("thanks"));
        messages.add(Message.ai("final"));
        return messages;
    }

    @Test
    void shouldHardClearOldAndSoftTrimMiddleAgedResults() {
        List<Message> messages = conversation();
        Map<Integer, Integer> tokens = new HashMap<>();

        ContextPruningService.Result result = service.apply(messages, tokens, COUNTER, settings);

        assertEquals(new ContextPruningService.Result(1, 1), result);
        assertEquals(ContextPruningSettings.DEFAULT_PLACEHOLDER, messages.get(2).getContent());
        String trimmed = messages.get(6).getContent();
        assertTrue(trimmed.startsWith("b".repeat(50) + "\n\n… [soft-trimmed: 1000 chars → 100 chars, middle removed]"));
        assertTrue(trimmed.endsWith("b".repeat(50)));
        assertEquals(trimmed.length(), tokens.get(6));
        assertEquals(ContextPruningSettings.DEFAULT_PLACEHOLDER.length(), tokens.get(2));
    }

    @Test
    void shouldDoNothingWhenDisabled() {
        List<Message> messages = conversation();
        List<Message> before = new ArrayList<>(messages);

        ContextPruningService.Result result = service.apply(messages, new HashMap<>(), COUNTER,
                ContextPruningSettings.DEFAULTS);

        assertSame(ContextPruningService.Result.NONE, result);
        assertEquals(before, messages);
    }

    @Test
    void shouldSkipResultsBelowMinimumSize() {
        List<Message> messages = conversation();
        messages.set(2, Message.tool("c1", "read", "tiny"));

        ContextPruningService.Result result = service.apply(messages, new HashMap<>(), COUNTER, settings);

        assertEquals(0, result.hardCleared());
        assertEquals("tiny", messages.get(2).getContent());
    }

    @Test
    void shouldProtectRecentAssistantTurns() {
        Set<Integer> protectedIndices = service.findProtectedIndices(conversation(), 2);

        assertEquals(Set.of(5, 6, 7, 8, 9), protectedIndices);
    }

    @Test
    void shouldProtectEverythingBeforeFirstHumanMessage() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system("be helpful"));
        messages.add(Message.ai("greeting"));
        messages.addAll(conversation());

        Set<Integer> protectedIndices = service.findProtectedIndices(messages, 1);

        assertTrue(protectedIndices.containsAll(Set.of(0, 1, 11)));
        assertFalse(protectedIndices.contains(4));
    }

    @Test
    void shouldSoftTrimToHeadAndTail() {
        String trimmed = ContextPruningService.softTrim("0123456789".repeat(10),
                new ContextPruningSettings.SoftTrim(20, 5, 5));

        assertTrue(trimmed.startsWith("01234\n\n… [soft-trimmed: 100 chars → 10 chars"));
        assertTrue(trimmed.endsWith("56789"));
    }
}
