package me.golemcore.converse.domain.agent;

import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.Message;
import me.golemcore.converse.domain.model.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StuckDetectorTest {

    private final StuckDetector detector = new StuckDetector(2, 3);

    @Test
    void detectsRepeatedAssistantReplies() {
        List<Message> messages = List.of(
                Message.user("go"),
                Message.assistant("same"),
                Message.assistant("same"),
                Message.assistant("same"));

        assertTrue(detector.isStuck(messages));
    }

    @Test
    void needsThresholdDuplicates() {
        List<Message> messages = List.of(
                Message.user("go"),
                Message.assistant("same"),
                Message.assistant("same"));

        assertFalse(detector.isStuck(messages));
    }

    @Test
    void ignoresNonAssistantMessagesBetweenReplies() {
        List<Message> messages = List.of(
                Message.assistant("same"),
                Message.user("again"),
                Message.assistant("same"),
                Message.system("note"),
                Message.assistant("same"));

        assertTrue(detector.isStuck(messages));
    }

    @Test
    void onlyInspectsWindow() {
        List<Message> messages = List.of(
                Message.assistant("same"),
                Message.assistant("same"),
                Message.assistant("a"),
                Message.assistant("b"),
                Message.assistant("c"),
                Message.assistant("same"));

        assertFalse(detector.isStuck(messages));
    }

    @Test
    void detectsRepeatedThoughtBetweenToolCalls() {
        List<Message> messages = List.of(
                Message.user("what time is it"),
                Message.fromToolCalls(List.of(ToolCall.function("t1", "datetime", "{}")), "Let me check the time"),
                Message.tool("12:00", "datetime", "t1"),
                Message.fromToolCalls(List.of(ToolCall.function("t2", "datetime", "{}")), "Let me check the time"),
                Message.tool("12:00", "datetime", "t2"),
                Message.fromToolCalls(List.of(ToolCall.function("t3", "datetime", "{}")), "Let me check the time"),
                Message.tool("12:00", "datetime", "t3"),
                Message.system(StuckDetector.STUCK_PROMPT));

        assertTrue(detector.isStuck(messages));
        assertEquals("Let me check the time", detector.repeatedContent(messages));
    }

    @Test
    void toolOnlyRepliesAreNotRepeatedThoughts() {
        List<Message> messages = List.of(
                Message.fromToolCalls(List.of(ToolCall.function("t1", "datetime", "{}")), LlmResponse.EMPTY_CONTENT),
                Message.tool("12:00", "datetime", "t1"),
                Message.fromToolCalls(List.of(ToolCall.function("t2", "datetime", "{}")), LlmResponse.EMPTY_CONTENT),
                Message.tool("12:00", "datetime", "t2"),
                Message.fromToolCalls(List.of(ToolCall.function("t3", "datetime", "{}")), LlmResponse.EMPTY_CONTENT),
                Message.tool("12:00", "datetime", "t3"));

        assertFalse(detector.isStuck(messages));
        assertNull(detector.repeatedContent(messages));
    }

    @Test
    void requiresNewestAssistantMessageWithContentAfterLastUserTurn() {
        assertFalse(detector.isStuck(List.of(
                Message.assistant("same"), Message.assistant("same"), Message.user("same"))));
        assertFalse(detector.isStuck(List.of(
                Message.assistant(null), Message.assistant(null), Message.assistant(null))));
        assertFalse(detector.isStuck(List.of(
                Message.fromToolCalls(List.of(ToolCall.function("a", "x", "{}")), null),
                Message.fromToolCalls(List.of(ToolCall.function("b", "x", "{}")), null),
                Message.fromToolCalls(List.of(ToolCall.function("c", "x", "{}")), null))));
    }

    @Test
    void shortHistoryIsNeverStuck() {
        assertFalse(detector.isStuck(List.of()));
        assertFalse(detector.isStuck(List.of(Message.assistant("only"))));
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new StuckDetector(0, 3));
    }
}
