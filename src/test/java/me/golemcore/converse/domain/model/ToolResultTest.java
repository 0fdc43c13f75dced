package me.golemcore.converse.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolResultTest {

    @Test
    void combineConcatenatesOutputs() {
        ToolResult combined = ToolResult.success("a").combine(ToolResult.success("b"));

        assertEquals("ab", combined.getOutput());
        assertNull(combined.getError());
    }

    @Test
    void combineTakesWhicheverFieldIsPresent() {
        ToolResult left = ToolResult.builder().output("out").build();
        ToolResult right = ToolResult.builder().error("bad").base64Image("img").build();

        ToolResult combined = left.combine(right);

        assertEquals("out", combined.getOutput());
        assertEquals("bad", combined.getError());
        assertEquals("img", combined.getBase64Image());
    }

    @Test
    void combineWithTwoImagesFails() {
        ToolResult left = ToolResult.builder().base64Image("x").build();
        ToolResult right = ToolResult.builder().base64Image("y").build();

        assertThrows(IllegalStateException.class, () -> left.combine(right));
    }

    @Test
    void isEmptyWhenAllFieldsAbsent() {
        assertTrue(ToolResult.builder().build().isEmpty());
        assertTrue(ToolResult.builder().output("").build().isEmpty());
        assertFalse(ToolResult.builder().system("note").build().isEmpty());
    }

    @Test
    void toStringPrefersError() {
        assertEquals("Error: boom", ToolResult.builder().output("out").error("boom").build().toString());
        assertEquals("out", ToolResult.success("out").toString());
    }

    @Test
    void withReturnsModifiedCopy() {
        ToolResult original = ToolResult.success("out");

        ToolResult copy = original.withError("late failure");

        assertEquals("late failure", copy.getError());
        assertEquals("out", copy.getOutput());
        assertNull(original.getError());
    }
}
