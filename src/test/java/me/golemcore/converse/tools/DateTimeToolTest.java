package me.golemcore.converse.tools;

import me.golemcore.converse.domain.model.ToolDefinition;
import me.golemcore.converse.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DateTimeToolTest {

    private static final Instant NOW = Instant.parse("2026-03-14T15:09:26Z");

    private final DateTimeTool tool = new DateTimeTool(Clock.fixed(NOW, ZoneId.of("UTC")));

    @Test
    void definitionDeclaresOptionalTimezone() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("datetime", definition.getName());
        assertTrue(((Map<?, ?>) definition.getParameters().get("properties")).containsKey("timezone"));
    }

    @Test
    void usesClockZoneByDefault() throws Exception {
        ToolResult result = tool.execute(Map.of()).get();

        assertTrue(result.isSuccess());
        assertEquals("2026-03-14 15:09:26 UTC (SATURDAY)", result.getOutput());
    }

    @Test
    void convertsToRequestedTimezone() throws Exception {
        ToolResult result = tool.execute(Map.of("timezone", "Asia/Tokyo")).get();

        assertTrue(result.getOutput().startsWith("2026-03-15 00:09:26"));
        assertTrue(result.getOutput().endsWith("(SUNDAY)"));
    }

    @Test
    void reportsInvalidTimezone() throws Exception {
        ToolResult result = tool.execute(Map.of("timezone", "Mars/Olympus")).get();

        assertFalse(result.isSuccess());
        assertEquals("Invalid timezone: Mars/Olympus", result.getError());
    }
}
