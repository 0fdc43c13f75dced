package me.golemcore.converse.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolCallTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void jsonRoundTripYieldsEqualObject() throws Exception {
        ToolCall call = ToolCall.function("c1", "f", "{\"a\":1}");

        String json = objectMapper.writeValueAsString(call);
        ToolCall parsed = objectMapper.readValue(json, ToolCall.class);

        assertEquals(call, parsed);
        assertEquals(objectMapper.readTree(
                "{\"id\":\"c1\",\"type\":\"function\",\"function\":{\"name\":\"f\",\"arguments\":\"{\\\"a\\\":1}\"}}"),
                objectMapper.readTree(json));
    }

    @Test
    void typeDefaultsToFunction() {
        ToolCall call = ToolCall.builder().id("c2").function(FunctionCall.of("g", "{}")).build();

        assertEquals(ToolCall.TYPE_FUNCTION, call.getType());
        assertEquals("g", call.getName());
        assertEquals("{}", call.getArguments());
    }
}
