package me.golemcore.converse.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LlmResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LlmResponse response(List<ToolCall> toolCalls) {
        return LlmResponse.builder()
                .id("chatcmpl-1")
                .created(1700000000L)
                .choices(List.of(LlmResponse.Choice.builder()
                        .finishReason("end_turn")
                        .index(0)
                        .message(LlmResponse.ChoiceMessage.builder()
                                .content("hello")
                                .role("assistant")
                                .toolCalls(toolCalls)
                                .build())
                        .build()))
                .usage(new LlmResponse.Usage(2, 3, 5))
                .build();
    }

    @Test
    void envelopeWritesExplicitNulls() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(response(null)));

        assertEquals("chat.completion", json.get("object").asText());
        JsonNode message = json.get("choices").get(0).get("message");
        assertTrue(message.has("tool_calls"));
        assertTrue(message.get("tool_calls").isNull());
        assertTrue(message.get("function_call").isNull());
        assertEquals("end_turn", json.get("choices").get(0).get("finish_reason").asText());
        assertEquals(5, json.get("usage").get("total_tokens").asInt());
        assertEquals(3, json.get("usage").get("prompt_tokens").asInt());
        assertFalse(json.has("content"));
    }

    @Test
    void toAssistantMessageCarriesToolCalls() {
        LlmResponse response = response(List.of(ToolCall.function("c1", "search", "{}")));

        Message message = response.toAssistantMessage();

        assertTrue(message.isAssistantMessage());
        assertTrue(message.hasToolCalls());
        assertEquals("hello", message.getContent());
    }

    @Test
    void toAssistantMessageWithoutToolCalls() {
        Message message = response(null).toAssistantMessage();

        assertFalse(message.hasToolCalls());
        assertEquals("hello", message.getContent());
    }
}
