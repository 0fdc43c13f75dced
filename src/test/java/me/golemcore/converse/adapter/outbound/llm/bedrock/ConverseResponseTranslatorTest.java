package me.golemcore.converse.adapter.outbound.llm.bedrock;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ConverseResponse;
import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.ToolCall;
import me.golemcore.converse.domain.model.ToolUseCorrelation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ConverseResponseTranslatorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private ObjectMapper objectMapper;
    private ConverseResponseTranslator translator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        translator = new ConverseResponseTranslator(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ConverseResponse parse(String json) throws Exception {
        return objectMapper.readValue(json, ConverseResponse.class);
    }

    @Test
    void translatesTextReply() throws Exception {
        ConverseResponse response = parse("""
                {"output":{"message":{"role":"assistant","content":[{"text":"Hello"},{"text":" world"}]}},
                 "stopReason":"end_turn",
                 "usage":{"inputTokens":10,"outputTokens":3,"totalTokens":13}}
                """);

        LlmResponse result = translator.translate(response, null);

        assertTrue(result.getId().startsWith(ConverseResponseTranslator.ID_PREFIX));
        assertEquals(NOW.getEpochSecond(), result.getCreated());
        assertEquals("chat.completion", result.getObject());
        assertEquals("Hello world", result.getContent());
        assertEquals("assistant", result.getMessage().getRole());
        assertNull(result.getToolCalls());
        assertEquals("end_turn", result.getFinishReason());
        assertEquals(3, result.getUsage().getCompletionTokens());
        assertEquals(10, result.getUsage().getPromptTokens());
        assertEquals(13, result.getUsage().getTotalTokens());
    }

    @Test
    void translatesToolUseAndRecordsCorrelation() throws Exception {
        ConverseResponse response = parse("""
                {"output":{"message":{"role":"assistant","content":[
                   {"toolUse":{"toolUseId":"t1","name":"search","input":{"q":"cats"}}}]}},
                 "stopReason":"tool_use"}
                """);
        ToolUseCorrelation correlation = new ToolUseCorrelation();

        LlmResponse result = translator.translate(response, correlation);

        assertEquals(ConverseResponseTranslator.EMPTY_CONTENT_PLACEHOLDER, result.getContent());
        assertEquals(1, result.getToolCalls().size());
        ToolCall call = result.getToolCalls().get(0);
        assertEquals("t1", call.getId());
        assertEquals("function", call.getType());
        assertEquals("search", call.getName());
        assertEquals(objectMapper.readTree("{\"q\":\"cats\"}"), objectMapper.readTree(call.getArguments()));
        assertEquals("tool_use", result.getFinishReason());
        assertEquals("t1", correlation.getLastToolUseId());
    }

    @Test
    void missingInputBecomesEmptyObject() throws Exception {
        ConverseResponse response = parse("""
                {"output":{"message":{"content":[{"toolUse":{"toolUseId":"t1","name":"terminate"}}]}}}
                """);

        LlmResponse result = translator.translate(response, null);

        assertEquals("{}", result.getToolCalls().get(0).getArguments());
    }

    @Test
    void appliesDefaultsForMissingFields() throws Exception {
        LlmResponse result = translator.translate(parse("{}"), null);

        assertEquals(".", result.getContent());
        assertEquals("assistant", result.getMessage().getRole());
        assertEquals(ConverseWire.DEFAULT_STOP_REASON, result.getFinishReason());
        assertEquals(0, result.getUsage().getCompletionTokens());
        assertEquals(0, result.getUsage().getPromptTokens());
        assertEquals(0, result.getUsage().getTotalTokens());
        assertNull(result.getMessage().getFunctionCall());
    }

    @Test
    void partialUsageDefaultsToZero() throws Exception {
        LlmResponse result = translator.translate(parse("{\"usage\":{\"inputTokens\":7}}"), null);

        assertEquals(7, result.getUsage().getPromptTokens());
        assertEquals(0, result.getUsage().getCompletionTokens());
    }

    @Test
    void generatesDistinctIds() throws Exception {
        ConverseResponse response = parse("{}");

        assertNotEquals(translator.translate(response, null).getId(), translator.translate(response, null).getId());
    }
}
