package me.golemcore.converse.adapter.outbound.llm.bedrock;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.BackendMessage;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ConverseRequest;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ToolResultBlock;
import me.golemcore.converse.domain.model.LlmRequest;
import me.golemcore.converse.domain.model.Message;
import me.golemcore.converse.domain.model.ToolCall;
import me.golemcore.converse.domain.model.ToolChoice;
import me.golemcore.converse.domain.model.ToolDefinition;
import me.golemcore.converse.domain.model.ToolUseCorrelation;
import me.golemcore.converse.port.outbound.ProtocolConversionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConverseRequestTranslatorTest {

    private ObjectMapper objectMapper;
    private ConverseRequestTranslator translator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        translator = new ConverseRequestTranslator(objectMapper);
    }

    private static LlmRequest request(Message... messages) {
        return LlmRequest.builder().messages(new ArrayList<>(List.of(messages))).build();
    }

    @Test
    void lastSystemMessageBecomesSystemPrompt() {
        ConverseRequest converse = translator.translate(request(
                Message.system("first"),
                Message.user("hi"),
                Message.system("second")));

        assertEquals(1, converse.getSystem().size());
        assertEquals("second", converse.getSystem().get(0).getText());
        assertEquals(1, converse.getMessages().size());
        assertEquals("user", converse.getMessages().get(0).getRole());
        assertEquals("hi", converse.getMessages().get(0).getContent().get(0).getText());
    }

    @Test
    void explicitSystemPromptOverridesSystemMessages() {
        LlmRequest request = request(Message.system("from memory"), Message.user("hi"));
        request.setSystemPrompt("configured");

        ConverseRequest converse = translator.translate(request);

        assertEquals("configured", converse.getSystem().get(0).getText());
    }

    @Test
    void omitsSystemAndInferenceConfigWhenAbsent() {
        ConverseRequest converse = translator.translate(request(Message.user("hi")));

        assertNull(converse.getSystem());
        assertNull(converse.getInferenceConfig());
        assertNull(converse.getToolConfig());
    }

    @Test
    void nullUserContentGetsPlaceholder() {
        ConverseRequest converse = translator.translate(request(Message.user(null)));

        assertEquals(ConverseRequestTranslator.PLACEHOLDER_TEXT,
                converse.getMessages().get(0).getContent().get(0).getText());
    }

    @Test
    void emptyToolResultGetsPlaceholder() {
        ConverseRequest converse = translator.translate(request(
                Message.fromToolCalls(List.of(ToolCall.function("c1", "search", "{}")), null),
                Message.tool("", "search", "c1")));

        ToolResultBlock toolResult = converse.getMessages().get(1).getContent().get(0).getToolResult();
        assertEquals(ConverseRequestTranslator.PLACEHOLDER_TEXT, toolResult.getContent().get(0).getText());
        assertNull(toolResult.getStatus());
    }

    @Test
    void userImageIsAttachedWithDetectedFormat() {
        ConverseRequest converse = translator.translate(request(Message.user("look", "/9j/4AAQSkZJRg")));

        BackendMessage user = converse.getMessages().get(0);
        assertEquals(2, user.getContent().size());
        assertEquals("jpeg", user.getContent().get(1).getImage().getFormat());
        assertEquals("/9j/4AAQSkZJRg", user.getContent().get(1).getImage().getSource().getBytes());
    }

    @Test
    void toolResultAnswersPrecedingToolUse() {
        ConverseRequest converse = translator.translate(request(
                Message.user("search cats"),
                Message.fromToolCalls(List.of(ToolCall.function("c1", "search", "{\"q\":\"cats\"}")), null),
                Message.tool("3 results", "search", "c1")));

        assertEquals(3, converse.getMessages().size());
        BackendMessage assistant = converse.getMessages().get(1);
        assertEquals("assistant", assistant.getRole());
        assertEquals(1, assistant.getContent().size());
        assertEquals("c1", assistant.getContent().get(0).getToolUse().getToolUseId());
        assertEquals("search", assistant.getContent().get(0).getToolUse().getName());
        assertEquals("cats", assistant.getContent().get(0).getToolUse().getInput().get("q").asText());

        BackendMessage result = converse.getMessages().get(2);
        assertEquals("user", result.getRole());
        ToolResultBlock toolResult = result.getContent().get(0).getToolResult();
        assertEquals("c1", toolResult.getToolUseId());
        assertEquals("3 results", toolResult.getContent().get(0).getText());
        assertNull(toolResult.getStatus());
    }

    @Test
    void consecutiveToolResultsFoldIntoOneMessageInCallOrder() {
        ConverseRequest converse = translator.translate(request(
                Message.user("go"),
                Message.fromToolCalls(List.of(
                        ToolCall.function("a", "one", "{}"),
                        ToolCall.function("b", "two", "{}")), "working"),
                Message.tool("first", "one", "x-1"),
                Message.tool("second", "two", "x-2")));

        assertEquals(3, converse.getMessages().size());
        BackendMessage assistant = converse.getMessages().get(1);
        assertEquals("working", assistant.getContent().get(0).getText());
        assertEquals(3, assistant.getContent().size());

        BackendMessage results = converse.getMessages().get(2);
        assertEquals(2, results.getContent().size());
        assertEquals("a", results.getContent().get(0).getToolResult().getToolUseId());
        assertEquals("b", results.getContent().get(1).getToolResult().getToolUseId());
    }

    @Test
    void toolResultWithoutPendingCallReusesConversationCorrelation() {
        ToolUseCorrelation correlation = new ToolUseCorrelation();
        correlation.record("earlier");
        LlmRequest request = request(Message.user("hi"), Message.tool("late", "x", "literal"));
        request.setCorrelation(correlation);

        ConverseRequest converse = translator.translate(request);

        assertEquals("earlier", converse.getMessages().get(1).getContent().get(0).getToolResult().getToolUseId());
    }

    @Test
    void toolResultFallsBackToLiteralId() {
        ConverseRequest converse = translator.translate(request(Message.tool("orphan", "x", "literal")));

        assertEquals("literal", converse.getMessages().get(0).getContent().get(0).getToolResult().getToolUseId());
    }

    @Test
    void errorToolResultIsMarked() {
        ConverseRequest converse = translator.translate(request(
                Message.fromToolCalls(List.of(ToolCall.function("c1", "search", "{}")), null),
                Message.tool("Error: boom", "search", "c1")));

        assertEquals(ConverseWire.STATUS_ERROR,
                converse.getMessages().get(1).getContent().get(0).getToolResult().getStatus());
    }

    @Test
    void emptyAssistantMessageGetsPlaceholder() {
        ConverseRequest converse = translator.translate(request(Message.user("hi"), Message.assistant(null)));

        assertEquals(ConverseRequestTranslator.PLACEHOLDER_TEXT,
                converse.getMessages().get(1).getContent().get(0).getText());
    }

    @Test
    void invalidToolArgumentsAreRejected() {
        LlmRequest request = request(
                Message.fromToolCalls(List.of(ToolCall.function("c1", "search", "{not json")), null));

        assertThrows(ProtocolConversionException.class, () -> translator.translate(request));
    }

    @Test
    void translatesFunctionToolsAndDropsOthers() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("q", Map.of("type", "string")),
                "required", List.of("q"));
        LlmRequest request = request(Message.user("hi"));
        request.setTools(List.of(
                ToolDefinition.builder().name("search").description("Search").parameters(schema).build().toParam(),
                Map.of("type", "retrieval")));

        ConverseRequest converse = translator.translate(request);

        assertEquals(1, converse.getToolConfig().getTools().size());
        ConverseWire.ToolSpec spec = converse.getToolConfig().getTools().get(0).getToolSpec();
        assertEquals("search", spec.getName());
        assertEquals("Search", spec.getDescription());
        assertEquals("object", spec.getInputSchema().getJson().get("type"));
        assertEquals(List.of("q"), spec.getInputSchema().getJson().get("required"));
        assertEquals(Map.of("auto", Map.of()), converse.getToolConfig().getToolChoice());
    }

    @Test
    void requiredToolChoiceMapsToAny() {
        LlmRequest request = request(Message.user("hi"));
        request.setTools(List.of(ToolDefinition.simple("terminate", "Stop").toParam()));
        request.setToolChoice(ToolChoice.REQUIRED);

        ConverseRequest converse = translator.translate(request);

        assertEquals(Map.of("any", Map.of()), converse.getToolConfig().getToolChoice());
    }

    @Test
    void noneToolChoiceOmitsToolConfig() {
        LlmRequest request = request(Message.user("hi"));
        request.setTools(List.of(ToolDefinition.simple("terminate", "Stop").toParam()));
        request.setToolChoice(ToolChoice.NONE);

        assertNull(translator.translate(request).getToolConfig());
    }

    @Test
    void passesInferenceSettings() {
        LlmRequest request = request(Message.user("hi"));
        request.setTemperature(0.2);
        request.setMaxTokens(512);

        ConverseRequest converse = translator.translate(request);

        assertEquals(0.2, converse.getInferenceConfig().getTemperature());
        assertEquals(512, converse.getInferenceConfig().getMaxTokens());
    }

    @Test
    void detectsImageFormats() {
        assertEquals("jpeg", ConverseRequestTranslator.detectImageFormat("/9j/abc"));
        assertEquals("gif", ConverseRequestTranslator.detectImageFormat("R0lGODlh"));
        assertEquals("webp", ConverseRequestTranslator.detectImageFormat("UklGRiQ"));
        assertEquals("png", ConverseRequestTranslator.detectImageFormat("iVBORw0KGgo"));
    }
}
