package me.golemcore.converse.adapter.outbound.llm.bedrock;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.BackendMessage;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ContentBlock;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ConverseRequest;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ImageBlock;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ImageSource;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.InferenceConfig;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.InputSchema;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.SystemBlock;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.Tool;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ToolConfig;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ToolResultBlock;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ToolSpec;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ToolUseBlock;
import me.golemcore.converse.domain.model.LlmRequest;
import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.Message;
import me.golemcore.converse.domain.model.ToolCall;
import me.golemcore.converse.domain.model.ToolChoice;
import me.golemcore.converse.domain.model.ToolUseCorrelation;
import me.golemcore.converse.port.outbound.ProtocolConversionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a canonical {@link LlmRequest} into a Converse request body.
 *
 * <p>
 * Tool results are linked to the tool-use item they answer through a
 * per-translation {@link ConversionContext}: every tool call of an assistant
 * turn becomes a pending id, and tool messages consume pending ids in call
 * order. When nothing is pending, the conversation's last seen id is reused.
 * The literal {@code tool_call_id} of a tool message is used only when no id
 * is known at all.
 */
@Slf4j
public class ConverseRequestTranslator {

    static final String PLACEHOLDER_TEXT = LlmResponse.EMPTY_CONTENT;
    private static final String ERROR_PREFIX = "Error:";

    private final ObjectMapper objectMapper;

    public ConverseRequestTranslator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ConverseRequest translate(LlmRequest request) {
        ToolUseCorrelation correlation = request.getCorrelation() != null
                ? request.getCorrelation()
                : new ToolUseCorrelation();
        ConversionContext context = new ConversionContext(correlation);

        ConverseRequest converse = new ConverseRequest();
        String systemPrompt = null;
        boolean lastWasToolResult = false;

        for (Message message : request.getMessages()) {
            if (message.getRole() == null) {
                throw new ProtocolConversionException("Invalid role: null");
            }
            switch (message.getRole()) {
            case SYSTEM -> {
                systemPrompt = message.getContent();
                lastWasToolResult = false;
            }
            case USER -> {
                converse.getMessages().add(toUserMessage(message));
                lastWasToolResult = false;
            }
            case ASSISTANT -> {
                converse.getMessages().add(toAssistantMessage(message, context));
                lastWasToolResult = false;
            }
            case TOOL -> {
                ContentBlock result = ContentBlock.ofToolResult(toToolResult(message, context));
                List<BackendMessage> messages = converse.getMessages();
                if (lastWasToolResult) {
                    messages.get(messages.size() - 1).getContent().add(result);
                } else {
                    BackendMessage wrapper = new BackendMessage(ConverseWire.ROLE_USER, new ArrayList<>());
                    wrapper.getContent().add(result);
                    messages.add(wrapper);
                }
                lastWasToolResult = true;
            }
            default -> throw new ProtocolConversionException("Invalid role: " + message.getRole());
            }
        }

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            systemPrompt = request.getSystemPrompt();
        }
        if (systemPrompt != null) {
            converse.setSystem(List.of(new SystemBlock(systemPrompt)));
        }

        if (request.getTemperature() != null || request.getMaxTokens() != null) {
            converse.setInferenceConfig(new InferenceConfig(request.getTemperature(), request.getMaxTokens()));
        }

        converse.setToolConfig(toToolConfig(request.getTools(), request.getToolChoice()));

        log.debug("[Converse] Translated {} canonical messages into {} backend messages",
                request.getMessages().size(), converse.getMessages().size());
        return converse;
    }

    private BackendMessage toUserMessage(Message message) {
        BackendMessage backend = new BackendMessage(ConverseWire.ROLE_USER, new ArrayList<>());
        backend.getContent().add(ContentBlock.ofText(textOrPlaceholder(message.getContent())));
        if (message.getBase64Image() != null && !message.getBase64Image().isBlank()) {
            backend.getContent().add(ContentBlock.ofImage(toImage(message.getBase64Image())));
        }
        return backend;
    }

    private BackendMessage toAssistantMessage(Message message, ConversionContext context) {
        BackendMessage backend = new BackendMessage(ConverseWire.ROLE_ASSISTANT, new ArrayList<>());
        if (message.hasContent()) {
            backend.getContent().add(ContentBlock.ofText(message.getContent()));
        }
        if (message.hasToolCalls()) {
            context.beginAssistantTurn();
            for (ToolCall toolCall : message.getToolCalls()) {
                JsonNode input = parseArguments(toolCall);
                backend.getContent().add(ContentBlock.ofToolUse(
                        new ToolUseBlock(toolCall.getId(), toolCall.getName(), input)));
                context.registerToolUse(toolCall.getId());
            }
        }
        if (backend.getContent().isEmpty()) {
            backend.getContent().add(ContentBlock.ofText(PLACEHOLDER_TEXT));
        }
        return backend;
    }

    private ToolResultBlock toToolResult(Message message, ConversionContext context) {
        String toolUseId = context.resolveToolResultId(message.getToolCallId());
        List<ContentBlock> content = new ArrayList<>();
        String text = textOrPlaceholder(message.getContent());
        content.add(ContentBlock.ofText(text));
        if (message.getBase64Image() != null && !message.getBase64Image().isBlank()) {
            content.add(ContentBlock.ofImage(toImage(message.getBase64Image())));
        }
        String status = text.startsWith(ERROR_PREFIX) ? ConverseWire.STATUS_ERROR : null;
        return new ToolResultBlock(toolUseId, content, status);
    }

    private static String textOrPlaceholder(String text) {
        return text != null && !text.isBlank() ? text : PLACEHOLDER_TEXT;
    }

    private JsonNode parseArguments(ToolCall toolCall) {
        String arguments = toolCall.getArguments();
        if (arguments == null || arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new ProtocolConversionException(
                    "Tool call " + toolCall.getId() + " has invalid JSON arguments: " + arguments, e);
        }
    }

    @SuppressWarnings("unchecked")
    private ToolConfig toToolConfig(List<Map<String, Object>> tools, ToolChoice toolChoice) {
        if (tools == null || tools.isEmpty() || toolChoice == ToolChoice.NONE) {
            return null;
        }
        List<Tool> specs = new ArrayList<>();
        for (Map<String, Object> tool : tools) {
            if (!"function".equals(tool.get("type"))) {
                continue;
            }
            Map<String, Object> function = tool.get("function") instanceof Map<?, ?> f
                    ? (Map<String, Object>) f
                    : Map.of();
            Map<String, Object> parameters = function.get("parameters") instanceof Map<?, ?> p
                    ? (Map<String, Object>) p
                    : Map.of();

            Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("type", "object");
            schema.put("properties", parameters.getOrDefault("properties", Map.of()));
            schema.put("required", parameters.getOrDefault("required", List.of()));

            specs.add(new Tool(new ToolSpec(
                    stringOrEmpty(function.get("name")),
                    stringOrEmpty(function.get("description")),
                    new InputSchema(schema))));
        }
        if (specs.isEmpty()) {
            return null;
        }
        Map<String, Object> choice = toolChoice == ToolChoice.REQUIRED
                ? Map.of("any", Map.of())
                : Map.of("auto", Map.of());
        return new ToolConfig(specs, choice);
    }

    private static String stringOrEmpty(Object value) {
        return value != null ? value.toString() : "";
    }

    static ImageBlock toImage(String base64) {
        return new ImageBlock(detectImageFormat(base64), new ImageSource(base64));
    }

    static String detectImageFormat(String base64) {
        if (base64.startsWith("/9j/")) {
            return "jpeg";
        }
        if (base64.startsWith("R0lGOD")) {
            return "gif";
        }
        if (base64.startsWith("UklGR")) {
            return "webp";
        }
        return "png";
    }

    /**
     * Correlation state of one translation pass.
     */
    static final class ConversionContext {

        private final Deque<String> pendingToolUseIds = new ArrayDeque<>();
        private final ToolUseCorrelation correlation;

        ConversionContext(ToolUseCorrelation correlation) {
            this.correlation = correlation;
        }

        void beginAssistantTurn() {
            pendingToolUseIds.clear();
        }

        void registerToolUse(String toolUseId) {
            pendingToolUseIds.addLast(toolUseId);
            correlation.record(toolUseId);
        }

        String resolveToolResultId(String literalId) {
            String pending = pendingToolUseIds.pollFirst();
            if (pending != null) {
                return pending;
            }
            String last = correlation.getLastToolUseId();
            if (last != null) {
                return last;
            }
            correlation.record(literalId);
            return literalId;
        }
    }
}
