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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.BackendMessage;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ContentBlock;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ConverseResponse;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.TokenUsage;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ToolUseBlock;
import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.ToolCall;
import me.golemcore.converse.domain.model.ToolUseCorrelation;
import me.golemcore.converse.port.outbound.ProtocolConversionException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Translates a Converse response (fetched directly or assembled from a
 * stream) into the canonical chat-completion envelope.
 */
public class ConverseResponseTranslator {

    static final String EMPTY_CONTENT_PLACEHOLDER = LlmResponse.EMPTY_CONTENT;
    static final String ID_PREFIX = "chatcmpl-";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ConverseResponseTranslator(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @param correlation
     *            receives every tool-use id found in the response; may be null
     */
    public LlmResponse translate(ConverseResponse response, ToolUseCorrelation correlation) {
        BackendMessage message = response.getOutput() != null ? response.getOutput().getMessage() : null;
        List<ContentBlock> content = message != null && message.getContent() != null
                ? message.getContent()
                : List.of();

        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (ContentBlock block : content) {
            if (block.getText() != null) {
                text.append(block.getText());
            }
            ToolUseBlock toolUse = block.getToolUse();
            if (toolUse != null) {
                if (correlation != null) {
                    correlation.record(toolUse.getToolUseId());
                }
                toolCalls.add(ToolCall.function(toolUse.getToolUseId(), toolUse.getName(), serializeInput(toolUse)));
            }
        }

        String reply = text.length() > 0 ? text.toString() : EMPTY_CONTENT_PLACEHOLDER;
        String role = message != null && message.getRole() != null && !message.getRole().isBlank()
                ? message.getRole()
                : ConverseWire.ROLE_ASSISTANT;
        String stopReason = response.getStopReason() != null && !response.getStopReason().isBlank()
                ? response.getStopReason()
                : ConverseWire.DEFAULT_STOP_REASON;

        LlmResponse.ChoiceMessage choiceMessage = LlmResponse.ChoiceMessage.builder()
                .content(reply)
                .role(role)
                .toolCalls(toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                .functionCall(null)
                .build();

        return LlmResponse.builder()
                .id(ID_PREFIX + UUID.randomUUID())
                .created(clock.instant().getEpochSecond())
                .choices(List.of(LlmResponse.Choice.builder()
                        .finishReason(stopReason)
                        .index(0)
                        .message(choiceMessage)
                        .build()))
                .usage(toUsage(response.getUsage()))
                .build();
    }

    private String serializeInput(ToolUseBlock toolUse) {
        if (toolUse.getInput() == null || toolUse.getInput().isNull()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(toolUse.getInput());
        } catch (JsonProcessingException e) {
            throw new ProtocolConversionException("Cannot serialize input of tool use " + toolUse.getToolUseId(), e);
        }
    }

    private static LlmResponse.Usage toUsage(TokenUsage usage) {
        if (usage == null) {
            return new LlmResponse.Usage(0, 0, 0);
        }
        return LlmResponse.Usage.builder()
                .completionTokens(orZero(usage.getOutputTokens()))
                .promptTokens(orZero(usage.getInputTokens()))
                .totalTokens(orZero(usage.getTotalTokens()))
                .build();
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
