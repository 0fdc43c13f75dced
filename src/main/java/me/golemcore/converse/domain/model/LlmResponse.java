package me.golemcore.converse.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Canonical chat-completion envelope returned by every {@code LlmPort}
 * regardless of the backend wire format:
 *
 * <pre>
 * {id, created, object: "chat.completion",
 *  choices: [{finish_reason, index, message: {content, role, tool_calls|null, function_call: null}}],
 *  usage: {completion_tokens, prompt_tokens, total_tokens}}
 * </pre>
 *
 * <p>
 * Unlike {@link Message}, the envelope writes {@code tool_calls} and
 * {@code function_call} as explicit nulls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class LlmResponse {

    public static final String OBJECT_CHAT_COMPLETION = "chat.completion";

    /**
     * Content of a reply without text, typically one that only calls tools.
     */
    public static final String EMPTY_CONTENT = ".";

    private String id;
    private long created;

    @Builder.Default
    private String object = OBJECT_CHAT_COMPLETION;

    private List<Choice> choices;
    private Usage usage;

    @JsonIgnore
    public ChoiceMessage getMessage() {
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        return choices.get(0).getMessage();
    }

    @JsonIgnore
    public String getContent() {
        ChoiceMessage message = getMessage();
        return message != null ? message.getContent() : null;
    }

    @JsonIgnore
    public List<ToolCall> getToolCalls() {
        ChoiceMessage message = getMessage();
        return message != null ? message.getToolCalls() : null;
    }

    @JsonIgnore
    public String getFinishReason() {
        if (choices == null || choices.isEmpty()) {
            return null;
        }
        return choices.get(0).getFinishReason();
    }

    public boolean hasToolCalls() {
        List<ToolCall> toolCalls = getToolCalls();
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Converts the first choice into a canonical assistant message.
     */
    public Message toAssistantMessage() {
        if (hasToolCalls()) {
            return Message.fromToolCalls(getToolCalls(), getContent());
        }
        return Message.assistant(getContent());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Choice {

        @JsonProperty("finish_reason")
        private String finishReason;

        private int index;
        private ChoiceMessage message;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChoiceMessage {

        private String content;
        private String role;

        @JsonProperty("tool_calls")
        private List<ToolCall> toolCalls;

        @JsonProperty("function_call")
        private Object functionCall;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {

        @JsonProperty("completion_tokens")
        private int completionTokens;

        @JsonProperty("prompt_tokens")
        private int promptTokens;

        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
