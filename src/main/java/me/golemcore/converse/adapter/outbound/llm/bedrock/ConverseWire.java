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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes of the Bedrock Converse API (request, response and the payloads
 * of stream events). Field names follow the wire format exactly.
 */
public final class ConverseWire {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";
    public static final String DEFAULT_STOP_REASON = "end_turn";

    private ConverseWire() {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ConverseRequest {
        private List<BackendMessage> messages = new ArrayList<>();
        private List<SystemBlock> system;
        private InferenceConfig inferenceConfig;
        private ToolConfig toolConfig;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SystemBlock {
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class InferenceConfig {
        private Double temperature;
        private Integer maxTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BackendMessage {
        private String role;
        private List<ContentBlock> content = new ArrayList<>();
    }

    /**
     * Union of content items; exactly one field is set.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContentBlock {
        private String text;
        private ImageBlock image;
        private ToolUseBlock toolUse;
        private ToolResultBlock toolResult;

        public static ContentBlock ofText(String text) {
            ContentBlock block = new ContentBlock();
            block.setText(text);
            return block;
        }

        public static ContentBlock ofImage(ImageBlock image) {
            ContentBlock block = new ContentBlock();
            block.setImage(image);
            return block;
        }

        public static ContentBlock ofToolUse(ToolUseBlock toolUse) {
            ContentBlock block = new ContentBlock();
            block.setToolUse(toolUse);
            return block;
        }

        public static ContentBlock ofToolResult(ToolResultBlock toolResult) {
            ContentBlock block = new ContentBlock();
            block.setToolResult(toolResult);
            return block;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageBlock {
        private String format;
        private ImageSource source;
    }

    /**
     * Image bytes, base64-encoded as the JSON binding of the API expects.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageSource {
        private String bytes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolUseBlock {
        private String toolUseId;
        private String name;
        private JsonNode input;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolResultBlock {
        private String toolUseId;
        private List<ContentBlock> content;
        private String status;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolConfig {
        private List<Tool> tools;
        private Map<String, Object> toolChoice;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tool {
        private ToolSpec toolSpec;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolSpec {
        private String name;
        private String description;
        private InputSchema inputSchema;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InputSchema {
        private Map<String, Object> json;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConverseResponse {
        private Output output;
        private String stopReason;
        private TokenUsage usage;
        private Map<String, Object> metrics;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Output {
        private BackendMessage message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TokenUsage {
        private Integer inputTokens;
        private Integer outputTokens;
        private Integer totalTokens;
    }

    /**
     * One decoded stream event. The event-stream frame's {@code :event-type}
     * header names the field that carries the frame payload.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StreamEvent {
        private MessageStart messageStart;
        private ContentBlockStart contentBlockStart;
        private ContentBlockDelta contentBlockDelta;
        private ContentBlockStop contentBlockStop;
        private MessageStop messageStop;
        private StreamMetadata metadata;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageStart {
        private String role;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlockStart {
        private int contentBlockIndex;
        private BlockStart start;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BlockStart {
        private ToolUseStart toolUse;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolUseStart {
        private String toolUseId;
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlockDelta {
        private int contentBlockIndex;
        private BlockDelta delta;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BlockDelta {
        private String text;
        private ToolUseDelta toolUse;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolUseDelta {
        private String input;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContentBlockStop {
        private int contentBlockIndex;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MessageStop {
        private String stopReason;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StreamMetadata {
        private TokenUsage usage;
        private Map<String, Object> metrics;
    }
}
