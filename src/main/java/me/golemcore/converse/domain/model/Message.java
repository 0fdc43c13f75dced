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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a single message in the canonical (chat-completion shaped)
 * conversation model. Instances are immutable and only built through the
 * role-specific factories, which validate the role/shape combination.
 *
 * <p>
 * Absent fields are never emitted: both {@link #toMap()} and Jackson
 * serialization skip them instead of writing {@code null}.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY, getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Message {

    Role role;
    String content;

    @JsonProperty("tool_calls")
    List<ToolCall> toolCalls;

    String name;

    @JsonProperty("tool_call_id")
    String toolCallId;

    @JsonProperty("base64_image")
    String base64Image;

    public static Message user(String content) {
        return user(content, null);
    }

    public static Message user(String content, String base64Image) {
        return Message.builder().role(Role.USER).content(content).base64Image(base64Image).build();
    }

    public static Message system(String content) {
        return Message.builder().role(Role.SYSTEM).content(content).build();
    }

    public static Message assistant(String content) {
        return assistant(content, null);
    }

    public static Message assistant(String content, String base64Image) {
        return Message.builder().role(Role.ASSISTANT).content(content).base64Image(base64Image).build();
    }

    public static Message tool(String content, String name, String toolCallId) {
        return tool(content, name, toolCallId, null);
    }

    /**
     * Creates a tool result message.
     *
     * @throws IllegalArgumentException
     *             if {@code toolCallId} is missing
     */
    public static Message tool(String content, String name, String toolCallId, String base64Image) {
        if (toolCallId == null || toolCallId.isBlank()) {
            throw new IllegalArgumentException("Tool message requires tool_call_id");
        }
        return Message.builder()
                .role(Role.TOOL)
                .content(content)
                .name(name)
                .toolCallId(toolCallId)
                .base64Image(base64Image)
                .build();
    }

    /**
     * Creates an assistant message carrying tool calls.
     */
    public static Message fromToolCalls(List<ToolCall> toolCalls, String content) {
        return fromToolCalls(toolCalls, content, null);
    }

    public static Message fromToolCalls(List<ToolCall> toolCalls, String content, String base64Image) {
        return Message.builder()
                .role(Role.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls != null ? List.copyOf(toolCalls) : null)
                .base64Image(base64Image)
                .build();
    }

    /**
     * Rebuilds a message from untrusted persisted fields. The role string is
     * validated and the shape is checked the same way the typed factories do.
     *
     * @throws IllegalArgumentException
     *             on an unknown role or a tool message without tool_call_id
     */
    public static Message of(String role, String content, List<ToolCall> toolCalls, String toolCallId) {
        Role resolved = Role.fromValue(role);
        return switch (resolved) {
        case SYSTEM -> system(content);
        case USER -> user(content);
        case ASSISTANT -> toolCalls != null && !toolCalls.isEmpty()
                ? fromToolCalls(toolCalls, content)
                : assistant(content);
        case TOOL -> tool(content, null, toolCallId);
        };
    }

    public boolean isUserMessage() {
        return role == Role.USER;
    }

    public boolean isAssistantMessage() {
        return role == Role.ASSISTANT;
    }

    public boolean isSystemMessage() {
        return role == Role.SYSTEM;
    }

    public boolean isToolMessage() {
        return role == Role.TOOL;
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    /**
     * Plain map view in wire key order; keys whose value is absent are omitted.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("role", role.getValue());
        if (content != null) {
            map.put("content", content);
        }
        if (toolCalls != null) {
            List<Map<String, Object>> calls = new ArrayList<>();
            for (ToolCall call : toolCalls) {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", call.getName());
                function.put("arguments", call.getArguments());
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", call.getId());
                entry.put("type", call.getType());
                entry.put("function", function);
                calls.add(entry);
            }
            map.put("tool_calls", calls);
        }
        if (name != null) {
            map.put("name", name);
        }
        if (toolCallId != null) {
            map.put("tool_call_id", toolCallId);
        }
        if (base64Image != null) {
            map.put("base64_image", base64Image);
        }
        return map;
    }

    public List<Message> plus(Message other) {
        return concat(this, other);
    }

    public List<Message> plus(List<Message> others) {
        return concat(this, others);
    }

    /**
     * Joins messages and message lists preserving argument order. Accepts
     * {@code (Message, Message)}, {@code (Message, List)} and
     * {@code (List, Message)}.
     *
     * @throws IllegalArgumentException
     *             for any other operand combination
     */
    public static List<Message> concat(Object left, Object right) {
        if (left instanceof Message leftMessage) {
            if (right instanceof Message rightMessage) {
                return new ArrayList<>(List.of(leftMessage, rightMessage));
            }
            if (right instanceof List<?> rightList) {
                List<Message> result = new ArrayList<>();
                result.add(leftMessage);
                result.addAll(requireMessages(rightList));
                return result;
            }
        } else if (left instanceof List<?> leftList && right instanceof Message rightMessage) {
            List<Message> result = new ArrayList<>(requireMessages(leftList));
            result.add(rightMessage);
            return result;
        }
        throw new IllegalArgumentException("Unsupported operand types: '" + typeName(left) + "' and '"
                + typeName(right) + "'");
    }

    private static List<Message> requireMessages(List<?> items) {
        List<Message> messages = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Message message)) {
                throw new IllegalArgumentException("List element is not a Message: " + typeName(item));
            }
            messages.add(message);
        }
        return messages;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
