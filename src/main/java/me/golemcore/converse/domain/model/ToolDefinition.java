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

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable declaration of a tool: name, description and a JSON Schema
 * describing its parameters.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> parameters; // JSON Schema

    /**
     * Creates a tool definition without input parameters.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .parameters(Map.of("type", "object", "properties", Map.of(), "required", List.of()))
                .build();
    }

    /**
     * Export format used when offering the tool to a model:
     * {@code {type: "function", function: {name, description, parameters}}}.
     */
    public Map<String, Object> toParam() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", parameters);

        Map<String, Object> param = new LinkedHashMap<>();
        param.put("type", ToolCall.TYPE_FUNCTION);
        param.put("function", function);
        return param;
    }
}
