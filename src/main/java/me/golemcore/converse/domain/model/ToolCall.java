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
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A tool invocation requested by the assistant. The {@code id} is an opaque
 * correlation token, unique within one assistant turn, that the matching tool
 * result message echoes back.
 */
@Value
@Builder
@Jacksonized
public class ToolCall {

    public static final String TYPE_FUNCTION = "function";

    String id;

    @Builder.Default
    String type = TYPE_FUNCTION;

    FunctionCall function;

    public static ToolCall function(String id, String name, String arguments) {
        return ToolCall.builder()
                .id(id)
                .function(FunctionCall.of(name, arguments))
                .build();
    }

    @JsonIgnore
    public String getName() {
        return function != null ? function.getName() : null;
    }

    @JsonIgnore
    public String getArguments() {
        return function != null ? function.getArguments() : null;
    }
}
