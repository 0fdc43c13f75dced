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
import lombok.extern.jackson.Jacksonized;

/**
 * Function invocation inside a {@link ToolCall}. {@code arguments} is the raw
 * JSON object text exactly as the model produced it; parsing is left to the
 * consumer.
 */
@Value
@Builder
@Jacksonized
public class FunctionCall {

    String name;
    String arguments;

    public static FunctionCall of(String name, String arguments) {
        return new FunctionCall(name, arguments);
    }
}
