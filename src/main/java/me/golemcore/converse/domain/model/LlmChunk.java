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

/**
 * One element of a streamed model response. Fragments arrive in generation
 * order; the final chunk is marked {@code done} and carries the assembled
 * response.
 */
@Value
@Builder
public class LlmChunk {

    public enum Kind {
        TEXT, TOOL_INPUT, DONE
    }

    Kind kind;
    String text;
    String toolUseId;
    LlmResponse response;

    public static LlmChunk text(String fragment) {
        return LlmChunk.builder().kind(Kind.TEXT).text(fragment).build();
    }

    public static LlmChunk toolInput(String toolUseId, String fragment) {
        return LlmChunk.builder().kind(Kind.TOOL_INPUT).toolUseId(toolUseId).text(fragment).build();
    }

    public static LlmChunk done(LlmResponse response) {
        return LlmChunk.builder().kind(Kind.DONE).response(response).build();
    }

    public boolean isDone() {
        return kind == Kind.DONE;
    }
}
