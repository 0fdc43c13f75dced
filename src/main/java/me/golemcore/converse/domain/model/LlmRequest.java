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
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class LlmRequest {

    private String model;

    /**
     * Overrides the system prompt derived from system messages when set.
     */
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /**
     * Tool declarations in the {@link ToolDefinition#toParam()} export format.
     */
    @Builder.Default
    private List<Map<String, Object>> tools = new ArrayList<>();

    @Builder.Default
    private ToolChoice toolChoice = ToolChoice.AUTO;

    private Double temperature;

    private Integer maxTokens;

    /**
     * Correlation state of the conversation this request belongs to. When
     * absent, the request is translated in isolation.
     */
    private ToolUseCorrelation correlation;
}
