package me.golemcore.converse.domain.agent;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.converse.domain.service.ToolRegistry;
import me.golemcore.converse.infrastructure.config.AgentProperties;
import me.golemcore.converse.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh engine, with its own memory and correlation state, for each
 * conversation.
 */
@Component
@RequiredArgsConstructor
public class AgentEngineFactory {

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    public AgentEngine create() {
        return new AgentEngine(llmPort, toolRegistry, properties, objectMapper);
    }
}
