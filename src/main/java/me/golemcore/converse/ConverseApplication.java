package me.golemcore.converse;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Converse agent.
 *
 * <p>
 * A tool-using conversational agent on top of the Amazon Bedrock Converse API.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleChatRunner
 * Domain Layer       → AgentEngine, ConversationAgentService, ToolRegistry
 * Infrastructure     → BedrockConverseAdapter (Feign + OkHttp), history store
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code agent.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ConverseApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConverseApplication.class, args);
    }

}
