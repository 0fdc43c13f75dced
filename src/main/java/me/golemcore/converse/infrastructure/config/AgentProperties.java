package me.golemcore.converse.infrastructure.config;

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

import lombok.Data;
import me.golemcore.converse.domain.model.ToolChoice;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the agent, bound from {@code application.yml}.
 *
 * <p>
 * All settings live under the {@code agent.*} prefix:
 * <ul>
 * <li>loop bounds and stuck detection ({@code max-steps},
 * {@code duplicate-threshold}, ...)</li>
 * <li>{@link LlmProperties} - backend provider and Bedrock settings</li>
 * <li>{@link HttpProperties} - shared OkHttp client timeouts and pool</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private int maxSteps = 20;
    private int maxMessages = 100;
    private int duplicateThreshold = 2;
    private int stuckWindow = 3;
    private boolean finishOnReply = true;
    private Duration toolTimeout = Duration.ofSeconds(30);
    private ToolChoice toolChoice = ToolChoice.AUTO;
    private String systemPrompt;
    private String nextStepPrompt;
    private List<String> specialTools = new ArrayList<>(List.of("terminate"));
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private ConsoleProperties console = new ConsoleProperties();

    @Data
    public static class LlmProperties {
        private String provider = "bedrock";
        private BedrockProperties bedrock = new BedrockProperties();
    }

    @Data
    public static class BedrockProperties {
        private String region = "us-east-1";
        private String endpoint;
        private String apiKey;
        private String modelId = "anthropic.claude-3-5-sonnet-20240620-v1:0";
        private int maxTokens = 4096;
        private double temperature = 1.0;

        /**
         * Endpoint override when set, otherwise the regional runtime endpoint.
         */
        public String resolveEndpoint() {
            if (endpoint != null && !endpoint.isBlank()) {
                return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
            }
            return "https://bedrock-runtime." + region + ".amazonaws.com";
        }
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private boolean retryOnConnectionFailure = true;
        private String userAgent = "converse-agent";
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
        private String conversationKey = "console";
    }
}
