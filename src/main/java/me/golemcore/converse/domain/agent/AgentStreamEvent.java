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

import lombok.Builder;
import lombok.Value;

/**
 * Progress event emitted by {@link AgentEngine#stream(String)}.
 */
@Value
@Builder
public class AgentStreamEvent {

    public enum Type {
        STEP_STARTED, TEXT, TOOL_INPUT, TOOL_RESULT, STEP_COMPLETED, STUCK_DETECTED, COMPLETED
    }

    Type type;
    int step;
    String text;
    String toolName;
    String toolCallId;
    RunResult result;

    public static AgentStreamEvent stepStarted(int step) {
        return AgentStreamEvent.builder().type(Type.STEP_STARTED).step(step).build();
    }

    public static AgentStreamEvent text(int step, String fragment) {
        return AgentStreamEvent.builder().type(Type.TEXT).step(step).text(fragment).build();
    }

    public static AgentStreamEvent toolInput(int step, String toolCallId, String fragment) {
        return AgentStreamEvent.builder().type(Type.TOOL_INPUT).step(step).toolCallId(toolCallId).text(fragment)
                .build();
    }

    public static AgentStreamEvent toolResult(int step, String toolName, String toolCallId, String output) {
        return AgentStreamEvent.builder().type(Type.TOOL_RESULT).step(step).toolName(toolName)
                .toolCallId(toolCallId).text(output).build();
    }

    public static AgentStreamEvent stepCompleted(int step, String summary) {
        return AgentStreamEvent.builder().type(Type.STEP_COMPLETED).step(step).text(summary).build();
    }

    public static AgentStreamEvent stuckDetected(int step, String directive) {
        return AgentStreamEvent.builder().type(Type.STUCK_DETECTED).step(step).text(directive).build();
    }

    public static AgentStreamEvent completed(RunResult result) {
        return AgentStreamEvent.builder().type(Type.COMPLETED).step(result.getSteps()).result(result)
                .text(result.getFinalReply()).build();
    }
}
