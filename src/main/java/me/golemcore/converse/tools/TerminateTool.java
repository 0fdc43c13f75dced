package me.golemcore.converse.tools;

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

import me.golemcore.converse.domain.component.ToolComponent;
import me.golemcore.converse.domain.component.ToolException;
import me.golemcore.converse.domain.model.ToolDefinition;
import me.golemcore.converse.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Special tool the model calls to end the interaction. The engine treats a
 * call to it as the end of the run; the tool itself only reports the status.
 */
@Component
public class TerminateTool implements ToolComponent {

    public static final String NAME = "terminate";

    private static final List<String> STATUSES = List.of("success", "failure");

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Terminate the interaction when the request is met OR if the assistant "
                        + "cannot proceed further with the task. When you have finished all the tasks, "
                        + "call this tool to end the work.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "status", Map.of(
                                        "type", "string",
                                        "description", "The finish status of the interaction.",
                                        "enum", STATUSES)),
                        "required", List.of("status")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object status = parameters.get("status");
        if (!(status instanceof String value) || !STATUSES.contains(value)) {
            return CompletableFuture.failedFuture(
                    new ToolException("status must be one of " + STATUSES + ", got: " + status));
        }
        return CompletableFuture.completedFuture(
                ToolResult.success("The interaction has been completed with status: " + value));
    }
}
