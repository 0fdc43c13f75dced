package me.golemcore.converse.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.component.ToolComponent;
import me.golemcore.converse.domain.component.ToolException;
import me.golemcore.converse.domain.model.ToolDefinition;
import me.golemcore.converse.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered collection of the tools offered to the model, keyed by name.
 *
 * <p>
 * Execution never throws for tool-level problems: unknown tools, disabled
 * tools, {@link ToolException}s and timeouts all come back as failure
 * results, so they can be fed to the model as tool messages.
 */
@Component
@Slf4j
public class ToolRegistry {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public ToolRegistry(List<ToolComponent> tools) {
        if (tools != null) {
            tools.forEach(this::register);
        }
    }

    public static ToolRegistry of(ToolComponent... tools) {
        return new ToolRegistry(List.of(tools));
    }

    public synchronized void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool has no name: " + tool.getClass().getName());
        }
        if (tools.containsKey(name)) {
            log.warn("[Tools] Duplicate tool '{}' ignored: {}", name, tool.getClass().getSimpleName());
            return;
        }
        tools.put(name, tool);
    }

    public synchronized void unregister(Collection<String> names) {
        if (names == null) {
            return;
        }
        names.forEach(tools::remove);
    }

    public synchronized ToolComponent get(String name) {
        return tools.get(name);
    }

    public synchronized boolean contains(String name) {
        return tools.containsKey(name);
    }

    public synchronized List<String> getNames() {
        return List.copyOf(tools.keySet());
    }

    /**
     * Definitions of the enabled tools, in registration order.
     */
    public synchronized List<ToolDefinition> getDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            if (tool.isEnabled()) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    /**
     * Enabled tools in the {@code {type: "function", function: {...}}} export
     * format.
     */
    public List<Map<String, Object>> toParams() {
        return getDefinitions().stream().map(ToolDefinition::toParam).toList();
    }

    public ToolResult execute(String name, Map<String, Object> arguments) {
        return execute(name, arguments, DEFAULT_TIMEOUT);
    }

    /**
     * Executes a tool and waits at most {@code timeout} for its result.
     */
    public ToolResult execute(String name, Map<String, Object> arguments, Duration timeout) {
        String toolName = sanitizeToolName(name);
        ToolComponent tool = get(toolName);
        if (tool == null) {
            return ToolResult.failure("Unknown tool: " + toolName + ". Available tools: "
                    + String.join(", ", getNames()));
        }
        if (!tool.isEnabled()) {
            return ToolResult.failure("Tool is disabled: " + toolName);
        }

        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
        } catch (ToolException e) {
            return ToolResult.failure(e.getMessage());
        }
        try {
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ToolResult.success(null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] '{}' timed out after {} ms", toolName, timeout.toMillis());
            return ToolResult.failure("Tool '" + toolName + "' timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure("Tool '" + toolName + "' was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ToolException) {
                log.debug("[Tools] '{}' reported: {}", toolName, cause.getMessage());
                return ToolResult.failure(cause.getMessage());
            }
            log.error("[Tools] '{}' execution failed", toolName, cause);
            return ToolResult.failure("Tool execution failed: " + safeMessage(cause));
        }
    }

    private static String safeMessage(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * Strip special tokens some models leak into tool call names, e.g.
     * {@code search<|channel|>commentary}.
     */
    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
