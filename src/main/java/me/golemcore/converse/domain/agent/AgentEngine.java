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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.model.AgentState;
import me.golemcore.converse.domain.model.LlmChunk;
import me.golemcore.converse.domain.model.LlmRequest;
import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.Memory;
import me.golemcore.converse.domain.model.Message;
import me.golemcore.converse.domain.model.ToolCall;
import me.golemcore.converse.domain.model.ToolChoice;
import me.golemcore.converse.domain.model.ToolResult;
import me.golemcore.converse.domain.model.ToolUseCorrelation;
import me.golemcore.converse.domain.service.ToolRegistry;
import me.golemcore.converse.infrastructure.config.AgentProperties;
import me.golemcore.converse.port.outbound.LlmException;
import me.golemcore.converse.port.outbound.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Bounded step loop of one conversation: ask the model, run the tools it
 * calls, feed the results back, until the run finishes or the step cap is
 * reached.
 *
 * <p>
 * State machine: {@code IDLE -> RUNNING -> (FINISHED | ERROR) -> IDLE}. Every
 * run, successful or not, leaves the engine {@code IDLE} with the step counter
 * at zero. A run finishes when a special tool (by default {@code terminate})
 * executes successfully, or when the model answers without tool calls and
 * {@code agent.finish-on-reply} is enabled.
 *
 * <p>
 * Not thread-safe: one engine belongs to one conversation, and its owner
 * serializes access.
 */
@Slf4j
public class AgentEngine {

    static final String NO_ACTION_SUMMARY = "Thinking complete - no action needed";
    static final String TOOL_REQUIRED_SUMMARY = "Tool call required but the model replied without one";

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final LlmPort llmPort;
    private final ToolRegistry tools;
    private final AgentProperties settings;
    private final ObjectMapper objectMapper;
    private final StuckDetector stuckDetector;
    private final Memory memory;
    private final ToolUseCorrelation correlation = new ToolUseCorrelation();
    private final Set<String> nudgedContents = new HashSet<>();

    private AgentState state = AgentState.IDLE;
    private int currentStep;

    public AgentEngine(LlmPort llmPort, ToolRegistry tools, AgentProperties settings, ObjectMapper objectMapper) {
        this.llmPort = llmPort;
        this.tools = tools;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.stuckDetector = new StuckDetector(settings.getDuplicateThreshold(), settings.getStuckWindow());
        this.memory = new Memory(settings.getMaxMessages());
    }

    /**
     * Runs the loop to completion.
     *
     * @throws IllegalStateException
     *             if the engine is not idle
     * @throws AgentRunException
     *             if a step failed; the engine is idle again
     */
    public RunResult run(String userInput) {
        begin(userInput);
        try {
            return loop(event -> {
            }, () -> false, false);
        } finally {
            finish();
        }
    }

    /**
     * Streams one run. The returned flux is cold and accepts a single
     * subscriber; the idle check happens on subscription.
     */
    public Flux<AgentStreamEvent> stream(String userInput) {
        return stream(userInput, () -> {
        });
    }

    /**
     * Streams one run and invokes {@code onIdle} exactly once, when the run no
     * longer uses the engine. A cancelled subscription does not interrupt the
     * step in progress: {@code onIdle} then fires after the loop has exited
     * and the engine is idle, or right away if the run never started.
     */
    public Flux<AgentStreamEvent> stream(String userInput, Runnable onIdle) {
        AtomicBoolean subscribed = new AtomicBoolean();
        return Flux.<AgentStreamEvent>create(sink -> {
            if (!subscribed.compareAndSet(false, true)) {
                if (!sink.isCancelled()) {
                    sink.error(new IllegalStateException("Agent stream accepts a single subscriber"));
                }
                return;
            }
            try {
                begin(userInput);
            } catch (IllegalStateException e) {
                onIdle.run();
                sink.error(e);
                return;
            }
            AtomicBoolean cancelled = new AtomicBoolean();
            sink.onCancel(() -> cancelled.set(true));
            RunResult result = null;
            RuntimeException failure = null;
            try {
                result = loop(sink::next, cancelled::get, true);
            } catch (RuntimeException e) {
                failure = e;
            } finally {
                finish();
                onIdle.run();
            }
            if (failure != null) {
                sink.error(failure);
            } else {
                sink.next(AgentStreamEvent.completed(result));
                sink.complete();
            }
        })
                .subscribeOn(Schedulers.boundedElastic())
                .doFinally(signal -> {
                    if (signal == SignalType.CANCEL && subscribed.compareAndSet(false, true)) {
                        onIdle.run();
                    }
                });
    }

    /**
     * Replaces the conversation memory with {@code history}.
     *
     * @throws IllegalStateException
     *             if a run is in progress
     */
    public void reset(List<Message> history) {
        if (state != AgentState.IDLE) {
            throw new IllegalStateException("Cannot reset agent in state " + state);
        }
        memory.clear();
        correlation.clear();
        nudgedContents.clear();
        if (history != null) {
            memory.addAll(history);
        }
    }

    private void begin(String userInput) {
        if (state != AgentState.IDLE) {
            throw new IllegalStateException("Cannot run agent from state: " + state);
        }
        state = AgentState.RUNNING;
        currentStep = 0;
        nudgedContents.clear();
        if (userInput != null && !userInput.isBlank()) {
            memory.add(Message.user(userInput));
        }
        log.info("[Agent] Run started (max steps {})", settings.getMaxSteps());
    }

    private void finish() {
        state = AgentState.IDLE;
        currentStep = 0;
    }

    private RunResult loop(Consumer<AgentStreamEvent> observer, BooleanSupplier cancelled, boolean streaming) {
        List<String> summaries = new ArrayList<>();
        try {
            while (state != AgentState.FINISHED && currentStep < settings.getMaxSteps() && !cancelled.getAsBoolean()) {
                String summary = step(observer, streaming);
                summaries.add(summary);
                observer.accept(AgentStreamEvent.stepCompleted(currentStep, summary));
                log.debug("[Agent] Step {}: {}", currentStep, summary);
                checkStuck(observer);
            }
        } catch (RuntimeException e) {
            state = AgentState.ERROR;
            log.error("[Agent] Run failed at step {}", currentStep, e);
            throw new AgentRunException(currentStep, e);
        }

        RunResult.Termination termination = state == AgentState.FINISHED
                ? RunResult.Termination.FINISHED
                : RunResult.Termination.MAX_STEPS;
        if (termination == RunResult.Termination.MAX_STEPS && !cancelled.getAsBoolean()) {
            log.warn("[Agent] Terminated: reached max steps ({})", settings.getMaxSteps());
        }
        RunResult result = RunResult.builder()
                .termination(termination)
                .steps(currentStep)
                .maxSteps(settings.getMaxSteps())
                .stepSummaries(List.copyOf(summaries))
                .finalReply(lastAssistantReply())
                .build();
        log.info("[Agent] Run completed: {} after {} step(s)", termination, currentStep);
        return result;
    }

    /**
     * One think/act cycle.
     *
     * @return a human-readable summary of the step
     */
    private String step(Consumer<AgentStreamEvent> observer, boolean streaming) {
        currentStep++;
        observer.accept(AgentStreamEvent.stepStarted(currentStep));

        LlmResponse response = think(observer, streaming);
        ToolChoice toolChoice = settings.getToolChoice();
        boolean hasToolCalls = response.hasToolCalls();

        if (hasToolCalls && toolChoice == ToolChoice.NONE) {
            log.warn("[Agent] Model called tools although tool choice is NONE, ignoring {} call(s)",
                    response.getToolCalls().size());
            hasToolCalls = false;
        }

        if (!hasToolCalls) {
            String content = response.getContent();
            memory.add(Message.assistant(content));
            if (toolChoice == ToolChoice.REQUIRED) {
                return TOOL_REQUIRED_SUMMARY;
            }
            if (settings.isFinishOnReply()) {
                state = AgentState.FINISHED;
            }
            return content != null && !content.isBlank() ? content : NO_ACTION_SUMMARY;
        }

        List<ToolCall> toolCalls = response.getToolCalls();
        memory.add(Message.fromToolCalls(toolCalls, response.getContent()));
        log.debug("[Agent] Model selected {} tool(s): {}", toolCalls.size(),
                toolCalls.stream().map(ToolCall::getName).toList());

        // every call gets a tool message, even after a special tool finished the run
        List<String> observations = new ArrayList<>();
        boolean finished = false;
        for (ToolCall toolCall : toolCalls) {
            ToolExecution execution = act(toolCall, observer);
            observations.add(execution.observation());
            finished |= execution.finishesRun();
        }
        if (finished) {
            state = AgentState.FINISHED;
        }
        return String.join("\n\n", observations);
    }

    private LlmResponse think(Consumer<AgentStreamEvent> observer, boolean streaming) {
        List<Message> messages = new ArrayList<>(memory.getMessages());
        if (settings.getNextStepPrompt() != null && !settings.getNextStepPrompt().isBlank()) {
            messages.add(Message.user(settings.getNextStepPrompt()));
        }
        ToolChoice toolChoice = settings.getToolChoice();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(effectiveSystemPrompt())
                .messages(messages)
                .tools(toolChoice == ToolChoice.NONE ? new ArrayList<>() : new ArrayList<>(tools.toParams()))
                .toolChoice(toolChoice)
                .correlation(correlation)
                .build();

        if (streaming && llmPort.supportsStreaming()) {
            return thinkStreaming(request, observer);
        }
        try {
            return llmPort.chat(request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new LlmException("Model call failed: " + cause.getMessage(), cause);
        }
    }

    private LlmResponse thinkStreaming(LlmRequest request, Consumer<AgentStreamEvent> observer) {
        int step = currentStep;
        AtomicReference<LlmResponse> response = new AtomicReference<>();
        llmPort.chatStream(request)
                .doOnNext(chunk -> {
                    if (chunk.getKind() == LlmChunk.Kind.TEXT) {
                        observer.accept(AgentStreamEvent.text(step, chunk.getText()));
                    } else if (chunk.getKind() == LlmChunk.Kind.TOOL_INPUT) {
                        observer.accept(AgentStreamEvent.toolInput(step, chunk.getToolUseId(), chunk.getText()));
                    } else if (chunk.isDone()) {
                        response.set(chunk.getResponse());
                    }
                })
                .blockLast();
        if (response.get() == null) {
            throw new LlmException("Model stream ended without a final response");
        }
        return response.get();
    }

    /**
     * Configured system prompt followed by the newest system directive in
     * memory, if any.
     */
    private String effectiveSystemPrompt() {
        String directive = null;
        List<Message> messages = memory.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).isSystemMessage()) {
                directive = messages.get(i).getContent();
                break;
            }
        }
        String base = settings.getSystemPrompt();
        boolean hasBase = base != null && !base.isBlank();
        boolean hasDirective = directive != null && !directive.isBlank();
        if (hasBase && hasDirective) {
            return base + "\n\n" + directive;
        }
        return hasBase ? base : directive;
    }

    private ToolExecution act(ToolCall toolCall, Consumer<AgentStreamEvent> observer) {
        String name = toolCall.getName();
        String toolCallId = toolCall.getId() != null && !toolCall.getId().isBlank()
                ? toolCall.getId()
                : "call_" + UUID.randomUUID();

        ToolResult result;
        if (name == null || name.isBlank()) {
            result = ToolResult.failure("Invalid command format");
        } else {
            Map<String, Object> arguments = parseArguments(toolCall.getArguments());
            result = arguments != null
                    ? tools.execute(name, arguments, settings.getToolTimeout())
                    : ToolResult.failure("Error parsing arguments for " + name + ": Invalid JSON format");
        }

        String observation = formatObservation(name, result);
        if (!result.isSuccess()) {
            log.warn("[Agent] Tool '{}' failed: {}", name, result.getError());
        }
        memory.add(Message.tool(observation, name, toolCallId, result.getBase64Image()));
        observer.accept(AgentStreamEvent.toolResult(currentStep, name, toolCallId, observation));

        boolean finishesRun = result.isSuccess() && isSpecialTool(name);
        if (finishesRun) {
            log.info("[Agent] Special tool '{}' has completed the task", name);
        }
        return new ToolExecution(observation, finishesRun);
    }

    private Map<String, Object> parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(arguments, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("[Agent] Invalid tool arguments: {}", arguments);
            return null;
        }
    }

    static String formatObservation(String name, ToolResult result) {
        if (!result.isSuccess()) {
            return result.toString();
        }
        String output = result.getOutput();
        if (output == null || output.isEmpty()) {
            return "Cmd `" + name + "` completed with no output";
        }
        return "Observed output of cmd `" + name + "` executed:\n" + output;
    }

    private boolean isSpecialTool(String name) {
        return name != null && settings.getSpecialTools().stream().anyMatch(name::equalsIgnoreCase);
    }

    private void checkStuck(Consumer<AgentStreamEvent> observer) {
        String repeated = stuckDetector.repeatedContent(memory.getMessages());
        if (repeated == null || !nudgedContents.add(repeated)) {
            return;
        }
        log.warn("[Agent] Detected stuck state at step {}, adding directive", currentStep);
        memory.add(Message.system(StuckDetector.STUCK_PROMPT));
        observer.accept(AgentStreamEvent.stuckDetected(currentStep, StuckDetector.STUCK_PROMPT));
    }

    private String lastAssistantReply() {
        List<Message> messages = memory.getMessages();
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isAssistantMessage() && message.hasContent()) {
                return message.getContent();
            }
        }
        return null;
    }

    private record ToolExecution(String observation, boolean finishesRun) {
    }

    public AgentState getState() {
        return state;
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public Memory getMemory() {
        return memory;
    }

    public ToolUseCorrelation getCorrelation() {
        return correlation;
    }
}
