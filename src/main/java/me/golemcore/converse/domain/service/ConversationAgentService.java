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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.domain.agent.AgentEngine;
import me.golemcore.converse.domain.agent.AgentEngineFactory;
import me.golemcore.converse.domain.agent.AgentStreamEvent;
import me.golemcore.converse.domain.agent.RunResult;
import me.golemcore.converse.domain.model.Message;
import me.golemcore.converse.domain.model.Role;
import me.golemcore.converse.port.outbound.ConversationHistoryPort;
import me.golemcore.converse.port.outbound.ConversationHistoryPort.StoredMessage;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Owns one {@link AgentEngine} per conversation and serializes access to it.
 *
 * <p>
 * Each turn clears the engine memory, rehydrates it from the persisted
 * history (which must not contain the message being submitted), runs the
 * engine and extracts the newest assistant reply. Turns of the same
 * conversation never overlap; different conversations run independently.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationAgentService {

    public static final String GUEST_KEY = "guest";
    static final String FALLBACK_REPLY = "Sorry, I could not generate a reply.";
    static final String ERROR_REPLY_PREFIX = "An error occurred while processing your request: ";

    private final AgentEngineFactory engineFactory;
    private final ConversationHistoryPort historyPort;

    private final Map<String, ConversationHandle> handles = new ConcurrentHashMap<>();

    /**
     * Runs one turn against the transcript stored by the history port and
     * appends the user message and the reply to it.
     */
    public ConversationReply chat(String conversationKey, String userInput) {
        String key = normalizeKey(conversationKey);
        List<StoredMessage> history = historyPort.loadMessages(key);
        ConversationReply reply = chat(key, history, userInput);
        historyPort.appendMessage(key, StoredMessage.of(Role.USER.getValue(), userInput));
        if (!reply.isFailed()) {
            historyPort.appendMessage(key, StoredMessage.of(Role.ASSISTANT.getValue(), reply.getReply()));
        }
        return reply;
    }

    /**
     * Runs one turn with an explicit history. Never throws for run failures:
     * they are reported as an error reply.
     */
    public ConversationReply chat(String conversationKey, List<StoredMessage> history, String userInput) {
        String key = normalizeKey(conversationKey);
        ConversationHandle handle = handleFor(key);
        handle.acquire();
        try {
            AgentEngine engine = handle.engine;
            engine.reset(rehydrate(key, history));
            RunResult result = engine.run(userInput);
            String reply = result.getFinalReply() != null ? result.getFinalReply() : FALLBACK_REPLY;
            log.info("[Conversation] {} answered after {} step(s) ({})", key, result.getSteps(),
                    result.getTermination());
            return ConversationReply.builder()
                    .conversationKey(key)
                    .reply(reply)
                    .termination(result.getTermination())
                    .steps(result.getSteps())
                    .build();
        } catch (RuntimeException e) {
            log.error("[Conversation] Turn failed for {}", key, e);
            return ConversationReply.builder()
                    .conversationKey(key)
                    .reply(ERROR_REPLY_PREFIX + e.getMessage())
                    .failed(true)
                    .build();
        } finally {
            handle.release();
        }
    }

    /**
     * Streams one turn. The conversation stays locked until the engine is idle
     * again, which on cancellation may be after the flux has been disposed.
     */
    public Flux<AgentStreamEvent> chatStream(String conversationKey, List<StoredMessage> history,
            String userInput) {
        String key = normalizeKey(conversationKey);
        return Flux.defer(() -> {
            ConversationHandle handle = handleFor(key);
            handle.acquire();
            try {
                handle.engine.reset(rehydrate(key, history));
            } catch (RuntimeException e) {
                handle.release();
                return Flux.<AgentStreamEvent>error(e);
            }
            return handle.engine.stream(userInput, handle::release);
        })
                .doOnError(e -> log.error("[Conversation] Streamed turn failed for {}", key, e))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Discards the engine of a conversation unless it is running.
     *
     * @return true if an engine was removed
     */
    public boolean evict(String conversationKey) {
        String key = normalizeKey(conversationKey);
        ConversationHandle handle = handles.get(key);
        if (handle == null || !handle.tryAcquire()) {
            return false;
        }
        try {
            return handles.remove(key, handle);
        } finally {
            handle.release();
        }
    }

    int activeConversations() {
        return handles.size();
    }

    private ConversationHandle handleFor(String key) {
        return handles.computeIfAbsent(key, k -> {
            log.debug("[Conversation] Creating engine for {}", k);
            return new ConversationHandle(engineFactory.create());
        });
    }

    private static String normalizeKey(String conversationKey) {
        return conversationKey == null || conversationKey.isBlank() ? GUEST_KEY : conversationKey;
    }

    private static List<Message> rehydrate(String key, List<StoredMessage> history) {
        List<Message> messages = new ArrayList<>();
        if (history == null) {
            return messages;
        }
        for (StoredMessage stored : history) {
            try {
                messages.add(Message.of(stored.role(), stored.content(), stored.toolCalls(), stored.toolCallId()));
            } catch (IllegalArgumentException e) {
                log.warn("[Conversation] Skipping invalid stored message in {}: {}", key, e.getMessage());
            }
        }
        return messages;
    }

    /**
     * Engine plus the binary semaphore guarding it. A semaphore rather than a
     * lock, because a streamed turn releases it from the engine's thread.
     */
    private static final class ConversationHandle {

        private final AgentEngine engine;
        private final Semaphore permit = new Semaphore(1);

        private ConversationHandle(AgentEngine engine) {
            this.engine = engine;
        }

        void acquire() {
            permit.acquireUninterruptibly();
        }

        boolean tryAcquire() {
            return permit.tryAcquire();
        }

        void release() {
            permit.release();
        }
    }
}
