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

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ordered, FIFO-bounded conversation history owned by a single agent engine.
 * When the bound is exceeded the oldest messages are evicted so that the most
 * recent {@code maxMessages} remain.
 *
 * <p>
 * Not thread-safe.
 */
public class Memory {

    public static final int DEFAULT_MAX_MESSAGES = 100;

    private final List<Message> messages = new ArrayList<>();

    @Getter
    private final int maxMessages;

    public Memory() {
        this(DEFAULT_MAX_MESSAGES);
    }

    public Memory(int maxMessages) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.maxMessages = maxMessages;
    }

    public void add(Message message) {
        messages.add(message);
        evictOverflow();
    }

    public void addAll(List<Message> batch) {
        messages.addAll(batch);
        evictOverflow();
    }

    public void clear() {
        messages.clear();
    }

    /**
     * Returns up to {@code n} most recent messages, oldest first.
     */
    public List<Message> getRecent(int n) {
        if (n <= 0) {
            return List.of();
        }
        int from = Math.max(0, messages.size() - n);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public Message lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public List<Map<String, Object>> toMapList() {
        return messages.stream().map(Message::toMap).toList();
    }

    private void evictOverflow() {
        int overflow = messages.size() - maxMessages;
        if (overflow > 0) {
            messages.subList(0, overflow).clear();
        }
    }
}
