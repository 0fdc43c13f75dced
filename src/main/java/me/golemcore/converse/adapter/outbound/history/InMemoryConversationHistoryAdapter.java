package me.golemcore.converse.adapter.outbound.history;

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
import me.golemcore.converse.port.outbound.ConversationHistoryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local transcript store. Each conversation list is guarded by its
 * own monitor.
 */
@Component
@Slf4j
public class InMemoryConversationHistoryAdapter implements ConversationHistoryPort {

    private final Map<String, List<StoredMessage>> transcripts = new ConcurrentHashMap<>();

    @Override
    public List<StoredMessage> loadMessages(String conversationKey) {
        List<StoredMessage> transcript = transcripts.get(conversationKey);
        if (transcript == null) {
            return List.of();
        }
        synchronized (transcript) {
            return List.copyOf(transcript);
        }
    }

    @Override
    public void appendMessage(String conversationKey, StoredMessage message) {
        List<StoredMessage> transcript = transcripts.computeIfAbsent(conversationKey, k -> new ArrayList<>());
        synchronized (transcript) {
            transcript.add(message);
        }
        log.trace("[History] Appended {} message to {}", message.role(), conversationKey);
    }
}
