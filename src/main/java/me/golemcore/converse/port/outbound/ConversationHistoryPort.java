package me.golemcore.converse.port.outbound;

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

import me.golemcore.converse.domain.model.ToolCall;

import java.util.List;

/**
 * Persistence collaborator holding conversation transcripts. Only the read
 * and append operations the agent needs are part of this contract.
 */
public interface ConversationHistoryPort {

    /**
     * Returns the stored messages of a conversation in original order, or an
     * empty list for an unknown conversation.
     */
    List<StoredMessage> loadMessages(String conversationKey);

    void appendMessage(String conversationKey, StoredMessage message);

    /**
     * Persisted shape of a message. Fields come from storage and are validated
     * when turned back into canonical messages.
     */
    record StoredMessage(String role, String content, List<ToolCall> toolCalls, String toolCallId) {

        public static StoredMessage of(String role, String content) {
            return new StoredMessage(role, content, null, null);
        }
    }
}
