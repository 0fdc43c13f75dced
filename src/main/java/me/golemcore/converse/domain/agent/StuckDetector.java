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

import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.Message;

import java.util.List;
import java.util.Objects;

/**
 * Detects a model that keeps repeating itself: the newest assistant message
 * has content, and at least {@code threshold} of the {@code window} assistant
 * messages before it carry exactly the same content. Tool results and system
 * directives after that message are skipped, so a model that repeats the same
 * thought while calling tools is caught too. The empty-reply placeholder
 * {@link LlmResponse#EMPTY_CONTENT} never counts as a repeated thought.
 */
public class StuckDetector {

    public static final String STUCK_PROMPT = "Observed duplicate responses. Consider new strategies and "
            + "avoid repeating ineffective paths already attempted.";

    private final int threshold;
    private final int window;

    public StuckDetector(int threshold, int window) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("duplicate threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
        this.window = Math.max(window, threshold);
    }

    public boolean isStuck(List<Message> messages) {
        return repeatedContent(messages) != null;
    }

    /**
     * @return the content the model keeps repeating, or {@code null} if it is
     *         not stuck
     */
    public String repeatedContent(List<Message> messages) {
        int newest = newestAssistantIndex(messages);
        if (newest < 0) {
            return null;
        }
        Message last = messages.get(newest);
        if (!last.hasContent() || LlmResponse.EMPTY_CONTENT.equals(last.getContent())) {
            return null;
        }

        int inspected = 0;
        int duplicates = 0;
        for (int i = newest - 1; i >= 0 && inspected < window; i--) {
            Message candidate = messages.get(i);
            if (!candidate.isAssistantMessage()) {
                continue;
            }
            inspected++;
            if (Objects.equals(candidate.getContent(), last.getContent())) {
                duplicates++;
            }
        }
        return duplicates >= threshold ? last.getContent() : null;
    }

    private static int newestAssistantIndex(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.isAssistantMessage()) {
                return i;
            }
            if (!message.isToolMessage() && !message.isSystemMessage()) {
                return -1;
            }
        }
        return -1;
    }

    public int getThreshold() {
        return threshold;
    }
}
