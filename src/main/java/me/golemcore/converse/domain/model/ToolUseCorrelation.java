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

/**
 * Conversation-scoped memory of the most recent tool-use correlation id seen
 * in either direction of a backend exchange.
 *
 * <p>
 * One instance belongs to one conversation (one agent engine) and is handed
 * to the protocol adapter with every request, so correlation never leaks
 * between conversations. Not thread-safe; follows the engine's ownership.
 */
public class ToolUseCorrelation {

    private String lastToolUseId;

    public String getLastToolUseId() {
        return lastToolUseId;
    }

    public void record(String toolUseId) {
        if (toolUseId != null && !toolUseId.isBlank()) {
            this.lastToolUseId = toolUseId;
        }
    }

    public void clear() {
        this.lastToolUseId = null;
    }
}
