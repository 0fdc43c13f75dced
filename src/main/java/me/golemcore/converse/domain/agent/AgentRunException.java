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

/**
 * A run was aborted by an error inside a step. The engine is back in
 * {@code IDLE} when this is thrown.
 */
public class AgentRunException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int step;

    public AgentRunException(int step, Throwable cause) {
        super("Agent run failed at step " + step + ": " + describe(cause), cause);
        this.step = step;
    }

    public int getStep() {
        return step;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
