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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a conversation message. The set is closed: anything else coming
 * from persisted history or a backend is rejected at construction time.
 */
public enum Role {

    SYSTEM("system"), USER("user"), ASSISTANT("assistant"), TOOL("tool");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a wire value ({@code "user"}, {@code "assistant"}, ...).
     *
     * @throws IllegalArgumentException
     *             if the value is not one of the four known roles
     */
    @JsonCreator
    public static Role fromValue(String value) {
        if (value != null) {
            for (Role role : values()) {
                if (role.value.equals(value)) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Invalid role: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
