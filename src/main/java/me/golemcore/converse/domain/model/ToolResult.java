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

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Result of a tool execution. Results are sent back to the model as tool
 * messages. Two results can be merged with {@link #combine(ToolResult)}.
 */
@Value
@With
@Builder
public class ToolResult {

    String output;
    String error;
    String base64Image;
    String system;

    public static ToolResult success(String output) {
        return ToolResult.builder().output(output).build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder().error(error).build();
    }

    public boolean isSuccess() {
        return isBlank(error);
    }

    public boolean hasImage() {
        return !isBlank(base64Image);
    }

    /**
     * True when every field is absent or empty.
     */
    public boolean isEmpty() {
        return isBlank(output) && isBlank(error) && isBlank(base64Image) && isBlank(system);
    }

    /**
     * Field-wise merge: text fields are concatenated when both sides carry a
     * value. Only one image can be attached to a result.
     *
     * @throws IllegalStateException
     *             if both results carry an image
     */
    public ToolResult combine(ToolResult other) {
        if (other == null) {
            return this;
        }
        if (hasImage() && other.hasImage()) {
            throw new IllegalStateException("Cannot combine tool results: both carry an image");
        }
        return ToolResult.builder()
                .output(concat(output, other.output))
                .error(concat(error, other.error))
                .base64Image(hasImage() ? base64Image : other.base64Image)
                .system(concat(system, other.system))
                .build();
    }

    @Override
    public String toString() {
        return !isBlank(error) ? "Error: " + error : output;
    }

    private static String concat(String left, String right) {
        if (!isBlank(left) && !isBlank(right)) {
            return left + right;
        }
        return !isBlank(left) ? left : right;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
