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

import me.golemcore.converse.domain.model.LlmChunk;
import me.golemcore.converse.domain.model.LlmRequest;
import me.golemcore.converse.domain.model.LlmResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port to a chat model backend. Implementations translate the
 * canonical request into the backend's wire format and back.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "bedrock").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Executes a streaming chat request. Emits text and tool-input fragments in
     * generation order, then one final {@link LlmChunk#isDone() done} chunk
     * carrying the assembled response. Default implementation falls back to
     * {@link #chat(LlmRequest)}.
     */
    default Flux<LlmChunk> chatStream(LlmRequest request) {
        return Mono.defer(() -> Mono.fromFuture(chat(request)))
                .flatMapIterable(response -> response.getContent() != null
                        ? List.of(LlmChunk.text(response.getContent()), LlmChunk.done(response))
                        : List.of(LlmChunk.done(response)));
    }

    /**
     * Checks if this provider supports streaming responses.
     */
    default boolean supportsStreaming() {
        return false;
    }

    /**
     * Returns the current or default model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
