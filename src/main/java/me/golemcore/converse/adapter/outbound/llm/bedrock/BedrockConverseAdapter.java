package me.golemcore.converse.adapter.outbound.llm.bedrock;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ConverseRequest;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ConverseResponse;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.InferenceConfig;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.StreamEvent;
import me.golemcore.converse.adapter.outbound.llm.bedrock.EventStreamDecoder.EventStreamMessage;
import me.golemcore.converse.domain.model.LlmChunk;
import me.golemcore.converse.domain.model.LlmRequest;
import me.golemcore.converse.domain.model.LlmResponse;
import me.golemcore.converse.domain.model.ToolUseCorrelation;
import me.golemcore.converse.infrastructure.config.AgentProperties;
import me.golemcore.converse.infrastructure.http.FeignClientFactory;
import me.golemcore.converse.port.outbound.LlmException;
import me.golemcore.converse.port.outbound.LlmPort;
import me.golemcore.converse.port.outbound.LlmRateLimitException;
import me.golemcore.converse.port.outbound.ProtocolConversionException;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LlmPort} for the Amazon Bedrock Converse API.
 *
 * <p>
 * Non-streaming calls go through a Feign client
 * ({@code POST /model/{modelId}/converse}); streaming calls use the shared
 * OkHttp client directly ({@code POST /model/{modelId}/converse-stream}) and
 * decode the binary event stream frame by frame. Both authenticate with a
 * Bedrock API key sent as a bearer token.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code agent.llm.bedrock.region} / {@code endpoint} - runtime
 * endpoint</li>
 * <li>{@code agent.llm.bedrock.api-key} - Bedrock API key</li>
 * <li>{@code agent.llm.bedrock.model-id}, {@code max-tokens},
 * {@code temperature} - request defaults</li>
 * </ul>
 *
 * <p>
 * Provider ID: {@code "bedrock"}
 */
@Component
@Slf4j
public class BedrockConverseAdapter implements LlmPort {

    public static final String PROVIDER_ID = "bedrock";

    private static final MediaType JSON = MediaType.get("application/json");
    private static final String EVENT_STREAM = "application/vnd.amazon.eventstream";
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final String THROTTLING_EXCEPTION = "throttlingException";

    private final AgentProperties.BedrockProperties settings;
    private final FeignClientFactory feignClientFactory;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final ConverseRequestTranslator requestTranslator;
    private final ConverseResponseTranslator responseTranslator;

    private ConverseApi client;
    private volatile boolean initialized = false;

    public BedrockConverseAdapter(AgentProperties properties, FeignClientFactory feignClientFactory,
            OkHttpClient okHttpClient, ObjectMapper objectMapper, Clock clock) {
        this.settings = properties.getLlm().getBedrock();
        this.feignClientFactory = feignClientFactory;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.requestTranslator = new ConverseRequestTranslator(objectMapper);
        this.responseTranslator = new ConverseResponseTranslator(objectMapper, clock);
    }

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }
        if (!isAvailable()) {
            throw new LlmException("Bedrock adapter not configured: agent.llm.bedrock.api-key is empty");
        }
        String endpoint = settings.resolveEndpoint();
        this.client = feignClientFactory.create(ConverseApi.class, endpoint);
        initialized = true;
        log.info("[Bedrock] Adapter initialized: endpoint={}, model={}", endpoint, settings.getModelId());
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            ToolUseCorrelation correlation = correlationOf(request);
            ConverseRequest body = buildRequest(request, correlation);
            String modelId = modelOf(request);
            log.debug("[Bedrock] converse: model={}, messages={}", modelId, body.getMessages().size());
            try {
                ConverseResponse response = client.converse(settings.getApiKey(), modelId, body);
                return responseTranslator.translate(response, correlation);
            } catch (FeignException e) {
                throw toLlmException(e.status(), e.contentUTF8(), e);
            } catch (ProtocolConversionException | LlmException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("[Bedrock] converse failed", e);
                throw new LlmException("Bedrock converse failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.<LlmChunk>create(sink -> stream(request, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void stream(LlmRequest request, FluxSink<LlmChunk> sink) {
        Call call;
        ToolUseCorrelation correlation = correlationOf(request);
        try {
            ensureInitialized();
            ConverseRequest body = buildRequest(request, correlation);
            HttpUrl url = HttpUrl.get(settings.resolveEndpoint()).newBuilder()
                    .addPathSegment("model")
                    .addPathSegment(modelOf(request))
                    .addPathSegment("converse-stream")
                    .build();
            Request httpRequest = new Request.Builder()
                    .url(url)
                    .header("Authorization", "Bearer " + settings.getApiKey())
                    .header("Accept", EVENT_STREAM)
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                    .build();
            call = okHttpClient.newCall(httpRequest);
        } catch (JsonProcessingException e) {
            sink.error(new ProtocolConversionException("Cannot serialize Converse request", e));
            return;
        } catch (RuntimeException e) {
            sink.error(e);
            return;
        }
        sink.onCancel(call::cancel);

        ConverseStreamAccumulator accumulator = new ConverseStreamAccumulator(objectMapper, correlation,
                new ConverseStreamAccumulator.Listener() {
                    @Override
                    public void onText(String fragment) {
                        sink.next(LlmChunk.text(fragment));
                    }

                    @Override
                    public void onToolInput(String toolUseId, String fragment) {
                        sink.next(LlmChunk.toolInput(toolUseId, fragment));
                    }
                });

        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                String detail = responseBody != null ? responseBody.string() : "";
                throw toLlmException(response.code(), detail, null);
            }
            if (responseBody == null) {
                throw new LlmException("Bedrock converse-stream returned no body");
            }
            EventStreamDecoder decoder = new EventStreamDecoder(responseBody.byteStream());
            int frames = 0;
            EventStreamMessage message;
            while ((message = decoder.next()) != null) {
                if (sink.isCancelled()) {
                    return;
                }
                handleFrame(message, accumulator);
                frames++;
            }
            log.debug("[Bedrock] converse-stream finished after {} frames", frames);
            sink.next(LlmChunk.done(responseTranslator.translate(accumulator.toResponse(), correlation)));
            sink.complete();
        } catch (IOException e) {
            if (!sink.isCancelled()) {
                sink.error(new LlmException("Bedrock converse-stream failed: " + e.getMessage(), e));
            }
        } catch (RuntimeException e) {
            sink.error(e);
        }
    }

    private void handleFrame(EventStreamMessage message, ConverseStreamAccumulator accumulator) throws IOException {
        String messageType = message.messageType();
        if ("exception".equals(messageType)) {
            String exceptionType = message.header(EventStreamDecoder.HEADER_EXCEPTION_TYPE);
            String detail = exceptionMessage(message);
            if (THROTTLING_EXCEPTION.equals(exceptionType)) {
                throw new LlmRateLimitException("Bedrock throttled the stream: " + detail);
            }
            throw new LlmException("Bedrock stream exception " + exceptionType + ": " + detail);
        }
        if ("error".equals(messageType)) {
            throw new LlmException("Bedrock stream error " + message.header(EventStreamDecoder.HEADER_ERROR_CODE)
                    + ": " + message.header(EventStreamDecoder.HEADER_ERROR_MESSAGE));
        }
        String eventType = message.eventType();
        if (eventType == null) {
            log.debug("[Bedrock] Skipping frame without event type");
            return;
        }
        JsonNode payload = message.payload().length > 0
                ? objectMapper.readTree(message.payload())
                : objectMapper.createObjectNode();
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.set(eventType, payload);
        accumulator.accept(objectMapper.treeToValue(wrapper, StreamEvent.class));
    }

    private String exceptionMessage(EventStreamMessage message) {
        try {
            JsonNode node = objectMapper.readTree(message.payload());
            JsonNode text = node.get("message");
            return text != null ? text.asText() : message.payloadAsString();
        } catch (IOException e) {
            return message.payloadAsString();
        }
    }

    private ConverseRequest buildRequest(LlmRequest request, ToolUseCorrelation correlation) {
        request.setCorrelation(correlation);
        ConverseRequest body = requestTranslator.translate(request);
        InferenceConfig inference = body.getInferenceConfig() != null
                ? body.getInferenceConfig()
                : new InferenceConfig();
        if (inference.getTemperature() == null) {
            inference.setTemperature(settings.getTemperature());
        }
        if (inference.getMaxTokens() == null) {
            inference.setMaxTokens(settings.getMaxTokens());
        }
        body.setInferenceConfig(inference);
        return body;
    }

    private static ToolUseCorrelation correlationOf(LlmRequest request) {
        return request.getCorrelation() != null ? request.getCorrelation() : new ToolUseCorrelation();
    }

    private String modelOf(LlmRequest request) {
        return request.getModel() != null && !request.getModel().isBlank()
                ? request.getModel()
                : settings.getModelId();
    }

    private static LlmException toLlmException(int status, String detail, Throwable cause) {
        String message = "Bedrock returned HTTP " + status + (detail != null && !detail.isBlank() ? ": " + detail : "");
        if (status == HTTP_TOO_MANY_REQUESTS) {
            return new LlmRateLimitException(message);
        }
        return cause != null ? new LlmException(message, cause) : new LlmException(message);
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public String getCurrentModel() {
        return settings.getModelId();
    }

    @Override
    public boolean isAvailable() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    // Feign API interface
    public interface ConverseApi {
        @RequestLine("POST /model/{modelId}/converse")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ConverseResponse converse(@Param("apiKey") String apiKey, @Param("modelId") String modelId,
                ConverseRequest request);
    }
}
