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
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.BackendMessage;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ContentBlock;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ContentBlockDelta;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ContentBlockStart;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ConverseResponse;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.Output;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.StreamEvent;
import me.golemcore.converse.adapter.outbound.llm.bedrock.ConverseWire.ToolUseBlock;
import me.golemcore.converse.domain.model.ToolUseCorrelation;
import me.golemcore.converse.port.outbound.ProtocolConversionException;

import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds a complete Converse response from a sequence of stream events.
 *
 * <p>
 * Content blocks are keyed by {@code contentBlockIndex} and tagged with their
 * kind when first seen: a {@code toolUse} start opens a tool-use block, a text
 * delta opens a text block. A later event for the same index must match that
 * kind. Tool input arrives as raw JSON fragments and is parsed when its block
 * stops. Any number of text and tool-use blocks is supported; the assembled
 * message lists them in index order.
 *
 * <p>
 * One instance serves one streamed response and is not thread-safe.
 */
public class ConverseStreamAccumulator {

    /**
     * Receives fragments as they are accumulated.
     */
    public interface Listener {

        void onText(String fragment);

        void onToolInput(String toolUseId, String fragment);

        Listener NONE = new Listener() {
            @Override
            public void onText(String fragment) {
                // no-op
            }

            @Override
            public void onToolInput(String toolUseId, String fragment) {
                // no-op
            }
        };
    }

    enum BlockKind {
        TEXT, TOOL_USE
    }

    private static final class Block {
        private final BlockKind kind;
        private final StringBuilder buffer = new StringBuilder();
        private String toolUseId;
        private String name;
        private JsonNode input;
        private boolean stopped;

        private Block(BlockKind kind) {
            this.kind = kind;
        }
    }

    private final ObjectMapper objectMapper;
    private final ToolUseCorrelation correlation;
    private final Listener listener;
    private final Map<Integer, Block> blocks = new TreeMap<>();

    private String role;
    private String stopReason;
    private ConverseWire.TokenUsage usage;
    private Map<String, Object> metrics;

    public ConverseStreamAccumulator(ObjectMapper objectMapper, ToolUseCorrelation correlation, Listener listener) {
        this.objectMapper = objectMapper;
        this.correlation = correlation != null ? correlation : new ToolUseCorrelation();
        this.listener = listener != null ? listener : Listener.NONE;
    }

    public void accept(StreamEvent event) {
        if (event.getMessageStart() != null && event.getMessageStart().getRole() != null) {
            role = event.getMessageStart().getRole();
        }
        if (event.getContentBlockStart() != null) {
            onBlockStart(event.getContentBlockStart());
        }
        if (event.getContentBlockDelta() != null) {
            onBlockDelta(event.getContentBlockDelta());
        }
        if (event.getContentBlockStop() != null) {
            onBlockStop(event.getContentBlockStop().getContentBlockIndex());
        }
        if (event.getMessageStop() != null) {
            stopReason = event.getMessageStop().getStopReason();
        }
        if (event.getMetadata() != null) {
            usage = event.getMetadata().getUsage();
            metrics = event.getMetadata().getMetrics();
        }
    }

    private void onBlockStart(ContentBlockStart start) {
        if (start.getStart() == null || start.getStart().getToolUse() == null) {
            return;
        }
        int index = start.getContentBlockIndex();
        Block existing = blocks.get(index);
        if (existing != null) {
            throw new ProtocolConversionException(
                    "Content block " + index + " was already started as " + existing.kind);
        }
        Block block = new Block(BlockKind.TOOL_USE);
        block.toolUseId = start.getStart().getToolUse().getToolUseId();
        block.name = start.getStart().getToolUse().getName();
        blocks.put(index, block);
        correlation.record(block.toolUseId);
    }

    private void onBlockDelta(ContentBlockDelta delta) {
        if (delta.getDelta() == null) {
            return;
        }
        int index = delta.getContentBlockIndex();
        String text = delta.getDelta().getText();
        if (text != null) {
            Block block = blocks.computeIfAbsent(index, i -> new Block(BlockKind.TEXT));
            requireKind(block, index, BlockKind.TEXT);
            block.buffer.append(text);
            listener.onText(text);
        }
        if (delta.getDelta().getToolUse() != null) {
            Block block = blocks.get(index);
            if (block == null) {
                throw new ProtocolConversionException("Tool input for content block " + index
                        + " that was never started as a tool use");
            }
            requireKind(block, index, BlockKind.TOOL_USE);
            String fragment = delta.getDelta().getToolUse().getInput();
            if (fragment != null) {
                block.buffer.append(fragment);
                listener.onToolInput(block.toolUseId, fragment);
            }
        }
    }

    private void onBlockStop(int index) {
        Block block = blocks.get(index);
        if (block == null || block.stopped) {
            return;
        }
        if (block.kind == BlockKind.TOOL_USE) {
            block.input = parseInput(block);
        }
        block.stopped = true;
    }

    private static void requireKind(Block block, int index, BlockKind expected) {
        if (block.kind != expected) {
            throw new ProtocolConversionException("Content block " + index + " is " + block.kind
                    + " but received a " + expected + " delta");
        }
    }

    private JsonNode parseInput(Block block) {
        String raw = block.buffer.toString();
        if (raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ProtocolConversionException(
                    "Tool use " + block.toolUseId + " streamed invalid JSON input: " + raw, e);
        }
    }

    /**
     * Assembles the accumulated blocks into a complete response. Tool-use
     * blocks that never received a stop event are parsed here.
     */
    public ConverseResponse toResponse() {
        BackendMessage message = new BackendMessage(
                role != null && !role.isBlank() ? role : ConverseWire.ROLE_ASSISTANT,
                new ArrayList<>());
        for (Block block : blocks.values()) {
            if (block.kind == BlockKind.TEXT) {
                message.getContent().add(ContentBlock.ofText(block.buffer.toString()));
            } else {
                JsonNode input = block.input != null ? block.input : parseInput(block);
                message.getContent().add(ContentBlock.ofToolUse(
                        new ToolUseBlock(block.toolUseId, block.name, input)));
            }
        }

        ConverseResponse response = new ConverseResponse();
        response.setOutput(new Output(message));
        response.setStopReason(stopReason);
        response.setUsage(usage);
        response.setMetrics(metrics);
        return response;
    }
}
