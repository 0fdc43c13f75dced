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

import me.golemcore.converse.port.outbound.ProtocolConversionException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.zip.CRC32;

/**
 * Reads frames of the {@code application/vnd.amazon.eventstream} binary
 * framing used by streaming Bedrock responses.
 *
 * <pre>
 * [total length:4][headers length:4][prelude crc:4][headers][payload][message crc:4]
 * </pre>
 *
 * All integers are big-endian; both checksums are CRC32. A header is
 * {@code [name length:1][name][type:1][value]}.
 */
public class EventStreamDecoder {

    static final int PRELUDE_LENGTH = 12;
    static final int TRAILER_LENGTH = 4;
    static final int MAX_MESSAGE_LENGTH = 16 * 1024 * 1024;

    public static final String HEADER_MESSAGE_TYPE = ":message-type";
    public static final String HEADER_EVENT_TYPE = ":event-type";
    public static final String HEADER_EXCEPTION_TYPE = ":exception-type";
    public static final String HEADER_ERROR_CODE = ":error-code";
    public static final String HEADER_ERROR_MESSAGE = ":error-message";

    private final InputStream input;

    public EventStreamDecoder(InputStream input) {
        this.input = input;
    }

    /**
     * Reads the next frame.
     *
     * @return the frame, or {@code null} when the stream ended cleanly between
     *         frames
     * @throws ProtocolConversionException
     *             on a truncated frame or checksum mismatch
     */
    public EventStreamMessage next() throws IOException {
        byte[] prelude = new byte[PRELUDE_LENGTH];
        int first = readFully(prelude, 0, PRELUDE_LENGTH);
        if (first == 0) {
            return null;
        }
        if (first < PRELUDE_LENGTH) {
            throw new ProtocolConversionException("Truncated event-stream prelude");
        }

        ByteBuffer preludeBuffer = ByteBuffer.wrap(prelude);
        int totalLength = preludeBuffer.getInt();
        int headersLength = preludeBuffer.getInt();
        long preludeCrc = Integer.toUnsignedLong(preludeBuffer.getInt());
        if (crc(prelude, 0, 8) != preludeCrc) {
            throw new ProtocolConversionException("Event-stream prelude checksum mismatch");
        }
        if (totalLength < PRELUDE_LENGTH + TRAILER_LENGTH || totalLength > MAX_MESSAGE_LENGTH
                || headersLength < 0 || headersLength > totalLength - PRELUDE_LENGTH - TRAILER_LENGTH) {
            throw new ProtocolConversionException("Invalid event-stream frame lengths: total=" + totalLength
                    + ", headers=" + headersLength);
        }

        byte[] frame = new byte[totalLength];
        System.arraycopy(prelude, 0, frame, 0, PRELUDE_LENGTH);
        int rest = totalLength - PRELUDE_LENGTH;
        if (readFully(frame, PRELUDE_LENGTH, rest) < rest) {
            throw new ProtocolConversionException("Truncated event-stream frame");
        }

        long messageCrc = Integer.toUnsignedLong(ByteBuffer.wrap(frame, totalLength - TRAILER_LENGTH, 4).getInt());
        if (crc(frame, 0, totalLength - TRAILER_LENGTH) != messageCrc) {
            throw new ProtocolConversionException("Event-stream message checksum mismatch");
        }

        Map<String, Object> headers = decodeHeaders(ByteBuffer.wrap(frame, PRELUDE_LENGTH, headersLength));
        int payloadOffset = PRELUDE_LENGTH + headersLength;
        int payloadLength = totalLength - payloadOffset - TRAILER_LENGTH;
        byte[] payload = new byte[payloadLength];
        System.arraycopy(frame, payloadOffset, payload, 0, payloadLength);
        return new EventStreamMessage(Collections.unmodifiableMap(headers), payload);
    }

    private int readFully(byte[] buffer, int offset, int length) throws IOException {
        int read = 0;
        while (read < length) {
            int n = input.read(buffer, offset + read, length - read);
            if (n < 0) {
                break;
            }
            read += n;
        }
        return read;
    }

    private static long crc(byte[] data, int offset, int length) {
        CRC32 crc32 = new CRC32();
        crc32.update(data, offset, length);
        return crc32.getValue();
    }

    static Map<String, Object> decodeHeaders(ByteBuffer buffer) {
        Map<String, Object> headers = new LinkedHashMap<>();
        try {
            while (buffer.hasRemaining()) {
                int nameLength = Byte.toUnsignedInt(buffer.get());
                String name = readString(buffer, nameLength);
                byte type = buffer.get();
                headers.put(name, decodeValue(buffer, type));
            }
        } catch (BufferUnderflowException e) {
            throw new ProtocolConversionException("Truncated event-stream header block", e);
        }
        return headers;
    }

    private static Object decodeValue(ByteBuffer buffer, byte type) {
        switch (type) {
        case 0:
            return Boolean.TRUE;
        case 1:
            return Boolean.FALSE;
        case 2:
            return buffer.get();
        case 3:
            return buffer.getShort();
        case 4:
            return buffer.getInt();
        case 5:
        case 8:
            return buffer.getLong();
        case 6: {
            byte[] bytes = new byte[Short.toUnsignedInt(buffer.getShort())];
            buffer.get(bytes);
            return bytes;
        }
        case 7:
            return readString(buffer, Short.toUnsignedInt(buffer.getShort()));
        case 9:
            return new UUID(buffer.getLong(), buffer.getLong());
        default:
            throw new ProtocolConversionException("Unknown event-stream header type: " + type);
        }
    }

    private static String readString(ByteBuffer buffer, int length) {
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * A decoded frame: headers in wire order and the raw payload.
     */
    public record EventStreamMessage(Map<String, Object> headers, byte[] payload) {

        public String header(String name) {
            Object value = headers.get(name);
            return value != null ? value.toString() : null;
        }

        public String messageType() {
            return header(HEADER_MESSAGE_TYPE);
        }

        public String eventType() {
            return header(HEADER_EVENT_TYPE);
        }

        public String payloadAsString() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }
}
