package com.questrail.touchportal.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * JsonLineCodec
 * -----------------------------------------------------------------------------
 * Translates between single protocol lines and messages.
 *
 * <pre>
 *   byte[] from socket
 *        → LineFramer        (newline delimiting, UTF-8)
 *            → JsonLineCodec (JSON object with textual "type")
 *                → InboundMessage
 * </pre>
 *
 * <p>Encoding yields one compact JSON object terminated by {@code '\n'}.
 * The codec holds no per-connection state and is safe for concurrent use.</p>
 */
public final class JsonLineCodec
{
    private final ObjectMapper mapper;

    public JsonLineCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public JsonLineCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws ProtocolDecodeException if the line is not a JSON object with a textual {@code type}
     */
    public InboundMessage decode(String line) {
        Objects.requireNonNull(line, "line");
        final JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ProtocolDecodeException("Line is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolDecodeException("Line is not a JSON object");
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            throw new ProtocolDecodeException("Message has no textual 'type'");
        }
        return new InboundMessage((ObjectNode) node);
    }

    /**
     * Compact JSON text of the message, without terminator.
     *
     * @throws IllegalArgumentException if a field value cannot be serialized
     */
    public String encodeToString(OutboundMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return mapper.writeValueAsString(message.fields());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + message.type() + " message", e);
        }
    }

    /**
     * UTF-8 bytes of the message followed by {@code '\n'}.
     */
    public byte[] encode(OutboundMessage message) {
        return (encodeToString(message) + "\n").getBytes(StandardCharsets.UTF_8);
    }
}
