package com.fintech.bars.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Codec for the length-prefixed text framing used by the quote feed.
 *
 * <p>Every frame is {@code ~m~<len>~m~<payload>} where {@code len} is the UTF-8 byte
 * length of the payload. Payloads are compact JSON objects {@code {"m":..,"p":[..]}},
 * or heartbeat tokens {@code ~h~<n>} which the client must echo back.
 *
 * <p>A single WebSocket read may carry several frames, heartbeats included.
 * Decoding is lenient: fragments that are empty, heartbeats, unparseable or not
 * JSON objects are dropped without failing the rest of the chunk.
 */
public class FrameCodec {

    private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);

    private static final String FRAME_MARKER = "~m~";
    private static final String HEARTBEAT_PREFIX = "~h~";
    private static final Pattern FRAME_SPLIT = Pattern.compile("~m~\\d+~m~");
    private static final Pattern HEARTBEAT = Pattern.compile("~h~(\\d+)");

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Encodes an outbound message.
     *
     * @param method Protocol method
     * @param params Positional parameters, serialized as a JSON array
     * @return Framed text ready to send
     */
    public String encode(ProtocolMethod method, List<?> params) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("m", method.wireName());
        payload.set("p", objectMapper.valueToTree(params));
        try {
            return wrap(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize params for " + method.wireName(), e);
        }
    }

    /**
     * Splits a raw chunk into messages, preserving arrival order.
     */
    public List<ProtocolMessage> decode(String raw) {
        List<ProtocolMessage> messages = new ArrayList<>();
        if (raw == null || raw.isEmpty()) {
            return messages;
        }

        for (String fragment : FRAME_SPLIT.split(raw)) {
            String payload = fragment.trim();
            if (payload.isEmpty() || payload.startsWith(HEARTBEAT_PREFIX)) {
                continue;
            }

            JsonNode node;
            try {
                node = objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                if (log.isTraceEnabled()) {
                    log.trace("Discarding unparseable fragment: {}", abbreviate(payload));
                }
                continue;
            }

            if (node == null || !node.isObject()) {
                continue;
            }
            JsonNode method = node.get("m");
            messages.add(new ProtocolMessage(
                method != null && method.isTextual() ? method.asText() : null,
                node.get("p")
            ));
        }
        return messages;
    }

    /**
     * Returns the first heartbeat token ({@code ~h~<n>}) in the chunk, if any.
     */
    public Optional<String> findHeartbeat(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = HEARTBEAT.matcher(raw);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /** Frames a heartbeat token for echoing back to the server. */
    public String encodeHeartbeat(String heartbeat) {
        return wrap(heartbeat);
    }

    private static String wrap(String payload) {
        int length = payload.getBytes(StandardCharsets.UTF_8).length;
        return FRAME_MARKER + length + FRAME_MARKER + payload;
    }

    private static String abbreviate(String payload) {
        return payload.length() <= 120 ? payload : payload.substring(0, 120) + "...";
    }
}
