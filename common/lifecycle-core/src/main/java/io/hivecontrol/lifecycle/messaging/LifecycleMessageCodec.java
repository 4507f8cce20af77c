package io.hivecontrol.lifecycle.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hivecontrol.lifecycle.control.ControlCommand;
import io.hivecontrol.lifecycle.heartbeat.HeartbeatRecord;
import java.util.Objects;

/**
 * JSON encoding of the heartbeat request and the control command envelopes.
 */
public final class LifecycleMessageCodec {

    private final ObjectMapper mapper;

    public LifecycleMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encodeHeartbeat(HeartbeatRecord record) {
        Objects.requireNonNull(record, "record");
        try {
            return mapper.writeValueAsString(record.toDocument());
        } catch (JsonProcessingException ex) {
            throw new ProtocolException("heartbeat for " + record.sid() + " could not be serialised", ex);
        }
    }

    /**
     * Parses {@code {"sid": ..., "action": ...}}. A missing {@code action} decodes to {@code null};
     * whether that matters depends on who the command is addressed to. A {@code sid} that is not a
     * JSON string decodes to {@code null} and matches no worker.
     *
     * @throws ProtocolException if the payload is not a JSON object or has no {@code sid}
     */
    public ControlCommand decodeControl(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ProtocolException("control payload must not be null or blank");
        }
        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new ProtocolException("control payload is not valid JSON: " + snippet(payload), ex);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("control payload must be a JSON object: " + snippet(payload));
        }
        JsonNode sid = node.get("sid");
        if (sid == null || sid.isNull()) {
            throw new ProtocolException("control payload has no sid: " + snippet(payload));
        }
        String addressee = sid.isTextual() ? sid.textValue() : null;
        return new ControlCommand(addressee, textOrNull(node.get("action")));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    static String snippet(String payload) {
        String trimmed = payload.strip();
        if (trimmed.length() > 300) {
            return trimmed.substring(0, 300) + "...";
        }
        return trimmed;
    }
}
