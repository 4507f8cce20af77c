package io.hivecontrol.lifecycle.heartbeat;

import io.hivecontrol.lifecycle.ServiceState;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One liveness report: caller-supplied static fields plus the live {@code sid} and state.
 * Exists only for the duration of a single send. Fields with a {@code null} value are kept and
 * sent as JSON {@code null}.
 */
public record HeartbeatRecord(String sid, ServiceState state, Map<String, Object> fields) {

    public static final String TYPE = "heartbeat";

    public HeartbeatRecord {
        Objects.requireNonNull(sid, "sid");
        Objects.requireNonNull(state, "state");
        fields = fields == null ? Map.of() : copyOf(fields);
    }

    /**
     * Wire document: the static fields first, then {@code sid}, {@code type} and {@code state},
     * which take precedence over static fields with the same names.
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>(fields);
        document.put("sid", sid);
        document.put("type", TYPE);
        document.put("state", state.value());
        return document;
    }

    private static Map<String, Object> copyOf(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
