package io.hivecontrol.lifecycle.spring;

import io.hivecontrol.lifecycle.control.MalformedCommandPolicy;
import jakarta.validation.Valid;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Worker lifecycle configuration: the service identity, static heartbeat metadata and the two
 * monitor endpoints. The heartbeat cadence is fixed.
 */
@Validated
@ConfigurationProperties(prefix = "hivecontrol.lifecycle")
public final class WorkerLifecycleProperties {

    static final String DEFAULT_HEARTBEAT_ROUTING_KEY = "hive.monitor.heartbeat";
    static final String DEFAULT_CONTROL_EXCHANGE = "hive.monitor.control";

    private final boolean enabled;
    private final boolean autoStartup;
    private final String sid;
    private final Map<String, String> metadata;
    private final Heartbeat heartbeat;
    private final Control control;

    public WorkerLifecycleProperties(Boolean enabled,
                                     Boolean autoStartup,
                                     String sid,
                                     Map<String, String> metadata,
                                     @Valid Heartbeat heartbeat,
                                     @Valid Control control) {
        this.enabled = enabled == null || enabled;
        this.autoStartup = autoStartup == null || autoStartup;
        this.sid = requireConcrete(sid, "hivecontrol.lifecycle.sid");
        this.metadata = copyMetadata(metadata);
        this.heartbeat = heartbeat != null ? heartbeat : new Heartbeat(null, null);
        this.control = control != null ? control : new Control(null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public String getSid() {
        return sid;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public Control getControl() {
        return control;
    }

    @Validated
    public static final class Heartbeat {

        private final String exchange;
        private final String routingKey;

        public Heartbeat(String exchange, String routingKey) {
            this.exchange = exchange == null ? "" : exchange.trim();
            this.routingKey = routingKey == null
                ? DEFAULT_HEARTBEAT_ROUTING_KEY
                : requireConcrete(routingKey, "hivecontrol.lifecycle.heartbeat.routing-key");
        }

        /**
         * Exchange the heartbeat request is published to; empty means the AMQP default exchange.
         */
        public String getExchange() {
            return exchange;
        }

        public String getRoutingKey() {
            return routingKey;
        }
    }

    @Validated
    public static final class Control {

        private final String exchange;
        private final boolean declareTopology;
        private final boolean skipMalformed;

        public Control(String exchange, Boolean declareTopology, Boolean skipMalformed) {
            this.exchange = exchange == null
                ? DEFAULT_CONTROL_EXCHANGE
                : requireConcrete(exchange, "hivecontrol.lifecycle.control.exchange");
            this.declareTopology = declareTopology == null || declareTopology;
            this.skipMalformed = skipMalformed != null && skipMalformed;
        }

        public String getExchange() {
            return exchange;
        }

        public boolean isDeclareTopology() {
            return declareTopology;
        }

        public boolean isSkipMalformed() {
            return skipMalformed;
        }

        public MalformedCommandPolicy malformedPolicy() {
            return skipMalformed ? MalformedCommandPolicy.SKIP : MalformedCommandPolicy.FAIL;
        }
    }

    private static Map<String, String> copyMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            String name = key == null ? "" : key.trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("hivecontrol.lifecycle.metadata contains an unnamed entry");
            }
            if (value != null) {
                copy.put(name, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static String requireConcrete(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must not be null or blank");
        }
        String trimmed = value.trim();
        if (trimmed.contains("${")) {
            throw new IllegalArgumentException(
                property + " must resolve to a concrete value, but was " + trimmed);
        }
        return trimmed;
    }
}
