package io.hivecontrol.lifecycle.heartbeat;

import io.hivecontrol.lifecycle.LifecycleObserver;
import io.hivecontrol.lifecycle.ServiceLifecycle;
import io.hivecontrol.lifecycle.messaging.LifecycleMessageCodec;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reports "alive and in state X" to the monitor on a fixed cadence.
 *
 * <p>Each cycle is a synchronous request/acknowledge exchange, so a slow monitor throttles the
 * reporter. Failures are logged and rethrown: the loop stops and the monitor sees heartbeat
 * silence, which is its liveness signal. Nothing here retries.</p>
 */
public final class HeartbeatReporter implements Runnable {

    /**
     * Pause between two heartbeats. Fixed and not jittered.
     */
    public static final Duration INTERVAL = Duration.ofSeconds(10);

    private static final Logger log = LoggerFactory.getLogger(HeartbeatReporter.class);

    private final ServiceLifecycle lifecycle;
    private final Map<String, Object> metadata;
    private final HeartbeatChannel channel;
    private final LifecycleMessageCodec codec;
    private final List<LifecycleObserver> observers;
    private final Sleeper sleeper;

    public HeartbeatReporter(ServiceLifecycle lifecycle,
                             Map<String, ?> metadata,
                             HeartbeatChannel channel,
                             LifecycleMessageCodec codec,
                             List<LifecycleObserver> observers) {
        this(lifecycle, metadata, channel, codec, observers, Sleeper.THREAD);
    }

    HeartbeatReporter(ServiceLifecycle lifecycle,
                      Map<String, ?> metadata,
                      HeartbeatChannel channel,
                      LifecycleMessageCodec codec,
                      List<LifecycleObserver> observers,
                      Sleeper sleeper) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(metadata));
        this.channel = Objects.requireNonNull(channel, "channel");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public void run() {
        String sid = lifecycle.identity().sid();
        MDC.put("sid", sid);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                beat();
                sleeper.sleep(INTERVAL);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("[HEARTBEAT] reporter for {} interrupted, no further heartbeats", sid);
        } catch (RuntimeException ex) {
            log.error("[HEARTBEAT] reporter for {} failed, no further heartbeats will be sent", sid, ex);
            throw ex;
        } finally {
            MDC.remove("sid");
        }
    }

    /**
     * Sends one heartbeat carrying the current state and waits for its acknowledgement.
     */
    HeartbeatRecord beat() throws InterruptedException {
        HeartbeatRecord record = new HeartbeatRecord(lifecycle.identity().sid(), lifecycle.state(), metadata);
        String payload = codec.encodeHeartbeat(record);
        log.debug("[HEARTBEAT] SEND sid={} payload={}", record.sid(), payload);
        channel.request(payload);
        log.debug("[HEARTBEAT] ACK sid={} state={}", record.sid(), record.state());
        observers.forEach(observer -> observer.onHeartbeat(record));
        return record;
    }

    @FunctionalInterface
    interface Sleeper {

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
