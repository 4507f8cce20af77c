package io.hivecontrol.lifecycle.control;

import io.hivecontrol.lifecycle.LifecycleObserver;
import io.hivecontrol.lifecycle.ServiceIdentity;
import io.hivecontrol.lifecycle.ServiceLifecycle;
import io.hivecontrol.lifecycle.messaging.LifecycleMessageCodec;
import io.hivecontrol.lifecycle.messaging.ProtocolException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Applies remote start/stop commands addressed to this worker.
 *
 * <p>Every worker receives every broadcast; commands for other identities are dropped without a
 * trace. A remote {@code start} enters {@link ServiceLifecycle#run()} directly, so unlike the boot
 * path it never passes through {@code starting}.</p>
 */
public final class ControlListener implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ControlListener.class);

    private final ServiceLifecycle lifecycle;
    private final ControlChannel channel;
    private final LifecycleMessageCodec codec;
    private final MalformedCommandPolicy malformedPolicy;
    private final List<LifecycleObserver> observers;

    public ControlListener(ServiceLifecycle lifecycle,
                           ControlChannel channel,
                           LifecycleMessageCodec codec,
                           MalformedCommandPolicy malformedPolicy,
                           List<LifecycleObserver> observers) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.malformedPolicy = Objects.requireNonNull(malformedPolicy, "malformedPolicy");
        this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
    }

    @Override
    public void run() {
        String sid = lifecycle.identity().sid();
        MDC.put("sid", sid);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                String payload = channel.receive();
                handle(payload);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("[CTRL] listener for {} interrupted", sid);
        } catch (RuntimeException ex) {
            log.error("[CTRL] listener for {} failed, remote control is no longer available", sid, ex);
            throw ex;
        } finally {
            MDC.remove("sid");
        }
    }

    /**
     * Decodes and applies one broadcast payload.
     *
     * @return {@code true} when a start or stop was applied to this worker
     */
    public boolean handle(String payload) {
        ControlCommand command;
        try {
            command = codec.decodeControl(payload);
        } catch (ProtocolException ex) {
            return malformed(ex);
        }
        ServiceIdentity identity = lifecycle.identity();
        if (!identity.matches(command.sid())) {
            return false;
        }
        if (command.action() == null) {
            return malformed(new ProtocolException("control command for " + identity.sid() + " has no action"));
        }
        Optional<ControlAction> action = command.resolvedAction();
        if (action.isEmpty()) {
            log.debug("[CTRL] ignoring unsupported action '{}' for {}", command.action(), identity.sid());
            return false;
        }
        log.info("[CTRL] RECV sid={} action={} state={}", identity.sid(), command.action(), lifecycle.status());
        switch (action.get()) {
            case STOP -> lifecycle.stop();
            case START -> lifecycle.run();
            default -> throw new IllegalStateException("unhandled control action " + action.get());
        }
        observers.forEach(observer -> observer.onControlCommand(command));
        return true;
    }

    private boolean malformed(ProtocolException ex) {
        if (malformedPolicy == MalformedCommandPolicy.SKIP) {
            log.warn("[CTRL] skipping malformed control message for {}: {}", lifecycle.identity().sid(), ex.getMessage());
            return false;
        }
        throw ex;
    }
}
