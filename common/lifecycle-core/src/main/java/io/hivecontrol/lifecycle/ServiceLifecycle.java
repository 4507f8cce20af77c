package io.hivecontrol.lifecycle;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative lifecycle state of a worker process and its transition rules.
 *
 * <p>The state cell is shared by the boot task, the control listener and the heartbeat reporter,
 * which run on separate threads. Only the transition methods write it; {@link #run()} uses an
 * atomic check-and-set so a concurrent start cannot enter the worker body twice.</p>
 *
 * <pre>
 * init -&gt; starting -&gt; started -&gt; stopped
 * stopped -&gt; started      (remote start, skips starting)
 * any     -&gt; stopped      (stop)
 * </pre>
 */
public final class ServiceLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ServiceLifecycle.class);

    private final ServiceIdentity identity;
    private final WorkerBody body;
    private final List<LifecycleObserver> observers;
    private final Clock clock;
    private final AtomicReference<ServiceState> state = new AtomicReference<>(ServiceState.INIT);

    public ServiceLifecycle(ServiceIdentity identity, WorkerBody body) {
        this(identity, body, List.of(), Clock.systemUTC());
    }

    public ServiceLifecycle(ServiceIdentity identity,
                            WorkerBody body,
                            List<LifecycleObserver> observers,
                            Clock clock) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.body = Objects.requireNonNull(body, "body");
        this.observers = List.copyOf(Objects.requireNonNull(observers, "observers"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ServiceIdentity identity() {
        return identity;
    }

    public ServiceState state() {
        return state.get();
    }

    /**
     * Returns the external representation of the current state.
     */
    public String status() {
        return state.get().value();
    }

    public void setState(ServiceState next) {
        if (next == null) {
            log.error("invalid service state for {}, need one of {}", identity.sid(), List.of(ServiceState.values()));
            throw new InvalidStateException(null);
        }
        ServiceState previous = state.getAndSet(next);
        transitioned(previous, next);
    }

    /**
     * Sets the state from its external representation.
     *
     * @throws InvalidStateException if {@code value} is not a member of {@link ServiceState};
     *     the current state is left unchanged
     */
    public void setState(String value) {
        ServiceState next;
        try {
            next = ServiceState.fromValue(value);
        } catch (InvalidStateException ex) {
            log.error("invalid service state '{}' for {}, need one of {}",
                value, identity.sid(), List.of(ServiceState.values()));
            throw ex;
        }
        setState(next);
    }

    /**
     * Boot path: moves to {@code starting} and enters the worker body through {@link #run()}.
     * Returns once the body's {@code run} returns.
     */
    public void start() {
        setState(ServiceState.STARTING);
        log.info("service {} starting", identity.sid());
        run();
    }

    /**
     * Moves straight to {@code stopped}; {@code stopping} is skipped.
     */
    public void stop() {
        setState(ServiceState.STOPPED);
        log.info("service {} stopped", identity.sid());
    }

    /**
     * Guarded entry into the worker body. A no-op when the service is already started, otherwise
     * moves to {@code started} and invokes {@link WorkerBody#run()} once.
     */
    public void run() {
        ServiceState previous = state.getAndUpdate(current ->
            current == ServiceState.STARTED ? current : ServiceState.STARTED);
        if (previous == ServiceState.STARTED) {
            log.error("tried to run service {}, but state is {}", identity.sid(), previous);
            return;
        }
        transitioned(previous, ServiceState.STARTED);
        try {
            body.run();
        } catch (RuntimeException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new WorkerBodyException("worker body of " + identity.sid() + " was interrupted", ex);
        } catch (Exception ex) {
            throw new WorkerBodyException("worker body of " + identity.sid() + " failed", ex);
        }
    }

    private void transitioned(ServiceState previous, ServiceState next) {
        String actor = Thread.currentThread().getName();
        log.info("set service state to {} (sid={}, previous={}, actor={})", next, identity.sid(), previous, actor);
        if (observers.isEmpty()) {
            return;
        }
        StateTransition transition = new StateTransition(identity.sid(), previous, next, actor, clock.instant());
        observers.forEach(observer -> observer.onTransition(transition));
    }
}
