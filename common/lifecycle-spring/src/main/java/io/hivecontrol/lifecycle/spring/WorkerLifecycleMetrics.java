package io.hivecontrol.lifecycle.spring;

import io.hivecontrol.lifecycle.LifecycleObserver;
import io.hivecontrol.lifecycle.ServiceIdentity;
import io.hivecontrol.lifecycle.ServiceState;
import io.hivecontrol.lifecycle.StateTransition;
import io.hivecontrol.lifecycle.control.ControlAction;
import io.hivecontrol.lifecycle.control.ControlCommand;
import io.hivecontrol.lifecycle.heartbeat.HeartbeatRecord;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Micrometer view of the worker lifecycle. The state gauge reads the live state on every sample;
 * counts are kept locally so events observed before the registry binds are not lost.
 */
public final class WorkerLifecycleMetrics implements MeterBinder, LifecycleObserver {

    static final String STATE = "hive.worker.state";
    static final String TRANSITIONS = "hive.worker.transitions";
    static final String HEARTBEATS = "hive.worker.heartbeats";
    static final String CONTROL_COMMANDS = "hive.worker.control.commands";

    private final ServiceIdentity identity;
    private final Supplier<ServiceState> state;
    private final Map<ServiceState, AtomicLong> transitions = new EnumMap<>(ServiceState.class);
    private final Map<ControlAction, AtomicLong> commands = new EnumMap<>(ControlAction.class);
    private final AtomicLong heartbeats = new AtomicLong();

    public WorkerLifecycleMetrics(ServiceIdentity identity, Supplier<ServiceState> state) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.state = Objects.requireNonNull(state, "state");
        for (ServiceState value : ServiceState.values()) {
            transitions.put(value, new AtomicLong());
        }
        for (ControlAction action : ControlAction.values()) {
            commands.put(action, new AtomicLong());
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder(STATE, state, current -> current.get().ordinal())
            .description("Current lifecycle state (ordinal of init, starting, started, stopping, stopped)")
            .tag("sid", identity.sid())
            .register(registry);
        transitions.forEach((target, count) -> FunctionCounter.builder(TRANSITIONS, count, AtomicLong::get)
            .description("Lifecycle state changes by target state")
            .tag("sid", identity.sid())
            .tag("state", target.value())
            .register(registry));
        FunctionCounter.builder(HEARTBEATS, heartbeats, AtomicLong::get)
            .description("Heartbeats acknowledged by the monitor")
            .tag("sid", identity.sid())
            .register(registry);
        commands.forEach((action, count) -> FunctionCounter.builder(CONTROL_COMMANDS, count, AtomicLong::get)
            .description("Control commands applied to this worker")
            .tag("sid", identity.sid())
            .tag("action", action.wireValue())
            .register(registry));
    }

    @Override
    public void onTransition(StateTransition transition) {
        transitions.get(transition.current()).incrementAndGet();
    }

    @Override
    public void onHeartbeat(HeartbeatRecord record) {
        heartbeats.incrementAndGet();
    }

    @Override
    public void onControlCommand(ControlCommand command) {
        command.resolvedAction().ifPresent(action -> commands.get(action).incrementAndGet());
    }
}
