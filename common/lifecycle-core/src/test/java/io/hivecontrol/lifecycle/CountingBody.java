package io.hivecontrol.lifecycle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

public final class CountingBody implements WorkerBody {

    private final AtomicInteger runs = new AtomicInteger();
    private final List<ServiceState> observedStates = new CopyOnWriteArrayList<>();
    private volatile Supplier<ServiceState> stateProbe = () -> null;

    public void probe(ServiceLifecycle lifecycle) {
        this.stateProbe = lifecycle::state;
    }

    @Override
    public void run() {
        runs.incrementAndGet();
        observedStates.add(stateProbe.get());
    }

    public int runs() {
        return runs.get();
    }

    public List<ServiceState> observedStates() {
        return observedStates;
    }
}
