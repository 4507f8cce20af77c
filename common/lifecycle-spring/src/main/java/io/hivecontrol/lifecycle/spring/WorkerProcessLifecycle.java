package io.hivecontrol.lifecycle.spring;

import io.hivecontrol.lifecycle.WorkerProcess;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the {@link WorkerProcess} once the application context is ready and shuts it down with the
 * context.
 */
public final class WorkerProcessLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessLifecycle.class);

    private final WorkerProcess process;
    private final boolean autoStartup;
    private volatile boolean running;

    public WorkerProcessLifecycle(WorkerProcess process, boolean autoStartup) {
        this.process = Objects.requireNonNull(process, "process");
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        process.start();
        running = true;
        if (log.isInfoEnabled()) {
            log.info("Worker lifecycle started (sid={})", process.lifecycle().identity().sid());
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        process.close();
        running = false;
        if (log.isInfoEnabled()) {
            log.info("Worker lifecycle stopped (sid={}, state={})",
                process.lifecycle().identity().sid(), process.lifecycle().status());
        }
    }

    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }
}
