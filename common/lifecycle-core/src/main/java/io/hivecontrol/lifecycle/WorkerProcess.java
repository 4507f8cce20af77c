package io.hivecontrol.lifecycle;

import io.hivecontrol.lifecycle.control.ControlListener;
import io.hivecontrol.lifecycle.heartbeat.HeartbeatReporter;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches the three concurrent activities of a worker process: the boot task that starts the
 * lifecycle, the control listener and the heartbeat reporter.
 *
 * <p>The heartbeat reporter sends its first heartbeat only after the boot task has entered the
 * worker body (or failed), so the first report already carries {@code started}. Beyond that no
 * ordering exists between the tasks. A failing activity ends on its own and is logged; the others
 * keep running. {@link #close()} is the only way to end them all.</p>
 */
public final class WorkerProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcess.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);
    private static final long BOOT_POLL_MILLIS = 10L;

    private final ServiceLifecycle lifecycle;
    private final ControlListener controlListener;
    private final HeartbeatReporter heartbeatReporter;
    private final Object monitor = new Object();

    private ExecutorService executor;
    private volatile CompletableFuture<Void> boot;
    private volatile CompletableFuture<Void> control;
    private volatile CompletableFuture<Void> heartbeat;

    public WorkerProcess(ServiceLifecycle lifecycle,
                         ControlListener controlListener,
                         HeartbeatReporter heartbeatReporter) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.controlListener = Objects.requireNonNull(controlListener, "controlListener");
        this.heartbeatReporter = Objects.requireNonNull(heartbeatReporter, "heartbeatReporter");
    }

    public void start() {
        synchronized (monitor) {
            if (executor != null) {
                return;
            }
            String sid = lifecycle.identity().sid();
            executor = Executors.newFixedThreadPool(3, threadFactory(sid));
            boot = launch("boot", lifecycle::start);
            control = launch("control", controlListener);
            heartbeat = launch("heartbeat", this::reportAfterBoot);
            log.info("Worker process {} launched (state={})", sid, lifecycle.status());
        }
    }

    public boolean isRunning() {
        synchronized (monitor) {
            return executor != null && !executor.isShutdown();
        }
    }

    public CompletableFuture<Void> boot() {
        return requireStarted(boot);
    }

    public CompletableFuture<Void> control() {
        return requireStarted(control);
    }

    public CompletableFuture<Void> heartbeat() {
        return requireStarted(heartbeat);
    }

    public ServiceLifecycle lifecycle() {
        return lifecycle;
    }

    @Override
    public void close() {
        ExecutorService current;
        synchronized (monitor) {
            current = executor;
            if (current == null || current.isShutdown()) {
                return;
            }
            current.shutdownNow();
        }
        try {
            if (!current.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker process {} tasks did not finish within {}", lifecycle.identity().sid(), SHUTDOWN_GRACE);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        log.info("Worker process {} shut down (state={})", lifecycle.identity().sid(), lifecycle.status());
    }

    private void reportAfterBoot() {
        try {
            while (!boot.isDone() && booting(lifecycle.state())) {
                Thread.sleep(BOOT_POLL_MILLIS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return;
        }
        heartbeatReporter.run();
    }

    private static boolean booting(ServiceState state) {
        return state == ServiceState.INIT || state == ServiceState.STARTING;
    }

    private CompletableFuture<Void> launch(String task, Runnable runnable) {
        return CompletableFuture.runAsync(runnable, executor)
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Worker process {} task '{}' terminated", lifecycle.identity().sid(), task, error);
                } else {
                    log.debug("Worker process {} task '{}' completed", lifecycle.identity().sid(), task);
                }
            });
    }

    private <T> T requireStarted(T value) {
        if (value == null) {
            throw new IllegalStateException("worker process " + lifecycle.identity().sid() + " has not been started");
        }
        return value;
    }

    private static ThreadFactory threadFactory(String sid) {
        String[] names = {"boot", "control", "heartbeat"};
        AtomicInteger index = new AtomicInteger();
        return runnable -> {
            int slot = index.getAndIncrement();
            String suffix = slot < names.length ? names[slot] : "task-" + slot;
            Thread thread = new Thread(runnable, sid + "-" + suffix);
            thread.setDaemon(false);
            return thread;
        };
    }
}
