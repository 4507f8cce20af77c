package io.hivecontrol.lifecycle;

/**
 * Domain logic of a concrete worker, invoked by {@link ServiceLifecycle#run()} once the worker has
 * entered {@link ServiceState#STARTED}.
 *
 * <p>Implementations that do long-running work should hand it to their own threads or listener
 * containers and return, since {@code run()} executes on the thread that triggered the start
 * (the boot task or the control listener).</p>
 */
public interface WorkerBody {

    /**
     * Body of the base service: does nothing.
     */
    WorkerBody NONE = new WorkerBody() { };

    /**
     * Entry point of the worker's job. Defaults to {@link #publish()} followed by {@link #subscribe()}.
     */
    default void run() throws Exception {
        publish();
        subscribe();
    }

    /**
     * For publishing workers: pushes domain messages to the worker's outbound transport.
     */
    default void publish() throws Exception {
    }

    /**
     * For consuming workers: starts consuming domain messages from the worker's subscriptions.
     */
    default void subscribe() throws Exception {
    }
}
