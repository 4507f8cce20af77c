package io.hivecontrol.lifecycle;

/**
 * Wraps a checked failure raised by a {@link WorkerBody}.
 */
public class WorkerBodyException extends RuntimeException {

    public WorkerBodyException(String message, Throwable cause) {
        super(message, cause);
    }
}
