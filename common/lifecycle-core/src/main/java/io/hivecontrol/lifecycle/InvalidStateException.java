package io.hivecontrol.lifecycle;

/**
 * Raised when a value outside {@link ServiceState} is offered as a lifecycle state.
 * Signals a programming or configuration bug and is never retried.
 */
public class InvalidStateException extends IllegalArgumentException {

    private final String rejectedValue;

    public InvalidStateException(String rejectedValue) {
        super("invalid service state '" + rejectedValue + "', need one of init, starting, started, stopping, stopped");
        this.rejectedValue = rejectedValue;
    }

    public String rejectedValue() {
        return rejectedValue;
    }
}
