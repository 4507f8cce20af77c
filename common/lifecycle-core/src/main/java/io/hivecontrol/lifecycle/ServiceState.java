package io.hivecontrol.lifecycle;

/**
 * Coarse-grained lifecycle states of a worker process.
 *
 * <p>{@link #STOPPING} is declared for a future graceful drain; no transition currently enters it.</p>
 */
public enum ServiceState {

    INIT("init"),
    STARTING("starting"),
    STARTED("started"),
    STOPPING("stopping"),
    STOPPED("stopped");

    private final String value;

    ServiceState(String value) {
        this.value = value;
    }

    /**
     * External representation used in heartbeats and {@link ServiceLifecycle#status()}.
     */
    public String value() {
        return value;
    }

    /**
     * Exact match on the external value; no trimming or case folding.
     *
     * @throws InvalidStateException for anything that is not one of the five external values
     */
    public static ServiceState fromValue(String value) {
        for (ServiceState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new InvalidStateException(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
