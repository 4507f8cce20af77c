package io.hivecontrol.lifecycle;

import java.time.Instant;
import java.util.Objects;

/**
 * One applied lifecycle state change. {@code actor} names the thread that caused it.
 */
public record StateTransition(String sid, ServiceState previous, ServiceState current, String actor, Instant at) {

    public StateTransition {
        Objects.requireNonNull(sid, "sid");
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(at, "at");
    }
}
