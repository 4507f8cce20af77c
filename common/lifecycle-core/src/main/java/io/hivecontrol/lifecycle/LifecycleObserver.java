package io.hivecontrol.lifecycle;

import io.hivecontrol.lifecycle.control.ControlCommand;
import io.hivecontrol.lifecycle.heartbeat.HeartbeatRecord;

/**
 * Receives observability events from the lifecycle, the heartbeat reporter and the control listener.
 * Callbacks run on the thread that produced the event and must not block.
 */
public interface LifecycleObserver {

    default void onTransition(StateTransition transition) {
    }

    default void onHeartbeat(HeartbeatRecord record) {
    }

    default void onControlCommand(ControlCommand command) {
    }
}
