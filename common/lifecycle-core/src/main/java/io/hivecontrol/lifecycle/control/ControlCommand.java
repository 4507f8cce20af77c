package io.hivecontrol.lifecycle.control;

import java.util.Optional;

/**
 * Inbound instruction from the monitor. Consumed immediately, never stored.
 *
 * @param sid    identity of the addressed worker, {@code null} when the payload's sid was not a
 *               JSON string and therefore addresses nobody
 * @param action raw action value, {@code null} when the payload carried none
 */
public record ControlCommand(String sid, String action) {

    public Optional<ControlAction> resolvedAction() {
        return ControlAction.fromWire(action);
    }
}
