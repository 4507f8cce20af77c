package io.hivecontrol.lifecycle.control;

import java.util.Optional;

public enum ControlAction {

    START("start"),
    STOP("stop");

    private final String wireValue;

    ControlAction(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Exact, case-sensitive match on the wire value; anything else resolves to empty.
     */
    public static Optional<ControlAction> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ControlAction action : values()) {
            if (action.wireValue.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
