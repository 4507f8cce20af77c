package io.hivecontrol.lifecycle.control;

/**
 * What the control listener does with a payload it cannot decode.
 */
public enum MalformedCommandPolicy {

    /**
     * Log and stop listening. Default.
     */
    FAIL,

    /**
     * Log and wait for the next message.
     */
    SKIP
}
