package io.hivecontrol.lifecycle.control;

/**
 * Broadcast subscription carrying control commands for the whole fleet.
 */
@FunctionalInterface
public interface ControlChannel {

    /**
     * Blocks until the next broadcast message arrives and returns its body.
     *
     * @throws io.hivecontrol.lifecycle.messaging.TransportException if the receive fails
     */
    String receive() throws InterruptedException;
}
