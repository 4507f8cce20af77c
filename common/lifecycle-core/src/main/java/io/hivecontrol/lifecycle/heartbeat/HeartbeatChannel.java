package io.hivecontrol.lifecycle.heartbeat;

/**
 * Point-to-point request/acknowledge exchange with the monitor.
 */
@FunctionalInterface
public interface HeartbeatChannel {

    /**
     * Sends one heartbeat and blocks until exactly one reply arrives.
     *
     * @return the reply body; its content carries no meaning
     * @throws io.hivecontrol.lifecycle.messaging.TransportException if the exchange fails
     */
    String request(String payload) throws InterruptedException;
}
