package io.hivecontrol.lifecycle.messaging;

/**
 * Sending or receiving on a heartbeat or control channel failed.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
