package io.hivecontrol.lifecycle.messaging;

/**
 * A heartbeat or control payload could not be encoded or decoded.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
