package io.hivecontrol.lifecycle.messaging;

import io.hivecontrol.lifecycle.control.ControlChannel;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;

/**
 * Pulls control broadcasts from the worker's own queue, which is bound to the monitor's fanout
 * exchange without any routing filter.
 */
public final class AmqpControlChannel implements ControlChannel {

    private static final long WAIT_INDEFINITELY = -1L;

    private final AmqpTemplate template;
    private final String queueName;

    public AmqpControlChannel(AmqpTemplate template, String queueName) {
        this.template = Objects.requireNonNull(template, "template");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
    }

    @Override
    public String receive() throws InterruptedException {
        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("control receive on " + queueName + " interrupted");
            }
            Message message;
            try {
                message = template.receive(queueName, WAIT_INDEFINITELY);
            } catch (AmqpException ex) {
                throw new TransportException("control receive on queue '" + queueName + "' failed", ex);
            }
            if (message != null) {
                return new String(message.getBody(), StandardCharsets.UTF_8);
            }
        }
    }

    public String queueName() {
        return queueName;
    }
}
