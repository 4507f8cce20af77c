package io.hivecontrol.lifecycle.messaging;

import io.hivecontrol.lifecycle.heartbeat.HeartbeatChannel;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpTemplate;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageProperties;

/**
 * Spring AMQP request/reply heartbeat exchange. The template's reply timeout decides how long a
 * request may wait; workers configure it as indefinite so heartbeats never time out locally.
 */
public final class AmqpHeartbeatChannel implements HeartbeatChannel {

    private final AmqpTemplate template;
    private final String exchange;
    private final String routingKey;

    public AmqpHeartbeatChannel(AmqpTemplate template, String exchange, String routingKey) {
        this.template = Objects.requireNonNull(template, "template");
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey");
    }

    @Override
    public String request(String payload) throws InterruptedException {
        Objects.requireNonNull(payload, "payload");
        Message request = MessageBuilder.withBody(payload.getBytes(StandardCharsets.UTF_8))
            .setContentType(MessageProperties.CONTENT_TYPE_JSON)
            .setContentEncoding(StandardCharsets.UTF_8.name())
            .build();
        Message reply;
        try {
            reply = template.sendAndReceive(exchange, routingKey, request);
        } catch (AmqpException ex) {
            throw new TransportException("heartbeat request to " + describe() + " failed", ex);
        }
        if (reply == null) {
            if (Thread.interrupted()) {
                throw new InterruptedException("heartbeat request to " + describe() + " interrupted");
            }
            throw new TransportException("no heartbeat acknowledgement from " + describe());
        }
        return new String(reply.getBody(), StandardCharsets.UTF_8);
    }

    private String describe() {
        return "exchange='" + exchange + "' routingKey='" + routingKey + "'";
    }
}
