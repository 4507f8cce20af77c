package io.hivecontrol.lifecycle;

import io.hivecontrol.lifecycle.control.ControlChannel;
import io.hivecontrol.lifecycle.heartbeat.HeartbeatChannel;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Queue-backed stand-ins for the monitor side of both channels.
 */
public final class InMemoryChannels {

    private InMemoryChannels() {
    }

    public static final class Monitor implements HeartbeatChannel {

        private final BlockingQueue<String> requests = new LinkedBlockingQueue<>();
        private final BlockingQueue<String> replies = new LinkedBlockingQueue<>();
        private volatile boolean autoAck;

        public static Monitor acknowledging() {
            Monitor monitor = new Monitor();
            monitor.autoAck = true;
            return monitor;
        }

        public static Monitor silent() {
            return new Monitor();
        }

        @Override
        public String request(String payload) throws InterruptedException {
            requests.put(payload);
            if (autoAck) {
                return "ok";
            }
            return replies.take();
        }

        public void reply(String body) {
            replies.add(body);
        }

        public String nextRequest(Duration timeout) throws InterruptedException {
            return requests.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        public int pendingRequests() {
            return requests.size();
        }
    }

    public static final class Broadcast implements ControlChannel {

        private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();

        @Override
        public String receive() throws InterruptedException {
            return inbox.take();
        }

        public void publish(String payload) {
            inbox.add(payload);
        }

        public boolean isDrained() {
            return inbox.isEmpty();
        }
    }
}
