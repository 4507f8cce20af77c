package io.hivecontrol.lifecycle.control;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hivecontrol.lifecycle.CountingBody;
import io.hivecontrol.lifecycle.InMemoryChannels;
import io.hivecontrol.lifecycle.RecordingObserver;
import io.hivecontrol.lifecycle.ServiceIdentity;
import io.hivecontrol.lifecycle.ServiceLifecycle;
import io.hivecontrol.lifecycle.ServiceState;
import io.hivecontrol.lifecycle.messaging.LifecycleMessageCodec;
import io.hivecontrol.lifecycle.messaging.ProtocolException;
import io.hivecontrol.lifecycle.messaging.TransportException;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ControlListenerTest {

    private final LifecycleMessageCodec codec = new LifecycleMessageCodec(new ObjectMapper());
    private final CountingBody body = new CountingBody();
    private final RecordingObserver observer = new RecordingObserver();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger logger = (Logger) LoggerFactory.getLogger(ControlListener.class);

    private ServiceLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        lifecycle = new ServiceLifecycle(new ServiceIdentity("w1"), body, List.of(observer), Clock.systemUTC());
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    @Test
    void commandsForOtherWorkersAreDroppedSilently() {
        lifecycle.setState(ServiceState.STARTED);
        observer.transitions.clear();
        ControlListener listener = listener(MalformedCommandPolicy.FAIL);

        assertThat(listener.handle("{\"sid\":\"w2\",\"action\":\"stop\"}")).isFalse();
        assertThat(listener.handle("{\"sid\":\"w10\",\"action\":\"start\"}")).isFalse();
        assertThat(listener.handle("{\"sid\":\"w2\"}")).isFalse();

        assertThat(lifecycle.state()).isEqualTo(ServiceState.STARTED);
        assertThat(observer.transitions).isEmpty();
        assertThat(observer.commands).isEmpty();
        assertThat(body.runs()).isZero();
        assertThat(appender.list).isEmpty();
    }

    @Test
    void paddedSidDoesNotAddressThisWorker() {
        lifecycle.setState(ServiceState.STARTED);
        observer.transitions.clear();
        ControlListener listener = listener(MalformedCommandPolicy.FAIL);

        assertThat(listener.handle("{\"sid\":\" w1 \",\"action\":\"stop\"}")).isFalse();
        assertThat(listener.handle("{\"sid\":\"W1\",\"action\":\"stop\"}")).isFalse();

        assertThat(lifecycle.status()).isEqualTo("started");
        assertThat(observer.transitions).isEmpty();
        assertThat(observer.commands).isEmpty();
    }

    @Test
    void numericSidDoesNotMatchNumericLookingIdentity() {
        ServiceLifecycle numbered = new ServiceLifecycle(new ServiceIdentity("7"), body, List.of(observer), Clock.systemUTC());
        numbered.setState(ServiceState.STARTED);
        observer.transitions.clear();
        ControlListener listener = new ControlListener(numbered, new InMemoryChannels.Broadcast(), codec,
            MalformedCommandPolicy.FAIL, List.of(observer));

        assertThat(listener.handle("{\"sid\":7,\"action\":\"stop\"}")).isFalse();
        assertThat(listener.handle("{\"sid\":7}")).isFalse();

        assertThat(numbered.status()).isEqualTo("started");
        assertThat(observer.commands).isEmpty();
        assertThat(listener.handle("{\"sid\":\"7\",\"action\":\"stop\"}")).isTrue();
        assertThat(numbered.status()).isEqualTo("stopped");
    }

    @Test
    void stopCommandStopsOnce() {
        lifecycle.setState(ServiceState.STARTED);
        observer.transitions.clear();

        assertThat(listener(MalformedCommandPolicy.FAIL).handle("{\"sid\":\"w1\",\"action\":\"stop\"}")).isTrue();

        assertThat(lifecycle.state()).isEqualTo(ServiceState.STOPPED);
        assertThat(observer.states()).containsExactly(ServiceState.STOPPED);
        assertThat(observer.commands).containsExactly(new ControlCommand("w1", "stop"));
    }

    @Test
    void startCommandEntersRunWithoutStarting() {
        lifecycle.setState(ServiceState.STOPPED);
        observer.transitions.clear();

        assertThat(listener(MalformedCommandPolicy.FAIL).handle("{\"sid\":\"w1\",\"action\":\"start\"}")).isTrue();

        assertThat(observer.states()).containsExactly(ServiceState.STARTED);
        assertThat(body.runs()).isEqualTo(1);
    }

    @Test
    void startCommandWhileStartedDoesNotReenterBody() {
        lifecycle.setState(ServiceState.STARTED);

        listener(MalformedCommandPolicy.FAIL).handle("{\"sid\":\"w1\",\"action\":\"start\"}");

        assertThat(body.runs()).isZero();
        assertThat(lifecycle.state()).isEqualTo(ServiceState.STARTED);
    }

    @Test
    void unsupportedActionsAreIgnored() {
        ControlListener listener = listener(MalformedCommandPolicy.FAIL);

        assertThat(listener.handle("{\"sid\":\"w1\",\"action\":\"restart\"}")).isFalse();
        assertThat(listener.handle("{\"sid\":\"w1\",\"action\":\"STOP\"}")).isFalse();

        assertThat(lifecycle.state()).isEqualTo(ServiceState.INIT);
        assertThat(observer.commands).isEmpty();
    }

    @Test
    void malformedPayloadFailsByDefault() {
        ControlListener listener = listener(MalformedCommandPolicy.FAIL);

        assertThatThrownBy(() -> listener.handle("not json")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> listener.handle("{\"action\":\"stop\"}")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> listener.handle("{\"sid\":\"w1\"}"))
            .isInstanceOf(ProtocolException.class)
            .hasMessage("control command for w1 has no action");
    }

    @Test
    void malformedPayloadIsSkippedWhenConfigured() {
        ControlListener listener = listener(MalformedCommandPolicy.SKIP);

        assertThat(listener.handle("not json")).isFalse();
        assertThat(listener.handle("{\"sid\":\"w1\"}")).isFalse();

        assertThat(appender.list)
            .extracting(ILoggingEvent::getLevel)
            .containsExactly(Level.WARN, Level.WARN);
    }

    @Test
    void loopAppliesCommandsUntilMalformedMessage() {
        InMemoryChannels.Broadcast broadcast = new InMemoryChannels.Broadcast();
        broadcast.publish("{\"sid\":\"w1\",\"action\":\"start\"}");
        broadcast.publish("{\"sid\":\"w2\",\"action\":\"stop\"}");
        broadcast.publish("{\"sid\":\"w1\",\"action\":\"stop\"}");
        broadcast.publish("[1,2,3]");
        broadcast.publish("{\"sid\":\"w1\",\"action\":\"start\"}");
        ControlListener listener = new ControlListener(lifecycle, broadcast, codec,
            MalformedCommandPolicy.FAIL, List.of(observer));

        assertThatThrownBy(listener::run).isInstanceOf(ProtocolException.class);

        assertThat(observer.states()).containsExactly(ServiceState.STARTED, ServiceState.STOPPED);
        assertThat(lifecycle.state()).isEqualTo(ServiceState.STOPPED);
        assertThat(broadcast.isDrained()).isFalse();
        assertThat(appender.list)
            .filteredOn(event -> event.getLevel() == Level.ERROR)
            .hasSize(1);
    }

    @Test
    void transportFailureEndsTheLoop() {
        ControlChannel broken = () -> {
            throw new TransportException("socket closed");
        };
        ControlListener listener = new ControlListener(lifecycle, broken, codec,
            MalformedCommandPolicy.SKIP, List.of(observer));

        assertThatThrownBy(listener::run)
            .isInstanceOf(TransportException.class)
            .hasMessage("socket closed");
    }

    private ControlListener listener(MalformedCommandPolicy policy) {
        return new ControlListener(lifecycle, new InMemoryChannels.Broadcast(), codec, policy, List.of(observer));
    }
}
