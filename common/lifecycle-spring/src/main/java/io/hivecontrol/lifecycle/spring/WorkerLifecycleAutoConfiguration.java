package io.hivecontrol.lifecycle.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hivecontrol.lifecycle.LifecycleObserver;
import io.hivecontrol.lifecycle.ServiceIdentity;
import io.hivecontrol.lifecycle.ServiceLifecycle;
import io.hivecontrol.lifecycle.WorkerBody;
import io.hivecontrol.lifecycle.WorkerProcess;
import io.hivecontrol.lifecycle.control.ControlChannel;
import io.hivecontrol.lifecycle.control.ControlListener;
import io.hivecontrol.lifecycle.heartbeat.HeartbeatChannel;
import io.hivecontrol.lifecycle.heartbeat.HeartbeatReporter;
import io.hivecontrol.lifecycle.messaging.AmqpControlChannel;
import io.hivecontrol.lifecycle.messaging.AmqpHeartbeatChannel;
import io.hivecontrol.lifecycle.messaging.LifecycleMessageCodec;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.amqp.core.AnonymousQueue;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the worker lifecycle substrate onto RabbitMQ: identity, state machine, heartbeat
 * request/reply channel, control broadcast queue and the process that runs them. Every bean backs
 * off when the application defines its own, most notably the {@link WorkerBody}.
 */
@AutoConfiguration(after = {RabbitAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass({RabbitTemplate.class, ServiceLifecycle.class})
@ConditionalOnProperty(prefix = "hivecontrol.lifecycle", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(WorkerLifecycleProperties.class)
public class WorkerLifecycleAutoConfiguration {

    private final WorkerLifecycleProperties properties;

    WorkerLifecycleAutoConfiguration(WorkerLifecycleProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Bean
    @ConditionalOnMissingBean
    ServiceIdentity workerServiceIdentity() {
        return new ServiceIdentity(properties.getSid());
    }

    @Bean
    @ConditionalOnMissingBean
    LifecycleMessageCodec lifecycleMessageCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new LifecycleMessageCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    WorkerBody workerBody() {
        return WorkerBody.NONE;
    }

    @Bean
    @ConditionalOnMissingBean
    WorkerLifecycleMetrics workerLifecycleMetrics(ServiceIdentity identity,
                                                  ObjectProvider<ServiceLifecycle> lifecycle) {
        return new WorkerLifecycleMetrics(identity, () -> lifecycle.getObject().state());
    }

    @Bean
    @ConditionalOnMissingBean
    ServiceLifecycle serviceLifecycle(ServiceIdentity identity,
                                      WorkerBody body,
                                      ObjectProvider<LifecycleObserver> observers) {
        return new ServiceLifecycle(identity, body, observers(observers), Clock.systemUTC());
    }

    @Bean(name = "workerControlQueue")
    @ConditionalOnMissingBean(name = "workerControlQueue")
    Queue workerControlQueue() {
        return new AnonymousQueue();
    }

    @Bean(name = "workerControlDeclarables")
    @ConditionalOnMissingBean(name = "workerControlDeclarables")
    Declarables workerControlDeclarables(@Qualifier("workerControlQueue") Queue queue) {
        FanoutExchange exchange = ExchangeBuilder.fanoutExchange(properties.getControl().getExchange())
            .durable(true)
            .build();
        List<Declarable> declarables = new ArrayList<>();
        if (properties.getControl().isDeclareTopology()) {
            declarables.add(exchange);
        }
        declarables.add(BindingBuilder.bind(queue).to(exchange));
        return new Declarables(declarables);
    }

    @Bean
    @ConditionalOnMissingBean
    HeartbeatChannel heartbeatChannel(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setReplyTimeout(-1L);
        template.setUseDirectReplyToContainer(false);
        WorkerLifecycleProperties.Heartbeat heartbeat = properties.getHeartbeat();
        return new AmqpHeartbeatChannel(template, heartbeat.getExchange(), heartbeat.getRoutingKey());
    }

    @Bean
    @ConditionalOnMissingBean
    ControlChannel controlChannel(RabbitTemplate rabbitTemplate,
                                  @Qualifier("workerControlQueue") Queue queue) {
        return new AmqpControlChannel(rabbitTemplate, queue.getName());
    }

    @Bean
    @ConditionalOnMissingBean
    HeartbeatReporter heartbeatReporter(ServiceLifecycle lifecycle,
                                        HeartbeatChannel channel,
                                        LifecycleMessageCodec codec,
                                        ObjectProvider<LifecycleObserver> observers) {
        return new HeartbeatReporter(lifecycle, properties.getMetadata(), channel, codec, observers(observers));
    }

    @Bean
    @ConditionalOnMissingBean
    ControlListener controlListener(ServiceLifecycle lifecycle,
                                    ControlChannel channel,
                                    LifecycleMessageCodec codec,
                                    ObjectProvider<LifecycleObserver> observers) {
        return new ControlListener(lifecycle, channel, codec,
            properties.getControl().malformedPolicy(), observers(observers));
    }

    @Bean
    @ConditionalOnMissingBean
    WorkerProcess workerProcess(ServiceLifecycle lifecycle,
                                ControlListener listener,
                                HeartbeatReporter reporter) {
        return new WorkerProcess(lifecycle, listener, reporter);
    }

    @Bean
    @ConditionalOnMissingBean
    WorkerProcessLifecycle workerProcessLifecycle(WorkerProcess process) {
        return new WorkerProcessLifecycle(process, properties.isAutoStartup());
    }

    private static List<LifecycleObserver> observers(ObjectProvider<LifecycleObserver> observers) {
        return observers.orderedStream().collect(Collectors.toList());
    }
}
