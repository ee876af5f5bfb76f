package com.intteq.reliable.rabbit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.rabbit.ReliableRabbitProperties.ConsumerConfig;
import com.intteq.reliable.rabbit.ReliableRabbitProperties.PublisherConfig;
import com.intteq.reliable.rabbit.ReliableRabbitProperties.QuarantineConfig;
import com.intteq.reliable.rabbit.connection.BrokerConnector;
import com.intteq.reliable.rabbit.connection.UriBrokerConnector;
import com.intteq.reliable.rabbit.consumer.MessageProcessor;
import com.intteq.reliable.rabbit.consumer.ReliableConsumer;
import com.intteq.reliable.rabbit.internal.ReliableConsumerLifecycle;
import com.intteq.reliable.rabbit.publisher.FailoverPublisher;
import com.intteq.reliable.rabbit.publisher.PublishTarget;
import com.intteq.reliable.rabbit.publisher.QuarantinePublisher;
import com.rabbitmq.client.ConnectionFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.lang.Nullable;

/**
 * Auto-configuration for the reliable RabbitMQ consumer and publishers.
 *
 * <p>It is enabled by default and can be disabled by setting:
 *
 * <pre>
 *   reliable.rabbit.enabled = false
 * </pre>
 *
 * <p>Beans:
 * <ul>
 *     <li>{@link BrokerConnector}: always, unless the application defines one</li>
 *     <li>{@code quarantinePublisher} (a {@link QuarantinePublisher}, never a
 *     {@link FailoverPublisher} bean) and {@link ReliableConsumer}: when
 *     {@code reliable.rabbit.consumer.queue} is set and a {@link MessageProcessor}
 *     bean exists</li>
 *     <li>{@code failoverPublisher}: when {@code reliable.rabbit.publisher.queue} or
 *     {@code reliable.rabbit.publisher.exchange} is set</li>
 * </ul>
 *
 * <p>The application's {@link ObjectMapper} and {@link MeterRegistry} are used when
 * present. Metrics are skipped without a registry.
 */
@AutoConfiguration
@ConditionalOnClass(ConnectionFactory.class)
@EnableConfigurationProperties(ReliableRabbitProperties.class)
@ConditionalOnProperty(prefix = "reliable.rabbit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReliableRabbitAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnector brokerConnector(ReliableRabbitProperties props) {
        ReliableRabbitProperties.ConnectionConfig connection = props.getConnection();
        return new UriBrokerConnector(
                connection.getConnectionTimeout(),
                connection.getRequestedHeartbeat(),
                connection.getName()
        );
    }

    // ========================================================================
    // Consumer
    // ========================================================================

    @Bean
    @ConditionalOnMissingBean(name = "quarantinePublisher")
    @ConditionalOnProperty(prefix = "reliable.rabbit.consumer", name = "queue")
    public QuarantinePublisher quarantinePublisher(
            ReliableRabbitProperties props,
            BrokerConnector connector,
            @Nullable ObjectMapper objectMapper,
            @Nullable MeterRegistry meterRegistry) {

        QuarantineConfig quarantine = props.getQuarantine();
        String queue = quarantine.resolveQueue(props.getConsumer().getQueue());

        return new QuarantinePublisher(FailoverPublisher.builder()
                .urls(props.getUrls())
                .target(PublishTarget.queue(queue, quarantine.isDurable()))
                .connector(connector)
                .arguments(ReliableRabbitProperties.declarationArguments(quarantine.getArguments()))
                .confirmDelivery(quarantine.isConfirmDelivery())
                .confirmTimeout(quarantine.getConfirmTimeout())
                .objectMapper(objectMapper)
                .meterRegistry(meterRegistry)
                .build());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MessageProcessor.class)
    @ConditionalOnProperty(prefix = "reliable.rabbit.consumer", name = "queue")
    public ReliableConsumer reliableConsumer(
            ReliableRabbitProperties props,
            BrokerConnector connector,
            MessageProcessor processor,
            @Qualifier("quarantinePublisher") QuarantineSink quarantinePublisher,
            @Nullable MeterRegistry meterRegistry) {

        ConsumerConfig consumer = props.getConsumer();
        return ReliableConsumer.builder()
                .settings(consumer.toSettings(props.getUrls()))
                .connector(connector)
                .quarantine(quarantinePublisher)
                .processor(processor)
                .checkTxId(consumer.isCheckTxId())
                .meterRegistry(meterRegistry)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MessageProcessor.class)
    @ConditionalOnProperty(prefix = "reliable.rabbit.consumer", name = "queue")
    public ReliableConsumerLifecycle reliableConsumerLifecycle(ReliableRabbitProperties props,
                                                               ReliableConsumer consumer) {
        return new ReliableConsumerLifecycle(consumer, props.getConsumer().isAutoStartup());
    }

    // ========================================================================
    // Application publisher
    // ========================================================================

    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "failoverPublisher")
    @ConditionalOnExpression("'${reliable.rabbit.publisher.queue:}' != '' or '${reliable.rabbit.publisher.exchange:}' != ''")
    public FailoverPublisher failoverPublisher(
            ReliableRabbitProperties props,
            BrokerConnector connector,
            @Nullable ObjectMapper objectMapper,
            @Nullable MeterRegistry meterRegistry) {

        PublisherConfig publisher = props.getPublisher();
        return FailoverPublisher.builder()
                .urls(props.getUrls())
                .target(publisher.toTarget())
                .connector(connector)
                .arguments(ReliableRabbitProperties.declarationArguments(publisher.getArguments()))
                .confirmDelivery(publisher.isConfirmDelivery())
                .confirmTimeout(publisher.getConfirmTimeout())
                .objectMapper(objectMapper)
                .meterRegistry(meterRegistry)
                .build();
    }
}
