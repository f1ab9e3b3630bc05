package com.intteq.reliable.subscriber;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.subscriber.context.CorrelationContextBuilder;
import com.intteq.reliable.subscriber.context.CorrelationContextProvider;
import com.intteq.reliable.subscriber.context.HeaderCorrelationContextProvider;
import com.intteq.reliable.subscriber.conventions.AnnotationConventionsProvider;
import com.intteq.reliable.subscriber.conventions.ConventionsProvider;
import com.intteq.reliable.subscriber.internal.ListenerRegistrar;
import com.intteq.reliable.subscriber.internal.RabbitBusSubscriber;
import com.intteq.reliable.subscriber.internal.SubscriberExecutors;
import com.intteq.reliable.subscriber.internal.SubscriberHealthIndicator;
import com.intteq.reliable.subscriber.internal.SubscriptionRegistry;
import com.intteq.reliable.subscriber.plugin.MessagingPlugin;
import com.intteq.reliable.subscriber.plugin.MetricsPlugin;
import com.intteq.reliable.subscriber.plugin.PluginPipeline;
import com.intteq.reliable.subscriber.processing.ExceptionToMessageMapper;
import com.intteq.reliable.subscriber.publisher.BusPublisher;
import com.intteq.reliable.subscriber.publisher.RabbitBusPublisher;
import com.intteq.reliable.subscriber.rabbitmq.ConsumerConnection;
import com.intteq.reliable.subscriber.rabbitmq.RabbitMQConfig;
import com.intteq.reliable.subscriber.rabbitmq.TopologyProvisioner;
import com.intteq.reliable.subscriber.serialization.JacksonMessageSerializer;
import com.intteq.reliable.subscriber.serialization.MessageSerializer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.lang.Nullable;

import java.util.stream.Collectors;

/**
 * Auto-configuration for the reliable subscriber.
 *
 * <p>Enabled by default and can be disabled by setting:
 *
 * <pre>
 *   messaging.rabbitmq.enabled = false
 * </pre>
 *
 * <p>Every collaborator of the subscriber (conventions, serializer, context provider, exception
 * mapper, publisher) backs off when the application defines its own bean. {@link MessagingPlugin}
 * beans are picked up in {@link org.springframework.core.annotation.Order} order. The
 * {@link MeterRegistry} is optional; metrics go to an in-memory registry when it is absent.
 */
@AutoConfiguration(before = RabbitAutoConfiguration.class)
@EnableConfigurationProperties({MessagingProperties.class, RabbitProperties.class})
@ConditionalOnProperty(prefix = "messaging.rabbitmq", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(RabbitMQConfig.class)
public class MessagingAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ConventionsProvider conventionsProvider(MessagingProperties props) {
        return new AnnotationConventionsProvider(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageSerializer messageSerializer(@Nullable ObjectMapper objectMapper) {
        return new JacksonMessageSerializer(objectMapper != null ? objectMapper : new ObjectMapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrelationContextProvider correlationContextProvider(@Nullable ObjectMapper objectMapper) {
        return new HeaderCorrelationContextProvider(objectMapper != null ? objectMapper : new ObjectMapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExceptionToMessageMapper exceptionToMessageMapper() {
        return ExceptionToMessageMapper.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public BusPublisher busPublisher(RabbitTemplate rabbitTemplate,
                                     ConventionsProvider conventionsProvider,
                                     @Nullable ObjectMapper objectMapper,
                                     @Nullable MeterRegistry meterRegistry) {
        return new RabbitBusPublisher(
                rabbitTemplate,
                conventionsProvider,
                objectMapper != null ? objectMapper : new ObjectMapper(),
                meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
    }

    @Bean
    public MetricsPlugin metricsPlugin(@Nullable MeterRegistry meterRegistry) {
        return new MetricsPlugin(meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
    }

    @Bean(destroyMethod = "close")
    public SubscriberExecutors subscriberExecutors() {
        return new SubscriberExecutors();
    }

    @Bean
    public SubscriptionRegistry subscriptionRegistry() {
        return new SubscriptionRegistry();
    }

    @Bean
    public TopologyProvisioner topologyProvisioner(MessagingProperties props) {
        return new TopologyProvisioner(props);
    }

    /**
     * The subscriber closes its channels and the consumer connection on shutdown.
     */
    @Bean(destroyMethod = "close")
    public RabbitBusSubscriber busSubscriber(ConsumerConnection consumerConnection,
                                             SubscriptionRegistry registry,
                                             ConventionsProvider conventionsProvider,
                                             TopologyProvisioner topologyProvisioner,
                                             MessageSerializer serializer,
                                             CorrelationContextProvider contextProvider,
                                             ObjectProvider<MessagingPlugin> plugins,
                                             ExceptionToMessageMapper exceptionMapper,
                                             BusPublisher publisher,
                                             SubscriberExecutors executors,
                                             MessagingProperties props) {
        return RabbitBusSubscriber.builder()
                .connection(consumerConnection.getConnection())
                .registry(registry)
                .conventionsProvider(conventionsProvider)
                .topologyProvisioner(topologyProvisioner)
                .serializer(serializer)
                .contextBuilder(new CorrelationContextBuilder(contextProvider))
                .pluginPipeline(new PluginPipeline(plugins.orderedStream().collect(Collectors.toList())))
                .exceptionMapper(exceptionMapper)
                .publisher(publisher)
                .scheduler(executors.getScheduler())
                .properties(props)
                .build();
    }

    @Bean
    public ListenerRegistrar listenerRegistrar(ApplicationContext ctx,
                                               RabbitBusSubscriber busSubscriber,
                                               SubscriberExecutors executors) {
        return new ListenerRegistrar(ctx, busSubscriber, executors.getHandlerExecutor());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class SubscriberHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "reliableSubscriberHealthIndicator")
        public SubscriberHealthIndicator reliableSubscriberHealthIndicator(RabbitBusSubscriber busSubscriber,
                                                                          SubscriptionRegistry registry) {
            return new SubscriberHealthIndicator(busSubscriber, registry);
        }
    }
}
