package relay.spring.boot;

import relay.circuit.CircuitBreaker;
import relay.dead.DeadLetterBuffer;
import relay.dead.MetricsDeadLetterListener;
import relay.dispatch.DeliveryCoordinator;
import relay.dispatch.DeliveryDispatcher;
import relay.kafka.KafkaDeliverySink;
import relay.kafka.KafkaSinkConfig;
import relay.retry.ExponentialBackoffRetryPolicy;
import relay.retry.RetryPolicy;
import relay.sink.DeliverySink;
import relay.sink.InMemoryDeliverySink;
import relay.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.logging.Logger;

/**
 * Auto-configuration for event delivery.
 *
 * <p>Wires a {@link DeliveryCoordinator} around the sink selected by
 * {@code relay.sink.type}, plus a background {@link DeliveryDispatcher} unless
 * {@code relay.dispatcher.enabled=false}. Every bean backs off when the application
 * defines its own.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DeliveryCoordinator.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {
  private static final Logger logger = Logger.getLogger(RelayAutoConfiguration.class.getName());

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "relay.sink", name = "type", havingValue = "memory", matchIfMissing = true)
  static class MemorySinkConfiguration {

    @Bean
    @ConditionalOnMissingBean(DeliverySink.class)
    public InMemoryDeliverySink deliverySink() {
      logger.warning("Using the in-memory delivery sink; events are not published anywhere");
      return new InMemoryDeliverySink();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(KafkaDeliverySink.class)
  @ConditionalOnProperty(prefix = "relay.sink", name = "type", havingValue = "kafka")
  static class KafkaSinkConfiguration {

    @Bean
    @ConditionalOnMissingBean(DeliverySink.class)
    public KafkaDeliverySink deliverySink(RelayProperties props) {
      RelayProperties.Kafka kafka = props.getKafka();
      KafkaSinkConfig.Builder config = KafkaSinkConfig.builder()
          .bootstrapServers(kafka.getBootstrapServers())
          .topic(kafka.getTopic())
          .clientId(kafka.getClientId())
          .acks(kafka.getAcks())
          .lingerMs(kafka.getLingerMs())
          .requestTimeoutMs(kafka.getRequestTimeoutMs())
          .deliveryTimeoutMs(kafka.getDeliveryTimeoutMs())
          .compressionType(kafka.getCompressionType())
          .sendTimeout(kafka.getSendTimeout())
          .closeTimeout(kafka.getCloseTimeout())
          .source(kafka.getSource())
          .producerProperties(kafka.getProperties());
      return new KafkaDeliverySink(config.build());
    }
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy retryPolicy(RelayProperties props) {
    RelayProperties.Retry retry = props.getRetry();
    return new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(),
        retry.getMaxAttempts(), retry.getJitter(), null);
  }

  @Bean
  @ConditionalOnMissingBean
  public CircuitBreaker circuitBreaker(RelayProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    RelayProperties.CircuitBreaker cb = props.getCircuitBreaker();
    return new CircuitBreaker(cb.getFailureThreshold(), cb.getCoolDown(), Clock.systemUTC(),
        (from, to) -> metrics.recordCircuitState(to));
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterBuffer deadLetterBuffer(RelayProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    RelayProperties.DeadLetter dl = props.getDeadLetter();
    return new DeadLetterBuffer(dl.getCapacity(), dl.getMaxReplayAttempts(), Clock.systemUTC(),
        new MetricsDeadLetterListener(metrics));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DeliveryCoordinator deliveryCoordinator(RelayProperties props,
      DeliverySink deliverySink,
      RetryPolicy retryPolicy,
      CircuitBreaker circuitBreaker,
      DeadLetterBuffer deadLetterBuffer,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = DeliveryCoordinator.builder()
        .sink(deliverySink)
        .retryPolicy(retryPolicy)
        .circuitBreaker(circuitBreaker)
        .deadLetterBuffer(deadLetterBuffer)
        .maxBatchSize(props.getBatch().getMaxSize())
        .sinkTimeout(props.getBatch().getSinkTimeout())
        .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "relay.dispatcher", name = "enabled", matchIfMissing = true)
  public DeliveryDispatcher deliveryDispatcher(RelayProperties props,
      DeliveryCoordinator deliveryCoordinator,
      ObjectProvider<MetricsExporter> metricsProvider) {
    RelayProperties.Dispatcher d = props.getDispatcher();
    var builder = DeliveryDispatcher.builder()
        .coordinator(deliveryCoordinator)
        .workerCount(d.getWorkerCount())
        .queueCapacity(d.getQueueCapacity())
        .maxInFlight(d.getMaxInFlight())
        .drainTimeoutMs(d.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
