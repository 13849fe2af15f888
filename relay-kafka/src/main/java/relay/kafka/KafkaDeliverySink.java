package relay.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import relay.Batch;
import relay.EventRecord;
import relay.sink.DeliverySink;
import relay.sink.SinkError;
import relay.sink.SinkException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DeliverySink} that publishes each record as one Kafka message.
 *
 * <p>Messages are keyed by {@code eventId} and carry the JSON produced by
 * {@link EventRecordEncoder}. A batch is accepted once every message has been acknowledged.
 * The first failed acknowledgement fails the whole batch, although earlier messages of that
 * batch may already be written; a retry sends them again, so consumers see at-least-once
 * delivery and should de-duplicate on the message key.
 *
 * <p>Thread-safe: {@link KafkaProducer} is shared by concurrent submissions.
 */
public final class KafkaDeliverySink implements DeliverySink {
  private static final Logger logger = Logger.getLogger(KafkaDeliverySink.class.getName());

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final EventRecordEncoder encoder;
  private final Duration sendTimeout;
  private final Duration closeTimeout;
  private final Clock clock;

  public KafkaDeliverySink(KafkaSinkConfig config) {
    this(new KafkaProducer<>(config.toProducerProperties()), config, Clock.systemUTC());
  }

  /**
   * Creates a sink over an existing producer. The sink takes ownership and closes it.
   *
   * @param producer the producer
   * @param config   topic, timeouts and source label
   * @param clock    source of {@code ingestion_timestamp}
   */
  public KafkaDeliverySink(Producer<String, byte[]> producer, KafkaSinkConfig config, Clock clock) {
    this.producer = Objects.requireNonNull(producer, "producer");
    Objects.requireNonNull(config, "config");
    this.topic = config.topic();
    this.encoder = new EventRecordEncoder(config.source());
    this.sendTimeout = config.sendTimeout();
    this.closeTimeout = config.closeTimeout();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void submit(Batch batch) throws SinkException {
    Objects.requireNonNull(batch, "batch");
    List<ProducerRecord<String, byte[]>> messages = encode(batch);

    long deadline = System.nanoTime() + sendTimeout.toNanos();
    List<Future<RecordMetadata>> acks = new ArrayList<>(messages.size());
    try {
      for (ProducerRecord<String, byte[]> message : messages) {
        acks.add(producer.send(message));
      }
    } catch (KafkaException e) {
      throw KafkaErrorClassifier.toSinkException(e, "send to " + topic + " failed");
    }

    for (Future<RecordMetadata> ack : acks) {
      long remainingNanos = Math.max(0L, deadline - System.nanoTime());
      try {
        ack.get(remainingNanos, TimeUnit.NANOSECONDS);
      } catch (ExecutionException e) {
        throw KafkaErrorClassifier.toSinkException(e, "publish to " + topic + " failed");
      } catch (TimeoutException e) {
        throw new SinkException(SinkError.TRANSIENT,
            "no acknowledgement from " + topic + " within " + sendTimeout.toMillis() + "ms", e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SinkException(SinkError.TRANSIENT, "interrupted waiting for " + topic, e);
      }
    }
    logger.log(Level.FINE, "Published {0} record(s) to {1}", new Object[]{batch.size(), topic});
  }

  private List<ProducerRecord<String, byte[]>> encode(Batch batch) throws SinkException {
    Instant ingestedAt = clock.instant();
    List<ProducerRecord<String, byte[]>> messages = new ArrayList<>(batch.size());
    for (EventRecord record : batch) {
      try {
        messages.add(new ProducerRecord<>(topic, record.eventId(), encoder.encode(record, ingestedAt)));
      } catch (JsonProcessingException e) {
        throw new SinkException(SinkError.PERMANENT,
            "cannot encode event " + record.eventId() + ": " + e.getOriginalMessage(), e);
      }
    }
    return messages;
  }

  /**
   * Probes the topic's partition metadata.
   *
   * @return {@code true} if the topic has at least one partition
   */
  @Override
  public boolean isHealthy() {
    try {
      List<PartitionInfo> partitions = producer.partitionsFor(topic);
      return partitions != null && !partitions.isEmpty();
    } catch (KafkaException e) {
      logger.log(Level.WARNING, "Health check for topic " + topic + " failed", e);
      return false;
    }
  }

  @Override
  public String name() {
    return "kafka:" + topic;
  }

  public String topic() {
    return topic;
  }

  /** Flushes pending sends and closes the producer. */
  @Override
  public void close() {
    try {
      producer.flush();
    } catch (KafkaException e) {
      logger.log(Level.WARNING, "Flush before close failed for topic " + topic, e);
    }
    producer.close(closeTimeout);
  }
}
