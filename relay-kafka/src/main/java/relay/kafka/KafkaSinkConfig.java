package relay.kafka;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection and timing settings for {@link KafkaDeliverySink}.
 *
 * <p>Producer-level retries are left to Kafka's own defaults; the delivery coordinator's
 * retry policy sits above them and sees only the final result of each send.
 */
public final class KafkaSinkConfig {
  private final String bootstrapServers;
  private final String topic;
  private final String clientId;
  private final String acks;
  private final int lingerMs;
  private final int requestTimeoutMs;
  private final int deliveryTimeoutMs;
  private final String compressionType;
  private final Duration sendTimeout;
  private final Duration closeTimeout;
  private final String source;
  private final Map<String, String> producerProperties;

  private KafkaSinkConfig(Builder builder) {
    this.bootstrapServers = requireNotBlank(builder.bootstrapServers, "bootstrapServers");
    this.topic = requireNotBlank(builder.topic, "topic");
    this.clientId = requireNotBlank(builder.clientId, "clientId");
    this.acks = requireNotBlank(builder.acks, "acks");
    this.source = requireNotBlank(builder.source, "source");
    if (builder.lingerMs < 0) {
      throw new IllegalArgumentException("lingerMs must be >= 0, got: " + builder.lingerMs);
    }
    if (builder.requestTimeoutMs <= 0) {
      throw new IllegalArgumentException("requestTimeoutMs must be > 0, got: " + builder.requestTimeoutMs);
    }
    if (builder.deliveryTimeoutMs < builder.lingerMs + builder.requestTimeoutMs) {
      throw new IllegalArgumentException(
          "deliveryTimeoutMs must be >= lingerMs + requestTimeoutMs, got: " + builder.deliveryTimeoutMs);
    }
    this.lingerMs = builder.lingerMs;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.deliveryTimeoutMs = builder.deliveryTimeoutMs;
    this.compressionType = builder.compressionType;
    this.sendTimeout = requirePositive(builder.sendTimeout, "sendTimeout");
    this.closeTimeout = requirePositive(builder.closeTimeout, "closeTimeout");
    this.producerProperties = Map.copyOf(builder.producerProperties);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String bootstrapServers() {
    return bootstrapServers;
  }

  public String topic() {
    return topic;
  }

  public String clientId() {
    return clientId;
  }

  public String acks() {
    return acks;
  }

  public int lingerMs() {
    return lingerMs;
  }

  public int requestTimeoutMs() {
    return requestTimeoutMs;
  }

  public int deliveryTimeoutMs() {
    return deliveryTimeoutMs;
  }

  public String compressionType() {
    return compressionType;
  }

  /**
   * Returns how long one {@link KafkaDeliverySink#submit} call waits for every record of the
   * batch to be acknowledged.
   *
   * @return the send timeout
   */
  public Duration sendTimeout() {
    return sendTimeout;
  }

  public Duration closeTimeout() {
    return closeTimeout;
  }

  /**
   * Returns the value written to each message's {@code source} field.
   *
   * @return the source label
   */
  public String source() {
    return source;
  }

  public Map<String, String> producerProperties() {
    return producerProperties;
  }

  /**
   * Builds the producer configuration. Extra producer properties are applied last and
   * override the typed settings, except the key and value serializers.
   *
   * @return properties for a {@code KafkaProducer<String, byte[]>}
   */
  public Properties toProducerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
    props.put(ProducerConfig.ACKS_CONFIG, acks);
    props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(lingerMs));
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Integer.toString(requestTimeoutMs));
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Integer.toString(deliveryTimeoutMs));
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, Long.toString(sendTimeout.toMillis()));
    if (compressionType != null && !compressionType.isBlank()) {
      props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, compressionType);
    }
    props.putAll(producerProperties);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return props;
  }

  private static String requireNotBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed;
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive, got: " + value);
    }
    return value;
  }

  /** Builder for {@link KafkaSinkConfig}. */
  public static final class Builder {
    private String bootstrapServers;
    private String topic;
    private String clientId = "relay";
    private String acks = "all";
    private int lingerMs = 5;
    private int requestTimeoutMs = 30_000;
    private int deliveryTimeoutMs = 120_000;
    private String compressionType;
    private Duration sendTimeout = Duration.ofSeconds(30);
    private Duration closeTimeout = Duration.ofSeconds(5);
    private String source = EventRecordEncoder.DEFAULT_SOURCE;
    private final Map<String, String> producerProperties = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Comma-separated Kafka bootstrap servers.
     *
     * <p><b>Required.</b>
     *
     * @param bootstrapServers the bootstrap servers
     * @return this builder
     */
    public Builder bootstrapServers(String bootstrapServers) {
      this.bootstrapServers = bootstrapServers;
      return this;
    }

    /**
     * Topic that receives the events.
     *
     * <p><b>Required.</b>
     *
     * @param topic the topic name
     * @return this builder
     */
    public Builder topic(String topic) {
      this.topic = topic;
      return this;
    }

    /**
     * Optional. Defaults to {@code "relay"}.
     *
     * @param clientId the Kafka client id
     * @return this builder
     */
    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    /**
     * Optional. Defaults to {@code "all"}.
     *
     * @param acks the producer acknowledgement mode
     * @return this builder
     */
    public Builder acks(String acks) {
      this.acks = acks;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5}.
     *
     * @param lingerMs producer linger in milliseconds
     * @return this builder
     */
    public Builder lingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
      return this;
    }

    /**
     * Optional. Defaults to {@code 30000}.
     *
     * @param requestTimeoutMs producer request timeout in milliseconds
     * @return this builder
     */
    public Builder requestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to {@code 120000}. Must be at least {@code lingerMs + requestTimeoutMs}.
     *
     * @param deliveryTimeoutMs producer delivery timeout in milliseconds
     * @return this builder
     */
    public Builder deliveryTimeoutMs(int deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
      return this;
    }

    /**
     * Optional. Defaults to the producer's own default (no compression).
     *
     * @param compressionType e.g. {@code "lz4"}, {@code "zstd"}
     * @return this builder
     */
    public Builder compressionType(String compressionType) {
      this.compressionType = compressionType;
      return this;
    }

    /**
     * Maximum time a batch submission waits for acknowledgements. Also bounds how long the
     * producer may block on metadata or a full buffer.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param sendTimeout the send timeout
     * @return this builder
     */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    /**
     * Optional. Defaults to 5 seconds.
     *
     * @param closeTimeout time to wait for pending sends when the sink closes
     * @return this builder
     */
    public Builder closeTimeout(Duration closeTimeout) {
      this.closeTimeout = closeTimeout;
      return this;
    }

    /**
     * Optional. Defaults to {@code "game_analytics_api"}.
     *
     * @param source value of the {@code source} field added to every message
     * @return this builder
     */
    public Builder source(String source) {
      this.source = source;
      return this;
    }

    /**
     * Adds a raw producer property, e.g. security settings.
     *
     * @param key   a {@link ProducerConfig} key
     * @param value the value
     * @return this builder
     */
    public Builder producerProperty(String key, String value) {
      producerProperties.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /**
     * Adds raw producer properties.
     *
     * @param properties the properties to add
     * @return this builder
     */
    public Builder producerProperties(Map<String, String> properties) {
      Objects.requireNonNull(properties, "properties").forEach(this::producerProperty);
      return this;
    }

    /**
     * @return a new {@link KafkaSinkConfig}
     * @throws NullPointerException if {@code bootstrapServers} or {@code topic} is null
     * @throws IllegalArgumentException if a value is blank or out of range
     */
    public KafkaSinkConfig build() {
      return new KafkaSinkConfig(this);
    }
  }
}
