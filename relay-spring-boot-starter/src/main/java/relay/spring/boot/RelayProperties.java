package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for event delivery.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private final Sink sink = new Sink();
    private final Kafka kafka = new Kafka();
    private final Batch batch = new Batch();
    private final Retry retry = new Retry();
    private final CircuitBreaker circuitBreaker = new CircuitBreaker();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Dispatcher dispatcher = new Dispatcher();
    private final Metrics metrics = new Metrics();

    public Sink getSink() {
        return sink;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Batch getBatch() {
        return batch;
    }

    public Retry getRetry() {
        return retry;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum SinkType {
        /** In-process sink that keeps every accepted batch in memory. */
        MEMORY,
        /** Apache Kafka topic; requires {@code relay-kafka} on the classpath. */
        KAFKA
    }

    public static class Sink {
        /**
         * Which sink receives batches.
         */
        private SinkType type = SinkType.MEMORY;

        public SinkType getType() {
            return type;
        }

        public void setType(SinkType type) {
            this.type = type;
        }
    }

    public static class Kafka {
        private String bootstrapServers;
        private String topic;
        private String clientId = "relay";
        private String acks = "all";
        private int lingerMs = 5;
        private int requestTimeoutMs = 30000;
        private int deliveryTimeoutMs = 120000;
        private String compressionType;
        private Duration sendTimeout = Duration.ofSeconds(30);
        private Duration closeTimeout = Duration.ofSeconds(5);
        private String source = "game_analytics_api";

        /**
         * Extra producer properties passed through unchanged, e.g. security settings.
         */
        private Map<String, String> properties = new LinkedHashMap<>();

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getAcks() {
            return acks;
        }

        public void setAcks(String acks) {
            this.acks = acks;
        }

        public int getLingerMs() {
            return lingerMs;
        }

        public void setLingerMs(int lingerMs) {
            this.lingerMs = lingerMs;
        }

        public int getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(int requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }

        public int getDeliveryTimeoutMs() {
            return deliveryTimeoutMs;
        }

        public void setDeliveryTimeoutMs(int deliveryTimeoutMs) {
            this.deliveryTimeoutMs = deliveryTimeoutMs;
        }

        public String getCompressionType() {
            return compressionType;
        }

        public void setCompressionType(String compressionType) {
            this.compressionType = compressionType;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public Duration getCloseTimeout() {
            return closeTimeout;
        }

        public void setCloseTimeout(Duration closeTimeout) {
            this.closeTimeout = closeTimeout;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public Map<String, String> getProperties() {
            return properties;
        }

        public void setProperties(Map<String, String> properties) {
            this.properties = properties;
        }
    }

    public static class Batch {
        /**
         * Largest number of records sent in one sink call; larger batches are split.
         */
        private int maxSize = 500;

        /**
         * Upper bound on a single sink call before it counts as a transient failure.
         */
        private Duration sinkTimeout = Duration.ofSeconds(30);

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getSinkTimeout() {
            return sinkTimeout;
        }

        public void setSinkTimeout(Duration sinkTimeout) {
            this.sinkTimeout = sinkTimeout;
        }
    }

    public static class Retry {
        private long baseDelayMs = 100;
        private long maxDelayMs = 10000;
        private int maxAttempts = 3;
        private double jitter = 0.2;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getCoolDown() {
            return coolDown;
        }

        public void setCoolDown(Duration coolDown) {
            this.coolDown = coolDown;
        }
    }

    public static class DeadLetter {
        private int capacity = 10000;
        private int maxReplayAttempts = 3;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getMaxReplayAttempts() {
            return maxReplayAttempts;
        }

        public void setMaxReplayAttempts(int maxReplayAttempts) {
            this.maxReplayAttempts = maxReplayAttempts;
        }
    }

    public static class Dispatcher {
        /**
         * Whether to create a background {@code DeliveryDispatcher}.
         */
        private boolean enabled = true;
        private int workerCount = 2;
        private int queueCapacity = 1000;
        private int maxInFlight = 64;
        private long drainTimeoutMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
