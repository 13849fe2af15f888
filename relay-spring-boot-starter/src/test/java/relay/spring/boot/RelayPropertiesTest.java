package relay.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(RelayProperties.class);
            assertEquals(RelayProperties.SinkType.MEMORY, props.getSink().getType());
            assertNull(props.getKafka().getBootstrapServers());
            assertEquals("all", props.getKafka().getAcks());
            assertEquals("game_analytics_api", props.getKafka().getSource());
            assertEquals(500, props.getBatch().getMaxSize());
            assertEquals(Duration.ofSeconds(30), props.getBatch().getSinkTimeout());
            assertEquals(100, props.getRetry().getBaseDelayMs());
            assertEquals(10000, props.getRetry().getMaxDelayMs());
            assertEquals(3, props.getRetry().getMaxAttempts());
            assertEquals(0.2, props.getRetry().getJitter());
            assertEquals(5, props.getCircuitBreaker().getFailureThreshold());
            assertEquals(Duration.ofSeconds(30), props.getCircuitBreaker().getCoolDown());
            assertEquals(10000, props.getDeadLetter().getCapacity());
            assertEquals(3, props.getDeadLetter().getMaxReplayAttempts());
            assertTrue(props.getDispatcher().isEnabled());
            assertEquals(2, props.getDispatcher().getWorkerCount());
            assertEquals(64, props.getDispatcher().getMaxInFlight());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("relay", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "relay.sink.type=kafka",
                "relay.kafka.bootstrap-servers=broker:9092",
                "relay.kafka.topic=game-events",
                "relay.kafka.send-timeout=10s",
                "relay.kafka.properties.security.protocol=SSL",
                "relay.batch.max-size=250",
                "relay.retry.max-attempts=5",
                "relay.circuit-breaker.failure-threshold=2",
                "relay.circuit-breaker.cool-down=1m",
                "relay.dead-letter.capacity=50",
                "relay.dispatcher.enabled=false",
                "relay.metrics.name-prefix=analytics.relay"
        ).run(ctx -> {
            var props = ctx.getBean(RelayProperties.class);
            assertEquals(RelayProperties.SinkType.KAFKA, props.getSink().getType());
            assertEquals("broker:9092", props.getKafka().getBootstrapServers());
            assertEquals("game-events", props.getKafka().getTopic());
            assertEquals(Duration.ofSeconds(10), props.getKafka().getSendTimeout());
            assertEquals("SSL", props.getKafka().getProperties().get("security.protocol"));
            assertEquals(250, props.getBatch().getMaxSize());
            assertEquals(5, props.getRetry().getMaxAttempts());
            assertEquals(2, props.getCircuitBreaker().getFailureThreshold());
            assertEquals(Duration.ofMinutes(1), props.getCircuitBreaker().getCoolDown());
            assertEquals(50, props.getDeadLetter().getCapacity());
            assertFalse(props.getDispatcher().isEnabled());
            assertEquals("analytics.relay", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(RelayProperties.class)
    static class PropsConfig {
    }
}
