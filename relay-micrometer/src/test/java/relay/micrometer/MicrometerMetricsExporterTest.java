package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import relay.Batch;
import relay.EventRecord;
import relay.EventType;
import relay.circuit.CircuitBreaker;
import relay.circuit.CircuitState;
import relay.dispatch.DeliveryCoordinator;
import relay.retry.ExponentialBackoffRetryPolicy;
import relay.sink.FailureInjector;
import relay.sink.InMemoryDeliverySink;
import relay.sink.SinkError;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void submissionOutcomeCounters() {
    exporter.incrementDelivered();
    exporter.incrementDelivered();
    exporter.incrementDeferred();
    exporter.incrementRejected();

    assertEquals(2.0, counter("relay.submission.delivered").count());
    assertEquals(1.0, counter("relay.submission.deferred").count());
    assertEquals(1.0, counter("relay.submission.rejected").count());
  }

  @Test
  void sinkFailuresAreTaggedByError() {
    exporter.incrementSinkAttempt();
    exporter.incrementSinkFailure(SinkError.THROTTLED);
    exporter.incrementSinkFailure(SinkError.THROTTLED);
    exporter.incrementSinkFailure(SinkError.PERMANENT);

    assertEquals(1.0, counter("relay.sink.attempt").count());
    assertEquals(2.0, registry.get("relay.sink.failure").tag("error", "throttled").counter().count());
    assertEquals(0.0, registry.get("relay.sink.failure").tag("error", "transient").counter().count());
    assertEquals(1.0, registry.get("relay.sink.failure").tag("error", "permanent").counter().count());
  }

  @Test
  void deadLetterMeters() {
    exporter.incrementDeadLetterOverflow();
    exporter.incrementDeadLetterDropped();
    exporter.incrementDeadLetterReplayed();
    exporter.recordDeadLetterSize(17);

    assertEquals(1.0, counter("relay.deadletter.overflow").count());
    assertEquals(1.0, counter("relay.deadletter.dropped").count());
    assertEquals(1.0, counter("relay.deadletter.replayed").count());
    assertEquals(17.0, gauge("relay.deadletter.size").value());
  }

  @Test
  void circuitStateGaugeUsesStateCode() {
    exporter.recordCircuitState(CircuitState.OPEN);
    assertEquals(2.0, gauge("relay.circuit.state").value());

    exporter.recordCircuitState(CircuitState.HALF_OPEN);
    assertEquals(1.0, gauge("relay.circuit.state").value());

    exporter.recordCircuitState(CircuitState.CLOSED);
    assertEquals(0.0, gauge("relay.circuit.state").value());
  }

  @Test
  void queueDepthAndLatency() {
    exporter.recordQueueDepth(42);
    exporter.recordSinkLatencyMs(120);
    exporter.recordSinkLatencyMs(80);

    assertEquals(42.0, gauge("relay.dispatcher.queue.depth").value());
    Timer latency = registry.get("relay.sink.latency").timer();
    assertEquals(2, latency.count());
    assertEquals(200.0, latency.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "analytics.relay");
    custom.incrementDelivered();
    custom.recordDeadLetterSize(3);

    assertEquals(1.0, counter("analytics.relay.submission.delivered").count());
    assertEquals(3.0, gauge("analytics.relay.deadletter.size").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.close();
    exporter.incrementDelivered();

    assertNull(registry.find("relay.submission.delivered").counter());
    assertNull(registry.find("relay.sink.failure").counter());
    assertNull(registry.find("relay.circuit.state").gauge());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "relay."));
  }

  @Test
  void coordinatorReportsThroughExporter() {
    InMemoryDeliverySink sink = new InMemoryDeliverySink(FailureInjector.firstN(1, SinkError.TRANSIENT));
    try (DeliveryCoordinator coordinator = DeliveryCoordinator.builder()
        .sink(sink)
        .retryPolicy(new ExponentialBackoffRetryPolicy(1, 10, 3))
        .circuitBreaker(new CircuitBreaker(5, Duration.ofSeconds(30)))
        .metrics(exporter)
        .build()) {
      EventRecord record = EventRecord.builder(EventType.INSTALL).field("user_id", "u-1").build();
      coordinator.handle(Batch.single(record));
    }

    assertEquals(2.0, counter("relay.sink.attempt").count());
    assertEquals(1.0, registry.get("relay.sink.failure").tag("error", "transient").counter().count());
    assertEquals(1.0, counter("relay.submission.delivered").count());
    assertEquals(0.0, gauge("relay.circuit.state").value());
    assertEquals(2, registry.get("relay.sink.latency").timer().count());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
