package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import relay.circuit.CircuitState;
import relay.sink.SinkError;
import relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.submission.delivered} / {@code .deferred} / {@code .rejected}: sub-batch outcomes</li>
 *   <li>{@code relay.sink.attempt}: sink invocations</li>
 *   <li>{@code relay.sink.failure}: failed invocations, tagged {@code error=throttled|transient|permanent}</li>
 *   <li>{@code relay.deadletter.overflow}: entries evicted because the buffer was full</li>
 *   <li>{@code relay.deadletter.dropped}: entries dropped after too many replays</li>
 *   <li>{@code relay.deadletter.replayed}: entries re-delivered by replay</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.deadletter.size}: entries waiting in the dead letter buffer</li>
 *   <li>{@code relay.circuit.state}: 0 closed, 1 half-open, 2 open</li>
 *   <li>{@code relay.dispatcher.queue.depth}: batches waiting in the dispatcher queue</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code relay.sink.latency}: duration of each sink invocation</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter delivered;
  private final Counter deferred;
  private final Counter rejected;
  private final Counter sinkAttempts;
  private final Map<SinkError, Counter> sinkFailures = new EnumMap<>(SinkError.class);
  private final Counter deadLetterOverflow;
  private final Counter deadLetterDropped;
  private final Counter deadLetterReplayed;
  private final Timer sinkLatency;
  private final Gauge deadLetterSizeGauge;
  private final Gauge circuitStateGauge;
  private final Gauge queueDepthGauge;

  private final AtomicInteger deadLetterSize = new AtomicInteger();
  private final AtomicInteger circuitState = new AtomicInteger();
  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "analytics.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.delivered = Counter.builder(namePrefix + ".submission.delivered")
        .description("Sub-batches accepted by the sink")
        .register(registry);
    this.deferred = Counter.builder(namePrefix + ".submission.deferred")
        .description("Sub-batches held in the dead letter buffer")
        .register(registry);
    this.rejected = Counter.builder(namePrefix + ".submission.rejected")
        .description("Sub-batches permanently refused by the sink")
        .register(registry);
    this.sinkAttempts = Counter.builder(namePrefix + ".sink.attempt")
        .description("Sink invocations")
        .register(registry);
    for (SinkError error : SinkError.values()) {
      sinkFailures.put(error, Counter.builder(namePrefix + ".sink.failure")
          .description("Failed sink invocations")
          .tag("error", error.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.deadLetterOverflow = Counter.builder(namePrefix + ".deadletter.overflow")
        .description("Dead letter entries evicted because the buffer was full")
        .register(registry);
    this.deadLetterDropped = Counter.builder(namePrefix + ".deadletter.dropped")
        .description("Dead letter entries dropped after exhausting replays")
        .register(registry);
    this.deadLetterReplayed = Counter.builder(namePrefix + ".deadletter.replayed")
        .description("Dead letter entries delivered by replay")
        .register(registry);
    this.sinkLatency = Timer.builder(namePrefix + ".sink.latency")
        .description("Duration of sink invocations")
        .register(registry);

    this.deadLetterSizeGauge = Gauge.builder(namePrefix + ".deadletter.size", deadLetterSize, AtomicInteger::get)
        .register(registry);
    this.circuitStateGauge = Gauge.builder(namePrefix + ".circuit.state", circuitState, AtomicInteger::get)
        .description("0 closed, 1 half-open, 2 open")
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".dispatcher.queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementDeferred() {
    if (closed) return;
    deferred.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementSinkAttempt() {
    if (closed) return;
    sinkAttempts.increment();
  }

  @Override
  public void incrementSinkFailure(SinkError error) {
    if (closed) return;
    sinkFailures.get(Objects.requireNonNull(error, "error")).increment();
  }

  @Override
  public void incrementDeadLetterOverflow() {
    if (closed) return;
    deadLetterOverflow.increment();
  }

  @Override
  public void incrementDeadLetterDropped() {
    if (closed) return;
    deadLetterDropped.increment();
  }

  @Override
  public void incrementDeadLetterReplayed() {
    if (closed) return;
    deadLetterReplayed.increment();
  }

  @Override
  public void recordDeadLetterSize(int size) {
    if (closed) return;
    deadLetterSize.set(size);
  }

  @Override
  public void recordCircuitState(CircuitState state) {
    if (closed) return;
    circuitState.set(state.code());
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordSinkLatencyMs(long latencyMs) {
    if (closed) return;
    sinkLatency.record(latencyMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the coordinator is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(delivered, deferred, rejected, sinkAttempts,
        deadLetterOverflow, deadLetterDropped, deadLetterReplayed, sinkLatency,
        deadLetterSizeGauge, circuitStateGauge, queueDepthGauge));
    meters.addAll(sinkFailures.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
