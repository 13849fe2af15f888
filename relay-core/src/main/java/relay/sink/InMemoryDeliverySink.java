package relay.sink;

import relay.Batch;
import relay.EventRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link DeliverySink} for tests and local development.
 *
 * <p>Every call is appended to {@link #invocations()}; accepted batches are also appended
 * to {@link #delivered()}. Failures come from a {@link FailureInjector}, which can be
 * swapped at runtime. An optional latency simulates a slow destination.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryDeliverySink implements DeliverySink {
  private static final Logger logger = Logger.getLogger(InMemoryDeliverySink.class.getName());

  private final List<Batch> invocations = new CopyOnWriteArrayList<>();
  private final List<Batch> delivered = new CopyOnWriteArrayList<>();
  private final AtomicInteger invocationCount = new AtomicInteger();
  private volatile FailureInjector failureInjector;
  private volatile Duration latency = Duration.ZERO;
  private volatile boolean healthy = true;

  public InMemoryDeliverySink() {
    this(FailureInjector.never());
  }

  public InMemoryDeliverySink(FailureInjector failureInjector) {
    this.failureInjector = Objects.requireNonNull(failureInjector, "failureInjector");
  }

  @Override
  public void submit(Batch batch) throws SinkException {
    Objects.requireNonNull(batch, "batch");
    int invocation = invocationCount.incrementAndGet();
    invocations.add(batch);

    Duration delay = latency;
    if (!delay.isZero()) {
      try {
        Thread.sleep(delay.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SinkException(SinkError.TRANSIENT, "interrupted while submitting", e);
      }
    }

    SinkError failure = failureInjector.failureFor(invocation, batch);
    if (failure != null) {
      logger.fine("Injected " + failure + " on invocation " + invocation + " for " + batch);
      throw new SinkException(failure, "injected failure on invocation " + invocation);
    }
    delivered.add(batch);
    logger.log(Level.FINE, "Accepted {0} record(s) starting at {1}",
        new Object[]{batch.size(), batch.firstEventId()});
  }

  @Override
  public boolean isHealthy() {
    return healthy;
  }

  @Override
  public String name() {
    return "in-memory";
  }

  public void setFailureInjector(FailureInjector failureInjector) {
    this.failureInjector = Objects.requireNonNull(failureInjector, "failureInjector");
  }

  /**
   * Sets the time each call spends before answering.
   *
   * @param latency simulated latency; zero disables it
   */
  public void setLatency(Duration latency) {
    Objects.requireNonNull(latency, "latency");
    if (latency.isNegative()) {
      throw new IllegalArgumentException("latency must not be negative");
    }
    this.latency = latency;
  }

  public void setHealthy(boolean healthy) {
    this.healthy = healthy;
  }

  /**
   * Returns every batch passed to {@link #submit}, failed calls included, in call order.
   *
   * @return snapshot of invocations
   */
  public List<Batch> invocations() {
    return List.copyOf(invocations);
  }

  public int invocationCount() {
    return invocationCount.get();
  }

  /**
   * Returns the batches the sink accepted, in acceptance order.
   *
   * @return snapshot of accepted batches
   */
  public List<Batch> delivered() {
    return List.copyOf(delivered);
  }

  /**
   * Returns the records of all accepted batches, flattened in acceptance order.
   *
   * @return accepted records
   */
  public List<EventRecord> deliveredRecords() {
    List<EventRecord> records = new ArrayList<>();
    for (Batch batch : delivered) {
      records.addAll(batch.records());
    }
    return records;
  }

  /**
   * Clears the invocation log, the accepted log and the invocation counter.
   */
  public void reset() {
    invocations.clear();
    delivered.clear();
    invocationCount.set(0);
  }
}
