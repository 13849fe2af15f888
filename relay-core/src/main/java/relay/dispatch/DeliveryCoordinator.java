package relay.dispatch;

import relay.Batch;
import relay.DeliveryStatus;
import relay.SubmissionOutcome;
import relay.SubmissionOutcome.DeferReason;
import relay.circuit.CircuitBreaker;
import relay.circuit.CircuitBreaker.Permit;
import relay.circuit.CircuitState;
import relay.dead.DeadLetterBuffer;
import relay.dead.MetricsDeadLetterListener;
import relay.dead.ReplaySession;
import relay.retry.ExponentialBackoffRetryPolicy;
import relay.retry.RetryDecision;
import relay.retry.RetryPolicy;
import relay.sink.DeliverySink;
import relay.sink.SinkError;
import relay.sink.SinkException;
import relay.spi.MetricsExporter;
import relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers one batch end-to-end under the retry policy and circuit breaker.
 *
 * <p>A batch larger than {@code maxBatchSize} is split into ordered sub-batches that are
 * delivered one after another. For each sub-batch the circuit breaker is consulted once:
 * <ul>
 *   <li>open: the sub-batch is deferred to the dead letter buffer without calling the sink;</li>
 *   <li>closed: the sink is called, and each retryable failure is followed by a
 *       time-based wait chosen by the {@link RetryPolicy} until it gives up;</li>
 *   <li>half-open: this submission holds the single probe and gets exactly one call.</li>
 * </ul>
 * Every sink result is reported to the circuit breaker. {@link SinkError#PERMANENT} failures
 * resolve to {@link SubmissionOutcome.Rejected} and are never stored for replay; everything
 * else that cannot be delivered is stored in the {@link DeadLetterBuffer} and resolves to
 * {@link SubmissionOutcome.Deferred}.
 *
 * <p>{@link #submit(Batch)} is fully asynchronous: sink calls run on the sink executor and
 * retry waits are scheduled, so a backing-off submission holds no thread. {@link #handle(Batch)}
 * is the blocking form. Every sink call is bounded by {@code sinkTimeout}, every wait by the
 * policy's {@link RetryPolicy#maxDelay()}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable}; closing does not close the sink.
 *
 * @see DeliveryCoordinator.Builder
 * @see DeliveryDispatcher
 */
public final class DeliveryCoordinator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryCoordinator.class.getName());

  private final DeliverySink sink;
  private final RetryPolicy retryPolicy;
  private final CircuitBreaker circuitBreaker;
  private final DeadLetterBuffer deadLetterBuffer;
  private final MetricsExporter metrics;
  private final int maxBatchSize;
  private final long sinkTimeoutMs;
  private final long drainTimeoutMs;
  private final ScheduledExecutorService scheduler;
  private final Executor sinkExecutor;
  private final boolean ownsScheduler;
  private final ExecutorService ownedSinkExecutor;
  private final Clock clock;

  private final Set<Submission> inFlight = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean();

  private DeliveryCoordinator(Builder builder) {
    this.sink = Objects.requireNonNull(builder.sink, "sink");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(100, 10_000, 3);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.circuitBreaker = builder.circuitBreaker != null
        ? builder.circuitBreaker
        : new CircuitBreaker(5, Duration.ofSeconds(30), clock,
            (from, to) -> metrics.recordCircuitState(to));
    this.deadLetterBuffer = builder.deadLetterBuffer != null
        ? builder.deadLetterBuffer
        : new DeadLetterBuffer(10_000, 3, clock, new MetricsDeadLetterListener(metrics));

    if (builder.maxBatchSize < 1) {
      throw new IllegalArgumentException("maxBatchSize must be >= 1, got: " + builder.maxBatchSize);
    }
    Objects.requireNonNull(builder.sinkTimeout, "sinkTimeout");
    if (builder.sinkTimeout.isNegative() || builder.sinkTimeout.isZero()) {
      throw new IllegalArgumentException("sinkTimeout must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.maxBatchSize = builder.maxBatchSize;
    this.sinkTimeoutMs = builder.sinkTimeout.toMillis();
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      ScheduledThreadPoolExecutor retryScheduler =
          new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("relay-retry-"));
      retryScheduler.setRemoveOnCancelPolicy(true);
      this.scheduler = retryScheduler;
      this.ownsScheduler = true;
    }
    if (builder.sinkExecutor != null) {
      this.sinkExecutor = builder.sinkExecutor;
      this.ownedSinkExecutor = null;
    } else {
      this.ownedSinkExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("relay-sink-"));
      this.sinkExecutor = ownedSinkExecutor;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts delivering a batch and returns immediately.
   *
   * <p>The returned future always completes normally with an outcome. Cancelling it stops
   * further retries: a sink call already in flight completes and is reported to the circuit
   * breaker, and every sub-batch not yet delivered is stored as
   * {@link DeferReason#CANCELLED}.
   *
   * @param batch the records to deliver
   * @return the eventual outcome
   */
  public CompletableFuture<SubmissionOutcome> submit(Batch batch) {
    Objects.requireNonNull(batch, "batch");
    Submission submission = new Submission(batch.split(maxBatchSize), true);
    if (closed.get()) {
      submission.step(() -> submission.deferRemaining(DeferReason.CANCELLED, "coordinator closed"));
      return submission.result;
    }
    return start(submission);
  }

  /**
   * Delivers a batch, blocking until it resolves.
   *
   * <p>If the calling thread is interrupted, the submission is cancelled as described in
   * {@link #submit(Batch)}, the interrupt flag is restored and
   * {@code Deferred(CANCELLED)} is returned.
   *
   * @param batch the records to deliver
   * @return the outcome, never {@code null}
   */
  public SubmissionOutcome handle(Batch batch) {
    CompletableFuture<SubmissionOutcome> future = submit(batch);
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(false);
      Thread.currentThread().interrupt();
      return SubmissionOutcome.deferred(DeferReason.CANCELLED, 0, "interrupted");
    } catch (ExecutionException e) {
      // submit() never completes exceptionally; kept for the checked signature
      logger.log(Level.SEVERE, "Unexpected delivery failure", e.getCause());
      return SubmissionOutcome.deferred(DeferReason.CANCELLED, 0, String.valueOf(e.getCause()));
    }
  }

  /**
   * Re-delivers up to {@code limit} dead letter entries, oldest first, through the normal
   * circuit and retry path. Stops early once the circuit is open. Entries that fail again go
   * back to the buffer with one more failed replay; permanently rejected entries are dropped.
   *
   * @param limit maximum entries to replay
   * @return counts of delivered, returned and dropped entries
   */
  public ReplayReport replay(int limit) {
    int delivered = 0;
    int returned = 0;
    int dropped = 0;
    try (ReplaySession session = deadLetterBuffer.replay(limit)) {
      Iterator<ReplaySession.Item> items = session.iterator();
      while (circuitBreaker.state() != CircuitState.OPEN && items.hasNext()) {
        ReplaySession.Item item = items.next();
        SubmissionOutcome outcome = replayOne(item);
        if (outcome instanceof SubmissionOutcome.Delivered) {
          item.confirm();
          metrics.incrementDeadLetterReplayed();
          delivered++;
        } else if (outcome instanceof SubmissionOutcome.Rejected) {
          item.discard("rejected on replay: " + outcome.lastError());
          dropped++;
        } else if (outcome.attempts() == 0) {
          item.release();
          returned++;
        } else if (item.retryLater(outcome.lastError())) {
          returned++;
        } else {
          dropped++;
        }
        if (Thread.currentThread().isInterrupted()) {
          break;
        }
      }
    }
    ReplayReport report = new ReplayReport(delivered, returned, dropped);
    if (report.total() > 0) {
      logger.log(Level.INFO, "Dead letter replay: " + report);
    }
    return report;
  }

  private SubmissionOutcome replayOne(ReplaySession.Item item) {
    CompletableFuture<SubmissionOutcome> future =
        start(new Submission(item.entry().batch().split(maxBatchSize), false));
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(false);
      Thread.currentThread().interrupt();
      return SubmissionOutcome.deferred(DeferReason.CANCELLED, 0, "interrupted");
    } catch (ExecutionException e) {
      logger.log(Level.SEVERE, "Unexpected replay failure", e.getCause());
      return SubmissionOutcome.deferred(DeferReason.CANCELLED, 0, String.valueOf(e.getCause()));
    }
  }

  private CompletableFuture<SubmissionOutcome> start(Submission submission) {
    inFlight.add(submission);
    submission.result.whenComplete((outcome, error) -> {
      if (submission.result.isCancelled()) {
        submission.step(submission::onCancelled);
      }
    });
    submission.step(submission::advance);
    return submission.result;
  }

  public CircuitState circuitState() {
    return circuitBreaker.state();
  }

  public int deadLetterSize() {
    return deadLetterBuffer.size();
  }

  /**
   * Takes a health snapshot, probing the sink.
   *
   * @return the current status
   */
  public DeliveryStatus status() {
    boolean sinkHealthy;
    try {
      sinkHealthy = sink.isHealthy();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Health probe of sink " + sink.name() + " failed", e);
      sinkHealthy = false;
    }
    return new DeliveryStatus(circuitBreaker.state(), deadLetterBuffer.size(), sinkHealthy,
        clock.instant());
  }

  public DeliverySink sink() {
    return sink;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  public DeadLetterBuffer deadLetterBuffer() {
    return deadLetterBuffer;
  }

  public int maxBatchSize() {
    return maxBatchSize;
  }

  /**
   * Stops accepting work and waits up to the drain timeout for in-flight submissions.
   * Submissions still running afterwards are resolved at once, their undelivered records
   * stored as {@link DeferReason#CANCELLED}. Batches submitted after closing are stored the
   * same way.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    List<CompletableFuture<Void>> pending = new ArrayList<>();
    for (Submission submission : inFlight) {
      pending.add(submission.done);
    }
    try {
      CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
          .get(drainTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Drain timeout exceeded; deferring " + inFlight.size()
          + " unfinished submission(s)");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      logger.log(Level.WARNING, "Unexpected failure while draining", e.getCause());
    }
    for (Submission submission : inFlight) {
      submission.step(() -> submission.deferRemaining(DeferReason.CANCELLED, "coordinator closed"));
    }
    if (ownsScheduler) {
      scheduler.shutdownNow();
    }
    if (ownedSinkExecutor != null) {
      ownedSinkExecutor.shutdown();
    }
  }

  private SinkException invokeSink(Batch part) {
    try {
      sink.submit(part);
      return null;
    } catch (SinkException e) {
      return e;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Sink " + sink.name() + " threw unexpectedly; treating as "
          + SinkError.TRANSIENT, e);
      return new SinkException(SinkError.TRANSIENT, "unexpected sink failure: " + e, e);
    }
  }

  private SinkException asSinkException(Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause() : error;
    if (cause instanceof TimeoutException) {
      return new SinkException(SinkError.TRANSIENT,
          "sink call timed out after " + sinkTimeoutMs + "ms", cause);
    }
    logger.log(Level.WARNING, "Sink call to " + sink.name() + " failed unexpectedly", cause);
    return new SinkException(SinkError.TRANSIENT, "unexpected sink failure: " + cause, cause);
  }

  // max(policy delay, min(hint, policy cap))
  private long retryDelayMs(Duration policyDelay, Duration hint) {
    long delayMs = policyDelay.toMillis();
    if (hint != null) {
      long hintMs = Math.min(hint.toMillis(), retryPolicy.maxDelay().toMillis());
      delayMs = Math.max(delayMs, hintMs);
    }
    return delayMs;
  }

  private static int severity(SubmissionOutcome outcome) {
    if (outcome instanceof SubmissionOutcome.Rejected) {
      return 2;
    }
    return outcome instanceof SubmissionOutcome.Deferred ? 1 : 0;
  }

  /**
   * State of one in-progress submission. Steps run one at a time under the instance lock,
   * on whichever thread delivered the previous result.
   */
  private final class Submission {
    private final List<Batch> parts;
    private final boolean deadLetterOnDefer;
    private final CompletableFuture<SubmissionOutcome> result = new CompletableFuture<>();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private int partIndex;
    private int totalAttempts;
    private SubmissionOutcome worst;
    private int attempt;
    private String lastError;
    private Permit permit;
    private ScheduledFuture<?> pendingRetry;
    private boolean finished;
    private SubmissionOutcome finalOutcome;

    Submission(List<Batch> parts, boolean deadLetterOnDefer) {
      this.parts = parts;
      this.deadLetterOnDefer = deadLetterOnDefer;
    }

    void step(Runnable action) {
      SubmissionOutcome outcome;
      synchronized (this) {
        if (finished) {
          return;
        }
        try {
          action.run();
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Delivery of batch starting at " + parts.get(0).firstEventId()
              + " failed unexpectedly; deferring remaining records", e);
          deferRemaining(DeferReason.CANCELLED, "internal error: " + e);
        }
        if (!finished) {
          return;
        }
        outcome = finalOutcome;
      }
      inFlight.remove(this);
      done.complete(null);
      result.complete(outcome);
    }

    void advance() {
      while (partIndex < parts.size()) {
        attempt = 0;
        lastError = null;
        if (result.isCancelled()) {
          deferRemaining(DeferReason.CANCELLED, null);
          return;
        }
        permit = circuitBreaker.tryAcquire();
        if (permit != Permit.REJECTED) {
          attemptPart();
          return;
        }
        completePart(defer(DeferReason.CIRCUIT_OPEN));
      }
      finish();
    }

    void onCancelled() {
      if (pendingRetry != null && pendingRetry.cancel(false)) {
        pendingRetry = null;
        deferRemaining(DeferReason.CANCELLED, lastError);
      }
    }

    private void attemptPart() {
      Batch part = parts.get(partIndex);
      Permit callPermit = permit;
      long startedAt = System.nanoTime();
      AtomicBoolean refused = new AtomicBoolean();
      CompletableFuture<SinkException> call = new CompletableFuture<>();
      call.orTimeout(sinkTimeoutMs, TimeUnit.MILLISECONDS);
      call.whenComplete((failure, error) -> {
        if (!refused.get()) {
          onCallComplete(callPermit, startedAt, error != null ? asSinkException(error) : failure);
        }
      });
      try {
        sinkExecutor.execute(() -> call.complete(invokeSink(part)));
      } catch (RejectedExecutionException e) {
        refused.set(true);
        call.cancel(false);
        // The sink was never called: no attempt is charged and a probe slot goes back.
        circuitBreaker.release(callPermit);
        logger.log(Level.WARNING, "Sink executor refused " + part + "; deferring remaining records", e);
        deferRemaining(DeferReason.CANCELLED, "sink executor rejected the call: " + e.getMessage());
        return;
      }
      // Still under the submission lock, so the result cannot be processed before this runs.
      attempt++;
      totalAttempts++;
      metrics.incrementSinkAttempt();
    }

    private void onCallComplete(Permit callPermit, long startedAt, SinkException failure) {
      metrics.recordSinkLatencyMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
      // Reported even when the submission was cancelled or abandoned meanwhile.
      if (failure == null) {
        circuitBreaker.recordSuccess(callPermit);
      } else {
        metrics.incrementSinkFailure(failure.error());
        circuitBreaker.recordFailure(callPermit, failure.error());
      }
      metrics.recordCircuitState(circuitBreaker.state());
      step(() -> onAttemptResult(failure));
    }

    private void onAttemptResult(SinkException failure) {
      Batch part = parts.get(partIndex);
      if (failure == null) {
        metrics.incrementDelivered();
        logger.log(Level.FINE, "Delivered " + part + " on attempt " + attempt);
        completePart(SubmissionOutcome.delivered(attempt));
        advance();
        return;
      }
      SinkError error = failure.error();
      lastError = failure.detail();
      logger.log(Level.FINE, "Attempt " + attempt + " for " + part + " failed: " + lastError);
      if (!error.isRetryable()) {
        completePart(reject());
        advance();
        return;
      }
      if (permit == Permit.PROBE) {
        completePart(defer(DeferReason.CIRCUIT_OPEN));
        advance();
        return;
      }
      if (result.isCancelled()) {
        deferRemaining(DeferReason.CANCELLED, lastError);
        return;
      }
      RetryDecision decision = retryPolicy.decide(attempt, error);
      if (decision instanceof RetryDecision.RetryAfter retry) {
        long delayMs = retryDelayMs(retry.delay(), failure.retryAfter());
        pendingRetry = scheduler.schedule(() -> step(this::retry), delayMs, TimeUnit.MILLISECONDS);
        return;
      }
      completePart(defer(DeferReason.RETRIES_EXHAUSTED));
      advance();
    }

    private void retry() {
      pendingRetry = null;
      if (result.isCancelled()) {
        deferRemaining(DeferReason.CANCELLED, lastError);
        return;
      }
      attemptPart();
    }

    private SubmissionOutcome defer(DeferReason reason) {
      Batch part = parts.get(partIndex);
      if (deadLetterOnDefer) {
        deadLetterBuffer.enqueue(part, reason, lastError);
      }
      metrics.incrementDeferred();
      logger.log(Level.WARNING, "Deferred " + part + " (" + reason + ") after " + attempt
          + " attempt(s); last error: " + lastError);
      return SubmissionOutcome.deferred(reason, attempt, lastError);
    }

    private SubmissionOutcome reject() {
      metrics.incrementRejected();
      logger.log(Level.WARNING, "Sink rejected " + parts.get(partIndex) + ": " + lastError);
      return SubmissionOutcome.rejected(attempt, lastError);
    }

    void deferRemaining(DeferReason reason, String error) {
      if (finished) {
        return;
      }
      pendingRetry = null;
      lastError = error;
      while (partIndex < parts.size()) {
        completePart(defer(reason));
        attempt = 0;
        lastError = null;
      }
      finish();
    }

    private void completePart(SubmissionOutcome outcome) {
      if (worst == null || severity(outcome) > severity(worst)) {
        worst = outcome;
      }
      partIndex++;
    }

    private void finish() {
      finished = true;
      if (worst instanceof SubmissionOutcome.Rejected rejected) {
        finalOutcome = SubmissionOutcome.rejected(totalAttempts, rejected.lastError());
      } else if (worst instanceof SubmissionOutcome.Deferred deferred) {
        finalOutcome = SubmissionOutcome.deferred(deferred.reason(), totalAttempts,
            deferred.lastError());
      } else {
        finalOutcome = SubmissionOutcome.delivered(totalAttempts);
      }
    }
  }

  /** Builder for {@link DeliveryCoordinator}. */
  public static final class Builder {
    private DeliverySink sink;
    private RetryPolicy retryPolicy;
    private CircuitBreaker circuitBreaker;
    private DeadLetterBuffer deadLetterBuffer;
    private MetricsExporter metrics;
    private int maxBatchSize = 500;
    private Duration sinkTimeout = Duration.ofSeconds(30);
    private long drainTimeoutMs = 5000;
    private ScheduledExecutorService scheduler;
    private Executor sinkExecutor;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the destination for delivered batches.
     *
     * <p><b>Required.</b>
     *
     * @param sink the delivery sink
     * @return this builder
     */
    public Builder sink(DeliverySink sink) {
      this.sink = sink;
      return this;
    }

    /**
     * Sets the retry policy consulted after each failed sink call.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=100}, {@code maxDelayMs=10000} and {@code maxAttempts=3}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the circuit breaker shared by all submissions.
     *
     * <p>Optional. Defaults to a breaker opening after 5 consecutive failures with a
     * 30 second cool-down, reporting its state to the metrics exporter.
     *
     * @param circuitBreaker the circuit breaker
     * @return this builder
     */
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    /**
     * Sets the buffer that holds deferred sub-batches.
     *
     * <p>Optional. Defaults to a buffer of 10000 entries with 3 replay attempts per entry,
     * reporting to the metrics exporter.
     *
     * @param deadLetterBuffer the dead letter buffer
     * @return this builder
     */
    public Builder deadLetterBuffer(DeadLetterBuffer deadLetterBuffer) {
      this.deadLetterBuffer = deadLetterBuffer;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the maximum records per sink call; larger batches are split in order.
     *
     * <p>Optional. Defaults to {@code 500}. Must be &ge; 1.
     *
     * @param maxBatchSize maximum sub-batch size
     * @return this builder
     */
    public Builder maxBatchSize(int maxBatchSize) {
      this.maxBatchSize = maxBatchSize;
      return this;
    }

    /**
     * Sets how long a single sink call may take before it counts as a
     * {@link SinkError#TRANSIENT} failure.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param sinkTimeout per-call timeout
     * @return this builder
     */
    public Builder sinkTimeout(Duration sinkTimeout) {
      this.sinkTimeout = sinkTimeout;
      return this;
    }

    /**
     * Sets how long {@link DeliveryCoordinator#close()} waits for in-flight submissions.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Sets the scheduler used for retry waits. The coordinator does not shut down a
     * scheduler it was given.
     *
     * <p>Optional. Defaults to a single daemon thread.
     *
     * @param scheduler the retry scheduler
     * @return this builder
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Sets the executor that runs sink calls. The coordinator does not shut down an
     * executor it was given.
     *
     * <p>Optional. Defaults to a cached pool of daemon threads.
     *
     * @param sinkExecutor the sink executor
     * @return this builder
     */
    public Builder sinkExecutor(Executor sinkExecutor) {
      this.sinkExecutor = sinkExecutor;
      return this;
    }

    /**
     * Sets the clock for status timestamps and the default breaker and buffer.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the coordinator.
     *
     * @return a new {@link DeliveryCoordinator}
     * @throws NullPointerException if {@code sink} is null
     * @throws IllegalArgumentException if {@code maxBatchSize < 1} or {@code sinkTimeout}
     *     is not positive
     */
    public DeliveryCoordinator build() {
      return new DeliveryCoordinator(this);
    }
  }
}
