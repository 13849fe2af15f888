package relay.dispatch;

import relay.spi.MetricsExporter;
import relay.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background delivery queue in front of a {@link DeliveryCoordinator}.
 *
 * <p>The request path calls {@link #enqueue(QueuedBatch)} and learns only whether the batch
 * was accepted for delivery. Worker threads take batches off a bounded queue and hand them
 * to {@link DeliveryCoordinator#submit(Batch)}; the batch's completion future receives the
 * outcome. At most {@code maxInFlight} submissions run at once. Retry waits happen inside the
 * coordinator and do not occupy a worker.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see DeliveryDispatcher.Builder
 */
public final class DeliveryDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryDispatcher.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  private final DeliveryCoordinator coordinator;
  private final BlockingQueue<QueuedBatch> queue;
  private final ExecutorService workers;
  private final Semaphore inFlight;
  private final int maxInFlight;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private DeliveryDispatcher(Builder builder) {
    this.coordinator = Objects.requireNonNull(builder.coordinator, "coordinator");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;

    int workerCount = builder.workerCount;
    if (workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.maxInFlight <= 0) {
      throw new IllegalArgumentException("maxInFlight must be > 0");
    }
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.maxInFlight = builder.maxInFlight;
    this.inFlight = new Semaphore(maxInFlight);

    this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount),
        new DaemonThreadFactory("relay-dispatcher-"));
    if (workerCount > 0) {
      for (int i = 0; i < workerCount; i++) {
        workers.submit(this::workerLoop);
      }
    } else {
      // workerCount=0: batches stay queued (testing only)
      logger.warning("workerCount=0: no dispatch workers started; batches will not be delivered");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Offers a batch to the queue. Returns {@code false} if the queue is full or the
   * dispatcher is no longer accepting batches.
   *
   * @param batch the queued batch
   * @return {@code true} if the batch was accepted for delivery
   */
  public boolean enqueue(QueuedBatch batch) {
    Objects.requireNonNull(batch, "batch");
    if (!accepting.get()) return false;
    boolean enqueued = queue.offer(batch);
    metrics.recordQueueDepth(queue.size());
    return enqueued;
  }

  public int queueDepth() {
    return queue.size();
  }

  public int remainingCapacity() {
    return queue.remainingCapacity();
  }

  /**
   * Returns the number of in-flight permits taken: submissions running in the coordinator,
   * plus any worker briefly holding a permit while it waits for its next batch.
   *
   * @return in-flight submissions
   */
  public int inFlight() {
    return maxInFlight - inFlight.availablePermits();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        // Permit first: an interrupt while waiting for it leaves the batch in the queue,
        // where close() still finds it.
        inFlight.acquire();
        QueuedBatch next;
        try {
          next = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          inFlight.release();
          throw e;
        }
        if (next == null) {
          inFlight.release();
          if (!running.get()) break;
          continue;
        }
        metrics.recordQueueDepth(queue.size());
        dispatch(next);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatcher loop error", t);
      }
    }
  }

  private void dispatch(QueuedBatch queued) {
    try {
      coordinator.submit(queued.batch()).whenComplete((outcome, error) -> {
        inFlight.release();
        if (error != null) {
          queued.completion().completeExceptionally(error);
        } else {
          queued.completion().complete(outcome);
        }
      });
    } catch (RuntimeException e) {
      inFlight.release();
      queued.completion().completeExceptionally(e);
      throw e;
    }
  }

  /**
   * Initiates graceful shutdown: stops accepting batches, lets workers drain the queue and
   * waits for in-flight submissions within the drain timeout. Batches still queued after the
   * timeout are handed to the coordinator directly, so none is left undelivered and
   * unrecorded. Does not close the coordinator.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    workers.shutdown();
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMs);
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. "
            + "Queued remaining: " + queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
      long remainingNanos = Math.max(0L, deadline - System.nanoTime());
      if (inFlight.tryAcquire(maxInFlight, remainingNanos, TimeUnit.NANOSECONDS)) {
        inFlight.release(maxInFlight);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    List<QueuedBatch> leftover = new ArrayList<>();
    queue.drainTo(leftover);
    for (QueuedBatch queued : leftover) {
      inFlight.acquireUninterruptibly();
      dispatch(queued);
    }
    metrics.recordQueueDepth(queue.size());
  }

  /** Builder for {@link DeliveryDispatcher}. */
  public static final class Builder {
    private DeliveryCoordinator coordinator;
    private int workerCount = 2;
    private int queueCapacity = 1000;
    private int maxInFlight = 64;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the coordinator that delivers dequeued batches.
     *
     * <p><b>Required.</b>
     *
     * @param coordinator the delivery coordinator
     * @return this builder
     */
    public Builder coordinator(DeliveryCoordinator coordinator) {
      this.coordinator = coordinator;
      return this;
    }

    /**
     * Sets the number of worker threads that take batches off the queue.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &ge; 0. Setting to {@code 0}
     * disables processing (useful for testing only).
     *
     * @param workerCount number of worker threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the bounded capacity of the queue.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum queued batches
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets how many submissions may run in the coordinator at once.
     *
     * <p>Optional. Defaults to {@code 64}. Must be &gt; 0.
     *
     * @param maxInFlight maximum concurrent submissions
     * @return this builder
     */
    public Builder maxInFlight(int maxInFlight) {
      this.maxInFlight = maxInFlight;
      return this;
    }

    /**
     * Sets the metrics exporter for recording queue depth.
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
     * Sets the maximum time in milliseconds to wait for queued and in-flight batches
     * during shutdown.
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
     * Builds and starts the dispatcher. Worker threads begin draining the queue immediately.
     *
     * @return a new {@link DeliveryDispatcher}
     * @throws NullPointerException if {@code coordinator} is null
     * @throws IllegalArgumentException if {@code workerCount < 0}, {@code queueCapacity}
     *     or {@code maxInFlight} is &le; 0
     */
    public DeliveryDispatcher build() {
      return new DeliveryDispatcher(this);
    }
  }
}
