package relay;

import java.util.Objects;

/**
 * Result of one {@link relay.dispatch.DeliveryCoordinator#handle(Batch)} call.
 *
 * <ul>
 *   <li>{@link Delivered}: the sink accepted every record.</li>
 *   <li>{@link Deferred}: at least one sub-batch could not be delivered now and is held in
 *       the dead letter buffer for replay. Callers may report it as accepted-for-later.</li>
 *   <li>{@link Rejected}: the sink permanently refused a sub-batch (for example, payload too
 *       large). Rejected records are never replayed.</li>
 * </ul>
 *
 * <p>When a batch is split, the outcome is the most severe across its sub-batches
 * ({@code Rejected} over {@code Deferred} over {@code Delivered}) and {@link #attempts()}
 * is the total number of sink invocations made.
 */
public sealed interface SubmissionOutcome
    permits SubmissionOutcome.Delivered, SubmissionOutcome.Deferred, SubmissionOutcome.Rejected {

  /**
   * Returns the number of sink invocations made for the submission.
   *
   * @return attempts, zero when the circuit short-circuited every sub-batch
   */
  int attempts();

  /**
   * Returns the detail of the last sink error, or {@code null} if none occurred.
   *
   * @return last error detail, or {@code null}
   */
  String lastError();

  static Delivered delivered(int attempts) {
    return new Delivered(attempts);
  }

  static Deferred deferred(DeferReason reason, int attempts, String lastError) {
    return new Deferred(reason, attempts, lastError);
  }

  static Rejected rejected(int attempts, String lastError) {
    return new Rejected(attempts, lastError);
  }

  /**
   * Why a submission was deferred to the dead letter buffer.
   */
  enum DeferReason {
    /** The circuit breaker was open; the sink was not called. */
    CIRCUIT_OPEN,
    /** Retryable sink errors persisted until the retry policy gave up. */
    RETRIES_EXHAUSTED,
    /** The submission was cancelled before it could complete. */
    CANCELLED
  }

  /**
   * The sink accepted every record.
   *
   * @param attempts sink invocations made
   */
  record Delivered(int attempts) implements SubmissionOutcome {
    public Delivered {
      if (attempts < 1) {
        throw new IllegalArgumentException("attempts must be >= 1");
      }
    }

    @Override
    public String lastError() {
      return null;
    }
  }

  /**
   * Delivery was postponed; the affected records sit in the dead letter buffer.
   *
   * @param reason    why delivery was postponed
   * @param attempts  sink invocations made
   * @param lastError last sink error detail, or {@code null}
   */
  record Deferred(DeferReason reason, int attempts, String lastError) implements SubmissionOutcome {
    public Deferred {
      Objects.requireNonNull(reason, "reason");
      if (attempts < 0) {
        throw new IllegalArgumentException("attempts must be >= 0");
      }
    }
  }

  /**
   * The sink permanently refused the payload.
   *
   * @param attempts  sink invocations made
   * @param lastError sink error detail
   */
  record Rejected(int attempts, String lastError) implements SubmissionOutcome {
    public Rejected {
      if (attempts < 1) {
        throw new IllegalArgumentException("attempts must be >= 1");
      }
    }
  }
}
