package relay.circuit;

import relay.sink.SinkError;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks the health of the sink across all submissions and short-circuits delivery while
 * the sink is judged unhealthy.
 *
 * <ul>
 *   <li>{@code CLOSED → OPEN} after {@code failureThreshold} consecutive
 *       {@link SinkError#THROTTLED}/{@link SinkError#TRANSIENT} results.</li>
 *   <li>{@code OPEN → HALF_OPEN} once {@code coolDown} has elapsed since opening.</li>
 *   <li>{@code HALF_OPEN → CLOSED} when the single probe succeeds;
 *       {@code HALF_OPEN → OPEN} when it fails.</li>
 * </ul>
 *
 * <p>{@link SinkError#PERMANENT} results are payload faults: they never move the failure
 * count and, for a probe, only free the probe slot. Results reported under a permit issued
 * in an earlier state are ignored, so only the probe decides a half-open transition.
 *
 * <p>This class is thread-safe. All reads and transitions happen under the instance lock.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final int failureThreshold;
  private final Duration coolDown;
  private final Clock clock;
  private final TransitionListener listener;

  private CircuitState state = CircuitState.CLOSED;
  private int consecutiveFailures;
  private Instant openedAt;
  private boolean probeInFlight;

  public CircuitBreaker(int failureThreshold, Duration coolDown) {
    this(failureThreshold, coolDown, Clock.systemUTC(), null);
  }

  /**
   * @param failureThreshold consecutive sink-health failures that open the circuit
   * @param coolDown         time spent open before a probe is allowed
   * @param clock            time source for cool-down tracking
   * @param listener         notified after each transition, or {@code null}
   */
  public CircuitBreaker(int failureThreshold, Duration coolDown, Clock clock,
      TransitionListener listener) {
    if (failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1, got: " + failureThreshold);
    }
    Objects.requireNonNull(coolDown, "coolDown");
    if (coolDown.isNegative()) {
      throw new IllegalArgumentException("coolDown must not be negative");
    }
    this.failureThreshold = failureThreshold;
    this.coolDown = coolDown;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = listener != null ? listener : TransitionListener.NOOP;
  }

  /**
   * Asks to submit to the sink.
   *
   * @return {@link Permit#ALLOWED} when closed, {@link Permit#PROBE} to the one caller that
   *     claims the half-open probe, {@link Permit#REJECTED} otherwise
   */
  public synchronized Permit tryAcquire() {
    advanceIfCooledDown();
    switch (state) {
      case CLOSED:
        return Permit.ALLOWED;
      case HALF_OPEN:
        if (!probeInFlight) {
          probeInFlight = true;
          return Permit.PROBE;
        }
        return Permit.REJECTED;
      default:
        return Permit.REJECTED;
    }
  }

  /**
   * Reports a successful sink call made under {@code permit}.
   *
   * @param permit the permit returned by {@link #tryAcquire()}
   */
  public synchronized void recordSuccess(Permit permit) {
    Objects.requireNonNull(permit, "permit");
    if (permit == Permit.PROBE && state == CircuitState.HALF_OPEN) {
      probeInFlight = false;
      consecutiveFailures = 0;
      transition(CircuitState.CLOSED);
    } else if (permit == Permit.ALLOWED && state == CircuitState.CLOSED) {
      consecutiveFailures = 0;
    }
  }

  /**
   * Reports a failed sink call made under {@code permit}.
   *
   * @param permit the permit returned by {@link #tryAcquire()}
   * @param error  the failure classification
   */
  public synchronized void recordFailure(Permit permit, SinkError error) {
    Objects.requireNonNull(permit, "permit");
    Objects.requireNonNull(error, "error");
    if (permit == Permit.PROBE && state == CircuitState.HALF_OPEN) {
      probeInFlight = false;
      if (error.countsAgainstHealth()) {
        open();
      }
      return;
    }
    if (permit == Permit.ALLOWED && state == CircuitState.CLOSED && error.countsAgainstHealth()) {
      consecutiveFailures++;
      if (consecutiveFailures >= failureThreshold) {
        open();
      }
    }
  }

  /**
   * Gives back a permit whose sink call never started. A released probe slot can be claimed
   * by the next caller; no transition happens and the failure count is unchanged.
   *
   * @param permit the permit returned by {@link #tryAcquire()}
   */
  public synchronized void release(Permit permit) {
    Objects.requireNonNull(permit, "permit");
    if (permit == Permit.PROBE && state == CircuitState.HALF_OPEN) {
      probeInFlight = false;
    }
  }

  /**
   * Returns the current state, first moving {@code OPEN} to {@code HALF_OPEN} if the
   * cool-down has elapsed.
   *
   * @return the current state
   */
  public synchronized CircuitState state() {
    advanceIfCooledDown();
    return state;
  }

  public synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  public int failureThreshold() {
    return failureThreshold;
  }

  public Duration coolDown() {
    return coolDown;
  }

  private void open() {
    openedAt = clock.instant();
    consecutiveFailures = 0;
    transition(CircuitState.OPEN);
  }

  private void advanceIfCooledDown() {
    if (state == CircuitState.OPEN && !clock.instant().isBefore(openedAt.plus(coolDown))) {
      probeInFlight = false;
      transition(CircuitState.HALF_OPEN);
    }
  }

  private void transition(CircuitState next) {
    CircuitState previous = state;
    if (previous == next) {
      return;
    }
    state = next;
    Level level = next == CircuitState.OPEN ? Level.WARNING : Level.INFO;
    logger.log(level, "Circuit " + previous + " -> " + next);
    try {
      listener.onTransition(previous, next);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Circuit transition listener failed", e);
    }
  }

  /**
   * Admission decision returned by {@link CircuitBreaker#tryAcquire()}.
   */
  public enum Permit {
    /** Circuit closed; submit normally. */
    ALLOWED,
    /** Circuit half-open; this caller holds the single probe and must report its result. */
    PROBE,
    /** Circuit open, or another probe is in flight; do not call the sink. */
    REJECTED
  }

  /**
   * Callback invoked, under the breaker's lock, after each state change.
   */
  @FunctionalInterface
  public interface TransitionListener {
    TransitionListener NOOP = (from, to) -> { };

    void onTransition(CircuitState from, CircuitState to);
  }
}
