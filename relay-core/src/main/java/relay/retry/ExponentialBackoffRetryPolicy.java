package relay.retry;

import relay.sink.SinkError;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with symmetric jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, then
 * multiplied by a uniform factor in {@code [1 - jitter, 1 + jitter]} and capped again.
 * {@link SinkError#PERMANENT} always gives up; retryable errors give up once
 * {@code maxAttempts} attempts have been made.
 *
 * <p>Pass a seeded {@link Random} to make backoff sequences reproducible. Without one,
 * {@link ThreadLocalRandom} is used.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final int maxAttempts;
  private final double jitter;
  private final Random random;

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param maxAttempts attempts per submission before giving up
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {
    this(baseDelayMs, maxDelayMs, maxAttempts, 0.2, null);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param maxAttempts attempts per submission before giving up
   * @param jitter      jitter fraction in {@code [0, 1)}; {@code 0.2} means &plusmn;20%
   * @param random      jitter source, or {@code null} for {@link ThreadLocalRandom}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts,
      double jitter, Random random) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (!(jitter >= 0.0 && jitter < 1.0)) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.maxAttempts = maxAttempts;
    this.jitter = jitter;
    this.random = random;
  }

  @Override
  public RetryDecision decide(int attempt, SinkError error) {
    Objects.requireNonNull(error, "error");
    if (!error.isRetryable() || attempt >= maxAttempts) {
      return RetryDecision.giveUp();
    }
    return RetryDecision.retryAfter(Duration.ofMillis(computeDelayMs(attempt)));
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public Duration maxDelay() {
    return Duration.ofMillis(maxDelayMs);
  }

  /**
   * Computes the jittered delay to wait after the given failed attempt.
   *
   * @param attempts the number of attempts so far (1-based)
   * @return delay in milliseconds, within {@code [0, maxDelayMs]}
   */
  public long computeDelayMs(int attempts) {
    if (attempts <= 0 || baseDelayMs == 0) {
      return 0L;
    }
    long expDelay;
    if (attempts >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    double u = random != null ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
    double factor = 1.0 - jitter + 2.0 * jitter * u;
    long withJitter = Math.round(capped * factor);
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }
}
