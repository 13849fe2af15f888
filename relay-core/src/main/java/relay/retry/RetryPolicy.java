package relay.retry;

import relay.sink.SinkError;

import java.time.Duration;

/**
 * Decides, after each failed attempt of one submission, whether and when to try again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Decides what follows a failed attempt.
     *
     * @param attempt the attempt that just failed (1-based)
     * @param error   the classification of its failure
     * @return {@link RetryDecision.RetryAfter} or {@link RetryDecision.GiveUp}
     */
    RetryDecision decide(int attempt, SinkError error);

    /**
     * Returns the most sink invocations a single submission can make under this policy.
     *
     * @return maximum attempts (&ge; 1)
     */
    int maxAttempts();

    /**
     * Returns the longest delay this policy will ask for. A sink's retry-after hint is
     * honoured up to this bound.
     *
     * @return maximum delay between attempts
     */
    Duration maxDelay();
}
