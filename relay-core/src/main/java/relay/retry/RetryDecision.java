package relay.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Answer of a {@link RetryPolicy} after a failed attempt.
 *
 * <ul>
 *   <li>{@link RetryAfter}: wait the given delay, then attempt again.</li>
 *   <li>{@link GiveUp}: stop; the submission resolves now.</li>
 * </ul>
 */
public sealed interface RetryDecision permits RetryDecision.RetryAfter, RetryDecision.GiveUp {

    /**
     * Singleton give-up decision.
     */
    GiveUp GIVE_UP = new GiveUp();

    static RetryAfter retryAfter(Duration delay) {
        return new RetryAfter(delay);
    }

    static GiveUp giveUp() {
        return GIVE_UP;
    }

    /**
     * Attempt again after {@code delay}.
     *
     * @param delay how long to wait (must not be null or negative)
     */
    record RetryAfter(Duration delay) implements RetryDecision {
        public RetryAfter {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }
    }

    /**
     * No further attempts.
     */
    record GiveUp() implements RetryDecision {
    }
}
