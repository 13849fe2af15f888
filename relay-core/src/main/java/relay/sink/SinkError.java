package relay.sink;

/**
 * Classification of a failed sink submission.
 *
 * <p>Adapters map their destination's error taxonomy onto these three tags; the
 * coordinator, retry policy and circuit breaker only ever see the tag.
 */
public enum SinkError {
    /** The sink signalled overload. Always retryable; counts against sink health. */
    THROTTLED(true),
    /** Network failure, timeout or other temporary condition. Retryable; counts against sink health. */
    TRANSIENT(true),
    /** The payload was refused (malformed, too large). Never retried; says nothing about sink health. */
    PERMANENT(false);

    private final boolean retryable;

    SinkError(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns whether this error is evidence that the sink itself is unhealthy.
     *
     * @return {@code true} for {@link #THROTTLED} and {@link #TRANSIENT}
     */
    public boolean countsAgainstHealth() {
        return retryable;
    }
}
