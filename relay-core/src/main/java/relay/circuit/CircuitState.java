package relay.circuit;

/**
 * State of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    /** Normal operation; every submission reaches the sink. */
    CLOSED(0),
    /** Probing: a single submission is let through to test the sink. */
    HALF_OPEN(1),
    /** Short-circuiting: submissions are deferred without calling the sink. */
    OPEN(2);

    private final int code;

    CircuitState(int code) {
        this.code = code;
    }

    /**
     * Returns a numeric code suitable for a gauge: 0 closed, 1 half-open, 2 open.
     *
     * @return the state code
     */
    public int code() {
        return code;
    }
}
