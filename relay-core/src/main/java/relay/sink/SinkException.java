package relay.sink;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by a {@link DeliverySink} when a batch was not accepted.
 *
 * <p>The {@link #error()} tag drives retry and circuit decisions. A sink may attach a
 * {@link #retryAfter()} hint (for example, a throttle window reported by the server); the
 * coordinator never waits less than the hint before the next attempt.
 */
public class SinkException extends Exception {

    private final SinkError error;
    private final Duration retryAfter;

    public SinkException(SinkError error, String message) {
        this(error, message, null, null);
    }

    public SinkException(SinkError error, String message, Throwable cause) {
        this(error, message, null, cause);
    }

    /**
     * Creates a new instance with a server-supplied retry hint.
     *
     * @param error      the error classification
     * @param message    detail message
     * @param retryAfter minimum wait before retrying, or {@code null}
     * @param cause      the underlying cause, or {@code null}
     * @throws IllegalArgumentException if {@code retryAfter} is negative
     */
    public SinkException(SinkError error, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        this.retryAfter = retryAfter;
    }

    public SinkError error() {
        return error;
    }

    /**
     * Returns the server-supplied minimum wait before retrying, or {@code null}.
     *
     * @return retry hint, or {@code null}
     */
    public Duration retryAfter() {
        return retryAfter;
    }

    /**
     * Returns {@code "<ERROR>: <message>"}, the form recorded as an outcome's last error.
     *
     * @return short error detail
     */
    public String detail() {
        return error + ": " + getMessage();
    }
}
