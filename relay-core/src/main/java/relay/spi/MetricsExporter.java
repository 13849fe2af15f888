package relay.spi;

import relay.circuit.CircuitState;
import relay.sink.SinkError;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of sub-batches accepted by the sink.
     */
    void incrementDelivered();

    /**
     * Increments the count of sub-batches deferred to the dead letter buffer.
     */
    void incrementDeferred();

    /**
     * Increments the count of sub-batches permanently rejected by the sink.
     */
    void incrementRejected();

    /**
     * Increments the count of sink invocations.
     */
    void incrementSinkAttempt();

    /**
     * Increments the count of failed sink invocations.
     *
     * @param error the failure classification
     */
    void incrementSinkFailure(SinkError error);

    /**
     * Increments the count of dead letter entries evicted because the buffer was full.
     */
    void incrementDeadLetterOverflow();

    /**
     * Increments the count of dead letter entries dropped after exhausting replay attempts
     * or being rejected on replay.
     */
    void incrementDeadLetterDropped();

    /**
     * Increments the count of dead letter entries re-delivered by replay.
     */
    default void incrementDeadLetterReplayed() {
    }

    /**
     * Records the current number of dead letter entries.
     *
     * @param size entries stored
     */
    void recordDeadLetterSize(int size);

    /**
     * Records the circuit breaker's state after a transition.
     *
     * @param state the new state
     */
    void recordCircuitState(CircuitState state);

    /**
     * Records the depth of the background dispatch queue.
     *
     * @param depth batches waiting
     */
    default void recordQueueDepth(int depth) {
    }

    /**
     * Records the duration of one sink invocation.
     *
     * @param latencyMs elapsed milliseconds (always non-negative)
     */
    default void recordSinkLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementDeferred() {
        }

        @Override
        public void incrementRejected() {
        }

        @Override
        public void incrementSinkAttempt() {
        }

        @Override
        public void incrementSinkFailure(SinkError error) {
        }

        @Override
        public void incrementDeadLetterOverflow() {
        }

        @Override
        public void incrementDeadLetterDropped() {
        }

        @Override
        public void recordDeadLetterSize(int size) {
        }

        @Override
        public void recordCircuitState(CircuitState state) {
        }
    }
}
