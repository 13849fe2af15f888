package relay.sink;

import relay.Batch;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Decides whether an {@link InMemoryDeliverySink} invocation fails, and how.
 *
 * <p>Factories cover the common scenarios; custom lambdas can express anything else.
 */
@FunctionalInterface
public interface FailureInjector {

    /**
     * Returns the error to raise for this invocation, or {@code null} to accept the batch.
     *
     * @param invocation 1-based count of calls made to the sink so far, including this one
     * @param batch      the submitted batch
     * @return the error to raise, or {@code null}
     */
    SinkError failureFor(int invocation, Batch batch);

    /**
     * Accepts every batch.
     *
     * @return an injector that never fails
     */
    static FailureInjector never() {
        return (invocation, batch) -> null;
    }

    /**
     * Fails every call with the given error.
     *
     * @param error the error to raise
     * @return an always-failing injector
     */
    static FailureInjector always(SinkError error) {
        Objects.requireNonNull(error, "error");
        return (invocation, batch) -> error;
    }

    /**
     * Fails the first {@code n} calls with the given error, then accepts.
     *
     * @param n     number of calls to fail
     * @param error the error to raise
     * @return the injector
     */
    static FailureInjector firstN(int n, SinkError error) {
        Objects.requireNonNull(error, "error");
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        return (invocation, batch) -> invocation <= n ? error : null;
    }

    /**
     * Fails calls whose batch matches the predicate.
     *
     * @param predicate selects batches to fail
     * @param error     the error to raise
     * @return the injector
     */
    static FailureInjector when(Predicate<Batch> predicate, SinkError error) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(error, "error");
        return (invocation, batch) -> predicate.test(batch) ? error : null;
    }

    /**
     * Plays back a script: call {@code i} gets {@code outcomes[i - 1]}, where {@code null}
     * means success. Calls beyond the script succeed.
     *
     * @param outcomes per-call errors
     * @return the injector
     */
    static FailureInjector sequence(SinkError... outcomes) {
        List<SinkError> script = Arrays.asList(outcomes.clone());
        return (invocation, batch) -> invocation <= script.size() ? script.get(invocation - 1) : null;
    }
}
