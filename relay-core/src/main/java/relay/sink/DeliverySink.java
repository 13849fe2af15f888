package relay.sink;

import relay.Batch;

/**
 * Destination that durably accepts delivered batches.
 *
 * <p>Implementations must be thread-safe: the coordinator invokes {@link #submit} from many
 * concurrent submissions. A real implementation talks to a remote streaming service; the
 * {@link InMemoryDeliverySink} stands in for it in tests and local development. The
 * coordinator observes no difference between the two beyond the success/{@link SinkException}
 * contract.
 *
 * @see SinkException
 */
public interface DeliverySink extends AutoCloseable {

    /**
     * Submits a batch. Returns normally once the sink has accepted every record.
     *
     * @param batch the records to deliver, in order
     * @throws SinkException if the sink did not accept the batch
     */
    void submit(Batch batch) throws SinkException;

    /**
     * Probes whether the destination is reachable and active.
     *
     * @return {@code true} if the sink looks usable
     */
    default boolean isHealthy() {
        return true;
    }

    /**
     * Returns a short identifier for logs and metrics tagging.
     *
     * @return the sink name
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Releases connections and threads held by the sink.
     */
    @Override
    default void close() {
    }
}
