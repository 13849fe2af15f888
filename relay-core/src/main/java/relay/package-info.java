/**
 * Root API for relay, the delivery reliability core of an event ingestion service.
 *
 * <h2>Core Design</h2>
 * <p>The request layer hands a validated {@link relay.Batch} of {@link relay.EventRecord}s to
 * the {@linkplain relay.dispatch.DeliveryCoordinator coordinator}, which splits oversized
 * batches, calls the {@linkplain relay.sink.DeliverySink sink} under a
 * {@linkplain relay.retry.RetryPolicy retry policy} and a shared
 * {@linkplain relay.circuit.CircuitBreaker circuit breaker}, and stores anything it cannot
 * deliver in the {@linkplain relay.dead.DeadLetterBuffer dead letter buffer} for replay.
 * Every call resolves to a {@link relay.SubmissionOutcome}. Delivery is at-least-once;
 * downstream systems must deduplicate by {@link relay.EventRecord#eventId() eventId}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>relay-core</b>: data model, coordinator, dispatcher, in-memory sink
 *       (depends only on ulid-creator)</li>
 *   <li><b>relay-kafka</b>: Kafka sink adapter</li>
 *   <li><b>relay-micrometer</b>: Micrometer metrics bridge</li>
 *   <li><b>relay-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var sink = new InMemoryDeliverySink();
 *
 * try (var coordinator = DeliveryCoordinator.builder()
 *     .sink(sink)
 *     .retryPolicy(new ExponentialBackoffRetryPolicy(100, 10_000, 3))
 *     .circuitBreaker(new CircuitBreaker(5, Duration.ofSeconds(30)))
 *     .deadLetterBuffer(new DeadLetterBuffer(10_000, 3))
 *     .build()) {
 *
 *     SubmissionOutcome outcome = coordinator.handle(Batch.single(
 *         EventRecord.builder(EventType.INSTALL)
 *             .field("user_id", "u-1")
 *             .field("game_id", "g-1")
 *             .build()));
 * }
 * }</pre>
 *
 * @see relay.dispatch.DeliveryCoordinator
 * @see relay.dispatch.DeliveryDispatcher
 * @see relay.EventRecord
 * @see relay.SubmissionOutcome
 */
package relay;
