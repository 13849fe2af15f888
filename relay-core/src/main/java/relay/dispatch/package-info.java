/**
 * Submission orchestration and background delivery.
 *
 * <p>{@link relay.dispatch.DeliveryCoordinator} delivers one batch end-to-end under the retry
 * policy and circuit breaker and routes undeliverable sub-batches to the dead letter buffer.
 * {@link relay.dispatch.DeliveryDispatcher} puts a bounded queue and worker pool in front of it
 * so the request path only waits for enqueueing.
 *
 * @see relay.dispatch.DeliveryCoordinator
 * @see relay.dispatch.DeliveryDispatcher
 * @see relay.dispatch.QueuedBatch
 * @see relay.dispatch.ReplayReport
 */
package relay.dispatch;
