/**
 * Bounded holding area for deferred sub-batches, with lazy, restartable replay.
 *
 * @see relay.dead.DeadLetterBuffer
 * @see relay.dead.ReplaySession
 */
package relay.dead;
