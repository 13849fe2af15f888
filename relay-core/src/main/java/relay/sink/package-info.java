/**
 * Sink adapter contract, error taxonomy and the in-memory sink used in tests and local runs.
 */
package relay.sink;
