/**
 * Circuit breaker shared by all submissions.
 */
package relay.circuit;
