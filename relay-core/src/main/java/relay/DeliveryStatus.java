package relay;

import relay.circuit.CircuitState;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time view of the delivery core for operational tooling.
 *
 * @param circuitState   current circuit breaker state
 * @param deadLetterSize entries waiting in the dead letter buffer
 * @param sinkHealthy    result of the sink's health probe
 * @param checkedAt      when the snapshot was taken
 */
public record DeliveryStatus(CircuitState circuitState, int deadLetterSize, boolean sinkHealthy,
    Instant checkedAt) {

  public DeliveryStatus {
    Objects.requireNonNull(circuitState, "circuitState");
    Objects.requireNonNull(checkedAt, "checkedAt");
  }

  /**
   * Returns {@code "healthy"} when the sink probe passes and the circuit is closed,
   * {@code "degraded"} otherwise.
   *
   * @return the health label
   */
  public String health() {
    return sinkHealthy && circuitState == CircuitState.CLOSED ? "healthy" : "degraded";
  }
}
