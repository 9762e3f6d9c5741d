package thanos.resilience.core.domain.model;

import java.time.Instant;

/**
 * Consistent point-in-time copy of a circuit, taken under the circuit's lock.
 *
 * <p>Timestamps are {@code null} until the corresponding event has happened at least once.
 */
public record CircuitSnapshot(
    String serviceName,
    CircuitState state,
    int failureCount,
    int successCount,
    Instant lastFailureAt,
    Instant lastSuccessAt,
    Instant openedAt,
    int halfOpenInFlight,
    long totalCalls,
    long shortCircuitedCalls,
    long recoveryAttempts) {

  public boolean isHealthy() {
    return state == CircuitState.CLOSED;
  }
}
