package thanos.resilience.core.domain.model;

/** Circuit breaker state. */
public enum CircuitState {
  /** Calls flow normally; consecutive failures are counted. */
  CLOSED,
  /** Calls are short-circuited until the recovery timeout elapses. */
  OPEN,
  /** A bounded number of probe calls are admitted to test recovery. */
  HALF_OPEN
}
