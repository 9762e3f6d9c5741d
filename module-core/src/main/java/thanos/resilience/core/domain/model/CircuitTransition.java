package thanos.resilience.core.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single circuit state change.
 *
 * @param serviceName the service whose circuit changed
 * @param from previous state
 * @param to new state
 * @param reason short machine-readable reason (e.g. {@code failure_threshold_reached})
 * @param timestamp when the change happened
 */
public record CircuitTransition(
    String serviceName, CircuitState from, CircuitState to, String reason, Instant timestamp) {

  public CircuitTransition {
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
