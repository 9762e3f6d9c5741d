package thanos.resilience.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import thanos.resilience.error.exception.CallFailureKind;

/**
 * Ephemeral record of one protected call, published to observability and then discarded.
 *
 * @param errorKind failure classification, {@code null} unless {@code outcome == FAILURE}
 */
public record CallAttempt(
    String serviceName,
    String operationName,
    String argsFingerprint,
    Instant startedAt,
    CallOutcome outcome,
    Duration latency,
    CallFailureKind errorKind) {

  public CallAttempt {
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(argsFingerprint, "argsFingerprint");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(latency, "latency");
    if (outcome == CallOutcome.FAILURE && errorKind == null) {
      throw new IllegalArgumentException("errorKind is required for FAILURE outcome");
    }
  }
}
