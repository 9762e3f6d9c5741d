package thanos.resilience.core.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured event emitted by the access layer.
 *
 * @param type event type
 * @param serviceName service the event concerns
 * @param timestamp when the event happened
 * @param fields event-specific attributes, in insertion order
 */
public record ObservabilityEvent(
    ObservabilityEventType type, String serviceName, Instant timestamp, Map<String, Object> fields) {

  public ObservabilityEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(timestamp, "timestamp");
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static ObservabilityEvent of(
      ObservabilityEventType type, String serviceName, Instant timestamp) {
    return new ObservabilityEvent(type, serviceName, timestamp, Map.of());
  }

  public static ObservabilityEvent transition(CircuitTransition transition) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("from", transition.from());
    fields.put("to", transition.to());
    fields.put("reason", transition.reason());
    return new ObservabilityEvent(
        ObservabilityEventType.CIRCUIT_TRANSITION,
        transition.serviceName(),
        transition.timestamp(),
        fields);
  }

  public static ObservabilityEvent completed(CallAttempt attempt) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("operation", attempt.operationName());
    fields.put("fingerprint", attempt.argsFingerprint());
    fields.put("outcome", attempt.outcome());
    fields.put("latencyMs", attempt.latency().toMillis());
    if (attempt.errorKind() != null) {
      fields.put("errorKind", attempt.errorKind());
    }
    return new ObservabilityEvent(
        ObservabilityEventType.CALL_COMPLETED,
        attempt.serviceName(),
        attempt.startedAt().plus(attempt.latency()),
        fields);
  }

  public Object field(String name) {
    return fields.get(name);
  }
}
