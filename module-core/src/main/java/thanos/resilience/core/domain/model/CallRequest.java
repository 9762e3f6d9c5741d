package thanos.resilience.core.domain.model;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifies one logical call against an external service.
 *
 * <p>{@code args} is part of the cache key and must be JSON-serializable. {@code resultType} is
 * used to decode fallback payloads; pass a {@link Class} or any generic {@link Type}.
 *
 * @param serviceName configured service name
 * @param operationName adapter operation (e.g. {@code searchDocs})
 * @param args call arguments
 * @param resultType declared type of the fetch result
 * @param deadline optional upper bound on the live fetch, {@code null} for none
 * @param <T> result type
 */
public record CallRequest<T>(
    String serviceName,
    String operationName,
    Map<String, Object> args,
    Type resultType,
    Duration deadline) {

  public CallRequest {
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalArgumentException("serviceName cannot be null or blank");
    }
    if (operationName == null || operationName.isBlank()) {
      throw new IllegalArgumentException("operationName cannot be null or blank");
    }
    if (resultType == null) {
      throw new IllegalArgumentException("resultType cannot be null");
    }
    if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
      throw new IllegalArgumentException("deadline must be positive: " + deadline);
    }
    args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
  }

  public static <T> CallRequest<T> of(
      String serviceName, String operationName, Map<String, Object> args, Class<T> resultType) {
    return new CallRequest<>(serviceName, operationName, args, resultType, null);
  }

  /** Returns a copy bounded by the given deadline. */
  public CallRequest<T> withDeadline(Duration newDeadline) {
    return new CallRequest<>(serviceName, operationName, args, resultType, newDeadline);
  }

  public boolean hasDeadline() {
    return deadline != null;
  }
}
