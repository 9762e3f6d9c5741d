package thanos.resilience.core.domain.model;

/**
 * Value produced by a fallback lookup.
 *
 * @param value decoded value
 * @param ageSeconds age of the value, {@code null} when unknown
 * @param stale true when older than its freshness window
 * @param <T> value type
 */
public record FallbackValue<T>(T value, Long ageSeconds, boolean stale) {

  public static <T> FallbackValue<T> of(T value) {
    return new FallbackValue<>(value, null, false);
  }
}
