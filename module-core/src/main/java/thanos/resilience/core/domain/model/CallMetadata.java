package thanos.resilience.core.domain.model;

import java.util.Objects;

/**
 * Metadata returned alongside every successful {@code call}.
 *
 * @param usedFallback true when the value came from a fallback lookup
 * @param circuitState circuit state observed when the call completed
 * @param cacheAgeSeconds age of the served fallback or cached value, {@code null} for live data
 * @param failureCount circuit failure count observed when the call completed
 * @param stale true when a fallback value older than its TTL was served
 * @param source origin of the returned value
 */
public record CallMetadata(
    boolean usedFallback,
    CircuitState circuitState,
    Long cacheAgeSeconds,
    int failureCount,
    boolean stale,
    CallSource source) {

  public CallMetadata {
    Objects.requireNonNull(circuitState, "circuitState");
    Objects.requireNonNull(source, "source");
  }

  public static CallMetadata live(CircuitState state, int failureCount) {
    return new CallMetadata(false, state, null, failureCount, false, CallSource.LIVE);
  }

  public static CallMetadata cached(CircuitState state, int failureCount, long ageSeconds) {
    return new CallMetadata(false, state, ageSeconds, failureCount, false, CallSource.RESULT_CACHE);
  }

  public static CallMetadata fallback(
      CircuitState state, int failureCount, Long ageSeconds, boolean stale) {
    return new CallMetadata(true, state, ageSeconds, failureCount, stale, CallSource.FALLBACK);
  }
}
