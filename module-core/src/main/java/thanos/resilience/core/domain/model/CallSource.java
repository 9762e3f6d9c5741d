package thanos.resilience.core.domain.model;

/** Where the value returned to the caller came from. */
public enum CallSource {
  LIVE,
  RESULT_CACHE,
  FALLBACK
}
