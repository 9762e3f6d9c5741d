package thanos.resilience.core.domain.model;

public enum ObservabilityEventType {
  CIRCUIT_TRANSITION,
  POOL_EXHAUSTED,
  THROTTLE_REJECTED,
  CACHE_HIT,
  CACHE_MISS,
  FALLBACK_SERVED,
  FALLBACK_CORRUPT,
  CALL_COMPLETED
}
