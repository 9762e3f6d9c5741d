package thanos.resilience.core.domain.model;

/** Terminal outcome of one protected call attempt. */
public enum CallOutcome {
  SUCCESS,
  FAILURE,
  SHORT_CIRCUITED,
  THROTTLED,
  POOL_EXHAUSTED,
  EXECUTOR_SATURATED,
  CACHE_HIT
}
