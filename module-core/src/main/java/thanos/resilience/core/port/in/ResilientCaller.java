package thanos.resilience.core.port.in;

import thanos.resilience.core.domain.model.CallRequest;
import thanos.resilience.core.domain.model.CallResult;

/**
 * Entry point for every protected external call.
 *
 * <p>Only {@code NoFallbackAvailableException} and caller programming errors escape; every other
 * failure is absorbed into a fallback result.
 */
public interface ResilientCaller {

  /**
   * Call with an explicit fallback.
   *
   * @param request call identity and deadline
   * @param fetch live call
   * @param fallback degraded-mode source
   * @return value and metadata
   */
  <T> CallResult<T> call(
      CallRequest<T> request, FetchOperation<T> fetch, FallbackOperation<T> fallback);

  /** Call using the fallback store entry recorded by the last successful live call. */
  <T> CallResult<T> call(CallRequest<T> request, FetchOperation<T> fetch);
}
