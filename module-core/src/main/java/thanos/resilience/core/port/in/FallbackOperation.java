package thanos.resilience.core.port.in;

import java.util.Optional;
import thanos.resilience.core.domain.model.FallbackValue;

/**
 * Degraded-mode value source used when the live call is unavailable.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface FallbackOperation<T> {

  Optional<FallbackValue<T>> lookup();

  /** A fallback that never has data. */
  static <T> FallbackOperation<T> none() {
    return Optional::empty;
  }

  /** A fallback that always returns the given constant. */
  static <T> FallbackOperation<T> constant(T value) {
    return () -> Optional.of(FallbackValue.of(value));
  }
}
