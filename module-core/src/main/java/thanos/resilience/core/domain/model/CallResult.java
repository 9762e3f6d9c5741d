package thanos.resilience.core.domain.model;

import java.util.Objects;

/**
 * Value returned by a protected call together with its metadata.
 *
 * @param <T> result type
 */
public record CallResult<T>(T value, CallMetadata metadata) {

  public CallResult {
    Objects.requireNonNull(metadata, "metadata");
  }
}
