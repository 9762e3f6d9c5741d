package thanos.resilience.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Last-known-good payload stored for a call key.
 *
 * <p>Staleness is reported by {@link #lookup(Instant)} and never causes deletion.
 *
 * @param key fallback key
 * @param payload serialized JSON value
 * @param createdAt time of the successful call that produced the payload
 * @param ttlSeconds freshness window in seconds
 */
public record FallbackEntry(String key, byte[] payload, Instant createdAt, long ttlSeconds) {

  public FallbackEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
    if (ttlSeconds < 0) {
      throw new IllegalArgumentException("ttlSeconds must not be negative: " + ttlSeconds);
    }
  }

  public long ageSeconds(Instant now) {
    return Math.max(0, Duration.between(createdAt, now).getSeconds());
  }

  public boolean isStale(Instant now) {
    return ageSeconds(now) > ttlSeconds;
  }

  public FallbackLookup lookup(Instant now) {
    long age = ageSeconds(now);
    return new FallbackLookup(this, age, age > ttlSeconds);
  }
}
