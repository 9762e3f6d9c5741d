package thanos.resilience.core.port.out;

import java.time.Duration;
import java.util.Optional;
import thanos.resilience.core.domain.model.FallbackLookup;

/**
 * Port for durable last-known-good payloads.
 *
 * <p>Implementations must never throw from {@link #get}: a missing or unreadable entry is reported
 * as {@link Optional#empty()}. Writes are last-write-wins.
 */
public interface FallbackStore {

  /**
   * Look up the entry stored for a key.
   *
   * @param key fallback key
   * @return the entry with its age and staleness, or empty when missing or corrupt
   */
  Optional<FallbackLookup> get(String key);

  /**
   * Store a payload, replacing any previous entry.
   *
   * @param key fallback key
   * @param payload serialized JSON value
   * @param ttl freshness window
   */
  void put(String key, byte[] payload, Duration ttl);

  /**
   * Remove an entry.
   *
   * @return true if an entry was removed
   */
  boolean delete(String key);
}
