package thanos.resilience.infrastructure.cache;

/** 결과 캐시 누적 통계 */
public record ResultCacheStats(
    long hits, long misses, long sets, long evictions, long expirations, int size, int maxEntries) {

  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
