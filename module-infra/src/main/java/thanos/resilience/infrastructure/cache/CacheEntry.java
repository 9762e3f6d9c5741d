package thanos.resilience.infrastructure.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * 결과 캐시 엔트리. 값은 불변이며 갱신은 엔트리 전체 교체로만 이루어집니다.
 *
 * @param key 캐시 키
 * @param value 성공 호출 결과
 * @param storedAt 저장 시각
 * @param ttlSeconds 유효 기간
 * @param hitCount 누적 히트 수
 */
public record CacheEntry(
    CallFingerprint key, Object value, Instant storedAt, long ttlSeconds, long hitCount) {

  public boolean isExpired(Instant now) {
    return Duration.between(storedAt, now).getSeconds() >= ttlSeconds;
  }

  public long ageSeconds(Instant now) {
    return Math.max(0, Duration.between(storedAt, now).getSeconds());
  }

  CacheEntry withHit() {
    return new CacheEntry(key, value, storedAt, ttlSeconds, hitCount + 1);
  }
}
