package thanos.resilience.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * 성공 결과 전용 TTL 캐시 (프로세스 메모리)
 *
 * <h3>정책</h3>
 *
 * <ul>
 *   <li>성공한 호출 결과만 저장. 실패는 절대 캐시하지 않음
 *   <li>만료 엔트리는 접근 시점에 지연 삭제 (별도 스윕 스레드 없음)
 *   <li>용량 초과 시 만료 엔트리를 먼저 비우고, 그래도 가득 차면 유효 엔트리 중 LRU 1건 제거
 *   <li>무효화: 키 단위, 서비스 단위, (서비스, 작업) 단위
 * </ul>
 */
@Slf4j
public class ResultCache {

  private final int maxEntries;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();

  // lock 보호 대상 (access-order LinkedHashMap: 첫 엔트리가 LRU)
  private final LinkedHashMap<CallFingerprint, CacheEntry> entries =
      new LinkedHashMap<>(16, 0.75f, true);
  private long hits;
  private long misses;
  private long sets;
  private long evictions;
  private long expirations;

  public ResultCache(int maxEntries, Clock clock) {
    if (maxEntries < 1) {
      throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
    }
    this.maxEntries = maxEntries;
    this.clock = clock;
  }

  public Optional<CacheEntry> get(CallFingerprint key) {
    lock.lock();
    try {
      CacheEntry entry = entries.get(key);
      if (entry == null) {
        misses++;
        return Optional.empty();
      }
      if (entry.isExpired(clock.instant())) {
        entries.remove(key);
        expirations++;
        misses++;
        return Optional.empty();
      }
      hits++;
      CacheEntry touched = entry.withHit();
      entries.put(key, touched);
      return Optional.of(touched);
    } finally {
      lock.unlock();
    }
  }

  /** TTL이 0 이하이면 저장하지 않습니다. */
  public void set(CallFingerprint key, Object value, Duration ttl) {
    if (ttl.isZero() || ttl.isNegative()) {
      return;
    }
    lock.lock();
    try {
      Instant now = clock.instant();
      if (!entries.containsKey(key) && entries.size() >= maxEntries) {
        makeRoom(now);
      }
      entries.put(key, new CacheEntry(key, value, now, ttl.getSeconds(), 0));
      sets++;
    } finally {
      lock.unlock();
    }
  }

  public boolean invalidate(CallFingerprint key) {
    lock.lock();
    try {
      return entries.remove(key) != null;
    } finally {
      lock.unlock();
    }
  }

  public int invalidate(String serviceName) {
    return removeIf(key -> key.serviceName().equals(serviceName));
  }

  public int invalidate(String serviceName, String operationName) {
    return removeIf(
        key ->
            key.serviceName().equals(serviceName) && key.operationName().equals(operationName));
  }

  public void clear() {
    lock.lock();
    try {
      entries.clear();
    } finally {
      lock.unlock();
    }
  }

  public ResultCacheStats stats() {
    lock.lock();
    try {
      return new ResultCacheStats(
          hits, misses, sets, evictions, expirations, entries.size(), maxEntries);
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** lock 보유 상태에서만 호출 */
  private void makeRoom(Instant now) {
    Iterator<Map.Entry<CallFingerprint, CacheEntry>> it = entries.entrySet().iterator();
    while (it.hasNext()) {
      if (it.next().getValue().isExpired(now)) {
        it.remove();
        expirations++;
      }
    }
    if (entries.size() >= maxEntries) {
      Iterator<CallFingerprint> lru = entries.keySet().iterator();
      CallFingerprint victim = lru.next();
      lru.remove();
      evictions++;
      log.debug("[ResultCache] 용량 초과로 LRU 제거. key={}", victim);
    }
  }

  private int removeIf(Predicate<CallFingerprint> predicate) {
    lock.lock();
    try {
      int before = entries.size();
      entries.keySet().removeIf(predicate);
      int removed = before - entries.size();
      if (removed > 0) {
        log.info("[ResultCache] 캐시 무효화. removed={}", removed);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }
}
