package thanos.resilience.infrastructure.fallback;

import com.github.benmanes.caffeine.cache.Cache;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.model.FallbackEntry;
import thanos.resilience.core.domain.model.FallbackLookup;
import thanos.resilience.core.port.out.FallbackStore;

/**
 * 2계층 폴백 저장소 (L1: Caffeine, L2: 파일)
 *
 * <ul>
 *   <li><b>조회</b>: L1 → L2, L2 히트 시 L1 백필
 *   <li><b>저장</b>: L2 먼저 기록 후 L1 갱신. L2 실패 시 L1은 건드리지 않음
 *   <li><b>신선도</b>: L1 만료는 메모리 한도용이며, stale 판정은 항상 엔트리의 createdAt/ttl로 계산
 * </ul>
 */
@Slf4j
public class TieredFallbackStore implements FallbackStore {

  private final Cache<String, FallbackEntry> l1;
  private final FileFallbackStore l2;
  private final Clock clock;

  public TieredFallbackStore(Cache<String, FallbackEntry> l1, FileFallbackStore l2, Clock clock) {
    this.l1 = l1;
    this.l2 = l2;
    this.clock = clock;
  }

  @Override
  public Optional<FallbackLookup> get(String key) {
    FallbackEntry cached = l1.getIfPresent(key);
    if (cached != null) {
      log.debug("[TieredFallback] L1 HIT. key={}", key);
      return Optional.of(cached.lookup(clock.instant()));
    }
    Optional<FallbackEntry> fromDisk = l2.read(key);
    fromDisk.ifPresent(
        entry -> {
          l1.put(key, entry);
          log.debug("[TieredFallback] L2 HIT, L1 백필. key={}", key);
        });
    return fromDisk.map(entry -> entry.lookup(clock.instant()));
  }

  @Override
  public void put(String key, byte[] payload, Duration ttl) {
    FallbackEntry entry = new FallbackEntry(key, payload, clock.instant(), ttl.getSeconds());
    l2.write(entry);
    l1.put(key, entry);
  }

  @Override
  public boolean delete(String key) {
    l1.invalidate(key);
    return l2.delete(key);
  }

  public int clear() {
    l1.invalidateAll();
    return l2.clear();
  }
}
