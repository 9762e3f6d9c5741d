package thanos.resilience.infrastructure.status;

import java.util.Map;
import thanos.resilience.infrastructure.cache.ResultCacheStats;

/** 전체 접근 계층 상태 스냅샷 */
public record ResilienceStatus(Map<String, ServiceStatus> services, ResultCacheStats resultCache) {}
