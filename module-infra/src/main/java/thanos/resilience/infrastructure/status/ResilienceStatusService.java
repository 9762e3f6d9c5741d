package thanos.resilience.infrastructure.status;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.model.CircuitState;
import thanos.resilience.infrastructure.breaker.CircuitBreakerRegistry;
import thanos.resilience.infrastructure.cache.ResultCache;
import thanos.resilience.infrastructure.config.ServiceConfigRegistry;
import thanos.resilience.infrastructure.pool.ConnectionPoolRegistry;
import thanos.resilience.infrastructure.throttle.Throttler;

/**
 * 운영자용 상태 조회 및 수동 조작
 *
 * <ul>
 *   <li>서비스별 서킷/풀/스로틀 상태 조회
 *   <li>서킷 수동 리셋, 결과 캐시 무효화
 * </ul>
 *
 * <p>조회는 풀을 새로 만들지 않습니다. 아직 호출되지 않은 서비스의 풀 통계는 null입니다.
 */
@Slf4j
@RequiredArgsConstructor
public class ResilienceStatusService {

  private final ServiceConfigRegistry serviceConfigs;
  private final CircuitBreakerRegistry breakers;
  private final ConnectionPoolRegistry pools;
  private final Throttler throttler;
  private final ResultCache resultCache;

  public ResilienceStatus status() {
    Map<String, ServiceStatus> services = new LinkedHashMap<>();
    for (String name : serviceConfigs.serviceNames()) {
      services.put(name, status(name));
    }
    return new ResilienceStatus(services, resultCache.stats());
  }

  public ServiceStatus status(String serviceName) {
    serviceConfigs.get(serviceName);
    return new ServiceStatus(
        serviceName,
        breakers.forService(serviceName).snapshot(),
        pools.stats().get(serviceName),
        throttler.stats(serviceName));
  }

  public Map<String, CircuitState> circuitHealth() {
    return breakers.circuitHealth();
  }

  public void resetCircuit(String serviceName) {
    breakers.forService(serviceName).reset();
    log.info("[Status] 서킷 수동 리셋. service={}", serviceName);
  }

  public int invalidate(String serviceName) {
    serviceConfigs.get(serviceName);
    return resultCache.invalidate(serviceName);
  }

  public int invalidate(String serviceName, String operationName) {
    serviceConfigs.get(serviceName);
    return resultCache.invalidate(serviceName, operationName);
  }
}
