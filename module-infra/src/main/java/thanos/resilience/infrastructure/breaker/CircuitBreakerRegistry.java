package thanos.resilience.infrastructure.breaker;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import thanos.resilience.core.domain.config.CircuitConfig;
import thanos.resilience.core.domain.model.CircuitSnapshot;
import thanos.resilience.core.domain.model.CircuitState;
import thanos.resilience.infrastructure.config.ServiceConfigRegistry;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;

/**
 * 서비스별 서킷 브레이커 레지스트리
 *
 * <p>첫 호출 시 CLOSED 상태로 지연 생성되며 메모리에만 존재합니다. 재시작하면 모든 서킷은 CLOSED로 시작합니다.
 */
@RequiredArgsConstructor
public class CircuitBreakerRegistry {

  private final ServiceConfigRegistry serviceConfigs;
  private final Clock clock;
  private final ObservabilityPublisher publisher;
  private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

  public CircuitBreaker forService(String serviceName) {
    CircuitBreaker existing = breakers.get(serviceName);
    if (existing != null) {
      return existing;
    }
    // 미등록 서비스는 computeIfAbsent 바깥에서 예외를 던지도록 먼저 조회
    CircuitConfig config = serviceConfigs.get(serviceName).circuit();
    return breakers.computeIfAbsent(
        serviceName, name -> new CircuitBreaker(name, config, clock, publisher));
  }

  /** 지금까지 생성된 서킷의 스냅샷 */
  public Map<String, CircuitSnapshot> snapshots() {
    Map<String, CircuitSnapshot> result = new TreeMap<>();
    breakers.forEach((name, breaker) -> result.put(name, breaker.snapshot()));
    return result;
  }

  /** 서비스별 현재 상태 (아직 호출되지 않은 서비스는 CLOSED) */
  public Map<String, CircuitState> circuitHealth() {
    Map<String, CircuitState> result = new TreeMap<>();
    for (String name : serviceConfigs.serviceNames()) {
      CircuitBreaker breaker = breakers.get(name);
      result.put(name, breaker == null ? CircuitState.CLOSED : breaker.state());
    }
    return result;
  }
}
