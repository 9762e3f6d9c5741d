package thanos.resilience.infrastructure.throttle;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.config.ThrottleConfig;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.infrastructure.config.ServiceConfigRegistry;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;

/**
 * 서비스별 호출 스로틀러
 *
 * <ul>
 *   <li>{@link #tryAcquire}는 절대 대기하지 않음: 한도 초과 시 즉시 거절 결과 반환
 *   <li>토큰 반납은 멱등이며, 호출자는 모든 종료 경로에서 반납해야 함
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class Throttler {

  private final ServiceConfigRegistry serviceConfigs;
  private final Clock clock;
  private final ObservabilityPublisher publisher;
  private final Map<String, ServiceThrottle> throttles = new ConcurrentHashMap<>();

  public ThrottleResult tryAcquire(String serviceName) {
    ThrottleResult result = throttleFor(serviceName).tryAcquire(clock.millis());
    if (result.isAdmitted()) {
      return result;
    }
    log.warn(
        "[Throttler] 호출 한도 초과로 거절. service={}, limit={}, retryAfterMs={}",
        serviceName,
        result.violatedLimit(),
        result.retryAfterMillis());
    publisher.publish(
        new ObservabilityEvent(
            ObservabilityEventType.THROTTLE_REJECTED,
            serviceName,
            clock.instant(),
            Map.of(
                "limit", result.violatedLimit(), "retryAfterMillis", result.retryAfterMillis())));
    return result;
  }

  public void release(ThrottleToken token) {
    if (token != null) {
      token.release();
    }
  }

  public ThrottleStats stats(String serviceName) {
    return throttleFor(serviceName).stats(clock.millis());
  }

  public Map<String, ThrottleStats> stats() {
    Map<String, ThrottleStats> result = new TreeMap<>();
    long now = clock.millis();
    throttles.forEach((name, throttle) -> result.put(name, throttle.stats(now)));
    return result;
  }

  private ServiceThrottle throttleFor(String serviceName) {
    ServiceThrottle existing = throttles.get(serviceName);
    if (existing != null) {
      return existing;
    }
    ThrottleConfig config = serviceConfigs.get(serviceName).throttle();
    return throttles.computeIfAbsent(serviceName, name -> new ServiceThrottle(name, config));
  }
}
