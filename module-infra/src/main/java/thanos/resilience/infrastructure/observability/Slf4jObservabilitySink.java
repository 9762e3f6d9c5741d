package thanos.resilience.infrastructure.observability;

import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.port.out.ObservabilitySink;

/** 관측 이벤트를 구조화 로그로 남기는 기본 싱크 */
@Slf4j
public class Slf4jObservabilitySink implements ObservabilitySink {

  @Override
  public void accept(ObservabilityEvent event) {
    switch (event.type()) {
      case CIRCUIT_TRANSITION -> log.info(
          "[Event] 서킷 상태 전이. service={}, fields={}", event.serviceName(), event.fields());
      case POOL_EXHAUSTED, THROTTLE_REJECTED, FALLBACK_CORRUPT -> log.warn(
          "[Event] {}. service={}, fields={}", event.type(), event.serviceName(), event.fields());
      case FALLBACK_SERVED -> log.info(
          "[Event] 폴백 응답. service={}, fields={}", event.serviceName(), event.fields());
      default -> log.debug(
          "[Event] {}. service={}, fields={}", event.type(), event.serviceName(), event.fields());
    }
  }
}
