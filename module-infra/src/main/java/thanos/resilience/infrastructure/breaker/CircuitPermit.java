package thanos.resilience.infrastructure.breaker;

import thanos.resilience.core.domain.model.AllowDecision;

/**
 * {@link CircuitBreaker#allow()}가 발급하는 호출 허가
 *
 * <p>{@code generation}은 발급 시점의 상태 세대입니다. 상태가 전이될 때마다 세대가 올라가므로, 이전 세대의 허가로 기록된 결과는 현재 상태의
 * 카운터와 HALF_OPEN 슬롯에 영향을 주지 않습니다.
 */
public record CircuitPermit(AllowDecision decision, long generation) {

  public boolean isAllowed() {
    return decision.isAllowed();
  }
}
