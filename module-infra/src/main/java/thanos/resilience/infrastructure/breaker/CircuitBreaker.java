package thanos.resilience.infrastructure.breaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.config.CircuitConfig;
import thanos.resilience.core.domain.model.AllowDecision;
import thanos.resilience.core.domain.model.CircuitSnapshot;
import thanos.resilience.core.domain.model.CircuitState;
import thanos.resilience.core.domain.model.CircuitTransition;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.error.exception.CallFailureKind;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;

/**
 * 서비스 1개의 서킷 브레이커
 *
 * <h3>상태 전이</h3>
 *
 * <ul>
 *   <li><b>CLOSED</b>: 연속 실패가 failureThreshold에 도달하면 OPEN. 성공 시 실패 카운트 초기화
 *   <li><b>OPEN</b>: recoveryTimeout 경과 전까지 모든 호출 차단. 경과 후 첫 allow()가 HALF_OPEN 전이 + 첫 프로브 승인
 *   <li><b>HALF_OPEN</b>: 최대 halfOpenMaxCalls개 프로브만 동시 허용. 실패 1회 → 즉시 OPEN, 성공
 *       successThreshold회 → CLOSED
 * </ul>
 *
 * <h3>동시성</h3>
 *
 * <p>모든 읽기/쓰기는 단일 {@link ReentrantLock} 아래에서 수행되어 선형화됩니다. 동시에 기록된 실패는 모두 집계되며 전이는 정확히 1회 발생합니다.
 * 전이 이벤트 발행과 로그는 락 해제 이후에 수행합니다.
 *
 * <p>결과 기록은 {@link CircuitPermit}의 세대로 구분합니다. 전이 이전 세대에 승인된 호출의 결과는 타임스탬프만 갱신하고 카운터와 슬롯은 건드리지
 * 않습니다.
 */
@Slf4j
public class CircuitBreaker {

  @Getter private final String serviceName;
  private final CircuitConfig config;
  private final Clock clock;
  private final ObservabilityPublisher publisher;
  private final ReentrantLock lock = new ReentrantLock();

  // lock 보호 대상
  private CircuitState state = CircuitState.CLOSED;
  private long generation;
  private int failureCount;
  private int successCount;
  private int halfOpenInFlight;
  private Instant lastFailureAt;
  private Instant lastSuccessAt;
  private Instant openedAt;
  private long totalCalls;
  private long shortCircuitedCalls;
  private long recoveryAttempts;

  public CircuitBreaker(
      String serviceName, CircuitConfig config, Clock clock, ObservabilityPublisher publisher) {
    this.serviceName = serviceName;
    this.config = config;
    this.clock = clock;
    this.publisher = publisher;
  }

  /**
   * 호출 허용 여부 판단. 허가를 받은 호출자는 반드시 같은 허가로 recordSuccess/recordFailure/releasePermit 중 하나를
   * 호출해야 합니다.
   */
  public CircuitPermit allow() {
    CircuitTransition transition = null;
    CircuitPermit permit;
    lock.lock();
    try {
      totalCalls++;
      Instant now = clock.instant();
      if (state == CircuitState.OPEN && recoveryTimeoutElapsed(now)) {
        transition = transitionTo(CircuitState.HALF_OPEN, "recovery_timeout_elapsed", now);
        recoveryAttempts++;
      }
      AllowDecision decision = decide();
      if (decision == AllowDecision.SHORT_CIRCUIT) {
        shortCircuitedCalls++;
      }
      permit = new CircuitPermit(decision, generation);
    } finally {
      lock.unlock();
    }
    announce(transition);
    return permit;
  }

  public void recordSuccess(CircuitPermit permit) {
    CircuitTransition transition = null;
    lock.lock();
    try {
      Instant now = clock.instant();
      lastSuccessAt = now;
      if (isStale(permit)) {
        return;
      }
      switch (state) {
        case CLOSED -> failureCount = 0;
        case HALF_OPEN -> {
          releaseProbeSlot();
          successCount++;
          if (successCount >= config.successThreshold()) {
            transition = transitionTo(CircuitState.CLOSED, "probe_succeeded", now);
          }
        }
        case OPEN -> {
          // 같은 세대의 OPEN에서는 승인된 호출이 없음
        }
      }
    } finally {
      lock.unlock();
    }
    announce(transition);
  }

  public void recordFailure(CircuitPermit permit, CallFailureKind kind) {
    CircuitTransition transition = null;
    lock.lock();
    try {
      Instant now = clock.instant();
      lastFailureAt = now;
      if (isStale(permit)) {
        return;
      }
      switch (state) {
        case CLOSED -> {
          failureCount++;
          if (failureCount >= config.failureThreshold()) {
            transition = transitionTo(CircuitState.OPEN, "failure_threshold_reached", now);
          }
        }
        case HALF_OPEN -> {
          failureCount++;
          transition = transitionTo(CircuitState.OPEN, "probe_failed", now);
        }
        case OPEN -> {
          // 같은 세대의 OPEN에서는 승인된 호출이 없음
        }
      }
    } finally {
      lock.unlock();
    }
    if (transition != null) {
      log.debug("[CircuitBreaker] 실패 기록으로 전이. service={}, kind={}", serviceName, kind);
    }
    announce(transition);
  }

  /** 성공/실패 어느 쪽도 기록하지 않고 종료된 호출(호출자 오류)의 HALF_OPEN 프로브 슬롯을 반환합니다. */
  public void releasePermit(CircuitPermit permit) {
    lock.lock();
    try {
      if (state == CircuitState.HALF_OPEN && !isStale(permit)) {
        releaseProbeSlot();
      }
    } finally {
      lock.unlock();
    }
  }

  /** 운영자 수동 복구: 상태와 관계없이 CLOSED로 되돌립니다. */
  public void reset() {
    CircuitTransition transition = null;
    lock.lock();
    try {
      if (state != CircuitState.CLOSED) {
        transition = transitionTo(CircuitState.CLOSED, "manual_reset", clock.instant());
      }
      failureCount = 0;
      successCount = 0;
    } finally {
      lock.unlock();
    }
    announce(transition);
  }

  public CircuitSnapshot snapshot() {
    lock.lock();
    try {
      return new CircuitSnapshot(
          serviceName,
          state,
          failureCount,
          successCount,
          lastFailureAt,
          lastSuccessAt,
          openedAt,
          halfOpenInFlight,
          totalCalls,
          shortCircuitedCalls,
          recoveryAttempts);
    } finally {
      lock.unlock();
    }
  }

  public CircuitState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  private AllowDecision decide() {
    return switch (state) {
      case CLOSED -> AllowDecision.PROCEED;
      case OPEN -> AllowDecision.SHORT_CIRCUIT;
      case HALF_OPEN -> {
        if (halfOpenInFlight >= config.halfOpenMaxCalls()) {
          yield AllowDecision.SHORT_CIRCUIT;
        }
        halfOpenInFlight++;
        yield AllowDecision.PROCEED;
      }
    };
  }

  /** 단락된 허가나 이전 세대의 허가는 상태에 반영하지 않음 */
  private boolean isStale(CircuitPermit permit) {
    return !permit.isAllowed() || permit.generation() != generation;
  }

  private boolean recoveryTimeoutElapsed(Instant now) {
    return Duration.between(openedAt, now).compareTo(config.recoveryTimeout()) >= 0;
  }

  private void releaseProbeSlot() {
    if (halfOpenInFlight > 0) {
      halfOpenInFlight--;
    }
  }

  /** lock 보유 상태에서만 호출 */
  private CircuitTransition transitionTo(CircuitState target, String reason, Instant now) {
    CircuitState from = state;
    state = target;
    generation++;
    switch (target) {
      case OPEN -> {
        openedAt = now;
        successCount = 0;
        halfOpenInFlight = 0;
      }
      case HALF_OPEN -> {
        successCount = 0;
        halfOpenInFlight = 0;
      }
      case CLOSED -> {
        openedAt = null;
        failureCount = 0;
        successCount = 0;
        halfOpenInFlight = 0;
      }
    }
    return new CircuitTransition(serviceName, from, target, reason, now);
  }

  private void announce(CircuitTransition transition) {
    if (transition == null) {
      return;
    }
    log.info(
        "[CircuitBreaker] 상태 전이. service={}, {} -> {}, reason={}",
        serviceName,
        transition.from(),
        transition.to(),
        transition.reason());
    publisher.publish(ObservabilityEvent.transition(transition));
  }
}
