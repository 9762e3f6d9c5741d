package thanos.resilience.infrastructure.facade;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.config.ServiceConfig;
import thanos.resilience.core.domain.model.CallAttempt;
import thanos.resilience.core.domain.model.CallMetadata;
import thanos.resilience.core.domain.model.CallOutcome;
import thanos.resilience.core.domain.model.CallRequest;
import thanos.resilience.core.domain.model.CallResult;
import thanos.resilience.core.domain.model.CircuitSnapshot;
import thanos.resilience.core.domain.model.FallbackLookup;
import thanos.resilience.core.domain.model.FallbackValue;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.core.port.in.FallbackOperation;
import thanos.resilience.core.port.in.FetchOperation;
import thanos.resilience.core.port.in.ResilientCaller;
import thanos.resilience.core.port.out.FallbackStore;
import thanos.resilience.error.exception.CallFailedException;
import thanos.resilience.error.exception.CallFailureKind;
import thanos.resilience.error.exception.ExecutorSaturatedException;
import thanos.resilience.error.exception.FallbackCorruptException;
import thanos.resilience.error.exception.FallbackPersistenceException;
import thanos.resilience.error.exception.NoFallbackAvailableException;
import thanos.resilience.error.exception.PoolExhaustedException;
import thanos.resilience.error.exception.ShortCircuitedException;
import thanos.resilience.error.exception.ThrottledException;
import thanos.resilience.infrastructure.breaker.CircuitBreaker;
import thanos.resilience.infrastructure.breaker.CircuitBreakerRegistry;
import thanos.resilience.infrastructure.breaker.CircuitPermit;
import thanos.resilience.infrastructure.cache.CacheEntry;
import thanos.resilience.infrastructure.cache.CallFingerprint;
import thanos.resilience.infrastructure.cache.CallFingerprinter;
import thanos.resilience.infrastructure.cache.ResultCache;
import thanos.resilience.infrastructure.config.ServiceConfigRegistry;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;
import thanos.resilience.infrastructure.pool.ConnectionPool;
import thanos.resilience.infrastructure.pool.ConnectionPoolRegistry;
import thanos.resilience.infrastructure.pool.PooledConnection;
import thanos.resilience.infrastructure.throttle.ThrottleResult;
import thanos.resilience.infrastructure.throttle.Throttler;
import thanos.resilience.infrastructure.util.ExceptionUtils;

/**
 * 외부 서비스 호출 단일 진입점
 *
 * <h3>호출 흐름</h3>
 *
 * <ol>
 *   <li>결과 캐시 히트 → 즉시 반환 (스로틀/브레이커/풀 미사용). 캐시 값이 요청 타입과 다르면 미스로 처리
 *   <li>스로틀 거절 → 폴백 (브레이커 미기록)
 *   <li>서킷 차단 → 폴백
 *   <li>풀 대여 → fetch. 성공 시 커넥션 정상 반납, 브레이커 성공 기록, 결과 캐시 + 폴백 저장(best-effort). 실패 시 커넥션 폐기, 브레이커 실패
 *       기록 → 폴백
 *   <li>fetch executor 포화(거절 또는 데드라인 안에 미시작) → 커넥션 정상 반납, 브레이커 미기록 → 폴백
 *   <li>폴백 데이터 없음 → {@link NoFallbackAvailableException}
 *   <li>스로틀 토큰은 모든 종료 경로에서 반납
 * </ol>
 *
 * <p>브레이커 결과는 {@code allow()}가 발급한 {@link CircuitPermit}으로 기록합니다.
 *
 * <h3>호출자 오류</h3>
 *
 * <p>fetch가 {@code CircuitBreakerIgnoreMarker} 예외(예: {@code InvalidCallArgumentException})를 던지면 브레이커에
 * 기록하지 않고 그대로 전파합니다. 재시도는 하지 않습니다.
 */
@Slf4j
public class ResilientCallFacade implements ResilientCaller {

  private final ServiceConfigRegistry serviceConfigs;
  private final CallFingerprinter fingerprinter;
  private final ResultCache resultCache;
  private final Throttler throttler;
  private final CircuitBreakerRegistry breakers;
  private final ConnectionPoolRegistry pools;
  private final FallbackStore fallbackStore;
  private final FallbackPayloadCodec payloadCodec;
  private final FailureClassifier failureClassifier;
  private final DeadlineInvoker deadlineInvoker;
  private final ObservabilityPublisher publisher;
  private final Clock clock;

  public ResilientCallFacade(
      ServiceConfigRegistry serviceConfigs,
      CallFingerprinter fingerprinter,
      ResultCache resultCache,
      Throttler throttler,
      CircuitBreakerRegistry breakers,
      ConnectionPoolRegistry pools,
      FallbackStore fallbackStore,
      FallbackPayloadCodec payloadCodec,
      FailureClassifier failureClassifier,
      DeadlineInvoker deadlineInvoker,
      ObservabilityPublisher publisher,
      Clock clock) {
    this.serviceConfigs = serviceConfigs;
    this.fingerprinter = fingerprinter;
    this.resultCache = resultCache;
    this.throttler = throttler;
    this.breakers = breakers;
    this.pools = pools;
    this.fallbackStore = fallbackStore;
    this.payloadCodec = payloadCodec;
    this.failureClassifier = failureClassifier;
    this.deadlineInvoker = deadlineInvoker;
    this.publisher = publisher;
    this.clock = clock;
  }

  @Override
  public <T> CallResult<T> call(CallRequest<T> request, FetchOperation<T> fetch) {
    CallFingerprint fingerprint = fingerprinter.fingerprint(request);
    return execute(request, fingerprint, fetch, storeFallback(request, fingerprint));
  }

  @Override
  public <T> CallResult<T> call(
      CallRequest<T> request, FetchOperation<T> fetch, FallbackOperation<T> fallback) {
    CallFingerprint fingerprint = fingerprinter.fingerprint(request);
    return execute(request, fingerprint, fetch, fallback);
  }

  private <T> CallResult<T> execute(
      CallRequest<T> request,
      CallFingerprint fingerprint,
      FetchOperation<T> fetch,
      FallbackOperation<T> fallback) {
    ServiceConfig config = serviceConfigs.get(request.serviceName());
    CallContext<T> ctx = new CallContext<>(request, fingerprint, fallback, clock.instant());
    CircuitBreaker breaker = breakers.forService(request.serviceName());

    // 1. 결과 캐시
    if (config.isResultCacheEnabled()) {
      Optional<CacheEntry> cached =
          resultCache.get(fingerprint).filter(entry -> matchesResultType(ctx, entry));
      if (cached.isPresent()) {
        return serveCached(ctx, breaker, cached.get());
      }
      publishCacheEvent(ObservabilityEventType.CACHE_MISS, ctx);
    }

    // 2. 스로틀
    ThrottleResult throttle = throttler.tryAcquire(request.serviceName());
    if (!throttle.isAdmitted()) {
      ThrottledException rejected =
          new ThrottledException(request.serviceName(), throttle.violatedLimit());
      return fallbackOrThrow(ctx, breaker, rejected, CallOutcome.THROTTLED, null);
    }
    try {
      // 3. 서킷 브레이커
      CircuitPermit permit = breaker.allow();
      if (!permit.isAllowed()) {
        ShortCircuitedException shortCircuited =
            new ShortCircuitedException(request.serviceName());
        return fallbackOrThrow(ctx, breaker, shortCircuited, CallOutcome.SHORT_CIRCUITED, null);
      }
      // 4. 커넥션 풀 + fetch
      return callLive(ctx, config, breaker, permit, fetch);
    } finally {
      // 6. 토큰 반납
      throttler.release(throttle.token());
    }
  }

  private <T> CallResult<T> callLive(
      CallContext<T> ctx,
      ServiceConfig config,
      CircuitBreaker breaker,
      CircuitPermit permit,
      FetchOperation<T> fetch) {
    String serviceName = ctx.request().serviceName();
    ConnectionPool<?> pool = pools.forService(serviceName);
    PooledConnection<?> acquired;
    try {
      acquired = pool.acquire();
    } catch (PoolExhaustedException e) {
      breaker.releasePermit(permit);
      return fallbackOrThrow(ctx, breaker, e, CallOutcome.POOL_EXHAUSTED, null);
    } catch (CallFailedException e) {
      breaker.recordFailure(permit, e.getKind());
      return fallbackOrThrow(ctx, breaker, e, CallOutcome.FAILURE, e.getKind());
    }

    PooledConnection<?> connection = acquired;
    T value;
    try {
      value =
          deadlineInvoker.invoke(
              () -> fetch.fetch(connection), ctx.request().deadline(), serviceName);
    } catch (ExecutorSaturatedException e) {
      // fetch가 시작되지 않았으므로 커넥션은 건강, 다운스트림 결과도 없음
      pool.release(connection, true);
      breaker.releasePermit(permit);
      return fallbackOrThrow(ctx, breaker, e, CallOutcome.EXECUTOR_SATURATED, null);
    } catch (Error error) {
      pool.release(connection, false);
      breaker.releasePermit(permit);
      throw error;
    } catch (Exception e) {
      return onFetchFailure(ctx, breaker, permit, pool, connection, e);
    }

    pool.release(connection, true);
    breaker.recordSuccess(permit);
    rememberSuccess(ctx, config, value);
    publishCompleted(ctx, CallOutcome.SUCCESS, null);
    CircuitSnapshot snapshot = breaker.snapshot();
    return new CallResult<>(
        value, CallMetadata.live(snapshot.state(), snapshot.failureCount()));
  }

  private <T> CallResult<T> onFetchFailure(
      CallContext<T> ctx,
      CircuitBreaker breaker,
      CircuitPermit permit,
      ConnectionPool<?> pool,
      PooledConnection<?> connection,
      Exception e) {
    Throwable cause = ExceptionUtils.unwrap(e);
    if (failureClassifier.isProgrammingError(cause)) {
      pool.release(connection, true);
      breaker.releasePermit(permit);
      throw propagateProgrammingError(cause);
    }

    CallFailureKind kind = failureClassifier.classify(cause);
    pool.release(connection, false);
    breaker.recordFailure(permit, kind);
    log.warn(
        "[ResilientCall] 외부 호출 실패. service={}, operation={}, kind={}",
        ctx.request().serviceName(),
        ctx.request().operationName(),
        kind,
        cause);
    CallFailedException failure =
        cause instanceof CallFailedException callFailed
            ? callFailed
            : new CallFailedException(ctx.request().serviceName(), kind, cause);
    return fallbackOrThrow(ctx, breaker, failure, CallOutcome.FAILURE, kind);
  }

  // ========================================
  // 5. 폴백
  // ========================================

  private <T> CallResult<T> fallbackOrThrow(
      CallContext<T> ctx,
      CircuitBreaker breaker,
      RuntimeException reason,
      CallOutcome outcome,
      CallFailureKind kind) {
    publishCompleted(ctx, outcome, kind);
    Optional<FallbackValue<T>> fallbackValue = lookupFallback(ctx, reason);
    CircuitSnapshot snapshot = breaker.snapshot();
    if (fallbackValue.isEmpty()) {
      log.warn(
          "[ResilientCall] 폴백 데이터 없음. service={}, operation={}, reason={}",
          ctx.request().serviceName(),
          ctx.request().operationName(),
          outcome);
      throw new NoFallbackAvailableException(
          ctx.request().serviceName(), ctx.request().operationName(), reason);
    }

    FallbackValue<T> served = fallbackValue.get();
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("operation", ctx.request().operationName());
    fields.put("reason", outcome);
    fields.put("stale", served.stale());
    if (served.ageSeconds() != null) {
      fields.put("ageSeconds", served.ageSeconds());
    }
    publisher.publish(
        new ObservabilityEvent(
            ObservabilityEventType.FALLBACK_SERVED,
            ctx.request().serviceName(),
            clock.instant(),
            fields));
    return new CallResult<>(
        served.value(),
        CallMetadata.fallback(
            snapshot.state(), snapshot.failureCount(), served.ageSeconds(), served.stale()));
  }

  private <T> Optional<FallbackValue<T>> lookupFallback(CallContext<T> ctx, RuntimeException reason) {
    try {
      return ctx.fallback().lookup();
    } catch (RuntimeException lookupFailure) {
      log.warn(
          "[ResilientCall] 폴백 조회 실패, 데이터 없음으로 처리. service={}, operation={}",
          ctx.request().serviceName(),
          ctx.request().operationName(),
          lookupFailure);
      reason.addSuppressed(lookupFailure);
      return Optional.empty();
    }
  }

  /** 마지막 성공 결과를 폴백 저장소에서 읽어 요청 타입으로 복원하는 기본 폴백 */
  private <T> FallbackOperation<T> storeFallback(
      CallRequest<T> request, CallFingerprint fingerprint) {
    return () -> {
      Optional<FallbackLookup> lookup = fallbackStore.get(fingerprint.key());
      if (lookup.isEmpty()) {
        return Optional.empty();
      }
      FallbackLookup found = lookup.get();
      try {
        T value =
            payloadCodec.decode(
                fingerprint.key(), found.entry().payload(), request.resultType());
        return Optional.of(new FallbackValue<>(value, found.ageSeconds(), found.stale()));
      } catch (FallbackCorruptException e) {
        return treatUndecodableAsMissing(request, fingerprint, e);
      }
    };
  }

  private <T> Optional<FallbackValue<T>> treatUndecodableAsMissing(
      CallRequest<T> request, CallFingerprint fingerprint, FallbackCorruptException e) {
    log.warn(
        "[ResilientCall] 폴백 payload 복원 실패, 데이터 없음으로 처리. key={}, type={}",
        fingerprint.key(),
        request.resultType().getTypeName(),
        e);
    publisher.publish(
        new ObservabilityEvent(
            ObservabilityEventType.FALLBACK_CORRUPT,
            request.serviceName(),
            clock.instant(),
            Map.of("key", fingerprint.key(), "reason", "undecodable payload")));
    return Optional.empty();
  }

  // ========================================
  // Private Helpers
  // ========================================

  private boolean matchesResultType(CallContext<?> ctx, CacheEntry entry) {
    if (payloadCodec.isInstance(entry.value(), ctx.request().resultType())) {
      return true;
    }
    log.debug(
        "[ResilientCall] 캐시 값 타입 불일치, 미스로 처리. key={}, cached={}, requested={}",
        ctx.fingerprint(),
        entry.value().getClass().getName(),
        ctx.request().resultType().getTypeName());
    return false;
  }

  // matchesResultType 통과한 엔트리만 들어옴
  @SuppressWarnings("unchecked")
  private <T> CallResult<T> serveCached(
      CallContext<T> ctx, CircuitBreaker breaker, CacheEntry entry) {
    publishCacheEvent(ObservabilityEventType.CACHE_HIT, ctx);
    publishCompleted(ctx, CallOutcome.CACHE_HIT, null);
    log.debug(
        "[ResilientCall] 결과 캐시 HIT. key={}, hitCount={}", ctx.fingerprint(), entry.hitCount());
    CircuitSnapshot snapshot = breaker.snapshot();
    return new CallResult<>(
        (T) entry.value(),
        CallMetadata.cached(
            snapshot.state(), snapshot.failureCount(), entry.ageSeconds(clock.instant())));
  }

  private <T> void rememberSuccess(CallContext<T> ctx, ServiceConfig config, T value) {
    if (config.isResultCacheEnabled()) {
      resultCache.set(ctx.fingerprint(), value, config.resultCacheTtl());
    }
    String key = ctx.fingerprint().key();
    try {
      fallbackStore.put(key, payloadCodec.encode(key, value), config.fallbackTtl());
    } catch (FallbackPersistenceException e) {
      log.warn("[ResilientCall] 폴백 저장 실패 (best-effort). key={}", key, e);
    }
  }

  private RuntimeException propagateProgrammingError(Throwable cause) {
    if (cause instanceof RuntimeException re) {
      return re;
    }
    return new IllegalStateException("programming error must be a RuntimeException", cause);
  }

  private void publishCacheEvent(ObservabilityEventType type, CallContext<?> ctx) {
    publisher.publish(
        new ObservabilityEvent(
            type,
            ctx.request().serviceName(),
            clock.instant(),
            Map.of(
                "operation", ctx.request().operationName(),
                "fingerprint", ctx.fingerprint().argsHash())));
  }

  private void publishCompleted(CallContext<?> ctx, CallOutcome outcome, CallFailureKind kind) {
    Instant now = clock.instant();
    Duration latency = Duration.between(ctx.startedAt(), now);
    CallAttempt attempt =
        new CallAttempt(
            ctx.request().serviceName(),
            ctx.request().operationName(),
            ctx.fingerprint().argsHash(),
            ctx.startedAt(),
            outcome,
            latency.isNegative() ? Duration.ZERO : latency,
            kind);
    publisher.publish(ObservabilityEvent.completed(attempt));
  }

  private record CallContext<T>(
      CallRequest<T> request,
      CallFingerprint fingerprint,
      FallbackOperation<T> fallback,
      Instant startedAt) {}
}
