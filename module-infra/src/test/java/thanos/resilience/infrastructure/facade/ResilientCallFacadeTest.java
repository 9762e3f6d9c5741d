package thanos.resilience.infrastructure.facade;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import thanos.resilience.core.domain.config.CircuitConfig;
import thanos.resilience.core.domain.config.PoolConfig;
import thanos.resilience.core.domain.model.CallMetadata;
import thanos.resilience.core.domain.model.CallOutcome;
import thanos.resilience.core.domain.model.CallRequest;
import thanos.resilience.core.domain.model.CallResult;
import thanos.resilience.core.domain.model.CallSource;
import thanos.resilience.core.domain.model.CircuitState;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.core.port.in.FallbackOperation;
import thanos.resilience.core.port.in.FetchOperation;
import thanos.resilience.error.exception.CallFailedException;
import thanos.resilience.error.exception.CallFailureKind;
import thanos.resilience.error.exception.ExecutorSaturatedException;
import thanos.resilience.error.exception.InvalidCallArgumentException;
import thanos.resilience.error.exception.InvalidServiceConfigurationException;
import thanos.resilience.error.exception.NoFallbackAvailableException;
import thanos.resilience.error.exception.PoolExhaustedException;
import thanos.resilience.error.exception.ShortCircuitedException;
import thanos.resilience.error.exception.ThrottledException;
import thanos.resilience.infrastructure.breaker.CircuitBreakerRegistry;
import thanos.resilience.infrastructure.cache.CallFingerprinter;
import thanos.resilience.infrastructure.cache.ResultCache;
import thanos.resilience.infrastructure.config.ServiceConfigRegistry;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.fallback.FileFallbackStore;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;
import thanos.resilience.infrastructure.pool.ConnectionPoolRegistry;
import thanos.resilience.infrastructure.pool.StatelessConnector;
import thanos.resilience.infrastructure.support.MutableClock;
import thanos.resilience.infrastructure.support.RecordingSink;
import thanos.resilience.infrastructure.support.TestFixtures;
import thanos.resilience.infrastructure.throttle.Throttler;

/**
 * 호출 흐름 시나리오 테스트
 *
 * <ul>
 *   <li>docs: 결과 캐시 60초, 실패 임계치 3
 *   <li>flaky: 결과 캐시 비활성, 실패 임계치 3 (폴백/서킷 시나리오)
 *   <li>limited: 초당 1회
 *   <li>single: 커넥션 최대 1개
 * </ul>
 */
@DisplayName("ResilientCallFacade 호출 흐름")
class ResilientCallFacadeTest {

  @TempDir Path fallbackDir;

  private MutableClock clock;
  private RecordingSink sink;
  private ExecutorService fetchExecutor;
  private ScheduledExecutorService sweeper;
  private CircuitBreakerRegistry breakers;
  private Throttler throttler;
  private ConnectionPoolRegistry pools;
  private ResultCache resultCache;
  private ServiceConfigRegistry configs;
  private ObjectMapper objectMapper;
  private CheckedLogicExecutor checkedExecutor;
  private ObservabilityPublisher publisher;
  private ResilientCallFacade facade;

  private final AtomicInteger fetches = new AtomicInteger();

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    sink = new RecordingSink();
    fetchExecutor = Executors.newCachedThreadPool();
    sweeper = Executors.newSingleThreadScheduledExecutor();

    checkedExecutor = TestFixtures.checkedExecutor();
    publisher = TestFixtures.syncPublisher(sink);
    objectMapper = new ObjectMapper();
    CircuitConfig circuit = TestFixtures.circuit(3, 60);
    configs =
        new ServiceConfigRegistry(
            List.of(
                TestFixtures.service("docs"),
                TestFixtures.service(
                    "flaky",
                    circuit,
                    TestFixtures.pool(0, 4),
                    TestFixtures.throttle(100, 1_000, 10),
                    Duration.ZERO),
                TestFixtures.service(
                    "limited",
                    circuit,
                    TestFixtures.pool(0, 4),
                    TestFixtures.throttle(1, 1_000, 10),
                    Duration.ZERO),
                TestFixtures.service(
                    "single",
                    circuit,
                    new PoolConfig(
                        0, 1, Duration.ofSeconds(300), Duration.ofSeconds(30), Duration.ZERO),
                    TestFixtures.throttle(100, 1_000, 10),
                    Duration.ZERO)));

    breakers = new CircuitBreakerRegistry(configs, clock, publisher);
    throttler = new Throttler(configs, clock, publisher);
    pools =
        new ConnectionPoolRegistry(
            configs,
            Map.of(),
            new StatelessConnector(),
            clock,
            checkedExecutor,
            publisher,
            sweeper);
    resultCache = new ResultCache(100, clock);
    facade = facadeWith(fetchExecutor);
  }

  /** 같은 레지스트리를 공유하고 fetch executor만 다른 파사드 */
  private ResilientCallFacade facadeWith(ExecutorService executor) {
    return new ResilientCallFacade(
        configs,
        new CallFingerprinter(objectMapper, checkedExecutor),
        resultCache,
        throttler,
        breakers,
        pools,
        new FileFallbackStore(fallbackDir, objectMapper, clock, checkedExecutor, publisher),
        new FallbackPayloadCodec(objectMapper, checkedExecutor),
        new FailureClassifier(),
        new DeadlineInvoker(executor),
        publisher,
        clock);
  }

  @AfterEach
  void tearDown() {
    pools.closeAll();
    sweeper.shutdownNow();
    fetchExecutor.shutdownNow();
  }

  private static CallRequest<String> request(String service, int id) {
    return CallRequest.of(service, "getDocument", Map.of("id", id), String.class);
  }

  private FetchOperation<String> succeeding(String value) {
    return lease -> {
      fetches.incrementAndGet();
      return value;
    };
  }

  private FetchOperation<String> failing(Exception failure) {
    return lease -> {
      fetches.incrementAndGet();
      throw failure;
    };
  }

  private void failTimes(String service, int times) {
    for (int i = 0; i < times; i++) {
      facade.call(
          request(service, 1), failing(new IOException("reset")), FallbackOperation.constant("-"));
    }
  }

  // ==================== 정상 경로 ====================

  @Nested
  @DisplayName("정상 경로")
  class HappyPath {

    @Test
    @DisplayName("성공 시 live 메타데이터, 같은 요청은 결과 캐시에서 응답")
    void liveThenCached() {
      // When
      CallResult<String> live = facade.call(request("docs", 1), succeeding("doc-1"));
      clock.advanceSeconds(5);
      CallResult<String> cached = facade.call(request("docs", 1), succeeding("doc-1-new"));

      // Then
      assertAll(
          () -> assertThat(live.value()).isEqualTo("doc-1"),
          () -> assertThat(live.metadata()).isEqualTo(CallMetadata.live(CircuitState.CLOSED, 0)),
          () -> assertThat(cached.value()).isEqualTo("doc-1"),
          () -> assertThat(cached.metadata().source()).isEqualTo(CallSource.RESULT_CACHE),
          () -> assertThat(cached.metadata().usedFallback()).isFalse(),
          () -> assertThat(cached.metadata().cacheAgeSeconds()).isEqualTo(5L),
          () -> assertThat(fetches.get()).isEqualTo(1));
    }

    @Test
    @DisplayName("캐시 히트는 스로틀/브레이커를 거치지 않음")
    void cacheHitBypassesThrottleAndBreaker() {
      facade.call(request("docs", 1), succeeding("doc-1"));
      facade.call(request("docs", 1), succeeding("doc-1"));

      assertAll(
          () -> assertThat(throttler.stats("docs").admitted()).isEqualTo(1),
          () -> assertThat(breakers.forService("docs").snapshot().totalCalls()).isEqualTo(1),
          () -> assertThat(sink.ofType(ObservabilityEventType.CACHE_HIT)).hasSize(1),
          () -> assertThat(sink.ofType(ObservabilityEventType.CACHE_MISS)).hasSize(1));
    }

    @Test
    @DisplayName("같은 키의 캐시 값이 요청 타입과 다르면 미스로 처리하고 live 호출")
    void cachedValueOfOtherTypeIsMiss() {
      // Given: String 결과가 캐시됨
      facade.call(request("docs", 1), succeeding("doc-1"));
      CallRequest<Integer> asInteger =
          CallRequest.of("docs", "getDocument", Map.of("id", 1), Integer.class);

      // When: 같은 서비스/작업/인자를 Integer로 요청
      CallResult<Integer> result =
          facade.call(
              asInteger,
              lease -> {
                fetches.incrementAndGet();
                return 42;
              });

      // Then: ClassCastException 없이 live 결과
      assertAll(
          () -> assertThat(result.value()).isEqualTo(42),
          () -> assertThat(result.metadata().source()).isEqualTo(CallSource.LIVE),
          () -> assertThat(fetches.get()).isEqualTo(2),
          () -> assertThat(sink.ofType(ObservabilityEventType.CACHE_MISS)).hasSize(2));
    }

    @Test
    @DisplayName("인자가 다르면 별도 캐시 엔트리")
    void differentArgsMissCache() {
      facade.call(request("docs", 1), succeeding("doc-1"));
      CallResult<String> other = facade.call(request("docs", 2), succeeding("doc-2"));

      assertThat(other.value()).isEqualTo("doc-2");
      assertThat(fetches.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("모든 종료 경로에서 스로틀 토큰과 커넥션이 반납됨")
    void releasesTokenAndConnection() {
      facade.call(request("flaky", 1), succeeding("ok"));
      facade.call(
          request("flaky", 1), failing(new IOException("x")), FallbackOperation.constant("-"));
      assertThatThrownBy(
              () ->
                  facade.call(
                      request("flaky", 1), failing(new InvalidCallArgumentException("bad"))))
          .isInstanceOf(InvalidCallArgumentException.class);

      assertAll(
          () -> assertThat(throttler.stats("flaky").inFlight()).isZero(),
          () -> assertThat(pools.stats().get("flaky").checkedOut()).isZero());
    }
  }

  // ==================== 폴백 ====================

  @Nested
  @DisplayName("폴백")
  class Fallback {

    @Test
    @DisplayName("실패 시 마지막 성공 결과를 폴백 저장소에서 나이와 함께 반환")
    void servesLastGoodValueFromStore() {
      // Given
      facade.call(request("flaky", 1), succeeding("v1"));
      clock.advanceSeconds(120);

      // When
      CallResult<String> result = facade.call(request("flaky", 1), failing(new IOException("503")));

      // Then
      CallMetadata metadata = result.metadata();
      assertAll(
          () -> assertThat(result.value()).isEqualTo("v1"),
          () -> assertThat(metadata.usedFallback()).isTrue(),
          () -> assertThat(metadata.source()).isEqualTo(CallSource.FALLBACK),
          () -> assertThat(metadata.cacheAgeSeconds()).isEqualTo(120L),
          () -> assertThat(metadata.stale()).isFalse(),
          () -> assertThat(metadata.failureCount()).isEqualTo(1),
          () -> assertThat(sink.ofType(ObservabilityEventType.FALLBACK_SERVED)).hasSize(1));
    }

    @Test
    @DisplayName("폴백 TTL이 지난 값도 stale 표시로 반환")
    void staleFallbackIsServed() {
      facade.call(request("flaky", 1), succeeding("v1"));
      clock.advanceSeconds(3_601);

      CallResult<String> result = facade.call(request("flaky", 1), failing(new IOException("503")));

      assertThat(result.metadata().stale()).isTrue();
    }

    @Test
    @DisplayName("폴백 데이터가 없으면 NoFallbackAvailableException, 원인은 호출 실패")
    void noFallbackRaises() {
      assertThatThrownBy(
              () ->
                  facade.call(
                      request("flaky", 1), failing(new IOException("503")), FallbackOperation.none()))
          .isInstanceOf(NoFallbackAvailableException.class)
          .cause()
          .isInstanceOfSatisfying(
              CallFailedException.class,
              e -> assertThat(e.getKind()).isEqualTo(CallFailureKind.TRANSIENT));
    }

    @Test
    @DisplayName("실패는 캐시되지 않아 다음 호출은 다시 fetch")
    void failuresAreNotCached() {
      facade.call(
          request("docs", 1), failing(new IOException("503")), FallbackOperation.constant("-"));

      CallResult<String> next = facade.call(request("docs", 1), succeeding("fresh"));

      assertThat(next.value()).isEqualTo("fresh");
      assertThat(next.metadata().source()).isEqualTo(CallSource.LIVE);
      assertThat(fetches.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("저장된 payload를 요청 타입으로 복원할 수 없으면 데이터 없음 + FALLBACK_CORRUPT")
    void undecodableStoredPayloadIsMissing() {
      facade.call(request("flaky", 1), succeeding("not-a-number"));
      CallRequest<Integer> asInteger =
          CallRequest.of("flaky", "getDocument", Map.of("id", 1), Integer.class);

      assertThatThrownBy(
              () ->
                  facade.call(
                      asInteger,
                      lease -> {
                        throw new IOException("503");
                      }))
          .isInstanceOf(NoFallbackAvailableException.class);
      assertThat(sink.ofType(ObservabilityEventType.FALLBACK_CORRUPT)).hasSize(1);
    }

    @Test
    @DisplayName("폴백 조회 자체가 실패하면 데이터 없음으로 처리하고 suppressed로 첨부")
    void failingFallbackLookupIsSuppressed() {
      FallbackOperation<String> broken =
          () -> {
            throw new IllegalStateException("fallback backend down");
          };

      assertThatThrownBy(
              () -> facade.call(request("flaky", 1), failing(new IOException("503")), broken))
          .isInstanceOfSatisfying(
              NoFallbackAvailableException.class,
              e -> assertThat(e.getCause().getSuppressed()).hasSize(1));
    }
  }

  // ==================== 서킷 ====================

  @Nested
  @DisplayName("서킷 브레이커 연동")
  class Circuit {

    @Test
    @DisplayName("임계치 도달 후 호출은 fetch 없이 단락되어 폴백")
    void openCircuitShortCircuits() {
      facade.call(request("flaky", 1), succeeding("v1"));
      failTimes("flaky", 3);
      int fetchesBefore = fetches.get();

      CallResult<String> result = facade.call(request("flaky", 1), succeeding("never"));

      assertAll(
          () -> assertThat(result.value()).isEqualTo("v1"),
          () -> assertThat(result.metadata().circuitState()).isEqualTo(CircuitState.OPEN),
          () -> assertThat(fetches.get()).isEqualTo(fetchesBefore));
    }

    @Test
    @DisplayName("단락 + 폴백 없음이면 원인은 ShortCircuitedException")
    void shortCircuitWithoutFallback() {
      failTimes("flaky", 3);

      assertThatThrownBy(
              () -> facade.call(request("flaky", 2), succeeding("x"), FallbackOperation.none()))
          .isInstanceOf(NoFallbackAvailableException.class)
          .hasCauseInstanceOf(ShortCircuitedException.class);
    }

    @Test
    @DisplayName("복구 대기 후 프로브 성공 시 CLOSED로 복귀")
    void recoversAfterTimeout() {
      failTimes("flaky", 3);
      clock.advanceSeconds(60);

      CallResult<String> result = facade.call(request("flaky", 1), succeeding("back"));

      assertAll(
          () -> assertThat(result.value()).isEqualTo("back"),
          () -> assertThat(result.metadata().circuitState()).isEqualTo(CircuitState.CLOSED),
          () -> assertThat(result.metadata().usedFallback()).isFalse());
    }

    @Test
    @DisplayName("호출자 오류는 그대로 전파되고 브레이커에 기록되지 않음")
    void programmingErrorsPropagate() {
      assertThatThrownBy(
              () ->
                  facade.call(request("flaky", 1), failing(new InvalidCallArgumentException("id"))))
          .isInstanceOf(InvalidCallArgumentException.class);

      assertThat(breakers.forService("flaky").snapshot().failureCount()).isZero();
    }

    @Test
    @DisplayName("어댑터가 응답 파싱 중 던진 IllegalArgumentException은 PERMANENT 실패로 기록되고 폴백")
    void adapterIllegalArgumentIsRecorded() {
      CallResult<String> result =
          facade.call(
              request("flaky", 1),
              failing(new IllegalArgumentException("No enum constant Status.GONE")),
              FallbackOperation.constant("fb"));

      assertAll(
          () -> assertThat(result.value()).isEqualTo("fb"),
          () -> assertThat(breakers.forService("flaky").snapshot().failureCount()).isEqualTo(1),
          () ->
              assertThat(sink.ofType(ObservabilityEventType.CALL_COMPLETED))
                  .last()
                  .satisfies(
                      event ->
                          assertThat(event.field("errorKind"))
                              .isEqualTo(CallFailureKind.PERMANENT)));
    }

    @Test
    @DisplayName("데드라인 초과는 TIMEOUT으로 기록되고 폴백")
    void deadlineExceededIsTimeout() {
      CallRequest<String> withDeadline = request("flaky", 1).withDeadline(Duration.ofMillis(50));

      CallResult<String> result =
          facade.call(
              withDeadline,
              lease -> {
                Thread.sleep(5_000);
                return "late";
              },
              FallbackOperation.constant("cached"));

      assertThat(result.value()).isEqualTo("cached");
      assertThat(breakers.forService("flaky").snapshot().failureCount()).isEqualTo(1);
      assertThat(sink.ofType(ObservabilityEventType.CALL_COMPLETED))
          .last()
          .satisfies(
              event -> {
                assertThat(event.field("outcome")).isEqualTo(CallOutcome.FAILURE);
                assertThat(event.field("errorKind")).isEqualTo(CallFailureKind.TIMEOUT);
              });
    }
  }

  // ==================== 용량 제한 ====================

  @Nested
  @DisplayName("스로틀/풀 용량")
  class Capacity {

    @Test
    @DisplayName("스로틀 거절은 폴백으로 응답하고 브레이커에 기록하지 않음")
    void throttledCallFallsBack() {
      facade.call(request("limited", 1), succeeding("v1"));

      CallResult<String> result =
          facade.call(request("limited", 2), succeeding("v2"), FallbackOperation.constant("slow"));

      assertAll(
          () -> assertThat(result.value()).isEqualTo("slow"),
          () -> assertThat(fetches.get()).isEqualTo(1),
          () -> assertThat(breakers.forService("limited").snapshot().failureCount()).isZero());
    }

    @Test
    @DisplayName("스로틀 거절 + 폴백 없음이면 원인은 ThrottledException")
    void throttledWithoutFallback() {
      facade.call(request("limited", 1), succeeding("v1"));

      assertThatThrownBy(
              () -> facade.call(request("limited", 2), succeeding("v2"), FallbackOperation.none()))
          .isInstanceOf(NoFallbackAvailableException.class)
          .hasCauseInstanceOf(ThrottledException.class);
    }

    @Test
    @DisplayName("풀 고갈은 폴백으로 응답하고 브레이커에 기록하지 않음")
    void poolExhaustionFallsBack() {
      AtomicInteger nestedFallbacks = new AtomicInteger();

      CallResult<String> outer =
          facade.call(
              request("single", 1),
              lease -> {
                // 유일한 커넥션을 쥔 채 같은 서비스를 다시 호출
                try {
                  facade.call(request("single", 2), succeeding("inner"), FallbackOperation.none());
                } catch (NoFallbackAvailableException e) {
                  assertThat(e.getCause()).isInstanceOf(PoolExhaustedException.class);
                  nestedFallbacks.incrementAndGet();
                }
                return "outer";
              });

      assertAll(
          () -> assertThat(outer.value()).isEqualTo("outer"),
          () -> assertThat(nestedFallbacks.get()).isEqualTo(1),
          () -> assertThat(breakers.forService("single").snapshot().failureCount()).isZero(),
          () -> assertThat(sink.ofType(ObservabilityEventType.POOL_EXHAUSTED)).hasSize(1));
    }
  }

  // ==================== fetch executor 포화 ====================

  @Nested
  @DisplayName("fetch executor 포화")
  class Saturation {

    private ThreadPoolTaskExecutor bounded;
    private CountDownLatch hold;

    @BeforeEach
    void setUp() throws InterruptedException {
      bounded = new ThreadPoolTaskExecutor();
      bounded.setCorePoolSize(1);
      bounded.setMaxPoolSize(1);
      bounded.setQueueCapacity(1);
      bounded.setThreadNamePrefix("fetch-test-");
      bounded.initialize();

      // 유일한 fetch 스레드를 다른 서비스가 붙잡고 있음
      hold = new CountDownLatch(1);
      CountDownLatch occupied = new CountDownLatch(1);
      bounded
          .getThreadPoolExecutor()
          .execute(
              () -> {
                occupied.countDown();
                try {
                  hold.await();
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
              });
      assertThat(occupied.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @AfterEach
    void tearDown() {
      hold.countDown();
      bounded.shutdown();
    }

    @Test
    @DisplayName("큐에서 데드라인을 넘긴 호출은 fetch 없이 폴백, 브레이커 미기록")
    void queuedPastDeadlineFallsBackWithoutRecording() {
      ResilientCallFacade saturated = facadeWith(bounded.getThreadPoolExecutor());
      CallRequest<String> withDeadline = request("flaky", 1).withDeadline(Duration.ofMillis(100));

      CallResult<String> result =
          saturated.call(withDeadline, succeeding("live"), FallbackOperation.constant("fb"));

      assertAll(
          () -> assertThat(result.value()).isEqualTo("fb"),
          () -> assertThat(fetches.get()).isZero(),
          () -> assertThat(breakers.forService("flaky").snapshot().failureCount()).isZero(),
          () -> assertThat(pools.stats().get("flaky").checkedOut()).isZero(),
          () -> assertThat(throttler.stats("flaky").inFlight()).isZero(),
          () ->
              assertThat(sink.ofType(ObservabilityEventType.CALL_COMPLETED))
                  .last()
                  .satisfies(
                      event ->
                          assertThat(event.field("outcome"))
                              .isEqualTo(CallOutcome.EXECUTOR_SATURATED)));
    }

    @Test
    @DisplayName("포화가 반복돼도 서킷은 열리지 않음, 폴백 없으면 원인은 ExecutorSaturatedException")
    void repeatedSaturationNeverOpensCircuit() {
      ResilientCallFacade saturated = facadeWith(bounded.getThreadPoolExecutor());
      CallRequest<String> withDeadline = request("flaky", 1).withDeadline(Duration.ofMillis(50));

      for (int i = 0; i < 4; i++) {
        assertThatThrownBy(
                () -> saturated.call(withDeadline, succeeding("live"), FallbackOperation.none()))
            .isInstanceOf(NoFallbackAvailableException.class)
            .hasCauseInstanceOf(ExecutorSaturatedException.class);
      }

      assertThat(breakers.forService("flaky").state()).isEqualTo(CircuitState.CLOSED);
      assertThat(fetches.get()).isZero();
    }
  }

  @Test
  @DisplayName("미등록 서비스 호출은 설정 오류로 즉시 실패")
  void unknownServiceFailsFast() {
    assertThatThrownBy(() -> facade.call(request("unknown", 1), succeeding("x")))
        .isInstanceOf(InvalidServiceConfigurationException.class);
  }
}
