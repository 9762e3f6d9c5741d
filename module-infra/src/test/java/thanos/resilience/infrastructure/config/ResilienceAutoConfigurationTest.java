package thanos.resilience.infrastructure.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import thanos.resilience.core.domain.model.CallRequest;
import thanos.resilience.core.domain.model.CallResult;
import thanos.resilience.core.domain.model.CallSource;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.core.port.in.ResilientCaller;
import thanos.resilience.core.port.out.FallbackStore;
import thanos.resilience.error.exception.InvalidServiceConfigurationException;
import thanos.resilience.infrastructure.breaker.CircuitBreakerRegistry;
import thanos.resilience.infrastructure.cache.ResultCache;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.fallback.TieredFallbackStore;
import thanos.resilience.infrastructure.pool.ConnectionPoolRegistry;
import thanos.resilience.infrastructure.pool.NamedServiceConnector;
import thanos.resilience.infrastructure.status.ResilienceStatusService;
import thanos.resilience.infrastructure.support.FakeConnector;
import thanos.resilience.infrastructure.support.RecordingSink;
import thanos.resilience.infrastructure.throttle.Throttler;

/**
 * ResilienceAutoConfiguration 테스트
 *
 * <ul>
 *   <li>기본 빈 등록 및 resilience.enabled=false 비활성화
 *   <li>서비스 설정 누락 시 기동 실패
 *   <li>ObservabilitySink / NamedServiceConnector 확장 빈 반영
 * </ul>
 */
class ResilienceAutoConfigurationTest {

  @TempDir Path fallbackDir;

  private ApplicationContextRunner contextRunner() {
    return new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ResilienceAutoConfiguration.class))
        .withPropertyValues(
            "resilience.fallback.directory=" + fallbackDir,
            "resilience.services.docs.failure-threshold=3",
            "resilience.services.docs.recovery-timeout-seconds=60",
            "resilience.services.docs.half-open-max-calls=1",
            "resilience.services.docs.success-threshold=1",
            "resilience.services.docs.min-idle=0",
            "resilience.services.docs.max-total=4",
            "resilience.services.docs.max-idle-seconds=300",
            "resilience.services.docs.health-check-interval-seconds=30",
            "resilience.services.docs.max-per-second=10",
            "resilience.services.docs.max-per-minute=100",
            "resilience.services.docs.max-concurrent=5",
            "resilience.services.docs.result-cache-ttl-seconds=60",
            "resilience.services.docs.fallback-ttl-seconds=3600");
  }

  @Test
  @DisplayName("기본 빈이 모두 등록된다")
  void registersAccessLayerBeans() {
    contextRunner()
        .run(
            context -> {
              assertThat(context).hasSingleBean(ResilientCaller.class);
              assertThat(context).hasSingleBean(ResilienceStatusService.class);
              assertThat(context).hasSingleBean(CircuitBreakerRegistry.class);
              assertThat(context).hasSingleBean(ConnectionPoolRegistry.class);
              assertThat(context).hasSingleBean(Throttler.class);
              assertThat(context).hasSingleBean(ResultCache.class);
              assertThat(context).hasSingleBean(CheckedLogicExecutor.class);
              assertThat(context.getBean(FallbackStore.class))
                  .isInstanceOf(TieredFallbackStore.class);
              assertThat(context.getBean(ServiceConfigRegistry.class).serviceNames())
                  .containsExactly("docs");
            });
  }

  @Test
  @DisplayName("fetch executor는 유한 큐 + 거절 정책, 풀 스윕은 Spring 스케줄러로 구성된다")
  void executorsAreBounded() {
    contextRunner()
        .withPropertyValues(
            "resilience.pool.fetch-threads=3", "resilience.pool.fetch-queue-capacity=5")
        .run(
            context -> {
              ThreadPoolExecutor fetch =
                  context
                      .getBean("resilienceFetchExecutor", ThreadPoolTaskExecutor.class)
                      .getThreadPoolExecutor();
              assertThat(fetch.getMaximumPoolSize()).isEqualTo(3);
              assertThat(fetch.getQueue().remainingCapacity()).isEqualTo(5);
              assertThat(context.getBean("resiliencePoolSweeper"))
                  .isInstanceOf(ThreadPoolTaskScheduler.class);
              assertThat(
                      context
                          .getBean(MeterRegistry.class)
                          .find("executor.pool.max")
                          .tag("name", "resilience.fetch")
                          .gauge())
                  .isNotNull();
            });
  }

  @Test
  @DisplayName("resilience.enabled=false이면 아무 빈도 등록하지 않는다")
  void disabledByProperty() {
    contextRunner()
        .withPropertyValues("resilience.enabled=false")
        .run(
            context -> {
              assertThat(context).doesNotHaveBean(ResilientCaller.class);
              assertThat(context).doesNotHaveBean(ServiceConfigRegistry.class);
            });
  }

  @Test
  @DisplayName("서비스 필수 항목이 빠지면 기동 실패")
  void missingServiceFieldFailsStartup() {
    contextRunner()
        .withPropertyValues("resilience.services.search.failure-threshold=3")
        .run(
            context -> {
              assertThat(context).hasFailed();
              assertThat(context.getStartupFailure())
                  .hasRootCauseInstanceOf(InvalidServiceConfigurationException.class)
                  .hasStackTraceContaining("search");
            });
  }

  @Test
  @DisplayName("등록된 커넥터와 추가 싱크가 실제 호출 경로에 쓰인다")
  void customConnectorAndSinkAreWired() {
    FakeConnector connector = new FakeConnector();
    RecordingSink sink = new RecordingSink();

    contextRunner()
        .withBean(NamedServiceConnector.class, () -> new NamedServiceConnector("docs", connector))
        .withBean(RecordingSink.class, () -> sink)
        .run(
            context -> {
              ResilientCaller caller = context.getBean(ResilientCaller.class);

              CallResult<Integer> result =
                  caller.call(
                      CallRequest.of("docs", "getDocument", Map.of("id", 1), Integer.class),
                      lease -> lease.handle(FakeConnector.Handle.class).id());

              assertThat(result.value()).isEqualTo(1);
              assertThat(result.metadata().source()).isEqualTo(CallSource.LIVE);
              assertThat(connector.createdCount()).isEqualTo(1);
              await()
                  .untilAsserted(
                      () ->
                          assertThat(sink.ofType(ObservabilityEventType.CALL_COMPLETED))
                              .hasSize(1));
            });
  }
}
