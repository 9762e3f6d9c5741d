package thanos.resilience.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import thanos.resilience.core.domain.model.FallbackEntry;
import thanos.resilience.core.port.in.ResilientCaller;
import thanos.resilience.core.port.out.FallbackStore;
import thanos.resilience.core.port.out.ObservabilitySink;
import thanos.resilience.core.port.out.ServiceConnector;
import thanos.resilience.error.exception.InvalidServiceConfigurationException;
import thanos.resilience.infrastructure.breaker.CircuitBreakerRegistry;
import thanos.resilience.infrastructure.cache.CallFingerprinter;
import thanos.resilience.infrastructure.cache.ResultCache;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.executor.DefaultCheckedLogicExecutor;
import thanos.resilience.infrastructure.facade.DeadlineInvoker;
import thanos.resilience.infrastructure.facade.FailureClassifier;
import thanos.resilience.infrastructure.facade.FallbackPayloadCodec;
import thanos.resilience.infrastructure.facade.ResilientCallFacade;
import thanos.resilience.infrastructure.fallback.FileFallbackStore;
import thanos.resilience.infrastructure.fallback.TieredFallbackStore;
import thanos.resilience.infrastructure.observability.MicrometerObservabilitySink;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;
import thanos.resilience.infrastructure.observability.Slf4jObservabilitySink;
import thanos.resilience.infrastructure.pool.ConnectionPoolRegistry;
import thanos.resilience.infrastructure.pool.NamedServiceConnector;
import thanos.resilience.infrastructure.pool.StatelessConnector;
import thanos.resilience.infrastructure.status.ResilienceStatusService;
import thanos.resilience.infrastructure.throttle.Throttler;

/**
 * 접근 계층 AutoConfiguration
 *
 * <h3>등록 빈</h3>
 *
 * <ul>
 *   <li>{@link ResilientCaller}: 외부 호출 단일 진입점
 *   <li>{@link ResilienceStatusService}: 상태 조회 + 서킷 리셋 + 캐시 무효화
 *   <li>서킷/풀/스로틀 레지스트리, 결과 캐시, 2계층 폴백 저장소
 * </ul>
 *
 * <h3>확장 지점</h3>
 *
 * <ul>
 *   <li>{@link ObservabilitySink} 빈: 기본 로그/메트릭 싱크에 추가로 이벤트 수신
 *   <li>{@link NamedServiceConnector} 빈: 서비스 전용 커넥터 (없으면 {@link StatelessConnector})
 *   <li>{@link Clock}, {@link ObjectMapper}, {@link MeterRegistry}: 애플리케이션 빈이 있으면 그것을 사용
 * </ul>
 *
 * <p>{@code resilience.enabled=false}이면 전체 비활성화됩니다.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(ResilienceProperties.class)
@ConditionalOnProperty(
    prefix = "resilience",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ResilienceAutoConfiguration {

  private static final RejectedExecutionHandler ABORT_POLICY =
      new ThreadPoolExecutor.AbortPolicy();

  // ========================================
  // Ambient
  // ========================================

  @Bean
  @ConditionalOnMissingBean
  public Clock resilienceClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public ObjectMapper resilienceObjectMapper() {
    return JsonMapper.builder().findAndAddModules().build();
  }

  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry resilienceMeterRegistry() {
    return new SimpleMeterRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public CheckedLogicExecutor checkedLogicExecutor(MeterRegistry meterRegistry) {
    return new DefaultCheckedLogicExecutor(meterRegistry);
  }

  @Bean
  public ServiceConfigRegistry serviceConfigRegistry(ResilienceProperties properties) {
    ServiceConfigRegistry registry = new ServiceConfigRegistry(properties.toServiceConfigs());
    log.info("[Resilience] 서비스 설정 로드 완료. services={}", registry.serviceNames());
    return registry;
  }

  // ========================================
  // Observability
  // ========================================

  /** 이벤트 전파 전용 스레드 풀. 큐가 가득 차면 거절되고 이벤트는 유실됩니다. */
  @Bean
  public ThreadPoolTaskExecutor resilienceEventExecutor(ResilienceProperties properties) {
    ResilienceProperties.Observability config = properties.getObservability();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(config.getEventThreads());
    executor.setMaxPoolSize(config.getEventThreads());
    executor.setQueueCapacity(config.getEventQueueCapacity());
    executor.setThreadNamePrefix("resilience-event-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }

  @Bean
  public ObservabilityPublisher observabilityPublisher(
      ObjectProvider<ObservabilitySink> customSinks,
      MeterRegistry meterRegistry,
      @Qualifier("resilienceEventExecutor") ThreadPoolTaskExecutor resilienceEventExecutor,
      CheckedLogicExecutor checkedLogicExecutor) {
    List<ObservabilitySink> sinks = new ArrayList<>();
    sinks.add(new Slf4jObservabilitySink());
    sinks.add(new MicrometerObservabilitySink(meterRegistry));
    customSinks.orderedStream().forEach(sinks::add);
    return new ObservabilityPublisher(sinks, resilienceEventExecutor, checkedLogicExecutor);
  }

  // ========================================
  // Circuit / Throttle / Pool
  // ========================================

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry(
      ServiceConfigRegistry serviceConfigRegistry,
      Clock clock,
      ObservabilityPublisher observabilityPublisher) {
    return new CircuitBreakerRegistry(serviceConfigRegistry, clock, observabilityPublisher);
  }

  @Bean
  public Throttler throttler(
      ServiceConfigRegistry serviceConfigRegistry,
      Clock clock,
      ObservabilityPublisher observabilityPublisher) {
    return new Throttler(serviceConfigRegistry, clock, observabilityPublisher);
  }

  /** 풀 워밍업/최소 유휴 보충/헬스체크 전용 스케줄러 */
  @Bean
  public ThreadPoolTaskScheduler resiliencePoolSweeper(
      ResilienceProperties properties, MeterRegistry meterRegistry) {
    Counter rejected =
        Counter.builder("resilience.sweeper.rejected")
            .description("Number of pool maintenance tasks rejected")
            .register(meterRegistry);

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.getPool().getSweeperThreads());
    scheduler.setThreadNamePrefix("resilience-pool-sweeper-");
    scheduler.setDaemon(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.setRejectedExecutionHandler(
        (r, e) -> {
          rejected.increment();
          ABORT_POLICY.rejectedExecution(r, e);
        });
    scheduler.initialize();

    new ExecutorServiceMetrics(
            scheduler.getScheduledExecutor(), "resilience.sweeper", Collections.emptyList())
        .bindTo(meterRegistry);
    return scheduler;
  }

  @Bean(destroyMethod = "closeAll")
  public ConnectionPoolRegistry connectionPoolRegistry(
      ServiceConfigRegistry serviceConfigRegistry,
      ObjectProvider<NamedServiceConnector> namedConnectors,
      Clock clock,
      CheckedLogicExecutor checkedLogicExecutor,
      ObservabilityPublisher observabilityPublisher,
      ThreadPoolTaskScheduler resiliencePoolSweeper) {
    Map<String, ServiceConnector<?>> connectors = new LinkedHashMap<>();
    namedConnectors.orderedStream().forEach(named -> register(connectors, named));
    return new ConnectionPoolRegistry(
        serviceConfigRegistry,
        connectors,
        new StatelessConnector(),
        clock,
        checkedLogicExecutor,
        observabilityPublisher,
        resiliencePoolSweeper.getScheduledExecutor());
  }

  // ========================================
  // Caches
  // ========================================

  @Bean
  public ResultCache resultCache(ResilienceProperties properties, Clock clock) {
    return new ResultCache(properties.getResultCache().getMaxEntries(), clock);
  }

  @Bean
  public CallFingerprinter callFingerprinter(
      ObjectMapper objectMapper, CheckedLogicExecutor checkedLogicExecutor) {
    return new CallFingerprinter(objectMapper, checkedLogicExecutor);
  }

  @Bean
  public FileFallbackStore fileFallbackStore(
      ResilienceProperties properties,
      ObjectMapper objectMapper,
      Clock clock,
      CheckedLogicExecutor checkedLogicExecutor,
      ObservabilityPublisher observabilityPublisher) {
    return new FileFallbackStore(
        properties.getFallback().getDirectory(),
        objectMapper,
        clock,
        checkedLogicExecutor,
        observabilityPublisher);
  }

  @Bean
  @ConditionalOnMissingBean(FallbackStore.class)
  public TieredFallbackStore tieredFallbackStore(
      ResilienceProperties properties, FileFallbackStore fileFallbackStore, Clock clock) {
    ResilienceProperties.Fallback config = properties.getFallback();
    Cache<String, FallbackEntry> l1 =
        Caffeine.newBuilder()
            .maximumSize(config.getL1MaxSize())
            .expireAfterWrite(Duration.ofSeconds(config.getL1ExpireAfterWriteSeconds()))
            .build();
    return new TieredFallbackStore(l1, fileFallbackStore, clock);
  }

  // ========================================
  // Facade
  // ========================================

  /**
   * 데드라인이 있는 fetch 전용 스레드 풀
   *
   * <p>큐는 유한합니다. 가득 차면 AbortPolicy로 즉시 거절되고, 큐에서 데드라인을 넘긴 작업은 실행되지 않습니다. 두 경우 모두 호출은
   * EXECUTOR_SATURATED로 끝나며 브레이커에는 기록되지 않습니다.
   */
  @Bean
  public ThreadPoolTaskExecutor resilienceFetchExecutor(
      ResilienceProperties properties, MeterRegistry meterRegistry) {
    ResilienceProperties.Pool config = properties.getPool();
    Counter rejected =
        Counter.builder("resilience.fetch.rejected")
            .description("Number of fetches rejected because the fetch executor was full")
            .register(meterRegistry);

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(config.getFetchThreads());
    executor.setMaxPoolSize(config.getFetchThreads());
    executor.setQueueCapacity(config.getFetchQueueCapacity());
    executor.setThreadNamePrefix("resilience-fetch-");
    executor.setDaemon(true);
    executor.setRejectedExecutionHandler(
        (r, e) -> {
          rejected.increment();
          ABORT_POLICY.rejectedExecution(r, e);
        });
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();

    new ExecutorServiceMetrics(
            executor.getThreadPoolExecutor(), "resilience.fetch", Collections.emptyList())
        .bindTo(meterRegistry);
    log.info(
        "[Resilience] fetch executor 초기화. threads={}, queueCapacity={}",
        config.getFetchThreads(),
        config.getFetchQueueCapacity());
    return executor;
  }

  @Bean
  @ConditionalOnMissingBean(ResilientCaller.class)
  public ResilientCallFacade resilientCallFacade(
      ServiceConfigRegistry serviceConfigRegistry,
      CallFingerprinter callFingerprinter,
      ResultCache resultCache,
      Throttler throttler,
      CircuitBreakerRegistry circuitBreakerRegistry,
      ConnectionPoolRegistry connectionPoolRegistry,
      FallbackStore fallbackStore,
      ObjectMapper objectMapper,
      CheckedLogicExecutor checkedLogicExecutor,
      @Qualifier("resilienceFetchExecutor") ThreadPoolTaskExecutor resilienceFetchExecutor,
      ObservabilityPublisher observabilityPublisher,
      Clock clock) {
    return new ResilientCallFacade(
        serviceConfigRegistry,
        callFingerprinter,
        resultCache,
        throttler,
        circuitBreakerRegistry,
        connectionPoolRegistry,
        fallbackStore,
        new FallbackPayloadCodec(objectMapper, checkedLogicExecutor),
        new FailureClassifier(),
        new DeadlineInvoker(resilienceFetchExecutor.getThreadPoolExecutor()),
        observabilityPublisher,
        clock);
  }

  @Bean
  public ResilienceStatusService resilienceStatusService(
      ServiceConfigRegistry serviceConfigRegistry,
      CircuitBreakerRegistry circuitBreakerRegistry,
      ConnectionPoolRegistry connectionPoolRegistry,
      Throttler throttler,
      ResultCache resultCache) {
    return new ResilienceStatusService(
        serviceConfigRegistry,
        circuitBreakerRegistry,
        connectionPoolRegistry,
        throttler,
        resultCache);
  }

  private static void register(
      Map<String, ServiceConnector<?>> connectors, NamedServiceConnector named) {
    if (connectors.putIfAbsent(named.serviceName(), named.connector()) != null) {
      throw new InvalidServiceConfigurationException(
          named.serviceName(), "duplicate connector registration");
    }
  }
}
