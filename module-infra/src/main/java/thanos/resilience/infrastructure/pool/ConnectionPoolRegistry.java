package thanos.resilience.infrastructure.pool;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.config.PoolConfig;
import thanos.resilience.core.port.out.ServiceConnector;
import thanos.resilience.infrastructure.config.ServiceConfigRegistry;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.executor.TaskContext;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;

/**
 * 서비스별 커넥션 풀 레지스트리
 *
 * <h3>백그라운드 스윕</h3>
 *
 * <ul>
 *   <li>풀 생성 시 minIdle 워밍업 1회 + 유휴 정리(주기 = maxIdle) + 헬스 체크(주기 = healthCheckInterval) 등록
 *   <li>스윕은 공유 {@link ScheduledExecutorService}에서 풀 단위로 실행되며, 예외는 로그 후 흡수되어 다음 주기를 막지 않음
 * </ul>
 */
@Slf4j
public class ConnectionPoolRegistry {

  private static final String COMPONENT = "ConnectionPool";

  private final ServiceConfigRegistry serviceConfigs;
  private final Map<String, ServiceConnector<?>> connectors;
  private final ServiceConnector<?> defaultConnector;
  private final Clock clock;
  private final CheckedLogicExecutor checkedExecutor;
  private final ObservabilityPublisher publisher;
  private final ScheduledExecutorService sweeper;
  private final Map<String, ConnectionPool<?>> pools = new ConcurrentHashMap<>();
  private final List<ScheduledFuture<?>> sweeps = new ArrayList<>();

  public ConnectionPoolRegistry(
      ServiceConfigRegistry serviceConfigs,
      Map<String, ServiceConnector<?>> connectors,
      ServiceConnector<?> defaultConnector,
      Clock clock,
      CheckedLogicExecutor checkedExecutor,
      ObservabilityPublisher publisher,
      ScheduledExecutorService sweeper) {
    this.serviceConfigs = serviceConfigs;
    this.connectors = Map.copyOf(connectors);
    this.defaultConnector = defaultConnector;
    this.clock = clock;
    this.checkedExecutor = checkedExecutor;
    this.publisher = publisher;
    this.sweeper = sweeper;
  }

  /** 서비스 풀 조회 (첫 호출 시 생성 + 스윕 등록) */
  public ConnectionPool<?> forService(String serviceName) {
    ConnectionPool<?> existing = pools.get(serviceName);
    if (existing != null) {
      return existing;
    }
    PoolConfig config = serviceConfigs.get(serviceName).pool();
    return pools.computeIfAbsent(serviceName, name -> createPool(name, config));
  }

  public Map<String, PoolStats> stats() {
    Map<String, PoolStats> result = new TreeMap<>();
    pools.forEach((name, pool) -> result.put(name, pool.stats()));
    return result;
  }

  /** 모든 풀과 스윕 종료 (애플리케이션 종료 시) */
  public void closeAll() {
    synchronized (sweeps) {
      sweeps.forEach(f -> f.cancel(false));
      sweeps.clear();
    }
    pools.values().forEach(ConnectionPool::close);
    log.info("[ConnectionPool] 전체 풀 종료. pools={}", pools.size());
  }

  private ConnectionPool<?> createPool(String serviceName, PoolConfig config) {
    ServiceConnector<?> connector = connectors.getOrDefault(serviceName, defaultConnector);
    ConnectionPool<?> pool = newPool(serviceName, config, connector);
    scheduleSweeps(pool, config);
    log.info(
        "[ConnectionPool] 풀 생성. service={}, minIdle={}, maxTotal={}",
        serviceName,
        config.minIdle(),
        config.maxTotal());
    return pool;
  }

  private <C> ConnectionPool<C> newPool(
      String serviceName, PoolConfig config, ServiceConnector<C> connector) {
    return new ConnectionPool<>(serviceName, config, connector, clock, checkedExecutor, publisher);
  }

  private void scheduleSweeps(ConnectionPool<?> pool, PoolConfig config) {
    String name = pool.getServiceName();
    long idlePeriod = config.maxIdle().toMillis();
    long healthPeriod = config.healthCheckInterval().toMillis();
    synchronized (sweeps) {
      sweeper.execute(() -> sweepSafely(pool::ensureMinIdle, "Warmup", name));
      sweeps.add(
          sweeper.scheduleWithFixedDelay(
              () -> sweepSafely(pool::evictIdle, "EvictIdle", name),
              idlePeriod,
              idlePeriod,
              TimeUnit.MILLISECONDS));
      sweeps.add(
          sweeper.scheduleWithFixedDelay(
              () -> sweepSafely(pool::healthCheck, "HealthCheck", name),
              healthPeriod,
              healthPeriod,
              TimeUnit.MILLISECONDS));
    }
  }

  /** 스케줄 작업이 예외로 종료되면 이후 주기가 취소되므로 실패를 로그로 흡수합니다. */
  private void sweepSafely(Runnable sweep, String operation, String serviceName) {
    checkedExecutor.executeOrLog(sweep::run, TaskContext.of(COMPONENT, operation, serviceName));
  }
}
