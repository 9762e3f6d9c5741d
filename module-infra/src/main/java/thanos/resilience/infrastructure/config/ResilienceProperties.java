package thanos.resilience.infrastructure.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import thanos.resilience.core.domain.config.CircuitConfig;
import thanos.resilience.core.domain.config.PoolConfig;
import thanos.resilience.core.domain.config.ServiceConfig;
import thanos.resilience.core.domain.config.ThrottleConfig;
import thanos.resilience.error.exception.InvalidServiceConfigurationException;

/**
 * 접근 계층 외부 설정 프로퍼티
 *
 * <h4>서비스 설정</h4>
 *
 * <p>{@code resilience.services.<name>.*} 항목은 기본값이 없습니다. 하나라도 빠지면 기동 시 {@link
 * InvalidServiceConfigurationException}으로 실패합니다. ({@code max-lifetime-seconds}만 선택, 0 = 무제한)
 *
 * <pre>
 * resilience:
 *   services:
 *     docs:
 *       failure-threshold: 5
 *       recovery-timeout-seconds: 60
 *       half-open-max-calls: 3
 *       success-threshold: 2
 *       min-idle: 1
 *       max-total: 10
 *       max-idle-seconds: 300
 *       health-check-interval-seconds: 30
 *       max-per-second: 10
 *       max-per-minute: 100
 *       max-concurrent: 5
 *       result-cache-ttl-seconds: 300
 *       fallback-ttl-seconds: 3600
 * </pre>
 */
@ConfigurationProperties(prefix = "resilience")
public class ResilienceProperties {

  /** 자동 구성 활성화 여부 */
  private boolean enabled = true;

  private Map<String, ServiceProperties> services = new LinkedHashMap<>();

  private final Fallback fallback = new Fallback();

  private final ResultCache resultCache = new ResultCache();

  private final Observability observability = new Observability();

  private final Pool pool = new Pool();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Map<String, ServiceProperties> getServices() {
    return services;
  }

  public void setServices(Map<String, ServiceProperties> services) {
    this.services = services;
  }

  public Fallback getFallback() {
    return fallback;
  }

  public ResultCache getResultCache() {
    return resultCache;
  }

  public Observability getObservability() {
    return observability;
  }

  public Pool getPool() {
    return pool;
  }

  /** 바인딩된 서비스 설정을 검증된 도메인 설정으로 변환 */
  public List<ServiceConfig> toServiceConfigs() {
    List<ServiceConfig> configs = new ArrayList<>();
    services.forEach((name, props) -> configs.add(props.toServiceConfig(name)));
    return configs;
  }

  /** 서비스 1건의 설정. 래퍼 타입으로 선언해 누락 여부를 판별합니다. */
  @Getter
  @Setter
  public static class ServiceProperties {

    private Integer failureThreshold;
    private Long recoveryTimeoutSeconds;
    private Integer halfOpenMaxCalls;
    private Integer successThreshold;

    private Integer minIdle;
    private Integer maxTotal;
    private Long maxIdleSeconds;
    private Long healthCheckIntervalSeconds;
    private Long maxLifetimeSeconds = 0L;

    private Integer maxPerSecond;
    private Integer maxPerMinute;
    private Integer maxConcurrent;

    private Long resultCacheTtlSeconds;
    private Long fallbackTtlSeconds;

    ServiceConfig toServiceConfig(String serviceName) {
      CircuitConfig circuit =
          new CircuitConfig(
              required(serviceName, "failure-threshold", failureThreshold),
              seconds(serviceName, "recovery-timeout-seconds", recoveryTimeoutSeconds),
              required(serviceName, "half-open-max-calls", halfOpenMaxCalls),
              required(serviceName, "success-threshold", successThreshold));
      PoolConfig poolConfig =
          new PoolConfig(
              required(serviceName, "min-idle", minIdle),
              required(serviceName, "max-total", maxTotal),
              seconds(serviceName, "max-idle-seconds", maxIdleSeconds),
              seconds(serviceName, "health-check-interval-seconds", healthCheckIntervalSeconds),
              seconds(serviceName, "max-lifetime-seconds", maxLifetimeSeconds));
      ThrottleConfig throttle =
          new ThrottleConfig(
              required(serviceName, "max-per-second", maxPerSecond),
              required(serviceName, "max-per-minute", maxPerMinute),
              required(serviceName, "max-concurrent", maxConcurrent));
      return new ServiceConfig(
          serviceName,
          circuit,
          poolConfig,
          throttle,
          seconds(serviceName, "result-cache-ttl-seconds", resultCacheTtlSeconds),
          seconds(serviceName, "fallback-ttl-seconds", fallbackTtlSeconds));
    }

    private static <V> V required(String serviceName, String key, V value) {
      if (value == null) {
        throw new InvalidServiceConfigurationException(serviceName, key + " missing");
      }
      return value;
    }

    private static Duration seconds(String serviceName, String key, Long value) {
      return Duration.ofSeconds(required(serviceName, key, value));
    }
  }

  /** 폴백 저장소 (L1 Caffeine + L2 파일) */
  @Getter
  @Setter
  public static class Fallback {

    private Path directory = Path.of("data", "fallback");

    private long l1MaxSize = 10_000;

    private long l1ExpireAfterWriteSeconds = 600;
  }

  @Getter
  @Setter
  public static class ResultCache {

    private int maxEntries = 1_000;
  }

  /** 이벤트 전파 및 fetch 실행 스레드 */
  @Getter
  @Setter
  public static class Observability {

    private int eventThreads = 2;

    private int eventQueueCapacity = 1_000;
  }

  @Getter
  @Setter
  public static class Pool {

    private int sweeperThreads = 1;

    /** 데드라인이 있는 fetch를 실행하는 스레드 수 */
    private int fetchThreads = 16;

    /** fetch 대기 큐 용량. 가득 차면 즉시 거절, 큐 대기는 호출 데드라인을 넘지 않음 */
    private int fetchQueueCapacity = 64;
  }
}
