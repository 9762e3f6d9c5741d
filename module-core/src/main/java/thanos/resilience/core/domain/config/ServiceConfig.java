package thanos.resilience.core.domain.config;

import java.time.Duration;
import thanos.resilience.error.exception.InvalidServiceConfigurationException;

/**
 * Complete, validated configuration of one external service.
 *
 * <p>There are no defaults: every field must be supplied and a violation fails fast with {@link
 * InvalidServiceConfigurationException}.
 *
 * @param serviceName service name
 * @param circuit circuit breaker thresholds
 * @param pool connection pool limits
 * @param throttle rate and concurrency limits
 * @param resultCacheTtl freshness of cached successful results, {@link Duration#ZERO} disables
 *     result caching
 * @param fallbackTtl freshness window stamped on fallback entries
 */
public record ServiceConfig(
    String serviceName,
    CircuitConfig circuit,
    PoolConfig pool,
    ThrottleConfig throttle,
    Duration resultCacheTtl,
    Duration fallbackTtl) {

  public ServiceConfig {
    if (serviceName == null || serviceName.isBlank()) {
      throw new InvalidServiceConfigurationException(String.valueOf(serviceName), "blank name");
    }
    String name = serviceName;
    require(name, circuit != null, "circuit settings missing");
    require(name, pool != null, "pool settings missing");
    require(name, throttle != null, "throttle settings missing");
    requireNonNegative(name, "resultCacheTtl", resultCacheTtl);
    requireNonNegative(name, "fallbackTtl", fallbackTtl);

    require(name, circuit.failureThreshold() >= 1, "failureThreshold must be >= 1");
    requirePositive(name, "recoveryTimeout", circuit.recoveryTimeout());
    require(name, circuit.halfOpenMaxCalls() >= 1, "halfOpenMaxCalls must be >= 1");
    require(name, circuit.successThreshold() >= 1, "successThreshold must be >= 1");

    require(name, pool.minIdle() >= 0, "minIdle must be >= 0");
    require(name, pool.maxTotal() >= 1, "maxTotal must be >= 1");
    require(name, pool.minIdle() <= pool.maxTotal(), "minIdle must be <= maxTotal");
    requirePositive(name, "maxIdle", pool.maxIdle());
    requirePositive(name, "healthCheckInterval", pool.healthCheckInterval());
    requireNonNegative(name, "maxLifetime", pool.maxLifetime());

    require(name, throttle.maxPerSecond() >= 1, "maxPerSecond must be >= 1");
    require(name, throttle.maxPerMinute() >= 1, "maxPerMinute must be >= 1");
    require(name, throttle.maxConcurrent() >= 1, "maxConcurrent must be >= 1");
  }

  public boolean isResultCacheEnabled() {
    return !resultCacheTtl.isZero();
  }

  private static void require(String serviceName, boolean condition, String reason) {
    if (!condition) {
      throw new InvalidServiceConfigurationException(serviceName, reason);
    }
  }

  private static void requirePositive(String serviceName, String field, Duration value) {
    require(serviceName, value != null, field + " missing");
    require(serviceName, !value.isNegative() && !value.isZero(), field + " must be positive");
  }

  private static void requireNonNegative(String serviceName, String field, Duration value) {
    require(serviceName, value != null, field + " missing");
    require(serviceName, !value.isNegative(), field + " must not be negative");
  }
}
